/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.instaclustr.ldap.strategy.conf;

import static java.lang.Boolean.parseBoolean;
import static java.lang.String.format;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.instaclustr.ldap.strategy.exception.ConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of the LDAP authentication strategy. Built once, either from an {@code ldap.properties} file or via
 * {@link #builder()}, and read only afterwards.
 */
public final class LdapStrategyConfiguration
{

    private static final Logger logger = LoggerFactory.getLogger(LdapStrategyConfiguration.class);

    public static final String LDAP_PROPERTIES_FILE_PROP = "ldap.strategy.properties.file";
    public static final String LDAP_PROPERTIES_FILENAME = "ldap.properties";
    public static final String LDAP_CONF_ENV = "LDAP_STRATEGY_CONF";

    public static final String LDAP_URI_PROP = "ldap_uri";
    public static final String CONTEXT_FACTORY_PROP = "context_factory";
    public static final String CONNECT_TIMEOUT_PROP = "connect_timeout_ms";
    public static final String READ_TIMEOUT_PROP = "read_timeout_ms";
    public static final String ENV_PREFIX = "env.";

    public static final String USERNAME_FIELD_PROP = "username_field";
    public static final String PASSWORD_FIELD_PROP = "password_field";
    public static final String DN_MODE_PROP = "dn_mode";
    public static final String UID_ATTRIBUTE_PROP = "uid_attribute";
    public static final String BASE_DN_PROP = "base_dn";
    public static final String BASE_DN_COMPONENTS_PROP = "base_dn_components";

    public static final String SEARCH_FILTER_PROP = "search_filter";
    public static final String SEARCH_SCOPE_PROP = "search_scope";
    public static final String SEARCH_ATTRIBUTES_PROP = "search_attributes";
    public static final String SEARCH_SIZE_LIMIT_PROP = "search_size_limit";
    public static final String SEARCH_TIME_LIMIT_PROP = "search_time_limit";

    public static final String AUTH_ONLY_PROP = "auth_only";
    public static final String DEBUG_PROP = "debug";
    public static final String AUTH_TIMEOUT_PROP = "auth_timeout_ms";

    public static final String DEFAULT_USERNAME_FIELD = "username";
    public static final String DEFAULT_PASSWORD_FIELD = "password";
    public static final String DEFAULT_UID_ATTRIBUTE = "uid";
    public static final String DEFAULT_CHALLENGE = "Basic realm=\"ldap\"";
    public static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofSeconds(30);

    private final ServerSpec server;
    private final String usernameField;
    private final String passwordField;
    private final DnMode dnMode;
    private final String uidAttribute;
    private final BaseDn baseDn;
    private final SearchSpec search;
    private final boolean authOnly;
    private final boolean debug;
    private final Duration authenticationTimeout;
    private final Supplier<String> challenge;

    private LdapStrategyConfiguration(final Builder builder)
    {
        this.server = builder.server;
        this.usernameField = builder.usernameField;
        this.passwordField = builder.passwordField;
        this.dnMode = builder.dnMode;
        this.uidAttribute = builder.uidAttribute;
        this.baseDn = builder.baseDn;
        this.search = builder.search;
        this.authOnly = builder.authOnly;
        this.debug = builder.debug;
        this.authenticationTimeout = builder.authenticationTimeout;
        this.challenge = builder.challenge;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Locates {@value #LDAP_PROPERTIES_FILENAME} from system property {@value #LDAP_PROPERTIES_FILE_PROP} or from
     * {@code $LDAP_STRATEGY_CONF/ldap.properties} and builds the configuration from it.
     */
    public static LdapStrategyConfiguration parseProperties() throws ConfigurationException
    {
        final String confEnvProperty = System.getenv().get(LDAP_CONF_ENV);

        File defaultLdapPropertyFile = null;

        if (confEnvProperty != null)
        {
            defaultLdapPropertyFile = new File(confEnvProperty, LDAP_PROPERTIES_FILENAME);
        }

        final File ldapPropertyFile = new File(System.getProperty(LDAP_PROPERTIES_FILE_PROP, LDAP_PROPERTIES_FILENAME));

        File finalLdapPropertyFile = null;

        if (ldapPropertyFile.exists() && ldapPropertyFile.canRead())
        {
            finalLdapPropertyFile = ldapPropertyFile;
        }
        else if (defaultLdapPropertyFile != null && defaultLdapPropertyFile.exists() && defaultLdapPropertyFile.canRead())
        {
            finalLdapPropertyFile = defaultLdapPropertyFile;
        }

        if (finalLdapPropertyFile == null)
        {
            throw new ConfigurationException(format(
                "Unable to locate readable LDAP configuration file from system property %s nor from $%s/%s.",
                LDAP_PROPERTIES_FILE_PROP,
                LDAP_CONF_ENV,
                LDAP_PROPERTIES_FILENAME));
        }

        logger.info("LDAP configuration file: {}", finalLdapPropertyFile.getAbsoluteFile());

        return parseProperties(finalLdapPropertyFile);
    }

    public static LdapStrategyConfiguration parseProperties(final File file) throws ConfigurationException
    {
        final Properties properties = new Properties();

        try (FileInputStream input = new FileInputStream(file))
        {
            properties.load(input);
        }
        catch (IOException ex)
        {
            throw new ConfigurationException(format("Could not open ldap configuration file %s", file), ex);
        }

        return fromProperties(properties);
    }

    public static LdapStrategyConfiguration fromProperties(final Properties properties) throws ConfigurationException
    {
        if (StringUtils.isBlank(properties.getProperty(LDAP_URI_PROP)))
        {
            throw new ConfigurationException(format("%s MUST be set in the LDAP configuration", LDAP_URI_PROP));
        }

        final Map<String, String> environment = new HashMap<>();

        for (final String key : properties.stringPropertyNames())
        {
            if (key.startsWith(ENV_PREFIX) && key.length() > ENV_PREFIX.length())
            {
                environment.put(key.substring(ENV_PREFIX.length()), properties.getProperty(key));
            }
        }

        final ServerSpec server = new ServerSpec(properties.getProperty(LDAP_URI_PROP).trim(),
                                                 properties.getProperty(CONTEXT_FACTORY_PROP, ServerSpec.DEFAULT_CONTEXT_FACTORY),
                                                 getInt(properties, CONNECT_TIMEOUT_PROP, ServerSpec.DEFAULT_CONNECT_TIMEOUT_MS),
                                                 getInt(properties, READ_TIMEOUT_PROP, ServerSpec.DEFAULT_READ_TIMEOUT_MS),
                                                 environment);

        final BaseDn baseDn;

        if (properties.containsKey(BASE_DN_COMPONENTS_PROP))
        {
            if (properties.containsKey(BASE_DN_PROP))
            {
                throw new ConfigurationException(format("Only one of %s and %s can be set.", BASE_DN_PROP, BASE_DN_COMPONENTS_PROP));
            }

            baseDn = BaseDn.ofComponents(Splitter.on(';').trimResults().omitEmptyStrings()
                                             .splitToList(properties.getProperty(BASE_DN_COMPONENTS_PROP)));
        }
        else
        {
            baseDn = BaseDn.of(properties.getProperty(BASE_DN_PROP, ""));
        }

        final List<String> attributes = Splitter.on(',').trimResults().omitEmptyStrings()
            .splitToList(properties.getProperty(SEARCH_ATTRIBUTES_PROP, ""));

        final SearchSpec search = new SearchSpec(properties.getProperty(SEARCH_FILTER_PROP, SearchSpec.DEFAULT_FILTER),
                                                 SearchScope.parse(properties.getProperty(SEARCH_SCOPE_PROP, "sub")),
                                                 attributes,
                                                 getInt(properties, SEARCH_SIZE_LIMIT_PROP, 0),
                                                 getInt(properties, SEARCH_TIME_LIMIT_PROP, 0));

        return builder()
            .server(server)
            .usernameField(properties.getProperty(USERNAME_FIELD_PROP, DEFAULT_USERNAME_FIELD))
            .passwordField(properties.getProperty(PASSWORD_FIELD_PROP, DEFAULT_PASSWORD_FIELD))
            .dnMode(DnMode.parse(properties.getProperty(DN_MODE_PROP, DnMode.UNIX.name())))
            .uidAttribute(properties.getProperty(UID_ATTRIBUTE_PROP, DEFAULT_UID_ATTRIBUTE))
            .baseDn(baseDn)
            .search(search)
            .authOnly(parseBoolean(properties.getProperty(AUTH_ONLY_PROP, "false")))
            .debug(parseBoolean(properties.getProperty(DEBUG_PROP, "false")))
            .authenticationTimeout(Duration.ofMillis(getInt(properties, AUTH_TIMEOUT_PROP, (int) DEFAULT_AUTH_TIMEOUT.toMillis())))
            .build();
    }

    private static int getInt(final Properties properties, final String key, final int defaultValue)
    {
        final String value = properties.getProperty(key);

        if (value == null)
        {
            return defaultValue;
        }

        try
        {
            return Integer.parseInt(value.trim());
        }
        catch (final NumberFormatException e)
        {
            logger.warn(format("Unable to parse %s property '%s', setting it to %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    public ServerSpec getServer()
    {
        return server;
    }

    public String getUsernameField()
    {
        return usernameField;
    }

    public String getPasswordField()
    {
        return passwordField;
    }

    public DnMode getDnMode()
    {
        return dnMode;
    }

    public String getUidAttribute()
    {
        return uidAttribute;
    }

    public BaseDn getBaseDn()
    {
        return baseDn;
    }

    /**
     * @return the search template, callers substitute the uid into a copy via {@link SearchSpec#forUid(String)}
     */
    public SearchSpec getSearch()
    {
        return search;
    }

    public boolean isAuthOnly()
    {
        return authOnly;
    }

    public boolean isDebug()
    {
        return debug;
    }

    /**
     * @return bound on a whole authentication attempt, {@link Duration#ZERO} when unbounded
     */
    public Duration getAuthenticationTimeout()
    {
        return authenticationTimeout;
    }

    /**
     * @return the reason reported when the verifier rejects a profile
     */
    public String getChallenge()
    {
        return challenge.get();
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("server", server)
            .add("usernameField", usernameField)
            .add("passwordField", passwordField)
            .add("dnMode", dnMode)
            .add("uidAttribute", uidAttribute)
            .add("baseDn", baseDn)
            .add("search", search)
            .add("authOnly", authOnly)
            .add("debug", debug)
            .add("authenticationTimeout", authenticationTimeout)
            .toString();
    }

    public static final class Builder
    {

        private ServerSpec server;
        private String usernameField = DEFAULT_USERNAME_FIELD;
        private String passwordField = DEFAULT_PASSWORD_FIELD;
        private DnMode dnMode = DnMode.UNIX;
        private String uidAttribute = DEFAULT_UID_ATTRIBUTE;
        private BaseDn baseDn = BaseDn.empty();
        private SearchSpec search = SearchSpec.defaults();
        private boolean authOnly;
        private boolean debug;
        private Duration authenticationTimeout = DEFAULT_AUTH_TIMEOUT;
        private Supplier<String> challenge = () -> DEFAULT_CHALLENGE;

        private Builder()
        {
        }

        public Builder server(final ServerSpec server)
        {
            this.server = server;
            return this;
        }

        public Builder server(final String url)
        {
            return server(ServerSpec.of(url));
        }

        public Builder usernameField(final String usernameField)
        {
            this.usernameField = usernameField;
            return this;
        }

        public Builder passwordField(final String passwordField)
        {
            this.passwordField = passwordField;
            return this;
        }

        public Builder dnMode(final DnMode dnMode)
        {
            this.dnMode = dnMode;
            return this;
        }

        public Builder uidAttribute(final String uidAttribute)
        {
            this.uidAttribute = uidAttribute;
            return this;
        }

        public Builder baseDn(final BaseDn baseDn)
        {
            this.baseDn = baseDn;
            return this;
        }

        public Builder baseDn(final String baseDn)
        {
            return baseDn(BaseDn.of(baseDn));
        }

        public Builder search(final SearchSpec search)
        {
            this.search = search;
            return this;
        }

        public Builder authOnly(final boolean authOnly)
        {
            this.authOnly = authOnly;
            return this;
        }

        public Builder debug(final boolean debug)
        {
            this.debug = debug;
            return this;
        }

        public Builder authenticationTimeout(final Duration authenticationTimeout)
        {
            this.authenticationTimeout = authenticationTimeout;
            return this;
        }

        public Builder challenge(final Supplier<String> challenge)
        {
            this.challenge = challenge;
            return this;
        }

        public LdapStrategyConfiguration build() throws ConfigurationException
        {
            if (server == null || StringUtils.isBlank(server.getUrl()))
            {
                throw new ConfigurationException("LDAP server URL must be set.");
            }

            if (StringUtils.isAnyBlank(usernameField, passwordField))
            {
                throw new ConfigurationException("Username and password field names must not be empty.");
            }

            if (StringUtils.isBlank(uidAttribute))
            {
                throw new ConfigurationException("uid attribute must not be empty.");
            }

            if (dnMode == null || baseDn == null || search == null || challenge == null)
            {
                throw new ConfigurationException("DN mode, base DN, search and challenge must not be null.");
            }

            if (!authOnly && baseDn.isEmpty())
            {
                throw new ConfigurationException(format("Base DN must be set unless %s is true.", AUTH_ONLY_PROP));
            }

            if (authenticationTimeout == null || authenticationTimeout.isNegative())
            {
                throw new ConfigurationException(format("Authentication timeout %s must not be negative.", authenticationTimeout));
            }

            search.validate();

            return new LdapStrategyConfiguration(this);
        }
    }
}
