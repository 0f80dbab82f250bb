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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Properties;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.instaclustr.ldap.strategy.exception.ConfigurationException;
import org.testng.annotations.Test;

public class LdapStrategyConfigurationTest
{

    private static Properties properties(final String... keyValues)
    {
        final Properties properties = new Properties();

        for (int i = 0; i < keyValues.length; i += 2)
        {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }

        return properties;
    }

    @Test
    public void defaultsAreApplied()
    {
        final LdapStrategyConfiguration configuration = LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389",
                                                                                                           "base_dn", "ou=people,dc=example,dc=local"));

        assertEquals(configuration.getServer().getUrl(), "ldap://localhost:389");
        assertEquals(configuration.getServer().getContextFactory(), ServerSpec.DEFAULT_CONTEXT_FACTORY);
        assertEquals(configuration.getServer().getConnectTimeoutMillis(), ServerSpec.DEFAULT_CONNECT_TIMEOUT_MS);
        assertEquals(configuration.getServer().getReadTimeoutMillis(), ServerSpec.DEFAULT_READ_TIMEOUT_MS);
        assertEquals(configuration.getUsernameField(), "username");
        assertEquals(configuration.getPasswordField(), "password");
        assertEquals(configuration.getDnMode(), DnMode.UNIX);
        assertEquals(configuration.getUidAttribute(), "uid");
        assertEquals(configuration.getBaseDn(), BaseDn.of("ou=people,dc=example,dc=local"));
        assertEquals(configuration.getSearch(), SearchSpec.defaults());
        assertFalse(configuration.isAuthOnly());
        assertFalse(configuration.isDebug());
        assertEquals(configuration.getAuthenticationTimeout(), LdapStrategyConfiguration.DEFAULT_AUTH_TIMEOUT);
        assertEquals(configuration.getChallenge(), "Basic realm=\"ldap\"");
    }

    @Test
    public void everyPropertyIsRead()
    {
        final LdapStrategyConfiguration configuration = LdapStrategyConfiguration.fromProperties(properties("ldap_uri", " ldaps://ad:636 ",
                                                                                                           "connect_timeout_ms", "500",
                                                                                                           "read_timeout_ms", "700",
                                                                                                           "env.java.naming.referral", "follow",
                                                                                                           "username_field", "user",
                                                                                                           "password_field", "pwd",
                                                                                                           "dn_mode", "windows",
                                                                                                           "base_dn_components", "dc=example; dc=local",
                                                                                                           "search_filter", "(sAMAccountName=$uid$)",
                                                                                                           "search_scope", "onelevel",
                                                                                                           "search_attributes", "displayName, mail",
                                                                                                           "search_size_limit", "1",
                                                                                                           "search_time_limit", "5",
                                                                                                           "debug", "true",
                                                                                                           "auth_timeout_ms", "1500"));

        assertEquals(configuration.getServer().getUrl(), "ldaps://ad:636");
        assertEquals(configuration.getServer().getConnectTimeoutMillis(), 500);
        assertEquals(configuration.getServer().getReadTimeoutMillis(), 700);
        assertEquals(configuration.getServer().getEnvironment(), ImmutableMap.of("java.naming.referral", "follow"));
        assertEquals(configuration.getUsernameField(), "user");
        assertEquals(configuration.getPasswordField(), "pwd");
        assertEquals(configuration.getDnMode(), DnMode.WINDOWS);
        assertEquals(configuration.getBaseDn(), BaseDn.ofComponents("dc=example", "dc=local"));
        assertEquals(configuration.getSearch(),
                     new SearchSpec("(sAMAccountName=$uid$)", SearchScope.ONE, ImmutableList.of("displayName", "mail"), 1, 5));
        assertTrue(configuration.isDebug());
        assertEquals(configuration.getAuthenticationTimeout(), Duration.ofMillis(1500));
    }

    @Test
    public void unparsableNumberFallsBackToDefault()
    {
        final LdapStrategyConfiguration configuration = LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389",
                                                                                                           "base_dn", "dc=example,dc=local",
                                                                                                           "connect_timeout_ms", "soon"));

        assertEquals(configuration.getServer().getConnectTimeoutMillis(), ServerSpec.DEFAULT_CONNECT_TIMEOUT_MS);
    }

    @Test
    public void authOnlyDoesNotNeedBaseDn()
    {
        final LdapStrategyConfiguration configuration = LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389",
                                                                                                           "auth_only", "true"));

        assertTrue(configuration.isAuthOnly());
        assertTrue(configuration.getBaseDn().isEmpty());
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void missingUriIsRejected()
    {
        LdapStrategyConfiguration.fromProperties(properties("base_dn", "dc=example,dc=local"));
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void missingBaseDnIsRejected()
    {
        LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389"));
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void bothBaseDnFormsAreRejected()
    {
        LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389",
                                                            "base_dn", "dc=example,dc=local",
                                                            "base_dn_components", "dc=example;dc=local"));
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void unknownDnModeIsRejected()
    {
        LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389",
                                                            "base_dn", "dc=example,dc=local",
                                                            "dn_mode", "solaris"));
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void unknownSearchScopeIsRejected()
    {
        LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389",
                                                            "base_dn", "dc=example,dc=local",
                                                            "search_scope", "everything"));
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void malformedFilterIsRejected()
    {
        LdapStrategyConfiguration.fromProperties(properties("ldap_uri", "ldap://localhost:389",
                                                            "base_dn", "dc=example,dc=local",
                                                            "search_filter", "uid=$uid$"));
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void negativeTimeoutIsRejected()
    {
        LdapStrategyConfiguration.builder()
            .server("ldap://localhost:389")
            .baseDn("dc=example,dc=local")
            .authenticationTimeout(Duration.ofSeconds(-1))
            .build();
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void blankFieldNameIsRejected()
    {
        LdapStrategyConfiguration.builder()
            .server("ldap://localhost:389")
            .baseDn("dc=example,dc=local")
            .usernameField(" ")
            .build();
    }

    @Test
    public void propertiesFileIsParsed() throws Exception
    {
        final File file = Files.createTempFile("ldap", ".properties").toFile();
        file.deleteOnExit();

        try (OutputStream output = new FileOutputStream(file))
        {
            properties("ldap_uri", "ldap://localhost:10389", "base_dn", "dc=example,dc=local").store(output, null);
        }

        final LdapStrategyConfiguration configuration = LdapStrategyConfiguration.parseProperties(file);

        assertEquals(configuration.getServer().getUrl(), "ldap://localhost:10389");
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void missingPropertiesFileIsRejected()
    {
        LdapStrategyConfiguration.parseProperties(new File("target/does-not-exist/ldap.properties"));
    }
}
