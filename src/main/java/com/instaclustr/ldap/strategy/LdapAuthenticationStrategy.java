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
package com.instaclustr.ldap.strategy;

import static com.instaclustr.ldap.strategy.utils.ServiceUtils.getService;
import static java.lang.String.format;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.instaclustr.ldap.strategy.auth.AuthenticationAttempt;
import com.instaclustr.ldap.strategy.auth.AuthenticationCallback;
import com.instaclustr.ldap.strategy.auth.AuthenticationOutcome;
import com.instaclustr.ldap.strategy.auth.AuthenticationRequest;
import com.instaclustr.ldap.strategy.auth.Verifier;
import com.instaclustr.ldap.strategy.client.DirectoryClient;
import com.instaclustr.ldap.strategy.conf.LdapStrategyConfiguration;
import com.instaclustr.ldap.strategy.jndi.JndiDirectoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates requests by binding to an LDAP server with the supplied credentials and, unless configured as auth-only,
 * searching for the user's entry and handing it to the application's {@link Verifier}.
 * <p>
 * Every call to {@code authenticate} opens its own connection, since directories close idle connections, and reports
 * exactly one of success, failure or error. Bind and search failures are both reported as {@code 403} so callers guessing
 * credentials learn nothing about the directory.
 * <p>
 * Example, Active Directory with the domain taken from {@code DOMAIN\name} usernames:
 * <pre>{@code
 * LdapStrategyConfiguration configuration = LdapStrategyConfiguration.builder()
 *     .server("ldap://ad.example.local:389")
 *     .dnMode(DnMode.WINDOWS)
 *     .baseDn(BaseDn.ofComponents("dc=example", "dc=local"))
 *     .search(new SearchSpec("(sAMAccountName=$uid$)", SearchScope.SUB, Arrays.asList("displayName", "mail"), 1, 0))
 *     .build();
 *
 * LdapAuthenticationStrategy strategy = new LdapAuthenticationStrategy(configuration, Verifier.acceptAll());
 * }</pre>
 */
public class LdapAuthenticationStrategy
{

    private static final Logger logger = LoggerFactory.getLogger(LdapAuthenticationStrategy.class);

    public static final String NAME = "ldap";

    private static final ScheduledExecutorService TIMEOUTS = timeoutScheduler();

    private final LdapStrategyConfiguration configuration;
    private final Verifier verifier;
    private final DirectoryClient directoryClient;
    private final ScheduledExecutorService timeouts;

    public LdapAuthenticationStrategy(final LdapStrategyConfiguration configuration, final Verifier verifier)
    {
        this(configuration, verifier, getService(DirectoryClient.class, JndiDirectoryClient.class));
    }

    public LdapAuthenticationStrategy(final LdapStrategyConfiguration configuration,
                                      final Verifier verifier,
                                      final DirectoryClient directoryClient)
    {
        this(configuration, verifier, directoryClient, TIMEOUTS);
    }

    @VisibleForTesting
    LdapAuthenticationStrategy(final LdapStrategyConfiguration configuration,
                               final Verifier verifier,
                               final DirectoryClient directoryClient,
                               final ScheduledExecutorService timeouts)
    {
        this.timeouts = Preconditions.checkNotNull(timeouts, "LDAP authentication strategy requires a timeout scheduler");
        this.configuration = Preconditions.checkNotNull(configuration, "LDAP authentication strategy requires a configuration");
        this.verifier = Preconditions.checkNotNull(verifier, "LDAP authentication strategy requires a verifier");
        this.directoryClient = Preconditions.checkNotNull(directoryClient, "LDAP authentication strategy requires a directory client");

        logger.info("{} was initialised with {}", LdapAuthenticationStrategy.class.getName(), configuration);
    }

    public String getName()
    {
        return NAME;
    }

    public LdapStrategyConfiguration getConfiguration()
    {
        return configuration;
    }

    /**
     * Authenticates the request. The outcome is delivered to {@code callback} and completes the returned future; the
     * future never completes exceptionally.
     */
    public CompletableFuture<AuthenticationOutcome> authenticate(final AuthenticationRequest request, final AuthenticationCallback callback)
    {
        final AuthenticationAttempt attempt = new AuthenticationAttempt(configuration, directoryClient, verifier, callback);

        scheduleTimeout(attempt);

        try
        {
            attempt.start(request);
        }
        catch (final RuntimeException ex)
        {
            logger.error("Authentication attempt failed unexpectedly", ex);
            attempt.abort(ex);
        }

        return attempt.getReporter().future();
    }

    public CompletableFuture<AuthenticationOutcome> authenticate(final AuthenticationRequest request)
    {
        return authenticate(request, AuthenticationCallback.NO_OP);
    }

    public CompletableFuture<AuthenticationOutcome> authenticate(final Map<String, String> credentials)
    {
        return authenticate(AuthenticationRequest.of(credentials));
    }

    private void scheduleTimeout(final AuthenticationAttempt attempt)
    {
        final long timeoutMillis = configuration.getAuthenticationTimeout().toMillis();

        if (timeoutMillis <= 0)
        {
            return;
        }

        final ScheduledFuture<?> timeout = timeouts.schedule(() -> attempt.abort(new TimeoutException(format("LDAP authentication did not finish within %s ms",
                                                                                                             timeoutMillis))),
                                                             timeoutMillis,
                                                             TimeUnit.MILLISECONDS);

        // drop the task as soon as an outcome is reported
        attempt.getReporter().future().whenComplete((outcome, throwable) -> timeout.cancel(false));
    }

    private static ScheduledExecutorService timeoutScheduler()
    {
        final ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
            .setNameFormat("ldap-strategy-timeout-%d")
            .setDaemon(true)
            .build());

        scheduler.setRemoveOnCancelPolicy(true);

        return scheduler;
    }
}
