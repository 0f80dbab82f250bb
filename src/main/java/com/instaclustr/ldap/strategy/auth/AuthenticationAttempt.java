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
package com.instaclustr.ldap.strategy.auth;

import static java.lang.String.format;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.instaclustr.ldap.strategy.client.BindResultHandler;
import com.instaclustr.ldap.strategy.client.DirectoryClient;
import com.instaclustr.ldap.strategy.client.DirectoryConnection;
import com.instaclustr.ldap.strategy.client.DirectoryEntry;
import com.instaclustr.ldap.strategy.client.DirectoryException;
import com.instaclustr.ldap.strategy.client.SearchResultHandler;
import com.instaclustr.ldap.strategy.conf.LdapStrategyConfiguration;
import com.instaclustr.ldap.strategy.conf.SearchSpec;
import com.instaclustr.ldap.strategy.utils.FilterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a single authentication: validate the request, bind, optionally search and verify, then report exactly one
 * outcome. An attempt owns the connection it opens and closes it whichever way it ends.
 */
public final class AuthenticationAttempt
{

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationAttempt.class);

    public enum State
    {
        START,
        VALIDATING,
        BINDING,
        SEARCHING,
        AWAITING_ENTRY,
        VERIFYING,
        SUCCEEDED,
        FAILED,
        ERRORED;

        public boolean isTerminal()
        {
            return this == SUCCEEDED || this == FAILED || this == ERRORED;
        }
    }

    private final LdapStrategyConfiguration configuration;
    private final DirectoryClient directoryClient;
    private final Verifier verifier;
    private final OutcomeReporter reporter;

    private final AtomicReference<State> state = new AtomicReference<>(State.START);
    private final AtomicReference<DirectoryConnection> connection = new AtomicReference<>();
    private final AtomicBoolean entrySeen = new AtomicBoolean(false);

    public AuthenticationAttempt(final LdapStrategyConfiguration configuration,
                                 final DirectoryClient directoryClient,
                                 final Verifier verifier,
                                 final AuthenticationCallback callback)
    {
        this.configuration = configuration;
        this.directoryClient = directoryClient;
        this.verifier = verifier;
        this.reporter = new OutcomeReporter(callback, this::onReported, configuration.isDebug());
    }

    public OutcomeReporter getReporter()
    {
        return reporter;
    }

    public State getState()
    {
        return state.get();
    }

    public void start(final AuthenticationRequest request)
    {
        transition(State.VALIDATING);

        final Optional<Credentials> credentials = Credentials.extract(request, configuration);

        if (!credentials.isPresent())
        {
            fail(FailureReason.missingCredentials(), "missing credentials");
            return;
        }

        final Optional<ResolvedDn> resolved = DnResolver.resolve(credentials.get().getUsername(), configuration);

        if (!resolved.isPresent())
        {
            fail(FailureReason.unresolvableDn(), format("unable to resolve DN for %s", credentials.get().getUsername()));
            return;
        }

        bind(credentials.get(), resolved.get());
    }

    /**
     * Reports an error unless an outcome was reported already.
     */
    public void abort(final Throwable cause)
    {
        if (!reporter.isReported())
        {
            logger.warn("Aborting authentication attempt in state {}: {}", state.get(), cause.getMessage());
            error(cause);
        }
    }

    private void bind(final Credentials credentials, final ResolvedDn resolved)
    {
        transition(State.BINDING);

        final DirectoryConnection conn;

        try
        {
            conn = directoryClient.connect(configuration.getServer());
        }
        catch (final DirectoryException | RuntimeException ex)
        {
            trace("(EE) Connection to {} failed: {}", configuration.getServer().getUrl(), ex.getMessage());
            fail(FailureReason.bindRejected(), "connection failed");
            return;
        }

        connection.set(conn);

        // outcome may have been reported while connecting, e.g. on timeout
        if (reporter.isReported())
        {
            closeConnection();
            return;
        }

        trace("(II) Binding as {}", resolved.getBindDn());

        try
        {
            conn.bind(resolved.getBindDn(), credentials.getPassword(), new BindResultHandler()
            {
                @Override
                public void handleBindSuccess()
                {
                    onBindSuccess(resolved);
                }

                @Override
                public void handleBindFailure(final Throwable cause)
                {
                    trace("(EE) LDAP bind as {} failed: {}", resolved.getBindDn(), cause.getMessage());
                    fail(FailureReason.bindRejected(), "bind rejected");
                }
            });
        }
        catch (final RuntimeException ex)
        {
            trace("(EE) LDAP bind as {} failed: {}", resolved.getBindDn(), ex.getMessage());
            fail(FailureReason.bindRejected(), "bind rejected");
        }
    }

    private void onBindSuccess(final ResolvedDn resolved)
    {
        if (reporter.isReported())
        {
            return;
        }

        if (configuration.isAuthOnly())
        {
            trace("(II) Auth success: {}", resolved.getBindDn());
            succeed(new DirectoryEntry(resolved.getBindDn(),
                                       ImmutableMap.of("uid", ImmutableList.of(resolved.getBindDn()))));
            return;
        }

        search(resolved);
    }

    private void search(final ResolvedDn resolved)
    {
        transition(State.SEARCHING);

        final DirectoryConnection conn = connection.get();

        if (conn == null)
        {
            return;
        }

        // forUid returns a copy, the configured template is never touched
        final SearchSpec spec = configuration.getSearch().forUid(FilterUtils.escapeValue(resolved.getFilterValue()));

        trace("(II) Searching {} with {}", resolved.getSearchBaseDn(), spec);

        transition(State.AWAITING_ENTRY);

        try
        {
            conn.search(resolved.getSearchBaseDn(), spec, new SearchResultHandler()
            {
                @Override
                public void handleEntry(final DirectoryEntry entry)
                {
                    onEntry(entry);
                }

                @Override
                public void handleDone(final int status)
                {
                    onDone(status);
                }

                @Override
                public void handleError(final Throwable cause)
                {
                    onSearchError(cause);
                }
            });
        }
        catch (final DirectoryException | RuntimeException ex)
        {
            trace("(EE) LDAP search failed: {}", ex.getMessage());
            fail(FailureReason.searchRejected(), "search could not be issued");
        }
    }

    private void onEntry(final DirectoryEntry entry)
    {
        if (reporter.isReported())
        {
            trace("(II) Ignoring entry {}, attempt already finished", entry.getDn());
            return;
        }

        if (!entrySeen.compareAndSet(false, true))
        {
            trace("(WW) Ignoring additional matching entry {}", entry.getDn());
            return;
        }

        verify(entry);
    }

    private void onDone(final int status)
    {
        if (entrySeen.get() || reporter.isReported())
        {
            trace("(II) Search finished with status {}", status);
            return;
        }

        trace("(EE) Search finished with status {} and no matching entry", status);
        fail(FailureReason.noMatchingEntry(status), "no matching entry");
    }

    private void onSearchError(final Throwable cause)
    {
        if (entrySeen.get() || reporter.isReported())
        {
            trace("(WW) Search error after a matching entry was received: {}", cause.getMessage());
            return;
        }

        logger.error("LDAP search failed", cause);
        error(cause);
    }

    private void verify(final DirectoryEntry profile)
    {
        transition(State.VERIFYING);

        final CompletionStage<Verification> verification;

        try
        {
            verification = verifier.verify(profile);
        }
        catch (final RuntimeException ex)
        {
            error(ex);
            return;
        }

        if (verification == null)
        {
            error(new IllegalStateException(format("Verifier returned no result for %s", profile.getDn())));
            return;
        }

        verification.whenComplete((result, throwable) ->
        {
            try
            {
                onVerification(profile, result, throwable);
            }
            catch (final RuntimeException ex)
            {
                logger.error("Handling verification of {} failed", profile.getDn(), ex);
                error(ex);
            }
        });
    }

    private void onVerification(final DirectoryEntry profile, final Verification result, final Throwable throwable)
    {
        if (throwable != null)
        {
            error(throwable instanceof CompletionException && throwable.getCause() != null ? throwable.getCause() : throwable);
        }
        else if (result == null)
        {
            error(new IllegalStateException(format("Verifier returned no result for %s", profile.getDn())));
        }
        else
        {
            switch (result.getKind())
            {
                case ACCEPTED:
                    trace("(II) Auth success: {}", result.getUser());
                    succeed(result.getUser());
                    break;
                case REJECTED:
                    final String challenge = configuration.getChallenge();
                    trace("(EE) LDAP user error: {}", challenge);
                    fail(FailureReason.verificationRejected(challenge), "verification rejected");
                    break;
                default:
                    error(result.getCause());
            }
        }
    }

    private void succeed(final Object user)
    {
        reporter.success(user);
    }

    private void fail(final FailureReason reason, final String what)
    {
        if (reporter.fail(reason))
        {
            trace("(EE) Authentication failed, {}: {}", what, reason);
        }
    }

    private void error(final Throwable cause)
    {
        reporter.error(cause);
    }

    private void onReported(final AuthenticationOutcome outcome)
    {
        switch (outcome.getType())
        {
            case SUCCESS:
                transition(State.SUCCEEDED);
                break;
            case FAILURE:
                transition(State.FAILED);
                break;
            default:
                transition(State.ERRORED);
        }

        closeConnection();
    }

    private void transition(final State next)
    {
        final State previous = state.getAndUpdate(current -> current.isTerminal() ? current : next);

        if (!previous.isTerminal())
        {
            trace("(II) {} -> {}", previous, next);
        }
    }

    private void closeConnection()
    {
        final DirectoryConnection conn = connection.getAndSet(null);

        if (conn != null)
        {
            conn.close();
        }
    }

    private void trace(final String format, final Object... arguments)
    {
        if (configuration.isDebug())
        {
            logger.info(format, arguments);
        }
        else
        {
            logger.debug(format, arguments);
        }
    }
}
