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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers the outcome of one attempt to the host callback and to a future. The first outcome wins, later ones are
 * dropped, so racing directory events can not report twice.
 */
public final class OutcomeReporter
{

    private static final Logger logger = LoggerFactory.getLogger(OutcomeReporter.class);

    private final AuthenticationCallback callback;
    private final Consumer<AuthenticationOutcome> onReported;
    private final boolean debug;

    private final AtomicBoolean reported = new AtomicBoolean(false);
    private final CompletableFuture<AuthenticationOutcome> future = new CompletableFuture<>();

    /**
     * @param onReported run once, right after the winning outcome was handed over, to release attempt resources
     */
    public OutcomeReporter(final AuthenticationCallback callback, final Consumer<AuthenticationOutcome> onReported, final boolean debug)
    {
        this.callback = callback == null ? AuthenticationCallback.NO_OP : callback;
        this.onReported = onReported;
        this.debug = debug;
    }

    public boolean success(final Object user)
    {
        return report(AuthenticationOutcome.success(user));
    }

    public boolean fail(final FailureReason reason)
    {
        return report(AuthenticationOutcome.failure(reason));
    }

    public boolean error(final Throwable cause)
    {
        return report(AuthenticationOutcome.error(cause));
    }

    public boolean isReported()
    {
        return reported.get();
    }

    public CompletableFuture<AuthenticationOutcome> future()
    {
        return future;
    }

    private boolean report(final AuthenticationOutcome outcome)
    {
        if (!reported.compareAndSet(false, true))
        {
            if (debug)
            {
                logger.info("Outcome {} dropped, attempt already reported", outcome);
            }
            else
            {
                logger.debug("Outcome {} dropped, attempt already reported", outcome);
            }

            return false;
        }

        try
        {
            switch (outcome.getType())
            {
                case SUCCESS:
                    callback.success(outcome.getUser());
                    break;
                case FAILURE:
                    callback.fail(outcome.getReason());
                    break;
                default:
                    callback.error(outcome.getCause());
            }
        }
        catch (final RuntimeException ex)
        {
            logger.error("Authentication callback failed while handling " + outcome, ex);
        }
        finally
        {
            try
            {
                if (onReported != null)
                {
                    onReported.accept(outcome);
                }
            }
            finally
            {
                future.complete(outcome);
            }
        }

        return true;
    }
}
