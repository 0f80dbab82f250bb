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

import com.google.common.base.MoreObjects;

/**
 * The one result of an authentication attempt.
 */
public final class AuthenticationOutcome
{

    public enum Type
    {
        SUCCESS,
        FAILURE,
        /**
         * Unexpected problem, to be treated as a server side error rather than bad credentials.
         */
        ERROR
    }

    private final Type type;
    private final Object user;
    private final FailureReason reason;
    private final Throwable cause;

    private AuthenticationOutcome(final Type type, final Object user, final FailureReason reason, final Throwable cause)
    {
        this.type = type;
        this.user = user;
        this.reason = reason;
        this.cause = cause;
    }

    public static AuthenticationOutcome success(final Object user)
    {
        return new AuthenticationOutcome(Type.SUCCESS, user, null, null);
    }

    public static AuthenticationOutcome failure(final FailureReason reason)
    {
        return new AuthenticationOutcome(Type.FAILURE, null, reason, null);
    }

    public static AuthenticationOutcome error(final Throwable cause)
    {
        return new AuthenticationOutcome(Type.ERROR, null, null, cause);
    }

    public Type getType()
    {
        return type;
    }

    public boolean isSuccess()
    {
        return type == Type.SUCCESS;
    }

    public boolean isFailure()
    {
        return type == Type.FAILURE;
    }

    public boolean isError()
    {
        return type == Type.ERROR;
    }

    public Object getUser()
    {
        return user;
    }

    public FailureReason getReason()
    {
        return reason;
    }

    public Throwable getCause()
    {
        return cause;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("type", type)
            .add("user", user)
            .add("reason", reason)
            .add("cause", cause)
            .toString();
    }
}
