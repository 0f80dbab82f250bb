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
import com.google.common.base.Preconditions;

/**
 * What a {@link Verifier} decided about a profile.
 */
public final class Verification
{

    public enum Kind
    {
        ACCEPTED,
        REJECTED,
        ERROR
    }

    private static final Verification REJECTED = new Verification(Kind.REJECTED, null, null);

    private final Kind kind;
    private final Object user;
    private final Throwable cause;

    private Verification(final Kind kind, final Object user, final Throwable cause)
    {
        this.kind = kind;
        this.user = user;
        this.cause = cause;
    }

    /**
     * @param user the application user the profile maps to, passed through to the host untouched
     */
    public static Verification accepted(final Object user)
    {
        return new Verification(Kind.ACCEPTED, Preconditions.checkNotNull(user, "accepted user must not be null"), null);
    }

    public static Verification rejected()
    {
        return REJECTED;
    }

    public static Verification error(final Throwable cause)
    {
        return new Verification(Kind.ERROR, null, Preconditions.checkNotNull(cause, "error cause must not be null"));
    }

    public Kind getKind()
    {
        return kind;
    }

    public Object getUser()
    {
        return user;
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
            .add("kind", kind)
            .add("user", user)
            .add("cause", cause)
            .toString();
    }
}
