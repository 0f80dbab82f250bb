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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Why an attempt failed. The code follows HTTP conventions for request and credential problems and carries the LDAP
 * result code when a search ended without a match.
 */
public final class FailureReason
{

    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;

    public enum Kind
    {
        MISSING_CREDENTIALS,
        UNRESOLVABLE_DN,
        BIND_REJECTED,
        // bind and search issue failures look the same to callers
        SEARCH_REJECTED,
        NO_MATCHING_ENTRY,
        VERIFICATION_REJECTED
    }

    private final Kind kind;
    private final int code;
    private final String challenge;

    private FailureReason(final Kind kind, final int code, final String challenge)
    {
        this.kind = kind;
        this.code = code;
        this.challenge = challenge;
    }

    public static FailureReason missingCredentials()
    {
        return new FailureReason(Kind.MISSING_CREDENTIALS, UNAUTHORIZED, null);
    }

    public static FailureReason unresolvableDn()
    {
        return new FailureReason(Kind.UNRESOLVABLE_DN, UNAUTHORIZED, null);
    }

    public static FailureReason bindRejected()
    {
        return new FailureReason(Kind.BIND_REJECTED, FORBIDDEN, null);
    }

    public static FailureReason searchRejected()
    {
        return new FailureReason(Kind.SEARCH_REJECTED, FORBIDDEN, null);
    }

    public static FailureReason noMatchingEntry(final int status)
    {
        return new FailureReason(Kind.NO_MATCHING_ENTRY, status, null);
    }

    public static FailureReason verificationRejected(final String challenge)
    {
        return new FailureReason(Kind.VERIFICATION_REJECTED, UNAUTHORIZED, challenge);
    }

    public Kind getKind()
    {
        return kind;
    }

    public int getCode()
    {
        return code;
    }

    /**
     * @return challenge for {@link Kind#VERIFICATION_REJECTED}, null otherwise
     */
    public String getChallenge()
    {
        return challenge;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof FailureReason))
        {
            return false;
        }

        final FailureReason other = (FailureReason) o;

        return code == other.code && kind == other.kind && Objects.equals(challenge, other.challenge);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, code, challenge);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("kind", kind)
            .add("code", code)
            .add("challenge", challenge)
            .toString();
    }
}
