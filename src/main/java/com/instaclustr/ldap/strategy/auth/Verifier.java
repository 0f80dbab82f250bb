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
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import com.instaclustr.ldap.strategy.client.DirectoryEntry;

/**
 * Application supplied check deciding whether a directory profile maps to a valid application user.
 * <p>
 * A thrown exception or an exceptionally completed stage is treated the same as {@link Verification#error(Throwable)}.
 */
@FunctionalInterface
public interface Verifier
{

    CompletionStage<Verification> verify(DirectoryEntry profile);

    static Verifier synchronous(final Function<DirectoryEntry, Verification> verification)
    {
        return profile -> CompletableFuture.completedFuture(verification.apply(profile));
    }

    /**
     * Accepts every profile, the profile itself becomes the user.
     */
    static Verifier acceptAll()
    {
        return synchronous(Verification::accepted);
    }
}
