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

/**
 * Three way signal consumed by the host authentication framework. Exactly one method is called per attempt.
 */
public interface AuthenticationCallback
{

    AuthenticationCallback NO_OP = new AuthenticationCallback()
    {
        @Override
        public void success(final Object user)
        {
        }

        @Override
        public void fail(final FailureReason reason)
        {
        }

        @Override
        public void error(final Throwable cause)
        {
        }
    };

    void success(Object user);

    void fail(FailureReason reason);

    void error(Throwable cause);
}
