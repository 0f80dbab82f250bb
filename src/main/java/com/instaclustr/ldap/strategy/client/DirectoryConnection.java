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
package com.instaclustr.ldap.strategy.client;

import com.instaclustr.ldap.strategy.conf.SearchSpec;

/**
 * One connection to the directory, owned by a single authentication attempt.
 */
public interface DirectoryConnection extends AutoCloseable
{

    void bind(String dn, String password, BindResultHandler handler);

    /**
     * Issues a search under {@code baseDn}. Results arrive on {@code handler}, possibly from another thread.
     *
     * @throws DirectoryException when the search can not be issued at all, in which case the handler is never called
     */
    void search(String baseDn, SearchSpec spec, SearchResultHandler handler) throws DirectoryException;

    @Override
    void close();
}
