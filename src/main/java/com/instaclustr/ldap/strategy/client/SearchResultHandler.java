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

/**
 * Handler for search results, which are delivered incrementally:
 * <ol>
 * <li>zero or more {@link #handleEntry} calls, one per matching entry</li>
 * <li>exactly one terminal call, either {@link #handleDone} or {@link #handleError}</li>
 * </ol>
 */
public interface SearchResultHandler
{

    void handleEntry(DirectoryEntry entry);

    /**
     * Called once when the search completed.
     *
     * @param status LDAP result code, 0 for success
     */
    void handleDone(int status);

    /**
     * Called once when the search failed after it was issued.
     */
    void handleError(Throwable cause);
}
