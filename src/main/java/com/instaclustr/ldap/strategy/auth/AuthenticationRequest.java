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

import java.util.HashMap;
import java.util.Map;

/**
 * Incoming request as seen by the strategy: a bag of named fields, of which the configured username and password fields
 * are read.
 */
public interface AuthenticationRequest
{

    /**
     * @return value of the field or null when the request does not carry it
     */
    String getField(String name);

    static AuthenticationRequest of(final Map<String, String> fields)
    {
        final Map<String, String> copy = fields == null ? new HashMap<>() : new HashMap<>(fields);
        return copy::get;
    }
}
