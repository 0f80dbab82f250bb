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
package com.instaclustr.ldap.strategy.conf;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * Where and how to connect to the directory. The strategy itself never looks inside, it is handed to the
 * {@link com.instaclustr.ldap.strategy.client.DirectoryClient} as is.
 */
public final class ServerSpec
{

    public static final String DEFAULT_CONTEXT_FACTORY = "com.sun.jndi.ldap.LdapCtxFactory";
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 2000;
    public static final int DEFAULT_READ_TIMEOUT_MS = 1000;

    private final String url;
    private final String contextFactory;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;
    private final Map<String, String> environment;

    public ServerSpec(final String url,
                      final String contextFactory,
                      final int connectTimeoutMillis,
                      final int readTimeoutMillis,
                      final Map<String, String> environment)
    {
        this.url = url;
        this.contextFactory = contextFactory == null ? DEFAULT_CONTEXT_FACTORY : contextFactory;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.readTimeoutMillis = readTimeoutMillis;
        this.environment = environment == null ? ImmutableMap.of() : ImmutableMap.copyOf(environment);
    }

    public static ServerSpec of(final String url)
    {
        return new ServerSpec(url, DEFAULT_CONTEXT_FACTORY, DEFAULT_CONNECT_TIMEOUT_MS, DEFAULT_READ_TIMEOUT_MS, ImmutableMap.of());
    }

    public String getUrl()
    {
        return url;
    }

    public String getContextFactory()
    {
        return contextFactory;
    }

    public int getConnectTimeoutMillis()
    {
        return connectTimeoutMillis;
    }

    public int getReadTimeoutMillis()
    {
        return readTimeoutMillis;
    }

    /**
     * @return additional environment entries, e.g. TLS socket factory or referral handling
     */
    public Map<String, String> getEnvironment()
    {
        return environment;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("url", url)
            .add("contextFactory", contextFactory)
            .add("connectTimeoutMillis", connectTimeoutMillis)
            .add("readTimeoutMillis", readTimeoutMillis)
            .add("environment", environment.keySet())
            .toString();
    }
}
