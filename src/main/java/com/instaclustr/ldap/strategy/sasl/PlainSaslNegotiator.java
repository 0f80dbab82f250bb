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
package com.instaclustr.ldap.strategy.sasl;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.instaclustr.ldap.strategy.LdapAuthenticationStrategy;
import com.instaclustr.ldap.strategy.auth.AuthenticationCallback;
import com.instaclustr.ldap.strategy.auth.AuthenticationOutcome;
import com.instaclustr.ldap.strategy.auth.AuthenticationRequest;
import com.instaclustr.ldap.strategy.conf.LdapStrategyConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds SASL PLAIN client responses into an {@link LdapAuthenticationStrategy}. Credentials the client did not send are
 * left out of the request, the strategy then reports them as missing.
 */
public class PlainSaslNegotiator
{
    private static final Logger logger = LoggerFactory.getLogger(PlainSaslNegotiator.class);

    private final LdapAuthenticationStrategy strategy;

    private boolean complete = false;

    private AuthenticationRequest request;

    public PlainSaslNegotiator(final LdapAuthenticationStrategy strategy)
    {
        this.strategy = strategy;
    }

    public byte[] evaluateResponse(final byte[] clientResponse)
    {
        request = decodeCredentials(clientResponse, strategy.getConfiguration());
        complete = true;
        return null;
    }

    public boolean isComplete()
    {
        return complete;
    }

    public CompletableFuture<AuthenticationOutcome> authenticate(final AuthenticationCallback callback)
    {
        if (!complete)
        {
            throw new IllegalStateException("SASL negotiation not complete");
        }

        return strategy.authenticate(request, callback);
    }

    public CompletableFuture<AuthenticationOutcome> authenticate()
    {
        return authenticate(AuthenticationCallback.NO_OP);
    }

    /**
     * SASL PLAIN mechanism specifies that credentials are encoded in a
     * sequence of UTF-8 bytes, delimited by 0 (US-ASCII NUL).
     * The form is : {code}authzId<NUL>authnId<NUL>password{code}
     * authzId is optional, and in fact we don't care about it here as there
     * is no concept of a user being authorized to act on behalf of another.
     *
     * @param bytes encoded credentials string sent by the client
     * @return request keyed by the configured username and password field names
     */
    static AuthenticationRequest decodeCredentials(final byte[] bytes, final LdapStrategyConfiguration configuration)
    {
        logger.trace("Decoding credentials from client token");

        final Map<String, String> fields = new HashMap<>();

        if (bytes == null)
        {
            return AuthenticationRequest.of(fields);
        }

        byte[] user = null;
        byte[] pass = null;

        int end = bytes.length;

        for (int i = bytes.length - 1; i >= 0; i--)
        {
            if (bytes[i] == 0)
            {
                if (pass == null)
                    pass = Arrays.copyOfRange(bytes, i + 1, end);
                else if (user == null)
                    user = Arrays.copyOfRange(bytes, i + 1, end);
                end = i;
            }
        }

        if (pass != null)
        {
            fields.put(configuration.getPasswordField(), new String(pass, UTF_8));
        }

        if (user != null)
        {
            fields.put(configuration.getUsernameField(), new String(user, UTF_8));
        }

        return AuthenticationRequest.of(fields);
    }
}
