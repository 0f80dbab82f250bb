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
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.instaclustr.ldap.strategy.FakeDirectoryClient;
import com.instaclustr.ldap.strategy.LdapAuthenticationStrategy;
import com.instaclustr.ldap.strategy.auth.AuthenticationOutcome;
import com.instaclustr.ldap.strategy.auth.AuthenticationRequest;
import com.instaclustr.ldap.strategy.auth.FailureReason;
import com.instaclustr.ldap.strategy.auth.Verifier;
import com.instaclustr.ldap.strategy.conf.LdapStrategyConfiguration;
import org.testng.annotations.Test;

public class PlainSaslNegotiatorTest
{

    private final LdapStrategyConfiguration configuration = LdapStrategyConfiguration.builder()
        .server("ldap://localhost:389")
        .baseDn("ou=people,dc=example,dc=local")
        .authOnly(true)
        .build();

    @Test
    public void authzIdIsIgnored()
    {
        final AuthenticationRequest request = PlainSaslNegotiator.decodeCredentials("admin\u0000jdoe\u0000secret".getBytes(UTF_8), configuration);

        assertEquals(request.getField("username"), "jdoe");
        assertEquals(request.getField("password"), "secret");
    }

    @Test
    public void missingAuthzIdIsAccepted()
    {
        final AuthenticationRequest request = PlainSaslNegotiator.decodeCredentials("\u0000jdoe\u0000secret".getBytes(UTF_8), configuration);

        assertEquals(request.getField("username"), "jdoe");
        assertEquals(request.getField("password"), "secret");
    }

    @Test
    public void tokenWithoutSeparatorsCarriesNoCredentials()
    {
        final AuthenticationRequest request = PlainSaslNegotiator.decodeCredentials("jdoe".getBytes(UTF_8), configuration);

        assertNull(request.getField("username"));
        assertNull(request.getField("password"));
        assertNull(PlainSaslNegotiator.decodeCredentials(null, configuration).getField("username"));
    }

    @Test
    public void negotiatedCredentialsAreAuthenticated() throws Exception
    {
        final FakeDirectoryClient client = new FakeDirectoryClient();
        final PlainSaslNegotiator negotiator = new PlainSaslNegotiator(new LdapAuthenticationStrategy(configuration, Verifier.acceptAll(), client));

        assertFalse(negotiator.isComplete());
        assertNull(negotiator.evaluateResponse("\u0000jdoe\u0000secret".getBytes(UTF_8)));
        assertTrue(negotiator.isComplete());

        final AuthenticationOutcome outcome = negotiator.authenticate().get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isSuccess());
        assertEquals(client.boundDns, ImmutableList.of("uid=jdoe,ou=people,dc=example,dc=local"));
        assertEquals(client.boundPasswords, ImmutableList.of("secret"));
    }

    @Test
    public void truncatedTokenFailsAsMissingCredentials() throws Exception
    {
        final FakeDirectoryClient client = new FakeDirectoryClient();
        final PlainSaslNegotiator negotiator = new PlainSaslNegotiator(new LdapAuthenticationStrategy(configuration, Verifier.acceptAll(), client));

        negotiator.evaluateResponse("secret".getBytes(UTF_8));

        final AuthenticationOutcome outcome = negotiator.authenticate().get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isFailure());
        assertEquals(outcome.getReason().getKind(), FailureReason.Kind.MISSING_CREDENTIALS);
        assertEquals(client.networkCalls(), 0);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void authenticatingBeforeNegotiationIsRejected()
    {
        new PlainSaslNegotiator(new LdapAuthenticationStrategy(configuration, Verifier.acceptAll(), new FakeDirectoryClient())).authenticate();
    }
}
