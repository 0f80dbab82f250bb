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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;

import com.instaclustr.ldap.strategy.conf.BaseDn;
import com.instaclustr.ldap.strategy.conf.DnMode;
import com.instaclustr.ldap.strategy.conf.LdapStrategyConfiguration;
import org.testng.annotations.Test;

public class DnResolverTest
{

    private static LdapStrategyConfiguration unix(final BaseDn baseDn, final boolean authOnly)
    {
        return LdapStrategyConfiguration.builder()
            .server("ldap://localhost:389")
            .dnMode(DnMode.UNIX)
            .uidAttribute("cn")
            .baseDn(baseDn)
            .authOnly(authOnly)
            .build();
    }

    private static LdapStrategyConfiguration windows(final BaseDn baseDn, final boolean authOnly)
    {
        return LdapStrategyConfiguration.builder()
            .server("ldap://ad:389")
            .dnMode(DnMode.WINDOWS)
            .baseDn(baseDn)
            .authOnly(authOnly)
            .build();
    }

    @Test
    public void unixBindDnIsUidAttributeUsernameAndBase()
    {
        final ResolvedDn resolved = DnResolver.resolve("jdoe", unix(BaseDn.of("ou=people,dc=example,dc=local"), false)).get();

        assertEquals(resolved.getBindDn(), "cn=jdoe,ou=people,dc=example,dc=local");
        assertEquals(resolved.getSearchBaseDn(), "cn=jdoe,ou=people,dc=example,dc=local");
        assertEquals(resolved.getFilterValue(), "jdoe");
    }

    @Test
    public void unixBaseComponentsAreJoined()
    {
        final ResolvedDn resolved = DnResolver.resolve("jdoe", unix(BaseDn.ofComponents("ou=people", "dc=example", "dc=local"), false)).get();

        assertEquals(resolved.getBindDn(), "cn=jdoe,ou=people,dc=example,dc=local");
    }

    @Test
    public void unixAuthOnlyWithoutBaseHasNoTrailingComma()
    {
        final ResolvedDn resolved = DnResolver.resolve("jdoe", unix(BaseDn.empty(), true)).get();

        assertEquals(resolved.getBindDn(), "cn=jdoe");
        assertNull(resolved.getSearchBaseDn());
        assertNull(resolved.getFilterValue());
    }

    @Test
    public void windowsDomainIsPrependedToSearchBase()
    {
        final ResolvedDn resolved = DnResolver.resolve("CORP\\jdoe", windows(BaseDn.ofComponents("dc=example", "dc=local"), false)).get();

        assertEquals(resolved.getBindDn(), "CORP\\jdoe");
        assertEquals(resolved.getSearchBaseDn(), "dc=corp,dc=example,dc=local");
        assertEquals(resolved.getFilterValue(), "jdoe");
    }

    @Test
    public void windowsDomainAlreadyInBaseIsNotRepeated()
    {
        final ResolvedDn resolved = DnResolver.resolve("Example\\jdoe", windows(BaseDn.ofComponents("DC = example", "dc=local"), false)).get();

        assertEquals(resolved.getSearchBaseDn(), "DC = example,dc=local");
    }

    @Test
    public void windowsSingleStringBaseIsUsedAsIs()
    {
        final ResolvedDn resolved = DnResolver.resolve("CORP\\jdoe", windows(BaseDn.of("dc=corp,dc=example,dc=local"), false)).get();

        assertEquals(resolved.getSearchBaseDn(), "dc=corp,dc=example,dc=local");
    }

    @Test
    public void windowsUsernameWithoutDomainIsUnresolvable()
    {
        final LdapStrategyConfiguration configuration = windows(BaseDn.ofComponents("dc=example", "dc=local"), false);

        assertFalse(DnResolver.resolve("jdoe", configuration).isPresent());
        assertFalse(DnResolver.resolve("\\jdoe", configuration).isPresent());
        assertFalse(DnResolver.resolve("CORP\\", configuration).isPresent());
        assertFalse(DnResolver.resolve(null, configuration).isPresent());
    }

    @Test
    public void windowsAuthOnlyBindsRawUsername()
    {
        final ResolvedDn resolved = DnResolver.resolve("jdoe@corp.example.local", windows(BaseDn.empty(), true)).get();

        assertEquals(resolved.getBindDn(), "jdoe@corp.example.local");
        assertNull(resolved.getSearchBaseDn());
    }
}
