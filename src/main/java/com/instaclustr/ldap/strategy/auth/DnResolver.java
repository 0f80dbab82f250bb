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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.instaclustr.ldap.strategy.conf.BaseDn;
import com.instaclustr.ldap.strategy.conf.DnMode;
import com.instaclustr.ldap.strategy.conf.LdapStrategyConfiguration;

/**
 * Computes the bind DN and the search base from a username.
 * <p>
 * Command line equivalents of what gets resolved:
 * <ul>
 * <li>Active Directory: {@code ldapsearch -H ldap://ad:389 -D 'CORP\jdoe' -w secret -b dc=corp,dc=example,dc=local '(sAMAccountName=jdoe)'}</li>
 * <li>OpenLDAP: {@code ldapsearch -H ldap://openldap:389 -D uid=jdoe,ou=people,dc=example,dc=local -w secret -b uid=jdoe,ou=people,dc=example,dc=local}</li>
 * </ul>
 */
public final class DnResolver
{

    public static final char DOMAIN_SEPARATOR = '\\';

    private static final Joiner COMMA = Joiner.on(',');

    private DnResolver()
    {
    }

    /**
     * @return resolved DNs, or empty when a Windows style username has no usable {@code DOMAIN\name} form and a search is
     * needed
     */
    public static Optional<ResolvedDn> resolve(final String username, final LdapStrategyConfiguration configuration)
    {
        if (username == null)
        {
            return Optional.empty();
        }

        if (configuration.getDnMode() == DnMode.UNIX)
        {
            final String base = configuration.getBaseDn().join();
            final String bindDn = base.isEmpty()
                ? configuration.getUidAttribute() + "=" + username
                : configuration.getUidAttribute() + "=" + username + "," + base;

            if (configuration.isAuthOnly())
            {
                return Optional.of(new ResolvedDn(bindDn, null, null));
            }

            return Optional.of(new ResolvedDn(bindDn, bindDn, username));
        }

        // Active Directory accepts DOMAIN\name as bind principal
        if (configuration.isAuthOnly())
        {
            return Optional.of(new ResolvedDn(username, null, null));
        }

        final int separator = username.indexOf(DOMAIN_SEPARATOR);

        if (separator <= 0 || separator == username.length() - 1)
        {
            return Optional.empty();
        }

        final String domain = username.substring(0, separator);
        final String localName = username.substring(separator + 1);

        return Optional.of(new ResolvedDn(username, windowsSearchBase(domain, configuration.getBaseDn()), localName));
    }

    static String windowsSearchBase(final String domain, final BaseDn baseDn)
    {
        if (!baseDn.isComponents())
        {
            return baseDn.join();
        }

        final String dc = "dc=" + domain.toLowerCase(Locale.ROOT);
        final List<String> components = new ArrayList<>(baseDn.getComponents());

        boolean present = false;

        for (final String component : components)
        {
            if (normalize(component).equals(dc))
            {
                present = true;
                break;
            }
        }

        if (!present)
        {
            components.add(0, dc);
        }

        return COMMA.join(components);
    }

    private static String normalize(final String component)
    {
        return component.replaceAll("\\s*=\\s*", "=").trim().toLowerCase(Locale.ROOT);
    }
}
