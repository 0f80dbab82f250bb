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

import java.util.Optional;
import java.util.StringJoiner;

import com.instaclustr.ldap.strategy.conf.LdapStrategyConfiguration;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Username and password taken from a request.
 */
public final class Credentials
{

    private final String username;

    private final String password;

    public Credentials(final String username, final String password)
    {
        if (username == null)
        {
            throw new IllegalArgumentException("Username provided to Credentials instance can not be a null object.");
        }

        this.username = username;
        this.password = password;
    }

    /**
     * Reads the configured username and password fields. Absent and empty values count as missing.
     */
    public static Optional<Credentials> extract(final AuthenticationRequest request, final LdapStrategyConfiguration configuration)
    {
        if (request == null)
        {
            return Optional.empty();
        }

        final String username = request.getField(configuration.getUsernameField());
        final String password = request.getField(configuration.getPasswordField());

        if (StringUtils.isAnyEmpty(username, password))
        {
            return Optional.empty();
        }

        return Optional.of(new Credentials(username, password));
    }

    public String getUsername()
    {
        return username;
    }

    public String getPassword()
    {
        return password;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
        {
            return true;
        }

        if (!(obj instanceof Credentials))
        {
            return false;
        }

        final Credentials other = (Credentials) obj;

        return new EqualsBuilder().append(username, other.username).append(password, other.password).isEquals();
    }

    @Override
    public int hashCode()
    {
        return new HashCodeBuilder(19, 29).append(username).append(password).toHashCode();
    }

    @Override
    public String toString()
    {
        return new StringJoiner(", ", Credentials.class.getSimpleName() + "[", "]")
            .add("username='" + username + "'")
            .add("password=redacted")
            .toString();
    }
}
