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

import static java.lang.String.format;

import java.util.Locale;

import com.instaclustr.ldap.strategy.exception.ConfigurationException;

/**
 * How the bind DN is built from the username.
 */
public enum DnMode
{
    /**
     * Active Directory: users bind as {@code DOMAIN\name}, the domain contributes a {@code dc=} component to the search base.
     */
    WINDOWS,

    /**
     * OpenLDAP and friends: users bind as {@code <uidAttribute>=<name>,<base>}.
     */
    UNIX;

    public static DnMode parse(final String value)
    {
        try
        {
            return DnMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (final IllegalArgumentException ex)
        {
            throw new ConfigurationException(format("Unknown DN mode '%s', expected one of 'unix' or 'windows'", value), ex);
        }
    }
}
