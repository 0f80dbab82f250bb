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

import javax.naming.directory.SearchControls;
import java.util.Locale;

import com.instaclustr.ldap.strategy.exception.ConfigurationException;

public enum SearchScope
{
    BASE(SearchControls.OBJECT_SCOPE),
    ONE(SearchControls.ONELEVEL_SCOPE),
    SUB(SearchControls.SUBTREE_SCOPE);

    private final int jndiScope;

    SearchScope(final int jndiScope)
    {
        this.jndiScope = jndiScope;
    }

    public int getJndiScope()
    {
        return jndiScope;
    }

    public static SearchScope parse(final String value)
    {
        switch (value.trim().toLowerCase(Locale.ROOT))
        {
            case "base":
                return BASE;
            case "one":
            case "onelevel":
                return ONE;
            case "sub":
            case "subtree":
                return SUB;
            default:
                throw new ConfigurationException(format("Unknown search scope '%s', expected one of 'base', 'one' or 'sub'", value));
        }
    }
}
