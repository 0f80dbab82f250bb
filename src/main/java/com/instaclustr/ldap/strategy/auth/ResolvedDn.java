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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Output of {@link DnResolver}: what to bind as, where to search and which value replaces the uid placeholder.
 */
public final class ResolvedDn
{

    private final String bindDn;
    private final String searchBaseDn;
    private final String filterValue;

    public ResolvedDn(final String bindDn, final String searchBaseDn, final String filterValue)
    {
        this.bindDn = bindDn;
        this.searchBaseDn = searchBaseDn;
        this.filterValue = filterValue;
    }

    public String getBindDn()
    {
        return bindDn;
    }

    /**
     * @return search base, null in auth-only mode
     */
    public String getSearchBaseDn()
    {
        return searchBaseDn;
    }

    /**
     * @return unescaped value for the uid placeholder, null in auth-only mode
     */
    public String getFilterValue()
    {
        return filterValue;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof ResolvedDn))
        {
            return false;
        }

        final ResolvedDn other = (ResolvedDn) o;

        return Objects.equals(bindDn, other.bindDn)
            && Objects.equals(searchBaseDn, other.searchBaseDn)
            && Objects.equals(filterValue, other.filterValue);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(bindDn, searchBaseDn, filterValue);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("bindDn", bindDn)
            .add("searchBaseDn", searchBaseDn)
            .add("filterValue", filterValue)
            .toString();
    }
}
