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
package com.instaclustr.ldap.strategy.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A matched directory entry. Its attribute set is the profile handed to the verifier.
 */
public final class DirectoryEntry
{

    private final String dn;
    private final Map<String, List<String>> attributes;

    public DirectoryEntry(final String dn, final Map<String, List<String>> attributes)
    {
        this.dn = dn;

        final ImmutableMap.Builder<String, List<String>> builder = ImmutableMap.builder();

        if (attributes != null)
        {
            for (final Map.Entry<String, List<String>> attribute : attributes.entrySet())
            {
                builder.put(attribute.getKey(), ImmutableList.copyOf(attribute.getValue()));
            }
        }

        this.attributes = builder.build();
    }

    public String getDn()
    {
        return dn;
    }

    public Map<String, List<String>> getAttributes()
    {
        return attributes;
    }

    public List<String> getValues(final String attribute)
    {
        for (final Map.Entry<String, List<String>> entry : attributes.entrySet())
        {
            if (entry.getKey().equalsIgnoreCase(attribute))
            {
                return entry.getValue();
            }
        }

        return ImmutableList.of();
    }

    /**
     * @return first value of the attribute, attribute names are matched case-insensitively, or null
     */
    public String getValue(final String attribute)
    {
        final List<String> values = getValues(attribute);
        return values.isEmpty() ? null : values.get(0);
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof DirectoryEntry))
        {
            return false;
        }

        final DirectoryEntry other = (DirectoryEntry) o;

        return Objects.equals(dn, other.dn) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(dn, attributes);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("dn", dn)
            .add("attributes", attributes)
            .toString();
    }
}
