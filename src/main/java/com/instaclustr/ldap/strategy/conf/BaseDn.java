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

import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Base DN, given either as one DN string or as an ordered list of RDN components.
 * <p>
 * The component form lets Active Directory searches prepend the {@code dc=} component taken from the user's domain.
 */
public final class BaseDn
{

    private static final Joiner COMMA = Joiner.on(',');

    private final String dn;
    private final List<String> components;

    private BaseDn(final String dn, final List<String> components)
    {
        this.dn = dn;
        this.components = components;
    }

    public static BaseDn of(final String dn)
    {
        return new BaseDn(dn == null ? "" : dn.trim(), null);
    }

    public static BaseDn ofComponents(final List<String> components)
    {
        final ImmutableList.Builder<String> builder = ImmutableList.builder();

        for (final String component : components)
        {
            if (component != null && !component.trim().isEmpty())
            {
                builder.add(component.trim());
            }
        }

        return new BaseDn(null, builder.build());
    }

    public static BaseDn ofComponents(final String... components)
    {
        return ofComponents(ImmutableList.copyOf(components));
    }

    public static BaseDn empty()
    {
        return of("");
    }

    public boolean isComponents()
    {
        return components != null;
    }

    /**
     * @return the components, or an empty list when the base was given as a single string
     */
    public List<String> getComponents()
    {
        return components == null ? ImmutableList.of() : components;
    }

    public boolean isEmpty()
    {
        return isComponents() ? components.isEmpty() : dn.isEmpty();
    }

    /**
     * @return the single DN string, or the components joined with commas
     */
    public String join()
    {
        return isComponents() ? COMMA.join(components) : dn;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof BaseDn))
        {
            return false;
        }

        final BaseDn other = (BaseDn) o;

        return Objects.equals(dn, other.dn) && Objects.equals(components, other.components);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(dn, components);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("dn", dn)
            .add("components", components)
            .toString();
    }
}
