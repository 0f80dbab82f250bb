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

import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.instaclustr.ldap.strategy.exception.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

/**
 * Search parameters for the profile lookup. Instances are immutable, {@link #withFilter(String)} returns a copy, so the
 * configured template is never modified by an authentication attempt.
 */
public final class SearchSpec
{

    public static final String UID_PLACEHOLDER = "$uid$";

    public static final String DEFAULT_FILTER = "(objectClass=*)";

    private final String filter;
    private final SearchScope scope;
    private final List<String> attributes;
    private final int sizeLimit;
    private final int timeLimit;

    public SearchSpec(final String filter,
                      final SearchScope scope,
                      final List<String> attributes,
                      final int sizeLimit,
                      final int timeLimit)
    {
        this.filter = filter;
        this.scope = scope == null ? SearchScope.SUB : scope;
        this.attributes = attributes == null ? ImmutableList.of() : ImmutableList.copyOf(attributes);
        this.sizeLimit = sizeLimit;
        this.timeLimit = timeLimit;
    }

    public static SearchSpec defaults()
    {
        return new SearchSpec(DEFAULT_FILTER, SearchScope.SUB, ImmutableList.of(), 0, 0);
    }

    public SearchSpec withFilter(final String filter)
    {
        return new SearchSpec(filter, scope, attributes, sizeLimit, timeLimit);
    }

    /**
     * Replaces every {@value #UID_PLACEHOLDER} in the filter template with the given, already escaped, value.
     */
    public SearchSpec forUid(final String escapedUid)
    {
        return withFilter(StringUtils.replace(filter, UID_PLACEHOLDER, escapedUid));
    }

    public String getFilter()
    {
        return filter;
    }

    public SearchScope getScope()
    {
        return scope;
    }

    /**
     * @return attributes to return, empty means all user attributes
     */
    public List<String> getAttributes()
    {
        return attributes;
    }

    /**
     * @return maximum number of entries, 0 for no limit
     */
    public int getSizeLimit()
    {
        return sizeLimit;
    }

    /**
     * @return time limit in seconds, 0 for no limit
     */
    public int getTimeLimit()
    {
        return timeLimit;
    }

    void validate()
    {
        if (StringUtils.isBlank(filter))
        {
            throw new ConfigurationException("Search filter must not be empty");
        }

        final String trimmed = filter.trim();

        if (!trimmed.startsWith("(") || !trimmed.endsWith(")"))
        {
            throw new ConfigurationException(format("Search filter %s has to be enclosed in parentheses", filter));
        }

        int depth = 0;

        for (int i = 0; i < trimmed.length(); i++)
        {
            final char c = trimmed.charAt(i);

            if (c == '(')
            {
                depth++;
            }
            else if (c == ')')
            {
                depth--;

                if (depth < 0)
                {
                    break;
                }
            }
        }

        if (depth != 0)
        {
            throw new ConfigurationException(format("Search filter %s has unbalanced parentheses", filter));
        }

        if (sizeLimit < 0 || timeLimit < 0)
        {
            throw new ConfigurationException(format("Search size limit (%s) and time limit (%s) must not be negative", sizeLimit, timeLimit));
        }
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof SearchSpec))
        {
            return false;
        }

        final SearchSpec other = (SearchSpec) o;

        return sizeLimit == other.sizeLimit
            && timeLimit == other.timeLimit
            && Objects.equals(filter, other.filter)
            && scope == other.scope
            && Objects.equals(attributes, other.attributes);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(filter, scope, attributes, sizeLimit, timeLimit);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("filter", filter)
            .add("scope", scope)
            .add("attributes", attributes)
            .add("sizeLimit", sizeLimit)
            .add("timeLimit", timeLimit)
            .toString();
    }
}
