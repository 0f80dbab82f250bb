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
package com.instaclustr.ldap.strategy.utils;

public final class FilterUtils
{

    private FilterUtils()
    {
    }

    /**
     * Escapes a value for use inside an LDAP search filter as described in RFC 4515, section 3.
     */
    public static String escapeValue(final String value)
    {
        if (value == null)
        {
            return null;
        }

        final StringBuilder sb = new StringBuilder(value.length() + 8);

        for (int i = 0; i < value.length(); i++)
        {
            final char c = value.charAt(i);

            switch (c)
            {
                case '\\':
                    sb.append("\\5c");
                    break;
                case '*':
                    sb.append("\\2a");
                    break;
                case '(':
                    sb.append("\\28");
                    break;
                case ')':
                    sb.append("\\29");
                    break;
                case '\0':
                    sb.append("\\00");
                    break;
                default:
                    sb.append(c);
            }
        }

        return sb.toString();
    }
}
