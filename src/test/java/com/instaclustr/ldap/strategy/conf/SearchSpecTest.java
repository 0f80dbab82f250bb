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

import static org.testng.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import com.instaclustr.ldap.strategy.exception.ConfigurationException;
import org.testng.annotations.Test;

public class SearchSpecTest
{

    @Test
    public void everyPlaceholderIsReplaced()
    {
        final SearchSpec template = new SearchSpec("(|(uid=$uid$)(mail=$uid$@example.local))", SearchScope.SUB, ImmutableList.of("mail"), 2, 3);

        final SearchSpec spec = template.forUid("jdoe");

        assertEquals(spec.getFilter(), "(|(uid=jdoe)(mail=jdoe@example.local))");
        assertEquals(spec.getScope(), SearchScope.SUB);
        assertEquals(spec.getAttributes(), ImmutableList.of("mail"));
        assertEquals(spec.getSizeLimit(), 2);
        assertEquals(spec.getTimeLimit(), 3);
        assertEquals(template.getFilter(), "(|(uid=$uid$)(mail=$uid$@example.local))");
    }

    @Test
    public void filterWithoutPlaceholderIsKept()
    {
        assertEquals(SearchSpec.defaults().forUid("jdoe").getFilter(), "(objectClass=*)");
    }

    @Test
    public void nullScopeDefaultsToSubtree()
    {
        assertEquals(new SearchSpec("(uid=$uid$)", null, null, 0, 0).getScope(), SearchScope.SUB);
    }

    @Test
    public void scopeNamesAreParsed()
    {
        assertEquals(SearchScope.parse("base"), SearchScope.BASE);
        assertEquals(SearchScope.parse("ONE"), SearchScope.ONE);
        assertEquals(SearchScope.parse(" subtree "), SearchScope.SUB);
    }

    @Test
    public void balancedFilterIsValid()
    {
        new SearchSpec("(&(objectClass=person)(uid=$uid$))", SearchScope.SUB, null, 0, 0).validate();
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void unbalancedFilterIsInvalid()
    {
        new SearchSpec("(&(objectClass=person)(uid=$uid$)", SearchScope.SUB, null, 0, 0).validate();
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void closingBeforeOpeningIsInvalid()
    {
        new SearchSpec("(uid=a))((x=y)", SearchScope.SUB, null, 0, 0).validate();
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void negativeLimitIsInvalid()
    {
        new SearchSpec("(uid=$uid$)", SearchScope.SUB, null, -1, 0).validate();
    }
}
