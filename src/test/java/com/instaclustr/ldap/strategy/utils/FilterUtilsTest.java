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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

import org.testng.annotations.Test;

public class FilterUtilsTest
{

    @Test
    public void specialCharactersAreEscaped()
    {
        assertEquals(FilterUtils.escapeValue("*)(uid=*))(|(uid=*"), "\\2a\\29\\28uid=\\2a\\29\\29\\28|\\28uid=\\2a");
        assertEquals(FilterUtils.escapeValue("a\\b"), "a\\5cb");
        assertEquals(FilterUtils.escapeValue("nul\u0000"), "nul\\00");
    }

    @Test
    public void plainValuesAreUnchanged()
    {
        assertEquals(FilterUtils.escapeValue("jdoe.smith@example.local"), "jdoe.smith@example.local");
        assertEquals(FilterUtils.escapeValue(""), "");
        assertNull(FilterUtils.escapeValue(null));
    }
}
