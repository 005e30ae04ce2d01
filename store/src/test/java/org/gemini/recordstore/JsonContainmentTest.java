/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package org.gemini.recordstore;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.gemini.recordstore.Fixtures.map;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JsonContainmentTest {
    @Test
    public void maps() {
        Object doc = map("a", 1, "b", map("c", "x", "d", true));
        assertTrue(JsonContainment.contains(doc, Collections.emptyMap()));
        assertTrue(JsonContainment.contains(doc, map("a", 1)));
        assertTrue(JsonContainment.contains(doc, map("b", map("d", true))));
        assertFalse(JsonContainment.contains(doc, map("b", map("d", false))));
        assertFalse(JsonContainment.contains(doc, map("z", 1)));
        assertFalse(JsonContainment.contains(doc, map("a", "1")));
    }

    @Test
    public void numbersCompareByValue() {
        assertTrue(JsonContainment.contains(map("a", 1), map("a", 1.0)));
        assertTrue(JsonContainment.contains(map("a", 2L), map("a", 2)));
        assertFalse(JsonContainment.contains(map("a", 2.5), map("a", 2)));
    }

    @Test
    public void lists() {
        Object doc = map("tags", Arrays.asList("rgb", "drone", map("alt", 30)));
        assertTrue(JsonContainment.contains(doc, map("tags", Collections.singletonList("drone"))));
        assertTrue(JsonContainment.contains(doc, map("tags", Arrays.asList("drone", "rgb"))));
        assertTrue(JsonContainment.contains(doc, map("tags", Collections.singletonList(map("alt", 30)))));
        assertFalse(JsonContainment.contains(doc, map("tags", Collections.singletonList("thermal"))));
        assertFalse(JsonContainment.contains(doc, map("tags", "rgb")));
    }

    @Test
    public void nulls() {
        assertTrue(JsonContainment.contains(map("a", null), map("a", null)));
        assertFalse(JsonContainment.contains(map("a", 1), map("a", null)));
        assertFalse(JsonContainment.contains(null, map("a", 1)));
    }
}
