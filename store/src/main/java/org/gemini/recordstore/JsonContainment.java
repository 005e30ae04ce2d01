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

import java.util.List;
import java.util.Map;

/**
 * JSON containment over decoded payloads: a map contains another if every key of the other is present with a
 * contained value; a list contains another if every element of the other is contained in some element of it;
 * scalars must be equal, with numbers compared by value.
 */
class JsonContainment {
    private JsonContainment() {}

    static boolean contains(Object container, Object contained) {
        if (contained instanceof Map) {
            if (!(container instanceof Map)) return false;
            Map<?, ?> outer = (Map<?, ?>) container;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) contained).entrySet()) {
                if (!outer.containsKey(entry.getKey()) || !contains(outer.get(entry.getKey()), entry.getValue())) {
                    return false;
                }
            }
            return true;
        } else if (contained instanceof List) {
            if (!(container instanceof List)) return false;
            for (Object wanted : (List<?>) contained) {
                boolean found = false;
                for (Object candidate : (List<?>) container) {
                    if (contains(candidate, wanted)) {
                        found = true;
                        break;
                    }
                }
                if (!found) return false;
            }
            return true;
        } else if (contained instanceof Number && container instanceof Number) {
            return Double.compare(((Number) container).doubleValue(), ((Number) contained).doubleValue()) == 0;
        } else if (contained == null) {
            return container == null;
        } else {
            return contained.equals(container);
        }
    }
}
