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
package org.gemini.recordstore.storage;

import java.util.UUID;

/** Position of a row in a table: timestamp, ties broken by id (compared as unsigned 128-bit) */
final class RowPosition implements Comparable<RowPosition> {
    static final UUID MIN_ID = new UUID(0, 0);

    final long micros;
    final UUID id;

    RowPosition(long micros, UUID id) {
        this.micros = micros;
        this.id = id;
    }

    @Override
    public int compareTo(RowPosition o) {
        int cmp = Long.compare(micros, o.micros);
        if (cmp != 0) return cmp;
        cmp = Long.compareUnsigned(id.getMostSignificantBits(), o.id.getMostSignificantBits());
        if (cmp != 0) return cmp;
        return Long.compareUnsigned(id.getLeastSignificantBits(), o.id.getLeastSignificantBits());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RowPosition)) return false;
        RowPosition other = (RowPosition) o;
        return micros == other.micros && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(micros) * 31 + id.hashCode();
    }

    @Override
    public String toString() {
        return micros + "/" + id;
    }
}
