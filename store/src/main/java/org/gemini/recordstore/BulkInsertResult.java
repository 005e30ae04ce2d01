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

import java.util.Collections;
import java.util.List;
import java.util.UUID;

/** Outcome of a bulk insert: ids of inserted records in request order, and how many requests were duplicates */
public class BulkInsertResult {
    private final List<UUID> insertedIds;
    private final int duplicates;

    BulkInsertResult(List<UUID> insertedIds, int duplicates) {
        this.insertedIds = Collections.unmodifiableList(insertedIds);
        this.duplicates = duplicates;
    }

    public List<UUID> getInsertedIds() {
        return insertedIds;
    }

    public int getNumInserted() {
        return insertedIds.size();
    }

    public int getNumDuplicates() {
        return duplicates;
    }

    @Override
    public String toString() {
        return insertedIds.size() + " inserted, " + duplicates + " duplicates skipped";
    }
}
