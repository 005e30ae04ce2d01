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

import java.util.UUID;

/** Natural key collision on insert. Callers may treat this as "already applied". */
public class DuplicateRecordException extends RecordStoreException {
    private final RecordKind kind;
    private final UUID existingId;

    public DuplicateRecordException(RecordKind kind, UUID existingId) {
        super(String.format("duplicate %s record: natural key already taken by %s", kind.getEntityName(), existingId));
        this.kind = kind;
        this.existingId = existingId;
    }

    public RecordKind getKind() {
        return kind;
    }

    /** id of the record that already holds the natural key */
    public UUID getExistingId() {
        return existingId;
    }
}
