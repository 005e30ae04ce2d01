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
package org.gemini.recordstore.files;

import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.RecordNotFoundException;
import org.gemini.recordstore.RecordStore;
import org.gemini.recordstore.config.SeedData;
import org.gemini.recordstore.storage.BackingStoreException;

import java.net.URL;
import java.time.Duration;
import java.util.UUID;

/**
 * Resolves a record's file pointer to a short-lived download URL against object storage. Callers redirect clients to
 * the URL; file bytes never pass through the record store.
 */
public class RecordFileService {
    private final RecordStore store;
    private final ObjectStorage objectStorage;
    private final SeedData seedData;
    private final Duration expiry;

    public RecordFileService(RecordStore store, ObjectStorage objectStorage, SeedData seedData, Duration expiry) {
        if (expiry.isNegative() || expiry.isZero()) {
            throw new IllegalArgumentException("download URL expiry must be positive");
        }
        this.store = store;
        this.objectStorage = objectStorage;
        this.seedData = seedData;
        this.expiry = expiry;
    }

    /**
     * @throws RecordNotFoundException if the record does not exist or has no record_file
     */
    public URL downloadUrl(RecordKind kind, UUID id) throws RecordNotFoundException, BackingStoreException {
        Record record = store.get(kind, id);
        if (record.getRecordFile() == null) {
            throw new RecordNotFoundException(kind.getEntityName() + " record " + id + " has no record_file");
        }
        RecordFile file = RecordFile.parse(record.getRecordFile(), objectStorage.getDefaultBucket());
        return objectStorage.presignedDownloadUrl(file, expiry, seedData.getContentType(file.getKey()));
    }
}
