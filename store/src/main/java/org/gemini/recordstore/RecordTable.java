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

import org.gemini.recordstore.resolve.DimensionResolver;
import org.gemini.recordstore.resolve.ResolvedDimensions;
import org.gemini.recordstore.storage.BackingStoreException;
import org.gemini.recordstore.storage.RecordTableManager;
import org.gemini.recordstore.views.RecordView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** One record table. This class has the outermost level of the logic for all record API calls. */
class RecordTable {
    private static final Logger logger = LoggerFactory.getLogger(RecordTable.class);

    final RecordKind kind;
    final RecordTableManager manager;
    private final DimensionResolver resolver;
    private final Clock clock;

    /**
     * Writers share this lock, so inserts, updates and deletes run concurrently with each other. View rebuilds take it
     * exclusively so that no delta lands between the rebuild scan and the view replacement.
     */
    private final ReadWriteLock rebuildLock = new ReentrantReadWriteLock();

    RecordTable(RecordTableManager manager, DimensionResolver resolver, Clock clock) {
        this.kind = manager.getKind();
        this.manager = manager;
        this.resolver = resolver;
        this.clock = clock;
    }

    UUID insert(RecordRequest request) throws RecordStoreException, BackingStoreException {
        validate(request);
        Record record = toRecord(request, UUID.randomUUID());
        rebuildLock.readLock().lock();
        try {
            manager.insert(record);
        } finally {
            rebuildLock.readLock().unlock();
        }
        logger.debug("inserted {} record {} at {}", kind.getEntityName(), record.getId(), record.getTimestamp());
        return record.getId();
    }

    /** Look up by natural key. The request must carry a timestamp. */
    Optional<Record> find(RecordRequest request) throws RecordStoreException, BackingStoreException {
        if (request.getTimestamp() == null) {
            throw new InvalidRecordException("timestamp is required to look up a record by natural key");
        }
        UUID id = manager.findIdByNaturalKey(toRecord(request, UUID.randomUUID()));
        return id == null ? Optional.empty() : Optional.ofNullable(manager.get(id));
    }

    Record get(UUID id) throws RecordNotFoundException, BackingStoreException {
        Record record = manager.get(id);
        if (record == null) {
            throw notFound(id);
        }
        return record;
    }

    Record update(UUID id, RecordPatch patch) throws RecordStoreException, BackingStoreException {
        patch.validateFor(kind);
        RecordPatch canonical = patch.canonicalFor(kind);
        Record updated;
        rebuildLock.readLock().lock();
        try {
            updated = manager.update(id, canonical::applyTo);
        } finally {
            rebuildLock.readLock().unlock();
        }
        if (updated == null) {
            throw notFound(id);
        }
        return updated;
    }

    void delete(UUID id) throws RecordNotFoundException, BackingStoreException {
        Record deleted;
        rebuildLock.readLock().lock();
        try {
            deleted = manager.delete(id);
        } finally {
            rebuildLock.readLock().unlock();
        }
        if (deleted == null) {
            throw notFound(id);
        }
        logger.debug("deleted {} record {}", kind.getEntityName(), id);
    }

    RecordCursor filter(RecordFilter filter) throws InvalidFilterException, BackingStoreException {
        FilterEngine.CompiledFilter compiled = FilterEngine.compile(kind, filter);
        logger.debug("filtering {} with {}", kind.getTableName(), compiled.getPredicate());
        return manager.scan(compiled.getFromMicros(), compiled.getToMicros(), compiled.getPredicate());
    }

    void rebuildViews() throws BackingStoreException {
        rebuildLock.writeLock().lock();
        try {
            for (RecordView<?> view : manager.getViews()) {
                manager.rebuildView(view);
            }
        } finally {
            rebuildLock.writeLock().unlock();
        }
    }

    private RecordNotFoundException notFound(UUID id) {
        return new RecordNotFoundException("no " + kind.getEntityName() + " record with id " + id);
    }

    private void validate(RecordRequest request) throws InvalidRecordException {
        if (request.getDatasetName() == null) {
            throw new InvalidRecordException("dataset_name is required");
        }
        if (kind.hasSeparateEntity() && request.getEntityName() == null) {
            throw new InvalidRecordException(kind.getEntityNameField() + " is required");
        }
        if (kind.getPayloadShape() == RecordKind.PayloadShape.SCALAR) {
            if (request.getData() != null) {
                throw new InvalidRecordException(kind.getTableName() + " carry a scalar " + kind.getPayloadField());
            }
            if (request.getValue() == null) {
                throw new InvalidRecordException(kind.getPayloadField() + " is required");
            }
        } else {
            if (request.getValue() != null) {
                throw new InvalidRecordException(kind.getTableName() + " carry a map " + kind.getPayloadField());
            }
            boolean hasData = request.getData() != null && !request.getData().isEmpty();
            if (!hasData && request.getRecordFile() == null) {
                throw new InvalidRecordException("either " + kind.getPayloadField() + " or record_file is required");
            }
        }
        if (!kind.hasRecordFile() && request.getRecordFile() != null) {
            throw new InvalidRecordException(kind.getTableName() + " do not carry a record_file");
        }
    }

    /** Resolve names and apply defaults: timestamp now, collection date today in the clock's zone */
    private Record toRecord(RecordRequest request, UUID id) throws RecordStoreException {
        ResolvedDimensions dimensions = resolver.resolve(kind, request);
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        LocalDate collectionDate = request.getCollectionDate() != null
                ? request.getCollectionDate()
                : LocalDate.now(clock);
        return dimensions.stamp(Record.builder(kind))
                .id(id)
                .timestamp(Utilities.truncateToMicros(timestamp))
                .collectionDate(collectionDate)
                .data(JsonPayloads.canonical(kind.getPayloadField(), request.getData()))
                .value(request.getValue())
                .recordFile(request.getRecordFile())
                .recordInfo(JsonPayloads.canonical("record_info", request.getRecordInfo()))
                .build();
    }
}
