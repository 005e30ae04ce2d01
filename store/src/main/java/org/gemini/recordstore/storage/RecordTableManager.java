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

import org.gemini.recordstore.DuplicateRecordException;
import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordCursor;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.views.RecordView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Encapsulates code for storing and retrieving the rows of one record table and maintaining the views over it.
 * Is the only class that talks to BackingStore.
 */
public class RecordTableManager {
    private static final Logger logger = LoggerFactory.getLogger(RecordTableManager.class);

    private final TableLayout layout;
    private final BackingStore backingStore;

    public RecordTableManager(RecordKind kind, List<RecordView<?>> views, BackingStore backingStore) {
        for (RecordView<?> view : views) {
            if (view.getKind() != kind) {
                throw new IllegalArgumentException("view " + view.getName() + " is not over " + kind.getTableName());
            }
        }
        this.layout = new TableLayout(kind, views);
        this.backingStore = backingStore;
    }

    public RecordKind getKind() {
        return layout.kind;
    }

    public List<RecordView<?>> getViews() {
        return layout.views;
    }

    public void insert(Record record) throws DuplicateRecordException, BackingStoreException {
        backingStore.insertRecord(layout, record);
    }

    public Record get(UUID id) throws BackingStoreException {
        return backingStore.getRecord(layout, id);
    }

    /** Id of the stored record sharing probe's natural key, or null */
    public UUID findIdByNaturalKey(Record probe) throws BackingStoreException {
        return backingStore.getIdByNaturalKey(layout, layout.naturalKey(probe));
    }

    public Record update(UUID id, UnaryOperator<Record> patch) throws BackingStoreException {
        return backingStore.updateRecord(layout, id, patch);
    }

    public Record delete(UUID id) throws BackingStoreException {
        return backingStore.deleteRecord(layout, id);
    }

    public RecordCursor scan(long fromMicros, long toMicros, ScanPredicate predicate) throws BackingStoreException {
        return backingStore.scan(layout, fromMicros, toMicros, predicate);
    }

    public long getNumRecords() throws BackingStoreException {
        return backingStore.getNumRecords(layout);
    }

    public Map<ByteBuffer, byte[]> getViewState(RecordView<?> view) throws BackingStoreException {
        return backingStore.getViewState(view);
    }

    /**
     * Recompute a view from the table's current rows. Caller must block writers to this table for the duration,
     * otherwise deltas committed during the scan are lost.
     */
    public <A> void rebuildView(RecordView<A> view) throws BackingStoreException {
        Map<ByteBuffer, A> groups = new HashMap<>();
        long ct = 0;
        try (RecordCursor cursor = scan(Long.MIN_VALUE, Long.MAX_VALUE, ScanPredicate.all())) {
            while (cursor.hasNext()) {
                Record record = cursor.next();
                ByteBuffer key = ByteBuffer.wrap(view.getGroupKey(record));
                A aggr = groups.get(key);
                groups.put(key, view.insert(aggr == null ? view.createEmpty() : aggr, record));
                ++ct;
            }
        } catch (RuntimeException e) {
            if (e.getCause() instanceof BackingStoreException) {
                throw (BackingStoreException) e.getCause();
            } else {
                throw e;
            }
        }
        Map<ByteBuffer, byte[]> state = new HashMap<>();
        for (Map.Entry<ByteBuffer, A> entry : groups.entrySet()) {
            state.put(entry.getKey(), view.serialize(entry.getValue()));
        }
        backingStore.replaceViewState(view, state);
        logger.info("rebuilt view {} from {} records into {} groups", view.getName(), ct, state.size());
    }
}
