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
import org.gemini.recordstore.Utilities;
import org.gemini.recordstore.views.RecordView;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.UnaryOperator;

/**
 * Transient backing store. Natural keys are claimed with putIfAbsent, so racing inserts resolve to exactly one
 * winner; view deltas are applied with per-group compute() and reverted if a later step fails.
 */
public class MainMemoryBackingStore extends BackingStore {
    private final Map<RecordKind, Table> tables = new ConcurrentHashMap<>();
    /** view code -> group key -> aggregate */
    private final Map<Byte, ConcurrentMap<ByteBuffer, byte[]>> views = new ConcurrentHashMap<>();
    /** serializes update and delete of the same row */
    private final Object[] rowLocks = new Object[64];

    public MainMemoryBackingStore() {
        for (int i = 0; i < rowLocks.length; ++i) {
            rowLocks[i] = new Object();
        }
    }

    private static class Table {
        final ConcurrentSkipListMap<RowPosition, Record> rows = new ConcurrentSkipListMap<>();
        final ConcurrentMap<UUID, RowPosition> positions = new ConcurrentHashMap<>();
        final ConcurrentMap<ByteBuffer, UUID> naturalKeys = new ConcurrentHashMap<>();
    }

    private Table table(RecordKind kind) {
        return tables.computeIfAbsent(kind, k -> new Table());
    }

    private ConcurrentMap<ByteBuffer, byte[]> viewGroups(RecordView<?> view) {
        return views.computeIfAbsent(view.getCode(), c -> new ConcurrentHashMap<>());
    }

    private Object rowLock(UUID id) {
        return rowLocks[Math.floorMod(id.hashCode(), rowLocks.length)];
    }

    @Override
    void insertRecord(TableLayout layout, Record record) throws DuplicateRecordException, BackingStoreException {
        Table table = table(layout.kind);
        ByteBuffer naturalKey = ByteBuffer.wrap(layout.naturalKey(record));
        UUID existing = table.naturalKeys.putIfAbsent(naturalKey, record.getId());
        if (existing != null) {
            throw new DuplicateRecordException(layout.kind, existing);
        }
        List<RecordView<?>> applied = new ArrayList<>();
        try {
            for (RecordView<?> view : layout.views) {
                applyInsert(view, record);
                applied.add(view);
            }
        } catch (RuntimeException e) {
            for (RecordView<?> view : applied) {
                applyRemove(view, record);
            }
            table.naturalKeys.remove(naturalKey, record.getId());
            throw new BackingStoreException("view maintenance failed on insert of " + record.getId(), e);
        }
        RowPosition position = new RowPosition(Utilities.toEpochMicros(record.getTimestamp()), record.getId());
        table.positions.put(record.getId(), position);
        table.rows.put(position, record);
    }

    private void applyInsert(RecordView<?> view, Record record) {
        viewGroups(view).compute(ByteBuffer.wrap(view.getGroupKey(record)),
                (k, stored) -> TableLayout.viewInsert(view, stored, record));
    }

    private void applyRemove(RecordView<?> view, Record record) {
        viewGroups(view).compute(ByteBuffer.wrap(view.getGroupKey(record)),
                (k, stored) -> TableLayout.viewRemove(view, stored, record));
    }

    @Override
    Record getRecord(TableLayout layout, UUID id) {
        Table table = table(layout.kind);
        RowPosition position = table.positions.get(id);
        return position == null ? null : table.rows.get(position);
    }

    @Override
    UUID getIdByNaturalKey(TableLayout layout, byte[] naturalKey) {
        UUID id = table(layout.kind).naturalKeys.get(ByteBuffer.wrap(naturalKey));
        // an insert claims its natural key before the row becomes visible
        return id != null && getRecord(layout, id) != null ? id : null;
    }

    @Override
    Record updateRecord(TableLayout layout, UUID id, UnaryOperator<Record> patch) throws BackingStoreException {
        Table table = table(layout.kind);
        synchronized (rowLock(id)) {
            RowPosition position = table.positions.get(id);
            if (position == null) return null;
            Record old = table.rows.get(position);
            Record updated = patch.apply(old);
            List<RecordView<?>> applied = new ArrayList<>();
            try {
                for (RecordView<?> view : layout.views) {
                    applyRemove(view, old);
                    applyInsert(view, updated);
                    applied.add(view);
                }
            } catch (RuntimeException e) {
                for (RecordView<?> view : applied) {
                    applyRemove(view, updated);
                    applyInsert(view, old);
                }
                throw new BackingStoreException("view maintenance failed on update of " + id, e);
            }
            table.rows.put(position, updated);
            return updated;
        }
    }

    @Override
    Record deleteRecord(TableLayout layout, UUID id) throws BackingStoreException {
        Table table = table(layout.kind);
        synchronized (rowLock(id)) {
            RowPosition position = table.positions.get(id);
            if (position == null) return null;
            Record old = table.rows.get(position);
            List<RecordView<?>> applied = new ArrayList<>();
            try {
                for (RecordView<?> view : layout.views) {
                    applyRemove(view, old);
                    applied.add(view);
                }
            } catch (RuntimeException e) {
                for (RecordView<?> view : applied) {
                    applyInsert(view, old);
                }
                throw new BackingStoreException("view maintenance failed on delete of " + id, e);
            }
            table.rows.remove(position);
            table.positions.remove(id);
            table.naturalKeys.remove(ByteBuffer.wrap(layout.naturalKey(old)), id);
            return old;
        }
    }

    @Override
    RecordCursor scan(TableLayout layout, long fromMicros, long toMicros, ScanPredicate predicate) {
        ConcurrentSkipListMap<RowPosition, Record> rows = table(layout.kind).rows;
        RowPosition from = new RowPosition(fromMicros, RowPosition.MIN_ID);
        NavigableMap<RowPosition, Record> range = toMicros == Long.MAX_VALUE
                ? rows.tailMap(from, true)
                : rows.subMap(from, true, new RowPosition(toMicros, RowPosition.MIN_ID), false);
        // skip-list iterators are weakly consistent and lazy: nothing is copied up front
        Iterator<Record> matching = new FilteringIterator(range.values().iterator(), predicate);
        return RecordCursor.of(matching, null);
    }

    private static class FilteringIterator implements Iterator<Record> {
        private final Iterator<Record> source;
        private final ScanPredicate predicate;
        private Record next;

        FilteringIterator(Iterator<Record> source, ScanPredicate predicate) {
            this.source = source;
            this.predicate = predicate;
            advance();
        }

        private void advance() {
            next = null;
            while (source.hasNext()) {
                Record candidate = source.next();
                if (predicate.test(candidate)) {
                    next = candidate;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Record next() {
            if (next == null) throw new NoSuchElementException();
            Record ret = next;
            advance();
            return ret;
        }
    }

    @Override
    long getNumRecords(TableLayout layout) {
        return table(layout.kind).positions.size();
    }

    @Override
    Map<ByteBuffer, byte[]> getViewState(RecordView<?> view) {
        return new HashMap<>(viewGroups(view));
    }

    @Override
    void replaceViewState(RecordView<?> view, Map<ByteBuffer, byte[]> state) {
        views.put(view.getCode(), new ConcurrentHashMap<>(state));
    }

    @Override
    public void close() {
        tables.clear();
        views.clear();
    }
}
