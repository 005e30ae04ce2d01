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
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Durable backing store on a RocksDB TransactionDB. Key layout:
 * <pre>
 *   'C' kind column timestamp id  -> cell        one key per column per row, so rows sort by (timestamp, id)
 *   'I' kind id                   -> timestamp   locates a row by id
 *   'N' kind natural-key          -> id          uniqueness index
 *   'V' view group-key            -> aggregate   incremental views
 * </pre>
 * Every write runs in a pessimistic transaction that locks the natural key (insert) or the id entry (update, delete)
 * and then every view group it touches, so concurrent writers never lose view deltas. Scans read a snapshot.
 */
public class RocksDBBackingStore extends BackingStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksDBBackingStore.class);

    private static final byte CELL = 'C', ID = 'I', NATURAL_KEY = 'N', VIEW = 'V';
    private static final int CELL_KEY_SIZE = 27;

    private final TransactionDB rocksDB;
    private final Options rocksDBOptions;
    private final TransactionDBOptions transactionDBOptions;
    private final WriteOptions rocksDBWriteOptions;
    private final ReadOptions rocksDBReadOptions;
    private final Cache blockCache;
    private final int insertLockRetries;

    static {
        RocksDB.loadLibrary();
    }

    /**
     * @param rocksPath  on-disk path
     * @param blockCacheBytes  size of the shared block cache
     * @param lockTimeoutMs  how long a transaction waits for a row, natural-key or view-group lock
     * @param insertLockRetries  how many times an insert retries after timing out on its natural-key lock
     * @throws BackingStoreException  wrapping RocksDBException
     */
    public RocksDBBackingStore(String rocksPath, long blockCacheBytes, long lockTimeoutMs, int insertLockRetries)
            throws BackingStoreException {
        this.insertLockRetries = insertLockRetries;
        blockCache = new LRUCache(blockCacheBytes);
        rocksDBOptions = new Options()
                .setCreateIfMissing(true)
                .setAllowConcurrentMemtableWrite(true)
                .setTableFormatConfig(new BlockBasedTableConfig()
                        .setBlockSize(16L * 1024)
                        .setBlockCache(blockCache)
                        .setCacheIndexAndFilterBlocks(true))
                .setMaxOpenFiles(-1);
        transactionDBOptions = new TransactionDBOptions()
                .setTransactionLockTimeout(lockTimeoutMs);
        rocksDBWriteOptions = new WriteOptions();
        rocksDBReadOptions = new ReadOptions();
        try {
            rocksDB = TransactionDB.open(rocksDBOptions, transactionDBOptions, rocksPath);
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    private static byte[] getCellKey(RecordKind kind, Column column, long micros, UUID id) {
        byte[] key = new byte[CELL_KEY_SIZE];
        key[0] = CELL;
        key[1] = kind.getCode();
        key[2] = column.getCode();
        Utilities.orderedLongToByteArray(micros, key, 3);
        Utilities.uuidToByteArray(id, key, 11);
        return key;
    }

    private static long getMicrosFromCellKey(byte[] key) {
        return Utilities.orderedByteArrayToLong(key, 3);
    }

    private static UUID getIdFromCellKey(byte[] key) {
        return Utilities.byteArrayToUUID(key, 11);
    }

    private static boolean isCellOf(byte[] key, RecordKind kind, Column column) {
        return key.length == CELL_KEY_SIZE && key[0] == CELL && key[1] == kind.getCode() && key[2] == column.getCode();
    }

    /** true if two cell keys address the same row */
    private static boolean isSameRow(byte[] a, byte[] b) {
        if (a.length != CELL_KEY_SIZE || b.length != CELL_KEY_SIZE || a[1] != b[1]) return false;
        for (int i = 3; i < CELL_KEY_SIZE; ++i) {
            if (a[i] != b[i]) return false;
        }
        return true;
    }

    private static byte[] getIdKey(RecordKind kind, UUID id) {
        byte[] key = new byte[18];
        key[0] = ID;
        key[1] = kind.getCode();
        Utilities.uuidToByteArray(id, key, 2);
        return key;
    }

    private static byte[] getNaturalKey(RecordKind kind, byte[] naturalKey) {
        byte[] key = new byte[2 + naturalKey.length];
        key[0] = NATURAL_KEY;
        key[1] = kind.getCode();
        System.arraycopy(naturalKey, 0, key, 2, naturalKey.length);
        return key;
    }

    private static byte[] getViewKey(RecordView<?> view, byte[] groupKey) {
        byte[] key = new byte[2 + groupKey.length];
        key[0] = VIEW;
        key[1] = view.getCode();
        System.arraycopy(groupKey, 0, key, 2, groupKey.length);
        return key;
    }

    private static byte[] encodeMicros(long micros) {
        byte[] bytes = new byte[8];
        Utilities.longToByteArray(micros, bytes, 0);
        return bytes;
    }

    private static byte[] encodeId(UUID id) {
        byte[] bytes = new byte[16];
        Utilities.uuidToByteArray(id, bytes, 0);
        return bytes;
    }

    private static boolean isLockContention(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) return false;
        Status.Code code = status.getCode();
        return code == Status.Code.TimedOut || code == Status.Code.Busy || code == Status.Code.TryAgain;
    }

    @Override
    void insertRecord(TableLayout layout, Record record) throws DuplicateRecordException, BackingStoreException {
        RecordKind kind = layout.kind;
        byte[] naturalKey = getNaturalKey(kind, layout.naturalKey(record));
        long micros = Utilities.toEpochMicros(record.getTimestamp());
        for (int attempt = 0; ; ++attempt) {
            // closing an uncommitted transaction rolls it back
            try (Transaction txn = rocksDB.beginTransaction(rocksDBWriteOptions)) {
                byte[] existing;
                try {
                    existing = txn.getForUpdate(rocksDBReadOptions, naturalKey, true);
                } catch (RocksDBException e) {
                    if (isLockContention(e) && attempt < insertLockRetries) {
                        logger.warn("natural key of {} record {} is locked, retrying ({}/{})",
                                kind.getEntityName(), record.getId(), attempt + 1, insertLockRetries);
                        continue;
                    }
                    throw new BackingStoreException("could not lock natural key of " + record.getId(), e);
                }
                if (existing != null) {
                    throw new DuplicateRecordException(kind, Utilities.byteArrayToUUID(existing, 0));
                }
                txn.put(naturalKey, encodeId(record.getId()));
                txn.put(getIdKey(kind, record.getId()), encodeMicros(micros));
                for (Column column : layout.columns) {
                    txn.put(getCellKey(kind, column, micros, record.getId()), layout.serde.encodeCell(column, record));
                }
                for (RecordView<?> view : layout.views) {
                    applyInsert(txn, view, record);
                }
                txn.commit();
                return;
            } catch (RocksDBException e) {
                throw new BackingStoreException(e);
            }
        }
    }

    private void applyInsert(Transaction txn, RecordView<?> view, Record record) throws RocksDBException {
        byte[] key = getViewKey(view, view.getGroupKey(record));
        byte[] stored = txn.getForUpdate(rocksDBReadOptions, key, true);
        txn.put(key, TableLayout.viewInsert(view, stored, record));
    }

    private void applyRemove(Transaction txn, RecordView<?> view, Record record) throws RocksDBException {
        byte[] key = getViewKey(view, view.getGroupKey(record));
        byte[] stored = txn.getForUpdate(rocksDBReadOptions, key, true);
        byte[] updated = TableLayout.viewRemove(view, stored, record);
        if (updated == null) {
            txn.delete(key);
        } else {
            txn.put(key, updated);
        }
    }

    private List<byte[]> getCellKeys(TableLayout layout, long micros, UUID id) {
        List<byte[]> keys = new ArrayList<>(layout.columns.size());
        for (Column column : layout.columns) {
            keys.add(getCellKey(layout.kind, column, micros, id));
        }
        return keys;
    }

    private Record decodeRow(TableLayout layout, UUID id, long micros, List<byte[]> cells)
            throws BackingStoreException {
        byte[][] cellArray = new byte[cells.size()][];
        for (int i = 0; i < cellArray.length; ++i) {
            cellArray[i] = cells.get(i);
            if (cellArray[i] == null) {
                throw new BackingStoreException("record " + id + " is missing its " + layout.columns.get(i) + " cell");
            }
        }
        return layout.serde.decodeRow(id, micros, cellArray);
    }

    @Override
    Record getRecord(TableLayout layout, UUID id) throws BackingStoreException {
        Snapshot snapshot = rocksDB.getSnapshot();
        try (ReadOptions options = new ReadOptions().setSnapshot(snapshot)) {
            byte[] micros = rocksDB.get(options, getIdKey(layout.kind, id));
            if (micros == null) return null;
            long ts = Utilities.byteArrayToLong(micros, 0);
            return decodeRow(layout, id, ts, rocksDB.multiGetAsList(options, getCellKeys(layout, ts, id)));
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        } finally {
            rocksDB.releaseSnapshot(snapshot);
        }
    }

    @Override
    UUID getIdByNaturalKey(TableLayout layout, byte[] naturalKey) throws BackingStoreException {
        try {
            byte[] id = rocksDB.get(rocksDBReadOptions, getNaturalKey(layout.kind, naturalKey));
            return id == null ? null : Utilities.byteArrayToUUID(id, 0);
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    /** Lock the row's id entry and read the row inside txn. Returns null if there is no such row. */
    private Record lockRow(Transaction txn, TableLayout layout, UUID id) throws RocksDBException, BackingStoreException {
        byte[] micros = txn.getForUpdate(rocksDBReadOptions, getIdKey(layout.kind, id), true);
        if (micros == null) return null;
        long ts = Utilities.byteArrayToLong(micros, 0);
        List<byte[]> cells = new ArrayList<>(layout.columns.size());
        for (byte[] key : getCellKeys(layout, ts, id)) {
            cells.add(txn.get(rocksDBReadOptions, key));
        }
        return decodeRow(layout, id, ts, cells);
    }

    @Override
    Record updateRecord(TableLayout layout, UUID id, UnaryOperator<Record> patch) throws BackingStoreException {
        try (Transaction txn = rocksDB.beginTransaction(rocksDBWriteOptions)) {
            Record old = lockRow(txn, layout, id);
            if (old == null) return null;
            Record updated = patch.apply(old);
            long micros = Utilities.toEpochMicros(old.getTimestamp());
            for (Column column : layout.columns) {
                txn.put(getCellKey(layout.kind, column, micros, id), layout.serde.encodeCell(column, updated));
            }
            for (RecordView<?> view : layout.views) {
                applyRemove(txn, view, old);
                applyInsert(txn, view, updated);
            }
            txn.commit();
            return updated;
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    @Override
    Record deleteRecord(TableLayout layout, UUID id) throws BackingStoreException {
        try (Transaction txn = rocksDB.beginTransaction(rocksDBWriteOptions)) {
            Record old = lockRow(txn, layout, id);
            if (old == null) return null;
            for (byte[] key : getCellKeys(layout, Utilities.toEpochMicros(old.getTimestamp()), id)) {
                txn.delete(key);
            }
            txn.delete(getIdKey(layout.kind, id));
            txn.delete(getNaturalKey(layout.kind, layout.naturalKey(old)));
            for (RecordView<?> view : layout.views) {
                applyRemove(txn, view, old);
            }
            txn.commit();
            return old;
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    /**
     * Walks one iterator per column in lockstep over a snapshot. Name cells the predicate constrains are checked
     * before anything else in the row is decoded.
     */
    private class ColumnarCursor implements RecordCursor {
        private final TableLayout layout;
        private final long toMicros;
        private final ScanPredicate predicate;
        private final Snapshot snapshot;
        private final ReadOptions options;
        private final RocksIterator[] iterators;
        private final int[] constrained;

        private Record next = null;
        private boolean closed = false;

        private ColumnarCursor(TableLayout layout, long fromMicros, long toMicros, ScanPredicate predicate) {
            this.layout = layout;
            this.toMicros = toMicros;
            this.predicate = predicate;
            snapshot = rocksDB.getSnapshot();
            options = new ReadOptions().setSnapshot(snapshot);
            iterators = new RocksIterator[layout.columns.size()];
            List<Integer> constrainedList = new ArrayList<>();
            for (int i = 0; i < iterators.length; ++i) {
                Column column = layout.columns.get(i);
                iterators[i] = rocksDB.newIterator(options);
                iterators[i].seek(getCellKey(layout.kind, column, fromMicros, RowPosition.MIN_ID));
                if (predicate.getConstrainedColumns().contains(column)) {
                    constrainedList.add(i);
                }
            }
            constrained = constrainedList.stream().mapToInt(Integer::intValue).toArray();
            advance();
        }

        private void advance() {
            next = null;
            while (!closed && next == null) {
                RocksIterator lead = iterators[0];
                if (!lead.isValid()) {
                    checkStatus(lead);
                    close();
                    return;
                }
                byte[] key = lead.key();
                if (!isCellOf(key, layout.kind, layout.columns.get(0)) || getMicrosFromCellKey(key) >= toMicros) {
                    close();
                    return;
                }
                next = readRow(key);
                for (RocksIterator iterator : iterators) {
                    iterator.next();
                }
            }
        }

        private Record readRow(byte[] leadKey) {
            for (int i = 1; i < iterators.length; ++i) {
                if (!iterators[i].isValid() || !isSameRow(leadKey, iterators[i].key())) {
                    close();
                    throw new RuntimeException(new BackingStoreException(
                            layout.columns.get(i) + " column misaligned at row " + getIdFromCellKey(leadKey)));
                }
            }
            for (int i : constrained) {
                if (!predicate.acceptsName(layout.columns.get(i), SerDe.decodeString(iterators[i].value()))) {
                    return null;
                }
            }
            byte[][] cells = new byte[iterators.length][];
            for (int i = 0; i < cells.length; ++i) {
                cells[i] = iterators[i].value();
            }
            Record record = layout.serde.decodeRow(getIdFromCellKey(leadKey), getMicrosFromCellKey(leadKey), cells);
            return predicate.testResidual(record) ? record : null;
        }

        private void checkStatus(RocksIterator iterator) {
            try {
                iterator.status();
            } catch (RocksDBException e) {
                close();
                throw new RuntimeException(new BackingStoreException(e));
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

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            next = null;
            for (RocksIterator iterator : iterators) {
                if (iterator != null) iterator.close();
            }
            options.close();
            rocksDB.releaseSnapshot(snapshot);
        }
    }

    @Override
    RecordCursor scan(TableLayout layout, long fromMicros, long toMicros, ScanPredicate predicate) {
        return new ColumnarCursor(layout, fromMicros, toMicros, predicate);
    }

    @Override
    long getNumRecords(TableLayout layout) {
        byte[] prefix = {ID, layout.kind.getCode()};
        try (RocksIterator iter = rocksDB.newIterator()) {
            long ct = 0;
            for (iter.seek(prefix); iter.isValid() && Utilities.hasPrefix(iter.key(), prefix); iter.next()) {
                ++ct;
            }
            return ct;
        }
    }

    @Override
    Map<ByteBuffer, byte[]> getViewState(RecordView<?> view) {
        byte[] prefix = {VIEW, view.getCode()};
        Map<ByteBuffer, byte[]> state = new HashMap<>();
        try (RocksIterator iter = rocksDB.newIterator()) {
            for (iter.seek(prefix); iter.isValid() && Utilities.hasPrefix(iter.key(), prefix); iter.next()) {
                byte[] key = iter.key();
                byte[] groupKey = new byte[key.length - prefix.length];
                System.arraycopy(key, prefix.length, groupKey, 0, groupKey.length);
                state.put(ByteBuffer.wrap(groupKey), iter.value());
            }
        }
        return state;
    }

    @Override
    void replaceViewState(RecordView<?> view, Map<ByteBuffer, byte[]> state) throws BackingStoreException {
        byte[] prefix = {VIEW, view.getCode()};
        try (Transaction txn = rocksDB.beginTransaction(rocksDBWriteOptions);
             RocksIterator iter = txn.getIterator(rocksDBReadOptions)) {
            for (iter.seek(prefix); iter.isValid() && Utilities.hasPrefix(iter.key(), prefix); iter.next()) {
                txn.delete(iter.key());
            }
            for (Map.Entry<ByteBuffer, byte[]> entry : state.entrySet()) {
                txn.put(getViewKey(view, entry.getKey().array()), entry.getValue());
            }
            txn.commit();
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    @Override
    public void close() throws BackingStoreException {
        if (rocksDB != null) rocksDB.close();
        rocksDBReadOptions.close();
        rocksDBWriteOptions.close();
        transactionDBOptions.close();
        rocksDBOptions.close();
        blockCache.close();
        logger.info("rocksDB closed");
    }
}
