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

import org.gemini.recordstore.resolve.Association;
import org.gemini.recordstore.resolve.DimensionResolver;
import org.gemini.recordstore.resolve.EntityCatalog;
import org.gemini.recordstore.storage.BackingStore;
import org.gemini.recordstore.storage.BackingStoreException;
import org.gemini.recordstore.storage.MainMemoryBackingStore;
import org.gemini.recordstore.storage.RecordTableManager;
import org.gemini.recordstore.storage.RocksDBBackingStore;
import org.gemini.recordstore.views.AssociationView;
import org.gemini.recordstore.views.RecordSummaryView;
import org.gemini.recordstore.views.RecordView;
import org.gemini.recordstore.views.SummaryGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Start here. Most external code will only construct and interact with an instance of this class.
 *
 * <p>Holds one table per record kind. All calls are safe for concurrent use; writers to the same table proceed in
 * parallel and only conflict on the natural key or view group they touch. This class forwards record calls to
 * RecordTable.</p>
 */
public class RecordStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RecordStore.class);

    private final BackingStore backingStore;
    private final String directory;
    private final DimensionResolver resolver;
    private final Map<RecordKind, RecordTable> tables = new EnumMap<>(RecordKind.class);
    private final Map<RecordKind, RecordSummaryView> summaryViews = new EnumMap<>(RecordKind.class);
    private final Map<Association, AssociationView> associationViews = new EnumMap<>(Association.class);

    public static class StoreOptions implements Serializable {
        private Clock clock = Clock.systemUTC();
        private long lockTimeoutMs = 1000;
        private int insertLockRetries = 3;
        private long blockCacheBytes = 256L * 1024 * 1024;

        /**
         * Source of the timestamp default (now) and the collection date default (today in the clock's zone).
         * Default system UTC clock.
         */
        public StoreOptions setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** How long a RocksDB write waits for a natural-key, row or view-group lock. Default 1000 ms. */
        public StoreOptions setLockTimeoutMs(long lockTimeoutMs) {
            if (lockTimeoutMs <= 0) {
                throw new IllegalArgumentException("lock timeout must be > 0");
            }
            this.lockTimeoutMs = lockTimeoutMs;
            return this;
        }

        /**
         * How many times an insert retries after timing out on its natural-key lock. View maintenance is never
         * retried. Default 3.
         */
        public StoreOptions setInsertLockRetries(int insertLockRetries) {
            if (insertLockRetries < 0) {
                throw new IllegalArgumentException("insert lock retries must be >= 0");
            }
            this.insertLockRetries = insertLockRetries;
            return this;
        }

        /** Size of the RocksDB block cache. Default 256 MB. */
        public StoreOptions setBlockCacheBytes(long blockCacheBytes) {
            this.blockCacheBytes = blockCacheBytes;
            return this;
        }

        public Clock getClock() {
            return clock;
        }

        public long getLockTimeoutMs() {
            return lockTimeoutMs;
        }

        public int getInsertLockRetries() {
            return insertLockRetries;
        }

        public long getBlockCacheBytes() {
            return blockCacheBytes;
        }
    }

    /**
     * @param directory  Directory to store all record tables in. Set to null to use transient in-memory store
     * @param catalog  entity services used to resolve names on insert
     */
    public RecordStore(String directory, EntityCatalog catalog, StoreOptions storeOptions)
            throws BackingStoreException {
        if (directory != null) {
            File dir = new File(directory);
            if (!dir.exists() && !dir.mkdirs()) {
                throw new BackingStoreException("could not create directory " + directory);
            }
            this.backingStore = new RocksDBBackingStore(directory + "/rocksdb", storeOptions.blockCacheBytes,
                    storeOptions.lockTimeoutMs, storeOptions.insertLockRetries);
        } else {
            this.backingStore = new MainMemoryBackingStore();
        }
        this.directory = directory;
        this.resolver = new DimensionResolver(catalog);
        for (RecordKind kind : RecordKind.values()) {
            List<RecordView<?>> views = new ArrayList<>();
            if (kind == RecordKind.SENSOR || kind == RecordKind.TRAIT) {
                RecordSummaryView summary = new RecordSummaryView(kind);
                summaryViews.put(kind, summary);
                views.add(summary);
            }
            RecordTableManager manager = new RecordTableManager(kind, views, backingStore);
            tables.put(kind, new RecordTable(manager, resolver, storeOptions.clock));
        }
        for (Association association : Association.values()) {
            associationViews.put(association, new AssociationView(association, catalog));
        }
        logger.info("opened record store at {}", directory != null ? directory : "<memory>");
    }

    /**
     * Open a RecordStore instance with default options.
     *
     * @param directory  Directory to store all record tables in. Set to null to use transient in-memory store
     */
    public RecordStore(String directory, EntityCatalog catalog) throws BackingStoreException {
        this(directory, catalog, new StoreOptions());
    }

    private RecordTable getTable(RecordKind kind) {
        return tables.get(kind);
    }

    public DimensionResolver getResolver() {
        return resolver;
    }

    /**
     * Insert a record, applying defaults and resolving its names.
     *
     * @return the generated id
     * @throws DuplicateRecordException if a record with the same natural key exists
     * @throws UnknownEntityException if a referenced name does not resolve
     * @throws InvalidRecordException if required fields are missing
     */
    public UUID insert(RecordKind kind, RecordRequest request) throws RecordStoreException, BackingStoreException {
        return getTable(kind).insert(request);
    }

    /**
     * Insert records one by one, each in its own transaction. Duplicates are skipped and counted; any other failure
     * stops the batch and propagates, leaving earlier records inserted.
     */
    public BulkInsertResult insertAll(RecordKind kind, Iterable<RecordRequest> requests)
            throws RecordStoreException, BackingStoreException {
        RecordTable table = getTable(kind);
        List<UUID> ids = new ArrayList<>();
        int duplicates = 0;
        for (RecordRequest request : requests) {
            try {
                ids.add(table.insert(request));
            } catch (DuplicateRecordException e) {
                ++duplicates;
            }
        }
        BulkInsertResult result = new BulkInsertResult(ids, duplicates);
        logger.debug("bulk insert into {}: {}", kind.getTableName(), result);
        return result;
    }

    public Record get(RecordKind kind, UUID id) throws RecordNotFoundException, BackingStoreException {
        return getTable(kind).get(id);
    }

    /** Look up a record by the natural key the request resolves to. The request must carry a timestamp. */
    public Optional<Record> find(RecordKind kind, RecordRequest request)
            throws RecordStoreException, BackingStoreException {
        return getTable(kind).find(request);
    }

    /** Shallow-merge the patch into the record's payload and record_info. Dimensional fields are untouched. */
    public Record update(RecordKind kind, UUID id, RecordPatch patch)
            throws RecordStoreException, BackingStoreException {
        return getTable(kind).update(id, patch);
    }

    /** Hard delete. Deleting a missing (or already deleted) record throws RecordNotFoundException. */
    public void delete(RecordKind kind, UUID id) throws RecordNotFoundException, BackingStoreException {
        getTable(kind).delete(id);
    }

    /**
     * Lazily evaluated records matching the filter, in timestamp order with ties broken by id. The cursor must be
     * closed.
     */
    public RecordCursor filter(RecordKind kind, RecordFilter filter)
            throws InvalidFilterException, BackingStoreException {
        return getTable(kind).filter(filter);
    }

    public long getNumRecords(RecordKind kind) throws BackingStoreException {
        return getTable(kind).manager.getNumRecords();
    }

    public boolean hasSummaryView(RecordKind kind) {
        return summaryViews.containsKey(kind);
    }

    /** Current contents of the kind's summary view, sorted by entity, dataset, experiment, season and site name */
    public List<SummaryGroup> getSummary(RecordKind kind) throws BackingStoreException {
        RecordSummaryView view = summaryViews.get(kind);
        if (view == null) {
            throw new IllegalArgumentException(kind.getTableName() + " have no summary view");
        }
        List<SummaryGroup> groups = new ArrayList<>();
        for (Map.Entry<ByteBuffer, byte[]> entry : getTable(kind).manager.getViewState(view).entrySet()) {
            groups.add(view.decodeGroup(entry.getKey().array(), entry.getValue()));
        }
        groups.sort(GROUP_ORDER);
        return groups;
    }

    private static final Comparator<String> NAME_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<SummaryGroup> GROUP_ORDER = Comparator
            .comparing(SummaryGroup::getEntityName, NAME_ORDER)
            .thenComparing(SummaryGroup::getDatasetName, NAME_ORDER)
            .thenComparing(SummaryGroup::getExperimentName, NAME_ORDER)
            .thenComparing(SummaryGroup::getSeasonName, NAME_ORDER)
            .thenComparing(SummaryGroup::getSiteName, NAME_ORDER);

    /** Recompute the kind's incremental views from its table, clearing stale flags. Blocks writers to that table. */
    public void rebuildViews(RecordKind kind) throws BackingStoreException {
        getTable(kind).rebuildViews();
    }

    public AssociationView getAssociationView(Association association) {
        return associationViews.get(association);
    }

    /** Recompute every association view from the entity catalog */
    public void refreshAssociationViews() {
        for (AssociationView view : associationViews.values()) {
            view.refresh();
        }
        logger.info("refreshed {} association views", associationViews.size());
    }

    @Override
    public void close() throws BackingStoreException {
        backingStore.close();
        logger.info("closed record store at {}", directory != null ? directory : "<memory>");
    }
}
