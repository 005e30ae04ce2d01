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
import org.gemini.recordstore.views.RecordView;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Underlying store holding the rows, natural-key indexes and view aggregates of all record tables. Every mutating
 * call is atomic: the row, its natural-key entry and the deltas of all views over the table are committed together
 * or not at all. Most code should not talk to BackingStore directly and should go through RecordTableManager instead.
 */
public abstract class BackingStore implements AutoCloseable {
    /**
     * Claim the record's natural key and append it.
     *
     * @throws DuplicateRecordException if another record already holds the natural key
     */
    abstract void insertRecord(TableLayout layout, Record record)
            throws DuplicateRecordException, BackingStoreException;

    /** Returns null if there is no such record */
    abstract Record getRecord(TableLayout layout, UUID id) throws BackingStoreException;

    /** Returns null if no record holds the natural key */
    abstract UUID getIdByNaturalKey(TableLayout layout, byte[] naturalKey) throws BackingStoreException;

    /**
     * Atomically replace a record by patch(record). The patch must not touch natural-key columns.
     *
     * @return the updated record, or null if there is no such record
     */
    abstract Record updateRecord(TableLayout layout, UUID id, UnaryOperator<Record> patch)
            throws BackingStoreException;

    /** @return the deleted record, or null if there was no such record */
    abstract Record deleteRecord(TableLayout layout, UUID id) throws BackingStoreException;

    /** Rows with fromMicros <= timestamp < toMicros matching predicate, in (timestamp, id) order */
    abstract RecordCursor scan(TableLayout layout, long fromMicros, long toMicros, ScanPredicate predicate)
            throws BackingStoreException;

    abstract long getNumRecords(TableLayout layout) throws BackingStoreException;

    /** All (group key, aggregate) pairs of a view */
    abstract Map<ByteBuffer, byte[]> getViewState(RecordView<?> view) throws BackingStoreException;

    /** Atomically replace the whole contents of a view */
    abstract void replaceViewState(RecordView<?> view, Map<ByteBuffer, byte[]> state) throws BackingStoreException;

    @Override
    abstract public void close() throws BackingStoreException;
}
