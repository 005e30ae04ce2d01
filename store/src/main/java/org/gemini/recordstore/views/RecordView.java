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
package org.gemini.recordstore.views;

import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;

/**
 * Manages an incrementally maintained view over one record table: a map from group key to an aggregate of type A.
 * Like the window operators this replaces, a RecordView does not hold aggregates itself; it creates, updates and
 * (de)serializes them, and the backing store keeps them next to the records so that every record write and its view
 * delta commit together.
 *
 * <p>Each insert or delete touches exactly one group, so maintenance costs constant work per write.</p>
 */
public interface RecordView<A> {
    /** e.g. "sensor_records_summary" */
    String getName();

    /** Single byte used as the view prefix in backing store keys */
    byte getCode();

    /** Table this view is maintained over */
    RecordKind getKind();

    /** Encoded group the record contributes to */
    byte[] getGroupKey(Record record);

    /** Aggregate of an empty group */
    A createEmpty();

    /** Fold record into aggr and return the updated aggregate */
    A insert(A aggr, Record record);

    /** Remove a previously inserted record. Returns null if the group is now empty and should be dropped. */
    A remove(A aggr, Record record);

    byte[] serialize(A aggr);

    A deserialize(byte[] bytes);
}
