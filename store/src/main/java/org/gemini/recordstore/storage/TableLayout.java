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

import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.views.RecordView;

import java.util.Collections;
import java.util.List;

/** Everything a backing store needs to know about one record table */
class TableLayout {
    final RecordKind kind;
    final SerDe serde;
    final List<Column> columns;
    final List<RecordView<?>> views;

    TableLayout(RecordKind kind, List<RecordView<?>> views) {
        this.kind = kind;
        this.serde = new SerDe(kind);
        this.columns = serde.getColumns();
        this.views = Collections.unmodifiableList(views);
    }

    byte[] naturalKey(Record record) {
        return serde.encodeNaturalKey(record);
    }

    /** Aggregate bytes after folding record into the stored aggregate (null if the group did not exist yet) */
    static <A> byte[] viewInsert(RecordView<A> view, byte[] stored, Record record) {
        A aggr = stored == null ? view.createEmpty() : view.deserialize(stored);
        return view.serialize(view.insert(aggr, record));
    }

    /** Aggregate bytes after removing record, or null if the group is now empty */
    static <A> byte[] viewRemove(RecordView<A> view, byte[] stored, Record record) {
        if (stored == null) {
            throw new IllegalStateException("view " + view.getName() + " has no group for " + record.getId());
        }
        A aggr = view.remove(view.deserialize(stored), record);
        return aggr == null ? null : view.serialize(aggr);
    }
}
