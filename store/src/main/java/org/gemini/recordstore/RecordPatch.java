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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Update to the mutable part of a record: its payload and record_info. Maps are merged shallowly, replacing matching
 * top-level keys. Dimensional fields cannot be patched.
 */
public class RecordPatch {
    private Map<String, Object> data;
    private Double value;
    private Map<String, Object> recordInfo;

    public RecordPatch setData(Map<String, Object> data) {
        this.data = data;
        return this;
    }

    public RecordPatch setValue(Double value) {
        this.value = value;
        return this;
    }

    public RecordPatch setRecordInfo(Map<String, Object> recordInfo) {
        this.recordInfo = recordInfo;
        return this;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Double getValue() {
        return value;
    }

    public Map<String, Object> getRecordInfo() {
        return recordInfo;
    }

    void validateFor(RecordKind kind) throws InvalidRecordException {
        if (kind.getPayloadShape() == RecordKind.PayloadShape.SCALAR && data != null) {
            throw new InvalidRecordException(kind.getTableName() + " have a scalar " + kind.getPayloadField()
                    + "; cannot patch a map payload");
        }
        if (kind.getPayloadShape() == RecordKind.PayloadShape.MAP && value != null) {
            throw new InvalidRecordException(kind.getTableName() + " have a map " + kind.getPayloadField()
                    + "; cannot patch a scalar value");
        }
    }

    /** Copy with both maps in stored JSON form */
    RecordPatch canonicalFor(RecordKind kind) throws InvalidRecordException {
        return new RecordPatch()
                .setData(JsonPayloads.canonical(kind.getPayloadField(), data))
                .setValue(value)
                .setRecordInfo(JsonPayloads.canonical("record_info", recordInfo));
    }

    /** Apply to an existing record, returning the patched copy */
    Record applyTo(Record existing) {
        Record.Builder b = existing.toBuilder();
        if (data != null) {
            b.data(merge(existing.getData(), data));
        }
        if (value != null) {
            b.value(value);
        }
        if (recordInfo != null) {
            b.recordInfo(merge(existing.getRecordInfo(), recordInfo));
        }
        return b.build();
    }

    private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> patch) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(patch);
        return merged;
    }
}
