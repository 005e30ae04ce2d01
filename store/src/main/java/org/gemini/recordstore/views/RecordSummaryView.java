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

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Per-table summary grouped by (entity, dataset, experiment, season, site): record count, first and last timestamp,
 * and for trait tables the sum, min and max of trait values.
 */
public class RecordSummaryView implements RecordView<RecordSummary> {
    private static final Logger logger = LoggerFactory.getLogger(RecordSummaryView.class);

    private final RecordKind kind;

    public RecordSummaryView(RecordKind kind) {
        this.kind = kind;
    }

    @Override
    public String getName() {
        return kind.getTableName() + "_summary";
    }

    @Override
    public byte getCode() {
        return kind.getCode();
    }

    @Override
    public RecordKind getKind() {
        return kind;
    }

    @Override
    public byte[] getGroupKey(Record record) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            writeName(out, record.getEntityName());
            writeName(out, record.getDatasetName());
            writeName(out, record.getExperimentName());
            writeName(out, record.getSeasonName());
            writeName(out, record.getSiteName());
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /** Decode a stored (group key, aggregate) pair */
    public SummaryGroup decodeGroup(byte[] groupKey, byte[] aggregate) {
        CodedInputStream in = CodedInputStream.newInstance(groupKey);
        try {
            String entity = readName(in), dataset = readName(in), experiment = readName(in), season = readName(in),
                    site = readName(in);
            return new SummaryGroup(entity, dataset, experiment, season, site, deserialize(aggregate));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeName(CodedOutputStream out, String name) throws IOException {
        out.writeBoolNoTag(name != null);
        if (name != null) out.writeStringNoTag(name);
    }

    private static String readName(CodedInputStream in) throws IOException {
        return in.readBool() ? in.readString() : null;
    }

    @Override
    public RecordSummary createEmpty() {
        return RecordSummary.EMPTY;
    }

    @Override
    public RecordSummary insert(RecordSummary aggr, Record record) {
        long ts = Utilities.toEpochMicros(record.getTimestamp());
        Double value = record.getValue();
        return new RecordSummary(
                aggr.count + 1,
                Math.min(aggr.firstMicros, ts),
                Math.max(aggr.lastMicros, ts),
                aggr.valueCount + (value != null ? 1 : 0),
                aggr.sum + (value != null ? value : 0),
                value != null ? Math.min(aggr.min, value) : aggr.min,
                value != null ? Math.max(aggr.max, value) : aggr.max,
                aggr.stale);
    }

    @Override
    public RecordSummary remove(RecordSummary aggr, Record record) {
        if (aggr.count <= 1) {
            return null;
        }
        long ts = Utilities.toEpochMicros(record.getTimestamp());
        Double value = record.getValue();
        boolean stale = aggr.stale || ts == aggr.firstMicros || ts == aggr.lastMicros;
        long valueCount = aggr.valueCount;
        double sum = aggr.sum;
        if (value != null) {
            --valueCount;
            sum -= value;
            stale |= value == aggr.min || value == aggr.max;
        }
        if (stale && !aggr.stale) {
            logger.debug("{}: removing {} took out a group extreme, group marked stale", getName(), record.getId());
        }
        if (valueCount == 0) {
            return new RecordSummary(aggr.count - 1, aggr.firstMicros, aggr.lastMicros, 0, 0,
                    Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, stale);
        }
        return new RecordSummary(aggr.count - 1, aggr.firstMicros, aggr.lastMicros, valueCount, sum, aggr.min,
                aggr.max, stale);
    }

    @Override
    public byte[] serialize(RecordSummary aggr) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            out.writeInt64NoTag(aggr.count);
            out.writeSFixed64NoTag(aggr.firstMicros);
            out.writeSFixed64NoTag(aggr.lastMicros);
            out.writeInt64NoTag(aggr.valueCount);
            out.writeDoubleNoTag(aggr.sum);
            out.writeDoubleNoTag(aggr.min);
            out.writeDoubleNoTag(aggr.max);
            out.writeBoolNoTag(aggr.stale);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    @Override
    public RecordSummary deserialize(byte[] bytes) {
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        try {
            return new RecordSummary(in.readInt64(), in.readSFixed64(), in.readSFixed64(), in.readInt64(),
                    in.readDouble(), in.readDouble(), in.readDouble(), in.readBool());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
