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
package org.gemini.recordstore.transport;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gemini.recordstore.PlotLocation;
import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.UUID;

/**
 * Renders records as flat JSON objects with snake_case fields, the wire shape clients of the record endpoints expect:
 * id, timestamp, collection_date, dataset and entity ids and names, the kind's payload field, experiment/season/site
 * ids and names, plot fields (sensor and trait only), record_file (all but trait) and record_info. Absent values are
 * written as null.
 */
public class RecordJsonCodec {
    private final ObjectMapper mapper;

    public RecordJsonCodec() {
        this(new ObjectMapper());
    }

    public RecordJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** One JSON object followed by a newline */
    public byte[] encodeLine(Record record) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(256);
        try (JsonGenerator gen = mapper.getFactory().createGenerator(bytes, JsonEncoding.UTF8)) {
            write(record, gen);
        }
        bytes.write('\n');
        return bytes.toByteArray();
    }

    public void write(Record record, JsonGenerator gen) throws IOException {
        RecordKind kind = record.getKind();
        gen.writeStartObject();
        writeId(gen, "id", record.getId());
        gen.writeStringField("timestamp", record.getTimestamp().toString());
        gen.writeStringField("collection_date", record.getCollectionDate().toString());
        writeId(gen, "dataset_id", record.getDatasetId());
        writeString(gen, "dataset_name", record.getDatasetName());
        if (kind.hasSeparateEntity()) {
            writeId(gen, kind.getEntityIdField(), record.getEntityId());
            writeString(gen, kind.getEntityNameField(), record.getEntityName());
        }
        gen.writeFieldName(kind.getPayloadField());
        if (kind.getPayloadShape() == RecordKind.PayloadShape.SCALAR) {
            if (record.getValue() == null) {
                gen.writeNull();
            } else {
                gen.writeNumber(record.getValue().doubleValue());
            }
        } else {
            mapper.writeValue(gen, record.getData());
        }
        writeId(gen, "experiment_id", record.getExperimentId());
        writeString(gen, "experiment_name", record.getExperimentName());
        writeId(gen, "season_id", record.getSeasonId());
        writeString(gen, "season_name", record.getSeasonName());
        writeId(gen, "site_id", record.getSiteId());
        writeString(gen, "site_name", record.getSiteName());
        if (kind.hasPlot()) {
            PlotLocation plot = record.getPlot();
            writeId(gen, "plot_id", plot != null ? plot.getPlotId() : null);
            writeInt(gen, "plot_number", plot != null ? plot.getPlotNumber() : null);
            writeInt(gen, "plot_row_number", plot != null ? plot.getPlotRowNumber() : null);
            writeInt(gen, "plot_column_number", plot != null ? plot.getPlotColumnNumber() : null);
        }
        if (kind.hasRecordFile()) {
            writeString(gen, "record_file", record.getRecordFile());
        }
        gen.writeFieldName("record_info");
        mapper.writeValue(gen, record.getRecordInfo());
        gen.writeEndObject();
    }

    private static void writeId(JsonGenerator gen, String field, UUID id) throws IOException {
        writeString(gen, field, id != null ? id.toString() : null);
    }

    private static void writeString(JsonGenerator gen, String field, String value) throws IOException {
        if (value == null) {
            gen.writeNullField(field);
        } else {
            gen.writeStringField(field, value);
        }
    }

    private static void writeInt(JsonGenerator gen, String field, Integer value) throws IOException {
        if (value == null) {
            gen.writeNullField(field);
        } else {
            gen.writeNumberField(field, value);
        }
    }
}
