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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import org.gemini.recordstore.PlotLocation;
import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.Utilities;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Encodes records of one kind into column cells and natural keys. A null cell is the empty array; every non-null cell
 * starts with a marker byte, so that empty strings and empty maps stay distinguishable from null.
 */
class SerDe implements Serializable {
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private static final byte[] NULL_CELL = new byte[0];
    private static final byte PRESENT = 1;

    private final RecordKind kind;
    private final List<Column> columns;

    SerDe(RecordKind kind) {
        this.kind = kind;
        this.columns = Column.columnsFor(kind);
    }

    List<Column> getColumns() {
        return columns;
    }

    byte[] encodeCell(Column column, Record record) {
        switch (column) {
            case COLLECTION_DATE:
                return encode(out -> out.writeSInt64NoTag(record.getCollectionDate().toEpochDay()));
            case DATASET_ID:
                return encodeUUID(record.getDatasetId());
            case DATASET_NAME:
                return encodeString(record.getDatasetName());
            case ENTITY_ID:
                return encodeUUID(record.getEntityId());
            case ENTITY_NAME:
                return encodeString(record.getEntityName());
            case EXPERIMENT_ID:
                return encodeUUID(record.getExperimentId());
            case EXPERIMENT_NAME:
                return encodeString(record.getExperimentName());
            case SEASON_ID:
                return encodeUUID(record.getSeasonId());
            case SEASON_NAME:
                return encodeString(record.getSeasonName());
            case SITE_ID:
                return encodeUUID(record.getSiteId());
            case SITE_NAME:
                return encodeString(record.getSiteName());
            case PLOT:
                return record.getPlot() == null ? NULL_CELL : encode(out -> writePlot(out, record.getPlot()));
            case PAYLOAD:
                if (kind.getPayloadShape() == RecordKind.PayloadShape.SCALAR) {
                    return record.getValue() == null ? NULL_CELL : encode(out -> out.writeDoubleNoTag(record.getValue()));
                } else {
                    return encodeJson(record.getData());
                }
            case RECORD_FILE:
                return encodeString(record.getRecordFile());
            case RECORD_INFO:
                return encodeJson(record.getRecordInfo());
            default:
                throw new IllegalArgumentException("unhandled column " + column);
        }
    }

    /**
     * Rebuild a record from its cells.
     *
     * @param cells  one cell per entry of {@link #getColumns()}, in the same order
     */
    Record decodeRow(UUID id, long micros, byte[][] cells) {
        assert cells.length == columns.size();
        Record.Builder builder = Record.builder(kind)
                .id(id)
                .timestamp(Utilities.fromEpochMicros(micros));
        UUID datasetId = null, entityId = null, experimentId = null, seasonId = null, siteId = null;
        String datasetName = null, entityName = null, experimentName = null, seasonName = null, siteName = null;
        try {
            for (int i = 0; i < cells.length; ++i) {
                byte[] cell = cells[i];
                switch (columns.get(i)) {
                    case COLLECTION_DATE:
                        builder.collectionDate(LocalDate.ofEpochDay(reader(cell).readSInt64()));
                        break;
                    case DATASET_ID:
                        datasetId = decodeUUID(cell);
                        break;
                    case DATASET_NAME:
                        datasetName = decodeString(cell);
                        break;
                    case ENTITY_ID:
                        entityId = decodeUUID(cell);
                        break;
                    case ENTITY_NAME:
                        entityName = decodeString(cell);
                        break;
                    case EXPERIMENT_ID:
                        experimentId = decodeUUID(cell);
                        break;
                    case EXPERIMENT_NAME:
                        experimentName = decodeString(cell);
                        break;
                    case SEASON_ID:
                        seasonId = decodeUUID(cell);
                        break;
                    case SEASON_NAME:
                        seasonName = decodeString(cell);
                        break;
                    case SITE_ID:
                        siteId = decodeUUID(cell);
                        break;
                    case SITE_NAME:
                        siteName = decodeString(cell);
                        break;
                    case PLOT:
                        if (cell.length > 0) builder.plot(readPlot(reader(cell)));
                        break;
                    case PAYLOAD:
                        if (kind.getPayloadShape() == RecordKind.PayloadShape.SCALAR) {
                            if (cell.length > 0) builder.value(reader(cell).readDouble());
                        } else {
                            builder.data(decodeJson(cell));
                        }
                        break;
                    case RECORD_FILE:
                        builder.recordFile(decodeString(cell));
                        break;
                    case RECORD_INFO:
                        builder.recordInfo(decodeJson(cell));
                        break;
                    default:
                        throw new IllegalStateException("unhandled column " + columns.get(i));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        builder.dataset(datasetId, datasetName)
                .experiment(experimentId, experimentName)
                .season(seasonId, seasonName)
                .site(siteId, siteName);
        if (kind.hasSeparateEntity()) {
            builder.entity(entityId, entityName);
        }
        return builder.build();
    }

    /**
     * Natural key: timestamp, collection date, then id and name of every dimension and the plot. Each component is
     * preceded by a presence flag, so two records that both lack a component (and agree on everything else) have
     * equal keys.
     */
    byte[] encodeNaturalKey(Record record) {
        return encode(out -> {
            out.writeSFixed64NoTag(Utilities.toEpochMicros(record.getTimestamp()));
            out.writeSInt64NoTag(record.getCollectionDate().toEpochDay());
            writeOptionalUUID(out, record.getDatasetId());
            writeOptionalString(out, record.getDatasetName());
            if (kind.hasSeparateEntity()) {
                writeOptionalUUID(out, record.getEntityId());
                writeOptionalString(out, record.getEntityName());
            }
            writeOptionalUUID(out, record.getExperimentId());
            writeOptionalString(out, record.getExperimentName());
            writeOptionalUUID(out, record.getSeasonId());
            writeOptionalString(out, record.getSeasonName());
            writeOptionalUUID(out, record.getSiteId());
            writeOptionalString(out, record.getSiteName());
            if (kind.hasPlot()) {
                out.writeBoolNoTag(record.getPlot() != null);
                if (record.getPlot() != null) writePlot(out, record.getPlot());
            }
        });
    }

    /** Decode a name cell without decoding the rest of the row */
    static String decodeString(byte[] cell) {
        return cell.length == 0 ? null : new String(cell, 1, cell.length - 1, StandardCharsets.UTF_8);
    }

    private static byte[] encodeString(String s) {
        if (s == null) return NULL_CELL;
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        byte[] cell = new byte[utf8.length + 1];
        cell[0] = PRESENT;
        System.arraycopy(utf8, 0, cell, 1, utf8.length);
        return cell;
    }

    private static byte[] encodeUUID(UUID uuid) {
        if (uuid == null) return NULL_CELL;
        byte[] cell = new byte[17];
        cell[0] = PRESENT;
        Utilities.uuidToByteArray(uuid, cell, 1);
        return cell;
    }

    private static UUID decodeUUID(byte[] cell) {
        return cell.length == 0 ? null : Utilities.byteArrayToUUID(cell, 1);
    }

    private static byte[] encodeJson(Map<String, Object> map) {
        if (map == null) return NULL_CELL;
        return encode(out -> out.writeByteArrayNoTag(mapper.writeValueAsBytes(map)));
    }

    private static Map<String, Object> decodeJson(byte[] cell) throws IOException {
        if (cell.length == 0) return null;
        return mapper.readValue(reader(cell).readByteArray(), MAP_TYPE);
    }

    private static void writePlot(CodedOutputStream out, PlotLocation plot) throws IOException {
        writeOptionalUUID(out, plot.getPlotId());
        out.writeInt32NoTag(plot.getPlotNumber());
        out.writeInt32NoTag(plot.getPlotRowNumber());
        out.writeInt32NoTag(plot.getPlotColumnNumber());
    }

    private static PlotLocation readPlot(CodedInputStream in) throws IOException {
        UUID plotId = in.readBool() ? new UUID(in.readFixed64(), in.readFixed64()) : null;
        return new PlotLocation(plotId, in.readInt32(), in.readInt32(), in.readInt32());
    }

    private static void writeOptionalUUID(CodedOutputStream out, UUID uuid) throws IOException {
        out.writeBoolNoTag(uuid != null);
        if (uuid != null) {
            out.writeFixed64NoTag(uuid.getMostSignificantBits());
            out.writeFixed64NoTag(uuid.getLeastSignificantBits());
        }
    }

    private static void writeOptionalString(CodedOutputStream out, String s) throws IOException {
        out.writeBoolNoTag(s != null);
        if (s != null) out.writeStringNoTag(s);
    }

    /** Reader over a non-null cell, positioned after the marker byte */
    private static CodedInputStream reader(byte[] cell) {
        return CodedInputStream.newInstance(cell, 1, cell.length - 1);
    }

    @FunctionalInterface
    private interface CellWriter {
        void write(CodedOutputStream out) throws IOException;
    }

    private static byte[] encode(CellWriter writer) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(32);
        bytes.write(PRESENT);
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            writer.write(out);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
