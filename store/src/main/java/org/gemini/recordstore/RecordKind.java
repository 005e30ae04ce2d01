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

import org.gemini.recordstore.resolve.EntityType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Descriptor for one of the six record tables. All kinds share the same physical layout and code paths; a kind only
 * decides field names, payload shape, which optional column groups exist, and which filter dimensions are legal.
 */
public enum RecordKind {
    SENSOR((byte) 1, EntityType.SENSOR, "sensor_data", PayloadShape.MAP, true, true),
    TRAIT((byte) 2, EntityType.TRAIT, "trait_value", PayloadShape.SCALAR, true, false),
    DATASET((byte) 3, EntityType.DATASET, "dataset_data", PayloadShape.MAP, false, true),
    PROCEDURE((byte) 4, EntityType.PROCEDURE, "procedure_data", PayloadShape.MAP, false, true),
    SCRIPT((byte) 5, EntityType.SCRIPT, "script_data", PayloadShape.MAP, false, true),
    MODEL((byte) 6, EntityType.MODEL, "model_data", PayloadShape.MAP, false, true);

    public enum PayloadShape {
        /** unstructured key/value map */
        MAP,
        /** single floating point value */
        SCALAR
    }

    private final byte code;
    private final EntityType entityType;
    private final String payloadField;
    private final PayloadShape payloadShape;
    private final boolean hasPlot;
    private final boolean hasRecordFile;
    private final Map<String, Dimension> filterDimensions;

    RecordKind(byte code, EntityType entityType, String payloadField, PayloadShape payloadShape,
               boolean hasPlot, boolean hasRecordFile) {
        this.code = code;
        this.entityType = entityType;
        this.payloadField = payloadField;
        this.payloadShape = payloadShape;
        this.hasPlot = hasPlot;
        this.hasRecordFile = hasRecordFile;

        Map<String, Dimension> dims = new LinkedHashMap<>();
        dims.put("dataset_names", Dimension.DATASET);
        if (entityType != EntityType.DATASET) {
            dims.put(entityType.getName() + "_names", Dimension.ENTITY);
        }
        dims.put("experiment_names", Dimension.EXPERIMENT);
        dims.put("season_names", Dimension.SEASON);
        dims.put("site_names", Dimension.SITE);
        this.filterDimensions = Collections.unmodifiableMap(dims);
    }

    /** Single byte used as the kind prefix in backing store keys. Never reuse a retired code. */
    public byte getCode() {
        return code;
    }

    /** The entity that owns records of this kind. For dataset records the dataset itself is the entity. */
    public EntityType getEntityType() {
        return entityType;
    }

    /** e.g. "sensor" */
    public String getEntityName() {
        return entityType.getName();
    }

    /** e.g. "sensor_records" */
    public String getTableName() {
        return entityType.getName() + "_records";
    }

    public String getEntityIdField() {
        return entityType.getName() + "_id";
    }

    public String getEntityNameField() {
        return entityType.getName() + "_name";
    }

    public String getPayloadField() {
        return payloadField;
    }

    public PayloadShape getPayloadShape() {
        return payloadShape;
    }

    /** True if the entity reference is a separate column pair rather than the dataset columns */
    public boolean hasSeparateEntity() {
        return entityType != EntityType.DATASET;
    }

    public boolean hasPlot() {
        return hasPlot;
    }

    public boolean hasRecordFile() {
        return hasRecordFile;
    }

    /** Filter parameter name -> dimension, e.g. "sensor_names" -> ENTITY */
    public Map<String, Dimension> getFilterDimensions() {
        return filterDimensions;
    }

    public Set<Dimension> getDimensions() {
        return EnumSet.copyOf(filterDimensions.values());
    }

    public static RecordKind fromCode(byte code) {
        for (RecordKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown record kind code " + code);
    }

    /** Look up by entity name ("sensor") or table name ("sensor_records") */
    public static RecordKind fromName(String name) {
        for (RecordKind kind : values()) {
            if (kind.getEntityName().equalsIgnoreCase(name) || kind.getTableName().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown record kind " + name);
    }
}
