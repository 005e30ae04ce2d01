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

import org.gemini.recordstore.Dimension;
import org.gemini.recordstore.RecordKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stored columns of a record table. Each column of each row is its own cell in the backing store, so a filter reads
 * the dimension columns it needs without decoding payloads of rows it rejects.
 */
public enum Column {
    COLLECTION_DATE('d'),
    DATASET_ID('a'),
    DATASET_NAME('A'),
    ENTITY_ID('e'),
    ENTITY_NAME('E'),
    EXPERIMENT_ID('x'),
    EXPERIMENT_NAME('X'),
    SEASON_ID('s'),
    SEASON_NAME('S'),
    SITE_ID('t'),
    SITE_NAME('T'),
    PLOT('p'),
    PAYLOAD('v'),
    RECORD_FILE('f'),
    RECORD_INFO('i');

    private final byte code;

    Column(char code) {
        this.code = (byte) code;
    }

    public byte getCode() {
        return code;
    }

    /** True for the columns holding a denormalized dimension name */
    public boolean isName() {
        return this == DATASET_NAME || this == ENTITY_NAME || this == EXPERIMENT_NAME || this == SEASON_NAME
                || this == SITE_NAME;
    }

    /** Columns stored for a kind, in cell order. COLLECTION_DATE is always first and never null. */
    public static List<Column> columnsFor(RecordKind kind) {
        List<Column> columns = new ArrayList<>();
        for (Column column : values()) {
            if (isStored(kind, column)) {
                columns.add(column);
            }
        }
        return Collections.unmodifiableList(columns);
    }

    private static boolean isStored(RecordKind kind, Column column) {
        switch (column) {
            case ENTITY_ID:
            case ENTITY_NAME:
                return kind.hasSeparateEntity();
            case PLOT:
                return kind.hasPlot();
            case RECORD_FILE:
                return kind.hasRecordFile();
            default:
                return true;
        }
    }

    /** Name column a filter dimension is pushed down to */
    public static Column forDimension(Dimension dimension) {
        switch (dimension) {
            case DATASET:
                return DATASET_NAME;
            case ENTITY:
                return ENTITY_NAME;
            case EXPERIMENT:
                return EXPERIMENT_NAME;
            case SEASON:
                return SEASON_NAME;
            case SITE:
                return SITE_NAME;
            default:
                throw new IllegalArgumentException("unhandled dimension " + dimension);
        }
    }
}
