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
package org.gemini.recordstore.files;

import org.gemini.recordstore.Record;
import org.gemini.recordstore.RecordKind;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.Assert.assertEquals;

public class RecordFileKeysTest {
    private static final Instant T = Instant.parse("2023-09-05T00:10:00.123Z");

    private static Record.Builder builder(RecordKind kind) {
        return Record.builder(kind)
                .id(UUID.randomUUID())
                .timestamp(T)
                .collectionDate(LocalDate.parse("2023-09-05"))
                .dataset(UUID.randomUUID(), "D1")
                .experiment(UUID.randomUUID(), "Experiment A")
                .season(UUID.randomUUID(), "Season 1A")
                .site(UUID.randomUUID(), "Site A1");
    }

    @Test
    public void sensorKey() {
        Record record = builder(RecordKind.SENSOR).entity(UUID.randomUUID(), "Weather Sensor").build();
        assertEquals("sensor_data/Experiment A/Weather Sensor/D1/2023-09-05/Site A1/Season 1A/"
                + T.toEpochMilli() + ".csv", RecordFileKeys.keyFor(record, "upload/readings.CSV"));
    }

    @Test
    public void datasetKeyHasNoEntitySegment() {
        Record record = builder(RecordKind.DATASET).build();
        assertEquals("dataset_data/Experiment A/D1/2023-09-05/Site A1/Season 1A/" + T.toEpochMilli() + ".tif",
                RecordFileKeys.keyFor(record, "ortho.tif"));
    }

    @Test
    public void missingNamesAndExtension() {
        Record record = builder(RecordKind.MODEL).entity(UUID.randomUUID(), "Yield Model")
                .experiment(null, null)
                .site(null, null)
                .build();
        assertEquals("model_data/None/Yield Model/D1/2023-09-05/None/Season 1A/" + T.toEpochMilli(),
                RecordFileKeys.keyFor(record, "weights"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void traitsHaveNoFiles() {
        RecordFileKeys.keyFor(builder(RecordKind.TRAIT).entity(UUID.randomUUID(), "Plant Height").value(1.0).build(),
                "x.csv");
    }
}
