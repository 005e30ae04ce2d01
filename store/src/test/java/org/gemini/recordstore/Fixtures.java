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

import org.gemini.recordstore.resolve.Association;
import org.gemini.recordstore.resolve.EntityType;
import org.gemini.recordstore.resolve.InMemoryEntityCatalog;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Entities and requests shared by the record store tests */
public class Fixtures {
    public static final String EXPERIMENT = "Experiment A";
    public static final String SEASON = "Season 1A";
    public static final String SITE = "Site A1";
    public static final String DATASET = "D1";
    public static final String SENSOR = "Weather Sensor";
    public static final String TRAIT = "Plant Height";
    public static final LocalDate DATE = LocalDate.parse("2023-09-05");
    public static final Instant T0 = Instant.parse("2023-09-05T00:00:00Z");

    private Fixtures() {}

    public static InMemoryEntityCatalog catalog() {
        InMemoryEntityCatalog catalog = new InMemoryEntityCatalog();
        catalog.add(EntityType.EXPERIMENT, EXPERIMENT);
        catalog.add(EntityType.EXPERIMENT, "Experiment B");
        catalog.addSeason(EXPERIMENT, SEASON);
        catalog.addSeason("Experiment B", "Season 1B");
        catalog.add(EntityType.SITE, SITE);
        catalog.add(EntityType.SITE, "Site B1");
        catalog.add(EntityType.DATASET, DATASET);
        catalog.add(EntityType.DATASET, "D2");
        catalog.add(EntityType.SENSOR, SENSOR);
        catalog.add(EntityType.SENSOR, "Soil Sensor");
        catalog.add(EntityType.TRAIT, TRAIT);
        catalog.add(EntityType.PROCEDURE, "Harvest");
        catalog.add(EntityType.SCRIPT, "Stitcher");
        catalog.add(EntityType.MODEL, "Yield Model");
        catalog.addPlot(EXPERIMENT, SEASON, SITE, 1, 1, 1);
        catalog.addPlot(EXPERIMENT, SEASON, SITE, 2, 1, 2);
        catalog.associate(Association.EXPERIMENT_SITES, EXPERIMENT, SITE);
        catalog.associate(Association.SENSOR_DATASETS, SENSOR, DATASET);
        return catalog;
    }

    public static RecordRequest sensorReading(Instant timestamp, double temperature) {
        return new RecordRequest()
                .setTimestamp(timestamp)
                .setCollectionDate(DATE)
                .setDatasetName(DATASET)
                .setEntityName(SENSOR)
                .setExperimentName(EXPERIMENT)
                .setSeasonName(SEASON)
                .setSiteName(SITE)
                .setPlot(1, 1, 1)
                .setData(map("temperature", temperature))
                .setRecordInfo(map("source", "station"));
    }

    public static RecordRequest traitValue(Instant timestamp, double value) {
        return new RecordRequest()
                .setTimestamp(timestamp)
                .setCollectionDate(DATE)
                .setDatasetName(DATASET)
                .setEntityName(TRAIT)
                .setExperimentName(EXPERIMENT)
                .setSeasonName(SEASON)
                .setSiteName(SITE)
                .setValue(value);
    }

    public static Map<String, Object> map(String key, Object value) {
        return Collections.singletonMap(key, value);
    }

    public static Map<String, Object> map(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put(k1, v1);
        ret.put(k2, v2);
        return ret;
    }
}
