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

import org.gemini.recordstore.storage.Column;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.UUID;

import static org.gemini.recordstore.Fixtures.map;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FilterEngineTest {
    private static final Instant T = Instant.parse("2023-09-05T00:10:00Z");

    private static Record sensor(String site) {
        return Record.builder(RecordKind.SENSOR)
                .id(UUID.randomUUID())
                .timestamp(T)
                .dataset(UUID.randomUUID(), "D1")
                .entity(UUID.randomUUID(), "Weather Sensor")
                .site(site == null ? null : UUID.randomUUID(), site)
                .data(map("unit", "C"))
                .build();
    }

    @Test
    public void unboundedByDefault() throws Exception {
        FilterEngine.CompiledFilter compiled = FilterEngine.compile(RecordKind.SENSOR, new RecordFilter());
        assertEquals(Long.MIN_VALUE, compiled.getFromMicros());
        assertEquals(Long.MAX_VALUE, compiled.getToMicros());
        assertTrue(compiled.getPredicate().getConstrainedColumns().isEmpty());
        assertTrue(compiled.getPredicate().test(sensor(null)));
    }

    @Test
    public void timeBoundsInMicros() throws Exception {
        FilterEngine.CompiledFilter compiled = FilterEngine.compile(RecordKind.SENSOR, new RecordFilter()
                .setStartTimestamp(T)
                .setEndTimestamp(T.plusNanos(1_500)));
        assertEquals(Utilities.toEpochMicros(T), compiled.getFromMicros());
        assertEquals(Utilities.toEpochMicros(T) + 1, compiled.getToMicros());

        // equal bounds are a valid, empty range
        FilterEngine.compile(RecordKind.SENSOR, new RecordFilter().setStartTimestamp(T).setEndTimestamp(T));
    }

    @Test
    public void namesArePushedDown() throws Exception {
        FilterEngine.CompiledFilter compiled = FilterEngine.compile(RecordKind.SENSOR, new RecordFilter()
                .setNames("sensor_names", Collections.singletonList("Weather Sensor"))
                .setSiteNames(Arrays.asList("Site A1", "Site B1")));
        assertEquals(EnumSet.of(Column.ENTITY_NAME, Column.SITE_NAME),
                compiled.getPredicate().getConstrainedColumns());
        assertTrue(compiled.getPredicate().test(sensor("Site B1")));
        assertFalse(compiled.getPredicate().test(sensor("Site C1")));
        assertFalse(compiled.getPredicate().test(sensor(null)));
    }

    @Test
    public void entityNamesAlias() throws Exception {
        FilterEngine.CompiledFilter compiled = FilterEngine.compile(RecordKind.TRAIT, new RecordFilter()
                .setEntityNames(Collections.singletonList("Plant Height")));
        assertEquals(EnumSet.of(Column.ENTITY_NAME), compiled.getPredicate().getConstrainedColumns());
        try {
            FilterEngine.compile(RecordKind.DATASET, new RecordFilter()
                    .setEntityNames(Collections.singletonList("D1")));
            fail("expected InvalidFilterException");
        } catch (InvalidFilterException expected) {
        }
    }

    @Test
    public void aliasAndEntityParameterIntersect() throws Exception {
        FilterEngine.CompiledFilter compiled = FilterEngine.compile(RecordKind.SENSOR, new RecordFilter()
                .setEntityNames(Arrays.asList("Weather Sensor", "Soil Sensor"))
                .setNames("sensor_names", Collections.singletonList("Weather Sensor")));
        assertEquals(EnumSet.of(Column.ENTITY_NAME), compiled.getPredicate().getConstrainedColumns());
        assertTrue(compiled.getPredicate().test(sensor(null)));

        compiled = FilterEngine.compile(RecordKind.SENSOR, new RecordFilter()
                .setEntityNames(Collections.singletonList("Weather Sensor"))
                .setNames("sensor_names", Collections.singletonList("Soil Sensor")));
        assertFalse(compiled.getPredicate().test(sensor(null)));
        assertFalse(compiled.getPredicate().acceptsName(Column.ENTITY_NAME, "Soil Sensor"));
        assertFalse(compiled.getPredicate().acceptsName(Column.ENTITY_NAME, "Weather Sensor"));
    }

    @Test
    public void containmentIsResidual() throws Exception {
        FilterEngine.CompiledFilter compiled = FilterEngine.compile(RecordKind.SENSOR, new RecordFilter()
                .setDataContains(map("unit", "C")));
        assertTrue(compiled.getPredicate().getConstrainedColumns().isEmpty());
        assertTrue(compiled.getPredicate().test(sensor(null)));
        compiled = FilterEngine.compile(RecordKind.SENSOR, new RecordFilter().setDataContains(map("unit", "F")));
        assertFalse(compiled.getPredicate().test(sensor(null)));
    }

    @Test
    public void rejectsBadFilters() {
        RecordFilter[] bad = {
                new RecordFilter().setStartTimestamp(T).setEndTimestamp(T.minusSeconds(1)),
                new RecordFilter().setNames("cultivar_names", Collections.singletonList("x")),
                new RecordFilter().setNames("sensor_names", Collections.singletonList("x")),
        };
        for (RecordFilter filter : bad) {
            try {
                FilterEngine.compile(RecordKind.TRAIT, filter);
                fail("expected InvalidFilterException for " + filter);
            } catch (InvalidFilterException expected) {
            }
        }
        try {
            FilterEngine.compile(RecordKind.TRAIT, new RecordFilter().setDataContains(map("a", 1)));
            fail("expected InvalidFilterException");
        } catch (InvalidFilterException expected) {
        }
    }
}
