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

import org.gemini.recordstore.Fixtures;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.RecordPatch;
import org.gemini.recordstore.RecordStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static org.gemini.recordstore.Fixtures.T0;
import static org.gemini.recordstore.Fixtures.sensorReading;
import static org.gemini.recordstore.Fixtures.traitValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@RunWith(Parameterized.class)
public class SummaryViewMaintenanceTest {
    @Parameterized.Parameters(name = "{0}")
    public static Collection<Object[]> backends() {
        return Arrays.asList(new Object[]{"memory"}, new Object[]{"rocksdb"});
    }

    @Parameterized.Parameter
    public String backend;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private RecordStore store;

    @Before
    public void setUp() throws Exception {
        String dir = backend.equals("rocksdb") ? folder.getRoot().getAbsolutePath() : null;
        store = new RecordStore(dir, Fixtures.catalog());
    }

    @After
    public void tearDown() throws Exception {
        store.close();
    }

    private RecordSummary only(RecordKind kind) throws Exception {
        List<SummaryGroup> groups = store.getSummary(kind);
        assertEquals(1, groups.size());
        return groups.get(0).getSummary();
    }

    @Test
    public void viewsExistForSensorsAndTraits() {
        assertTrue(store.hasSummaryView(RecordKind.SENSOR));
        assertTrue(store.hasSummaryView(RecordKind.TRAIT));
        assertFalse(store.hasSummaryView(RecordKind.DATASET));
    }

    @Test(expected = IllegalArgumentException.class)
    public void noSummaryForDatasets() throws Exception {
        store.getSummary(RecordKind.DATASET);
    }

    @Test
    public void incrementalCounts() throws Exception {
        for (int i = 0; i < 10; ++i) {
            store.insert(RecordKind.SENSOR, sensorReading(T0.plusSeconds(i), i));
        }
        store.insert(RecordKind.SENSOR, sensorReading(T0, 0).setEntityName("Soil Sensor"));

        List<SummaryGroup> groups = store.getSummary(RecordKind.SENSOR);
        assertEquals(2, groups.size());
        // sorted by entity name
        assertEquals("Soil Sensor", groups.get(0).getEntityName());
        assertEquals(1, groups.get(0).getSummary().getCount());
        assertEquals("Weather Sensor", groups.get(1).getEntityName());
        assertEquals(10, groups.get(1).getSummary().getCount());
        assertEquals(T0, groups.get(1).getSummary().getFirstTimestamp());
        assertEquals(T0.plusSeconds(9), groups.get(1).getSummary().getLastTimestamp());
        assertTrue(groups.get(1).matches(Fixtures.SENSOR, Fixtures.DATASET, Fixtures.EXPERIMENT, Fixtures.SEASON,
                Fixtures.SITE));
    }

    @Test
    public void deleteOfExtremeMarksStaleUntilRebuild() throws Exception {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 5; ++i) {
            ids.add(store.insert(RecordKind.TRAIT, traitValue(T0.plusSeconds(i), i)));
        }
        store.delete(RecordKind.TRAIT, ids.get(2));
        RecordSummary summary = only(RecordKind.TRAIT);
        assertEquals(4, summary.getCount());
        assertEquals(8, summary.getSum(), 0);
        assertFalse(summary.isStale());

        store.delete(RecordKind.TRAIT, ids.get(4));
        summary = only(RecordKind.TRAIT);
        assertEquals(3, summary.getCount());
        assertTrue(summary.isStale());
        assertEquals(T0.plusSeconds(4), summary.getLastTimestamp());

        store.rebuildViews(RecordKind.TRAIT);
        summary = only(RecordKind.TRAIT);
        assertFalse(summary.isStale());
        assertEquals(3, summary.getCount());
        assertEquals(T0.plusSeconds(3), summary.getLastTimestamp());
        assertEquals(3, summary.getMax(), 0);
        assertEquals(4, summary.getSum(), 0);
    }

    @Test
    public void updateMovesValue() throws Exception {
        store.insert(RecordKind.TRAIT, traitValue(T0, 1));
        UUID middle = store.insert(RecordKind.TRAIT, traitValue(T0.plusSeconds(1), 2));
        store.insert(RecordKind.TRAIT, traitValue(T0.plusSeconds(2), 3));

        store.update(RecordKind.TRAIT, middle, new RecordPatch().setValue(10.0));
        RecordSummary summary = only(RecordKind.TRAIT);
        assertEquals(3, summary.getCount());
        assertEquals(14, summary.getSum(), 0);
        assertEquals(10, summary.getMax(), 0);
        assertFalse(summary.isStale());
    }

    @Test
    public void deletingLastRecordDropsGroup() throws Exception {
        UUID id = store.insert(RecordKind.TRAIT, traitValue(T0, 1));
        store.delete(RecordKind.TRAIT, id);
        assertTrue(store.getSummary(RecordKind.TRAIT).isEmpty());
    }

    @Test
    public void rebuildMatchesIncrementalState() throws Exception {
        for (int i = 0; i < 20; ++i) {
            store.insert(RecordKind.SENSOR, sensorReading(T0.plusSeconds(i), i)
                    .setDatasetName(i % 2 == 0 ? "D1" : "D2"));
        }
        List<SummaryGroup> incremental = store.getSummary(RecordKind.SENSOR);
        store.rebuildViews(RecordKind.SENSOR);
        List<SummaryGroup> rebuilt = store.getSummary(RecordKind.SENSOR);
        assertEquals(2, rebuilt.size());
        for (int i = 0; i < 2; ++i) {
            assertEquals(incremental.get(i).getDatasetName(), rebuilt.get(i).getDatasetName());
            assertEquals(incremental.get(i).getSummary().getCount(), rebuilt.get(i).getSummary().getCount());
            assertEquals(incremental.get(i).getSummary().getLastTimestamp(),
                    rebuilt.get(i).getSummary().getLastTimestamp());
        }
    }
}
