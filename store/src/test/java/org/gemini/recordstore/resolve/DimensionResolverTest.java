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
package org.gemini.recordstore.resolve;

import org.gemini.recordstore.Fixtures;
import org.gemini.recordstore.InvalidRecordException;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.RecordRequest;
import org.gemini.recordstore.UnknownEntityException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class DimensionResolverTest {
    private final InMemoryEntityCatalog catalog = Fixtures.catalog();
    private final DimensionResolver resolver = new DimensionResolver(catalog);

    @Test
    public void resolvesEverything() throws Exception {
        ResolvedDimensions resolved = resolver.resolve(RecordKind.SENSOR, Fixtures.sensorReading(Fixtures.T0, 1));
        assertEquals(catalog.find(EntityType.DATASET, Fixtures.DATASET).get(), resolved.getDataset());
        assertEquals(catalog.find(EntityType.SENSOR, Fixtures.SENSOR).get(), resolved.getEntity());
        assertEquals(catalog.find(EntityType.SITE, Fixtures.SITE).get(), resolved.getSite());
        assertEquals(1, resolved.getPlot().getPlotNumber());
    }

    @Test
    public void datasetKindHasNoSeparateEntity() throws Exception {
        ResolvedDimensions resolved = resolver.resolve(RecordKind.DATASET, new RecordRequest()
                .setDatasetName(Fixtures.DATASET)
                .setEntityName("ignored"));
        assertNull(resolved.getEntity());
        assertNull(resolved.getExperiment());
    }

    @Test
    public void plotIgnoredForKindsWithoutPlots() throws Exception {
        ResolvedDimensions resolved = resolver.resolve(RecordKind.PROCEDURE, new RecordRequest()
                .setDatasetName(Fixtures.DATASET)
                .setEntityName("Harvest")
                .setPlot(9, 9, 9));
        assertNull(resolved.getPlot());
    }

    @Test
    public void seasonsAreScopedToExperiment() throws Exception {
        EntityRef a = resolver.resolve(RecordKind.TRAIT, Fixtures.traitValue(Fixtures.T0, 1)).getSeason();
        catalog.addSeason("Experiment B", Fixtures.SEASON);
        EntityRef b = resolver.resolve(RecordKind.TRAIT, Fixtures.traitValue(Fixtures.T0, 1)
                .setExperimentName("Experiment B")).getSeason();
        assertNotEquals(a.getId(), b.getId());

        try {
            resolver.resolve(RecordKind.TRAIT, Fixtures.traitValue(Fixtures.T0, 1)
                    .setExperimentName("Experiment B")
                    .setSeasonName("Season 1A-missing"));
            fail("expected UnknownEntityException");
        } catch (UnknownEntityException e) {
            assertEquals(EntityType.SEASON, e.getEntityType());
        }
    }

    @Test
    public void partialPlotIsInvalid() throws Exception {
        try {
            resolver.resolve(RecordKind.SENSOR, Fixtures.sensorReading(Fixtures.T0, 1).setPlot(1, null, 1));
            fail("expected InvalidRecordException");
        } catch (InvalidRecordException expected) {
        }
    }

    @Test
    public void unknownDataset() throws Exception {
        try {
            resolver.resolve(RecordKind.SENSOR, Fixtures.sensorReading(Fixtures.T0, 1).setDatasetName("D9"));
            fail("expected UnknownEntityException");
        } catch (UnknownEntityException e) {
            assertEquals(EntityType.DATASET, e.getEntityType());
            assertEquals("D9", e.getName());
        }
    }
}
