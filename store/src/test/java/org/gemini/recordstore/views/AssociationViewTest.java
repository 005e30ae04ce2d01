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
import org.gemini.recordstore.RecordStore;
import org.gemini.recordstore.resolve.Association;
import org.gemini.recordstore.resolve.EntityRef;
import org.gemini.recordstore.resolve.InMemoryEntityCatalog;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AssociationViewTest {
    @Test
    public void snapshotUntilRefreshed() throws Exception {
        InMemoryEntityCatalog catalog = Fixtures.catalog();
        try (RecordStore store = new RecordStore(null, catalog)) {
            AssociationView view = store.getAssociationView(Association.EXPERIMENT_SITES);
            assertEquals("experiment_sites_view", view.getName());
            assertEquals(1, view.getRows().size());

            catalog.associate(Association.EXPERIMENT_SITES, Fixtures.EXPERIMENT, "Site B1");
            assertEquals(1, view.getRows().size());
            store.refreshAssociationViews();
            assertEquals(2, view.getRows().size());

            List<EntityRef> sites = view.getRight(Fixtures.EXPERIMENT);
            assertEquals(2, sites.size());
            assertEquals(Fixtures.EXPERIMENT, view.getLeft("Site B1").get(0).getName());
            assertTrue(view.getRight("Experiment B").isEmpty());
        }
    }

    @Test
    public void seasonsAreAssociatedOnCreation() {
        InMemoryEntityCatalog catalog = Fixtures.catalog();
        AssociationView view = new AssociationView(Association.EXPERIMENT_SEASONS, catalog);
        assertEquals(Fixtures.SEASON, view.getRight(Fixtures.EXPERIMENT).get(0).getName());
    }
}
