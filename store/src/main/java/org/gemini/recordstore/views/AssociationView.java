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

import org.apache.commons.lang3.tuple.Pair;
import org.gemini.recordstore.resolve.Association;
import org.gemini.recordstore.resolve.EntityCatalog;
import org.gemini.recordstore.resolve.EntityRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Join view over one association table of the entity catalog, e.g. "all cultivars of a plot". Association tables are
 * small and change rarely, so the view is recomputed wholesale by {@link #refresh()} rather than maintained
 * incrementally. Readers see the last refreshed snapshot.
 */
public class AssociationView {
    private static final Logger logger = LoggerFactory.getLogger(AssociationView.class);

    private final Association association;
    private final EntityCatalog catalog;

    private static class Snapshot {
        final List<Pair<EntityRef, EntityRef>> rows;
        final Map<String, List<EntityRef>> byLeft = new HashMap<>();
        final Map<String, List<EntityRef>> byRight = new HashMap<>();

        Snapshot(Collection<Pair<EntityRef, EntityRef>> rows) {
            this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
            for (Pair<EntityRef, EntityRef> row : rows) {
                byLeft.computeIfAbsent(row.getLeft().getName(), k -> new ArrayList<>()).add(row.getRight());
                byRight.computeIfAbsent(row.getRight().getName(), k -> new ArrayList<>()).add(row.getLeft());
            }
        }
    }

    private volatile Snapshot snapshot;

    public AssociationView(Association association, EntityCatalog catalog) {
        this.association = association;
        this.catalog = catalog;
        refresh();
    }

    public String getName() {
        return association.getViewName();
    }

    public Association getAssociation() {
        return association;
    }

    /** Recompute from the catalog's current association table */
    public void refresh() {
        Snapshot fresh = new Snapshot(catalog.associations(association));
        snapshot = fresh;
        logger.debug("refreshed {}: {} rows", getName(), fresh.rows.size());
    }

    public List<Pair<EntityRef, EntityRef>> getRows() {
        return snapshot.rows;
    }

    /** Entities associated with the named left-hand entity, e.g. the cultivars of a plot */
    public List<EntityRef> getRight(String leftName) {
        return Collections.unmodifiableList(snapshot.byLeft.getOrDefault(leftName, Collections.emptyList()));
    }

    /** Entities associated with the named right-hand entity, e.g. the sensors attached to a dataset */
    public List<EntityRef> getLeft(String rightName) {
        return Collections.unmodifiableList(snapshot.byRight.getOrDefault(rightName, Collections.emptyList()));
    }
}
