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

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Query descriptor: an optional [start, end) range on timestamp plus zero or more dimension name sets, keyed by
 * their query parameter name ("dataset_names", "sensor_names", ...). An empty or omitted set places no constraint on
 * its dimension. Validated against a record kind by {@link FilterEngine}.
 */
public class RecordFilter {
    /** Alias for the kind-specific entity parameter ("sensor_names", "trait_names", ...) */
    public static final String ENTITY_NAMES = "entity_names";

    private Instant startTimestamp;
    private Instant endTimestamp;
    private final Map<String, Set<String>> names = new LinkedHashMap<>();
    private Map<String, Object> dataContains;
    private Map<String, Object> infoContains;

    /** Inclusive; null for no lower bound */
    public RecordFilter setStartTimestamp(Instant startTimestamp) {
        this.startTimestamp = startTimestamp;
        return this;
    }

    /** Exclusive; null for no upper bound */
    public RecordFilter setEndTimestamp(Instant endTimestamp) {
        this.endTimestamp = endTimestamp;
        return this;
    }

    /** Constrain the dimension behind a query parameter. A null or empty collection removes the constraint. */
    public RecordFilter setNames(String parameter, Collection<String> values) {
        if (values == null || values.isEmpty()) {
            names.remove(parameter);
        } else {
            names.put(parameter, Collections.unmodifiableSet(new LinkedHashSet<>(values)));
        }
        return this;
    }

    public RecordFilter setDatasetNames(Collection<String> values) {
        return setNames("dataset_names", values);
    }

    public RecordFilter setEntityNames(Collection<String> values) {
        return setNames(ENTITY_NAMES, values);
    }

    public RecordFilter setExperimentNames(Collection<String> values) {
        return setNames("experiment_names", values);
    }

    public RecordFilter setSeasonNames(Collection<String> values) {
        return setNames("season_names", values);
    }

    public RecordFilter setSiteNames(Collection<String> values) {
        return setNames("site_names", values);
    }

    /** Only match records whose payload contains this map (JSON containment) */
    public RecordFilter setDataContains(Map<String, Object> dataContains) {
        this.dataContains = dataContains;
        return this;
    }

    /** Only match records whose record_info contains this map (JSON containment) */
    public RecordFilter setInfoContains(Map<String, Object> infoContains) {
        this.infoContains = infoContains;
        return this;
    }

    public Instant getStartTimestamp() {
        return startTimestamp;
    }

    public Instant getEndTimestamp() {
        return endTimestamp;
    }

    /** Non-empty name sets by query parameter */
    public Map<String, Set<String>> getNames() {
        return Collections.unmodifiableMap(names);
    }

    public Map<String, Object> getDataContains() {
        return dataContains;
    }

    public Map<String, Object> getInfoContains() {
        return infoContains;
    }

    @Override
    public String toString() {
        return "RecordFilter{[" + startTimestamp + ", " + endTimestamp + "), " + names
                + (dataContains != null ? ", data @> " + dataContains : "")
                + (infoContains != null ? ", info @> " + infoContains : "") + "}";
    }
}
