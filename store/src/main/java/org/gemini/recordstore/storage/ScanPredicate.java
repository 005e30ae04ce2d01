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

import org.gemini.recordstore.Record;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Row predicate of a table scan. Name-column memberships are pushed down to the backing store, which checks them
 * against individual cells before decoding the rest of the row; the residual predicate runs on decoded records.
 */
public class ScanPredicate {
    private static final ScanPredicate ALL = new ScanPredicate(Collections.emptyMap(), null);

    private final Map<Column, Set<String>> memberships;
    private final Predicate<Record> residual;

    private ScanPredicate(Map<Column, Set<String>> memberships, Predicate<Record> residual) {
        this.memberships = memberships;
        this.residual = residual;
    }

    public static ScanPredicate all() {
        return ALL;
    }

    /**
     * @param memberships  name column to the set of accepted names. A row with a null name in a constrained column
     *                     never matches.
     * @param residual  null for none
     */
    public static ScanPredicate of(Map<Column, ? extends Set<String>> memberships, Predicate<Record> residual) {
        Map<Column, Set<String>> copy = new EnumMap<>(Column.class);
        for (Map.Entry<Column, ? extends Set<String>> entry : memberships.entrySet()) {
            if (!entry.getKey().isName()) {
                throw new IllegalArgumentException("cannot push down membership on column " + entry.getKey());
            }
            copy.put(entry.getKey(), Collections.unmodifiableSet(new HashSet<>(entry.getValue())));
        }
        return new ScanPredicate(Collections.unmodifiableMap(copy), residual);
    }

    public Set<Column> getConstrainedColumns() {
        return memberships.keySet();
    }

    /** Test a single decoded name cell of a constrained column */
    public boolean acceptsName(Column column, String name) {
        Set<String> accepted = memberships.get(column);
        return accepted == null || (name != null && accepted.contains(name));
    }

    public boolean testResidual(Record record) {
        return residual == null || residual.test(record);
    }

    /** Full evaluation against a decoded record */
    public boolean test(Record record) {
        for (Map.Entry<Column, Set<String>> entry : memberships.entrySet()) {
            if (!acceptsName(entry.getKey(), nameOf(entry.getKey(), record))) {
                return false;
            }
        }
        return testResidual(record);
    }

    private static String nameOf(Column column, Record record) {
        switch (column) {
            case DATASET_NAME:
                return record.getDatasetName();
            case ENTITY_NAME:
                return record.getEntityName();
            case EXPERIMENT_NAME:
                return record.getExperimentName();
            case SEASON_NAME:
                return record.getSeasonName();
            case SITE_NAME:
                return record.getSiteName();
            default:
                throw new IllegalArgumentException("not a name column: " + column);
        }
    }

    @Override
    public String toString() {
        return memberships + (residual != null ? " + residual" : "");
    }
}
