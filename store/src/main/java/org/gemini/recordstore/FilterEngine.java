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
import org.gemini.recordstore.storage.ScanPredicate;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Translates a {@link RecordFilter} into a time range and a {@link ScanPredicate} for one record kind. Dimension
 * name sets are pushed down to the name columns; payload containment runs as a residual predicate.
 */
public class FilterEngine {
    private FilterEngine() {}

    /** Validated, storage-level form of a filter */
    public static class CompiledFilter {
        private final long fromMicros, toMicros;
        private final ScanPredicate predicate;

        private CompiledFilter(long fromMicros, long toMicros, ScanPredicate predicate) {
            this.fromMicros = fromMicros;
            this.toMicros = toMicros;
            this.predicate = predicate;
        }

        public long getFromMicros() {
            return fromMicros;
        }

        public long getToMicros() {
            return toMicros;
        }

        public ScanPredicate getPredicate() {
            return predicate;
        }
    }

    /**
     * @throws InvalidFilterException if the filter names a dimension the kind does not have, or start is after end
     */
    public static CompiledFilter compile(RecordKind kind, RecordFilter filter) throws InvalidFilterException {
        long from = Long.MIN_VALUE, to = Long.MAX_VALUE;
        if (filter.getStartTimestamp() != null) {
            from = Utilities.toEpochMicros(filter.getStartTimestamp());
        }
        if (filter.getEndTimestamp() != null) {
            to = Utilities.toEpochMicros(filter.getEndTimestamp());
        }
        if (from > to) {
            throw new InvalidFilterException("start_timestamp " + filter.getStartTimestamp()
                    + " is after end_timestamp " + filter.getEndTimestamp());
        }

        Map<Column, Set<String>> memberships = new EnumMap<>(Column.class);
        for (Map.Entry<String, Set<String>> entry : filter.getNames().entrySet()) {
            Dimension dimension = resolveParameter(kind, entry.getKey());
            // entity_names and the kind's own parameter share a column; both must hold
            memberships.merge(Column.forDimension(dimension), new HashSet<>(entry.getValue()), (a, b) -> {
                a.retainAll(b);
                return a;
            });
        }

        Predicate<Record> residual = null;
        Map<String, Object> dataContains = filter.getDataContains(), infoContains = filter.getInfoContains();
        if (dataContains != null && !dataContains.isEmpty()) {
            if (kind.getPayloadShape() != RecordKind.PayloadShape.MAP) {
                throw new InvalidFilterException(kind.getTableName() + " have a scalar " + kind.getPayloadField()
                        + "; payload containment is not supported");
            }
            residual = r -> JsonContainment.contains(r.getData(), dataContains);
        }
        if (infoContains != null && !infoContains.isEmpty()) {
            Predicate<Record> info = r -> JsonContainment.contains(r.getRecordInfo(), infoContains);
            residual = residual == null ? info : residual.and(info);
        }
        return new CompiledFilter(from, to, ScanPredicate.of(memberships, residual));
    }

    private static Dimension resolveParameter(RecordKind kind, String parameter) throws InvalidFilterException {
        if (RecordFilter.ENTITY_NAMES.equals(parameter)) {
            if (!kind.hasSeparateEntity()) {
                throw new InvalidFilterException(kind.getTableName() + " have no separate entity to filter by");
            }
            return Dimension.ENTITY;
        }
        Dimension dimension = kind.getFilterDimensions().get(parameter);
        if (dimension == null) {
            throw new InvalidFilterException("unsupported filter dimension " + parameter + " for "
                    + kind.getTableName() + "; supported: " + kind.getFilterDimensions().keySet());
        }
        return dimension;
    }
}
