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

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One stored measurement event. Immutable; use {@link #toBuilder()} to derive a modified copy.
 *
 * <p>Entity, experiment, season, site and plot names are denormalized snapshots taken when the record was inserted.
 * Renaming an entity later does not change records already stored.</p>
 *
 * <p>For {@link RecordKind#DATASET} the dataset is the owning entity, so the entity getters return the dataset
 * columns.</p>
 */
public final class Record implements Serializable {
    /** Replay order: timestamp ascending, ties broken by id (unsigned, i.e. canonical string order) */
    public static final Comparator<Record> REPLAY_ORDER = (a, b) -> {
        int c = a.timestamp.compareTo(b.timestamp);
        if (c != 0) return c;
        c = Long.compareUnsigned(a.id.getMostSignificantBits(), b.id.getMostSignificantBits());
        if (c != 0) return c;
        return Long.compareUnsigned(a.id.getLeastSignificantBits(), b.id.getLeastSignificantBits());
    };

    private final RecordKind kind;
    private final UUID id;
    private final Instant timestamp;
    private final LocalDate collectionDate;
    private final UUID datasetId;
    private final String datasetName;
    private final UUID entityId;
    private final String entityName;
    private final UUID experimentId;
    private final String experimentName;
    private final UUID seasonId;
    private final String seasonName;
    private final UUID siteId;
    private final String siteName;
    private final PlotLocation plot;
    private final Map<String, Object> data;
    private final Double value;
    private final String recordFile;
    private final Map<String, Object> recordInfo;

    private Record(Builder b) {
        this.kind = Validate.notNull(b.kind, "kind");
        this.id = Validate.notNull(b.id, "id");
        this.timestamp = Validate.notNull(b.timestamp, "timestamp");
        this.collectionDate = Validate.notNull(b.collectionDate, "collectionDate");
        this.datasetId = b.datasetId;
        this.datasetName = b.datasetName;
        this.entityId = kind.hasSeparateEntity() ? b.entityId : null;
        this.entityName = kind.hasSeparateEntity() ? b.entityName : null;
        this.experimentId = b.experimentId;
        this.experimentName = b.experimentName;
        this.seasonId = b.seasonId;
        this.seasonName = b.seasonName;
        this.siteId = b.siteId;
        this.siteName = b.siteName;
        this.plot = kind.hasPlot() ? b.plot : null;
        if (kind.getPayloadShape() == RecordKind.PayloadShape.MAP) {
            this.data = freeze(b.data);
            this.value = null;
        } else {
            this.data = Collections.emptyMap();
            this.value = b.value;
        }
        this.recordFile = kind.hasRecordFile() ? b.recordFile : null;
        this.recordInfo = freeze(b.recordInfo);
    }

    private static Map<String, Object> freeze(Map<String, Object> map) {
        return map == null || map.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static Builder builder(RecordKind kind) {
        return new Builder(kind);
    }

    public Builder toBuilder() {
        Builder b = new Builder(kind);
        b.id = id;
        b.timestamp = timestamp;
        b.collectionDate = collectionDate;
        b.datasetId = datasetId;
        b.datasetName = datasetName;
        b.entityId = entityId;
        b.entityName = entityName;
        b.experimentId = experimentId;
        b.experimentName = experimentName;
        b.seasonId = seasonId;
        b.seasonName = seasonName;
        b.siteId = siteId;
        b.siteName = siteName;
        b.plot = plot;
        b.data = data;
        b.value = value;
        b.recordFile = recordFile;
        b.recordInfo = recordInfo;
        return b;
    }

    public RecordKind getKind() {
        return kind;
    }

    public UUID getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public LocalDate getCollectionDate() {
        return collectionDate;
    }

    public UUID getDatasetId() {
        return datasetId;
    }

    public String getDatasetName() {
        return datasetName;
    }

    public UUID getEntityId() {
        return kind.hasSeparateEntity() ? entityId : datasetId;
    }

    public String getEntityName() {
        return kind.hasSeparateEntity() ? entityName : datasetName;
    }

    public UUID getExperimentId() {
        return experimentId;
    }

    public String getExperimentName() {
        return experimentName;
    }

    public UUID getSeasonId() {
        return seasonId;
    }

    public String getSeasonName() {
        return seasonName;
    }

    public UUID getSiteId() {
        return siteId;
    }

    public String getSiteName() {
        return siteName;
    }

    /** Null for kinds without plots or records not tied to a plot */
    public PlotLocation getPlot() {
        return plot;
    }

    /** Map payload (sensor_data, dataset_data, ...). Empty for trait records. */
    public Map<String, Object> getData() {
        return data;
    }

    /** Scalar payload (trait_value). Null for map-payload kinds. */
    public Double getValue() {
        return value;
    }

    /** Pointer into object storage, or null */
    public String getRecordFile() {
        return recordFile;
    }

    public Map<String, Object> getRecordInfo() {
        return recordInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record)) return false;
        Record that = (Record) o;
        return new EqualsBuilder()
                .append(kind, that.kind)
                .append(id, that.id)
                .append(timestamp, that.timestamp)
                .append(collectionDate, that.collectionDate)
                .append(datasetId, that.datasetId)
                .append(datasetName, that.datasetName)
                .append(entityId, that.entityId)
                .append(entityName, that.entityName)
                .append(experimentId, that.experimentId)
                .append(experimentName, that.experimentName)
                .append(seasonId, that.seasonId)
                .append(seasonName, that.seasonName)
                .append(siteId, that.siteId)
                .append(siteName, that.siteName)
                .append(plot, that.plot)
                .append(data, that.data)
                .append(value, that.value)
                .append(recordFile, that.recordFile)
                .append(recordInfo, that.recordInfo)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(kind).append(id).append(timestamp).toHashCode();
    }

    @Override
    public String toString() {
        return String.format("<%s-record %s: ts %s, %s=%s, dataset=%s, experiment=%s, season=%s, site=%s>",
                kind.getEntityName(), id, timestamp, kind.getEntityNameField(), getEntityName(), datasetName,
                experimentName, seasonName, siteName);
    }

    public static class Builder {
        private final RecordKind kind;
        private UUID id;
        private Instant timestamp;
        private LocalDate collectionDate;
        private UUID datasetId;
        private String datasetName;
        private UUID entityId;
        private String entityName;
        private UUID experimentId;
        private String experimentName;
        private UUID seasonId;
        private String seasonName;
        private UUID siteId;
        private String siteName;
        private PlotLocation plot;
        private Map<String, Object> data;
        private Double value;
        private String recordFile;
        private Map<String, Object> recordInfo;

        private Builder(RecordKind kind) {
            this.kind = Validate.notNull(kind, "kind");
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder collectionDate(LocalDate collectionDate) {
            this.collectionDate = collectionDate;
            return this;
        }

        public Builder dataset(UUID datasetId, String datasetName) {
            this.datasetId = datasetId;
            this.datasetName = datasetName;
            return this;
        }

        public Builder entity(UUID entityId, String entityName) {
            this.entityId = entityId;
            this.entityName = entityName;
            return this;
        }

        public Builder experiment(UUID experimentId, String experimentName) {
            this.experimentId = experimentId;
            this.experimentName = experimentName;
            return this;
        }

        public Builder season(UUID seasonId, String seasonName) {
            this.seasonId = seasonId;
            this.seasonName = seasonName;
            return this;
        }

        public Builder site(UUID siteId, String siteName) {
            this.siteId = siteId;
            this.siteName = siteName;
            return this;
        }

        public Builder plot(PlotLocation plot) {
            this.plot = plot;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder value(Double value) {
            this.value = value;
            return this;
        }

        public Builder recordFile(String recordFile) {
            this.recordFile = recordFile;
            return this;
        }

        public Builder recordInfo(Map<String, Object> recordInfo) {
            this.recordInfo = recordInfo;
            return this;
        }

        public Record build() {
            return new Record(this);
        }
    }
}
