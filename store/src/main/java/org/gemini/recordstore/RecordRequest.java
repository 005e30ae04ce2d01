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
import java.time.LocalDate;
import java.util.Map;

/**
 * Caller-supplied record contents for the write path. Related entities are referenced by human-readable name only;
 * {@link org.gemini.recordstore.resolve.DimensionResolver} turns them into ids and canonical names.
 *
 * <p>For dataset records, {@link #setEntityName} is ignored: the dataset is the entity.</p>
 */
public class RecordRequest {
    private Instant timestamp;
    private LocalDate collectionDate;
    private String datasetName;
    private String entityName;
    private String experimentName;
    private String seasonName;
    private String siteName;
    private Integer plotNumber, plotRowNumber, plotColumnNumber;
    private Map<String, Object> data;
    private Double value;
    private String recordFile;
    private Map<String, Object> recordInfo;

    /** Observation time. Defaults to now. */
    public RecordRequest setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    /** Collection date. Defaults to today in the store's zone. */
    public RecordRequest setCollectionDate(LocalDate collectionDate) {
        this.collectionDate = collectionDate;
        return this;
    }

    public RecordRequest setDatasetName(String datasetName) {
        this.datasetName = datasetName;
        return this;
    }

    /** Sensor, trait, procedure, script or model name, depending on the record kind */
    public RecordRequest setEntityName(String entityName) {
        this.entityName = entityName;
        return this;
    }

    public RecordRequest setExperimentName(String experimentName) {
        this.experimentName = experimentName;
        return this;
    }

    public RecordRequest setSeasonName(String seasonName) {
        this.seasonName = seasonName;
        return this;
    }

    public RecordRequest setSiteName(String siteName) {
        this.siteName = siteName;
        return this;
    }

    /** Sensor and trait records only. All three coordinates must be given together. */
    public RecordRequest setPlot(Integer plotNumber, Integer plotRowNumber, Integer plotColumnNumber) {
        this.plotNumber = plotNumber;
        this.plotRowNumber = plotRowNumber;
        this.plotColumnNumber = plotColumnNumber;
        return this;
    }

    /** Map payload for sensor, dataset, procedure, script and model records */
    public RecordRequest setData(Map<String, Object> data) {
        this.data = data;
        return this;
    }

    /** Scalar payload for trait records */
    public RecordRequest setValue(Double value) {
        this.value = value;
        return this;
    }

    public RecordRequest setRecordFile(String recordFile) {
        this.recordFile = recordFile;
        return this;
    }

    public RecordRequest setRecordInfo(Map<String, Object> recordInfo) {
        this.recordInfo = recordInfo;
        return this;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public LocalDate getCollectionDate() {
        return collectionDate;
    }

    public String getDatasetName() {
        return datasetName;
    }

    public String getEntityName() {
        return entityName;
    }

    public String getExperimentName() {
        return experimentName;
    }

    public String getSeasonName() {
        return seasonName;
    }

    public String getSiteName() {
        return siteName;
    }

    public Integer getPlotNumber() {
        return plotNumber;
    }

    public Integer getPlotRowNumber() {
        return plotRowNumber;
    }

    public Integer getPlotColumnNumber() {
        return plotColumnNumber;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Double getValue() {
        return value;
    }

    public String getRecordFile() {
        return recordFile;
    }

    public Map<String, Object> getRecordInfo() {
        return recordInfo;
    }
}
