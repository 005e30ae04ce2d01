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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/** One row of a summary view: the group's dimension names and its aggregate */
public final class SummaryGroup {
    private final String entityName;
    private final String datasetName;
    private final String experimentName;
    private final String seasonName;
    private final String siteName;
    private final RecordSummary summary;

    SummaryGroup(String entityName, String datasetName, String experimentName, String seasonName, String siteName,
                 RecordSummary summary) {
        this.entityName = entityName;
        this.datasetName = datasetName;
        this.experimentName = experimentName;
        this.seasonName = seasonName;
        this.siteName = siteName;
        this.summary = summary;
    }

    public String getEntityName() {
        return entityName;
    }

    public String getDatasetName() {
        return datasetName;
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

    public RecordSummary getSummary() {
        return summary;
    }

    /** True if this group's dimension names equal the given ones (nulls included) */
    public boolean matches(String entityName, String datasetName, String experimentName, String seasonName,
                           String siteName) {
        return new EqualsBuilder()
                .append(this.entityName, entityName)
                .append(this.datasetName, datasetName)
                .append(this.experimentName, experimentName)
                .append(this.seasonName, seasonName)
                .append(this.siteName, siteName)
                .isEquals();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SummaryGroup)) return false;
        SummaryGroup other = (SummaryGroup) o;
        return matches(other.entityName, other.datasetName, other.experimentName, other.seasonName, other.siteName);
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder()
                .append(entityName).append(datasetName).append(experimentName).append(seasonName).append(siteName)
                .toHashCode();
    }

    @Override
    public String toString() {
        return String.format("%s/%s/%s/%s/%s: %s", entityName, datasetName, experimentName, seasonName, siteName,
                summary);
    }
}
