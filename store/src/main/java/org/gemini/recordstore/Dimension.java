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

/** Categorical dimensions a filter can constrain by denormalized name. */
public enum Dimension {
    DATASET,
    /** the kind-specific entity: sensor, trait, procedure, script or model */
    ENTITY,
    EXPERIMENT,
    SEASON,
    SITE;

    /** Denormalized name of this dimension on a record, or null if the record has none */
    public String nameOf(Record record) {
        switch (this) {
            case DATASET:
                return record.getDatasetName();
            case ENTITY:
                return record.getEntityName();
            case EXPERIMENT:
                return record.getExperimentName();
            case SEASON:
                return record.getSeasonName();
            case SITE:
                return record.getSiteName();
            default:
                throw new IllegalStateException("unhandled dimension " + this);
        }
    }
}
