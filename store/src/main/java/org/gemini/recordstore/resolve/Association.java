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

/** Many-to-many association tables owned by the entity services. */
public enum Association {
    EXPERIMENT_SITES(EntityType.EXPERIMENT, EntityType.SITE),
    EXPERIMENT_SEASONS(EntityType.EXPERIMENT, EntityType.SEASON),
    EXPERIMENT_DATASETS(EntityType.EXPERIMENT, EntityType.DATASET),
    EXPERIMENT_SENSORS(EntityType.EXPERIMENT, EntityType.SENSOR),
    EXPERIMENT_TRAITS(EntityType.EXPERIMENT, EntityType.TRAIT),
    EXPERIMENT_CULTIVARS(EntityType.EXPERIMENT, EntityType.CULTIVAR),
    PLOT_CULTIVARS(EntityType.PLOT, EntityType.CULTIVAR),
    SENSOR_DATASETS(EntityType.SENSOR, EntityType.DATASET),
    TRAIT_DATASETS(EntityType.TRAIT, EntityType.DATASET),
    PROCEDURE_DATASETS(EntityType.PROCEDURE, EntityType.DATASET),
    SCRIPT_DATASETS(EntityType.SCRIPT, EntityType.DATASET),
    MODEL_DATASETS(EntityType.MODEL, EntityType.DATASET);

    private final EntityType left, right;

    Association(EntityType left, EntityType right) {
        this.left = left;
        this.right = right;
    }

    public EntityType getLeft() {
        return left;
    }

    public EntityType getRight() {
        return right;
    }

    /** e.g. "experiment_sites_view" */
    public String getViewName() {
        return name().toLowerCase() + "_view";
    }
}
