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

import org.gemini.recordstore.PlotLocation;
import org.gemini.recordstore.Record;

/** Canonical entities for every name a record request referenced. Unreferenced dimensions are null. */
public class ResolvedDimensions {
    final EntityRef dataset;
    final EntityRef entity;
    final EntityRef experiment;
    final EntityRef season;
    final EntityRef site;
    final PlotLocation plot;

    ResolvedDimensions(EntityRef dataset, EntityRef entity, EntityRef experiment, EntityRef season, EntityRef site,
                       PlotLocation plot) {
        this.dataset = dataset;
        this.entity = entity;
        this.experiment = experiment;
        this.season = season;
        this.site = site;
        this.plot = plot;
    }

    public EntityRef getDataset() {
        return dataset;
    }

    public EntityRef getEntity() {
        return entity;
    }

    public EntityRef getExperiment() {
        return experiment;
    }

    public EntityRef getSeason() {
        return season;
    }

    public EntityRef getSite() {
        return site;
    }

    public PlotLocation getPlot() {
        return plot;
    }

    /** Stamp the resolved ids and names onto a record under construction */
    public Record.Builder stamp(Record.Builder builder) {
        if (dataset != null) builder.dataset(dataset.getId(), dataset.getName());
        if (entity != null) builder.entity(entity.getId(), entity.getName());
        if (experiment != null) builder.experiment(experiment.getId(), experiment.getName());
        if (season != null) builder.season(season.getId(), season.getName());
        if (site != null) builder.site(site.getId(), site.getName());
        if (plot != null) builder.plot(plot);
        return builder;
    }
}
