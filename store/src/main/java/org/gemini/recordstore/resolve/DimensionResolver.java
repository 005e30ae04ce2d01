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

import org.gemini.recordstore.InvalidRecordException;
import org.gemini.recordstore.PlotLocation;
import org.gemini.recordstore.RecordKind;
import org.gemini.recordstore.RecordRequest;
import org.gemini.recordstore.UnknownEntityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the names on a record request to canonical entities. This is the only place referential integrity between
 * records and entities is checked; once a record is stored the two are decoupled.
 */
public class DimensionResolver {
    private static final Logger logger = LoggerFactory.getLogger(DimensionResolver.class);

    private final EntityCatalog catalog;

    public DimensionResolver(EntityCatalog catalog) {
        this.catalog = catalog;
    }

    public EntityCatalog getCatalog() {
        return catalog;
    }

    /**
     * @throws UnknownEntityException naming the first reference that does not resolve
     * @throws InvalidRecordException if a plot is only partially specified
     */
    public ResolvedDimensions resolve(RecordKind kind, RecordRequest request)
            throws UnknownEntityException, InvalidRecordException {
        EntityRef dataset = resolve(EntityType.DATASET, request.getDatasetName());
        EntityRef entity = kind.hasSeparateEntity()
                ? resolve(kind.getEntityType(), request.getEntityName())
                : null;
        EntityRef experiment = resolve(EntityType.EXPERIMENT, request.getExperimentName());
        EntityRef season = null;
        if (request.getSeasonName() != null) {
            season = catalog.findSeason(request.getExperimentName(), request.getSeasonName())
                    .orElseThrow(() -> request.getExperimentName() != null
                            ? new UnknownEntityException(EntityType.SEASON, request.getSeasonName(),
                                "no season named " + request.getSeasonName() + " in experiment "
                                        + request.getExperimentName())
                            : new UnknownEntityException(EntityType.SEASON, request.getSeasonName()));
        }
        EntityRef site = resolve(EntityType.SITE, request.getSiteName());
        PlotLocation plot = kind.hasPlot() ? resolvePlot(request) : null;

        ResolvedDimensions resolved = new ResolvedDimensions(dataset, entity, experiment, season, site, plot);
        logger.debug("resolved {} record dimensions: dataset={}, entity={}, experiment={}, season={}, site={}",
                kind.getEntityName(), dataset, entity, experiment, season, site);
        return resolved;
    }

    private EntityRef resolve(EntityType type, String name) throws UnknownEntityException {
        if (name == null) {
            return null;
        }
        return catalog.find(type, name).orElseThrow(() -> new UnknownEntityException(type, name));
    }

    private PlotLocation resolvePlot(RecordRequest request) throws UnknownEntityException, InvalidRecordException {
        Integer number = request.getPlotNumber(), row = request.getPlotRowNumber(), col = request.getPlotColumnNumber();
        if (number == null && row == null && col == null) {
            return null;
        }
        if (number == null || row == null || col == null) {
            throw new InvalidRecordException(
                    "plot number, plot row number and plot column number are required if a plot is specified");
        }
        String desc = String.format("%d (row %d, column %d)", number, row, col);
        EntityRef plot = catalog.findPlot(request.getExperimentName(), request.getSeasonName(), request.getSiteName(),
                number, row, col)
                .orElseThrow(() -> new UnknownEntityException(EntityType.PLOT, desc, "no plot " + desc + " in "
                        + request.getExperimentName() + "/" + request.getSeasonName() + "/" + request.getSiteName()));
        return new PlotLocation(plot.getId(), number, row, col);
    }
}
