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

import org.apache.commons.lang3.tuple.Pair;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only view of the entity services: canonical name -> id resolution plus the association tables. Implementations
 * must be safe for concurrent use.
 */
public interface EntityCatalog {
    /** Look up an entity by its unique name. Not used for seasons or plots, whose names are scoped. */
    Optional<EntityRef> find(EntityType type, String name);

    /** Seasons are named per experiment; a null experimentName matches a season of that name in any experiment */
    Optional<EntityRef> findSeason(String experimentName, String seasonName);

    /** Plots are identified by their position within an experiment, season and site */
    Optional<EntityRef> findPlot(String experimentName, String seasonName, String siteName,
                                 int plotNumber, int plotRowNumber, int plotColumnNumber);

    /** Current contents of an association table as (left, right) pairs */
    Collection<Pair<EntityRef, EntityRef>> associations(Association association);
}
