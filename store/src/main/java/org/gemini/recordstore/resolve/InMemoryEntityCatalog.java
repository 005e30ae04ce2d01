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

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Entity catalog held in process memory. Used when the record store is embedded without the entity services, and in
 * tests. Entity ids are random UUIDs, matching what the entity tables generate.
 */
public class InMemoryEntityCatalog implements EntityCatalog {
    private final Map<EntityType, Map<String, EntityRef>> byName = new EnumMap<>(EntityType.class);
    /** experiment name -> season name -> season */
    private final Map<String, Map<String, EntityRef>> seasons = new ConcurrentHashMap<>();
    /** plot position key -> plot */
    private final Map<String, EntityRef> plots = new ConcurrentHashMap<>();
    private final Map<Association, Set<Pair<EntityRef, EntityRef>>> associations = new EnumMap<>(Association.class);

    public InMemoryEntityCatalog() {
        for (EntityType type : EntityType.values()) {
            byName.put(type, new ConcurrentHashMap<>());
        }
        for (Association association : Association.values()) {
            associations.put(association, new CopyOnWriteArraySet<>());
        }
    }

    /** Register an entity with a unique name, returning the existing one if already present */
    public EntityRef add(EntityType type, String name) {
        Validate.isTrue(type != EntityType.SEASON && type != EntityType.PLOT,
                "use addSeason/addPlot for scoped entities");
        Validate.notBlank(name, "name");
        return byName.get(type).computeIfAbsent(name, n -> new EntityRef(type, UUID.randomUUID(), n));
    }

    public EntityRef addSeason(String experimentName, String seasonName) {
        EntityRef experiment = add(EntityType.EXPERIMENT, experimentName);
        EntityRef season = seasons.computeIfAbsent(experimentName, e -> new ConcurrentHashMap<>())
                .computeIfAbsent(seasonName, s -> new EntityRef(EntityType.SEASON, UUID.randomUUID(), s));
        associate(Association.EXPERIMENT_SEASONS, experiment, season);
        return season;
    }

    public EntityRef addPlot(String experimentName, String seasonName, String siteName,
                             int plotNumber, int plotRowNumber, int plotColumnNumber) {
        String key = plotKey(experimentName, seasonName, siteName, plotNumber, plotRowNumber, plotColumnNumber);
        return plots.computeIfAbsent(key, k -> new EntityRef(EntityType.PLOT, UUID.randomUUID(), k));
    }

    /**
     * Rename an entity in place, keeping its id. Records inserted earlier keep the old name; that is the
     * snapshot-at-write-time contract of the record store.
     */
    public EntityRef rename(EntityType type, String oldName, String newName) {
        Map<String, EntityRef> names = byName.get(type);
        synchronized (names) {
            EntityRef old = names.remove(oldName);
            Validate.isTrue(old != null, "no %s named %s", type.getName(), oldName);
            EntityRef renamed = new EntityRef(type, old.getId(), newName);
            names.put(newName, renamed);
            return renamed;
        }
    }

    public void associate(Association association, EntityRef left, EntityRef right) {
        Validate.isTrue(left.getType() == association.getLeft() && right.getType() == association.getRight(),
                "%s associates %s with %s", association, association.getLeft(), association.getRight());
        associations.get(association).add(new ImmutablePair<>(left, right));
    }

    /** Associate two uniquely named entities, registering either if missing */
    public void associate(Association association, String leftName, String rightName) {
        associate(association, add(association.getLeft(), leftName), add(association.getRight(), rightName));
    }

    @Override
    public Optional<EntityRef> find(EntityType type, String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(byName.get(type).get(name));
    }

    @Override
    public Optional<EntityRef> findSeason(String experimentName, String seasonName) {
        if (seasonName == null) return Optional.empty();
        if (experimentName != null) {
            Map<String, EntityRef> experimentSeasons = seasons.get(experimentName);
            return experimentSeasons == null
                    ? Optional.empty()
                    : Optional.ofNullable(experimentSeasons.get(seasonName));
        }
        for (Map<String, EntityRef> experimentSeasons : seasons.values()) {
            EntityRef season = experimentSeasons.get(seasonName);
            if (season != null) {
                return Optional.of(season);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<EntityRef> findPlot(String experimentName, String seasonName, String siteName,
                                        int plotNumber, int plotRowNumber, int plotColumnNumber) {
        return Optional.ofNullable(plots.get(
                plotKey(experimentName, seasonName, siteName, plotNumber, plotRowNumber, plotColumnNumber)));
    }

    @Override
    public Collection<Pair<EntityRef, EntityRef>> associations(Association association) {
        List<Pair<EntityRef, EntityRef>> ret = new ArrayList<>(associations.get(association));
        return ret;
    }

    private static String plotKey(String experimentName, String seasonName, String siteName,
                                  int plotNumber, int plotRowNumber, int plotColumnNumber) {
        return String.format("%s/%s/%s/%d/%d/%d", experimentName, seasonName, siteName,
                plotNumber, plotRowNumber, plotColumnNumber);
    }
}
