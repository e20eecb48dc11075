/*
 * Copyright 2021 Netflix, Inc.
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

package io.shardkeeper.server.shard.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

import io.shardkeeper.server.kubernetes.reconciler.OrphanStatus;

/**
 * Shard status rebuilt on every reconciliation pass. Not thread safe; a pass owns its instance.
 */
public class ShardStatus {

    /**
     * Value of {@link #getLowestPodGeneration()} before any pod reported its observed generation.
     */
    public static final long GENERATION_UNSET = 0;

    private final Map<String, TabletStatus> tablets = new TreeMap<>();
    private final Map<String, OrphanStatus> orphanedTablets = new TreeMap<>();
    private List<String> cells = Collections.emptyList();
    private long lowestPodGeneration = GENERATION_UNSET;

    /**
     * Status of every desired tablet, keyed by alias.
     */
    public Map<String, TabletStatus> getTablets() {
        return Collections.unmodifiableMap(tablets);
    }

    public void putTablet(String alias, TabletStatus status) {
        tablets.put(alias, status);
    }

    /**
     * Replaces the status of an existing tablet. Does nothing if the tablet has no status.
     */
    public void updateTablet(String alias, UnaryOperator<TabletStatus> updater) {
        tablets.computeIfPresent(alias, (key, current) -> updater.apply(current));
    }

    /**
     * Reasons why tablets that are no longer desired have not been removed yet, keyed by alias.
     */
    public Map<String, OrphanStatus> getOrphanedTablets() {
        return Collections.unmodifiableMap(orphanedTablets);
    }

    public void putOrphanedTablet(String alias, OrphanStatus status) {
        orphanedTablets.put(alias, status);
    }

    public boolean hasOrphanedTablet(String alias) {
        return orphanedTablets.containsKey(alias);
    }

    /**
     * Sorted names of the cells with desired tablets or retained orphans.
     */
    public List<String> getCells() {
        return cells;
    }

    public void setCells(Collection<String> cells) {
        this.cells = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(cells)));
    }

    public long getLowestPodGeneration() {
        return lowestPodGeneration;
    }

    /**
     * Lowers the low-water mark to the given generation. The first observation sets it.
     */
    public void observePodGeneration(long generation) {
        if (lowestPodGeneration == GENERATION_UNSET || generation < lowestPodGeneration) {
            lowestPodGeneration = generation;
        }
    }

    @Override
    public String toString() {
        return "ShardStatus{" +
                "cells=" + cells +
                ", tablets=" + tablets +
                ", orphanedTablets=" + orphanedTablets +
                ", lowestPodGeneration=" + lowestPodGeneration +
                '}';
    }
}
