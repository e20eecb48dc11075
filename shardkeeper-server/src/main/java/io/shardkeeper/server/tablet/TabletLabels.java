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

package io.shardkeeper.server.tablet;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import io.kubernetes.client.common.KubernetesObject;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.shard.model.TabletAlias;
import io.shardkeeper.server.shard.model.TabletShard;

/**
 * Labels identifying tablet objects. The parent labels scope the objects of one shard, and the tablet labels
 * identify one tablet within it.
 */
public final class TabletLabels {

    private static final String PREFIX = "shardkeeper.io/";

    public static final String COMPONENT = PREFIX + "component";
    public static final String CLUSTER = PREFIX + "cluster";
    public static final String KEYSPACE = PREFIX + "keyspace";
    public static final String SHARD = PREFIX + "shard";
    public static final String CELL = PREFIX + "cell";
    public static final String TABLET_UID = PREFIX + "tablet-uid";
    public static final String TABLET_TYPE = PREFIX + "tablet-type";
    public static final String TABLET_INDEX = PREFIX + "tablet-index";

    public static final String COMPONENT_VTTABLET = "vttablet";

    private TabletLabels() {
    }

    /**
     * Selector of all tablet objects owned by the shard.
     */
    public static Map<String, String> parentLabels(TabletShard shard) {
        Map<String, String> labels = new HashMap<>();
        labels.put(COMPONENT, COMPONENT_VTTABLET);
        labels.put(CLUSTER, shard.getClusterName());
        labels.put(KEYSPACE, shard.getKeyspaceName());
        labels.put(SHARD, shard.getKeyRange().toSafeName());
        return labels;
    }

    /**
     * Recovers the tablet alias from the labels of a live object. Returns empty if the labels are missing or
     * malformed.
     */
    public static Optional<TabletAlias> aliasFromLabels(KubernetesObject object) {
        Map<String, String> labels = KubeUtil.getLabels(object);
        String cell = labels.get(CELL);
        String uid = labels.get(TABLET_UID);
        if (cell == null || cell.isEmpty() || uid == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(TabletAlias.of(cell, Long.parseLong(uid)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
