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

package io.shardkeeper.server.shard;

import java.util.Map;
import java.util.Set;

import io.kubernetes.client.common.KubernetesObject;
import io.shardkeeper.common.util.ExceptionExt;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.kubernetes.reconciler.ReconcileResult;
import io.shardkeeper.server.shard.model.ShardStatus;
import io.shardkeeper.server.shard.model.TabletShard;
import io.shardkeeper.server.shard.model.TabletSpec;
import io.shardkeeper.server.tablet.TabletLabels;

/**
 * State shared by the strategies of one reconciliation pass of a shard.
 */
class TabletReconcileContext {

    private final TabletShard shard;
    private final ShardStatus status;
    private final Map<ObjectKey, TabletSpec> tablets;
    private final Set<String> deployedCells;
    private final ReconcileResult.Builder resultBuilder;

    TabletReconcileContext(TabletShard shard,
                           ShardStatus status,
                           Map<ObjectKey, TabletSpec> tablets,
                           Set<String> deployedCells,
                           ReconcileResult.Builder resultBuilder) {
        this.shard = shard;
        this.status = status;
        this.tablets = tablets;
        this.deployedCells = deployedCells;
        this.resultBuilder = resultBuilder;
    }

    TabletShard getShard() {
        return shard;
    }

    ShardStatus getStatus() {
        return status;
    }

    ReconcileResult.Builder getResultBuilder() {
        return resultBuilder;
    }

    TabletSpec getTablet(ObjectKey key) {
        TabletSpec spec = tablets.get(key);
        if (spec == null) {
            throw new IllegalStateException("No desired tablet with key " + key);
        }
        return spec;
    }

    /**
     * Adds the failure to the message of the desired tablet, after failures of its other objects.
     */
    void recordError(ObjectKey key, String kind, Throwable error) {
        String failure = kind + ": " + ExceptionExt.toMessageChain(error);
        status.updateTablet(getTablet(key).getAlias().toString(), tabletStatus -> tabletStatus.toBuilder()
                .withMessage(tabletStatus.getMessage().isEmpty() ? failure : tabletStatus.getMessage() + "; " + failure)
                .build()
        );
    }

    void addDeployedCell(String cell) {
        deployedCells.add(cell);
    }

    /**
     * Alias of an object that is not desired, recovered from its labels. Falls back to the object key.
     */
    String orphanAlias(ObjectKey key, KubernetesObject object) {
        return TabletLabels.aliasFromLabels(object).map(Object::toString).orElse(key.toString());
    }
}
