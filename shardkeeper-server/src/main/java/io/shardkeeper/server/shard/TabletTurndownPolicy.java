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

import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.server.drain.DrainAnnotations;
import io.shardkeeper.server.kubernetes.reconciler.OrphanStatus;
import io.shardkeeper.server.shard.model.ConditionStatus;
import io.shardkeeper.server.shard.model.ShardStatus;
import io.shardkeeper.server.shard.model.TabletAlias;
import io.shardkeeper.server.shard.model.TabletShard;
import io.shardkeeper.server.shard.model.TabletStatus;
import io.shardkeeper.server.tablet.TabletLabels;
import io.shardkeeper.server.topology.PrimaryCheck;
import io.shardkeeper.server.topology.PrimaryTabletResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a tablet pod that is no longer desired can be deleted. The gates run in a fixed order, and the
 * first one that fails keeps the pod:
 * <ol>
 *     <li>the tablet must be drained (the drain is requested on first refusal)</li>
 *     <li>the tablet must not be the primary in the global shard record</li>
 *     <li>all desired tablets of the shard must be ready</li>
 * </ol>
 * The policy is evaluated again on every pass. Its only side effect, requesting a drain, is idempotent.
 */
@Singleton
public class TabletTurndownPolicy {

    private static final Logger logger = LoggerFactory.getLogger(TabletTurndownPolicy.class);

    public static final String REASON_DRAINING = "Draining";
    public static final String REASON_PRIMARY_UNKNOWN = "PrimaryUnknown";
    public static final String REASON_PRIMARY = "Primary";
    public static final String REASON_SHARD_NOT_HEALTHY = "ShardNotHealthy";

    static final String DRAIN_REASON = "turning down unwanted tablet";

    private final PrimaryTabletResolver primaryTabletResolver;

    @Inject
    public TabletTurndownPolicy(PrimaryTabletResolver primaryTabletResolver) {
        this.primaryTabletResolver = primaryTabletResolver;
    }

    /**
     * Returns the reason to keep the pod, or empty if it may be deleted. The status must already hold the state of
     * all desired tablets of this pass.
     */
    public Optional<OrphanStatus> prepareForTurndown(TabletShard shard, ShardStatus status, V1Pod pod) {
        if (!DrainAnnotations.isFinished(pod)) {
            DrainAnnotations.start(pod, DRAIN_REASON);
            return refuse(pod, REASON_DRAINING, "waiting for the tablet to be drained before turn-down");
        }

        Optional<TabletAlias> alias = TabletLabels.aliasFromLabels(pod);
        if (!alias.isPresent()) {
            return refuse(pod, REASON_PRIMARY_UNKNOWN, "tablet alias labels are missing, cannot check whether the tablet is the primary");
        }
        PrimaryCheck primaryCheck = primaryTabletResolver.check(shard, alias.get());
        if (primaryCheck == PrimaryCheck.UNKNOWN) {
            return refuse(pod, REASON_PRIMARY_UNKNOWN, "unable to determine whether this tablet is the primary");
        }
        if (primaryCheck == PrimaryCheck.PRIMARY) {
            return refuse(pod, REASON_PRIMARY, "this tablet is the primary");
        }

        for (TabletStatus tablet : status.getTablets().values()) {
            if (tablet.getReady() != ConditionStatus.TRUE) {
                return refuse(pod, REASON_SHARD_NOT_HEALTHY, "the remaining, desired tablets in the shard are not all healthy");
            }
        }
        return Optional.empty();
    }

    private static Optional<OrphanStatus> refuse(V1Pod pod, String reason, String message) {
        logger.info("Not turning down tablet pod {}: {} ({})", pod.getMetadata().getName(), reason, message);
        return Optional.of(new OrphanStatus(reason, message));
    }
}
