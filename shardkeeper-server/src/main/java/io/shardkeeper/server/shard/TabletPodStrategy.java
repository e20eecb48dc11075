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

import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.kubernetes.reconciler.ObjectSetStrategy;
import io.shardkeeper.server.kubernetes.reconciler.OrphanStatus;
import io.shardkeeper.server.kubernetes.reconciler.RolloutAnnotations;
import io.shardkeeper.server.shard.model.ConditionStatus;
import io.shardkeeper.server.shard.model.TabletSpec;
import io.shardkeeper.server.tablet.TabletLabels;
import io.shardkeeper.server.tablet.TabletPodFactory;

class TabletPodStrategy implements ObjectSetStrategy<V1Pod> {

    private final TabletReconcileContext context;
    private final TabletPodFactory podFactory;
    private final TabletAvailabilityTracker availabilityTracker;
    private final VolumeResizePropagator resizePropagator;
    private final TabletTurndownPolicy turndownPolicy;

    TabletPodStrategy(TabletReconcileContext context,
                      TabletPodFactory podFactory,
                      TabletAvailabilityTracker availabilityTracker,
                      VolumeResizePropagator resizePropagator,
                      TabletTurndownPolicy turndownPolicy) {
        this.context = context;
        this.podFactory = podFactory;
        this.availabilityTracker = availabilityTracker;
        this.resizePropagator = resizePropagator;
        this.turndownPolicy = turndownPolicy;
    }

    @Override
    public V1Pod newObject(ObjectKey key) {
        TabletSpec tablet = context.getTablet(key);
        context.getStatus().updateTablet(tablet.getAlias().toString(), status -> status.toBuilder()
                .withRunning(ConditionStatus.FALSE)
                .withReady(ConditionStatus.FALSE)
                .withAvailable(ConditionStatus.FALSE)
                .build()
        );
        V1Pod pod = podFactory.newPod(key, tablet);
        availabilityTracker.stampGeneration(pod, context.getShard().getGeneration());
        return pod;
    }

    @Override
    public void updateInPlace(ObjectKey key, V1Pod pod) {
        podFactory.updatePodInPlace(pod, context.getTablet(key));
        availabilityTracker.stampGeneration(pod, context.getShard().getGeneration());
    }

    @Override
    public void updateRollingRecreate(ObjectKey key, V1Pod pod) {
        TabletSpec tablet = resizePropagator.propagate(context.getTablet(key), pod);
        podFactory.updatePod(pod, tablet);
    }

    @Override
    public void status(ObjectKey key, V1Pod pod) {
        TabletSpec tablet = context.getTablet(key);
        boolean ready = KubeUtil.isPodReady(pod);
        ConditionStatus available = ready
                ? availabilityTracker.availability(pod, context.getResultBuilder())
                : ConditionStatus.FALSE;
        context.getStatus().updateTablet(tablet.getAlias().toString(), status -> status.toBuilder()
                .withRunning(ConditionStatus.of(KubeUtil.isPodRunning(pod)))
                .withReady(ConditionStatus.of(ready))
                .withAvailable(available)
                .withPendingChanges(RolloutAnnotations.getScheduledChanges(pod))
                .build()
        );
        availabilityTracker.observeGeneration(pod, context.getStatus());
    }

    @Override
    public void reconcileError(ObjectKey key, Throwable error) {
        context.recordError(key, "pod", error);
    }

    @Override
    public void orphanStatus(ObjectKey key, V1Pod pod, OrphanStatus orphanStatus) {
        context.getStatus().putOrphanedTablet(context.orphanAlias(key, pod), orphanStatus);
        // A kept tablet still occupies its cell.
        TabletLabels.aliasFromLabels(pod).ifPresent(alias -> context.addDeployedCell(alias.getCell()));
    }

    @Override
    public Optional<OrphanStatus> prepareForTurndown(ObjectKey key, V1Pod pod) {
        return turndownPolicy.prepareForTurndown(context.getShard(), context.getStatus(), pod);
    }
}
