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

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.common.runtime.OperatorRuntime;
import io.shardkeeper.common.util.ExceptionExt;
import io.shardkeeper.common.util.spectator.ActionMetrics;
import io.shardkeeper.server.kubernetes.KubeApiFacade;
import io.shardkeeper.server.kubernetes.KubeObjectClient;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.kubernetes.reconciler.ObjectSetReconciler;
import io.shardkeeper.server.kubernetes.reconciler.ReconcileResult;
import io.shardkeeper.server.shard.model.ShardStatus;
import io.shardkeeper.server.shard.model.TabletShard;
import io.shardkeeper.server.shard.model.TabletSpec;
import io.shardkeeper.server.shard.model.TabletStatus;
import io.shardkeeper.server.tablet.TabletLabels;
import io.shardkeeper.server.tablet.TabletPodFactory;
import io.shardkeeper.server.tablet.TabletPvcFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one reconciliation pass of the tablets of a shard: data volume claims first, then pods, since pod updates
 * read the claim state. All state needed by the pass is rebuilt from the shard and the live objects, so passes may
 * run on any worker. Passes of the same shard must not run concurrently.
 */
@Singleton
public class ShardTabletReconciler {

    private static final Logger logger = LoggerFactory.getLogger(ShardTabletReconciler.class);

    static final String METRIC_ROOT = "shardkeeper.shard.reconcile";

    private final KubeApiFacade kubeApiFacade;
    private final ObjectSetReconciler objectSetReconciler;
    private final TabletSpecCompiler specCompiler;
    private final TabletPodFactory podFactory;
    private final TabletPvcFactory pvcFactory;
    private final TabletAvailabilityTracker availabilityTracker;
    private final VolumeResizePropagator resizePropagator;
    private final TabletTurndownPolicy turndownPolicy;
    private final ActionMetrics metrics;

    @Inject
    public ShardTabletReconciler(KubeApiFacade kubeApiFacade,
                                 ObjectSetReconciler objectSetReconciler,
                                 TabletSpecCompiler specCompiler,
                                 TabletPodFactory podFactory,
                                 TabletPvcFactory pvcFactory,
                                 TabletAvailabilityTracker availabilityTracker,
                                 VolumeResizePropagator resizePropagator,
                                 TabletTurndownPolicy turndownPolicy,
                                 OperatorRuntime runtime) {
        this.kubeApiFacade = kubeApiFacade;
        this.objectSetReconciler = objectSetReconciler;
        this.specCompiler = specCompiler;
        this.podFactory = podFactory;
        this.pvcFactory = pvcFactory;
        this.availabilityTracker = availabilityTracker;
        this.resizePropagator = resizePropagator;
        this.turndownPolicy = turndownPolicy;
        this.metrics = new ActionMetrics(runtime.getRegistry().createId(METRIC_ROOT), runtime.getRegistry());
    }

    /**
     * Reconciles the tablet objects of the shard and fills in the status. Every desired tablet gets a status entry,
     * even if none of its objects exist yet.
     */
    public ReconcileResult reconcileTablets(TabletShard shard, ShardStatus status) {
        long startTime = metrics.start();
        ReconcileResult result;
        try {
            result = doReconcile(shard, status);
        } catch (RuntimeException e) {
            metrics.failure(startTime, e);
            throw e;
        }
        if (result.getError().isPresent()) {
            Throwable error = result.getError().get();
            // Aggregated failures keep the first error as the cause and the rest as suppressed exceptions.
            List<Throwable> failures = ExceptionExt.flattenSuppressed(error);
            logger.warn("Tablet reconciliation of shard {}/{} failed with {} error(s)", shard.getNamespace(), shard.getName(),
                    failures.size());
            for (Throwable failure : failures) {
                logger.warn("Shard {}/{} failure: {}", shard.getNamespace(), shard.getName(), ExceptionExt.toMessageChain(failure));
            }
            metrics.failure(startTime, error);
        } else {
            logger.debug("Tablet reconciliation of shard {}/{} completed: {}", shard.getNamespace(), shard.getName(), result);
            metrics.finish(startTime);
        }
        return result;
    }

    private ReconcileResult doReconcile(TabletShard shard, ShardStatus status) {
        Map<String, String> labels = TabletLabels.parentLabels(shard);
        List<TabletSpec> tablets = specCompiler.compile(shard, labels);

        Set<ObjectKey> pvcKeys = new LinkedHashSet<>();
        Set<ObjectKey> podKeys = new LinkedHashSet<>();
        Map<ObjectKey, TabletSpec> tabletMap = new HashMap<>();
        Set<String> deployedCells = new TreeSet<>();
        for (TabletSpec tablet : tablets) {
            ObjectKey key = tablet.getObjectKey();
            if (tablet.getDataVolumeClaimTemplate().isPresent()) {
                pvcKeys.add(key);
            }
            podKeys.add(key);
            tabletMap.put(key, tablet);
            deployedCells.add(tablet.getAlias().getCell());

            status.putTablet(tablet.getAlias().toString(), TabletStatus.newBuilder()
                    .withType(tablet.getType())
                    .withIndex(tablet.getIndex())
                    .build()
            );
        }

        ReconcileResult.Builder resultBuilder = ReconcileResult.newBuilder();
        TabletReconcileContext context = new TabletReconcileContext(shard, status, tabletMap, deployedCells, resultBuilder);
        try {
            KubeObjectClient<V1Pod> podClient = kubeApiFacade.getPodClient();
            KubeObjectClient<V1PersistentVolumeClaim> pvcClient = kubeApiFacade.getPersistentVolumeClaimClient();

            resultBuilder.merge(objectSetReconciler.reconcileObjectSet(pvcClient, shard.getNamespace(), pvcKeys, labels,
                    new TabletPvcStrategy(context, pvcFactory, podClient)));

            resultBuilder.merge(objectSetReconciler.reconcileObjectSet(podClient, shard.getNamespace(), podKeys, labels,
                    new TabletPodStrategy(context, podFactory, availabilityTracker, resizePropagator, turndownPolicy)));
        } finally {
            status.setCells(deployedCells);
        }
        return resultBuilder.build();
    }
}
