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

import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.common.util.ExceptionExt;
import io.shardkeeper.server.kubernetes.KubeObjectClient;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.kubernetes.reconciler.ObjectSetStrategy;
import io.shardkeeper.server.kubernetes.reconciler.OrphanStatus;
import io.shardkeeper.server.shard.model.ConditionStatus;
import io.shardkeeper.server.shard.model.TabletSpec;
import io.shardkeeper.server.tablet.TabletLabels;
import io.shardkeeper.server.tablet.TabletPvcFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Data volume claims of tablets. A claim shares its key with the tablet pod and is deleted only after the pod is
 * gone, so a pod kept by the turndown policy never loses its volume.
 */
class TabletPvcStrategy implements ObjectSetStrategy<V1PersistentVolumeClaim> {

    private static final Logger logger = LoggerFactory.getLogger(TabletPvcStrategy.class);

    static final String REASON_POD_EXISTS = "PodExists";

    private final TabletReconcileContext context;
    private final TabletPvcFactory pvcFactory;
    private final KubeObjectClient<V1Pod> podClient;

    TabletPvcStrategy(TabletReconcileContext context, TabletPvcFactory pvcFactory, KubeObjectClient<V1Pod> podClient) {
        this.context = context;
        this.pvcFactory = pvcFactory;
        this.podClient = podClient;
    }

    @Override
    public V1PersistentVolumeClaim newObject(ObjectKey key) {
        TabletSpec tablet = context.getTablet(key);
        context.getStatus().updateTablet(tablet.getAlias().toString(), status -> status.toBuilder()
                .withDataVolumeBound(ConditionStatus.FALSE)
                .build()
        );
        return pvcFactory.newPvc(key, tablet);
    }

    @Override
    public void updateInPlace(ObjectKey key, V1PersistentVolumeClaim pvc) {
        pvcFactory.updatePvcInPlace(pvc, context.getTablet(key));
    }

    @Override
    public void status(ObjectKey key, V1PersistentVolumeClaim pvc) {
        TabletSpec tablet = context.getTablet(key);
        context.getStatus().updateTablet(tablet.getAlias().toString(), status -> status.toBuilder()
                .withDataVolumeBound(ConditionStatus.of(KubeUtil.isPersistentVolumeClaimBound(pvc)))
                .build()
        );
    }

    @Override
    public void reconcileError(ObjectKey key, Throwable error) {
        context.recordError(key, "claim", error);
    }

    @Override
    public void orphanStatus(ObjectKey key, V1PersistentVolumeClaim pvc, OrphanStatus orphanStatus) {
        String alias = context.orphanAlias(key, pvc);
        // The pod of the same tablet reports the more useful reason, and it is processed after the claims.
        if (!context.getStatus().hasOrphanedTablet(alias)) {
            context.getStatus().putOrphanedTablet(alias, orphanStatus);
        }
        TabletLabels.aliasFromLabels(pvc).ifPresent(tabletAlias -> context.addDeployedCell(tabletAlias.getCell()));
    }

    @Override
    public Optional<OrphanStatus> prepareForTurndown(ObjectKey key, V1PersistentVolumeClaim pvc) {
        Optional<V1Pod> pod;
        try {
            pod = podClient.get(key);
        } catch (Exception e) {
            logger.info("Cannot check pod {} before deleting its data volume claim: {}", key, ExceptionExt.toMessageChain(e));
            return Optional.of(new OrphanStatus(REASON_POD_EXISTS, "not deleting tablet PVC because the tablet Pod may still exist"));
        }
        if (pod.isPresent()) {
            return Optional.of(new OrphanStatus(REASON_POD_EXISTS, "not deleting tablet PVC because tablet Pod still exists"));
        }
        return Optional.empty();
    }
}
