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

package io.shardkeeper.server.testkit;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimCondition;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimStatus;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodCondition;
import io.kubernetes.client.openapi.models.V1PodStatus;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.shardkeeper.server.kubernetes.KubeConstants;
import io.shardkeeper.server.shard.model.BackupLocation;
import io.shardkeeper.server.shard.model.GlobalLockserver;
import io.shardkeeper.server.shard.model.KeyRange;
import io.shardkeeper.server.shard.model.TabletImages;
import io.shardkeeper.server.shard.model.TabletPool;
import io.shardkeeper.server.shard.model.TabletShard;
import io.shardkeeper.server.shard.model.TabletType;

/**
 * Shard and live object fixtures.
 */
public final class TabletShardGenerator {

    public static final String NAMESPACE = "default";
    public static final String CLUSTER = "example";
    public static final String KEYSPACE = "commerce";

    private TabletShardGenerator() {
    }

    public static TabletShard oneShard(TabletPool... pools) {
        return TabletShard.newBuilder()
                .withName(CLUSTER + "-" + KEYSPACE + "-x-80")
                .withNamespace(NAMESPACE)
                .withGeneration(1)
                .withClusterName(CLUSTER)
                .withKeyspaceName(KEYSPACE)
                .withKeyRange(KeyRange.of("", "80"))
                .withDatabaseName("commerce_db")
                .withGlobalLockserver(new GlobalLockserver("etcd2", "etcd-global:2379", "/vitess/global"))
                .withImages(new TabletImages("vitess/lite:v15", "mysql:8.0"))
                .withImagePullPolicy("IfNotPresent")
                .withZoneMap(Collections.singletonMap("us-east", "us-east-1a"))
                .withTabletPools(Arrays.asList(pools))
                .withBackupLocations(Collections.singletonList(new BackupLocation("", Collections.singletonMap("backup.shardkeeper.io/bucket", "backups"))))
                .build();
    }

    public static TabletPool replicaPool(String cell, int replicas) {
        return TabletPool.newBuilder()
                .withCell(cell)
                .withType(TabletType.REPLICA)
                .withReplicas(replicas)
                .withDataVolumeClaimTemplate(dataVolumeClaimTemplate("10Gi"))
                .build();
    }

    public static TabletPool rdonlyPool(String cell, int replicas) {
        return TabletPool.newBuilder()
                .withCell(cell)
                .withType(TabletType.RDONLY)
                .withReplicas(replicas)
                .build();
    }

    public static V1PersistentVolumeClaimSpec dataVolumeClaimTemplate(String size) {
        return new V1PersistentVolumeClaimSpec()
                .accessModes(new ArrayList<>(Collections.singletonList("ReadWriteOnce")))
                .resources(new V1ResourceRequirements().putRequestsItem(KubeConstants.RESOURCE_STORAGE, Quantity.fromString(size)));
    }

    /**
     * Marks the pod as running and ready since the given time.
     */
    public static V1Pod runningAndReady(V1Pod pod, OffsetDateTime readySince) {
        return pod.status(new V1PodStatus()
                .phase(KubeConstants.POD_PHASE_RUNNING)
                .conditions(new ArrayList<>(Collections.singletonList(new V1PodCondition()
                        .type(KubeConstants.POD_CONDITION_READY)
                        .status(KubeConstants.CONDITION_TRUE)
                        .lastTransitionTime(readySince)
                )))
        );
    }

    public static V1Pod runningNotReady(V1Pod pod) {
        return pod.status(new V1PodStatus()
                .phase(KubeConstants.POD_PHASE_RUNNING)
                .conditions(new ArrayList<>(Collections.singletonList(new V1PodCondition()
                        .type(KubeConstants.POD_CONDITION_READY)
                        .status(KubeConstants.CONDITION_FALSE)
                )))
        );
    }

    public static V1PersistentVolumeClaim bound(V1PersistentVolumeClaim pvc) {
        return pvc.status(new V1PersistentVolumeClaimStatus().phase(KubeConstants.PVC_PHASE_BOUND));
    }

    public static V1PersistentVolumeClaim withResizePending(V1PersistentVolumeClaim pvc, String conditionStatus) {
        List<V1PersistentVolumeClaimCondition> conditions = new ArrayList<>();
        conditions.add(new V1PersistentVolumeClaimCondition()
                .type(KubeConstants.PVC_CONDITION_FILE_SYSTEM_RESIZE_PENDING)
                .status(conditionStatus));
        V1PersistentVolumeClaimStatus status = pvc.getStatus() == null ? new V1PersistentVolumeClaimStatus() : pvc.getStatus();
        return pvc.status(status.conditions(conditions));
    }
}
