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

package io.shardkeeper.server.kubernetes;

import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimList;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;

@Singleton
public class DefaultKubeApiFacade implements KubeApiFacade {

    private static final String CORE_API_GROUP = "";
    private static final String CORE_API_VERSION = "v1";

    private final KubeObjectClient<V1Pod> podClient;
    private final KubeObjectClient<V1PersistentVolumeClaim> persistentVolumeClaimClient;

    @Inject
    public DefaultKubeApiFacade(ApiClient apiClient) {
        this.podClient = new GenericKubeObjectClient<>(
                "pod",
                V1Pod.class,
                new GenericKubernetesApi<>(V1Pod.class, V1PodList.class, CORE_API_GROUP, CORE_API_VERSION, "pods", apiClient)
        );
        this.persistentVolumeClaimClient = new GenericKubeObjectClient<>(
                "persistentvolumeclaim",
                V1PersistentVolumeClaim.class,
                new GenericKubernetesApi<>(V1PersistentVolumeClaim.class, V1PersistentVolumeClaimList.class, CORE_API_GROUP,
                        CORE_API_VERSION, "persistentvolumeclaims", apiClient)
        );
    }

    @Override
    public KubeObjectClient<V1Pod> getPodClient() {
        return podClient;
    }

    @Override
    public KubeObjectClient<V1PersistentVolumeClaim> getPersistentVolumeClaimClient() {
        return persistentVolumeClaimClient;
    }
}
