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

import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Pod;

/**
 * {@link KubeApiFacade} hides the Kube Java client behind per-kind interfaces, so it is easy to replace with
 * an in-memory implementation in the test code.
 */
public interface KubeApiFacade {

    KubeObjectClient<V1Pod> getPodClient();

    KubeObjectClient<V1PersistentVolumeClaim> getPersistentVolumeClaimClient();
}
