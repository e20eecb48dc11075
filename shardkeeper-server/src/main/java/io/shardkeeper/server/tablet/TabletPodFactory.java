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

import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.shard.model.TabletSpec;

/**
 * Builds and updates tablet pods.
 */
public interface TabletPodFactory {

    V1Pod newPod(ObjectKey key, TabletSpec spec);

    /**
     * Applies the changes that a running pod accepts without a restart: labels and annotations.
     */
    void updatePodInPlace(V1Pod pod, TabletSpec spec);

    /**
     * Applies all fields this factory owns. Fields set by other parties, such as defaults filled in by the API server,
     * are left untouched, so an up-to-date pod is not modified.
     */
    void updatePod(V1Pod pod, TabletSpec spec);
}
