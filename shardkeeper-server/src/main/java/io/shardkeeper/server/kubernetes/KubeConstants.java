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

public final class KubeConstants {

    private KubeConstants() {
    }

    // Pod phases
    public static final String POD_PHASE_PENDING = "Pending";
    public static final String POD_PHASE_RUNNING = "Running";

    // Pod conditions
    public static final String POD_CONDITION_READY = "Ready";

    // Persistent volume claims
    public static final String PVC_PHASE_BOUND = "Bound";
    public static final String PVC_CONDITION_FILE_SYSTEM_RESIZE_PENDING = "FileSystemResizePending";

    // Condition status values
    public static final String CONDITION_TRUE = "True";
    public static final String CONDITION_FALSE = "False";

    // Resources
    public static final String RESOURCE_STORAGE = "storage";

    // Well known node labels
    public static final String NODE_LABEL_ZONE = "topology.kubernetes.io/zone";
}
