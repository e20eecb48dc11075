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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "shardkeeper.shard.reconciler")
public interface ShardReconcilerConfiguration {

    /**
     * Deadline of one reconciliation pass of a shard.
     */
    @DefaultValue("60000")
    long getReconcileTimeoutMs();

    /**
     * Timeout of the primary tablet lookup in the topology service. Capped at a quarter of
     * {@link #getReconcileTimeoutMs()}, so a hanging topology service cannot use up the pass.
     */
    @DefaultValue("5000")
    long getTopologyLookupTimeoutMs();

    /**
     * How long a tablet must be continuously ready before it is reported as available.
     */
    @DefaultValue("30000")
    long getTabletAvailableDelayMs();
}
