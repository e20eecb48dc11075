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

package io.shardkeeper.server.topology;

import io.shardkeeper.server.shard.model.GlobalLockserver;
import reactor.core.publisher.Mono;

/**
 * Read access to the global topology service.
 */
public interface TopologyClient {

    /**
     * Emits the shard record, or an error if the topology service cannot be reached or has no such shard.
     * Nothing happens until subscription.
     */
    Mono<ShardRecord> getShard(GlobalLockserver lockserver, String keyspace, String shard);
}
