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

import java.util.concurrent.atomic.AtomicInteger;

import io.shardkeeper.server.shard.model.GlobalLockserver;
import io.shardkeeper.server.shard.model.TabletAlias;
import io.shardkeeper.server.topology.ShardRecord;
import io.shardkeeper.server.topology.TopologyClient;
import reactor.core.publisher.Mono;

/**
 * Topology service answering every shard lookup the same way. Starts with a shard that has no primary.
 */
public class StubTopologyClient implements TopologyClient {

    private enum Mode {Record, Error, Never}

    private volatile Mode mode = Mode.Record;
    private volatile TabletAlias primaryAlias;
    private volatile RuntimeException error;

    private final AtomicInteger lookupCount = new AtomicInteger();

    @Override
    public Mono<ShardRecord> getShard(GlobalLockserver lockserver, String keyspace, String shard) {
        return Mono.defer(() -> {
            lookupCount.incrementAndGet();
            switch (mode) {
                case Error:
                    return Mono.error(error);
                case Never:
                    return Mono.never();
                default:
                    return Mono.just(new ShardRecord(keyspace, shard, primaryAlias));
            }
        });
    }

    public void setPrimary(TabletAlias primaryAlias) {
        this.mode = Mode.Record;
        this.primaryAlias = primaryAlias;
    }

    public void failWith(RuntimeException error) {
        this.mode = Mode.Error;
        this.error = error;
    }

    /**
     * Lookups never complete, as with an unresponsive topology service.
     */
    public void hang() {
        this.mode = Mode.Never;
    }

    public int getLookupCount() {
        return lookupCount.get();
    }
}
