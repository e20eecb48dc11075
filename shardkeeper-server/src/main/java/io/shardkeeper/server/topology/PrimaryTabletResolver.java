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

import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.shardkeeper.common.util.ExceptionExt;
import io.shardkeeper.server.shard.ShardReconcilerConfiguration;
import io.shardkeeper.server.shard.model.TabletAlias;
import io.shardkeeper.server.shard.model.TabletShard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Checks tablets against the primary alias in the global shard record. The tablet's own view of its role is not
 * consulted, so that a tablet wrongly believing it is the primary can still be removed.
 */
@Singleton
public class PrimaryTabletResolver {

    private static final Logger logger = LoggerFactory.getLogger(PrimaryTabletResolver.class);

    private final TopologyClient topologyClient;
    private final ShardReconcilerConfiguration configuration;

    @Inject
    public PrimaryTabletResolver(TopologyClient topologyClient, ShardReconcilerConfiguration configuration) {
        this.topologyClient = topologyClient;
        this.configuration = configuration;
    }

    /**
     * Never throws. Lookup errors, timeouts and a missing shard record all yield {@link PrimaryCheck#UNKNOWN}.
     */
    public PrimaryCheck check(TabletShard shard, TabletAlias alias) {
        Duration timeout = getLookupTimeout();
        try {
            PrimaryCheck result = Mono.defer(() -> topologyClient.getShard(shard.getGlobalLockserver(), shard.getKeyspaceName(), shard.getShardName()))
                    .timeout(timeout)
                    .map(record -> record.getPrimaryAlias().map(alias::equals).orElse(false)
                            ? PrimaryCheck.PRIMARY
                            : PrimaryCheck.NOT_PRIMARY
                    )
                    .onErrorResume(error -> {
                        logger.warn("Cannot read shard record {}/{} from the topology service: {}",
                                shard.getKeyspaceName(), shard.getShardName(), ExceptionExt.toMessageChain(error));
                        return Mono.just(PrimaryCheck.UNKNOWN);
                    })
                    .defaultIfEmpty(PrimaryCheck.UNKNOWN)
                    .block();
            return result == null ? PrimaryCheck.UNKNOWN : result;
        } catch (Exception e) {
            logger.warn("Primary check of tablet {} failed: {}", alias, ExceptionExt.toMessageChain(e));
            return PrimaryCheck.UNKNOWN;
        }
    }

    Duration getLookupTimeout() {
        long timeoutMs = Math.min(configuration.getTopologyLookupTimeoutMs(), configuration.getReconcileTimeoutMs() / 4);
        return Duration.ofMillis(Math.max(1, timeoutMs));
    }
}
