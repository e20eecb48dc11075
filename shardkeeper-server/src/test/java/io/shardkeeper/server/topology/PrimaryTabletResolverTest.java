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

import io.shardkeeper.common.util.archaius2.Archaius2Ext;
import io.shardkeeper.server.shard.ShardReconcilerConfiguration;
import io.shardkeeper.server.shard.model.TabletAlias;
import io.shardkeeper.server.shard.model.TabletShard;
import io.shardkeeper.server.testkit.StubTopologyClient;
import io.shardkeeper.server.testkit.TabletShardGenerator;
import org.junit.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

public class PrimaryTabletResolverTest {

    private static final TabletAlias PRIMARY = TabletAlias.of("us-east", 1);
    private static final TabletAlias REPLICA = TabletAlias.of("us-east", 2);

    private final TabletShard shard = TabletShardGenerator.oneShard(TabletShardGenerator.replicaPool("us-east", 2));

    private final StubTopologyClient topologyClient = new StubTopologyClient();

    private final PrimaryTabletResolver resolver = new PrimaryTabletResolver(
            topologyClient,
            Archaius2Ext.newConfiguration(ShardReconcilerConfiguration.class,
                    "shardkeeper.shard.reconciler.reconcileTimeoutMs", "400",
                    "shardkeeper.shard.reconciler.topologyLookupTimeoutMs", "5000"
            )
    );

    @Test
    public void testPrimaryAliasIsComparedWithShardRecord() {
        topologyClient.setPrimary(PRIMARY);

        assertThat(resolver.check(shard, PRIMARY)).isEqualTo(PrimaryCheck.PRIMARY);
        assertThat(resolver.check(shard, REPLICA)).isEqualTo(PrimaryCheck.NOT_PRIMARY);
    }

    @Test
    public void testLookupUsesShardCoordinates() {
        topologyClient.setPrimary(PRIMARY);

        StepVerifier.create(topologyClient.getShard(shard.getGlobalLockserver(), shard.getKeyspaceName(), shard.getShardName()))
                .assertNext(record -> {
                    assertThat(record.getKeyspace()).isEqualTo(TabletShardGenerator.KEYSPACE);
                    assertThat(record.getShard()).isEqualTo("-80");
                    assertThat(record.getPrimaryAlias()).contains(PRIMARY);
                })
                .verifyComplete();
    }

    @Test
    public void testLookupErrorIsUnknown() {
        topologyClient.failWith(new IllegalStateException("simulated"));

        assertThat(resolver.check(shard, PRIMARY)).isEqualTo(PrimaryCheck.UNKNOWN);
    }

    @Test
    public void testEmptyLookupIsUnknown() {
        PrimaryTabletResolver emptyResolver = new PrimaryTabletResolver(
                (lockserver, keyspace, shardName) -> Mono.empty(),
                Archaius2Ext.newConfiguration(ShardReconcilerConfiguration.class)
        );

        assertThat(emptyResolver.check(shard, PRIMARY)).isEqualTo(PrimaryCheck.UNKNOWN);
    }

    @Test
    public void testClientThrowingDirectlyIsUnknown() {
        PrimaryTabletResolver throwingResolver = new PrimaryTabletResolver(
                (lockserver, keyspace, shardName) -> {
                    throw new IllegalStateException("not connected");
                },
                Archaius2Ext.newConfiguration(ShardReconcilerConfiguration.class)
        );

        assertThat(throwingResolver.check(shard, PRIMARY)).isEqualTo(PrimaryCheck.UNKNOWN);
    }

    @Test
    public void testLookupTimeoutIsFractionOfReconcileTimeout() {
        assertThat(resolver.getLookupTimeout()).isEqualTo(Duration.ofMillis(100));

        topologyClient.hang();
        long start = System.currentTimeMillis();
        assertThat(resolver.check(shard, PRIMARY)).isEqualTo(PrimaryCheck.UNKNOWN);
        assertThat(System.currentTimeMillis() - start).isLessThan(5_000);
    }
}
