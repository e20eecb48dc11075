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

import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.server.kubernetes.KubeApiException;
import io.shardkeeper.server.shard.model.TabletShard;
import io.shardkeeper.server.shard.model.TabletSpec;
import io.shardkeeper.server.tablet.DefaultTabletPodFactory;
import io.shardkeeper.server.tablet.TabletLabels;
import io.shardkeeper.server.tablet.TabletPvcFactory;
import io.shardkeeper.server.testkit.InMemoryKubeApiFacade;
import io.shardkeeper.server.testkit.TabletShardGenerator;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class VolumeResizePropagatorTest {

    private final InMemoryKubeApiFacade kubeApiFacade = new InMemoryKubeApiFacade();

    private final VolumeResizePropagator propagator = new VolumeResizePropagator(kubeApiFacade);

    private final TabletSpec spec = compile(TabletShardGenerator.oneShard(TabletShardGenerator.replicaPool("us-east", 1)));
    private final V1Pod pod = new DefaultTabletPodFactory().newPod(spec.getObjectKey(), spec);

    @Test
    public void testPendingResizeWithMatchingSizeAnnotatesSpec() {
        kubeApiFacade.getPersistentVolumeClaimClient().add(TabletShardGenerator.withResizePending(newClaim("10Gi"), "True"));

        TabletSpec result = propagator.propagate(spec, pod);

        assertThat(result.getAnnotations()).containsEntry(VolumeResizePropagator.FILESYSTEM_RESIZE_ANNOTATION, "10Gi");
        assertThat(spec.getAnnotations()).doesNotContainKey(VolumeResizePropagator.FILESYSTEM_RESIZE_ANNOTATION);
    }

    @Test
    public void testMismatchedSizeIsIgnored() {
        kubeApiFacade.getPersistentVolumeClaimClient().add(TabletShardGenerator.withResizePending(newClaim("5Gi"), "True"));

        assertThat(propagator.propagate(spec, pod)).isSameAs(spec);
    }

    @Test
    public void testConditionNotTrueIsIgnored() {
        kubeApiFacade.getPersistentVolumeClaimClient().add(TabletShardGenerator.withResizePending(newClaim("10Gi"), "False"));

        assertThat(propagator.propagate(spec, pod)).isSameAs(spec);
    }

    @Test
    public void testClaimWithoutConditionIsIgnored() {
        kubeApiFacade.getPersistentVolumeClaimClient().add(TabletShardGenerator.bound(newClaim("10Gi")));

        assertThat(propagator.propagate(spec, pod)).isSameAs(spec);
    }

    @Test
    public void testMissingClaimIsIgnored() {
        assertThat(propagator.propagate(spec, pod)).isSameAs(spec);
    }

    @Test
    public void testClaimLookupFailureIsIgnored() {
        kubeApiFacade.getPersistentVolumeClaimClient().failOn(spec.getObjectKey(),
                new KubeApiException("simulated", KubeApiException.ErrorCode.INTERNAL, 500));

        assertThat(propagator.propagate(spec, pod)).isSameAs(spec);
    }

    @Test
    public void testTabletWithoutDataVolumeIsIgnored() {
        TabletSpec ephemeral = compile(TabletShardGenerator.oneShard(TabletShardGenerator.rdonlyPool("us-east", 1)));

        assertThat(propagator.propagate(ephemeral, pod)).isSameAs(ephemeral);
    }

    private V1PersistentVolumeClaim newClaim(String size) {
        TabletSpec sized = spec.toBuilder().withDataVolumeClaimTemplate(TabletShardGenerator.dataVolumeClaimTemplate(size)).build();
        return new TabletPvcFactory().newPvc(spec.getObjectKey(), sized);
    }

    private static TabletSpec compile(TabletShard shard) {
        return new TabletSpecCompiler().compile(shard, TabletLabels.parentLabels(shard)).get(0);
    }
}
