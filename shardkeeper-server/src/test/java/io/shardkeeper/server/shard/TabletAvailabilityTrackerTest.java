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

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.common.runtime.OperatorRuntimes;
import io.shardkeeper.common.util.archaius2.Archaius2Ext;
import io.shardkeeper.common.util.time.Clocks;
import io.shardkeeper.common.util.time.TestClock;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.reconciler.ReconcileResult;
import io.shardkeeper.server.shard.model.ConditionStatus;
import io.shardkeeper.server.shard.model.ShardStatus;
import io.shardkeeper.server.testkit.TabletShardGenerator;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TabletAvailabilityTrackerTest {

    private static final Duration DELAY = Duration.ofSeconds(30);

    private final TestClock clock = Clocks.test(1_600_000_000_000L);

    private final TabletAvailabilityTracker tracker = new TabletAvailabilityTracker(
            Archaius2Ext.newConfiguration(ShardReconcilerConfiguration.class),
            OperatorRuntimes.test(clock)
    );

    @Test
    public void testReadyFor29SecondsIsNotAvailableAndRequeues() {
        ReconcileResult.Builder resultBuilder = ReconcileResult.newBuilder();

        ConditionStatus available = tracker.availability(readyFor(Duration.ofSeconds(29)), resultBuilder);

        assertThat(available).isEqualTo(ConditionStatus.FALSE);
        assertThat(resultBuilder.build().getRequeueAfter()).contains(DELAY);
    }

    @Test
    public void testReadyFor30SecondsIsAvailable() {
        ReconcileResult.Builder resultBuilder = ReconcileResult.newBuilder();

        assertThat(tracker.availability(readyFor(DELAY), resultBuilder)).isEqualTo(ConditionStatus.TRUE);
        assertThat(tracker.availability(readyFor(Duration.ofSeconds(40)), resultBuilder)).isEqualTo(ConditionStatus.TRUE);
        assertThat(resultBuilder.build().getRequeueAfter()).isEmpty();
    }

    @Test
    public void testTerminatingPodIsNotAvailable() {
        ReconcileResult.Builder resultBuilder = ReconcileResult.newBuilder();
        V1Pod pod = readyFor(Duration.ofSeconds(40));
        pod.getMetadata().setDeletionTimestamp(now());

        assertThat(tracker.availability(pod, resultBuilder)).isEqualTo(ConditionStatus.FALSE);
        assertThat(resultBuilder.build().getRequeueAfter()).isEmpty();
    }

    @Test
    public void testNotReadyPodIsNotAvailable() {
        ReconcileResult.Builder resultBuilder = ReconcileResult.newBuilder();
        V1Pod pod = TabletShardGenerator.runningNotReady(newPod());

        assertThat(tracker.availability(pod, resultBuilder)).isEqualTo(ConditionStatus.FALSE);
        assertThat(resultBuilder.build().getRequeueAfter()).isEmpty();
    }

    @Test
    public void testAvailabilityFollowsClock() {
        V1Pod pod = readyFor(Duration.ofSeconds(10));
        assertThat(tracker.availability(pod, ReconcileResult.newBuilder())).isEqualTo(ConditionStatus.FALSE);

        clock.advanceTime(Duration.ofSeconds(20));
        assertThat(tracker.availability(pod, ReconcileResult.newBuilder())).isEqualTo(ConditionStatus.TRUE);
    }

    @Test
    public void testLowestGenerationIsTracked() {
        ShardStatus status = new ShardStatus();

        tracker.observeGeneration(withGeneration("5"), status);
        tracker.observeGeneration(withGeneration("7"), status);
        tracker.observeGeneration(withGeneration("3"), status);
        tracker.observeGeneration(newPod(), status);

        assertThat(status.getLowestPodGeneration()).isEqualTo(3);
    }

    @Test
    public void testUnsetAndMalformedGenerationsAreIgnored() {
        ShardStatus status = new ShardStatus();

        tracker.observeGeneration(newPod(), status);
        tracker.observeGeneration(withGeneration(""), status);
        tracker.observeGeneration(withGeneration("not-a-number"), status);

        assertThat(status.getLowestPodGeneration()).isEqualTo(ShardStatus.GENERATION_UNSET);
    }

    @Test
    public void testStampGeneration() {
        V1Pod pod = newPod();

        tracker.stampGeneration(pod, 12);

        assertThat(KubeUtil.findAnnotation(pod, TabletAvailabilityTracker.OBSERVED_SHARD_GENERATION_ANNOTATION)).contains("12");
    }

    private V1Pod readyFor(Duration duration) {
        return TabletShardGenerator.runningAndReady(newPod(), now().minus(duration));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(Instant.ofEpochMilli(clock.wallTime()), ZoneOffset.UTC);
    }

    private static V1Pod withGeneration(String generation) {
        V1Pod pod = newPod();
        KubeUtil.putAnnotation(pod, TabletAvailabilityTracker.OBSERVED_SHARD_GENERATION_ANNOTATION, generation);
        return pod;
    }

    private static V1Pod newPod() {
        return new V1Pod().metadata(new V1ObjectMeta().namespace("default").name("pod1"));
    }
}
