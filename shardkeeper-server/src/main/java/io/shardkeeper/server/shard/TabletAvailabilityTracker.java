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
import java.time.OffsetDateTime;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodCondition;
import io.shardkeeper.common.runtime.OperatorRuntime;
import io.shardkeeper.common.util.time.Clock;
import io.shardkeeper.server.kubernetes.KubeConstants;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.reconciler.ReconcileResult;
import io.shardkeeper.server.shard.model.ConditionStatus;
import io.shardkeeper.server.shard.model.ShardStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives tablet availability and rollout progress from live pods.
 */
@Singleton
public class TabletAvailabilityTracker {

    private static final Logger logger = LoggerFactory.getLogger(TabletAvailabilityTracker.class);

    /**
     * Generation of the shard last applied to a pod by an in-place update.
     */
    public static final String OBSERVED_SHARD_GENERATION_ANNOTATION = "shardkeeper.io/observed-shard-generation";

    private final ShardReconcilerConfiguration configuration;
    private final Clock clock;

    @Inject
    public TabletAvailabilityTracker(ShardReconcilerConfiguration configuration, OperatorRuntime runtime) {
        this.configuration = configuration;
        this.clock = runtime.getClock();
    }

    /**
     * A pod is available once it has been ready for the configured delay and is not terminating. A ready pod that
     * has not reached the delay yet is reported unavailable, and a recheck is requested after the delay, as no
     * pod event is expected while only time passes.
     */
    public ConditionStatus availability(V1Pod pod, ReconcileResult.Builder resultBuilder) {
        if (KubeUtil.isBeingDeleted(pod)) {
            return ConditionStatus.FALSE;
        }
        Optional<V1PodCondition> ready = KubeUtil.findPodCondition(pod, KubeConstants.POD_CONDITION_READY);
        if (!ready.isPresent() || !KubeConstants.CONDITION_TRUE.equals(ready.get().getStatus())) {
            return ConditionStatus.FALSE;
        }
        Duration delay = Duration.ofMillis(configuration.getTabletAvailableDelayMs());
        OffsetDateTime readySince = ready.get().getLastTransitionTime();
        if (readySince != null && !readySince.toInstant().plus(delay).isAfter(clock.instant())) {
            return ConditionStatus.TRUE;
        }
        resultBuilder.requeueAfter(delay);
        return ConditionStatus.FALSE;
    }

    /**
     * Records the shard generation the pod was last updated to. Pods without a valid annotation are ignored.
     */
    public void observeGeneration(V1Pod pod, ShardStatus status) {
        Optional<String> value = KubeUtil.findAnnotation(pod, OBSERVED_SHARD_GENERATION_ANNOTATION);
        if (!value.isPresent() || value.get().isEmpty()) {
            return;
        }
        long generation;
        try {
            generation = Long.parseLong(value.get());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed generation annotation on pod {}: {}", pod.getMetadata().getName(), value.get());
            return;
        }
        status.observePodGeneration(generation);
    }

    public void stampGeneration(V1Pod pod, long generation) {
        KubeUtil.putAnnotation(pod, OBSERVED_SHARD_GENERATION_ANNOTATION, Long.toString(generation));
    }
}
