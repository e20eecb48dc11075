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

package io.shardkeeper.server.kubernetes.reconciler;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.shardkeeper.common.runtime.OperatorRuntime;
import io.shardkeeper.common.util.ExceptionExt;
import io.shardkeeper.server.kubernetes.KubeObjectClient;
import io.shardkeeper.server.kubernetes.KubeObjectFormatter;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.ObjectKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converges the set of objects of one kind, selected by a label set, to a desired set of keys. Desired objects
 * that are missing are created, existing ones are updated, and live objects outside the desired set are turned
 * down once the strategy allows it. A failure on one object does not stop work on the others; all failures are
 * returned together in the result.
 */
@Singleton
public class ObjectSetReconciler {

    private static final Logger logger = LoggerFactory.getLogger(ObjectSetReconciler.class);

    /**
     * Delay before the pass that creates the replacement of a recreated object.
     */
    static final Duration RECREATE_REQUEUE_DELAY = Duration.ofSeconds(5);

    static final String METRIC_ROOT = "shardkeeper.reconciler.objectSet";

    static final String ACTION_CREATED = "created";
    static final String ACTION_UPDATED_IN_PLACE = "updatedInPlace";
    static final String ACTION_RECREATE_SCHEDULED = "recreateScheduled";
    static final String ACTION_RECREATED = "recreated";
    static final String ACTION_DELETED = "deleted";
    static final String ACTION_ORPHANED = "orphaned";
    static final String ACTION_FAILED = "failed";

    private final Registry registry;
    private final Id actionId;

    @Inject
    public ObjectSetReconciler(OperatorRuntime runtime) {
        this.registry = runtime.getRegistry();
        this.actionId = registry.createId(METRIC_ROOT);
    }

    public <T extends KubernetesObject> ReconcileResult reconcileObjectSet(KubeObjectClient<T> client,
                                                                          String namespace,
                                                                          Set<ObjectKey> desiredKeys,
                                                                          Map<String, String> labels,
                                                                          ObjectSetStrategy<T> strategy) {
        String kind = client.getKind();

        List<T> liveObjects;
        try {
            liveObjects = client.list(namespace, labels);
        } catch (Exception e) {
            logger.warn("Cannot list {} objects in namespace {} with labels {}: {}", kind, namespace,
                    KubeUtil.formatLabelSelector(labels), ExceptionExt.toMessageChain(e));
            increment(kind, ACTION_FAILED);
            return ReconcileResult.error(e);
        }

        Map<ObjectKey, T> liveByKey = new HashMap<>();
        for (T object : liveObjects) {
            liveByKey.put(ObjectKey.of(object.getMetadata(), namespace), object);
        }

        ReconcileResult.Builder result = ReconcileResult.newBuilder();

        // Iteration order of the desired set decides the order in which the strategy observes status.
        for (ObjectKey key : new LinkedHashSet<>(desiredKeys)) {
            try {
                T live = liveByKey.get(key);
                if (live == null) {
                    createObject(client, key, labels, strategy);
                } else {
                    if (updateObject(client, key, live, strategy)) {
                        result.requeueAfter(RECREATE_REQUEUE_DELAY);
                    }
                }
            } catch (Exception e) {
                logger.warn("Failed to reconcile {} {}: {}", kind, key, ExceptionExt.toMessageChain(e));
                increment(kind, ACTION_FAILED);
                result.error(e);
                strategy.reconcileError(key, e);
            }
        }

        for (Map.Entry<ObjectKey, T> entry : liveByKey.entrySet()) {
            ObjectKey key = entry.getKey();
            if (desiredKeys.contains(key)) {
                continue;
            }
            T live = entry.getValue();
            if (KubeUtil.isBeingDeleted(live)) {
                logger.debug("Orphaned {} {} is already being deleted", kind, key);
                continue;
            }
            try {
                turnDownObject(client, key, live, strategy);
            } catch (Exception e) {
                logger.warn("Failed to turn down {} {}: {}", kind, key, ExceptionExt.toMessageChain(e));
                increment(kind, ACTION_FAILED);
                result.error(e);
            }
        }

        return result.build();
    }

    private <T extends KubernetesObject> void createObject(KubeObjectClient<T> client,
                                                           ObjectKey key,
                                                           Map<String, String> labels,
                                                           ObjectSetStrategy<T> strategy) {
        T object = strategy.newObject(key);
        V1ObjectMeta metadata = object.getMetadata();
        if (metadata == null) {
            throw new IllegalStateException(String.format("Strategy built %s %s without metadata", client.getKind(), key));
        }
        metadata.setName(key.getName());
        metadata.setNamespace(key.getNamespace());
        KubeUtil.mergeLabels(metadata, labels);

        T created = client.create(object);
        logger.info("Created {} {}: {}", client.getKind(), key, KubeObjectFormatter.formatEssentials(created));
        increment(client.getKind(), ACTION_CREATED);

        strategy.status(key, created);
    }

    /**
     * Returns true if the object was deleted to be recreated.
     */
    private <T extends KubernetesObject> boolean updateObject(KubeObjectClient<T> client,
                                                           ObjectKey key,
                                                           T live,
                                                           ObjectSetStrategy<T> strategy) {
        String kind = client.getKind();
        if (KubeUtil.isBeingDeleted(live)) {
            logger.debug("Skipping update of {} {} which is being deleted", kind, key);
            strategy.status(key, live);
            return false;
        }

        T current = live;

        T inPlace = KubeUtil.deepCopy(current);
        strategy.updateInPlace(key, inPlace);
        if (!Objects.equals(inPlace, current)) {
            logger.info("Updating {} {} in place: changed={}", kind, key, KubeUtil.describeChanges(current, inPlace));
            current = client.update(inPlace);
            increment(kind, ACTION_UPDATED_IN_PLACE);
        }

        T recreate = KubeUtil.deepCopy(current);
        strategy.updateRollingRecreate(key, recreate);
        if (!Objects.equals(recreate, current)) {
            if (RolloutAnnotations.isReleased(current)) {
                logger.info("Recreating {} {} released by rollout: changed={}", kind, key,
                        KubeUtil.describeChanges(current, recreate));
                client.delete(key);
                increment(kind, ACTION_RECREATED);
                // The object is created again from the new spec on the next pass.
                strategy.status(key, current);
                return true;
            }
            String changes = KubeUtil.describeChanges(current, recreate);
            if (!changes.equals(RolloutAnnotations.getScheduledChanges(current))) {
                T scheduled = KubeUtil.deepCopy(current);
                RolloutAnnotations.schedule(scheduled, changes);
                logger.info("Scheduling rolling recreate of {} {}: changed={}", kind, key, changes);
                current = client.update(scheduled);
                increment(kind, ACTION_RECREATE_SCHEDULED);
            }
        } else if (RolloutAnnotations.isScheduled(current) || RolloutAnnotations.isReleased(current)) {
            T cleared = KubeUtil.deepCopy(current);
            RolloutAnnotations.unschedule(cleared);
            logger.info("No recreate pending for {} {} anymore; clearing rollout markers", kind, key);
            current = client.update(cleared);
        }

        strategy.status(key, current);
        return false;
    }

    private <T extends KubernetesObject> void turnDownObject(KubeObjectClient<T> client,
                                                             ObjectKey key,
                                                             T live,
                                                             ObjectSetStrategy<T> strategy) {
        String kind = client.getKind();

        T candidate = KubeUtil.deepCopy(live);
        Optional<OrphanStatus> orphanStatus = strategy.prepareForTurndown(key, candidate);
        if (orphanStatus.isPresent()) {
            T current = live;
            if (!Objects.equals(candidate, live)) {
                logger.info("Persisting turndown preparation of {} {}: changed={}", kind, key,
                        KubeUtil.describeChanges(live, candidate));
                current = client.update(candidate);
            }
            logger.debug("Keeping orphaned {} {}: {}", kind, key, orphanStatus.get());
            increment(kind, ACTION_ORPHANED);
            strategy.orphanStatus(key, current, orphanStatus.get());
            return;
        }

        client.delete(key);
        logger.info("Deleted orphaned {} {}", kind, key);
        increment(kind, ACTION_DELETED);
    }

    private void increment(String kind, String action) {
        registry.counter(actionId.withTag("kind", kind).withTag("action", action)).increment();
    }
}
