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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.JSON;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimCondition;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodCondition;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;

public final class KubeUtil {

    private static final JSON JSON = new JSON();

    private KubeUtil() {
    }

    /**
     * Formats labels as an equality based label selector, with keys sorted so the output is stable.
     */
    public static String formatLabelSelector(Map<String, String> labels) {
        return new TreeMap<>(labels).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(","));
    }

    public static boolean hasLabels(KubernetesObject object, Map<String, String> labels) {
        Map<String, String> objectLabels = getLabels(object);
        return labels.entrySet().stream().allMatch(entry -> entry.getValue().equals(objectLabels.get(entry.getKey())));
    }

    public static Map<String, String> getLabels(KubernetesObject object) {
        V1ObjectMeta metadata = object.getMetadata();
        if (metadata == null || metadata.getLabels() == null) {
            return Collections.emptyMap();
        }
        return metadata.getLabels();
    }

    public static Optional<String> findAnnotation(KubernetesObject object, String key) {
        V1ObjectMeta metadata = object.getMetadata();
        if (metadata == null || metadata.getAnnotations() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(metadata.getAnnotations().get(key));
    }

    public static void putAnnotation(KubernetesObject object, String key, String value) {
        V1ObjectMeta metadata = object.getMetadata();
        if (metadata.getAnnotations() == null) {
            metadata.setAnnotations(new HashMap<>());
        }
        metadata.getAnnotations().put(key, value);
    }

    public static void removeAnnotation(KubernetesObject object, String key) {
        V1ObjectMeta metadata = object.getMetadata();
        if (metadata != null && metadata.getAnnotations() != null) {
            metadata.getAnnotations().remove(key);
        }
    }

    /**
     * Adds or overwrites the given labels. Labels not present in the map are kept.
     */
    public static void mergeLabels(V1ObjectMeta metadata, Map<String, String> labels) {
        if (labels.isEmpty()) {
            return;
        }
        if (metadata.getLabels() == null) {
            metadata.setLabels(new HashMap<>());
        }
        metadata.getLabels().putAll(labels);
    }

    /**
     * Adds or overwrites the given annotations. Annotations not present in the map are kept.
     */
    public static void mergeAnnotations(V1ObjectMeta metadata, Map<String, String> annotations) {
        if (annotations.isEmpty()) {
            return;
        }
        if (metadata.getAnnotations() == null) {
            metadata.setAnnotations(new HashMap<>());
        }
        metadata.getAnnotations().putAll(annotations);
    }

    public static boolean isBeingDeleted(KubernetesObject object) {
        return object.getMetadata() != null && object.getMetadata().getDeletionTimestamp() != null;
    }

    public static boolean isPodRunning(V1Pod pod) {
        return pod.getStatus() != null && KubeConstants.POD_PHASE_RUNNING.equals(pod.getStatus().getPhase());
    }

    public static Optional<V1PodCondition> findPodCondition(V1Pod pod, String type) {
        if (pod.getStatus() == null || pod.getStatus().getConditions() == null) {
            return Optional.empty();
        }
        return pod.getStatus().getConditions().stream()
                .filter(condition -> type.equals(condition.getType()))
                .findFirst();
    }

    public static boolean isPodReady(V1Pod pod) {
        return findPodCondition(pod, KubeConstants.POD_CONDITION_READY)
                .map(condition -> KubeConstants.CONDITION_TRUE.equals(condition.getStatus()))
                .orElse(false);
    }

    public static boolean isPersistentVolumeClaimBound(V1PersistentVolumeClaim pvc) {
        return pvc.getStatus() != null && KubeConstants.PVC_PHASE_BOUND.equals(pvc.getStatus().getPhase());
    }

    public static Optional<V1PersistentVolumeClaimCondition> findPersistentVolumeClaimCondition(V1PersistentVolumeClaim pvc, String type) {
        if (pvc.getStatus() == null) {
            return Optional.empty();
        }
        List<V1PersistentVolumeClaimCondition> conditions = pvc.getStatus().getConditions();
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream().filter(condition -> type.equals(condition.getType())).findFirst();
    }

    public static Optional<Quantity> findStorageRequest(V1PersistentVolumeClaimSpec spec) {
        if (spec == null) {
            return Optional.empty();
        }
        return findStorageRequest(spec.getResources());
    }

    public static Optional<Quantity> findStorageRequest(V1ResourceRequirements resources) {
        if (resources == null || resources.getRequests() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(resources.getRequests().get(KubeConstants.RESOURCE_STORAGE));
    }

    /**
     * Deep copy through the same JSON serializer the Kube client uses on the wire. The model classes have no
     * copy constructors, and callbacks must be able to mutate an object without touching the original.
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T object) {
        if (object == null) {
            return null;
        }
        return (T) JSON.deserialize(JSON.serialize(object), object.getClass());
    }

    /**
     * Describes fields that differ between two versions of an object as a sorted list of paths two levels
     * deep, for example "metadata.annotations, spec.containers". The status subtree is ignored.
     */
    public static String describeChanges(Object before, Object after) {
        return KubeObjectDiff.describe(JSON.getGson().toJsonTree(before), JSON.getGson().toJsonTree(after));
    }
}
