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

import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimStatus;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodStatus;

/**
 * Helper functions to build compact representations of Kube objects suitable for logging.
 */
public final class KubeObjectFormatter {

    private KubeObjectFormatter() {
    }

    public static String formatPodEssentials(V1Pod pod) {
        try {
            return formatPodEssentialsInternal(pod);
        } catch (Exception e) {
            return "pod formatting error: " + e.getMessage();
        }
    }

    private static String formatPodEssentialsInternal(V1Pod pod) {
        StringBuilder builder = new StringBuilder("{");

        appendMetadata(builder, pod.getMetadata());

        V1PodSpec spec = pod.getSpec();
        if (spec != null) {
            builder.append(", nodeName=").append(spec.getNodeName());
        }

        V1PodStatus status = pod.getStatus();
        if (status != null) {
            builder.append(", phase=").append(status.getPhase());
            builder.append(", ready=").append(KubeUtil.isPodReady(pod));
        }

        builder.append("}");
        return builder.toString();
    }

    public static String formatPvcEssentials(V1PersistentVolumeClaim pvc) {
        try {
            return formatPvcEssentialsInternal(pvc);
        } catch (Exception e) {
            return "pvc formatting error: " + e.getMessage();
        }
    }

    private static String formatPvcEssentialsInternal(V1PersistentVolumeClaim pvc) {
        StringBuilder builder = new StringBuilder("{");

        appendMetadata(builder, pvc.getMetadata());

        V1PersistentVolumeClaimSpec spec = pvc.getSpec();
        if (spec != null) {
            builder.append(", volume=").append(spec.getVolumeName());
            builder.append(", storageRequest=").append(KubeUtil.findStorageRequest(spec).map(q -> q.toSuffixedString()).orElse("<not set>"));
        }

        V1PersistentVolumeClaimStatus status = pvc.getStatus();
        if (status != null) {
            builder.append(", phase=").append(status.getPhase());
        }

        builder.append("}");
        return builder.toString();
    }

    /**
     * Formats pods and claims with their essentials, and any other object by its name.
     */
    public static String formatEssentials(Object object) {
        if (object instanceof V1Pod) {
            return formatPodEssentials((V1Pod) object);
        }
        if (object instanceof V1PersistentVolumeClaim) {
            return formatPvcEssentials((V1PersistentVolumeClaim) object);
        }
        return String.valueOf(object);
    }

    private static void appendMetadata(StringBuilder builder, V1ObjectMeta metadata) {
        if (metadata != null) {
            builder.append("namespace=").append(metadata.getNamespace());
            builder.append(", name=").append(metadata.getName());
            builder.append(", deleting=").append(metadata.getDeletionTimestamp() != null);
        } else {
            builder.append("metadata=null");
        }
    }
}
