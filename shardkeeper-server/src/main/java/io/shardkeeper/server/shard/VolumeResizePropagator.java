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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Pod;
import io.shardkeeper.common.util.ExceptionExt;
import io.shardkeeper.server.kubernetes.KubeApiFacade;
import io.shardkeeper.server.kubernetes.KubeConstants;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.shard.model.TabletSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Some storage drivers grow a volume only after the pod using it restarts, which they signal with the
 * FileSystemResizePending claim condition. Once the claim request matches the desired size and the condition is
 * set, the target size is added to the tablet annotations. The annotation changes the pod, and so triggers the
 * rolling restart that completes the resize.
 */
@Singleton
public class VolumeResizePropagator {

    private static final Logger logger = LoggerFactory.getLogger(VolumeResizePropagator.class);

    public static final String FILESYSTEM_RESIZE_ANNOTATION = "shardkeeper.io/pvc-filesystem-resize";

    private final KubeApiFacade kubeApiFacade;

    @Inject
    public VolumeResizePropagator(KubeApiFacade kubeApiFacade) {
        this.kubeApiFacade = kubeApiFacade;
    }

    /**
     * Returns the spec with the resize annotation added, or the unchanged spec if no resize is waiting for a restart.
     */
    public TabletSpec propagate(TabletSpec spec, V1Pod pod) {
        if (!spec.getDataVolumeClaimName().isPresent()) {
            return spec;
        }
        Optional<Quantity> requested = spec.getDataVolumeClaimTemplate().flatMap(KubeUtil::findStorageRequest);
        if (!requested.isPresent()) {
            return spec;
        }

        String namespace = pod.getMetadata() != null && pod.getMetadata().getNamespace() != null
                ? pod.getMetadata().getNamespace()
                : spec.getNamespace();
        ObjectKey claimKey = ObjectKey.of(namespace, spec.getDataVolumeClaimName().get());

        Optional<V1PersistentVolumeClaim> claim;
        try {
            claim = kubeApiFacade.getPersistentVolumeClaimClient().get(claimKey);
        } catch (Exception e) {
            logger.debug("Cannot read data volume claim {}; resize check skipped: {}", claimKey, ExceptionExt.toMessageChain(e));
            return spec;
        }
        if (!claim.isPresent() || claim.get().getSpec() == null) {
            return spec;
        }

        Optional<Quantity> current = KubeUtil.findStorageRequest(claim.get().getSpec());
        if (!current.isPresent() || current.get().getNumber().compareTo(requested.get().getNumber()) != 0) {
            return spec;
        }
        boolean resizePending = KubeUtil.findPersistentVolumeClaimCondition(claim.get(), KubeConstants.PVC_CONDITION_FILE_SYSTEM_RESIZE_PENDING)
                .map(condition -> KubeConstants.CONDITION_TRUE.equals(condition.getStatus()))
                .orElse(false);
        if (!resizePending) {
            return spec;
        }

        Map<String, String> annotations = new HashMap<>(spec.getAnnotations());
        annotations.put(FILESYSTEM_RESIZE_ANNOTATION, requested.get().toSuffixedString());
        return spec.toBuilder().withAnnotations(annotations).build();
    }
}
