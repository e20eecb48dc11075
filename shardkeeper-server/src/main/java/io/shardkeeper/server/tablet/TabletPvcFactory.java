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

package io.shardkeeper.server.tablet;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Singleton;

import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.shardkeeper.server.kubernetes.KubeConstants;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.shard.model.TabletSpec;

/**
 * Builds and updates the data volume claims of tablets.
 */
@Singleton
public class TabletPvcFactory {

    public V1PersistentVolumeClaim newPvc(ObjectKey key, TabletSpec spec) {
        V1PersistentVolumeClaimSpec template = spec.getDataVolumeClaimTemplate().orElseThrow(() ->
                new IllegalArgumentException("Tablet " + spec.getAlias() + " has no data volume claim template"));
        return new V1PersistentVolumeClaim()
                .apiVersion("v1")
                .kind("PersistentVolumeClaim")
                .metadata(new V1ObjectMeta()
                        .name(key.getName())
                        .namespace(key.getNamespace())
                        .labels(new HashMap<>(objectLabels(spec))))
                .spec(KubeUtil.deepCopy(template));
    }

    /**
     * Merges labels and grows the requested storage to the template size. Claims are never shrunk, since volumes
     * cannot be made smaller online.
     */
    public void updatePvcInPlace(V1PersistentVolumeClaim pvc, TabletSpec spec) {
        KubeUtil.mergeLabels(pvc.getMetadata(), objectLabels(spec));

        Optional<Quantity> desired = spec.getDataVolumeClaimTemplate().flatMap(KubeUtil::findStorageRequest);
        if (!desired.isPresent() || pvc.getSpec() == null) {
            return;
        }
        Optional<Quantity> current = KubeUtil.findStorageRequest(pvc.getSpec());
        if (current.isPresent() && current.get().getNumber().compareTo(desired.get().getNumber()) >= 0) {
            return;
        }
        V1ResourceRequirements resources = pvc.getSpec().getResources();
        if (resources == null) {
            resources = new V1ResourceRequirements();
            pvc.getSpec().setResources(resources);
        }
        Map<String, Quantity> requests = resources.getRequests() == null ? new HashMap<>() : new HashMap<>(resources.getRequests());
        requests.put(KubeConstants.RESOURCE_STORAGE, desired.get());
        resources.setRequests(requests);
    }

    private static Map<String, String> objectLabels(TabletSpec spec) {
        Map<String, String> labels = new HashMap<>(spec.getExtraLabels());
        labels.putAll(spec.getLabels());
        return labels;
    }
}
