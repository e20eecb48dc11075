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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.inject.Singleton;

import com.google.common.base.Strings;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1EmptyDirVolumeSource;
import io.kubernetes.client.openapi.models.V1HTTPGetAction;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimVolumeSource;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1Probe;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Toleration;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import io.shardkeeper.server.kubernetes.KubeConstants;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.shard.model.GlobalLockserver;
import io.shardkeeper.server.shard.model.TabletSpec;

@Singleton
public class DefaultTabletPodFactory implements TabletPodFactory {

    static final String VTTABLET_CONTAINER = "vttablet";
    static final String MYSQLD_CONTAINER = "mysqld";
    static final String DATA_VOLUME = "vt-data";
    static final String DATA_MOUNT_PATH = "/vt/vtdataroot";

    static final int WEB_PORT = 15000;
    static final int GRPC_PORT = 15999;
    static final int MYSQL_PORT = 3306;

    @Override
    public V1Pod newPod(ObjectKey key, TabletSpec spec) {
        V1ObjectMeta metadata = new V1ObjectMeta()
                .name(key.getName())
                .namespace(key.getNamespace())
                .labels(new HashMap<>(objectLabels(spec)))
                .annotations(new HashMap<>(spec.getAnnotations()));

        V1PodSpec podSpec = new V1PodSpec()
                .hostname(key.getName())
                .containers(new ArrayList<>(desiredContainers(spec)))
                .volumes(new ArrayList<>(Collections.singletonList(dataVolume(spec))))
                .affinity(KubeUtil.deepCopy(spec.getAffinity()))
                .tolerations(copyOrNull(spec.getTolerations()));
        spec.getZone().ifPresent(zone -> podSpec.putNodeSelectorItem(KubeConstants.NODE_LABEL_ZONE, zone));

        return new V1Pod()
                .apiVersion("v1")
                .kind("Pod")
                .metadata(metadata)
                .spec(podSpec);
    }

    @Override
    public void updatePodInPlace(V1Pod pod, TabletSpec spec) {
        KubeUtil.mergeLabels(pod.getMetadata(), objectLabels(spec));
        KubeUtil.mergeAnnotations(pod.getMetadata(), spec.getAnnotations());
    }

    @Override
    public void updatePod(V1Pod pod, TabletSpec spec) {
        updatePodInPlace(pod, spec);

        V1PodSpec podSpec = pod.getSpec();
        if (podSpec == null) {
            podSpec = new V1PodSpec();
            pod.setSpec(podSpec);
        }

        for (V1Container desired : desiredContainers(spec)) {
            V1Container live = findContainer(podSpec, desired.getName());
            if (live == null) {
                podSpec.addContainersItem(desired);
            } else {
                updateContainer(live, desired);
            }
        }

        V1Volume desiredVolume = dataVolume(spec);
        List<V1Volume> volumes = podSpec.getVolumes() == null ? new ArrayList<>() : new ArrayList<>(podSpec.getVolumes());
        boolean replaced = false;
        for (int i = 0; i < volumes.size(); i++) {
            if (DATA_VOLUME.equals(volumes.get(i).getName())) {
                volumes.set(i, desiredVolume);
                replaced = true;
            }
        }
        if (!replaced) {
            volumes.add(desiredVolume);
        }
        podSpec.setVolumes(volumes);

        podSpec.setAffinity(KubeUtil.deepCopy(spec.getAffinity()));

        Map<String, String> nodeSelector = podSpec.getNodeSelector() == null
                ? new HashMap<>()
                : new HashMap<>(podSpec.getNodeSelector());
        if (spec.getZone().isPresent()) {
            nodeSelector.put(KubeConstants.NODE_LABEL_ZONE, spec.getZone().get());
        } else {
            nodeSelector.remove(KubeConstants.NODE_LABEL_ZONE);
        }
        podSpec.setNodeSelector(nodeSelector.isEmpty() ? null : nodeSelector);

        // The API server adds its own tolerations, so only the missing ones are appended.
        for (V1Toleration toleration : spec.getTolerations()) {
            if (podSpec.getTolerations() == null || !podSpec.getTolerations().contains(toleration)) {
                podSpec.addTolerationsItem(KubeUtil.deepCopy(toleration));
            }
        }
    }

    /**
     * Applies the owned fields of a container. The API server defaults the pull policy and the resources, and adds
     * its own volume mounts, so unset values and foreign mounts are left as they are.
     */
    private static void updateContainer(V1Container live, V1Container desired) {
        live.setImage(desired.getImage());
        if (!Strings.isNullOrEmpty(desired.getImagePullPolicy())) {
            live.setImagePullPolicy(desired.getImagePullPolicy());
        }
        live.setArgs(desired.getArgs());
        live.setEnv(desired.getEnv());
        if (!isEmpty(desired.getResources())) {
            live.setResources(desired.getResources());
        }
        live.setPorts(desired.getPorts());
        live.setVolumeMounts(mergeVolumeMounts(live.getVolumeMounts(), desired.getVolumeMounts()));
    }

    private static List<V1VolumeMount> mergeVolumeMounts(List<V1VolumeMount> live, List<V1VolumeMount> desired) {
        List<V1VolumeMount> merged = live == null ? new ArrayList<>() : new ArrayList<>(live);
        for (V1VolumeMount mount : desired) {
            boolean replaced = false;
            for (int i = 0; i < merged.size(); i++) {
                if (mount.getName().equals(merged.get(i).getName())) {
                    merged.set(i, mount);
                    replaced = true;
                }
            }
            if (!replaced) {
                merged.add(mount);
            }
        }
        return merged;
    }

    private static boolean isEmpty(V1ResourceRequirements resources) {
        return resources == null
                || ((resources.getLimits() == null || resources.getLimits().isEmpty())
                && (resources.getRequests() == null || resources.getRequests().isEmpty()));
    }

    private static Map<String, String> objectLabels(TabletSpec spec) {
        Map<String, String> labels = new HashMap<>(spec.getExtraLabels());
        labels.putAll(spec.getLabels());
        return labels;
    }

    private static List<V1Container> desiredContainers(TabletSpec spec) {
        V1Container vttablet = new V1Container()
                .name(VTTABLET_CONTAINER)
                .image(spec.getImages() == null ? null : spec.getImages().getVttablet())
                .imagePullPolicy(spec.getImagePullPolicy())
                .args(formatFlags(vttabletFlags(spec)))
                .env(copyOrNull(spec.getExtraEnv()))
                .resources(KubeUtil.deepCopy(spec.getResources()))
                .ports(new ArrayList<>(Arrays.asList(
                        new V1ContainerPort().name("web").containerPort(WEB_PORT).protocol("TCP"),
                        new V1ContainerPort().name("grpc").containerPort(GRPC_PORT).protocol("TCP")
                )))
                .volumeMounts(dataVolumeMounts())
                .readinessProbe(new V1Probe()
                        .httpGet(new V1HTTPGetAction().path("/healthz").port(new IntOrString(WEB_PORT)))
                        .periodSeconds(10));

        V1Container mysqld = new V1Container()
                .name(MYSQLD_CONTAINER)
                .image(spec.getImages() == null ? null : spec.getImages().getMysqld())
                .imagePullPolicy(spec.getImagePullPolicy())
                .args(formatFlags(mysqldFlags(spec)))
                .ports(new ArrayList<>(Collections.singletonList(new V1ContainerPort().name("mysql").containerPort(MYSQL_PORT).protocol("TCP"))))
                .volumeMounts(dataVolumeMounts());

        List<V1Container> containers = new ArrayList<>();
        containers.add(vttablet);
        containers.add(mysqld);
        return containers;
    }

    private static Map<String, String> vttabletFlags(TabletSpec spec) {
        Map<String, String> flags = new TreeMap<>();
        flags.put("tablet-path", spec.getAlias().toString());
        flags.put("init_keyspace", spec.getKeyspaceName());
        flags.put("init_shard", spec.getKeyRange() == null ? null : spec.getKeyRange().toString());
        flags.put("init_tablet_type", spec.getType().getValue());
        flags.put("port", Integer.toString(WEB_PORT));
        flags.put("grpc_port", Integer.toString(GRPC_PORT));
        if (spec.getDatabaseName() != null && !spec.getDatabaseName().isEmpty()) {
            flags.put("init_db_name_override", spec.getDatabaseName());
        }
        GlobalLockserver lockserver = spec.getGlobalLockserver();
        if (lockserver != null) {
            flags.put("topo_implementation", lockserver.getImplementation());
            flags.put("topo_global_server_address", lockserver.getAddress());
            flags.put("topo_global_root", lockserver.getRootPath());
        }
        spec.getBackupLocation().ifPresent(location -> {
            if (!location.getName().isEmpty()) {
                flags.put("backup_storage_location", location.getName());
            }
        });
        flags.putAll(spec.getExtraFlags());
        return flags;
    }

    private static Map<String, String> mysqldFlags(TabletSpec spec) {
        Map<String, String> flags = new TreeMap<>();
        flags.put("tablet_uid", Long.toString(spec.getAlias().getUid()));
        flags.put("socket_file", DATA_MOUNT_PATH + "/mysqlctl.sock");
        return flags;
    }

    /**
     * Renders flags as sorted "--name=value" arguments. Flags with a null value are skipped.
     */
    static List<String> formatFlags(Map<String, String> flags) {
        List<String> args = new ArrayList<>();
        new TreeMap<>(flags).forEach((name, value) -> {
            if (value != null) {
                args.add("--" + name + '=' + value);
            }
        });
        return args;
    }

    private static List<V1VolumeMount> dataVolumeMounts() {
        return new ArrayList<>(Collections.singletonList(new V1VolumeMount().name(DATA_VOLUME).mountPath(DATA_MOUNT_PATH)));
    }

    private static V1Volume dataVolume(TabletSpec spec) {
        V1Volume volume = new V1Volume().name(DATA_VOLUME);
        if (spec.getDataVolumeClaimName().isPresent()) {
            return volume.persistentVolumeClaim(new V1PersistentVolumeClaimVolumeSource().claimName(spec.getDataVolumeClaimName().get()));
        }
        return volume.emptyDir(new V1EmptyDirVolumeSource());
    }

    private static V1Container findContainer(V1PodSpec podSpec, String name) {
        if (podSpec.getContainers() == null) {
            return null;
        }
        for (V1Container container : podSpec.getContainers()) {
            if (name.equals(container.getName())) {
                return container;
            }
        }
        return null;
    }

    private static <T> List<T> copyOrNull(List<T> items) {
        if (items.isEmpty()) {
            return null;
        }
        List<T> copy = new ArrayList<>();
        for (T item : items) {
            copy.add(KubeUtil.deepCopy(item));
        }
        return copy;
    }
}
