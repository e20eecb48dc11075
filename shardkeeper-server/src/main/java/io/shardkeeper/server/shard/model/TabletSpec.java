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

package io.shardkeeper.server.shard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import io.kubernetes.client.openapi.models.V1Affinity;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Toleration;
import io.shardkeeper.server.kubernetes.ObjectKey;

/**
 * Fully resolved configuration of one tablet. The pod and the data volume claim of a tablet share the same name.
 */
public final class TabletSpec {

    private final TabletAlias alias;
    private final TabletType type;
    private final int index;
    private final String namespace;
    private final String name;
    private final String clusterName;
    private final String keyspaceName;
    private final KeyRange keyRange;
    private final String databaseName;
    private final GlobalLockserver globalLockserver;
    private final TabletImages images;
    private final String imagePullPolicy;
    private final String zone;
    private final Map<String, String> labels;
    private final Map<String, String> extraLabels;
    private final Map<String, String> annotations;
    private final Map<String, String> extraFlags;
    private final List<V1EnvVar> extraEnv;
    private final V1ResourceRequirements resources;
    private final V1PersistentVolumeClaimSpec dataVolumeClaimTemplate;
    private final List<V1Toleration> tolerations;
    private final V1Affinity affinity;
    private final BackupLocation backupLocation;

    private TabletSpec(Builder builder) {
        this.alias = builder.alias;
        this.type = builder.type;
        this.index = builder.index;
        this.namespace = builder.namespace;
        this.name = builder.name;
        this.clusterName = builder.clusterName;
        this.keyspaceName = builder.keyspaceName;
        this.keyRange = builder.keyRange;
        this.databaseName = builder.databaseName;
        this.globalLockserver = builder.globalLockserver;
        this.images = builder.images;
        this.imagePullPolicy = builder.imagePullPolicy;
        this.zone = builder.zone;
        this.labels = Collections.unmodifiableMap(new HashMap<>(builder.labels));
        this.extraLabels = Collections.unmodifiableMap(new HashMap<>(builder.extraLabels));
        this.annotations = Collections.unmodifiableMap(new HashMap<>(builder.annotations));
        this.extraFlags = Collections.unmodifiableMap(new HashMap<>(builder.extraFlags));
        this.extraEnv = Collections.unmodifiableList(new ArrayList<>(builder.extraEnv));
        this.resources = builder.resources;
        this.dataVolumeClaimTemplate = builder.dataVolumeClaimTemplate;
        this.tolerations = Collections.unmodifiableList(new ArrayList<>(builder.tolerations));
        this.affinity = builder.affinity;
        this.backupLocation = builder.backupLocation;
    }

    public TabletAlias getAlias() {
        return alias;
    }

    public TabletType getType() {
        return type;
    }

    /**
     * 1-based position of the tablet within its pool.
     */
    public int getIndex() {
        return index;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Name of both the pod and the data volume claim.
     */
    public String getName() {
        return name;
    }

    public ObjectKey getObjectKey() {
        return ObjectKey.of(namespace, name);
    }

    public String getClusterName() {
        return clusterName;
    }

    public String getKeyspaceName() {
        return keyspaceName;
    }

    public KeyRange getKeyRange() {
        return keyRange;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public GlobalLockserver getGlobalLockserver() {
        return globalLockserver;
    }

    public TabletImages getImages() {
        return images;
    }

    public String getImagePullPolicy() {
        return imagePullPolicy;
    }

    /**
     * Availability zone the tablet is pinned to, or empty if its cell has no zone mapping.
     */
    public Optional<String> getZone() {
        return Optional.ofNullable(zone);
    }

    /**
     * Selector labels stamped on the tablet's objects.
     */
    public Map<String, String> getLabels() {
        return labels;
    }

    public Map<String, String> getExtraLabels() {
        return extraLabels;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public Map<String, String> getExtraFlags() {
        return extraFlags;
    }

    public List<V1EnvVar> getExtraEnv() {
        return extraEnv;
    }

    public V1ResourceRequirements getResources() {
        return resources;
    }

    public Optional<V1PersistentVolumeClaimSpec> getDataVolumeClaimTemplate() {
        return Optional.ofNullable(dataVolumeClaimTemplate);
    }

    /**
     * Name of the data volume claim, present only if the tablet has one.
     */
    public Optional<String> getDataVolumeClaimName() {
        return dataVolumeClaimTemplate == null ? Optional.empty() : Optional.of(name);
    }

    public List<V1Toleration> getTolerations() {
        return tolerations;
    }

    public V1Affinity getAffinity() {
        return affinity;
    }

    public Optional<BackupLocation> getBackupLocation() {
        return Optional.ofNullable(backupLocation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TabletSpec that = (TabletSpec) o;
        return index == that.index &&
                alias.equals(that.alias) &&
                type == that.type &&
                namespace.equals(that.namespace) &&
                name.equals(that.name) &&
                Objects.equals(clusterName, that.clusterName) &&
                Objects.equals(keyspaceName, that.keyspaceName) &&
                Objects.equals(keyRange, that.keyRange) &&
                Objects.equals(databaseName, that.databaseName) &&
                Objects.equals(globalLockserver, that.globalLockserver) &&
                Objects.equals(images, that.images) &&
                Objects.equals(imagePullPolicy, that.imagePullPolicy) &&
                Objects.equals(zone, that.zone) &&
                labels.equals(that.labels) &&
                extraLabels.equals(that.extraLabels) &&
                annotations.equals(that.annotations) &&
                extraFlags.equals(that.extraFlags) &&
                extraEnv.equals(that.extraEnv) &&
                Objects.equals(resources, that.resources) &&
                Objects.equals(dataVolumeClaimTemplate, that.dataVolumeClaimTemplate) &&
                tolerations.equals(that.tolerations) &&
                Objects.equals(affinity, that.affinity) &&
                Objects.equals(backupLocation, that.backupLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, type, index, namespace, name, clusterName, keyspaceName, keyRange, databaseName,
                globalLockserver, images, imagePullPolicy, zone, labels, extraLabels, annotations, extraFlags,
                extraEnv, resources, dataVolumeClaimTemplate, tolerations, affinity, backupLocation);
    }

    @Override
    public String toString() {
        return "TabletSpec{" +
                "alias=" + alias +
                ", type=" + type +
                ", index=" + index +
                ", name='" + name + '\'' +
                ", keyspace='" + keyspaceName + '\'' +
                ", keyRange=" + keyRange +
                ", zone='" + zone + '\'' +
                ", annotations=" + annotations +
                ", extraFlags=" + extraFlags +
                ", dataVolume=" + (dataVolumeClaimTemplate != null) +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withAlias(alias)
                .withType(type)
                .withIndex(index)
                .withNamespace(namespace)
                .withName(name)
                .withClusterName(clusterName)
                .withKeyspaceName(keyspaceName)
                .withKeyRange(keyRange)
                .withDatabaseName(databaseName)
                .withGlobalLockserver(globalLockserver)
                .withImages(images)
                .withImagePullPolicy(imagePullPolicy)
                .withZone(zone)
                .withLabels(labels)
                .withExtraLabels(extraLabels)
                .withAnnotations(annotations)
                .withExtraFlags(extraFlags)
                .withExtraEnv(extraEnv)
                .withResources(resources)
                .withDataVolumeClaimTemplate(dataVolumeClaimTemplate)
                .withTolerations(tolerations)
                .withAffinity(affinity)
                .withBackupLocation(backupLocation);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private TabletAlias alias;
        private TabletType type;
        private int index;
        private String namespace;
        private String name;
        private String clusterName;
        private String keyspaceName;
        private KeyRange keyRange;
        private String databaseName;
        private GlobalLockserver globalLockserver;
        private TabletImages images;
        private String imagePullPolicy;
        private String zone;
        private Map<String, String> labels = Collections.emptyMap();
        private Map<String, String> extraLabels = Collections.emptyMap();
        private Map<String, String> annotations = Collections.emptyMap();
        private Map<String, String> extraFlags = Collections.emptyMap();
        private List<V1EnvVar> extraEnv = Collections.emptyList();
        private V1ResourceRequirements resources;
        private V1PersistentVolumeClaimSpec dataVolumeClaimTemplate;
        private List<V1Toleration> tolerations = Collections.emptyList();
        private V1Affinity affinity;
        private BackupLocation backupLocation;

        private Builder() {
        }

        public Builder withAlias(TabletAlias alias) {
            this.alias = alias;
            return this;
        }

        public Builder withType(TabletType type) {
            this.type = type;
            return this;
        }

        public Builder withIndex(int index) {
            this.index = index;
            return this;
        }

        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withClusterName(String clusterName) {
            this.clusterName = clusterName;
            return this;
        }

        public Builder withKeyspaceName(String keyspaceName) {
            this.keyspaceName = keyspaceName;
            return this;
        }

        public Builder withKeyRange(KeyRange keyRange) {
            this.keyRange = keyRange;
            return this;
        }

        public Builder withDatabaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        public Builder withGlobalLockserver(GlobalLockserver globalLockserver) {
            this.globalLockserver = globalLockserver;
            return this;
        }

        public Builder withImages(TabletImages images) {
            this.images = images;
            return this;
        }

        public Builder withImagePullPolicy(String imagePullPolicy) {
            this.imagePullPolicy = imagePullPolicy;
            return this;
        }

        public Builder withZone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder withLabels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder withExtraLabels(Map<String, String> extraLabels) {
            this.extraLabels = extraLabels;
            return this;
        }

        public Builder withAnnotations(Map<String, String> annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder withExtraFlags(Map<String, String> extraFlags) {
            this.extraFlags = extraFlags;
            return this;
        }

        public Builder withExtraEnv(List<V1EnvVar> extraEnv) {
            this.extraEnv = extraEnv;
            return this;
        }

        public Builder withResources(V1ResourceRequirements resources) {
            this.resources = resources;
            return this;
        }

        public Builder withDataVolumeClaimTemplate(V1PersistentVolumeClaimSpec dataVolumeClaimTemplate) {
            this.dataVolumeClaimTemplate = dataVolumeClaimTemplate;
            return this;
        }

        public Builder withTolerations(List<V1Toleration> tolerations) {
            this.tolerations = tolerations;
            return this;
        }

        public Builder withAffinity(V1Affinity affinity) {
            this.affinity = affinity;
            return this;
        }

        public Builder withBackupLocation(BackupLocation backupLocation) {
            this.backupLocation = backupLocation;
            return this;
        }

        public TabletSpec build() {
            Preconditions.checkNotNull(alias, "tablet alias must be set");
            Preconditions.checkNotNull(type, "tablet type must be set");
            Preconditions.checkArgument(index > 0, "tablet index must be positive: %s", index);
            Preconditions.checkArgument(namespace != null && !namespace.isEmpty(), "namespace must be set");
            Preconditions.checkArgument(name != null && !name.isEmpty(), "object name must be set");
            return new TabletSpec(this);
        }
    }
}
