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

/**
 * A group of identical tablets of one type in one cell.
 */
public final class TabletPool {

    private final String cell;
    private final TabletType type;
    private final int replicas;
    private final V1PersistentVolumeClaimSpec dataVolumeClaimTemplate;
    private final V1ResourceRequirements resources;
    private final Map<String, String> extraFlags;
    private final Map<String, String> annotations;
    private final Map<String, String> extraLabels;
    private final List<V1EnvVar> extraEnv;
    private final List<V1Toleration> tolerations;
    private final V1Affinity affinity;
    private final String backupLocationName;

    private TabletPool(Builder builder) {
        this.cell = builder.cell;
        this.type = builder.type;
        this.replicas = builder.replicas;
        this.dataVolumeClaimTemplate = builder.dataVolumeClaimTemplate;
        this.resources = builder.resources;
        this.extraFlags = Collections.unmodifiableMap(new HashMap<>(builder.extraFlags));
        this.annotations = Collections.unmodifiableMap(new HashMap<>(builder.annotations));
        this.extraLabels = Collections.unmodifiableMap(new HashMap<>(builder.extraLabels));
        this.extraEnv = Collections.unmodifiableList(new ArrayList<>(builder.extraEnv));
        this.tolerations = Collections.unmodifiableList(new ArrayList<>(builder.tolerations));
        this.affinity = builder.affinity;
        this.backupLocationName = builder.backupLocationName;
    }

    public String getCell() {
        return cell;
    }

    public TabletType getType() {
        return type;
    }

    public int getReplicas() {
        return replicas;
    }

    /**
     * Template of the data volume claim. Tablets of a pool without one store data on an ephemeral volume.
     */
    public Optional<V1PersistentVolumeClaimSpec> getDataVolumeClaimTemplate() {
        return Optional.ofNullable(dataVolumeClaimTemplate);
    }

    public V1ResourceRequirements getResources() {
        return resources;
    }

    public Map<String, String> getExtraFlags() {
        return extraFlags;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public Map<String, String> getExtraLabels() {
        return extraLabels;
    }

    public List<V1EnvVar> getExtraEnv() {
        return extraEnv;
    }

    public List<V1Toleration> getTolerations() {
        return tolerations;
    }

    public V1Affinity getAffinity() {
        return affinity;
    }

    public String getBackupLocationName() {
        return backupLocationName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TabletPool that = (TabletPool) o;
        return replicas == that.replicas &&
                cell.equals(that.cell) &&
                type == that.type &&
                Objects.equals(dataVolumeClaimTemplate, that.dataVolumeClaimTemplate) &&
                Objects.equals(resources, that.resources) &&
                extraFlags.equals(that.extraFlags) &&
                annotations.equals(that.annotations) &&
                extraLabels.equals(that.extraLabels) &&
                extraEnv.equals(that.extraEnv) &&
                tolerations.equals(that.tolerations) &&
                Objects.equals(affinity, that.affinity) &&
                backupLocationName.equals(that.backupLocationName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cell, type, replicas, dataVolumeClaimTemplate, resources, extraFlags, annotations,
                extraLabels, extraEnv, tolerations, affinity, backupLocationName);
    }

    @Override
    public String toString() {
        return "TabletPool{" +
                "cell='" + cell + '\'' +
                ", type=" + type +
                ", replicas=" + replicas +
                ", dataVolume=" + (dataVolumeClaimTemplate != null) +
                ", extraFlags=" + extraFlags +
                ", annotations=" + annotations +
                ", extraLabels=" + extraLabels +
                ", backupLocationName='" + backupLocationName + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withCell(cell)
                .withType(type)
                .withReplicas(replicas)
                .withDataVolumeClaimTemplate(dataVolumeClaimTemplate)
                .withResources(resources)
                .withExtraFlags(extraFlags)
                .withAnnotations(annotations)
                .withExtraLabels(extraLabels)
                .withExtraEnv(extraEnv)
                .withTolerations(tolerations)
                .withAffinity(affinity)
                .withBackupLocationName(backupLocationName);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private String cell;
        private TabletType type = TabletType.REPLICA;
        private int replicas;
        private V1PersistentVolumeClaimSpec dataVolumeClaimTemplate;
        private V1ResourceRequirements resources;
        private Map<String, String> extraFlags = Collections.emptyMap();
        private Map<String, String> annotations = Collections.emptyMap();
        private Map<String, String> extraLabels = Collections.emptyMap();
        private List<V1EnvVar> extraEnv = Collections.emptyList();
        private List<V1Toleration> tolerations = Collections.emptyList();
        private V1Affinity affinity;
        private String backupLocationName = "";

        private Builder() {
        }

        public Builder withCell(String cell) {
            this.cell = cell;
            return this;
        }

        public Builder withType(TabletType type) {
            this.type = type;
            return this;
        }

        public Builder withReplicas(int replicas) {
            this.replicas = replicas;
            return this;
        }

        public Builder withDataVolumeClaimTemplate(V1PersistentVolumeClaimSpec dataVolumeClaimTemplate) {
            this.dataVolumeClaimTemplate = dataVolumeClaimTemplate;
            return this;
        }

        public Builder withResources(V1ResourceRequirements resources) {
            this.resources = resources;
            return this;
        }

        public Builder withExtraFlags(Map<String, String> extraFlags) {
            this.extraFlags = extraFlags;
            return this;
        }

        public Builder withAnnotations(Map<String, String> annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder withExtraLabels(Map<String, String> extraLabels) {
            this.extraLabels = extraLabels;
            return this;
        }

        public Builder withExtraEnv(List<V1EnvVar> extraEnv) {
            this.extraEnv = extraEnv;
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

        public Builder withBackupLocationName(String backupLocationName) {
            this.backupLocationName = backupLocationName == null ? "" : backupLocationName;
            return this;
        }

        public TabletPool build() {
            Preconditions.checkArgument(cell != null && !cell.isEmpty(), "pool cell must be set");
            Preconditions.checkNotNull(type, "pool type must be set");
            Preconditions.checkArgument(replicas >= 0, "negative replica count: %s", replicas);
            return new TabletPool(this);
        }
    }
}
