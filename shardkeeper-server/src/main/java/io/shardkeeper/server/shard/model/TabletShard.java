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

/**
 * Desired state of one shard of a keyspace, as declared by the user. Immutable input of a reconciliation pass.
 */
public final class TabletShard {

    private final String name;
    private final String namespace;
    private final long generation;
    private final String clusterName;
    private final String keyspaceName;
    private final KeyRange keyRange;
    private final String databaseName;
    private final GlobalLockserver globalLockserver;
    private final TabletImages images;
    private final String imagePullPolicy;
    private final Map<String, String> zoneMap;
    private final Map<String, String> extraFlags;
    private final List<TabletPool> tabletPools;
    private final List<BackupLocation> backupLocations;

    private TabletShard(Builder builder) {
        this.name = builder.name;
        this.namespace = builder.namespace;
        this.generation = builder.generation;
        this.clusterName = builder.clusterName;
        this.keyspaceName = builder.keyspaceName;
        this.keyRange = builder.keyRange;
        this.databaseName = builder.databaseName;
        this.globalLockserver = builder.globalLockserver;
        this.images = builder.images;
        this.imagePullPolicy = builder.imagePullPolicy;
        this.zoneMap = Collections.unmodifiableMap(new HashMap<>(builder.zoneMap));
        this.extraFlags = Collections.unmodifiableMap(new HashMap<>(builder.extraFlags));
        this.tabletPools = Collections.unmodifiableList(new ArrayList<>(builder.tabletPools));
        this.backupLocations = Collections.unmodifiableList(new ArrayList<>(builder.backupLocations));
    }

    /**
     * Name of the shard object.
     */
    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Revision of the shard object, stamped on pods when they are updated.
     */
    public long getGeneration() {
        return generation;
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

    /**
     * Name of the shard in the topology service, for example "-80".
     */
    public String getShardName() {
        return keyRange.toString();
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
     * Maps cell names to the availability zone their tablets are scheduled in.
     */
    public Map<String, String> getZoneMap() {
        return zoneMap;
    }

    public Map<String, String> getExtraFlags() {
        return extraFlags;
    }

    public List<TabletPool> getTabletPools() {
        return tabletPools;
    }

    public List<BackupLocation> getBackupLocations() {
        return backupLocations;
    }

    public Optional<BackupLocation> findBackupLocation(String locationName) {
        String effective = locationName == null ? "" : locationName;
        return backupLocations.stream().filter(location -> location.getName().equals(effective)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TabletShard that = (TabletShard) o;
        return generation == that.generation &&
                name.equals(that.name) &&
                namespace.equals(that.namespace) &&
                clusterName.equals(that.clusterName) &&
                keyspaceName.equals(that.keyspaceName) &&
                keyRange.equals(that.keyRange) &&
                Objects.equals(databaseName, that.databaseName) &&
                Objects.equals(globalLockserver, that.globalLockserver) &&
                Objects.equals(images, that.images) &&
                Objects.equals(imagePullPolicy, that.imagePullPolicy) &&
                zoneMap.equals(that.zoneMap) &&
                extraFlags.equals(that.extraFlags) &&
                tabletPools.equals(that.tabletPools) &&
                backupLocations.equals(that.backupLocations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, generation, clusterName, keyspaceName, keyRange, databaseName,
                globalLockserver, images, imagePullPolicy, zoneMap, extraFlags, tabletPools, backupLocations);
    }

    @Override
    public String toString() {
        return "TabletShard{" +
                "name='" + name + '\'' +
                ", namespace='" + namespace + '\'' +
                ", generation=" + generation +
                ", clusterName='" + clusterName + '\'' +
                ", keyspaceName='" + keyspaceName + '\'' +
                ", keyRange=" + keyRange +
                ", tabletPools=" + tabletPools +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withName(name)
                .withNamespace(namespace)
                .withGeneration(generation)
                .withClusterName(clusterName)
                .withKeyspaceName(keyspaceName)
                .withKeyRange(keyRange)
                .withDatabaseName(databaseName)
                .withGlobalLockserver(globalLockserver)
                .withImages(images)
                .withImagePullPolicy(imagePullPolicy)
                .withZoneMap(zoneMap)
                .withExtraFlags(extraFlags)
                .withTabletPools(tabletPools)
                .withBackupLocations(backupLocations);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private String name;
        private String namespace;
        private long generation;
        private String clusterName;
        private String keyspaceName;
        private KeyRange keyRange = KeyRange.full();
        private String databaseName;
        private GlobalLockserver globalLockserver;
        private TabletImages images;
        private String imagePullPolicy;
        private Map<String, String> zoneMap = Collections.emptyMap();
        private Map<String, String> extraFlags = Collections.emptyMap();
        private List<TabletPool> tabletPools = Collections.emptyList();
        private List<BackupLocation> backupLocations = Collections.emptyList();

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withGeneration(long generation) {
            this.generation = generation;
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

        public Builder withZoneMap(Map<String, String> zoneMap) {
            this.zoneMap = zoneMap;
            return this;
        }

        public Builder withExtraFlags(Map<String, String> extraFlags) {
            this.extraFlags = extraFlags;
            return this;
        }

        public Builder withTabletPools(List<TabletPool> tabletPools) {
            this.tabletPools = tabletPools;
            return this;
        }

        public Builder withBackupLocations(List<BackupLocation> backupLocations) {
            this.backupLocations = backupLocations;
            return this;
        }

        public TabletShard build() {
            Preconditions.checkArgument(name != null && !name.isEmpty(), "shard name must be set");
            Preconditions.checkArgument(namespace != null && !namespace.isEmpty(), "shard namespace must be set");
            Preconditions.checkArgument(clusterName != null && !clusterName.isEmpty(), "cluster name must be set");
            Preconditions.checkArgument(keyspaceName != null && !keyspaceName.isEmpty(), "keyspace name must be set");
            Preconditions.checkNotNull(keyRange, "key range must be set");
            return new TabletShard(this);
        }
    }
}
