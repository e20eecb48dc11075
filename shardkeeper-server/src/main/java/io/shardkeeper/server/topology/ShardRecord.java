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

package io.shardkeeper.server.topology;

import java.util.Objects;
import java.util.Optional;

import io.shardkeeper.server.shard.model.TabletAlias;

/**
 * Global topology record of a shard.
 */
public final class ShardRecord {

    private final String keyspace;
    private final String shard;
    private final TabletAlias primaryAlias;

    public ShardRecord(String keyspace, String shard, TabletAlias primaryAlias) {
        this.keyspace = keyspace;
        this.shard = shard;
        this.primaryAlias = primaryAlias;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getShard() {
        return shard;
    }

    /**
     * Alias of the tablet the topology service records as primary, or empty if the shard has no primary.
     */
    public Optional<TabletAlias> getPrimaryAlias() {
        return Optional.ofNullable(primaryAlias);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ShardRecord that = (ShardRecord) o;
        return Objects.equals(keyspace, that.keyspace) &&
                Objects.equals(shard, that.shard) &&
                Objects.equals(primaryAlias, that.primaryAlias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyspace, shard, primaryAlias);
    }

    @Override
    public String toString() {
        return "ShardRecord{" +
                "keyspace='" + keyspace + '\'' +
                ", shard='" + shard + '\'' +
                ", primaryAlias=" + primaryAlias +
                '}';
    }
}
