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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Singleton;

import io.shardkeeper.server.drain.DrainAnnotations;
import io.shardkeeper.server.shard.model.BackupLocation;
import io.shardkeeper.server.shard.model.TabletAlias;
import io.shardkeeper.server.shard.model.TabletPool;
import io.shardkeeper.server.shard.model.TabletShard;
import io.shardkeeper.server.shard.model.TabletSpec;
import io.shardkeeper.server.tablet.TabletLabels;
import io.shardkeeper.server.tablet.TabletNames;
import io.shardkeeper.server.tablet.TabletUids;

/**
 * Expands the tablet pools of a shard into the specs of individual tablets.
 */
@Singleton
public class TabletSpecCompiler {

    static final String DRAIN_SUPPORTED_DESCRIPTION = "ensure that the tablet is not a primary";

    /**
     * Returns one spec per tablet, in pool order and then by index within the pool. Indexes run from 1 to the pool
     * replica count.
     */
    public List<TabletSpec> compile(TabletShard shard, Map<String, String> parentLabels) {
        List<TabletSpec> tablets = new ArrayList<>();
        for (TabletPool pool : shard.getTabletPools()) {
            for (int index = 1; index <= pool.getReplicas(); index++) {
                tablets.add(compileTablet(shard, pool, index, parentLabels));
            }
        }
        return tablets;
    }

    private TabletSpec compileTablet(TabletShard shard, TabletPool pool, int index, Map<String, String> parentLabels) {
        long uid = TabletUids.uid(pool.getCell(), shard.getKeyspaceName(), shard.getKeyRange(), pool.getType(), index);
        TabletAlias alias = TabletAlias.of(pool.getCell(), uid);

        Map<String, String> labels = new HashMap<>(parentLabels);
        labels.put(TabletLabels.CELL, alias.getCell());
        labels.put(TabletLabels.TABLET_UID, Long.toString(alias.getUid()));
        labels.put(TabletLabels.TABLET_TYPE, pool.getType().getValue());
        labels.put(TabletLabels.TABLET_INDEX, Integer.toString(index));

        Map<String, String> extraFlags = new HashMap<>(shard.getExtraFlags());
        extraFlags.putAll(pool.getExtraFlags());

        Optional<BackupLocation> backupLocation = shard.findBackupLocation(pool.getBackupLocationName());

        Map<String, String> annotations = new HashMap<>();
        annotations.put(DrainAnnotations.SUPPORTED, DRAIN_SUPPORTED_DESCRIPTION);
        annotations.putAll(pool.getAnnotations());
        backupLocation.ifPresent(location -> annotations.putAll(location.getAnnotations()));

        return TabletSpec.newBuilder()
                .withAlias(alias)
                .withType(pool.getType())
                .withIndex(index)
                .withNamespace(shard.getNamespace())
                .withName(TabletNames.podName(shard.getClusterName(), alias))
                .withClusterName(shard.getClusterName())
                .withKeyspaceName(shard.getKeyspaceName())
                .withKeyRange(shard.getKeyRange())
                .withDatabaseName(shard.getDatabaseName())
                .withGlobalLockserver(shard.getGlobalLockserver())
                .withImages(shard.getImages())
                .withImagePullPolicy(shard.getImagePullPolicy())
                .withZone(shard.getZoneMap().get(alias.getCell()))
                .withLabels(labels)
                .withExtraLabels(pool.getExtraLabels())
                .withAnnotations(annotations)
                .withExtraFlags(extraFlags)
                .withExtraEnv(pool.getExtraEnv())
                .withResources(pool.getResources())
                .withDataVolumeClaimTemplate(pool.getDataVolumeClaimTemplate().orElse(null))
                .withTolerations(pool.getTolerations())
                .withAffinity(pool.getAffinity())
                .withBackupLocation(backupLocation.orElse(null))
                .build();
    }
}
