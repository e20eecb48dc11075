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

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.shardkeeper.common.runtime.OperatorRuntime;
import io.shardkeeper.common.runtime.internal.DefaultOperatorRuntime;
import io.shardkeeper.server.kubernetes.DefaultKubeApiFacade;
import io.shardkeeper.server.kubernetes.KubeApiClients;
import io.shardkeeper.server.kubernetes.KubeApiFacade;
import io.shardkeeper.server.kubernetes.KubeConnectorConfiguration;
import io.shardkeeper.server.tablet.DefaultTabletPodFactory;
import io.shardkeeper.server.tablet.TabletPodFactory;

/**
 * Wires the shard tablet reconciler. The embedding application binds the Spectator {@code Registry}, the
 * {@code TopologyClient} and Archaius ({@link ConfigProxyFactory}).
 */
public class ShardReconcilerModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(OperatorRuntime.class).to(DefaultOperatorRuntime.class);
        bind(KubeApiFacade.class).to(DefaultKubeApiFacade.class);
        bind(TabletPodFactory.class).to(DefaultTabletPodFactory.class);
    }

    @Provides
    @Singleton
    public ShardReconcilerConfiguration getShardReconcilerConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(ShardReconcilerConfiguration.class);
    }

    @Provides
    @Singleton
    public KubeConnectorConfiguration getKubeConnectorConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(KubeConnectorConfiguration.class);
    }

    @Provides
    @Singleton
    public ApiClient getApiClient(KubeConnectorConfiguration configuration) {
        return KubeApiClients.createApiClient(configuration);
    }
}
