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

import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Strings;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class KubeApiClients {

    private static final Logger logger = LoggerFactory.getLogger(KubeApiClients.class);

    private KubeApiClients() {
    }

    public static ApiClient createApiClient(KubeConnectorConfiguration configuration) {
        ApiClient client;
        String kubeApiServerUrl = configuration.getKubeApiServerUrl();
        String kubeConfigPath = configuration.getKubeConfigPath();
        if (Strings.isNullOrEmpty(kubeApiServerUrl)) {
            try {
                client = Strings.isNullOrEmpty(kubeConfigPath) ? Config.defaultClient() : Config.fromConfig(kubeConfigPath);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot load kube client configuration", e);
            }
        } else {
            client = Config.fromUrl(kubeApiServerUrl);
        }

        OkHttpClient httpClient = client.getHttpClient().newBuilder()
                .protocols(Collections.singletonList(Protocol.HTTP_1_1))
                .readTimeout(configuration.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        client.setHttpClient(httpClient);

        logger.info("Created kube API client: basePath={}", client.getBasePath());
        return client;
    }
}
