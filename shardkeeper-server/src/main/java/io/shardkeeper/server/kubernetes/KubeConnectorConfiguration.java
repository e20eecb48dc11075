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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "shardkeeper.kube")
public interface KubeConnectorConfiguration {

    /**
     * Kube API server URL. If not set, the kube config file is used.
     */
    @DefaultValue("")
    String getKubeApiServerUrl();

    /**
     * Path to the kube config file. If not set, the client default resolution applies (in-cluster service
     * account, or ~/.kube/config).
     */
    @DefaultValue("")
    String getKubeConfigPath();

    @DefaultValue("30000")
    long getReadTimeoutMs();
}
