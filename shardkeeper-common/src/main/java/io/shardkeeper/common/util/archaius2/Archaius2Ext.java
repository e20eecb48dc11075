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

package io.shardkeeper.common.util.archaius2;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.archaius.DefaultPropertyFactory;
import com.netflix.archaius.api.Config;
import com.netflix.archaius.config.MapConfig;

public final class Archaius2Ext {

    private Archaius2Ext() {
    }

    /**
     * Create Archaius based configuration object initialized with default values. Defaults can be overridden
     * by providing key/value pairs as parameters, with keys including the configuration prefix.
     */
    public static <C> C newConfiguration(Class<C> configType, String... keyValuePairs) {
        Preconditions.checkArgument(keyValuePairs.length % 2 == 0, "Expected even number of arguments");

        Map<String, String> props = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            props.put(keyValuePairs[i], keyValuePairs[i + 1]);
        }
        return newConfiguration(configType, props);
    }

    public static <C> C newConfiguration(Class<C> configType, Map<String, String> properties) {
        return newConfiguration(configType, new MapConfig(properties.isEmpty() ? Collections.emptyMap() : properties));
    }

    public static <C> C newConfiguration(Class<C> configType, Config config) {
        return newProxyFactory(config).newProxy(configType);
    }

    /**
     * Same as {@link #newConfiguration(Class, Config)}, but with the prefix given explicitly. Used for
     * configuration interfaces shared by several components, each under its own prefix.
     */
    public static <C> C newConfiguration(Class<C> configType, String prefix, Config config) {
        return newProxyFactory(config).newProxy(configType, prefix);
    }

    private static ConfigProxyFactory newProxyFactory(Config config) {
        return new ConfigProxyFactory(config, config.getDecoder(), DefaultPropertyFactory.from(config));
    }
}
