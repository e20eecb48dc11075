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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;
import com.netflix.archaius.config.MapConfig;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Archaius2ExtTest {

    @Test
    public void testDefaults() {
        SampleConfiguration configuration = Archaius2Ext.newConfiguration(SampleConfiguration.class);
        assertThat(configuration.getTimeoutMs()).isEqualTo(1000);
        assertThat(configuration.getName()).isEqualTo("default");
    }

    @Test
    public void testOverrides() {
        SampleConfiguration configuration = Archaius2Ext.newConfiguration(SampleConfiguration.class,
                "sample.timeoutMs", "250"
        );
        assertThat(configuration.getTimeoutMs()).isEqualTo(250);
        assertThat(configuration.getName()).isEqualTo("default");
    }

    @Test
    public void testExplicitPrefix() {
        MapConfig config = new MapConfig(Collections.singletonMap("other.name", "custom"));
        SampleConfiguration configuration = Archaius2Ext.newConfiguration(SampleConfiguration.class, "other", config);
        assertThat(configuration.getName()).isEqualTo("custom");
    }

    @Test
    public void testOddNumberOfArguments() {
        assertThatThrownBy(() -> Archaius2Ext.newConfiguration(SampleConfiguration.class, "sample.timeoutMs"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Configuration(prefix = "sample")
    public interface SampleConfiguration {

        @DefaultValue("1000")
        long getTimeoutMs();

        @DefaultValue("default")
        String getName();
    }
}
