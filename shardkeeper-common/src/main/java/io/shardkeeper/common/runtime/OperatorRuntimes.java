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

package io.shardkeeper.common.runtime;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.shardkeeper.common.runtime.internal.DefaultOperatorRuntime;
import io.shardkeeper.common.util.time.Clocks;
import io.shardkeeper.common.util.time.TestClock;

public final class OperatorRuntimes {

    private OperatorRuntimes() {
    }

    public static OperatorRuntime internal() {
        return new DefaultOperatorRuntime(new DefaultRegistry(), Clocks.system());
    }

    public static OperatorRuntime internal(Registry registry) {
        return new DefaultOperatorRuntime(registry, Clocks.system());
    }

    public static OperatorRuntime test() {
        return test(Clocks.test());
    }

    public static OperatorRuntime test(TestClock clock) {
        return new DefaultOperatorRuntime(new DefaultRegistry(), clock);
    }
}
