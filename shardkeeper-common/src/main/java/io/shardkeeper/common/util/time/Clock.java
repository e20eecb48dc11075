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

package io.shardkeeper.common.util.time;

import java.time.Instant;

/**
 * Time source used by all time-dependent logic, so it can be replaced with {@link TestClock} in tests.
 */
public interface Clock {

    /**
     * Monotonic time in nanoseconds, suitable only for measuring elapsed time.
     */
    long nanoTime();

    /**
     * Current time in milliseconds since the epoch, equivalent to {@link System#currentTimeMillis()}.
     */
    long wallTime();

    default Instant instant() {
        return Instant.ofEpochMilli(wallTime());
    }
}
