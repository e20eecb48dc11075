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

package io.shardkeeper.common.util.spectator;

import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.Timer;
import com.netflix.spectator.api.patterns.PolledMeter;

/**
 * Success/failure counters and latencies of a repeatedly executed action, plus the time of its last completion.
 */
public class ActionMetrics implements Closeable {

    private final Id rootId;
    private final Registry registry;

    private final Counter successCounter;
    private final Timer successLatency;
    private final Timer failureLatency;
    private final Map<Class<? extends Throwable>, Counter> failureCounters = new ConcurrentHashMap<>();

    private final Id lastCompletionId;
    private final AtomicLong lastCompletionTime;

    public ActionMetrics(Id rootId, Registry registry) {
        this.rootId = rootId;
        this.registry = registry;

        this.successCounter = registry.counter(rootId.withTag("status", "success"));
        Id latencyId = registry.createId(rootId.name() + ".latency", rootId.tags());
        this.successLatency = registry.timer(latencyId.withTag("status", "success"));
        this.failureLatency = registry.timer(latencyId.withTag("status", "failure"));

        this.lastCompletionId = registry.createId(rootId.name() + ".lastCompletionTime", rootId.tags());
        this.lastCompletionTime = PolledMeter.using(registry)
                .withId(lastCompletionId)
                .monitorValue(new AtomicLong(registry.clock().wallTime()));
    }

    @Override
    public void close() {
        PolledMeter.remove(registry, lastCompletionId);
    }

    public long start() {
        return registry.clock().wallTime();
    }

    public void finish(long startTime) {
        long now = registry.clock().wallTime();
        successCounter.increment();
        successLatency.record(now - startTime, TimeUnit.MILLISECONDS);
        lastCompletionTime.set(now);
    }

    public void failure(long startTime, Throwable error) {
        long now = registry.clock().wallTime();
        failureLatency.record(now - startTime, TimeUnit.MILLISECONDS);
        lastCompletionTime.set(now);
        failureCounters.computeIfAbsent(error.getClass(), type -> registry.counter(
                rootId.withTag("status", "failure").withTag("exception", type.getSimpleName())
        )).increment();
    }
}
