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

package io.shardkeeper.server.kubernetes.reconciler;

import java.time.Duration;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ReconcileResultTest {

    @Test
    public void testEmptyBuilderIsSuccess() {
        ReconcileResult result = ReconcileResult.newBuilder().build();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRequeueAfter()).isEmpty();
    }

    @Test
    public void testShortestRequeueWins() {
        ReconcileResult result = ReconcileResult.newBuilder()
                .requeueAfter(Duration.ofSeconds(30))
                .merge(ReconcileResult.requeueAfter(Duration.ofSeconds(5)))
                .requeueAfter(Duration.ofSeconds(10))
                .build();

        assertThat(result.getRequeueAfter()).contains(Duration.ofSeconds(5));
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    public void testErrorsAreAggregated() {
        IllegalStateException first = new IllegalStateException("first");
        IllegalArgumentException second = new IllegalArgumentException("second");

        ReconcileResult result = ReconcileResult.newBuilder()
                .merge(ReconcileResult.error(first))
                .merge(ReconcileResult.success())
                .error(second)
                .requeueAfter(Duration.ofSeconds(30))
                .build();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRequeueAfter()).contains(Duration.ofSeconds(30));
        ReconcileException error = (ReconcileException) result.getError().get();
        assertThat(error.getErrors()).containsExactly(first, second);
        assertThat(error.getCause()).isSameAs(first);
        assertThat(error.getSuppressed()).containsExactly(second);
    }
}
