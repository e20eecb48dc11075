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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.shardkeeper.common.util.ExceptionExt;

/**
 * Outcome of a reconciliation pass, handed back to the scheduler that triggered it. An error means the pass
 * should be retried with backoff. A requeue delay asks for another pass after the given time even if
 * nothing changes in the cluster.
 */
public final class ReconcileResult {

    private static final ReconcileResult SUCCESS = new ReconcileResult(null, null);

    private final Duration requeueAfter;
    private final Throwable error;

    private ReconcileResult(Duration requeueAfter, Throwable error) {
        this.requeueAfter = requeueAfter;
        this.error = error;
    }

    public Optional<Duration> getRequeueAfter() {
        return Optional.ofNullable(requeueAfter);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public static ReconcileResult success() {
        return SUCCESS;
    }

    public static ReconcileResult error(Throwable error) {
        return new ReconcileResult(null, error);
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(delay, null);
    }

    @Override
    public String toString() {
        return "ReconcileResult{" +
                "requeueAfter=" + requeueAfter +
                ", error=" + (error == null ? null : ExceptionExt.toMessageChain(error)) +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Accumulates results of independent steps. The shortest requested requeue delay wins, and all errors
     * are kept.
     */
    public static final class Builder {

        private Duration requeueAfter;
        private final List<Throwable> errors = new ArrayList<>();

        private Builder() {
        }

        public Builder requeueAfter(Duration delay) {
            if (requeueAfter == null || delay.compareTo(requeueAfter) < 0) {
                this.requeueAfter = delay;
            }
            return this;
        }

        public Builder error(Throwable error) {
            errors.add(error);
            return this;
        }

        public Builder merge(ReconcileResult result) {
            result.getRequeueAfter().ifPresent(this::requeueAfter);
            result.getError().ifPresent(this::error);
            return this;
        }

        public ReconcileResult build() {
            if (errors.isEmpty()) {
                return requeueAfter == null ? SUCCESS : new ReconcileResult(requeueAfter, null);
            }
            Throwable error = errors.size() == 1
                    ? errors.get(0)
                    : new ReconcileException(errors.size() + " reconciliation steps failed", new ArrayList<>(errors));
            return new ReconcileResult(requeueAfter, error);
        }
    }
}
