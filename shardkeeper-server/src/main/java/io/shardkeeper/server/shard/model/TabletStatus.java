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

package io.shardkeeper.server.shard.model;

import java.util.Objects;

/**
 * Observed state of one desired tablet.
 */
public final class TabletStatus {

    private final TabletType type;
    private final int index;
    private final ConditionStatus running;
    private final ConditionStatus ready;
    private final ConditionStatus available;
    private final ConditionStatus dataVolumeBound;
    private final String pendingChanges;
    private final String message;

    private TabletStatus(Builder builder) {
        this.type = builder.type;
        this.index = builder.index;
        this.running = builder.running;
        this.ready = builder.ready;
        this.available = builder.available;
        this.dataVolumeBound = builder.dataVolumeBound;
        this.pendingChanges = builder.pendingChanges;
        this.message = builder.message;
    }

    public TabletType getType() {
        return type;
    }

    public int getIndex() {
        return index;
    }

    public ConditionStatus getRunning() {
        return running;
    }

    public ConditionStatus getReady() {
        return ready;
    }

    public ConditionStatus getAvailable() {
        return available;
    }

    public ConditionStatus getDataVolumeBound() {
        return dataVolumeBound;
    }

    /**
     * Description of changes waiting for a rolling recreate, or empty if none.
     */
    public String getPendingChanges() {
        return pendingChanges;
    }

    /**
     * Last failure to create or update the objects of this tablet in the current pass, or empty if none.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TabletStatus that = (TabletStatus) o;
        return index == that.index &&
                type == that.type &&
                running == that.running &&
                ready == that.ready &&
                available == that.available &&
                dataVolumeBound == that.dataVolumeBound &&
                pendingChanges.equals(that.pendingChanges) &&
                message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, index, running, ready, available, dataVolumeBound, pendingChanges, message);
    }

    @Override
    public String toString() {
        return "TabletStatus{" +
                "type=" + type +
                ", index=" + index +
                ", running=" + running +
                ", ready=" + ready +
                ", available=" + available +
                ", dataVolumeBound=" + dataVolumeBound +
                ", pendingChanges='" + pendingChanges + '\'' +
                ", message='" + message + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withType(type)
                .withIndex(index)
                .withRunning(running)
                .withReady(ready)
                .withAvailable(available)
                .withDataVolumeBound(dataVolumeBound)
                .withPendingChanges(pendingChanges)
                .withMessage(message);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private TabletType type;
        private int index;
        private ConditionStatus running = ConditionStatus.UNKNOWN;
        private ConditionStatus ready = ConditionStatus.UNKNOWN;
        private ConditionStatus available = ConditionStatus.UNKNOWN;
        private ConditionStatus dataVolumeBound = ConditionStatus.UNKNOWN;
        private String pendingChanges = "";
        private String message = "";

        private Builder() {
        }

        public Builder withType(TabletType type) {
            this.type = type;
            return this;
        }

        public Builder withIndex(int index) {
            this.index = index;
            return this;
        }

        public Builder withRunning(ConditionStatus running) {
            this.running = running;
            return this;
        }

        public Builder withReady(ConditionStatus ready) {
            this.ready = ready;
            return this;
        }

        public Builder withAvailable(ConditionStatus available) {
            this.available = available;
            return this;
        }

        public Builder withDataVolumeBound(ConditionStatus dataVolumeBound) {
            this.dataVolumeBound = dataVolumeBound;
            return this;
        }

        public Builder withPendingChanges(String pendingChanges) {
            this.pendingChanges = pendingChanges == null ? "" : pendingChanges;
            return this;
        }

        public Builder withMessage(String message) {
            this.message = message == null ? "" : message;
            return this;
        }

        public TabletStatus build() {
            return new TabletStatus(this);
        }
    }
}
