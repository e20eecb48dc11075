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

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Explains why an object that is no longer desired has not been deleted yet.
 */
public final class OrphanStatus {

    private final String reason;
    private final String message;

    public OrphanStatus(String reason, String message) {
        Preconditions.checkArgument(reason != null && !reason.isEmpty(), "orphan reason must be set");
        this.reason = reason;
        this.message = message;
    }

    /**
     * Short, stable reason code, for example "Draining".
     */
    public String getReason() {
        return reason;
    }

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
        OrphanStatus that = (OrphanStatus) o;
        return reason.equals(that.reason) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, message);
    }

    @Override
    public String toString() {
        return "OrphanStatus{" +
                "reason='" + reason + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
