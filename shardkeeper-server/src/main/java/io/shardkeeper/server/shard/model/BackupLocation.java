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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class BackupLocation {

    private final String name;
    private final Map<String, String> annotations;

    public BackupLocation(String name, Map<String, String> annotations) {
        this.name = name == null ? "" : name;
        this.annotations = annotations == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(annotations));
    }

    /**
     * Location name. The empty name is the default location.
     */
    public String getName() {
        return name;
    }

    /**
     * Annotations added to tablet pods that back up to this location.
     */
    public Map<String, String> getAnnotations() {
        return annotations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BackupLocation that = (BackupLocation) o;
        return name.equals(that.name) && annotations.equals(that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, annotations);
    }

    @Override
    public String toString() {
        return "BackupLocation{" +
                "name='" + name + '\'' +
                ", annotations=" + annotations +
                '}';
    }
}
