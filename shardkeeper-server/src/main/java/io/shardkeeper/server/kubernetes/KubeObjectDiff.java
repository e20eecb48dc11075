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

package io.shardkeeper.server.kubernetes;

import java.util.Set;
import java.util.TreeSet;

import com.google.common.collect.Sets;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

final class KubeObjectDiff {

    private static final int MAX_DEPTH = 2;
    private static final String STATUS = "status";

    private KubeObjectDiff() {
    }

    static String describe(JsonElement before, JsonElement after) {
        Set<String> paths = new TreeSet<>();
        collect("", before, after, 1, paths);
        return String.join(", ", paths);
    }

    private static void collect(String path, JsonElement before, JsonElement after, int depth, Set<String> paths) {
        JsonElement left = before == null ? JsonNull.INSTANCE : before;
        JsonElement right = after == null ? JsonNull.INSTANCE : after;
        if (left.equals(right)) {
            return;
        }
        if (depth > MAX_DEPTH || !left.isJsonObject() || !right.isJsonObject()) {
            paths.add(path);
            return;
        }
        JsonObject leftObject = left.getAsJsonObject();
        JsonObject rightObject = right.getAsJsonObject();
        for (String field : Sets.union(leftObject.keySet(), rightObject.keySet())) {
            if (depth == 1 && STATUS.equals(field)) {
                continue;
            }
            String fieldPath = path.isEmpty() ? field : path + "." + field;
            collect(fieldPath, leftObject.get(field), rightObject.get(field), depth + 1, paths);
        }
    }
}
