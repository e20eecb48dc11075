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

package io.shardkeeper.common.util;

import java.util.ArrayList;
import java.util.List;

public final class ExceptionExt {

    private ExceptionExt() {
    }

    /**
     * Renders an exception and its causes in one line, for example
     * "(KubeApiException) create failed -CAUSED BY-> (ApiException) Conflict".
     */
    public static String toMessageChain(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            sb.append('(').append(current.getClass().getSimpleName()).append(") ").append(current.getMessage());
            current = current.getCause();
            if (current != null) {
                sb.append(" -CAUSED BY-> ");
            }
        }
        return sb.toString();
    }

    /**
     * Returns the given exception followed by all exceptions suppressed by it.
     */
    public static List<Throwable> flattenSuppressed(Throwable error) {
        List<Throwable> all = new ArrayList<>();
        all.add(error);
        for (Throwable suppressed : error.getSuppressed()) {
            all.add(suppressed);
        }
        return all;
    }
}
