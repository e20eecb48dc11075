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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Aggregate of the failures collected during one reconciliation. The first failure is the cause, and the
 * remaining ones are added as suppressed exceptions.
 */
public class ReconcileException extends RuntimeException {

    private final List<Throwable> errors;

    public ReconcileException(String message, List<Throwable> errors) {
        super(message, firstOf(errors));
        this.errors = Collections.unmodifiableList(errors);
        for (int i = 1; i < errors.size(); i++) {
            addSuppressed(errors.get(i));
        }
    }

    public List<Throwable> getErrors() {
        return errors;
    }

    private static Throwable firstOf(List<Throwable> errors) {
        Preconditions.checkArgument(!errors.isEmpty(), "at least one error expected");
        return errors.get(0);
    }
}
