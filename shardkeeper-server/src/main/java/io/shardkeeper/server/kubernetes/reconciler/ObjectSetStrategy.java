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

import java.util.Optional;

import io.kubernetes.client.common.KubernetesObject;
import io.shardkeeper.server.kubernetes.ObjectKey;

/**
 * Kind specific callbacks driven by {@link ObjectSetReconciler}. Every callback except {@link #newObject(ObjectKey)}
 * is optional. Callbacks that receive an object may mutate it: the reconciler passes a private copy, and
 * persists the mutation where the callback contract says so.
 */
public interface ObjectSetStrategy<T extends KubernetesObject> {

    /**
     * Builds a desired object that does not exist yet.
     */
    T newObject(ObjectKey key);

    /**
     * Applies changes that can be made to a live object without restarting it. A changed object is written back
     * with an update.
     */
    default void updateInPlace(ObjectKey key, T object) {
    }

    /**
     * Applies changes that can only take effect by recreating the object. If the object changes, the recreate is
     * scheduled with {@link RolloutAnnotations} and carried out once it has been released.
     */
    default void updateRollingRecreate(ObjectKey key, T object) {
    }

    /**
     * Projects the state of a desired object into the status of its owner. Called for every desired object that
     * exists after the create/update step, including objects created in the same pass.
     */
    default void status(ObjectKey key, T object) {
    }

    /**
     * Called when creating or updating a desired object failed. The failure is also reported in the result of the
     * pass.
     */
    default void reconcileError(ObjectKey key, Throwable error) {
    }

    /**
     * Records why an object that is not desired was kept.
     */
    default void orphanStatus(ObjectKey key, T object, OrphanStatus orphanStatus) {
    }

    /**
     * Decides whether an object that is not desired can be deleted now. Returns an orphan status to keep the
     * object, or {@link Optional#empty()} to delete it. Changes made to the object are persisted when the
     * object is kept.
     */
    default Optional<OrphanStatus> prepareForTurndown(ObjectKey key, T object) {
        return Optional.empty();
    }
}
