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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.kubernetes.client.common.KubernetesObject;

/**
 * Access to the namespaced objects of one kind. All operations throw {@link KubeApiException} on failure.
 */
public interface KubeObjectClient<T extends KubernetesObject> {

    /**
     * Kind name used in logs and metrics, for example "pod".
     */
    String getKind();

    /**
     * Returns {@link Optional#empty()} if the object does not exist.
     */
    Optional<T> get(ObjectKey key);

    /**
     * Returns all objects in the namespace that carry every one of the given labels.
     */
    List<T> list(String namespace, Map<String, String> labels);

    T create(T object);

    T update(T object);

    /**
     * Deletes the object. Deleting an object that no longer exists is not an error.
     */
    void delete(ObjectKey key);
}
