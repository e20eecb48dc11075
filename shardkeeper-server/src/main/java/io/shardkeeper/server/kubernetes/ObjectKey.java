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

import java.util.Objects;

import com.google.common.base.Preconditions;
import io.kubernetes.client.openapi.models.V1ObjectMeta;

/**
 * Namespaced name of a Kube object. A tablet pod and its data volume claim share the same key.
 */
public final class ObjectKey {

    private final String namespace;
    private final String name;

    private ObjectKey(String namespace, String name) {
        this.namespace = Preconditions.checkNotNull(namespace, "namespace is null");
        this.name = Preconditions.checkNotNull(name, "name is null");
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public static ObjectKey of(String namespace, String name) {
        return new ObjectKey(namespace, name);
    }

    /**
     * Key of an object returned by a namespaced query. Objects returned by the API server always have the
     * namespace set, but test fixtures may not, so the queried namespace is used as a fallback.
     */
    public static ObjectKey of(V1ObjectMeta metadata, String defaultNamespace) {
        String namespace = metadata.getNamespace() == null ? defaultNamespace : metadata.getNamespace();
        return new ObjectKey(namespace, metadata.getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ObjectKey objectKey = (ObjectKey) o;
        return namespace.equals(objectKey.namespace) && name.equals(objectKey.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
