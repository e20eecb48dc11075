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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.common.KubernetesType;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import io.kubernetes.client.util.generic.options.ListOptions;

/**
 * {@link KubeObjectClient} backed by the Kube Java client {@link GenericKubernetesApi}.
 */
public class GenericKubeObjectClient<T extends KubernetesObject, L extends KubernetesListObject> implements KubeObjectClient<T> {

    private static final int NOT_FOUND = 404;

    private final String kind;
    private final Class<T> objectType;
    private final GenericKubernetesApi<T, L> api;

    public GenericKubeObjectClient(String kind, Class<T> objectType, GenericKubernetesApi<T, L> api) {
        this.kind = kind;
        this.objectType = objectType;
        this.api = api;
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public Optional<T> get(ObjectKey key) {
        KubernetesApiResponse<T> response = call("get " + kind + " " + key, () -> api.get(key.getNamespace(), key.getName()));
        if (response.getHttpStatusCode() == NOT_FOUND) {
            return Optional.empty();
        }
        return Optional.of(checkSuccess("get " + kind + " " + key, response));
    }

    @Override
    public List<T> list(String namespace, Map<String, String> labels) {
        ListOptions listOptions = new ListOptions();
        listOptions.setLabelSelector(KubeUtil.formatLabelSelector(labels));

        String operation = "list " + kind + " in " + namespace;
        L list = checkSuccess(operation, call(operation, () -> api.list(namespace, listOptions)));

        List<T> items = new ArrayList<>();
        if (list.getItems() != null) {
            for (KubernetesObject item : list.getItems()) {
                items.add(objectType.cast(item));
            }
        }
        return items;
    }

    @Override
    public T create(T object) {
        String operation = "create " + kind + " " + ObjectKey.of(object.getMetadata(), "");
        return checkSuccess(operation, call(operation, () -> api.create(object)));
    }

    @Override
    public T update(T object) {
        String operation = "update " + kind + " " + ObjectKey.of(object.getMetadata(), "");
        return checkSuccess(operation, call(operation, () -> api.update(object)));
    }

    @Override
    public void delete(ObjectKey key) {
        String operation = "delete " + kind + " " + key;
        KubernetesApiResponse<T> response = call(operation, () -> api.delete(key.getNamespace(), key.getName()));
        if (response.getHttpStatusCode() == NOT_FOUND) {
            return;
        }
        if (!response.isSuccess()) {
            throw KubeApiException.fromStatus(operation, response.getHttpStatusCode(), response.getStatus());
        }
    }

    private <R extends KubernetesType> KubernetesApiResponse<R> call(String operation, Supplier<KubernetesApiResponse<R>> action) {
        try {
            return action.get();
        } catch (KubeApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KubeApiException(operation + " failed", e);
        }
    }

    private static <R extends KubernetesType> R checkSuccess(String operation, KubernetesApiResponse<R> response) {
        if (!response.isSuccess()) {
            throw KubeApiException.fromStatus(operation, response.getHttpStatusCode(), response.getStatus());
        }
        return response.getObject();
    }
}
