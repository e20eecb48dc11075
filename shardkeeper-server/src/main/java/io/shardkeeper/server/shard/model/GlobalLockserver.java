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
 * Connection parameters of the global topology service holding the shard records.
 */
public final class GlobalLockserver {

    private final String implementation;
    private final String address;
    private final String rootPath;

    public GlobalLockserver(String implementation, String address, String rootPath) {
        this.implementation = implementation;
        this.address = address;
        this.rootPath = rootPath;
    }

    public String getImplementation() {
        return implementation;
    }

    public String getAddress() {
        return address;
    }

    public String getRootPath() {
        return rootPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GlobalLockserver that = (GlobalLockserver) o;
        return Objects.equals(implementation, that.implementation) &&
                Objects.equals(address, that.address) &&
                Objects.equals(rootPath, that.rootPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(implementation, address, rootPath);
    }

    @Override
    public String toString() {
        return "GlobalLockserver{" +
                "implementation='" + implementation + '\'' +
                ", address='" + address + '\'' +
                ", rootPath='" + rootPath + '\'' +
                '}';
    }
}
