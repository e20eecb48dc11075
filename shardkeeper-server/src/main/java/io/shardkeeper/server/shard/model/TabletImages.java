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

public final class TabletImages {

    private final String vttablet;
    private final String mysqld;

    public TabletImages(String vttablet, String mysqld) {
        this.vttablet = vttablet;
        this.mysqld = mysqld;
    }

    public String getVttablet() {
        return vttablet;
    }

    public String getMysqld() {
        return mysqld;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TabletImages that = (TabletImages) o;
        return Objects.equals(vttablet, that.vttablet) && Objects.equals(mysqld, that.mysqld);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vttablet, mysqld);
    }

    @Override
    public String toString() {
        return "TabletImages{" +
                "vttablet='" + vttablet + '\'' +
                ", mysqld='" + mysqld + '\'' +
                '}';
    }
}
