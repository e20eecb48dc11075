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

import com.google.common.base.Preconditions;

/**
 * Globally unique tablet name: the cell it runs in and a numeric id unique within the cell.
 */
public final class TabletAlias implements Comparable<TabletAlias> {

    private final String cell;
    private final long uid;

    private TabletAlias(String cell, long uid) {
        this.cell = cell;
        this.uid = uid;
    }

    public String getCell() {
        return cell;
    }

    public long getUid() {
        return uid;
    }

    public static TabletAlias of(String cell, long uid) {
        Preconditions.checkArgument(cell != null && !cell.isEmpty(), "cell must be set");
        Preconditions.checkArgument(uid >= 0 && uid <= 0xFFFFFFFFL, "uid out of range: %s", uid);
        return new TabletAlias(cell, uid);
    }

    /**
     * Parses the "cell-uid" form. The cell may itself contain dashes; the uid follows the last one.
     */
    public static TabletAlias parse(String value) {
        int idx = value.lastIndexOf('-');
        Preconditions.checkArgument(idx > 0 && idx < value.length() - 1, "Invalid tablet alias: %s", value);
        try {
            return of(value.substring(0, idx), Long.parseLong(value.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid tablet alias: " + value, e);
        }
    }

    @Override
    public int compareTo(TabletAlias other) {
        int result = cell.compareTo(other.cell);
        return result != 0 ? result : Long.compare(uid, other.uid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TabletAlias that = (TabletAlias) o;
        return uid == that.uid && cell.equals(that.cell);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cell, uid);
    }

    @Override
    public String toString() {
        return String.format("%s-%010d", cell, uid);
    }
}
