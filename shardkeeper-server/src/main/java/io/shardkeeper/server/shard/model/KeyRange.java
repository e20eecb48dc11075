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
 * Half-open range of keyspace ids served by a shard, with hex encoded bounds. An empty bound is unbounded.
 */
public final class KeyRange {

    private static final KeyRange FULL = new KeyRange("", "");

    private final String start;
    private final String end;

    private KeyRange(String start, String end) {
        this.start = start;
        this.end = end;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    public static KeyRange of(String start, String end) {
        return new KeyRange(start == null ? "" : start, end == null ? "" : end);
    }

    public static KeyRange full() {
        return FULL;
    }

    /**
     * Parses the canonical "start-end" form, for example "-80" or "80-".
     */
    public static KeyRange parse(String value) {
        int idx = value.indexOf('-');
        if (idx < 0 || idx != value.lastIndexOf('-')) {
            throw new IllegalArgumentException("Invalid key range: " + value);
        }
        return of(value.substring(0, idx), value.substring(idx + 1));
    }

    /**
     * Form usable in object names, with unbounded sides rendered as "x".
     */
    public String toSafeName() {
        return (start.isEmpty() ? "x" : start) + '-' + (end.isEmpty() ? "x" : end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KeyRange keyRange = (KeyRange) o;
        return start.equals(keyRange.start) && end.equals(keyRange.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + '-' + end;
    }
}
