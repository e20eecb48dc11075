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

package io.shardkeeper.server.tablet;

import java.nio.charset.StandardCharsets;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;
import io.shardkeeper.server.shard.model.KeyRange;
import io.shardkeeper.server.shard.model.TabletType;

/**
 * Deterministic tablet ids. The uid depends only on where the tablet sits in the shard configuration, so the same
 * configuration always yields the same tablets.
 */
public final class TabletUids {

    private TabletUids() {
    }

    /**
     * Returns the first four bytes, read as a big-endian unsigned integer, of the MD5 digest of
     * {@code "<cell> <keyspace> <keyRange> <type> <index>\n"}.
     */
    public static long uid(String cell, String keyspace, KeyRange keyRange, TabletType type, int index) {
        String input = cell + ' ' + keyspace + ' ' + keyRange + ' ' + type.getValue() + ' ' + index + '\n';
        HashCode hash = Hashing.md5().hashString(input, StandardCharsets.UTF_8);
        return Integer.toUnsignedLong(Ints.fromByteArray(hash.asBytes()));
    }
}
