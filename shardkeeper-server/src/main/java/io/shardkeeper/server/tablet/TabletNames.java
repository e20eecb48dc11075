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
import java.util.Locale;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.shardkeeper.server.shard.model.TabletAlias;

/**
 * Object names of tablets. Names are DNS labels: lowercase and at most 63 characters, with a hash suffix that keeps
 * them unique when the readable part is truncated.
 */
public final class TabletNames {

    static final int MAX_NAME_LENGTH = 63;

    private static final int HASH_LENGTH = 8;

    private TabletNames() {
    }

    /**
     * Name shared by the pod and the data volume claim of a tablet.
     */
    public static String podName(String clusterName, TabletAlias alias) {
        return join(clusterName, TabletLabels.COMPONENT_VTTABLET, alias.getCell(), String.format("%010d", alias.getUid()));
    }

    static String join(String... parts) {
        Hasher hasher = Hashing.md5().newHasher();
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            hasher.putString(part, StandardCharsets.UTF_8).putByte((byte) 0);
            if (sb.length() > 0) {
                sb.append('-');
            }
            sb.append(part.toLowerCase(Locale.ROOT));
        }
        String hash = hasher.hash().toString().substring(0, HASH_LENGTH);

        int maxPrefix = MAX_NAME_LENGTH - HASH_LENGTH - 1;
        String prefix = sb.length() > maxPrefix ? sb.substring(0, maxPrefix) : sb.toString();
        while (prefix.endsWith("-")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix + '-' + hash;
    }
}
