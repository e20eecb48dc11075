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

import io.shardkeeper.server.shard.model.KeyRange;
import io.shardkeeper.server.shard.model.TabletType;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TabletUidsTest {

    private static final KeyRange KEY_RANGE = KeyRange.of("", "80");

    @Test
    public void testUidIsStableDigestOfTabletPosition() {
        assertThat(TabletUids.uid("us-east", "commerce", KEY_RANGE, TabletType.REPLICA, 1)).isEqualTo(228837429L);
        // Above the signed int range; must stay positive.
        assertThat(TabletUids.uid("us-east", "commerce", KEY_RANGE, TabletType.REPLICA, 2)).isEqualTo(3480331586L);
    }

    @Test
    public void testEveryPositionComponentChangesUid() {
        long base = TabletUids.uid("us-east", "commerce", KEY_RANGE, TabletType.REPLICA, 1);

        assertThat(TabletUids.uid("us-west", "commerce", KEY_RANGE, TabletType.REPLICA, 1)).isNotEqualTo(base);
        assertThat(TabletUids.uid("us-east", "customer", KEY_RANGE, TabletType.REPLICA, 1)).isNotEqualTo(base);
        assertThat(TabletUids.uid("us-east", "commerce", KeyRange.of("80", ""), TabletType.REPLICA, 1)).isNotEqualTo(base);
        assertThat(TabletUids.uid("us-east", "commerce", KEY_RANGE, TabletType.RDONLY, 1)).isNotEqualTo(base);
    }
}
