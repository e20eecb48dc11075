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

package io.shardkeeper.server.drain;

import io.kubernetes.client.common.KubernetesObject;
import io.shardkeeper.server.kubernetes.KubeUtil;

/**
 * Annotation contract with the drain controller. Drain is asynchronous: it is requested here by setting the
 * started annotation, the drain controller moves traffic away from the object and reports completion with the
 * finished annotation.
 */
public final class DrainAnnotations {

    private static final String PREFIX = "drain.shardkeeper.io/";

    /**
     * Set on objects that the drain controller knows how to drain. The value describes what draining means for it.
     */
    public static final String SUPPORTED = PREFIX + "supported";

    /**
     * Set to request a drain. The value is the reason.
     */
    public static final String STARTED = PREFIX + "started";

    /**
     * Set by the drain controller once draining is complete.
     */
    public static final String FINISHED = PREFIX + "finished";

    private DrainAnnotations() {
    }

    public static boolean isStarted(KubernetesObject object) {
        return KubeUtil.findAnnotation(object, STARTED).isPresent();
    }

    public static boolean isFinished(KubernetesObject object) {
        return KubeUtil.findAnnotation(object, FINISHED).isPresent();
    }

    /**
     * Requests a drain. An already started drain keeps its original reason.
     */
    public static void start(KubernetesObject object, String reason) {
        if (!isStarted(object)) {
            KubeUtil.putAnnotation(object, STARTED, reason);
        }
    }
}
