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

package io.shardkeeper.server.kubernetes.reconciler;

import io.kubernetes.client.common.KubernetesObject;
import io.shardkeeper.server.kubernetes.KubeUtil;

/**
 * Annotations coordinating recreate-class updates with an external rollout controller. The reconciler marks an
 * object as scheduled, the rollout controller marks it as released when it is the object's turn, and the
 * reconciler then recreates it.
 */
public final class RolloutAnnotations {

    /**
     * Set by the reconciler. The value describes the pending changes.
     */
    public static final String SCHEDULED = "rollout.shardkeeper.io/scheduled";

    /**
     * Set by the rollout controller.
     */
    public static final String RELEASED = "rollout.shardkeeper.io/released";

    private RolloutAnnotations() {
    }

    public static boolean isScheduled(KubernetesObject object) {
        return KubeUtil.findAnnotation(object, SCHEDULED).isPresent();
    }

    public static boolean isReleased(KubernetesObject object) {
        return KubeUtil.findAnnotation(object, RELEASED).isPresent();
    }

    public static String getScheduledChanges(KubernetesObject object) {
        return KubeUtil.findAnnotation(object, SCHEDULED).orElse("");
    }

    public static void schedule(KubernetesObject object, String changes) {
        KubeUtil.putAnnotation(object, SCHEDULED, changes);
    }

    public static void unschedule(KubernetesObject object) {
        KubeUtil.removeAnnotation(object, SCHEDULED);
        KubeUtil.removeAnnotation(object, RELEASED);
    }
}
