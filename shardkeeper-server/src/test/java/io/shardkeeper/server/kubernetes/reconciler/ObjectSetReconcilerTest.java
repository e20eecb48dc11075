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

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.netflix.spectator.api.Registry;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.shardkeeper.common.runtime.OperatorRuntime;
import io.shardkeeper.common.runtime.OperatorRuntimes;
import io.shardkeeper.server.kubernetes.KubeApiException;
import io.shardkeeper.server.kubernetes.KubeUtil;
import io.shardkeeper.server.kubernetes.ObjectKey;
import io.shardkeeper.server.testkit.InMemoryKubeObjectClient;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ObjectSetReconcilerTest {

    private static final String NAMESPACE = "default";

    private static final Map<String, String> LABELS = Collections.singletonMap("app", "db");

    private static final ObjectKey KEY_A = ObjectKey.of(NAMESPACE, "a");
    private static final ObjectKey KEY_B = ObjectKey.of(NAMESPACE, "b");
    private static final ObjectKey KEY_C = ObjectKey.of(NAMESPACE, "c");

    private final OperatorRuntime runtime = OperatorRuntimes.test();
    private final Registry registry = runtime.getRegistry();

    private final ObjectSetReconciler reconciler = new ObjectSetReconciler(runtime);

    private final InMemoryKubeObjectClient<V1Pod> client = new InMemoryKubeObjectClient<>("pod");
    private final RecordingStrategy strategy = new RecordingStrategy();

    @Test
    public void testMissingObjectsAreCreatedWithSelectorLabels() {
        ReconcileResult result = reconcile(KEY_A, KEY_B);

        assertThat(result.isSuccess()).isTrue();
        assertThat(client.getCreatedKeys()).containsExactly(KEY_A, KEY_B);
        assertThat(client.getRequired(KEY_A).getMetadata().getLabels()).containsEntry("app", "db");
        assertThat(strategy.statusKeys).containsExactly(KEY_A, KEY_B);
        assertThat(actionCount("created")).isEqualTo(2);

        client.resetHistory();
        strategy.statusKeys.clear();
        reconcile(KEY_A, KEY_B);

        assertThat(client.getCreatedKeys()).isEmpty();
        assertThat(client.getUpdatedKeys()).isEmpty();
        assertThat(strategy.statusKeys).containsExactly(KEY_A, KEY_B);
    }

    @Test
    public void testUndesiredObjectIsDeletedWhenTurndownIsAuthorized() {
        client.add(newLivePod("c", "v1"));

        ReconcileResult result = reconcile(KEY_A);

        assertThat(result.isSuccess()).isTrue();
        assertThat(client.find(KEY_C)).isEmpty();
        assertThat(client.getDeletedKeys()).containsExactly(KEY_C);
        assertThat(strategy.turndownKeys).containsExactly(KEY_C);
        assertThat(strategy.orphans).isEmpty();
        assertThat(actionCount("deleted")).isEqualTo(1);
    }

    @Test
    public void testRefusedTurndownKeepsObjectAndPersistsPreparation() {
        client.add(newLivePod("c", "v1"));
        strategy.turndownRefusal = new OrphanStatus("Draining", "waiting for drain");

        ReconcileResult result = reconcile(KEY_A);

        assertThat(result.isSuccess()).isTrue();
        assertThat(client.getDeletedKeys()).isEmpty();
        assertThat(client.getUpdatedKeys()).containsExactly(KEY_C);
        assertThat(KubeUtil.findAnnotation(client.getRequired(KEY_C), RecordingStrategy.TURNDOWN_ANNOTATION)).contains("prepared");
        assertThat(strategy.orphans).containsEntry(KEY_C, strategy.turndownRefusal);
        assertThat(actionCount("orphaned")).isEqualTo(1);

        // A second refusal does not change the object again.
        client.resetHistory();
        reconcile(KEY_A);
        assertThat(client.getUpdatedKeys()).isEmpty();
    }

    @Test
    public void testObjectsOutsideOfSelectorAreIgnored() {
        V1Pod foreign = newLivePod("c", "v1");
        foreign.getMetadata().setLabels(new HashMap<>(Collections.singletonMap("app", "other")));
        client.add(foreign);

        reconcile(KEY_A);

        assertThat(client.find(KEY_C)).isPresent();
        assertThat(strategy.turndownKeys).isEmpty();
    }

    @Test
    public void testOrphanBeingDeletedIsSkipped() {
        V1Pod terminating = newLivePod("c", "v1");
        terminating.getMetadata().setDeletionTimestamp(OffsetDateTime.now());
        client.add(terminating);

        reconcile(KEY_A);

        assertThat(strategy.turndownKeys).isEmpty();
        assertThat(client.getDeletedKeys()).isEmpty();
    }

    @Test
    public void testInPlaceUpdateIsWrittenOnlyWhenObjectChanges() {
        client.add(newLivePod("a", "v1"));

        reconcile(KEY_A);
        assertThat(client.getUpdatedKeys()).isEmpty();

        strategy.version = "2";
        reconcile(KEY_A);
        assertThat(client.getUpdatedKeys()).containsExactly(KEY_A);
        assertThat(client.getRequired(KEY_A).getMetadata().getLabels()).containsEntry(RecordingStrategy.VERSION_LABEL, "2");
        assertThat(actionCount("updatedInPlace")).isEqualTo(1);
    }

    @Test
    public void testRollingRecreateIsScheduledAndExecutedOnceReleased() {
        client.add(newLivePod("a", "v1"));
        strategy.image = "v2";

        ReconcileResult first = reconcile(KEY_A);

        V1Pod scheduled = client.getRequired(KEY_A);
        assertThat(first.isSuccess()).isTrue();
        assertThat(first.getRequeueAfter()).isEmpty();
        assertThat(RolloutAnnotations.getScheduledChanges(scheduled)).isEqualTo("spec.containers");
        assertThat(scheduled.getSpec().getContainers().get(0).getImage()).isEqualTo("v1");
        assertThat(strategy.lastStatus.get(KEY_A).getMetadata().getAnnotations()).containsKey(RolloutAnnotations.SCHEDULED);
        assertThat(actionCount("recreateScheduled")).isEqualTo(1);

        // Not released yet, so nothing changes.
        client.resetHistory();
        reconcile(KEY_A);
        assertThat(client.getUpdatedKeys()).isEmpty();
        assertThat(client.getDeletedKeys()).isEmpty();

        // Released by the rollout controller.
        V1Pod released = client.getRequired(KEY_A);
        released.getMetadata().putAnnotationsItem(RolloutAnnotations.RELEASED, "true");
        client.add(released);

        ReconcileResult recreate = reconcile(KEY_A);
        assertThat(client.getDeletedKeys()).containsExactly(KEY_A);
        assertThat(recreate.getRequeueAfter()).contains(ObjectSetReconciler.RECREATE_REQUEUE_DELAY);
        assertThat(actionCount("recreated")).isEqualTo(1);

        reconcile(KEY_A);
        V1Pod recreated = client.getRequired(KEY_A);
        assertThat(recreated.getSpec().getContainers().get(0).getImage()).isEqualTo("v2");
        assertThat(RolloutAnnotations.isScheduled(recreated)).isFalse();
    }

    @Test
    public void testScheduleIsClearedWhenChangeIsNoLongerPending() {
        V1Pod pod = newLivePod("a", "v1");
        RolloutAnnotations.schedule(pod, "spec.containers");
        client.add(pod);

        reconcile(KEY_A);

        assertThat(client.getUpdatedKeys()).containsExactly(KEY_A);
        assertThat(RolloutAnnotations.isScheduled(client.getRequired(KEY_A))).isFalse();
    }

    @Test
    public void testSingleFailureIsReportedAsIs() {
        KubeApiException failure = new KubeApiException("simulated", KubeApiException.ErrorCode.INTERNAL, 500);
        client.failOn(KEY_A, failure);

        ReconcileResult result = reconcile(KEY_A, KEY_B);

        assertThat(result.getError()).contains(failure);
        assertThat(strategy.errors).containsOnlyKeys(KEY_A).containsEntry(KEY_A, failure);
        assertThat(client.getCreatedKeys()).containsExactly(KEY_B);
        assertThat(actionCount("failed")).isEqualTo(1);
    }

    @Test
    public void testFailuresAreCollectedWithoutStoppingOtherObjects() {
        client.add(newLivePod("c", "v1"));
        client.failOn(KEY_A, new KubeApiException("create failed", KubeApiException.ErrorCode.INTERNAL, 500));
        strategy.failingTurndown = KEY_C;

        ReconcileResult result = reconcile(KEY_A, KEY_B);

        assertThat(client.getCreatedKeys()).containsExactly(KEY_B);
        assertThat(strategy.statusKeys).containsExactly(KEY_B);
        // Turn-down failures belong to no desired object.
        assertThat(strategy.errors).containsOnlyKeys(KEY_A);
        assertThat(result.getError()).isPresent();
        assertThat(result.getError().get()).isInstanceOf(ReconcileException.class);
        ReconcileException error = (ReconcileException) result.getError().get();
        assertThat(error.getErrors()).hasSize(2);
        assertThat(error.getCause()).isInstanceOf(KubeApiException.class);
        assertThat(error.getSuppressed()).hasSize(1);
    }

    @Test
    public void testListFailureIsReported() {
        client.failList(new KubeApiException("list failed", KubeApiException.ErrorCode.INTERNAL, 500));

        ReconcileResult result = reconcile(KEY_A);

        assertThat(result.getError()).isPresent();
        assertThat(client.getCreatedKeys()).isEmpty();
        assertThat(strategy.statusKeys).isEmpty();
    }

    private ReconcileResult reconcile(ObjectKey... desired) {
        Set<ObjectKey> keys = new LinkedHashSet<>(Arrays.asList(desired));
        return reconciler.reconcileObjectSet(client, NAMESPACE, keys, LABELS, strategy);
    }

    private long actionCount(String action) {
        return registry.counter(registry.createId(ObjectSetReconciler.METRIC_ROOT).withTag("kind", "pod").withTag("action", action)).count();
    }

    private static V1Pod newLivePod(String name, String image) {
        Map<String, String> labels = new HashMap<>(LABELS);
        labels.put(RecordingStrategy.VERSION_LABEL, "1");
        return new V1Pod()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name(name).labels(labels))
                .spec(new V1PodSpec().containers(new ArrayList<>(Collections.singletonList(new V1Container().name("main").image(image)))));
    }

    private static class RecordingStrategy implements ObjectSetStrategy<V1Pod> {

        static final String VERSION_LABEL = "version";
        static final String TURNDOWN_ANNOTATION = "turndown";

        private String image = "v1";
        private String version = "1";
        private OrphanStatus turndownRefusal;
        private ObjectKey failingTurndown;

        private final List<ObjectKey> statusKeys = new ArrayList<>();
        private final Map<ObjectKey, V1Pod> lastStatus = new HashMap<>();
        private final Set<ObjectKey> turndownKeys = new HashSet<>();
        private final Map<ObjectKey, OrphanStatus> orphans = new HashMap<>();
        private final Map<ObjectKey, Throwable> errors = new HashMap<>();

        @Override
        public V1Pod newObject(ObjectKey key) {
            return new V1Pod()
                    .metadata(new V1ObjectMeta().labels(new HashMap<>(Collections.singletonMap(VERSION_LABEL, version))))
                    .spec(new V1PodSpec().containers(new ArrayList<>(Collections.singletonList(new V1Container().name("main").image(image)))));
        }

        @Override
        public void updateInPlace(ObjectKey key, V1Pod pod) {
            pod.getMetadata().putLabelsItem(VERSION_LABEL, version);
        }

        @Override
        public void updateRollingRecreate(ObjectKey key, V1Pod pod) {
            pod.getSpec().getContainers().get(0).setImage(image);
        }

        @Override
        public void status(ObjectKey key, V1Pod pod) {
            statusKeys.add(key);
            lastStatus.put(key, pod);
        }

        @Override
        public void reconcileError(ObjectKey key, Throwable error) {
            errors.put(key, error);
        }

        @Override
        public void orphanStatus(ObjectKey key, V1Pod pod, OrphanStatus orphanStatus) {
            orphans.put(key, orphanStatus);
        }

        @Override
        public Optional<OrphanStatus> prepareForTurndown(ObjectKey key, V1Pod pod) {
            turndownKeys.add(key);
            if (key.equals(failingTurndown)) {
                throw new IllegalStateException("simulated turndown failure");
            }
            if (turndownRefusal != null) {
                KubeUtil.putAnnotation(pod, TURNDOWN_ANNOTATION, "prepared");
                return Optional.of(turndownRefusal);
            }
            return Optional.empty();
        }
    }
}
