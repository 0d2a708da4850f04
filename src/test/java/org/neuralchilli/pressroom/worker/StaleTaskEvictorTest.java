package org.neuralchilli.pressroom.worker;

import com.hazelcast.core.HazelcastInstance;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pressroom.core.TaskRecordStore;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.support.Fixtures;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@QuarkusTest
class StaleTaskEvictorTest {

    @Inject
    StaleTaskEvictor evictor;

    @Inject
    TaskRecordStore store;

    @Inject
    HazelcastInstance hazelcast;

    @AfterEach
    void cleanup() {
        hazelcast.getMap(TaskRecordStore.MAP_NAME).clear();
    }

    @Test
    void shouldEvictFinishedTasksOlderThanCutoff() {
        TaskRecord finished = store.create(List.of(Stage.EXTRACT), Fixtures.request());
        store.update(finished.id(), TaskRecord::cancel);

        int evicted = evictor.evictOlderThan(Instant.now().plusSeconds(1));

        assertThat(evicted).isEqualTo(1);
        assertThat(hazelcast.getMap(TaskRecordStore.MAP_NAME).containsKey(finished.id())).isFalse();
    }

    @Test
    void shouldNeverEvictUnfinishedTasks() {
        TaskRecord pending = store.create(List.of(Stage.EXTRACT), Fixtures.request());

        int evicted = evictor.evictOlderThan(Instant.now().plusSeconds(60));

        assertThat(evicted).isZero();
        assertThat(store.get(pending.id())).isNotNull();
    }

    @Test
    void shouldKeepRecentlyFinishedTasksWithinTtl() {
        TaskRecord finished = store.create(List.of(Stage.EXTRACT), Fixtures.request());
        store.update(finished.id(), TaskRecord::cancel);

        assertThat(evictor.evictStale()).isZero();
        assertThatCode(() -> store.get(finished.id())).doesNotThrowAnyException();
    }
}
