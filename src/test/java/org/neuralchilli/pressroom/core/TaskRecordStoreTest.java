package org.neuralchilli.pressroom.core;

import com.hazelcast.core.HazelcastInstance;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.domain.TaskStatus;
import org.neuralchilli.pressroom.support.Fixtures;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class TaskRecordStoreTest {

    @Inject
    TaskRecordStore store;

    @Inject
    HazelcastInstance hazelcast;

    @AfterEach
    void cleanup() {
        hazelcast.getMap(TaskRecordStore.MAP_NAME).clear();
    }

    @Test
    void shouldCreateAndGetTask() {
        TaskRecord created = store.create(List.of(Stage.EXTRACT), Fixtures.request());

        TaskRecord fetched = store.get(created.id());

        assertThat(fetched).isEqualTo(created);
        assertThat(fetched.status()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void shouldThrowForUnknownId() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> store.get(unknown)).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> store.update(unknown, TaskRecord::start))
                .isInstanceOf(TaskNotFoundException.class);
        assertThat(store.delete(unknown)).isFalse();
    }

    @Test
    void shouldLeaveRecordUntouchedWhenMutationReturnsSameInstance() {
        TaskRecord created = store.create(List.of(Stage.EXTRACT), Fixtures.request());

        TaskRecord result = store.update(created.id(), current -> current);

        assertThat(result).isEqualTo(created);
        assertThat(store.get(created.id()).updatedAt()).isEqualTo(created.updatedAt());
    }

    @Test
    void shouldLetExactlyOneConcurrentClaimWin() throws Exception {
        TaskRecord created = store.create(List.of(Stage.EXTRACT), Fixtures.request());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> claims = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                claims.add(executor.submit(() -> {
                    boolean[] won = {false};
                    store.update(created.id(), current -> {
                        if (current.status() != TaskStatus.PENDING) {
                            return current;
                        }
                        won[0] = true;
                        return current.start();
                    });
                    return won[0];
                }));
            }

            int winners = 0;
            for (Future<Boolean> claim : claims) {
                if (claim.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(store.get(created.id()).status()).isEqualTo(TaskStatus.RUNNING);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldFindOnlyTerminalRecordsBeforeCutoff() {
        TaskRecord pending = store.create(List.of(Stage.EXTRACT), Fixtures.request());
        TaskRecord cancelled = store.create(List.of(Stage.EXTRACT), Fixtures.request());
        store.update(cancelled.id(), TaskRecord::cancel);

        List<TaskRecord> evictable = store.findEvictable(Instant.now().plusSeconds(1));

        assertThat(evictable).extracting(TaskRecord::id)
                .contains(cancelled.id())
                .doesNotContain(pending.id());
        assertThat(store.findEvictable(Instant.now().minusSeconds(60))).isEmpty();
    }
}
