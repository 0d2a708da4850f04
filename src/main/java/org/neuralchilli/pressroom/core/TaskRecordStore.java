package org.neuralchilli.pressroom.core;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pressroom.domain.PipelineRequest;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Task records keyed by ID, held in a Hazelcast map.
 * <p>
 * Updates are serialised per task with the map's key lock, so a mutation
 * always sees the latest record. Reads take no lock and never wait for a
 * running stage.
 */
@ApplicationScoped
public class TaskRecordStore {

    private static final Logger log = LoggerFactory.getLogger(TaskRecordStore.class);

    public static final String MAP_NAME = "task-records";

    @Inject
    HazelcastInstance hazelcast;

    private IMap<UUID, TaskRecord> records;

    @PostConstruct
    void init() {
        records = hazelcast.getMap(MAP_NAME);
        log.info("TaskRecordStore initialized ({} records)", records.size());
    }

    /**
     * Create and store a new pending task.
     */
    public TaskRecord create(List<Stage> requestedStages, PipelineRequest request) {
        TaskRecord task = TaskRecord.create(requestedStages, request);
        records.set(task.id(), task);
        log.debug("Created task {} for stages {}", task.id(), requestedStages);
        return task;
    }

    /**
     * @throws TaskNotFoundException if no record exists
     */
    public TaskRecord get(UUID id) {
        TaskRecord task = records.get(id);
        if (task == null) {
            throw new TaskNotFoundException(id);
        }
        return task;
    }

    /**
     * Apply a mutation atomically. The mutation runs under the task's lock
     * and must not call out to collaborators. Returning the same instance
     * leaves the record untouched.
     *
     * @return the record after the mutation
     * @throws TaskNotFoundException if no record exists
     */
    public TaskRecord update(UUID id, UnaryOperator<TaskRecord> mutation) {
        records.lock(id);
        try {
            TaskRecord current = records.get(id);
            if (current == null) {
                throw new TaskNotFoundException(id);
            }

            TaskRecord updated = mutation.apply(current);
            if (updated != current) {
                if (!updated.id().equals(id)) {
                    throw new IllegalStateException("Mutation changed task ID " + id + " to " + updated.id());
                }
                records.set(id, updated);
            }
            return updated;
        } finally {
            records.unlock(id);
        }
    }

    /**
     * @return true if a record was removed
     */
    public boolean delete(UUID id) {
        records.lock(id);
        try {
            return records.remove(id) != null;
        } finally {
            records.unlock(id);
        }
    }

    /**
     * Terminal records last updated before the cutoff, oldest first.
     */
    public List<TaskRecord> findEvictable(Instant cutoff) {
        return records.values().stream()
                .filter(TaskRecord::isTerminal)
                .filter(task -> task.updatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(TaskRecord::updatedAt))
                .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }
}
