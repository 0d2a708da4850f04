package org.neuralchilli.pressroom.serializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.pressroom.domain.FailureReason;
import org.neuralchilli.pressroom.domain.PipelineRequest;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.StageOutput;
import org.neuralchilli.pressroom.domain.TaskError;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.domain.TaskStatus;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Compact serializer for TaskRecord.
 * <p>
 * Scalars are written as binary; the request and the stage outputs are
 * nested JSON documents, since their shapes vary per stage.
 */
public class TaskRecordSerializer implements StreamSerializer<TaskRecord> {

    public static final int TYPE_ID = 2001;

    private static final Stage[] STAGES = Stage.values();
    private static final TaskStatus[] STATUSES = TaskStatus.values();
    private static final FailureReason[] REASONS = FailureReason.values();

    private final ObjectWriter outputWriter;
    private final ObjectReader outputReader;
    private final ObjectWriter requestWriter;
    private final ObjectReader requestReader;

    public TaskRecordSerializer() {
        ObjectMapper mapper = PayloadMapper.get();
        this.outputWriter = mapper.writerFor(StageOutput.class);
        this.outputReader = mapper.readerFor(StageOutput.class);
        this.requestWriter = mapper.writerFor(PipelineRequest.class);
        this.requestReader = mapper.readerFor(PipelineRequest.class);
    }

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, TaskRecord task) throws IOException {
        // UUID (16 bytes)
        out.writeLong(task.id().getMostSignificantBits());
        out.writeLong(task.id().getLeastSignificantBits());

        out.writeInt(task.status().ordinal());

        out.writeInt(task.requestedStages().size());
        for (Stage stage : task.requestedStages()) {
            out.writeInt(stage.ordinal());
        }

        out.writeByteArray(requestWriter.writeValueAsBytes(task.request()));

        // Outputs, in pipeline order
        out.writeInt(task.stageOutputs().size());
        for (Map.Entry<Stage, StageOutput> entry : task.stageOutputs().entrySet()) {
            out.writeInt(entry.getKey().ordinal());
            out.writeByteArray(outputWriter.writeValueAsBytes(entry.getValue()));
        }

        writeError(out, task.error());

        out.writeInt(task.currentStage() != null ? task.currentStage().ordinal() : -1);
        out.writeBoolean(task.cancelRequested());

        writeInstant(out, task.createdAt());
        writeInstant(out, task.updatedAt());
        writeInstantOrNull(out, task.startedAt());
        writeInstantOrNull(out, task.completedAt());
    }

    @Override
    public TaskRecord read(ObjectDataInput in) throws IOException {
        UUID id = new UUID(in.readLong(), in.readLong());

        TaskStatus status = STATUSES[in.readInt()];

        int stageCount = in.readInt();
        List<Stage> requestedStages = new ArrayList<>(stageCount);
        for (int i = 0; i < stageCount; i++) {
            requestedStages.add(STAGES[in.readInt()]);
        }

        PipelineRequest request = requestReader.readValue(in.readByteArray());

        int outputCount = in.readInt();
        Map<Stage, StageOutput> outputs = new EnumMap<>(Stage.class);
        for (int i = 0; i < outputCount; i++) {
            Stage stage = STAGES[in.readInt()];
            StageOutput output = outputReader.readValue(in.readByteArray());
            outputs.put(stage, output);
        }

        TaskError error = readError(in);

        int currentStageOrdinal = in.readInt();
        Stage currentStage = currentStageOrdinal >= 0 ? STAGES[currentStageOrdinal] : null;
        boolean cancelRequested = in.readBoolean();

        Instant createdAt = readInstant(in);
        Instant updatedAt = readInstant(in);
        Instant startedAt = readInstantOrNull(in);
        Instant completedAt = readInstantOrNull(in);

        return new TaskRecord(
                id,
                status,
                requestedStages,
                request,
                outputs,
                error,
                currentStage,
                cancelRequested,
                createdAt,
                updatedAt,
                startedAt,
                completedAt
        );
    }

    private void writeError(ObjectDataOutput out, TaskError error) throws IOException {
        if (error == null) {
            out.writeBoolean(false);
            return;
        }
        out.writeBoolean(true);
        out.writeInt(error.stage().ordinal());
        out.writeInt(error.reason().ordinal());
        out.writeString(error.message());
        out.writeInt(error.attempts());
        writeInstant(out, error.occurredAt());
    }

    private TaskError readError(ObjectDataInput in) throws IOException {
        if (!in.readBoolean()) {
            return null;
        }
        Stage stage = STAGES[in.readInt()];
        FailureReason reason = REASONS[in.readInt()];
        String message = in.readString();
        int attempts = in.readInt();
        Instant occurredAt = readInstant(in);
        return new TaskError(stage, reason, message, attempts, occurredAt);
    }

    // Full nanosecond precision, unlike epoch millis
    private void writeInstant(ObjectDataOutput out, Instant value) throws IOException {
        out.writeLong(value.getEpochSecond());
        out.writeInt(value.getNano());
    }

    private Instant readInstant(ObjectDataInput in) throws IOException {
        long seconds = in.readLong();
        int nanos = in.readInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private void writeInstantOrNull(ObjectDataOutput out, Instant value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            writeInstant(out, value);
        }
    }

    private Instant readInstantOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? readInstant(in) : null;
    }

    @Override
    public void destroy() {
        // No resources to clean up
    }
}
