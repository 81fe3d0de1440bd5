package com.z254.gridpulse.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One ordered unit of progress or result for a task.
 *
 * <p>Events are built through the static factories, which validate the payload
 * against the shape declared by {@link EventType}. The bus stamps the task id and
 * sequence number when the event is published.
 */
@Data
@NoArgsConstructor
public class PipelineEvent {

    /**
     * Per-task sequence number, starting at 1. Null until published.
     */
    private Long seq;

    private String taskId;

    private EventType type;

    private Integer step;

    private Map<String, Object> payload;

    private Instant timestamp;

    private PipelineEvent(EventType type, Integer step, Map<String, Object> payload) {
        type.validate(step, payload);
        this.type = type;
        this.step = step;
        this.payload = payload;
        this.timestamp = Instant.now();
    }

    public static PipelineEvent of(EventType type, Integer step, Map<String, Object> payload) {
        return new PipelineEvent(type, step, payload == null ? null : new LinkedHashMap<>(payload));
    }

    public static PipelineEvent stepStart(int step, String stepName) {
        return of(EventType.STEP_START, step, Map.of("stepName", stepName));
    }

    public static PipelineEvent stepComplete(int step, String stepName, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stepName", stepName);
        if (message != null) {
            payload.put("message", message);
        }
        return of(EventType.STEP_COMPLETE, step, payload);
    }

    public static PipelineEvent stepError(int step, String stepName, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stepName", stepName);
        payload.put("message", message);
        return of(EventType.STEP_ERROR, step, payload);
    }

    public static PipelineEvent thinking(String content) {
        return of(EventType.THINKING, null, Map.of("content", content));
    }

    public static PipelineEvent intent(String intent, List<String> steps, String region, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("intent", intent);
        payload.put("steps", steps);
        if (region != null) {
            payload.put("region", region);
        }
        if (reason != null) {
            payload.put("reason", reason);
        }
        return of(EventType.INTENT, null, payload);
    }

    public static PipelineEvent data(Integer step, String dataType, Object data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dataType", dataType);
        payload.put("data", data);
        return of(EventType.DATA, step, payload);
    }

    public static PipelineEvent modelSelection(int step, String model, int horizon) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("horizon", horizon);
        return of(EventType.MODEL_SELECTION, step, payload);
    }

    public static PipelineEvent narrativeChunk(Integer step, String channel, String content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("content", content);
        return of(EventType.NARRATIVE_CHUNK, step, payload);
    }

    public static PipelineEvent error(String message) {
        return of(EventType.ERROR, null, Map.of("message", message));
    }

    public static PipelineEvent done(String status, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        if (message != null) {
            payload.put("message", message);
        }
        return of(EventType.DONE, null, payload);
    }

    /**
     * Copy carrying the bus-assigned identity and a normalized payload.
     */
    PipelineEvent stamped(String taskId, long seq, Map<String, Object> normalizedPayload) {
        PipelineEvent copy = new PipelineEvent();
        copy.seq = seq;
        copy.taskId = taskId;
        copy.type = type;
        copy.step = step;
        copy.payload = normalizedPayload;
        copy.timestamp = timestamp;
        return copy;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type == EventType.DONE;
    }

    @JsonIgnore
    public String payloadString(String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? null : value.toString();
    }
}
