package com.z254.gridpulse.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for GRIDPULSE.
 * Provides consistent, machine-parseable log entries for pipeline lifecycle events.
 */
@Component
@Slf4j
public class StructuredLogger {

    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_TEMPLATE = "template";

    private final ObjectMapper objectMapper;

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void setTaskContext(String taskId, String template) {
        if (taskId != null) MDC.put(MDC_TASK_ID, taskId);
        if (template != null) MDC.put(MDC_TEMPLATE, template);
    }

    public void clearContext() {
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_TEMPLATE);
    }

    public void logTaskStarted(String taskId, String query, boolean followUp) {
        logEvent("task_started", Map.of(
                "taskId", taskId,
                "queryLength", query != null ? query.length() : 0,
                "followUp", followUp
        ));
    }

    public void logTaskClassified(String taskId, String template, String region) {
        Map<String, Object> data = new HashMap<>();
        data.put("taskId", taskId);
        data.put("template", template);
        if (region != null) data.put("region", region);
        logEvent("task_classified", data);
    }

    public void logStepCompleted(String taskId, int step, String stepName, String status) {
        logEvent("step_completed", Map.of(
                "taskId", taskId,
                "step", step,
                "stepName", stepName,
                "status", status
        ));
    }

    public void logTaskCompleted(String taskId, long durationMs, String status) {
        logEvent("task_completed", Map.of(
                "taskId", taskId,
                "durationMs", durationMs,
                "status", status
        ));
    }

    public void logTaskFailed(String taskId, String errorCode, String errorMessage) {
        logEvent("task_failed", Map.of(
                "taskId", taskId,
                "errorCode", errorCode,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error"
        ));
    }

    public void logCapabilityFailure(String taskId, String capability, boolean required, String errorMessage) {
        Map<String, Object> data = new HashMap<>();
        data.put("taskId", taskId);
        data.put("capability", capability);
        data.put("required", required);
        if (errorMessage != null) data.put("errorMessage", errorMessage);
        logEvent("capability_failure", data);
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "gridpulse");

        String taskId = MDC.get(MDC_TASK_ID);
        if (taskId != null) event.putIfAbsent("taskId", taskId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
