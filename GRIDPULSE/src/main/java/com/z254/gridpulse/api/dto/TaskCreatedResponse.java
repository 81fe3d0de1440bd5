package com.z254.gridpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an accepted run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskCreatedResponse {

    public static final String STATUS_ACCEPTED = "accepted";

    private String taskId;

    private String status;

    public static TaskCreatedResponse accepted(String taskId) {
        return new TaskCreatedResponse(taskId, STATUS_ACCEPTED);
    }
}
