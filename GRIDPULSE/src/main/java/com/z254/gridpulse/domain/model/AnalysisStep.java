package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One named stage within a task's template.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisStep {

    /**
     * 1-indexed position in the template.
     */
    private int id;

    private String name;

    private StepStatus status;

    private String message;

    public enum StepStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        ERROR
    }

    public static AnalysisStep pending(int id, String name) {
        return new AnalysisStep(id, name, StepStatus.PENDING, null);
    }
}
