package com.z254.gridpulse.exception;

/**
 * A run is already active for the task; only one writer per task is allowed.
 */
public class TaskAlreadyRunningException extends GridPulseException {

    public TaskAlreadyRunningException(String taskId) {
        super("Task is already running: " + taskId);
    }
}
