package com.teknolojikpanda.findings.synth.api;

/**
 * Signals that the external tracker did not create a task.
 */
public class TaskTrackerException extends Exception {

    public TaskTrackerException(String message) {
        super(message);
    }

    public TaskTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
