package com.teknolojikpanda.findings.synth.api;

import com.teknolojikpanda.findings.synth.model.TaskPriority;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * External issue/task tracker.
 */
public interface TaskTracker {

    /**
     * Creates a task.
     *
     * @return the tracker's identifier for the new task
     * @throws TaskTrackerException when the tracker rejects the call or cannot be reached
     */
    @Nonnull
    String createTask(@Nonnull String title,
                      @Nonnull String description,
                      @Nonnull TaskPriority priority,
                      @Nonnull List<String> labels) throws TaskTrackerException;
}
