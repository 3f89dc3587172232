package com.teknolojikpanda.findings.triage.sink;

import com.teknolojikpanda.findings.synth.api.TaskTrackerException;
import com.teknolojikpanda.findings.synth.model.TaskPriority;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class BeadsCliTaskTrackerTest {

    @Test
    public void parsesCreatedTaskId() throws Exception {
        List<List<String>> commands = new ArrayList<>();
        BeadsCliTaskTracker tracker = new BeadsCliTaskTracker("bd", command -> {
            commands.add(command);
            return new BeadsCliTaskTracker.CommandResult(0, "Created issue: bd-a1b2 Leaked token\n");
        });

        String id = tracker.createTask("Leaked token", "details", TaskPriority.HIGHEST,
                Arrays.asList("security", "code-review"));

        assertEquals("bd-a1b2", id);
        assertEquals(Arrays.asList("bd", "create", "Leaked token", "--body", "details", "--priority", "5",
                "--labels", "security,code-review"), commands.get(0));
    }

    @Test
    public void omitsEmptyBodyAndLabels() {
        BeadsCliTaskTracker tracker = new BeadsCliTaskTracker("bd", command -> null);

        assertEquals(Arrays.asList("bd", "create", "t", "--priority", "1"),
                tracker.buildCommand("t", "", TaskPriority.LOWEST, Collections.emptyList()));
    }

    @Test
    public void nonZeroExitIsAFailure() {
        BeadsCliTaskTracker tracker = new BeadsCliTaskTracker("bd",
                command -> new BeadsCliTaskTracker.CommandResult(1, "database locked"));

        TaskTrackerException error = assertThrows(TaskTrackerException.class,
                () -> tracker.createTask("t", "", TaskPriority.MEDIUM, Collections.emptyList()));
        assertTrue(error.getMessage().contains("database locked"));
    }

    @Test
    public void outputWithoutIdIsAFailure() {
        BeadsCliTaskTracker tracker = new BeadsCliTaskTracker("bd",
                command -> new BeadsCliTaskTracker.CommandResult(0, "ok"));

        assertThrows(TaskTrackerException.class,
                () -> tracker.createTask("t", "", TaskPriority.MEDIUM, Collections.emptyList()));
    }

    @Test
    public void launchFailureIsWrapped() {
        BeadsCliTaskTracker tracker = new BeadsCliTaskTracker("bd", command -> {
            throw new IOException("bd: not found");
        });

        TaskTrackerException error = assertThrows(TaskTrackerException.class,
                () -> tracker.createTask("t", "", TaskPriority.MEDIUM, Collections.emptyList()));
        assertTrue(error.getCause() instanceof IOException);
    }
}
