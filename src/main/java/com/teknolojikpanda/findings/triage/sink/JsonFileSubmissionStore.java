package com.teknolojikpanda.findings.triage.sink;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.teknolojikpanda.findings.synth.api.SubmissionStore;
import com.teknolojikpanda.findings.synth.model.SubmissionStatus;
import com.teknolojikpanda.findings.synth.model.TaskSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Keeps submissions in a JSON file so accepted findings survive a restart. The whole file is
 * rewritten on every save through a temporary sibling and a move, so a crash leaves either the
 * old or the new content.
 */
public class JsonFileSubmissionStore implements SubmissionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSubmissionStore.class);
    private static final TypeReference<List<TaskSubmission>> LIST_TYPE = new TypeReference<List<TaskSubmission>>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, TaskSubmission> submissions = new LinkedHashMap<>();

    /**
     * @throws UncheckedIOException when an existing file cannot be read
     */
    public JsonFileSubmissionStore(@Nonnull Path file, @Nonnull ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    public JsonFileSubmissionStore(@Nonnull Path file) {
        this(file, new ObjectMapper());
    }

    @Nonnull
    public Path getFile() {
        return file;
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<TaskSubmission> stored = objectMapper.readValue(file.toFile(), LIST_TYPE);
            for (TaskSubmission submission : stored) {
                submissions.put(submission.getFindingId(), submission);
            }
            log.info("Loaded {} task submissions from {}", submissions.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read submission store " + file, e);
        }
    }

    /**
     * @throws UncheckedIOException when the file cannot be written; the in-memory view is rolled back
     */
    @Override
    public synchronized void save(@Nonnull TaskSubmission submission) {
        Objects.requireNonNull(submission, "submission");
        TaskSubmission previous = submissions.put(submission.getFindingId(), submission);
        try {
            write();
        } catch (IOException e) {
            if (previous == null) {
                submissions.remove(submission.getFindingId());
            } else {
                submissions.put(previous.getFindingId(), previous);
            }
            throw new UncheckedIOException("Failed to write submission store " + file, e);
        }
    }

    private void write() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), new ArrayList<>(submissions.values()));
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Nullable
    @Override
    public synchronized TaskSubmission get(@Nonnull String findingId) {
        return submissions.get(findingId);
    }

    @Nonnull
    @Override
    public synchronized List<TaskSubmission> findAll() {
        return new ArrayList<>(submissions.values());
    }

    @Nonnull
    @Override
    public synchronized List<TaskSubmission> findByStatus(@Nonnull SubmissionStatus status) {
        return submissions.values().stream()
                .filter(submission -> submission.getStatus() == status)
                .collect(Collectors.toList());
    }
}
