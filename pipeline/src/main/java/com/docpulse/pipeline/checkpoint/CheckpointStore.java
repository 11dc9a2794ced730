package com.docpulse.pipeline.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * File-per-run record of completed item ids, {@code <dir>/<runId>.json}.
 *
 * <p>Every write goes to a temp file that is atomically moved over the
 * previous checkpoint, so a crash leaves either the old or the new file.</p>
 */
public class CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public CheckpointStore(Path directory) {
        this.directory = directory;
    }

    /**
     * Ids completed so far for {@code runId}, in completion order; empty if none.
     */
    public synchronized Set<String> loadCompleted(String runId) {
        Path file = fileFor(runId);
        if (!Files.isRegularFile(file)) {
            return Collections.emptySet();
        }
        try {
            CheckpointRecord record = objectMapper.readValue(file.toFile(), CheckpointRecord.class);
            Set<String> ids = new LinkedHashSet<>(record.processedIds());
            logger.info("Loaded checkpoint for run {} with {} completed items", runId, ids.size());
            return Collections.unmodifiableSet(ids);
        } catch (IOException e) {
            throw new CheckpointException("Could not read checkpoint " + file, e);
        }
    }

    public void recordCompleted(String runId, String itemId) {
        recordCompleted(runId, List.of(itemId));
    }

    /**
     * Adds {@code itemIds} to the run's checkpoint. Ids already present are ignored.
     */
    public synchronized void recordCompleted(String runId, Collection<String> itemIds) {
        Set<String> ids = new LinkedHashSet<>(loadCompleted(runId));
        if (!ids.addAll(itemIds)) {
            return;
        }
        write(runId, ids);
        logger.debug("Checkpoint for run {} now holds {} items", runId, ids.size());
    }

    public synchronized void clear(String runId) {
        Path file = fileFor(runId);
        try {
            if (Files.deleteIfExists(file)) {
                logger.info("Cleared checkpoint for run {}", runId);
            }
        } catch (IOException e) {
            throw new CheckpointException("Could not delete checkpoint " + file, e);
        }
    }

    /**
     * Run ids with a checkpoint on disk, sorted.
     */
    public synchronized List<String> listRuns() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> runs = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                runs.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new CheckpointException("Could not list checkpoints in " + directory, e);
        }
        Collections.sort(runs);
        return runs;
    }

    private void write(String runId, Set<String> ids) {
        Path file = fileFor(runId);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, "." + runId + "-", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), new CheckpointRecord(runId, new ArrayList<>(ids)));
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new CheckpointException("Could not write checkpoint " + file, e);
        }
    }

    Path fileFor(String runId) {
        if (runId == null || runId.isBlank() || runId.contains("/") || runId.contains("\\")
                || runId.contains("..")) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return directory.resolve(runId + SUFFIX);
    }
}
