package com.docpulse.pipeline.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    @TempDir
    Path tempDir;

    private CheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new CheckpointStore(tempDir.resolve("checkpoints"));
    }

    @Test
    @DisplayName("Unknown run has no completed items")
    void loadCompleted_unknownRun() {
        assertTrue(store.loadCompleted("run-1").isEmpty());
    }

    @Test
    @DisplayName("Checkpoint file holds run_id and processed_ids in completion order")
    void recordCompleted_fileFormat() throws Exception {
        store.recordCompleted("run-1", "b");
        store.recordCompleted("run-1", List.of("a", "c"));

        Path file = tempDir.resolve("checkpoints").resolve("run-1.json");
        JsonNode json = new ObjectMapper().readTree(file.toFile());

        assertEquals("run-1", json.get("run_id").asText());
        assertEquals(3, json.get("processed_ids").size());
        assertEquals("b", json.get("processed_ids").get(0).asText());
        assertEquals(List.of("b", "a", "c"), List.copyOf(store.loadCompleted("run-1")));
    }

    @Test
    @DisplayName("Recording an id twice leaves the checkpoint unchanged")
    void recordCompleted_idempotent() throws Exception {
        store.recordCompleted("run-1", "a");
        Path file = store.fileFor("run-1");
        String before = Files.readString(file);

        store.recordCompleted("run-1", "a");

        assertEquals(before, Files.readString(file));
        assertEquals(Set.of("a"), store.loadCompleted("run-1"));
    }

    @Test
    @DisplayName("No temp files remain after writes")
    void recordCompleted_noTempFiles() throws Exception {
        for (int i = 0; i < 5; i++) {
            store.recordCompleted("run-1", "item-" + i);
        }

        try (var files = Files.list(tempDir.resolve("checkpoints"))) {
            assertEquals(List.of("run-1.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    @DisplayName("Runs are isolated, listed sorted and clearable")
    void runs() {
        store.recordCompleted("run-b", "x");
        store.recordCompleted("run-a", "y");

        assertEquals(List.of("run-a", "run-b"), store.listRuns());
        assertEquals(Set.of("x"), store.loadCompleted("run-b"));

        store.clear("run-b");

        assertEquals(List.of("run-a"), store.listRuns());
        assertTrue(store.loadCompleted("run-b").isEmpty());
    }

    @Test
    @DisplayName("Corrupt checkpoints raise CheckpointException")
    void corruptFile() throws Exception {
        Files.createDirectories(tempDir.resolve("checkpoints"));
        Files.writeString(tempDir.resolve("checkpoints").resolve("run-1.json"), "{not json");

        assertThrows(CheckpointException.class, () -> store.loadCompleted("run-1"));
    }

    @Test
    @DisplayName("Run ids that would escape the directory are rejected")
    void invalidRunId() {
        assertThrows(IllegalArgumentException.class, () -> store.fileFor("../etc"));
        assertThrows(IllegalArgumentException.class, () -> store.fileFor(" "));
    }
}
