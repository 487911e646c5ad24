package com.homework.core.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.core.config.HomeworkProperties;
import com.homework.core.model.FailureKind;
import com.homework.core.model.PipelineResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LocalResultStorageService}.
 */
class LocalResultStorageServiceTest {

    @TempDir
    Path folder;

    private HomeworkProperties properties;
    private ObjectMapper objectMapper;
    private LocalResultStorageService storage;

    @BeforeEach
    void setUp() {
        properties = HomeworkProperties.defaults(folder);
        objectMapper = new ObjectMapper();
        storage = new LocalResultStorageService(properties, objectMapper);
        storage.initializeFolders();
    }

    @Test
    void shouldCreateProcessingAndResultsFolders() {
        assertThat(folder.resolve("processing")).isDirectory();
        assertThat(folder.resolve("results")).isDirectory();
    }

    @Test
    void shouldMoveThroughProcessingIntoResults() throws IOException {
        Path incoming = Files.writeString(folder.resolve("hw.pdf"), "pdf");

        Path working = storage.moveToProcessing(incoming);
        Path done = storage.moveToResults(working);

        assertThat(incoming).doesNotExist();
        assertThat(working).doesNotExist();
        assertThat(done).isEqualTo(folder.resolve("results").resolve("hw.pdf"));
        assertThat(done).hasContent("pdf");
    }

    @Test
    void shouldAddTimestamp_whenResultNameIsTaken() throws IOException {
        Files.writeString(folder.resolve("results").resolve("hw.pdf"), "old");
        Path working = Files.writeString(folder.resolve("processing").resolve("hw.pdf"), "new");

        Path done = storage.moveToResults(working);

        assertThat(done.getFileName().toString()).matches("hw_\\d{8}_\\d{6}\\.pdf");
        assertThat(done).hasContent("new");
        assertThat(folder.resolve("results").resolve("hw.pdf")).hasContent("old");
    }

    @Test
    void shouldWriteResultJsonNamedAfterSourceStem() throws IOException {
        Path saved = storage.saveResult("week 3.final.pdf", PipelineResult.success(5, List.of()));

        assertThat(saved).isEqualTo(folder.resolve("results").resolve("week 3.final_result.json"));
        JsonNode json = objectMapper.readTree(saved.toFile());
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("totalElements").asInt()).isEqualTo(5);
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void shouldWriteOnlyErrorAndStep_forFailedRun() throws IOException {
        Path saved = storage.saveResult("scan.png", PipelineResult.failure(FailureKind.MATCHING_EMPTY));

        JsonNode json = objectMapper.readTree(saved.toFile());
        assertThat(json.get("step").asInt()).isEqualTo(3);
        assertThat(json.has("success")).isFalse();
        assertThat(json.has("results")).isFalse();
    }
}
