package com.homework.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.core.config.HomeworkProperties;
import com.homework.core.model.PipelineResult;
import com.homework.core.service.impl.LocalResultStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link HomeworkInboxWorker} over a temporary inbox folder.
 */
@ExtendWith(MockitoExtension.class)
class HomeworkInboxWorkerTest {

    @TempDir
    Path folder;

    @Mock private HomeworkProcessingService processingService;

    private DocumentRunGuard runGuard;
    private HomeworkInboxWorker worker;

    @BeforeEach
    void setUp() {
        HomeworkProperties properties = HomeworkProperties.defaults(folder);
        LocalResultStorageService storage = new LocalResultStorageService(properties, new ObjectMapper());
        storage.initializeFolders();
        runGuard = new DocumentRunGuard();
        worker = new HomeworkInboxWorker(properties, processingService, storage, runGuard);
    }

    private Path settledFile(String name) throws IOException {
        Path file = Files.writeString(folder.resolve(name), "content");
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().minusSeconds(60)));
        return file;
    }

    @Test
    void shouldProcessSettledFile_andFileResultNextToIt() throws IOException {
        settledFile("hw.pdf");
        when(processingService.extractAndRun(any(), eq("pdf"))).thenReturn(PipelineResult.success(1, List.of()));

        worker.pollInbox();

        assertThat(folder.resolve("hw.pdf")).doesNotExist();
        assertThat(folder.resolve("results").resolve("hw.pdf")).exists();
        assertThat(folder.resolve("results").resolve("hw_result.json")).exists();
        assertThat(folder.resolve("processing").resolve("hw.pdf")).doesNotExist();
        assertThat(runGuard.inFlightCount()).isZero();
    }

    @Test
    void shouldIgnoreUnsupportedAndFreshFiles() throws IOException {
        settledFile("notes.txt");
        Files.writeString(folder.resolve("still-copying.pdf"), "partial");

        assertThat(worker.findReadyFiles()).isEmpty();
        worker.pollInbox();

        verify(processingService, never()).extractAndRun(any(), any());
    }

    @Test
    void shouldSkipFile_whenSameNameIsAlreadyRunning() throws IOException {
        Path file = settledFile("hw.pdf");
        runGuard.tryAcquire("hw.pdf");

        worker.processFile(file);

        assertThat(file).exists();
        verify(processingService, never()).extractAndRun(any(), any());
    }

    @Test
    void shouldLeaveFileInProcessing_andReleaseGuard_whenProcessingFails() throws IOException {
        settledFile("hw.pdf");
        when(processingService.extractAndRun(any(), eq("pdf"))).thenThrow(new IllegalStateException("boom"));

        worker.pollInbox();

        assertThat(folder.resolve("processing").resolve("hw.pdf")).exists();
        assertThat(runGuard.isRunning("hw.pdf")).isFalse();
    }
}
