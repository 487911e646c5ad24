package com.homework.core.service;

import com.homework.common.util.FileUtils;
import com.homework.core.config.HomeworkProperties;
import com.homework.core.model.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Polls the homework folder and processes every supported file dropped into it.
 *
 * <p>A file is picked up once it has not been modified for
 * {@code homework.inbox-settle-delay}, so half-copied files are left alone.
 */
@Component
@ConditionalOnProperty(name = "homework.inbox.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class HomeworkInboxWorker {

    private final HomeworkProperties properties;
    private final HomeworkProcessingService processingService;
    private final ResultStorageService storageService;
    private final DocumentRunGuard runGuard;

    @Scheduled(fixedDelayString = "${homework.inbox.poll-interval:3000}")
    public void pollInbox() {
        List<Path> ready;
        try {
            ready = findReadyFiles();
        } catch (IOException e) {
            log.error("[INBOX] Failed to list {}", properties.getFolder(), e);
            return;
        }
        for (Path file : ready) {
            processFile(file);
        }
    }

    List<Path> findReadyFiles() throws IOException {
        if (!Files.isDirectory(properties.getFolder())) {
            return List.of();
        }
        Instant settledBefore = Instant.now().minus(properties.getInboxSettleDelay());
        try (Stream<Path> files = Files.list(properties.getFolder())) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> properties.isSupportedFormat(FileUtils.getFileExtension(path.getFileName().toString())))
                .filter(path -> isSettled(path, settledBefore))
                .sorted()
                .toList();
        }
    }

    void processFile(Path file) {
        String fileName = file.getFileName().toString();
        if (!runGuard.tryAcquire(fileName)) {
            log.info("[INBOX] Skipping {}: already being processed", fileName);
            return;
        }
        try {
            long startTime = System.currentTimeMillis();
            log.info("[INBOX] New homework file detected: {}", fileName);
            Path working = storageService.moveToProcessing(file);

            PipelineResult result;
            try (InputStream in = Files.newInputStream(working)) {
                result = processingService.extractAndRun(in, FileUtils.getFileExtension(fileName));
            }

            storageService.saveResult(fileName, result);
            storageService.moveToResults(working);
            log.info("[INBOX] Finished {} | success={} | durationMs={}",
                fileName, result.succeeded(), System.currentTimeMillis() - startTime);
        } catch (IOException | RuntimeException e) {
            log.error("[INBOX] Failed to process {}", fileName, e);
        } finally {
            runGuard.release(fileName);
        }
    }

    private boolean isSettled(Path path, Instant settledBefore) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(settledBefore);
        } catch (IOException e) {
            log.warn("[INBOX] Cannot read modification time of {}: {}", path, e.getMessage());
            return false;
        }
    }
}
