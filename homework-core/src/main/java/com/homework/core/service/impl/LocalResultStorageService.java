package com.homework.core.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.common.util.FileUtils;
import com.homework.core.config.HomeworkProperties;
import com.homework.core.exception.ResultStorageException;
import com.homework.core.model.PipelineResult;
import com.homework.core.service.ResultStorageService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class LocalResultStorageService implements ResultStorageService {

    static final String RESULT_SUFFIX = "_result.json";

    private final HomeworkProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    @PostConstruct
    public void initializeFolders() {
        try {
            Files.createDirectories(properties.getFolder());
            Files.createDirectories(properties.getProcessingPath());
            Files.createDirectories(properties.getResultsPath());
            log.info("Homework folders ready | inbox={} | processing={} | results={}",
                properties.getFolder(), properties.getProcessingPath(), properties.getResultsPath());
        } catch (IOException e) {
            log.error("Failed to create homework folders under {}", properties.getFolder(), e);
            throw new ResultStorageException("Failed to create homework folders", e);
        }
    }

    @Override
    public Path moveToProcessing(Path file) {
        Path target = properties.getProcessingPath().resolve(file.getFileName());
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Moved {} to processing", file.getFileName());
            return target;
        } catch (IOException e) {
            log.error("Failed to move {} to processing", file, e);
            throw new ResultStorageException("Failed to move file to processing: " + file, e);
        }
    }

    @Override
    public Path moveToResults(Path file) {
        String fileName = file.getFileName().toString();
        Path target = properties.getResultsPath().resolve(fileName);
        if (Files.exists(target)) {
            target = properties.getResultsPath().resolve(FileUtils.withTimestamp(fileName, LocalDateTime.now()));
        }
        try {
            Files.move(file, target);
            log.info("Moved {} to results as {}", fileName, target.getFileName());
            return target;
        } catch (IOException e) {
            log.error("Failed to move {} to results", file, e);
            throw new ResultStorageException("Failed to move file to results: " + file, e);
        }
    }

    @Override
    public Path saveResult(String sourceFileName, PipelineResult result) {
        Path target = properties.getResultsPath().resolve(FileUtils.getBaseName(sourceFileName) + RESULT_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), result);
            log.info("Saved result for {} to {}", sourceFileName, target);
            return target;
        } catch (IOException e) {
            log.error("Failed to save result for {}", sourceFileName, e);
            throw new ResultStorageException("Failed to save result for " + sourceFileName, e);
        }
    }
}
