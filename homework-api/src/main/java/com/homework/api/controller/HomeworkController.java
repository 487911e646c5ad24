package com.homework.api.controller;

import com.homework.common.util.FileUtils;
import com.homework.core.model.PipelineResult;
import com.homework.core.service.HomeworkProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@RestController
@RequestMapping("/api/v1/homework")
@RequiredArgsConstructor
@Slf4j
public class HomeworkController {

    private final HomeworkProcessingService processingService;

    /**
     * Runs the whole pipeline on an uploaded PDF or page image and returns the
     * result synchronously. A pipeline that stopped early answers 422 with its
     * {@code {error, step}} body.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PipelineResult> solve(@RequestParam("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            log.warn("Upload rejected: file is missing or empty");
            return ResponseEntity.badRequest().build();
        }
        String fileName = file.getOriginalFilename();
        if (!FileUtils.isValidFile(fileName, file.getSize())) {
            log.warn("Upload rejected: {} ({} bytes)", fileName, file.getSize());
            return ResponseEntity.badRequest().build();
        }

        log.info("Homework upload received | fileName={} | size={}", fileName, file.getSize());
        PipelineResult result;
        try (InputStream in = file.getInputStream()) {
            result = processingService.process(FileUtils.sanitizeFileName(fileName), in, FileUtils.getFileExtension(fileName));
        }

        if (!result.succeeded()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        return ResponseEntity.ok(result);
    }
}
