package com.homework.api.controller;

import com.homework.core.service.DocumentRunGuard;
import com.homework.llm.client.GeminiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final DocumentRunGuard runGuard;
    private final GeminiProperties geminiProperties;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "homework-solver");
        response.put("inFlightDocuments", runGuard.inFlightCount());
        response.put("oracleConfigured", geminiProperties.hasApiKey());
        return ResponseEntity.ok(response);
    }
}
