package com.homework.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts the JSON object embedded in a free-form oracle reply.
 *
 * <p>A "```json" fence wins when present; its body runs to the next fence or, for a
 * truncated reply, to the end of the text. Otherwise the span from the first
 * opening brace to the last closing brace is used. That span is parsed strictly: a reply
 * holding two separate objects yields a span that is not valid JSON and the
 * extraction fails instead of silently keeping the first object.
 */
@Component
@Slf4j
public class ResilientJsonExtractor {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectReader strictReader;

    public ResilientJsonExtractor(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonExtraction extract(String reply) {
        if (reply == null || reply.isBlank()) {
            return JsonExtraction.failure("", "empty reply");
        }

        String candidate = selectCandidate(reply);
        if (candidate.isEmpty()) {
            return JsonExtraction.failure(candidate, "no JSON object found");
        }

        try {
            JsonNode node = strictReader.readTree(candidate);
            if (node == null || !node.isObject()) {
                return JsonExtraction.failure(candidate, "top-level JSON value is not an object");
            }
            return JsonExtraction.success((ObjectNode) node, candidate);
        } catch (JsonProcessingException e) {
            log.debug("JSON candidate rejected ({} chars): {}", candidate.length(), e.getOriginalMessage());
            return JsonExtraction.failure(candidate, e.getOriginalMessage());
        }
    }

    String selectCandidate(String reply) {
        int fence = reply.indexOf(JSON_FENCE);
        if (fence >= 0) {
            String body = reply.substring(fence + JSON_FENCE.length());
            int close = body.indexOf(FENCE);
            return (close >= 0 ? body.substring(0, close) : body).trim();
        }

        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end < start) {
            return "";
        }
        return reply.substring(start, end + 1).trim();
    }
}
