package com.homework.core.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of pulling a JSON object out of an oracle reply. On failure {@code json}
 * is null and {@code candidate} holds the substring that was tried.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JsonExtraction {
    ObjectNode json;
    String candidate;
    String failureReason;

    public static JsonExtraction success(ObjectNode json, String candidate) {
        return new JsonExtraction(json, candidate, null);
    }

    public static JsonExtraction failure(String candidate, String reason) {
        return new JsonExtraction(null, candidate, reason);
    }

    public boolean isSuccess() {
        return json != null;
    }
}
