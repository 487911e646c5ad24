package com.homework.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Subset of the Gemini {@code generateContent} reply the client reads.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationResponse {
    @JsonProperty("candidates")
    private List<Candidate> candidates;

    @JsonProperty("promptFeedback")
    private PromptFeedback promptFeedback;

    /**
     * Concatenated text of the first candidate's parts, or null when there is none.
     */
    public String firstCandidateText() {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        Content content = candidates.get(0).getContent();
        if (content == null || content.getParts() == null || content.getParts().isEmpty()) {
            return null;
        }
        return content.getParts().stream()
            .map(Part::getText)
            .filter(Objects::nonNull)
            .collect(Collectors.joining());
    }

    public String firstFinishReason() {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        return candidates.get(0).getFinishReason();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Candidate {
        @JsonProperty("content")
        private Content content;

        @JsonProperty("finishReason")
        private String finishReason;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Content {
        @JsonProperty("parts")
        private List<Part> parts;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Part {
        @JsonProperty("text")
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PromptFeedback {
        @JsonProperty("blockReason")
        private String blockReason;
    }
}
