package com.homework.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one pipeline run: either the answered problems or the first stage that came up empty.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineResult {
    Boolean success;
    Integer totalElements;
    Integer totalProblems;
    List<ProblemResult> results;
    String error;
    Integer step;

    public static PipelineResult success(int totalElements, List<ProblemResult> results) {
        return PipelineResult.builder()
            .success(true)
            .totalElements(totalElements)
            .totalProblems(results.size())
            .results(results)
            .build();
    }

    public static PipelineResult failure(FailureKind kind) {
        return failure(kind.getStep(), kind.getDescription());
    }

    public static PipelineResult failure(int step, String error) {
        return PipelineResult.builder()
            .error(error)
            .step(step)
            .build();
    }

    public boolean succeeded() {
        return Boolean.TRUE.equals(success);
    }
}
