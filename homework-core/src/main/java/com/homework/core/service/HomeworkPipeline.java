package com.homework.core.service;

import com.homework.core.answer.AnswerAggregator;
import com.homework.core.matching.ElementMatcher;
import com.homework.core.model.Element;
import com.homework.core.model.FailureKind;
import com.homework.core.model.PipelineResult;
import com.homework.core.model.Problem;
import com.homework.core.model.ProblemOutline;
import com.homework.core.model.ProblemResult;
import com.homework.core.structure.ElementOrdering;
import com.homework.core.structure.StructureInferenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs the four pipeline stages over an element list: ordering and structure
 * inference, element matching, then answer aggregation. The first stage that
 * comes up empty ends the run with {@code {error, step}}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HomeworkPipeline {

    static final int STEP_STRUCTURE = 2;
    static final int STEP_MATCHING = 3;
    static final int STEP_ANSWER = 4;

    private final StructureInferenceService structureInferenceService;
    private final ElementMatcher elementMatcher;
    private final AnswerAggregator answerAggregator;

    public PipelineResult run(List<Element> elements) {
        long startTime = System.currentTimeMillis();
        if (elements == null || elements.isEmpty()) {
            log.warn("[PIPELINE] {}", FailureKind.EXTRACTION_EMPTY.getDescription());
            return PipelineResult.failure(FailureKind.EXTRACTION_EMPTY);
        }
        List<Element> ordered = ElementOrdering.sort(elements);
        log.info("[PIPELINE] Step 1 complete | elements={}", ordered.size());

        try {
            List<ProblemOutline> outlines = stage(STEP_STRUCTURE, () -> structureInferenceService.inferStructure(ordered));
            if (outlines.isEmpty()) {
                log.warn("[PIPELINE] {}", FailureKind.STRUCTURE_EMPTY.getDescription());
                return PipelineResult.failure(FailureKind.STRUCTURE_EMPTY);
            }
            log.info("[PIPELINE] Step 2 complete | problems={}", outlines.size());

            List<Problem> problems = stage(STEP_MATCHING, () -> elementMatcher.match(outlines, ordered));
            if (problems.isEmpty()) {
                log.warn("[PIPELINE] {}", FailureKind.MATCHING_EMPTY.getDescription());
                return PipelineResult.failure(FailureKind.MATCHING_EMPTY);
            }
            log.info("[PIPELINE] Step 3 complete | matchedProblems={}", problems.size());

            List<ProblemResult> results = stage(STEP_ANSWER, () -> answerAggregator.answerAll(problems));
            log.info("[PIPELINE] Step 4 complete | results={} | totalDurationMs={}",
                results.size(), System.currentTimeMillis() - startTime);
            return PipelineResult.success(ordered.size(), results);
        } catch (StageFailure failure) {
            log.error("[PIPELINE] Step {} failed unexpectedly", failure.step, failure.getCause());
            String message = failure.getCause().getMessage();
            return PipelineResult.failure(failure.step,
                message != null ? message : failure.getCause().getClass().getSimpleName());
        }
    }

    private static <T> T stage(int step, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            throw new StageFailure(step, e);
        }
    }

    private static final class StageFailure extends RuntimeException {
        private final int step;

        StageFailure(int step, RuntimeException cause) {
            super(cause);
            this.step = step;
        }
    }
}
