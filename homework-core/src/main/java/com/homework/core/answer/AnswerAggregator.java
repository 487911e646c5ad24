package com.homework.core.answer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.homework.core.config.HomeworkProperties;
import com.homework.core.json.JsonExtraction;
import com.homework.core.json.ResilientJsonExtractor;
import com.homework.core.model.AnswerRecord;
import com.homework.core.model.Element;
import com.homework.core.model.FailureKind;
import com.homework.core.model.Problem;
import com.homework.core.model.ProblemResult;
import com.homework.core.model.Subquestion;
import com.homework.llm.model.ContentPart;
import com.homework.llm.oracle.ContentOracle;
import com.homework.llm.prompt.HomeworkPrompts;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Answers every problem with one oracle call and aligns the returned answers
 * with the problem's subquestions.
 *
 * <p>The result always holds exactly one {@link AnswerRecord} per subquestion, in
 * subquestion order. A failed or unparseable reply is copied into every record so
 * the caller still sees what the oracle said.
 */
@Service
@Slf4j
public class AnswerAggregator {

    private final ContentOracle oracle;
    private final ResilientJsonExtractor jsonExtractor;
    private final ExecutorService executorService;

    public AnswerAggregator(ContentOracle oracle, ResilientJsonExtractor jsonExtractor, HomeworkProperties properties) {
        this.oracle = oracle;
        this.jsonExtractor = jsonExtractor;
        int parallelism = properties.getAnswerParallelism();
        this.executorService = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
    }

    public List<ProblemResult> answerAll(List<Problem> problems) {
        long startTime = System.currentTimeMillis();
        List<ProblemResult> results;

        if (executorService == null || problems.size() < 2) {
            results = new ArrayList<>();
            for (Problem problem : problems) {
                results.add(answer(problem));
            }
        } else {
            List<CompletableFuture<ProblemResult>> futures = problems.stream()
                .map(problem -> CompletableFuture.supplyAsync(() -> answer(problem), executorService))
                .toList();
            results = futures.stream().map(CompletableFuture::join).toList();
        }

        log.info("[ANSWER] Aggregation complete | problems={} | durationMs={}",
            problems.size(), System.currentTimeMillis() - startTime);
        return results;
    }

    public ProblemResult answer(Problem problem) {
        String reply = oracle.respond(HomeworkPrompts.ANSWER_SYSTEM_PROMPT, buildParts(problem));
        List<Subquestion> subquestions = problem.getSubquestions();

        if (ContentOracle.isFailure(reply)) {
            log.warn("[ANSWER] {} | problemId={}", FailureKind.ORACLE_EXHAUSTED.getDescription(), problem.getId());
            return degraded(problem, reply);
        }

        JsonExtraction extraction = jsonExtractor.extract(reply);
        if (!extraction.isSuccess()) {
            log.warn("[ANSWER] Answer reply could not be parsed | problemId={} | reason={}",
                problem.getId(), extraction.getFailureReason());
            return degraded(problem, reply);
        }

        ObjectNode json = extraction.getJson();
        String overrideText = asPlainText(json.get("problem_text"));
        String problemText = overrideText.isBlank() ? problem.getText() : overrideText;

        AnswerRecord[] slots = new AnswerRecord[subquestions.size()];
        JsonNode answers = json.path("answers");
        if (answers.isArray()) {
            for (int i = 0; i < answers.size(); i++) {
                JsonNode answer = answers.get(i);
                int slot = resolveSlot(answer.path("sub_id"), i, subquestions);
                if (slot < 0) {
                    log.warn("[ANSWER] Dropping answer {} of problem {}: no matching subquestion", i, problem.getId());
                    continue;
                }
                if (slots[slot] != null) {
                    log.warn("[ANSWER] Dropping answer {} of problem {}: subquestion {} already answered",
                        i, problem.getId(), subquestions.get(slot).getId());
                    continue;
                }
                slots[slot] = AnswerRecord.of(problem.getId(), subquestions.get(slot),
                    asPlainText(answer.get("answer")), asPlainText(answer.get("reason")));
            }
        }

        return toResult(problem, problemText, slots);
    }

    List<ContentPart> buildParts(Problem problem) {
        List<ContentPart> parts = new ArrayList<>();
        if (problem.getText() != null && !problem.getText().isBlank()) {
            parts.add(ContentPart.text(HomeworkPrompts.stemTurn(problem.getId(), problem.getText())));
        }
        for (Subquestion subquestion : problem.getSubquestions()) {
            parts.add(ContentPart.text(HomeworkPrompts.subquestionTurn(subquestion.getId(), subquestion.getText())));
        }
        for (Element image : problem.imageElements()) {
            parts.add(ContentPart.jpeg(image.getContent()));
        }
        return parts;
    }

    /**
     * Slot for an answer: the subquestion with the given id, otherwise the one at
     * the answer's position. Returns -1 when neither exists.
     */
    static int resolveSlot(JsonNode subId, int position, List<Subquestion> subquestions) {
        if (subId.isValueNode() && !subId.isNull()) {
            String id = subId.asText();
            for (int i = 0; i < subquestions.size(); i++) {
                if (id.equals(subquestions.get(i).getId())) {
                    return i;
                }
            }
        }
        return position < subquestions.size() ? position : -1;
    }

    private ProblemResult degraded(Problem problem, String reply) {
        String rawText = reply == null ? "" : reply;
        AnswerRecord[] slots = problem.getSubquestions().stream()
            .map(sub -> AnswerRecord.of(problem.getId(), sub, rawText, ""))
            .toArray(AnswerRecord[]::new);
        return toResult(problem, problem.getText(), slots);
    }

    private ProblemResult toResult(Problem problem, String problemText, AnswerRecord[] slots) {
        List<Subquestion> subquestions = problem.getSubquestions();
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                slots[i] = AnswerRecord.empty(problem.getId(), subquestions.get(i));
            }
        }
        return ProblemResult.builder()
            .problemId(problem.getId())
            .problemText(problemText)
            .subquestionCount(subquestions.size())
            .answers(List.copyOf(Arrays.asList(slots)))
            .build();
    }

    static String asPlainText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    @PreDestroy
    public void shutdown() {
        if (executorService != null) {
            executorService.shutdown();
        }
    }
}
