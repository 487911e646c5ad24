package com.homework.core.structure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.homework.core.json.JsonExtraction;
import com.homework.core.json.ResilientJsonExtractor;
import com.homework.core.model.ProblemOutline;
import com.homework.core.model.QuestionFragment;
import com.homework.core.model.SubquestionOutline;
import com.homework.llm.oracle.ContentOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw structure reply into a {@link StructureReply}. Field access is
 * lenient: missing strings become empty, indices that are not integers are
 * skipped, and numeric page values are truncated to integers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructureReplyParser {

    private static final String INDICES_FIELD = "relatedElementIndices";
    private static final String INDICES_ALIAS = "related_elements";

    private final ResilientJsonExtractor jsonExtractor;

    public StructureReply decode(String reply) {
        if (ContentOracle.isFailure(reply)) {
            return StructureReply.unparseable("oracle returned no usable reply");
        }

        JsonExtraction extraction = jsonExtractor.extract(reply);
        if (!extraction.isSuccess()) {
            return StructureReply.unparseable(extraction.getFailureReason() + " in: " + abbreviate(extraction.getCandidate()));
        }

        ObjectNode json = extraction.getJson();
        JsonNode problems = json.path("problems");
        if (problems.isArray() && problems.size() > 0) {
            return StructureReply.nativeHierarchy(readProblems(problems));
        }

        JsonNode questions = json.path("questions");
        if (questions.isArray()) {
            return StructureReply.legacyFlatList(readFragments(questions));
        }

        return StructureReply.unparseable("reply has neither a problems nor a questions array");
    }

    private List<ProblemOutline> readProblems(JsonNode problems) {
        List<ProblemOutline> outlines = new ArrayList<>();
        int index = 0;
        for (JsonNode problem : problems) {
            if (!problem.isObject()) {
                log.debug("Skipping non-object problem entry at {}", index);
                index++;
                continue;
            }
            String id = readText(problem, "id");
            outlines.add(ProblemOutline.builder()
                .id(id.isEmpty() ? "p" + index : id)
                .text(readText(problem, "text"))
                .relatedElementIndices(readIndices(problem))
                .pages(readPages(problem.path("pages")))
                .subquestions(readSubquestions(problem.path("subquestions")))
                .build());
            index++;
        }
        return outlines;
    }

    private List<SubquestionOutline> readSubquestions(JsonNode subquestions) {
        List<SubquestionOutline> outlines = new ArrayList<>();
        if (!subquestions.isArray()) {
            return outlines;
        }
        for (JsonNode sub : subquestions) {
            if (!sub.isObject()) {
                continue;
            }
            outlines.add(SubquestionOutline.builder()
                .id(readText(sub, "id"))
                .text(readText(sub, "text"))
                .relatedElementIndices(readIndices(sub))
                .pages(readPages(sub.path("pages")))
                .build());
        }
        return outlines;
    }

    private List<QuestionFragment> readFragments(JsonNode questions) {
        List<QuestionFragment> fragments = new ArrayList<>();
        for (JsonNode question : questions) {
            if (!question.isObject()) {
                continue;
            }
            fragments.add(QuestionFragment.builder()
                .id(readText(question, "id"))
                .text(readText(question, "text"))
                .relatedElementIndices(readIndices(question))
                .pages(readPages(question.path("pages")))
                .build());
        }
        return fragments;
    }

    static String readText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private List<Integer> readIndices(JsonNode node) {
        JsonNode indices = node.has(INDICES_FIELD) ? node.path(INDICES_FIELD) : node.path(INDICES_ALIAS);
        List<Integer> result = new ArrayList<>();
        if (!indices.isArray()) {
            return result;
        }
        for (JsonNode index : indices) {
            if (index.isIntegralNumber() && index.canConvertToInt()) {
                result.add(index.intValue());
            } else if (index.isTextual()) {
                parseIndex(index.asText().trim()).ifPresent(result::add);
            }
        }
        return result;
    }

    private static Optional<Integer> parseIndex(String token) {
        if (!token.matches("-?\\d+")) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(token));
        } catch (NumberFormatException e) {
            log.debug("Dropping index outside int range: {}", token);
            return Optional.empty();
        }
    }

    private List<String> readPages(JsonNode pages) {
        List<String> result = new ArrayList<>();
        if (pages.isMissingNode() || pages.isNull()) {
            return result;
        }
        if (!pages.isArray()) {
            addPage(result, pages);
            return result;
        }
        for (JsonNode page : pages) {
            addPage(result, page);
        }
        return result;
    }

    private void addPage(List<String> result, JsonNode page) {
        if (page.isNumber()) {
            result.add(String.valueOf(page.intValue()));
        } else if (page.isTextual()) {
            result.add(page.asText());
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
