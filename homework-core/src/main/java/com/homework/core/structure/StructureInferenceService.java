package com.homework.core.structure;

import com.homework.core.model.Element;
import com.homework.core.model.FailureKind;
import com.homework.core.model.ProblemOutline;
import com.homework.llm.model.ContentPart;
import com.homework.llm.oracle.ContentOracle;
import com.homework.llm.prompt.HomeworkPrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Infers the problem hierarchy of a document with one oracle call over every
 * element. When the reply cannot be used, regex recognition over the text
 * elements takes over. Never throws for a bad reply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructureInferenceService {

    private final ContentOracle oracle;
    private final StructureReplyParser replyParser;
    private final RegexQuestionRecognizer regexRecognizer;
    private final PrefixGrouper prefixGrouper;

    public List<ProblemOutline> inferStructure(List<Element> elements) {
        List<Element> ordered = ElementOrdering.sort(elements);
        if (ordered.isEmpty()) {
            return List.of();
        }

        String reply = oracle.respond(HomeworkPrompts.STRUCTURE_SYSTEM_PROMPT, buildParts(ordered));
        StructureReply decoded = replyParser.decode(reply);

        switch (decoded.getKind()) {
            case NATIVE_HIERARCHY:
                log.info("Structure inferred | problems={}", decoded.getProblems().size());
                return decoded.getProblems();
            case LEGACY_FLAT_LIST:
                List<ProblemOutline> grouped = prefixGrouper.group(decoded.getFragments());
                log.info("Structure reply used a flat question list | questions={} | problems={}",
                    decoded.getFragments().size(), grouped.size());
                return grouped;
            case UNPARSEABLE:
            default:
                log.warn("{}: {}; falling back to regex recognition",
                    FailureKind.STRUCTURE_PARSE_FAILURE.getDescription(), decoded.getDiagnostic());
                return prefixGrouper.group(regexRecognizer.recognize(ordered));
        }
    }

    List<ContentPart> buildParts(List<Element> ordered) {
        List<ContentPart> parts = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            Element element = ordered.get(i);
            String marker = HomeworkPrompts.elementMarker(i, element.getPageNumber(), element.getKind().getLabel());
            if (element.isImage()) {
                parts.add(ContentPart.text(marker));
                parts.add(ContentPart.jpeg(element.getContent()));
            } else {
                parts.add(ContentPart.text(marker + "\n" + element.getContent()));
            }
        }
        return parts;
    }
}
