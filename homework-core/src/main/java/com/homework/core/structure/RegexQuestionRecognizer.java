package com.homework.core.structure;

import com.homework.core.model.Element;
import com.homework.core.model.QuestionFragment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based question recognition used when the oracle gives no usable structure.
 * Patterns are tried in order and the first match wins.
 */
@Component
@Slf4j
public class RegexQuestionRecognizer {

    static final List<Pattern> QUESTION_PATTERNS = List.of(
        Pattern.compile("^(\\d+)\\s*[.、。)]", Pattern.UNICODE_CHARACTER_CLASS),
        Pattern.compile("^第\\s*(\\d+)\\s*题", Pattern.UNICODE_CHARACTER_CLASS),
        Pattern.compile("^题\\s*(\\d+)", Pattern.UNICODE_CHARACTER_CLASS),
        Pattern.compile("^([0-9]+[a-zA-Z]?)\\s*[.、)]", Pattern.UNICODE_CHARACTER_CLASS)
    );

    public List<QuestionFragment> recognize(List<Element> elements) {
        List<QuestionFragment> fragments = new ArrayList<>();
        for (Element element : elements) {
            if (!element.isText()) {
                continue;
            }
            for (String rawLine : element.getContent().split("\\R")) {
                String line = rawLine.trim();
                if (line.isEmpty()) {
                    continue;
                }
                String id = matchId(line);
                if (id != null) {
                    fragments.add(QuestionFragment.builder()
                        .id(id)
                        .text(line)
                        .pages(List.of(String.valueOf(element.getPageNumber())))
                        .build());
                }
            }
        }
        log.info("Regex fallback recognised {} question(s)", fragments.size());
        return fragments;
    }

    static String matchId(String line) {
        for (Pattern pattern : QUESTION_PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }
}
