package com.homework.core.structure;

import com.homework.core.model.ProblemOutline;
import com.homework.core.model.QuestionFragment;
import com.homework.core.model.SubquestionOutline;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups flat question fragments into problems by the leading digit run of their ids.
 *
 * <p>Grouping is a single pass over adjacent fragments, so {@code 1, 1a, 2, 2b, 1c}
 * becomes three problems: 1, 2 and 1 again.
 */
@Component
public class PrefixGrouper {

    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    public List<ProblemOutline> group(List<QuestionFragment> fragments) {
        List<ProblemOutline> problems = new ArrayList<>();
        String currentPrefix = null;
        List<SubquestionOutline> current = new ArrayList<>();

        for (QuestionFragment fragment : fragments) {
            String prefix = prefixOf(fragment.getId());
            if (currentPrefix != null && !Objects.equals(prefix, currentPrefix)) {
                problems.add(outline(currentPrefix, current));
                current = new ArrayList<>();
            }
            currentPrefix = prefix;
            current.add(SubquestionOutline.builder()
                .id(fragment.getId())
                .text(fragment.getText())
                .relatedElementIndices(fragment.getRelatedElementIndices())
                .pages(fragment.getPages())
                .build());
        }
        if (currentPrefix != null) {
            problems.add(outline(currentPrefix, current));
        }
        return problems;
    }

    static String prefixOf(String id) {
        String value = id == null ? "" : id;
        Matcher matcher = LEADING_DIGITS.matcher(value);
        return matcher.find() ? matcher.group(1) : value;
    }

    private ProblemOutline outline(String prefix, List<SubquestionOutline> subquestions) {
        return ProblemOutline.builder()
            .id(prefix)
            .subquestions(List.copyOf(subquestions))
            .build();
    }
}
