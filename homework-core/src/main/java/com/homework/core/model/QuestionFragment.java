package com.homework.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A flat question as recognised by the regex fallback or listed in a legacy
 * {@code questions} reply, before it is grouped into a problem.
 */
@Value
@Builder
public class QuestionFragment {
    String id;
    @Builder.Default
    String text = "";
    @Builder.Default
    List<Integer> relatedElementIndices = List.of();
    @Builder.Default
    List<String> pages = List.of();
}
