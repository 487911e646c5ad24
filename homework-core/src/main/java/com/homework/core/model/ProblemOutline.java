package com.homework.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Problem hierarchy before element resolution, either declared by the oracle or
 * synthesised by prefix grouping. Element indices refer to the ordered element list.
 */
@Value
@Builder
public class ProblemOutline {
    String id;
    @Builder.Default
    String text = "";
    @Builder.Default
    List<Integer> relatedElementIndices = List.of();
    @Builder.Default
    List<String> pages = List.of();
    @Builder.Default
    List<SubquestionOutline> subquestions = List.of();
}
