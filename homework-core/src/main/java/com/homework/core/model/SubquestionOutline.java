package com.homework.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SubquestionOutline {
    String id;
    @Builder.Default
    String text = "";
    @Builder.Default
    List<Integer> relatedElementIndices = List.of();
    /** Page tokens as declared; non-numeric tokens are kept verbatim. */
    @Builder.Default
    List<String> pages = List.of();
}
