package com.homework.core.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * A matched problem. {@code relatedElements} holds the problem's own elements
 * followed by those of its subquestions, without duplicates.
 */
@Value
@Builder
public class Problem {
    String id;
    String text;
    List<String> pageNumbers;
    @ToString.Exclude
    List<Element> relatedElements;
    List<Subquestion> subquestions;

    public List<Element> imageElements() {
        return relatedElements.stream().filter(Element::isImage).toList();
    }
}
