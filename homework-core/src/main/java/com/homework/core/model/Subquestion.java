package com.homework.core.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Subquestion {
    String id;
    String text;
    @ToString.Exclude
    List<String> images;
    List<String> pageNumbers;
    @ToString.Exclude
    List<Element> relatedElements;
}
