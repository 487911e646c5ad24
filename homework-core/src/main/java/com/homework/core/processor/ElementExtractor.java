package com.homework.core.processor;

import com.homework.core.model.Element;

import java.io.InputStream;
import java.util.List;

/**
 * Turns an uploaded document into page elements. Implementations never throw for
 * unreadable input; they log the problem and return an empty list.
 */
public interface ElementExtractor {
    boolean supports(String fileType);
    List<Element> extract(InputStream inputStream);
}
