package com.homework.core.structure;

import com.homework.core.model.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reading order for page elements: page number, then vertical center, both ascending.
 *
 * <p>The sort is stable, so elements with equal keys keep their extraction order.
 * Element indices handed to and returned by the oracle refer to this order, and
 * the page-window heuristics of matching assume it; every stage re-applies it
 * instead of trusting its input.
 */
public final class ElementOrdering {

    public static final Comparator<Element> READING_ORDER = Comparator
        .comparingInt(Element::getPageNumber)
        .thenComparingDouble(Element::getVerticalCenter);

    private ElementOrdering() {}

    public static List<Element> sort(List<Element> elements) {
        if (elements == null || elements.isEmpty()) {
            return List.of();
        }
        List<Element> ordered = new ArrayList<>(elements);
        ordered.sort(READING_ORDER);
        return List.copyOf(ordered);
    }
}
