package com.homework.core.model;

import lombok.Value;

/**
 * Rectangle in page coordinates, origin at the top-left corner of the page.
 */
@Value
public class BoundingBox {
    double left;
    double top;
    double right;
    double bottom;

    public static BoundingBox ofSize(double width, double height) {
        return new BoundingBox(0, 0, width, height);
    }

    public double verticalCenter() {
        return (top + bottom) / 2;
    }
}
