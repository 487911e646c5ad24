package com.homework.core.model;

import lombok.ToString;
import lombok.Value;

/**
 * One atomic piece of page evidence: a block of text, an embedded image or a
 * rasterised page. Image content is a base64 encoded JPEG.
 *
 * <p>{@code verticalCenter} is derived from the bounding box when the element is
 * built and is the secondary ordering key after the page number.
 */
@Value
public class Element {
    ElementKind kind;
    @ToString.Exclude
    String content;
    BoundingBox boundingBox;
    int pageNumber;
    double verticalCenter;

    public Element(ElementKind kind, String content, BoundingBox boundingBox, int pageNumber) {
        this.kind = kind;
        this.content = content == null ? "" : content;
        this.boundingBox = boundingBox;
        this.pageNumber = pageNumber;
        this.verticalCenter = boundingBox.verticalCenter();
    }

    public static Element text(String text, BoundingBox boundingBox, int pageNumber) {
        return new Element(ElementKind.TEXT, text, boundingBox, pageNumber);
    }

    public static Element embeddedImage(String base64Jpeg, BoundingBox boundingBox, int pageNumber) {
        return new Element(ElementKind.EMBEDDED_IMAGE, base64Jpeg, boundingBox, pageNumber);
    }

    public static Element pageRaster(String base64Jpeg, BoundingBox boundingBox, int pageNumber) {
        return new Element(ElementKind.PAGE_RASTER_IMAGE, base64Jpeg, boundingBox, pageNumber);
    }

    public boolean isImage() {
        return kind.isImage();
    }

    public boolean isText() {
        return kind == ElementKind.TEXT;
    }
}
