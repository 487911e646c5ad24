package com.homework.llm.model;

import com.homework.common.constants.FileTypes;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One turn of an oracle request: either plain text or an inlined, base64 encoded image.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContentPart {

    public enum Type {
        TEXT,
        IMAGE
    }

    Type type;
    String text;
    String mimeType;
    String data;

    public static ContentPart text(String text) {
        return new ContentPart(Type.TEXT, text == null ? "" : text, null, null);
    }

    public static ContentPart image(String base64Data, String mimeType) {
        return new ContentPart(Type.IMAGE, null, mimeType, base64Data);
    }

    public static ContentPart jpeg(String base64Data) {
        return image(base64Data, FileTypes.JPEG_MIME_TYPE);
    }

    public boolean isImage() {
        return type == Type.IMAGE;
    }
}
