package com.homework.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ElementKind {
    TEXT("text", false),
    EMBEDDED_IMAGE("image", true),
    PAGE_RASTER_IMAGE("page image", true);

    private final String label;
    private final boolean image;
}
