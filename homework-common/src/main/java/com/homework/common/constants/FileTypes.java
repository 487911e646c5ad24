package com.homework.common.constants;

import java.util.Set;

public final class FileTypes {
    public static final Set<String> IMAGE_TYPES = Set.of("png", "jpg", "jpeg", "bmp");

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
        "pdf", "png", "jpg", "jpeg", "bmp"
    );

    public static final String JPEG_MIME_TYPE = "image/jpeg";

    public static final long MAX_FILE_SIZE_BYTES = 50 * 1024 * 1024; // 50MB

    private FileTypes() {}

    public static boolean isSupported(String extension) {
        return extension != null && SUPPORTED_EXTENSIONS.contains(extension.toLowerCase());
    }
}
