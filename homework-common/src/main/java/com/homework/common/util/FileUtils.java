package com.homework.common.util;

import com.homework.common.constants.FileTypes;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public final class FileUtils {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private FileUtils() {}

    public static String getFileExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot == -1 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot + 1).toLowerCase();
    }

    /**
     * File name without its last extension ("hw1.final.pdf" gives "hw1.final").
     */
    public static String getBaseName(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot <= 0) {
            return filename;
        }
        return filename.substring(0, lastDot);
    }

    /**
     * Validates file based on extension and size.
     */
    public static boolean isValidFile(String filename, long fileSizeBytes) {
        if (filename == null || filename.isEmpty()) {
            return false;
        }

        String extension = getFileExtension(filename);
        if (!FileTypes.isSupported(extension)) {
            return false;
        }

        return fileSizeBytes <= FileTypes.MAX_FILE_SIZE_BYTES;
    }

    public static String sanitizeFileName(String filename) {
        if (filename == null) {
            return "unnamed";
        }
        return filename.replaceAll("[^\\p{L}\\p{N}._-]", "_");
    }

    /**
     * Inserts a timestamp between base name and extension, used when a target name is taken.
     */
    public static String withTimestamp(String filename, LocalDateTime time) {
        if (filename == null || filename.isEmpty()) {
            return "unnamed_" + TIMESTAMP.format(time);
        }
        String base = getBaseName(filename);
        String suffix = filename.substring(base.length());
        return base + "_" + TIMESTAMP.format(time) + suffix;
    }
}
