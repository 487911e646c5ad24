package com.homework.core.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Pipeline and folder settings bound from {@code homework.*}. Built once at startup
 * and handed to every component through its constructor.
 */
@ConfigurationProperties(prefix = "homework")
@Getter
public class HomeworkProperties {

    private final Path folder;
    private final String resultsFolder;
    private final String processingFolder;
    private final List<String> supportedFormats;
    private final int imageMaxSize;
    private final int imageQuality;
    private final int answerParallelism;
    private final Duration inboxSettleDelay;

    public HomeworkProperties(
            @DefaultValue("./homework") Path folder,
            @DefaultValue("results") String resultsFolder,
            @DefaultValue("processing") String processingFolder,
            @DefaultValue({"pdf", "png", "jpg", "jpeg"}) List<String> supportedFormats,
            @DefaultValue("512") int imageMaxSize,
            @DefaultValue("80") int imageQuality,
            @DefaultValue("1") int answerParallelism,
            @DefaultValue("2s") Duration inboxSettleDelay) {
        this.folder = folder;
        this.resultsFolder = resultsFolder;
        this.processingFolder = processingFolder;
        this.supportedFormats = supportedFormats.stream()
            .map(format -> format.toLowerCase(Locale.ROOT))
            .toList();
        this.imageMaxSize = imageMaxSize;
        this.imageQuality = Math.min(100, Math.max(1, imageQuality));
        this.answerParallelism = Math.max(1, answerParallelism);
        this.inboxSettleDelay = inboxSettleDelay;
    }

    public static HomeworkProperties defaults(Path folder) {
        return new HomeworkProperties(folder, "results", "processing",
            List.of("pdf", "png", "jpg", "jpeg"), 512, 80, 1, Duration.ofSeconds(2));
    }

    public Path getResultsPath() {
        return folder.resolve(resultsFolder);
    }

    public Path getProcessingPath() {
        return folder.resolve(processingFolder);
    }

    public boolean isSupportedFormat(String extension) {
        return extension != null && supportedFormats.contains(extension.toLowerCase(Locale.ROOT));
    }
}
