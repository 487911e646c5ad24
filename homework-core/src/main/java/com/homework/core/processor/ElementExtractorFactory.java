package com.homework.core.processor;

import com.homework.core.config.HomeworkProperties;
import com.homework.core.exception.UnsupportedFileTypeException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ElementExtractorFactory {

    private final List<ElementExtractor> extractors;
    private final HomeworkProperties properties;

    public ElementExtractor getExtractor(String fileType) {
        if (!properties.isSupportedFormat(fileType)) {
            throw new UnsupportedFileTypeException(fileType);
        }
        return extractors.stream()
            .filter(e -> e.supports(fileType))
            .findFirst()
            .orElseThrow(() -> new UnsupportedFileTypeException(fileType));
    }
}
