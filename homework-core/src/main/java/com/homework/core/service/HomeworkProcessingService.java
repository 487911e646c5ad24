package com.homework.core.service;

import com.homework.core.exception.DocumentBusyException;
import com.homework.core.model.Element;
import com.homework.core.model.PipelineResult;
import com.homework.core.processor.ElementExtractor;
import com.homework.core.processor.ElementExtractorFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class HomeworkProcessingService {

    private final ElementExtractorFactory extractorFactory;
    private final HomeworkPipeline pipeline;
    private final DocumentRunGuard runGuard;

    /**
     * Processes one document under the run guard.
     *
     * @throws DocumentBusyException when a run for {@code documentId} is already in flight
     * @throws com.homework.core.exception.UnsupportedFileTypeException when no extractor handles {@code fileType}
     */
    public PipelineResult process(String documentId, InputStream inputStream, String fileType) {
        ElementExtractor extractor = extractorFactory.getExtractor(fileType);
        if (!runGuard.tryAcquire(documentId)) {
            throw new DocumentBusyException(documentId);
        }
        try {
            log.info("[PROCESS] Processing document | documentId={} | fileType={}", documentId, fileType);
            return runExtracted(extractor, inputStream);
        } finally {
            runGuard.release(documentId);
        }
    }

    /**
     * Processes a document without taking the run guard; the caller holds it.
     */
    public PipelineResult extractAndRun(InputStream inputStream, String fileType) {
        return runExtracted(extractorFactory.getExtractor(fileType), inputStream);
    }

    private PipelineResult runExtracted(ElementExtractor extractor, InputStream inputStream) {
        List<Element> elements = extractor.extract(inputStream);
        log.info("[PROCESS] Extraction complete | elements={}", elements.size());
        return pipeline.run(elements);
    }
}
