package com.homework.core.service;

import com.homework.core.exception.DocumentBusyException;
import com.homework.core.exception.UnsupportedFileTypeException;
import com.homework.core.model.Element;
import com.homework.core.model.PipelineResult;
import com.homework.core.processor.ElementExtractor;
import com.homework.core.processor.ElementExtractorFactory;
import com.homework.core.support.Elements;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link HomeworkProcessingService}.
 */
@ExtendWith(MockitoExtension.class)
class HomeworkProcessingServiceTest {

    @Mock private ElementExtractorFactory extractorFactory;
    @Mock private ElementExtractor extractor;
    @Mock private HomeworkPipeline pipeline;

    private DocumentRunGuard runGuard;
    private HomeworkProcessingService service;

    @BeforeEach
    void setUp() {
        runGuard = new DocumentRunGuard();
        service = new HomeworkProcessingService(extractorFactory, pipeline, runGuard);
    }

    private static InputStream input() {
        return new ByteArrayInputStream(new byte[] {1, 2, 3});
    }

    @Test
    void shouldRunPipelineOnExtractedElements_andReleaseGuard() {
        List<Element> elements = List.of(Elements.text("1. a", 1));
        PipelineResult expected = PipelineResult.success(1, List.of());
        when(extractorFactory.getExtractor("pdf")).thenReturn(extractor);
        when(extractor.extract(any())).thenReturn(elements);
        when(pipeline.run(elements)).thenReturn(expected);

        PipelineResult result = service.process("hw.pdf", input(), "pdf");

        assertThat(result).isSameAs(expected);
        assertThat(runGuard.isRunning("hw.pdf")).isFalse();
    }

    @Test
    void shouldThrowBusy_whenDocumentIsAlreadyRunning() {
        when(extractorFactory.getExtractor("pdf")).thenReturn(extractor);
        runGuard.tryAcquire("hw.pdf");

        assertThatThrownBy(() -> service.process("hw.pdf", input(), "pdf"))
            .isInstanceOf(DocumentBusyException.class);
        verify(pipeline, never()).run(any());
        assertThat(runGuard.isRunning("hw.pdf")).isTrue();
    }

    @Test
    void shouldNotTakeGuard_whenFileTypeIsUnsupported() {
        when(extractorFactory.getExtractor("docx")).thenThrow(new UnsupportedFileTypeException("docx"));

        assertThatThrownBy(() -> service.process("hw.docx", input(), "docx"))
            .isInstanceOf(UnsupportedFileTypeException.class);
        assertThat(runGuard.inFlightCount()).isZero();
    }

    @Test
    void shouldReleaseGuard_whenPipelineThrows() {
        when(extractorFactory.getExtractor("pdf")).thenReturn(extractor);
        when(extractor.extract(any())).thenReturn(List.of());
        when(pipeline.run(any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.process("hw.pdf", input(), "pdf")).isInstanceOf(IllegalStateException.class);
        assertThat(runGuard.isRunning("hw.pdf")).isFalse();
    }
}
