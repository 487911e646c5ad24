package com.homework.core.processor.impl;

import com.homework.core.model.BoundingBox;
import com.homework.core.model.Element;
import com.homework.core.processor.ElementExtractor;
import com.homework.core.processor.ImageCompressor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts page elements from a PDF.
 *
 * <p>Per page: one text element with a page-sized box when the page has text, one
 * embedded image element per drawn image with its placement box, and a page
 * raster at twice the nominal resolution when the page draws no images.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfElementExtractor implements ElementExtractor {

    private static final float RASTER_DPI = 144f;

    private final ImageCompressor imageCompressor;

    @Override
    public boolean supports(String fileType) {
        return "pdf".equalsIgnoreCase(fileType);
    }

    @Override
    public List<Element> extract(InputStream inputStream) {
        try (PDDocument document = Loader.loadPDF(inputStream.readAllBytes())) {
            List<Element> elements = new ArrayList<>();
            PDFTextStripper stripper = new PDFTextStripper();
            PDFRenderer renderer = new PDFRenderer(document);
            int totalPages = document.getNumberOfPages();

            for (int pageNumber = 1; pageNumber <= totalPages; pageNumber++) {
                PDPage page = document.getPage(pageNumber - 1);
                PDRectangle box = page.getCropBox();

                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                String pageText = stripper.getText(document);
                if (pageText != null && !pageText.isBlank()) {
                    elements.add(Element.text(pageText.trim(), BoundingBox.ofSize(box.getWidth(), box.getHeight()), pageNumber));
                } else {
                    log.warn("[PDF] No text on page {}", pageNumber);
                }

                ImagePlacementCollector collector = new ImagePlacementCollector(box.getHeight());
                collector.processPage(page);
                for (PlacedImage placed : collector.getPlacements()) {
                    try {
                        ImageCompressor.CompressedImage compressed = imageCompressor.compress(placed.getImage().getImage());
                        elements.add(Element.embeddedImage(compressed.getBase64(), placed.getBoundingBox(), pageNumber));
                    } catch (IOException | RuntimeException e) {
                        log.warn("[PDF] Skipping unreadable image on page {}: {}", pageNumber, e.getMessage());
                    }
                }

                if (collector.getPlacements().isEmpty()) {
                    BufferedImage raster = renderer.renderImageWithDPI(pageNumber - 1, RASTER_DPI, ImageType.RGB);
                    ImageCompressor.CompressedImage compressed = imageCompressor.compress(raster);
                    elements.add(Element.pageRaster(compressed.getBase64(), BoundingBox.ofSize(box.getWidth(), box.getHeight()), pageNumber));
                }

                log.info("[PDF] Page {} processed | images={}", pageNumber, collector.getPlacements().size());
            }

            log.info("[PDF] Extraction complete | pages={} | elements={}", totalPages, elements.size());
            return elements;
        } catch (IOException | RuntimeException e) {
            log.error("[PDF] Extraction failed", e);
            return List.of();
        }
    }

    @lombok.Value
    private static class PlacedImage {
        PDImageXObject image;
        BoundingBox boundingBox;
    }

    /**
     * Walks a page content stream and records every image draw with the box it is
     * painted into, converted to a top-left origin.
     */
    private static final class ImagePlacementCollector extends PDFStreamEngine {

        private final float pageHeight;
        private final List<PlacedImage> placements = new ArrayList<>();

        ImagePlacementCollector(float pageHeight) {
            this.pageHeight = pageHeight;
            addOperator(new Concatenate(this));
            addOperator(new Save(this));
            addOperator(new Restore(this));
            addOperator(new DrawObject(this));
        }

        List<PlacedImage> getPlacements() {
            return placements;
        }

        void record(PDImageXObject image, Matrix ctm) {
            float width = Math.abs(ctm.getScalingFactorX());
            float height = Math.abs(ctm.getScalingFactorY());
            float left = ctm.getTranslateX();
            float bottom = ctm.getTranslateY();
            placements.add(new PlacedImage(image,
                new BoundingBox(left, pageHeight - (bottom + height), left + width, pageHeight - bottom)));
        }

        /** Handles the "Do" operator for images and nested forms. */
        private static final class DrawObject extends OperatorProcessor {

            private final ImagePlacementCollector collector;

            DrawObject(ImagePlacementCollector collector) {
                super(collector);
                this.collector = collector;
            }

            @Override
            public void process(Operator operator, List<COSBase> operands) throws IOException {
                if (operands.isEmpty() || !(operands.get(0) instanceof COSName)) {
                    return;
                }
                PDXObject xObject = collector.getResources().getXObject((COSName) operands.get(0));
                if (xObject instanceof PDImageXObject) {
                    collector.record((PDImageXObject) xObject, collector.getGraphicsState().getCurrentTransformationMatrix());
                } else if (xObject instanceof PDFormXObject) {
                    collector.showForm((PDFormXObject) xObject);
                }
            }

            @Override
            public String getName() {
                return OperatorName.DRAW_OBJECT;
            }
        }
    }
}
