package com.homework.core.processor.impl;

import com.homework.common.constants.FileTypes;
import com.homework.core.model.BoundingBox;
import com.homework.core.model.Element;
import com.homework.core.processor.ElementExtractor;
import com.homework.core.processor.ImageCompressor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * A scanned page photo becomes a single page raster on page 1.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageElementExtractor implements ElementExtractor {

    private final ImageCompressor imageCompressor;

    @Override
    public boolean supports(String fileType) {
        return fileType != null && FileTypes.IMAGE_TYPES.contains(fileType.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<Element> extract(InputStream inputStream) {
        try {
            BufferedImage image = ImageIO.read(inputStream);
            if (image == null) {
                log.error("Image extraction failed: no registered reader understands the input");
                return List.of();
            }
            ImageCompressor.CompressedImage compressed = imageCompressor.compress(image);
            log.info("Image page extracted | width={} | height={}", compressed.getWidth(), compressed.getHeight());
            return List.of(Element.pageRaster(compressed.getBase64(),
                BoundingBox.ofSize(compressed.getWidth(), compressed.getHeight()), 1));
        } catch (IOException e) {
            log.error("Image extraction failed", e);
            return List.of();
        }
    }
}
