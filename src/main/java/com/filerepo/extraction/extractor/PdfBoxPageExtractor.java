package com.filerepo.extraction.extractor;

import com.filerepo.extraction.exception.CorruptDocumentException;
import com.filerepo.extraction.exception.UnsupportedFormatException;
import com.filerepo.extraction.model.PageImage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Renders every page of a PDF to PNG. Rendering is sequential: a {@link PDDocument} is not thread-safe.
 */
@Slf4j
@Component
public class PdfBoxPageExtractor implements PageExtractor {

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final int HEADER_SCAN_LIMIT = 1024;

    private final float dpi;

    public PdfBoxPageExtractor(@Value("${app.extraction.render-dpi:200}") float dpi) {
        this.dpi = dpi;
    }

    @Override
    public List<PageImage> extractPages(byte[] documentBytes) {
        if (documentBytes == null || documentBytes.length == 0) {
            return List.of();
        }
        if (!hasPdfHeader(documentBytes)) {
            throw new UnsupportedFormatException("Only PDF documents are supported for page indexing");
        }

        try (PDDocument document = Loader.loadPDF(documentBytes)) {
            int pageCount = document.getNumberOfPages();
            log.debug("Rendering {} pages at {} dpi", pageCount, dpi);

            PDFRenderer renderer = new PDFRenderer(document);
            List<PageImage> pages = new ArrayList<>(pageCount);
            for (int index = 0; index < pageCount; index++) {
                BufferedImage image = renderer.renderImageWithDPI(index, dpi, ImageType.RGB);
                pages.add(new PageImage(index + 1, toPng(image)));
            }
            return pages;
        } catch (InvalidPasswordException e) {
            throw new UnsupportedFormatException("Encrypted PDF documents are not supported", e);
        } catch (IOException e) {
            throw new CorruptDocumentException("Failed to process PDF: " + e.getMessage(), e);
        }
    }

    // the header may be preceded by junk bytes, which readers tolerate within the first kilobyte
    private static boolean hasPdfHeader(byte[] bytes) {
        int limit = Math.min(bytes.length, HEADER_SCAN_LIMIT) - PDF_MAGIC.length;
        for (int offset = 0; offset <= limit; offset++) {
            if (Arrays.equals(bytes, offset, offset + PDF_MAGIC.length, PDF_MAGIC, 0, PDF_MAGIC.length)) {
                return true;
            }
        }
        return false;
    }

    private static byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
