package fr.lapetina.ocr.scheduler.pipeline;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Page counting with PDFBox.
 */
public final class PdfInspector {

    private static final Logger log = LoggerFactory.getLogger(PdfInspector.class);

    /**
     * Counts the pages of a PDF.
     *
     * @return the page count, or empty for non-PDF inputs and unreadable documents
     */
    public OptionalInt pageCount(Path input) {
        if (!isPdf(input)) {
            return OptionalInt.empty();
        }
        try (PDDocument document = Loader.loadPDF(input.toFile())) {
            return OptionalInt.of(document.getNumberOfPages());
        } catch (IOException e) {
            log.warn("Page count unavailable: file={}, error={}", input.getFileName(), e.getMessage());
            return OptionalInt.empty();
        }
    }

    static boolean isPdf(Path input) {
        return input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
