package eu.virtualparadox.ragcore.ingest.extractor;

import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.ingest.cleaner.TextCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Extractor for the formats listed in {@link EFileType}.
 * <p>
 * Text formats are decoded as UTF-8. PDFs are read page by page with Apache PDFBox; pages without
 * text are skipped and the remaining pages are joined by a blank line, so every page starts a new
 * paragraph for the chunker. The result passes through {@link TextCleaner}.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class DocumentTextExtractor implements TextExtractor {

    private static final String PAGE_SEPARATOR = "\n\n";

    private final TextCleaner textCleaner;

    @Override
    public String extractText(final String fileName, final byte[] content) {
        if (fileName == null || fileName.isBlank()) {
            throw new InvalidArgumentException("fileName cannot be blank");
        }
        if (content == null) {
            throw new InvalidArgumentException("content cannot be null");
        }

        final EFileType type = EFileType.fromFileName(fileName)
                .orElseThrow(() -> new InvalidArgumentException("Unsupported file type: " + fileName));

        final String raw = switch (type) {
            case TEXT -> new String(content, StandardCharsets.UTF_8);
            case PDF -> extractPdf(fileName, content);
        };

        final String text = textCleaner.cleanText(raw);
        log.debug("Extracted {} characters from {} ({})", text.length(), fileName, type);
        return text;
    }

    private String extractPdf(final String fileName, final byte[] content) {
        try (PDDocument pdf = PDDocument.load(content)) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final List<String> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = stripper.getText(pdf).strip();
                if (!pageText.isEmpty()) {
                    pages.add(pageText);
                }
            }

            if (pages.isEmpty()) {
                throw new InvalidArgumentException("No extractable text in PDF: " + fileName);
            }
            return String.join(PAGE_SEPARATOR, pages);
        } catch (final IOException e) {
            throw new InvalidArgumentException("Failed to parse PDF " + fileName + ": " + e.getMessage(), e);
        }
    }
}
