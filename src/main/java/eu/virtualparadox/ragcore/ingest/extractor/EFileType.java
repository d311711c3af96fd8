package eu.virtualparadox.ragcore.ingest.extractor;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * File formats accepted for ingestion, detected by file name extension.
 */
public enum EFileType {

    /**
     * Read as UTF-8 text.
     */
    TEXT(Set.of("txt", "md", "json", "html", "htm", "csv", "xml", "yaml", "yml")),

    /**
     * Parsed with PDFBox.
     */
    PDF(Set.of("pdf"));

    private final Set<String> extensions;

    EFileType(final Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    /**
     * Detects the type of {@code fileName}. A name without extension is treated as plain text.
     *
     * @return the file type, or empty if the extension is not supported
     */
    public static Optional<EFileType> fromFileName(final String fileName) {
        final String baseName = StringUtils.substringAfterLast(fileName.replace('\\', '/'), "/");
        final String name = baseName.isEmpty() ? fileName : baseName;
        final int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.of(TEXT);
        }

        final String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (final EFileType type : values()) {
            if (type.extensions.contains(extension)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
