package eu.virtualparadox.ragcore.ingest.extractor;

public interface TextExtractor {

    /**
     * Extracts cleaned plain text from the raw bytes of a file.
     *
     * @param fileName original file name, used to detect the format
     * @param content  raw file content
     * @return cleaned text, possibly empty for text files without content
     * @throws eu.virtualparadox.ragcore.exception.InvalidArgumentException if the format is not
     *                                                                      supported or the file cannot be parsed
     */
    String extractText(final String fileName, final byte[] content);

}
