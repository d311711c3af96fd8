package eu.virtualparadox.ragcore.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

@Component
public class TextCleaner {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\u2060\\uFEFF]");
    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\x0B\\f \\u00A0\\u2000-\\u200A\\u202F\\u205F\\u3000]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    /**
     * Cleans extracted text by removing control characters and zero-width spaces and normalizing
     * whitespace while keeping diacritics and the paragraph structure.
     * <p>
     * The result is NFC-normalized, uses {@code \n} line endings, has no runs of horizontal
     * whitespace and at most one blank line between paragraphs.
     * </p>
     *
     * @param input raw text
     * @return cleaned text, empty for {@code null} input
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        String text = Normalizer.normalize(input, Normalizer.Form.NFC);
        text = LINE_BREAKS.matcher(text).replaceAll("\n");
        // zero-width and soft hyphen → remove
        text = ZERO_WIDTH.matcher(text).replaceAll("");
        text = text.replace("\u00AD", "");
        // other format chars → SPACE
        text = FORMAT_CHARS.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
        text = SPACE_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}
