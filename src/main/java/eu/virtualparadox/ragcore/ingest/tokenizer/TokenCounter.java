package eu.virtualparadox.ragcore.ingest.tokenizer;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import eu.virtualparadox.ragcore.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Counts and slices text in the BPE tokens the embedding model sees.
 * <p>Chunk sizing and the persisted {@code tokenCount} both go through this class, so the two
 * numbers always agree.</p>
 */
@Slf4j
@Component
public class TokenCounter {

    private final Encoding encoding;

    /**
     * @param encodingName JTokkit encoding name, e.g. {@code o200k_base} or {@code cl100k_base}
     * @throws InvalidConfigurationException if the encoding is unknown
     */
    public TokenCounter(@Value("${ragcore.tokenizer.encoding:o200k_base}") final String encodingName) {
        final EncodingType type = EncodingType.fromName(encodingName)
                .orElseThrow(() -> new InvalidConfigurationException("Unknown tokenizer encoding: " + encodingName));
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(type);
        log.info("Using tokenizer encoding {}", type.getName());
    }

    public int count(final String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }

    public IntArrayList encode(final String text) {
        return encoding.encode(text);
    }

    /**
     * Decodes the last {@code n} tokens of {@code tokens}.
     *
     * @param tokens encoded text
     * @param n      number of trailing tokens, clamped to {@code [0, tokens.size()]}
     * @return decoded suffix (may contain replacement characters when {@code n} cuts a multi-byte character)
     */
    public String decodeTail(final IntArrayList tokens, final int n) {
        final int size = tokens.size();
        final int take = Math.max(0, Math.min(n, size));
        final IntArrayList tail = new IntArrayList(take);
        for (int i = size - take; i < size; i++) {
            tail.add(tokens.get(i));
        }
        return encoding.decode(tail);
    }
}
