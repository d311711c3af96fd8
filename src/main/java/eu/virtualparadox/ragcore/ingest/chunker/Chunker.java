package eu.virtualparadox.ragcore.ingest.chunker;

import com.knuddels.jtokkit.api.IntArrayList;
import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.exception.InvalidConfigurationException;
import eu.virtualparadox.ragcore.ingest.model.Chunk;
import eu.virtualparadox.ragcore.ingest.tokenizer.TokenCounter;
import eu.virtualparadox.ragcore.util.CancellationSignal;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Token-bounded recursive text {@code Chunker} that produces overlapping chunks for embedding.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Separator waterfall:</strong> text that does not fit into {@code chunkSize} tokens is
 *       split on the first separator it contains, tried in the order paragraph ({@code "\n\n"}),
 *       line ({@code "\n"}) and word ({@code " "}). Text containing none of them is cut at the
 *       character level.</li>
 *   <li><strong>Packing:</strong> consecutive pieces are greedily merged back with their separator
 *       as long as the merged text stays within the segment budget: {@code chunkSize} tokens for
 *       the first chunk, {@code chunkSize - overlap} for every later one. A single piece that is
 *       too large on its own is split again with the finer separators.</li>
 *   <li><strong>Overlap prefix:</strong> every chunk after the first is prefixed with the trailing
 *       {@code overlap} tokens of the previous chunk, filling the room the budget left free. If
 *       re-tokenizing the prefixed chunk pushes it over {@code chunkSize}, the carried prefix
 *       shrinks; the limit never grows.</li>
 *   <li><strong>Character fallback:</strong> cuts the longest prefix that still fits. At least one
 *       code point is always taken, so the fallback makes progress even for {@code chunkSize == 1}.
 *       A single code point that alone encodes to more than {@code chunkSize} tokens (some emoji
 *       and rare CJK characters) therefore becomes a chunk of its own; it is the only case in which
 *       {@link Chunk#tokenCount()} exceeds {@code chunkSize}.</li>
 * </ul>
 *
 * <h2>Size Accounting</h2>
 * All sizes are measured by {@link TokenCounter} on the realized text, after trimming, so the
 * {@link Chunk#tokenCount()} stored with a chunk is the number the size decision was made on.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * The component holds only immutable configuration. For the same {@code (text, chunkSize, overlap)}
 * the output is identical, independent of locale or thread.
 */
@Component
public class Chunker {

    /**
     * Separators in the order they are tried; the character-level cut follows the last one.
     */
    private static final String[] SEPARATORS = {"\n\n", "\n", " "};

    /**
     * Joins the overlap prefix and the chunk body.
     */
    private static final String OVERLAP_JOINER = " ";

    private final TokenCounter tokenCounter;

    /**
     * Default maximum number of tokens per chunk, overlap included.
     */
    private final int chunkSize;

    /**
     * Default number of trailing tokens carried over from the previous chunk.
     */
    private final int overlap;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param tokenCounter tokenizer matching the embedding model
     * @param chunkSize    default token limit per chunk (must be {@code > 0})
     * @param overlap      default overlap in tokens (must be {@code >= 0} and {@code < chunkSize})
     * @throws InvalidConfigurationException if the defaults violate the constraints
     */
    public Chunker(final TokenCounter tokenCounter,
                   @Value("${ragcore.chunker.chunk-size:800}") final int chunkSize,
                   @Value("${ragcore.chunker.chunk-overlap:200}") final int overlap) {
        validateSizes(chunkSize, overlap);
        this.tokenCounter = tokenCounter;
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    /**
     * Splits with the configured default sizes.
     *
     * @param text input text (non-null)
     * @return ordered chunks, empty for blank input
     */
    public List<Chunk> split(final String text) {
        return split(text, chunkSize, overlap, CancellationSignal.none());
    }

    public List<Chunk> split(final String text, final int chunkSize, final int overlap) {
        return split(text, chunkSize, overlap, CancellationSignal.none());
    }

    /**
     * Splits {@code text} into token-bounded, overlapping chunks.
     *
     * @param text         input text (non-null, may be blank)
     * @param chunkSize    token limit per chunk
     * @param overlap      tokens carried over from the previous chunk
     * @param cancellation checked between splitting steps
     * @return chunks indexed {@code 0..n-1}; empty when the text has no non-whitespace content
     * @throws InvalidConfigurationException if {@code chunkSize <= 0}, {@code overlap < 0} or {@code overlap >= chunkSize}
     * @throws InvalidArgumentException      if {@code text} is null
     */
    public List<Chunk> split(final String text,
                             final int chunkSize,
                             final int overlap,
                             final CancellationSignal cancellation) {
        validateSizes(chunkSize, overlap);
        if (text == null) {
            throw new InvalidArgumentException("text cannot be null");
        }

        final List<String> segments = new ArrayList<>();
        splitRecursive(text, 0, chunkSize, overlap, cancellation, segments);
        return applyOverlap(segments, chunkSize, overlap, cancellation);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    private static void validateSizes(final int chunkSize, final int overlap) {
        if (chunkSize <= 0) {
            throw new InvalidConfigurationException("chunkSize must be positive, got " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new InvalidConfigurationException(
                    "overlap must be non-negative and less than chunkSize, got overlap=" + overlap + ", chunkSize=" + chunkSize);
        }
    }

    /**
     * Token budget of the next segment: the first may use the whole {@code chunkSize}, every
     * later one leaves {@code overlap} tokens free for the prefix carried from its predecessor.
     */
    private static int segmentBudget(final List<String> out, final int chunkSize, final int overlap) {
        return out.isEmpty() ? chunkSize : chunkSize - overlap;
    }

    /**
     * Emits size-bounded segments of {@code text} into {@code out}, trying separators from
     * {@code separatorIndex} onwards.
     */
    private void splitRecursive(final String text,
                                final int separatorIndex,
                                final int chunkSize,
                                final int overlap,
                                final CancellationSignal cancellation,
                                final List<String> out) {
        cancellation.throwIfCancelled();

        if (tokenCounter.count(text) <= segmentBudget(out, chunkSize, overlap)) {
            addIfNotBlank(out, text);
            return;
        }

        for (int i = separatorIndex; i < SEPARATORS.length; i++) {
            if (text.contains(SEPARATORS[i])) {
                final String[] pieces = StringUtils.splitByWholeSeparatorPreserveAllTokens(text, SEPARATORS[i]);
                packPieces(pieces, i, chunkSize, overlap, cancellation, out);
                return;
            }
        }

        splitCharacters(text, chunkSize, overlap, cancellation, out);
    }

    /**
     * Greedily merges consecutive pieces while the merged text fits the segment budget.
     * <p>
     * The running estimate counts each following piece together with its separator. Because
     * BPE counts are not strictly additive, the merged text is re-measured and trailing pieces
     * are handed to the next chunk until the realized count fits.
     * </p>
     */
    private void packPieces(final String[] pieces,
                            final int separatorIndex,
                            final int chunkSize,
                            final int overlap,
                            final CancellationSignal cancellation,
                            final List<String> out) {
        final String separator = SEPARATORS[separatorIndex];

        int start = 0;
        while (start < pieces.length) {
            cancellation.throwIfCancelled();

            final int budget = segmentBudget(out, chunkSize, overlap);
            int end = start + 1;
            int estimate = tokenCounter.count(pieces[start]);
            while (end < pieces.length) {
                final int next = tokenCounter.count(separator + pieces[end]);
                if (estimate + next > budget) {
                    break;
                }
                estimate += next;
                end++;
            }

            String merged = join(pieces, start, end, separator);
            while (end - start > 1 && tokenCounter.count(merged) > budget) {
                end--;
                merged = join(pieces, start, end, separator);
            }

            if (end - start == 1 && tokenCounter.count(merged) > budget) {
                // a single piece larger than the budget: descend to the finer separators
                splitRecursive(merged, separatorIndex + 1, chunkSize, overlap, cancellation, out);
            } else {
                addIfNotBlank(out, merged);
            }
            start = end;
        }
    }

    /**
     * Last resort: cuts {@code text} into the longest prefixes that fit the segment budget.
     */
    private void splitCharacters(final String text,
                                 final int chunkSize,
                                 final int overlap,
                                 final CancellationSignal cancellation,
                                 final List<String> out) {
        int start = 0;
        while (start < text.length()) {
            cancellation.throwIfCancelled();
            final int end = longestFittingEnd(text, start, segmentBudget(out, chunkSize, overlap));
            addIfNotBlank(out, text.substring(start, end));
            start = end;
        }
    }

    /**
     * Binary search for the largest {@code end} such that {@code text[start, end)} fits
     * {@code budget} tokens. The first code point is always included so the caller advances,
     * even when that code point alone encodes to more than {@code budget} tokens.
     */
    private int longestFittingEnd(final String text, final int start, final int budget) {
        final int length = text.length();
        if (tokenCounter.count(text.substring(start)) <= budget) {
            return length;
        }

        int lo = start + Character.charCount(text.codePointAt(start));
        int hi = length;
        while (hi - lo > 1) {
            final int mid = (lo + hi) >>> 1;
            if (tokenCounter.count(text.substring(start, mid)) <= budget) {
                lo = mid;
            } else {
                hi = mid;
            }
        }

        // never separate a surrogate pair
        if (lo < length && Character.isLowSurrogate(text.charAt(lo))) {
            lo = (lo - 1 > start) ? lo - 1 : lo + 1;
        }
        return lo;
    }

    /**
     * Prefixes each segment after the first with the tail of its predecessor and assigns indices.
     */
    private List<Chunk> applyOverlap(final List<String> segments,
                                     final int chunkSize,
                                     final int overlap,
                                     final CancellationSignal cancellation) {
        final List<Chunk> chunks = new ArrayList<>(segments.size());

        String previous = null;
        for (final String segment : segments) {
            cancellation.throwIfCancelled();

            final String text = (previous != null && overlap > 0)
                    ? withOverlap(previous, segment, chunkSize, overlap)
                    : segment;
            chunks.add(new Chunk(chunks.size(), text, tokenCounter.count(text)));
            previous = text;
        }
        return chunks;
    }

    /**
     * Builds {@code tail(previous) + " " + body} with the largest tail of at most {@code overlap}
     * tokens for which the result still fits {@code chunkSize}.
     *
     * @return the prefixed body, or {@code body} unchanged if no tail fits
     */
    private String withOverlap(final String previous,
                               final String body,
                               final int chunkSize,
                               final int overlap) {
        final IntArrayList previousTokens = tokenCounter.encode(previous);
        final int room = chunkSize - tokenCounter.count(body);

        for (int carry = Math.min(Math.min(overlap, previousTokens.size()), room); carry > 0; carry--) {
            final String tail = tokenCounter.decodeTail(previousTokens, carry);
            if (!previous.endsWith(tail)) {
                // the cut fell inside a multi-byte character
                continue;
            }
            final String prefix = tail.strip();
            if (prefix.isEmpty()) {
                return body;
            }
            final String candidate = prefix + OVERLAP_JOINER + body;
            if (tokenCounter.count(candidate) <= chunkSize) {
                return candidate;
            }
        }
        return body;
    }

    private static String join(final String[] pieces, final int from, final int to, final String separator) {
        final StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (i > from) {
                sb.append(separator);
            }
            sb.append(pieces[i]);
        }
        return sb.toString();
    }

    private static void addIfNotBlank(final List<String> out, final String segment) {
        final String stripped = segment.strip();
        if (!stripped.isEmpty()) {
            out.add(stripped);
        }
    }
}
