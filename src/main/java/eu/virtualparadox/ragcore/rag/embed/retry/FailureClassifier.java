package eu.virtualparadox.ragcore.rag.embed.retry;

import eu.virtualparadox.ragcore.rag.embed.provider.EProviderError;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Table deciding which provider failures are worth another attempt.
 * <p>Rate limits and transient server or network conditions are retryable; everything that
 * would fail the same way again (credentials, request shape, unknown errors) is fatal.</p>
 */
@Component
public class FailureClassifier {

    private static final Map<EProviderError, EFailureDisposition> TABLE = buildTable();

    private static Map<EProviderError, EFailureDisposition> buildTable() {
        final Map<EProviderError, EFailureDisposition> table = new EnumMap<>(EProviderError.class);
        for (final EProviderError error : EProviderError.values()) {
            table.put(error, dispositionOf(error));
        }
        return Collections.unmodifiableMap(table);
    }

    private static EFailureDisposition dispositionOf(final EProviderError error) {
        switch (error) {
            case RATE_LIMITED:
            case SERVER_ERROR:
            case CONNECTION:
            case TIMEOUT:
                return EFailureDisposition.RETRYABLE;
            case AUTHENTICATION:
            case PERMISSION:
            case INVALID_REQUEST:
            case NOT_FOUND:
            case MALFORMED_RESPONSE:
            case UNKNOWN:
                return EFailureDisposition.FATAL;
            default:
                throw new IllegalStateException("Unclassified provider error: " + error);
        }
    }

    public EFailureDisposition classify(final EProviderError error) {
        return error == null ? EFailureDisposition.FATAL : TABLE.get(error);
    }

    public boolean isRetryable(final EProviderError error) {
        return classify(error) == EFailureDisposition.RETRYABLE;
    }
}
