package eu.virtualparadox.ragcore.rag.embed.provider;

/**
 * Closed classification of embedding provider failures, assigned once at the provider boundary.
 */
public enum EProviderError {
    RATE_LIMITED,
    SERVER_ERROR,
    CONNECTION,
    TIMEOUT,
    AUTHENTICATION,
    PERMISSION,
    INVALID_REQUEST,
    NOT_FOUND,
    MALFORMED_RESPONSE,
    UNKNOWN;

    /**
     * Maps an HTTP status of a failed provider response.
     *
     * @param status HTTP status code ({@code >= 400})
     * @return the matching classification, {@link #UNKNOWN} for anything unlisted
     */
    public static EProviderError fromHttpStatus(final int status) {
        switch (status) {
            case 429:
                return RATE_LIMITED;
            case 500:
            case 502:
            case 503:
            case 504:
                return SERVER_ERROR;
            case 401:
                return AUTHENTICATION;
            case 403:
                return PERMISSION;
            case 400:
            case 422:
                return INVALID_REQUEST;
            case 404:
                return NOT_FOUND;
            default:
                return UNKNOWN;
        }
    }
}
