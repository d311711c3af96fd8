package eu.virtualparadox.ragcore.rag.embed.retry;

/**
 * Phases of one batch call: {@code ATTEMPTING -> SUCCEEDED}, or
 * {@code ATTEMPTING -> RETRYING -> ATTEMPTING -> ... -> EXHAUSTED | FAILED}.
 */
public enum ERetryPhase {
    ATTEMPTING,
    RETRYING,
    SUCCEEDED,
    EXHAUSTED,
    FAILED
}
