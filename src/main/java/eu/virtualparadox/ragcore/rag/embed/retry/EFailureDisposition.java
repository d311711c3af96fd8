package eu.virtualparadox.ragcore.rag.embed.retry;

public enum EFailureDisposition {
    RETRYABLE,
    FATAL
}
