package eu.virtualparadox.ragcore.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_OWNER_SCOPE = "ownerScope";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_DOC_KEY = "docKey";
    public static final String FIELD_CHUNK_REF = "chunkRef";
    public static final String FIELD_CHUNK_INDEX = "chunkIndex";
    public static final String FIELD_TOKEN_COUNT = "tokenCount";
    public static final String FIELD_TEXT = "text";
    public static final String METADATA_PREFIX = "meta.";

    private LuceneConstants() {
        // prevent instantiation
    }
}
