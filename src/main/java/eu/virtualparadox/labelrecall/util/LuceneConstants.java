package eu.virtualparadox.labelrecall.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_ENTRY_ID = "entryId";

    private LuceneConstants() {
        // prevent instantiation
    }
}
