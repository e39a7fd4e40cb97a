package eu.virtualparadox.labelrecall.ingest.parser;

import java.util.List;

/**
 * Outcome of loading a record file: the accepted records and the rejected lines.
 */
public record ParseResult<T>(List<T> records, List<MalformedRecord> malformed) {

    public ParseResult {
        records = List.copyOf(records);
        malformed = List.copyOf(malformed);
    }

    public int malformedCount() {
        return malformed.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
