package eu.virtualparadox.labelrecall.ingest.parser;

/**
 * A rejected input line.
 *
 * @param lineNumber 1-based line number in the source
 * @param line       the raw line
 * @param reason     why it was rejected
 */
public record MalformedRecord(int lineNumber, String line, String reason) {

    public String asString() {
        return "line " + lineNumber + ": " + reason + " [" + line + "]";
    }
}
