package eu.virtualparadox.labelrecall.ingest.cleaner;

import org.springframework.stereotype.Component;

/**
 * Normalizes raw record text before it reaches the encoder, so the corpus side and the
 * query side see identical character sequences for identical content.
 */
@Component
public class TextCleaner {

    /**
     * Cleans text by removing control characters, zero-width spaces,
     * and normalizing whitespace while keeping diacritics and CJK characters.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, empty for {@code null} input
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return input
                // line breaks -> space
                .replaceAll("[\\r\\n]+", " ")
                // zero-width and similar -> SPACE
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // full-width space -> SPACE
                .replace('\u3000', ' ')
                // non-breaking space -> SPACE
                .replace('\u00A0', ' ')
                // soft hyphen -> remove
                .replace("\u00AD", "")
                // other format chars -> SPACE
                .replaceAll("\\p{Cf}", " ")
                // tabs are field delimiters, never content
                .replace('\t', ' ')
                // remaining control chars -> remove
                .replaceAll("\\p{Cc}", "")
                // collapse multiple whitespace -> single space
                .replaceAll("\\s+", " ")
                .trim();
    }
}
