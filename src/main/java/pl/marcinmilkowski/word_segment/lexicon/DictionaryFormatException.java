package pl.marcinmilkowski.word_segment.lexicon;

import java.io.IOException;

/**
 * Thrown when a dictionary record cannot be parsed.
 */
public class DictionaryFormatException extends IOException {

    private final long lineNumber;

    public DictionaryFormatException(long lineNumber, String line, Throwable cause) {
        super("Malformed dictionary record at line " + lineNumber + ": '" + line + "'", cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based number of the offending line.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
