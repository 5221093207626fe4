package pl.marcinmilkowski.word_segment.lexicon;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Streaming parser for line-oriented dictionary files.
 *
 * Each line holds {@code word[ frequency[ partOfSpeech]]} separated by single
 * spaces. A byte-order mark in the word field is dropped, blank lines are
 * skipped and a missing frequency reads as 0.
 *
 * Records are parsed on demand by {@link #iterator()}, so a large dictionary
 * is never buffered in memory. Read and format errors surface from the
 * iterator as {@link UncheckedIOException}; the wrapped cause is a
 * {@link DictionaryFormatException} for a bad frequency field.
 */
public class DictionaryReader implements Closeable, Iterable<Token> {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final BufferedReader reader;
    private long lineNumber = 0;
    private boolean iterated = false;

    public DictionaryReader(Reader reader) {
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    }

    /**
     * Parses one dictionary line.
     *
     * @return the token, or null for a blank line
     * @throws DictionaryFormatException if the frequency field is not a number
     */
    public static Token parseLine(String line, long lineNumber) throws DictionaryFormatException {
        if (line.isBlank()) {
            return null;
        }
        String[] fields = line.split(" ");
        String text = fields[0].replace(String.valueOf(BYTE_ORDER_MARK), "").trim();
        if (text.isEmpty()) {
            return null;
        }

        double frequency = 0.0;
        String pos = null;
        if (fields.length > 1) {
            try {
                frequency = Double.parseDouble(fields[1]);
            } catch (NumberFormatException e) {
                throw new DictionaryFormatException(lineNumber, line, e);
            }
            if (frequency < 0 || Double.isNaN(frequency)) {
                throw new DictionaryFormatException(lineNumber, line,
                    new IllegalArgumentException("negative frequency"));
            }
            if (fields.length > 2) {
                pos = fields[2].trim();
            }
        }
        return new Token(text, frequency, pos);
    }

    /**
     * Returns the single-use token iterator over the remaining input.
     */
    @Override
    public Iterator<Token> iterator() {
        if (iterated) {
            throw new IllegalStateException("DictionaryReader can only be iterated once");
        }
        iterated = true;
        return new TokenIterator();
    }

    /**
     * Number of lines consumed so far.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private final class TokenIterator implements Iterator<Token> {
        private Token next;
        private boolean done;

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (done) return false;
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    next = parseLine(line, lineNumber);
                    if (next != null) {
                        return true;
                    }
                }
            } catch (IOException e) {
                done = true;
                throw new UncheckedIOException(e);
            }
            done = true;
            return false;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token token = next;
            next = null;
            return token;
        }
    }
}
