package pl.marcinmilkowski.word_segment.lexicon;

/**
 * A single dictionary record: a word with its corpus frequency and an
 * optional part-of-speech tag.
 *
 * Produced by {@link DictionaryReader}, one per input line, and consumed by
 * {@link FrequencyLexicon}. Immutable.
 */
public record Token(
    String text,               // The word itself, never empty
    double frequency,          // Raw frequency, 0 when the record has none
    String partOfSpeech        // Tag such as "ns" or "n", may be null
) {

    public Token {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Token text must not be empty");
        }
        if (frequency < 0 || Double.isNaN(frequency)) {
            throw new IllegalArgumentException("Token frequency must be non-negative: " + frequency);
        }
    }

    public Token(String text, double frequency) {
        this(text, frequency, null);
    }

    /**
     * Number of Unicode code points in the word.
     */
    public int length() {
        return text.codePointCount(0, text.length());
    }

    @Override
    public String toString() {
        return partOfSpeech != null
            ? String.format("%s %s %s", text, frequency, partOfSpeech)
            : String.format("%s %s", text, frequency);
    }
}
