package pl.marcinmilkowski.word_segment.hmm;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a decoded tag sequence back into words.
 *
 * B starts a word, M continues it, E closes it and S is a word by itself.
 * A word left open at the end of the input is emitted as is, so the words
 * always concatenate to the original text.
 */
public final class SegmentExtractor {

    private SegmentExtractor() {
    }

    /**
     * @throws IllegalArgumentException if the sequences differ in length
     */
    public static List<String> extractWords(int[] codePoints, List<State> states) {
        if (codePoints.length != states.size()) {
            throw new IllegalArgumentException(String.format(
                "Input has %d characters but %d states", codePoints.length, states.size()));
        }

        List<String> words = new ArrayList<>();
        int begin = 0;
        int next = 0;
        for (int i = 0; i < codePoints.length; i++) {
            switch (states.get(i)) {
                case B -> begin = i;
                case E -> {
                    words.add(new String(codePoints, begin, i + 1 - begin));
                    next = i + 1;
                }
                case S -> {
                    words.add(new String(codePoints, i, 1));
                    next = i + 1;
                }
                case M -> {
                }
            }
        }
        if (next < codePoints.length) {
            words.add(new String(codePoints, next, codePoints.length - next));
        }
        return words;
    }

    public static List<String> extractWords(String text, DecodeResult result) {
        return extractWords(text.codePoints().toArray(), result.states());
    }
}
