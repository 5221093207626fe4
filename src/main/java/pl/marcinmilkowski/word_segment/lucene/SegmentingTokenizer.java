package pl.marcinmilkowski.word_segment.lucene;

import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import pl.marcinmilkowski.word_segment.segment.CutMode;
import pl.marcinmilkowski.word_segment.segment.Segmenter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A Tokenizer that emits the words produced by a {@link Segmenter}.
 *
 * The whole input is read on {@link #reset()} and segmented in one go. Each
 * word is emitted with:
 * - Its text as the term
 * - Position increment 1, or 0 for a search-mode word inside the previous word
 * - Start/end offsets into the original input, never decreasing
 * Whitespace-only words are not emitted.
 */
public final class SegmentingTokenizer extends Tokenizer {

    private final CharTermAttribute termAttr = addAttribute(CharTermAttribute.class);
    private final PositionIncrementAttribute posIncrAttr = addAttribute(PositionIncrementAttribute.class);
    private final OffsetAttribute offsetAttr = addAttribute(OffsetAttribute.class);

    private final Segmenter segmenter;
    private final CutMode mode;

    private int textLength;
    private List<Span> spans = List.of();
    private int current;

    public SegmentingTokenizer(Segmenter segmenter, CutMode mode) {
        this.segmenter = segmenter;
        this.mode = mode;
    }

    @Override
    public boolean incrementToken() throws IOException {
        clearAttributes();

        if (current >= spans.size()) {
            return false;
        }

        Span span = spans.get(current++);
        termAttr.setEmpty().append(span.word());
        posIncrAttr.setPositionIncrement(span.positionIncrement());
        offsetAttr.setOffset(correctOffset(span.start()), correctOffset(span.end()));
        return true;
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[4096];
        int read;
        while ((read = input.read(buffer)) != -1) {
            sb.append(buffer, 0, read);
        }
        String text = sb.toString();
        textLength = text.length();
        spans = switch (mode) {
            case ACCURATE, ACCURATE_NO_HMM -> contiguous(mode.cut(segmenter, text));
            case FULL -> located(text, segmenter.cutAll(text));
            case SEARCH -> withGrams(segmenter.cut(text, true));
        };
        current = 0;
    }

    @Override
    public void end() throws IOException {
        super.end();
        int finalOffset = correctOffset(textLength);
        offsetAttr.setOffset(finalOffset, finalOffset);
    }

    @Override
    public void close() throws IOException {
        super.close();
        spans = List.of();
    }

    // Accurate-mode words tile the input exactly.
    private static List<Span> contiguous(List<String> words) {
        List<Span> result = new ArrayList<>(words.size());
        int offset = 0;
        for (String word : words) {
            addIfNotBlank(result, word, offset);
            offset += word.length();
        }
        return result;
    }

    // Full-mode words overlap but come in order of start position.
    private static List<Span> located(String text, List<String> words) {
        List<Span> result = new ArrayList<>(words.size());
        int from = 0;
        for (String word : words) {
            int start = text.indexOf(word, from);
            if (start < 0) {
                continue;
            }
            addIfNotBlank(result, word, start);
            from = start;
        }
        return result;
    }

    // Each word is followed by the known words inside it, stacked on its position.
    private List<Span> withGrams(List<String> words) {
        List<Span> result = new ArrayList<>();
        int offset = 0;
        for (String word : words) {
            addIfNotBlank(result, word, offset);
            List<Span> grams = new ArrayList<>();
            Map<Integer, Integer> nextByLength = new HashMap<>();
            for (String gram : segmenter.knownGrams(word)) {
                int cpLength = gram.codePointCount(0, gram.length());
                int at = word.indexOf(gram, nextByLength.getOrDefault(cpLength, 0));
                nextByLength.put(cpLength, at + 1);
                grams.add(new Span(gram, offset + at, offset + at + gram.length(), 0));
            }
            grams.sort(Comparator.comparingInt(Span::start));
            result.addAll(grams);
            offset += word.length();
        }
        return result;
    }

    private static void addIfNotBlank(List<Span> spans, String word, int start) {
        if (!word.isBlank()) {
            spans.add(new Span(word, start, start + word.length(), 1));
        }
    }

    private record Span(String word, int start, int end, int positionIncrement) {
    }
}
