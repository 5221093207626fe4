package pl.marcinmilkowski.word_segment.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Segments text using only the HMM, without a dictionary.
 *
 * Runs of Han characters are decoded and split at the predicted word
 * boundaries. Everything else is split into numbers (including decimals),
 * alphanumeric runs and the text between them. The pieces always
 * concatenate back to the input.
 */
public class HmmSegmenter {

    private static final Logger logger = LoggerFactory.getLogger(HmmSegmenter.class);

    private static final Pattern HAN = Pattern.compile("\\p{IsHan}+");
    private static final Pattern SKIP = Pattern.compile("\\d+\\.\\d+|[a-zA-Z0-9]+");

    private final ViterbiDecoder decoder;

    public HmmSegmenter(HmmModel model) {
        this(new ViterbiDecoder(model));
    }

    public HmmSegmenter(ViterbiDecoder decoder) {
        this.decoder = decoder;
    }

    public List<String> cut(String sentence) {
        List<String> words = new ArrayList<>();
        Matcher han = HAN.matcher(sentence);
        int last = 0;
        while (han.find()) {
            cutOther(sentence.substring(last, han.start()), words);
            cutHan(han.group(), words);
            last = han.end();
        }
        cutOther(sentence.substring(last), words);
        return words;
    }

    private void cutHan(String block, List<String> words) {
        int[] codePoints = block.codePoints().toArray();
        DecodeResult result = decoder.decode(codePoints);
        if (logger.isTraceEnabled()) {
            logger.trace("{} -> {}", block, result);
        }
        words.addAll(SegmentExtractor.extractWords(codePoints, result.states()));
    }

    private static void cutOther(String block, List<String> words) {
        if (block.isEmpty()) {
            return;
        }
        Matcher skip = SKIP.matcher(block);
        int last = 0;
        while (skip.find()) {
            if (skip.start() > last) {
                words.add(block.substring(last, skip.start()));
            }
            words.add(skip.group());
            last = skip.end();
        }
        if (last < block.length()) {
            words.add(block.substring(last));
        }
    }

    public ViterbiDecoder getDecoder() {
        return decoder;
    }
}
