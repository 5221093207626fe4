package pl.marcinmilkowski.word_segment.segment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_segment.config.SegmenterConfig;
import pl.marcinmilkowski.word_segment.hmm.EmissionTable;
import pl.marcinmilkowski.word_segment.hmm.HmmModel;
import pl.marcinmilkowski.word_segment.hmm.HmmSegmenter;
import pl.marcinmilkowski.word_segment.lexicon.DictionaryLoader;
import pl.marcinmilkowski.word_segment.lexicon.FrequencyLexicon;
import pl.marcinmilkowski.word_segment.lexicon.Token;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dictionary-driven Chinese word segmenter.
 *
 * For each sentence a DAG of all dictionary words starting at each position
 * is built from the lexicon, and the route maximising the sum of
 * {@code ln(frequency) - ln(total)} is taken. Runs of characters the
 * dictionary cannot explain are optionally passed to the {@link HmmSegmenter}.
 *
 * Thread safe: the lexicon handles its own locking and every cut works on
 * call-local state.
 */
public class Segmenter {

    private static final Logger logger = LoggerFactory.getLogger(Segmenter.class);

    private static final Pattern ALNUM = Pattern.compile("\\p{Alnum}");
    private static final Pattern HAN_DEFAULT = Pattern.compile("[\\p{IsHan}\\p{Alnum}+#&._]+");
    private static final Pattern SKIP_DEFAULT = Pattern.compile("\\r\\n|\\s");
    private static final Pattern HAN_CUT_ALL = Pattern.compile("\\p{IsHan}+");
    private static final Pattern SKIP_CUT_ALL = Pattern.compile("[^\\p{Alnum}+#\\n]");

    private volatile FrequencyLexicon lexicon;
    private final HmmSegmenter hmmSegmenter;
    private final int loadBatchSize;

    public Segmenter(FrequencyLexicon lexicon, HmmSegmenter hmmSegmenter) {
        this(lexicon, hmmSegmenter, FrequencyLexicon.DEFAULT_BATCH_SIZE);
    }

    public Segmenter(FrequencyLexicon lexicon, HmmSegmenter hmmSegmenter, int loadBatchSize) {
        this.lexicon = lexicon;
        this.hmmSegmenter = hmmSegmenter;
        this.loadBatchSize = loadBatchSize;
    }

    /**
     * Build a segmenter from configuration: main dictionary, user dictionaries
     * in order, and the emission table.
     */
    public static Segmenter fromConfig(SegmenterConfig config) throws IOException {
        EmissionTable emissions = EmissionTable.load(config.getEmissionTablePath());
        Segmenter segmenter = new Segmenter(new FrequencyLexicon(config.getLoadBatchSize()),
            new HmmSegmenter(new HmmModel(emissions)), config.getLoadBatchSize());
        segmenter.loadDictionary(config.getDictionaryPath());
        for (Path userDictionary : config.getUserDictionaryPaths()) {
            segmenter.loadUserDictionary(userDictionary);
        }
        logger.info("Segmenter ready: {}, {}", segmenter.lexicon, emissions);
        return segmenter;
    }

    /**
     * Replace the lexicon with the contents of a dictionary file.
     * The new lexicon becomes visible only once fully loaded.
     */
    public void loadDictionary(Path path) throws IOException {
        FrequencyLexicon fresh = new FrequencyLexicon(loadBatchSize);
        DictionaryLoader.load(fresh, path);
        this.lexicon = fresh;
    }

    /**
     * Add the words of a dictionary file to the current lexicon, overriding existing entries.
     */
    public void loadUserDictionary(Path path) throws IOException {
        DictionaryLoader.load(lexicon, path);
    }

    public void addWord(String word, double frequency) {
        lexicon.addToken(new Token(word, frequency));
    }

    /**
     * Keeps the word as a known prefix but stops it from being chosen as a word.
     */
    public void deleteWord(String word) {
        lexicon.addToken(new Token(word, 0.0));
    }

    public OptionalDouble frequency(String word) {
        return lexicon.frequency(word);
    }

    public FrequencyLexicon getLexicon() {
        return lexicon;
    }

    /**
     * Accurate mode.
     *
     * @param hmm whether runs of unknown single characters go through the HMM
     */
    public List<String> cut(String sentence, boolean hmm) {
        List<String> words = new ArrayList<>();
        for (String block : splitKeeping(HAN_DEFAULT, sentence)) {
            if (HAN_DEFAULT.matcher(block).matches()) {
                if (hmm) {
                    cutDag(block, words);
                } else {
                    cutDagNoHmm(block, words);
                }
                continue;
            }
            for (String sub : splitKeeping(SKIP_DEFAULT, block)) {
                if (SKIP_DEFAULT.matcher(sub).matches()) {
                    words.add(sub);
                    continue;
                }
                sub.codePoints().forEach(cp -> words.add(new String(Character.toChars(cp))));
            }
        }
        return words;
    }

    /**
     * Full mode: every dictionary word in the sentence, in order of start position.
     */
    public List<String> cutAll(String sentence) {
        List<String> words = new ArrayList<>();
        for (String block : splitKeeping(HAN_CUT_ALL, sentence)) {
            if (HAN_CUT_ALL.matcher(block).matches()) {
                cutAllHan(block, words);
                continue;
            }
            for (String sub : SKIP_CUT_ALL.split(block, -1)) {
                if (!sub.isEmpty()) {
                    words.add(sub);
                }
            }
        }
        return words;
    }

    /**
     * Search-engine mode: accurate mode, with each long word preceded by the
     * known shorter words inside it.
     */
    public List<String> cutForSearch(String sentence, boolean hmm) {
        List<String> words = new ArrayList<>();
        for (String word : cut(sentence, hmm)) {
            words.addAll(knownGrams(word));
            words.add(word);
        }
        return words;
    }

    /**
     * The 2- and then 3-character substrings of a word that are dictionary words,
     * in order of position. Empty for words of three characters or fewer.
     */
    public List<String> knownGrams(String word) {
        FrequencyLexicon dict = lexicon;
        List<String> grams = new ArrayList<>();
        int[] cps = word.codePoints().toArray();
        for (int gramLength = 2; gramLength <= 3; gramLength++) {
            if (cps.length <= gramLength) {
                continue;
            }
            for (int i = 0; i + gramLength <= cps.length; i++) {
                String gram = new String(cps, i, gramLength);
                OptionalDouble freq = dict.frequency(gram);
                if (freq.isPresent() && freq.getAsDouble() > 0.0) {
                    grams.add(gram);
                }
            }
        }
        return grams;
    }

    /**
     * Suggests a frequency that makes the segmenter keep the given word together
     * (single argument) or split a word into the given parts (several arguments).
     */
    public double suggestFrequency(String... words) {
        if (words.length == 0) {
            throw new IllegalArgumentException("At least one word is required");
        }
        FrequencyLexicon dict = lexicon;
        double total = dict.total();
        double frequency = 1.0;
        if (words.length > 1) {
            for (String word : words) {
                OptionalDouble freq = dict.frequency(word);
                if (freq.isPresent()) {
                    frequency *= freq.getAsDouble();
                }
                frequency /= total;
            }
            frequency = truncate(frequency * total);
            double wordFreq = dict.frequency(String.join("", words)).orElse(0.0);
            return Math.min(frequency, wordFreq);
        }

        String word = words[0];
        for (String segment : cut(word, false)) {
            OptionalDouble freq = dict.frequency(segment);
            if (freq.isPresent()) {
                frequency *= freq.getAsDouble();
            }
            frequency /= total;
        }
        frequency = truncate(frequency * total) + 1.0;
        double wordFreq = dict.frequency(word).orElse(1.0);
        return Math.max(frequency, wordFreq);
    }

    /**
     * For each start position, the end positions (inclusive) of dictionary words
     * starting there; a position with no word maps to itself.
     */
    List<List<Integer>> dag(int[] cps) {
        return dag(lexicon, cps);
    }

    private static List<List<Integer>> dag(FrequencyLexicon dict, int[] cps) {
        int n = cps.length;
        List<List<Integer>> dag = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            List<Integer> ends = new ArrayList<>();
            for (int i = k; i < n; i++) {
                OptionalDouble freq = dict.frequency(new String(cps, k, i + 1 - k));
                if (freq.isEmpty()) {
                    break;
                }
                if (freq.getAsDouble() > 0.0) {
                    ends.add(i);
                }
            }
            if (ends.isEmpty()) {
                ends.add(k);
            }
            dag.add(ends);
        }
        return dag;
    }

    /**
     * Best route from each position to the end: route[k] is the inclusive end of
     * the word chosen at k. Ties go to the longer word.
     */
    int[] route(int[] cps) {
        FrequencyLexicon dict = lexicon;
        List<List<Integer>> dag = dag(dict, cps);
        double logTotal = dict.logTotal();
        int n = cps.length;
        double[] best = new double[n + 1];
        int[] route = new int[n];
        for (int idx = n - 1; idx >= 0; idx--) {
            boolean first = true;
            for (int i : dag.get(idx)) {
                double logFreq = Math.log(dict.frequency(new String(cps, idx, i + 1 - idx)).orElse(1.0));
                double score = logFreq - logTotal + best[i + 1];
                if (first || best[idx] < score || (best[idx] == score && route[idx] < i)) {
                    best[idx] = score;
                    route[idx] = i;
                    first = false;
                }
            }
        }
        return route;
    }

    private void cutDag(String block, List<String> words) {
        int[] cps = block.codePoints().toArray();
        int[] route = route(cps);
        int bufStart = -1;
        for (int x = 0; x < cps.length; ) {
            int y = route[x] + 1;
            if (y - x == 1) {
                if (bufStart < 0) {
                    bufStart = x;
                }
            } else {
                if (bufStart >= 0) {
                    flushBuffer(cps, bufStart, x, words);
                    bufStart = -1;
                }
                words.add(new String(cps, x, y - x));
            }
            x = y;
        }
        if (bufStart >= 0) {
            flushBuffer(cps, bufStart, cps.length, words);
        }
    }

    private void flushBuffer(int[] cps, int start, int end, List<String> words) {
        String buf = new String(cps, start, end - start);
        if (end - start == 1) {
            words.add(buf);
            return;
        }
        OptionalDouble freq = lexicon.frequency(buf);
        if (freq.isEmpty() || freq.getAsDouble() == 0.0) {
            words.addAll(hmmSegmenter.cut(buf));
        } else {
            for (int i = start; i < end; i++) {
                words.add(new String(cps, i, 1));
            }
        }
    }

    private void cutDagNoHmm(String block, List<String> words) {
        int[] cps = block.codePoints().toArray();
        int[] route = route(cps);
        StringBuilder buf = new StringBuilder();
        for (int x = 0; x < cps.length; ) {
            int y = route[x] + 1;
            String frag = new String(cps, x, y - x);
            if (y - x == 1 && ALNUM.matcher(frag).matches()) {
                buf.append(frag);
                x = y;
                continue;
            }
            if (buf.length() > 0) {
                words.add(buf.toString());
                buf.setLength(0);
            }
            words.add(frag);
            x = y;
        }
        if (buf.length() > 0) {
            words.add(buf.toString());
        }
    }

    private void cutAllHan(String block, List<String> words) {
        int[] cps = block.codePoints().toArray();
        List<List<Integer>> dag = dag(cps);
        int start = -1;
        for (int k = 0; k < dag.size(); k++) {
            List<Integer> ends = dag.get(k);
            if (ends.size() == 1 && k > start) {
                words.add(new String(cps, k, ends.get(0) + 1 - k));
                start = ends.get(0);
                continue;
            }
            for (int j : ends) {
                if (j > k) {
                    words.add(new String(cps, k, j + 1 - k));
                    start = j;
                }
            }
        }
    }

    private static double truncate(double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    /**
     * Splits text around the matches of a pattern, keeping the matches; empty pieces are dropped.
     */
    static List<String> splitKeeping(Pattern pattern, String text) {
        List<String> pieces = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                pieces.add(text.substring(last, m.start()));
            }
            if (m.end() > m.start()) {
                pieces.add(m.group());
            }
            last = m.end();
        }
        if (last < text.length()) {
            pieces.add(text.substring(last));
        }
        return pieces;
    }
}
