package pl.marcinmilkowski.word_segment.segment;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.word_segment.config.SegmenterConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Segmenter, using the test dictionary and emission table.
 */
class SegmenterTest {

    private Segmenter segmenter;

    @BeforeEach
    void setUp() throws Exception {
        segmenter = Segmenter.fromConfig(new SegmenterConfig(Path.of("src/test/resources/test-config.json")));
    }

    @Test
    @DisplayName("Accurate mode picks the most probable dictionary route")
    void testAccurate() {
        List<String> expected = List.of("我", "来到", "北京", "清华大学");
        assertEquals(expected, segmenter.cut("我来到北京清华大学", true));
        assertEquals(expected, segmenter.cut("我来到北京清华大学", false));
    }

    @Test
    @DisplayName("Unknown runs go through the HMM only when enabled")
    void testUnknownRun() {
        assertEquals(List.of("他们", "来到", "北京"), segmenter.cut("他们来到北京", true));
        assertEquals(List.of("他", "们", "来到", "北京"), segmenter.cut("他们来到北京", false));
    }

    @Test
    @DisplayName("Whitespace is kept as its own piece")
    void testWhitespace() {
        assertEquals(List.of("我", " ", "来到"), segmenter.cut("我 来到", true));
    }

    @Test
    @DisplayName("Single alphanumerics merge into one word")
    void testAlphanumericRun() {
        assertEquals(List.of("abc", "北京"), segmenter.cut("abc北京", false));
        assertEquals(List.of("abc", "北京"), segmenter.cut("abc北京", true));
    }

    @Test
    @DisplayName("Accurate mode covers the input exactly")
    void testAccurateCoverage() {
        String text = "他们, 来到北京清华大学 in 2024 年!";
        assertEquals(text, String.join("", segmenter.cut(text, true)));
        assertEquals(text, String.join("", segmenter.cut(text, false)));
    }

    @Test
    @DisplayName("Full mode lists every dictionary word")
    void testCutAll() {
        assertEquals(List.of("清华", "清华大学", "大学"), segmenter.cutAll("清华大学"));
    }

    @Test
    @DisplayName("Search mode adds the known short words inside long words")
    void testCutForSearch() {
        assertEquals(List.of("我", "来到", "北京", "清华", "大学", "清华大学"),
            segmenter.cutForSearch("我来到北京清华大学", true));
    }

    @Test
    @DisplayName("Deleted word is no longer chosen")
    void testDeleteWord() {
        segmenter.deleteWord("清华大学");

        assertEquals(0.0, segmenter.frequency("清华大学").getAsDouble());
        assertEquals(List.of("我", "来到", "北京", "清华", "大学"), segmenter.cut("我来到北京清华大学", false));
    }

    @Test
    @DisplayName("Suggested frequency keeps a new word together")
    void testSuggestFrequencyJoin() {
        double suggested = segmenter.suggestFrequency("他们");
        assertEquals(1.0, suggested);

        segmenter.addWord("他们", suggested);
        assertEquals(List.of("他们", "来到", "北京"), segmenter.cut("他们来到北京", false));
    }

    @Test
    @DisplayName("Suggested frequency for a split is capped by the joined word")
    void testSuggestFrequencySplit() {
        assertEquals(0.0, segmenter.suggestFrequency("清华", "大学"));
    }

    @Test
    @DisplayName("Cut modes dispatch to the matching method")
    void testCutModes() {
        String text = "清华大学";
        assertEquals(segmenter.cut(text, true), CutMode.ACCURATE.cut(segmenter, text));
        assertEquals(segmenter.cut(text, false), CutMode.ACCURATE_NO_HMM.cut(segmenter, text));
        assertEquals(segmenter.cutAll(text), CutMode.FULL.cut(segmenter, text));
        assertEquals(segmenter.cutForSearch(text, true), CutMode.SEARCH.cut(segmenter, text));
    }

    @Test
    @DisplayName("Reloading the main dictionary drops user words")
    void testLoadDictionaryReplaces() throws Exception {
        segmenter.addWord("他们", 3.0);
        segmenter.loadDictionary(Path.of("src/test/resources/test-dict.txt"));

        assertFalse(segmenter.frequency("他们").isPresent());
        assertEquals(69.0, segmenter.getLexicon().total(), 1e-12);
    }

    @Test
    @DisplayName("Cuts during dictionary reloads use one lexicon throughout")
    void testCutWhileReloading(@TempDir Path tempDir) throws Exception {
        Path whole = tempDir.resolve("whole.txt");
        Path split = tempDir.resolve("split.txt");
        Files.writeString(whole, "清华大学 8 nt\n", StandardCharsets.UTF_8);
        Files.writeString(split, "清华 6 nt\n大学 10 n\n", StandardCharsets.UTF_8);
        segmenter.loadDictionary(whole);
        assertEquals(List.of("清华大学"), segmenter.cut("清华大学", false));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> reloads = executor.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    segmenter.loadDictionary(i % 2 == 0 ? split : whole);
                }
                return null;
            });
            Set<List<String>> allowed = Set.of(List.of("清华大学"), List.of("清华", "大学"));
            while (!reloads.isDone()) {
                List<String> words = segmenter.cut("清华大学", false);
                assertTrue(allowed.contains(words), "mixed lexicons produced " + words);
            }
            reloads.get();
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of("清华大学"), segmenter.cut("清华大学", false));
    }
}
