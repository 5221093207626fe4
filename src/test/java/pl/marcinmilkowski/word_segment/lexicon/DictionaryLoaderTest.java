package pl.marcinmilkowski.word_segment.lexicon;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DictionaryLoader.
 */
class DictionaryLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Load dictionary file into lexicon")
    void testLoadFile() throws Exception {
        FrequencyLexicon lexicon = new FrequencyLexicon();
        long loaded = DictionaryLoader.load(lexicon, Path.of("src/test/resources/test-dict.txt"));

        assertEquals(10, loaded);
        assertEquals(69.0, lexicon.total(), 1e-12);
        assertEquals(10.0, lexicon.frequency("我").getAsDouble());
        assertEquals(0.0, lexicon.frequency("清华大").getAsDouble());
    }

    @Test
    @DisplayName("Missing file is reported")
    void testMissingFile() {
        FrequencyLexicon lexicon = new FrequencyLexicon();
        assertThrows(FileNotFoundException.class,
            () -> DictionaryLoader.load(lexicon, tempDir.resolve("nope.txt")));
    }

    @Test
    @DisplayName("Malformed record fails the load but keeps earlier records")
    void testPartialLoad() throws Exception {
        Path dict = tempDir.resolve("dict.txt");
        Files.writeString(dict, "北京 20 ns\n大学 10 n\n清华 many ns\n来到 5 v\n", StandardCharsets.UTF_8);

        FrequencyLexicon lexicon = new FrequencyLexicon(1);
        DictionaryFormatException e = assertThrows(DictionaryFormatException.class,
            () -> DictionaryLoader.load(lexicon, dict));

        assertEquals(3, e.getLineNumber());
        assertTrue(lexicon.contains("北京"));
        assertTrue(lexicon.contains("大学"));
        assertFalse(lexicon.contains("来到"));
        assertEquals(30.0, lexicon.total(), 1e-12);
        assertEquals(Math.log(30.0), lexicon.logTotal(), 1e-12);
    }

    @Test
    @DisplayName("Blank and space-only lines between records are skipped")
    void testBlankLinesInDictionary() throws Exception {
        FrequencyLexicon lexicon = new FrequencyLexicon(2);
        long loaded = DictionaryLoader.load(lexicon,
            new StringReader("北京 3 ns\n \n\n   \n大学 2 n\n\t\n来到 1\n"), "inline");

        assertEquals(3, loaded);
        assertEquals(3.0, lexicon.frequency("北京").getAsDouble());
        assertEquals(2.0, lexicon.frequency("大学").getAsDouble());
        assertEquals(1.0, lexicon.frequency("来到").getAsDouble());
        assertEquals(6.0, lexicon.total(), 1e-12);
    }
}
