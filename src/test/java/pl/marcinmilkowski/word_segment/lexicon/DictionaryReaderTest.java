package pl.marcinmilkowski.word_segment.lexicon;

import org.junit.jupiter.api.*;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DictionaryReader.
 */
class DictionaryReaderTest {

    @Test
    @DisplayName("Full record yields word, frequency and tag")
    void testFullRecord() throws Exception {
        Token token = DictionaryReader.parseLine("北京 0.03 ns", 1);

        assertEquals("北京", token.text());
        assertEquals(0.03, token.frequency());
        assertEquals("ns", token.partOfSpeech());
    }

    @Test
    @DisplayName("Frequency and tag are optional")
    void testOptionalFields() throws Exception {
        Token wordOnly = DictionaryReader.parseLine("石墨烯", 1);
        assertEquals(0.0, wordOnly.frequency());
        assertNull(wordOnly.partOfSpeech());

        Token noTag = DictionaryReader.parseLine("石墨烯 42", 2);
        assertEquals(42.0, noTag.frequency());
        assertNull(noTag.partOfSpeech());
    }

    @Test
    @DisplayName("Byte-order mark is stripped from the word")
    void testByteOrderMark() throws Exception {
        Token token = DictionaryReader.parseLine("\uFEFF我 10 r", 1);
        assertEquals("我", token.text());
    }

    @Test
    @DisplayName("Blank lines parse to null")
    void testBlankLine() throws Exception {
        assertNull(DictionaryReader.parseLine("", 1));
        assertNull(DictionaryReader.parseLine("   ", 1));
        assertNull(DictionaryReader.parseLine(" \t ", 1));
    }

    @Test
    @DisplayName("Unparsable frequency reports the line number")
    void testMalformedFrequency() {
        DictionaryFormatException e = assertThrows(DictionaryFormatException.class,
            () -> DictionaryReader.parseLine("北京 lots ns", 7));
        assertEquals(7, e.getLineNumber());
        assertTrue(e.getMessage().contains("北京 lots ns"));
    }

    @Test
    @DisplayName("Negative frequency is malformed")
    void testNegativeFrequency() {
        assertThrows(DictionaryFormatException.class, () -> DictionaryReader.parseLine("北京 -1", 1));
    }

    @Test
    @DisplayName("Iterator yields records lazily, skipping blank lines")
    void testIteration() {
        DictionaryReader reader = new DictionaryReader(new StringReader("我 10 r\n\n来到 5 v\n北京 20 ns\n"));
        List<Token> tokens = new ArrayList<>();
        reader.forEach(tokens::add);

        assertEquals(3, tokens.size());
        assertEquals("来到", tokens.get(1).text());
        assertEquals(4, reader.getLineNumber());
    }

    @Test
    @DisplayName("Iterator stops at the malformed record")
    void testIterationFailure() {
        DictionaryReader reader = new DictionaryReader(new StringReader("我 10\n来到 x\n北京 20\n"));
        Iterator<Token> it = reader.iterator();

        assertEquals("我", it.next().text());
        UncheckedIOException e = assertThrows(UncheckedIOException.class, it::next);
        assertInstanceOf(DictionaryFormatException.class, e.getCause());
        assertEquals(2, ((DictionaryFormatException) e.getCause()).getLineNumber());
    }

    @Test
    @DisplayName("A reader can only be iterated once")
    void testSingleUse() {
        DictionaryReader reader = new DictionaryReader(new StringReader("我 10\n"));
        reader.iterator();
        assertThrows(IllegalStateException.class, reader::iterator);
    }
}
