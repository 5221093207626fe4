package pl.marcinmilkowski.word_segment.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Feeds dictionary files into a {@link FrequencyLexicon}.
 *
 * Loading is streamed: records are parsed as the lexicon consumes them. A
 * malformed record stops the load with a {@link DictionaryFormatException};
 * everything before it stays in the lexicon.
 */
public final class DictionaryLoader {

    private static final Logger logger = LoggerFactory.getLogger(DictionaryLoader.class);

    private DictionaryLoader() {
    }

    /**
     * Loads a UTF-8 dictionary file. Relative paths resolve against the working directory.
     *
     * @return number of tokens loaded
     * @throws IOException if the file is missing, unreadable or malformed
     */
    public static long load(FrequencyLexicon lexicon, Path path) throws IOException {
        Path resolved = path.toAbsolutePath().normalize();
        if (!Files.exists(resolved)) {
            throw new FileNotFoundException("Dictionary file not found: " + resolved);
        }
        try (Reader reader = Files.newBufferedReader(resolved, StandardCharsets.UTF_8)) {
            return load(lexicon, reader, resolved.toString());
        }
    }

    /**
     * Loads dictionary records from a reader. The reader is not closed.
     *
     * @param sourceName used in log messages only
     * @return number of tokens loaded
     */
    public static long load(FrequencyLexicon lexicon, Reader reader, String sourceName) throws IOException {
        long start = System.currentTimeMillis();
        DictionaryReader records = new DictionaryReader(reader);
        long loaded;
        try {
            loaded = lexicon.load(records.iterator());
        } catch (UncheckedIOException e) {
            logger.warn("Dictionary load from {} stopped after {} lines: {}",
                sourceName, records.getLineNumber(), e.getCause().getMessage());
            throw e.getCause();
        }
        logger.info("Loaded {} tokens from {} in {} ms (lexicon: {} entries, total={})",
            loaded, sourceName, System.currentTimeMillis() - start, lexicon.size(), lexicon.total());
        return loaded;
    }
}
