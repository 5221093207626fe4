package pl.marcinmilkowski.word_segment.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe word frequency dictionary.
 *
 * Maps each known word to its frequency and keeps two derived values used for
 * scoring: the sum of all inserted frequencies and its natural logarithm.
 * Every proper prefix of an inserted word is also stored (with frequency 0
 * unless it is a word in its own right) so that DAG construction can tell a
 * partial match from a dead end.
 *
 * Lookups take a shared lock; insertions take the exclusive lock and update
 * the map, the prefixes and both totals before releasing it, so readers never
 * see a word without its prefixes or a total out of step with its logarithm.
 * Words are never removed.
 */
public class FrequencyLexicon {

    private static final Logger logger = LoggerFactory.getLogger(FrequencyLexicon.class);

    public static final int DEFAULT_BATCH_SIZE = 10_000;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Double> frequencies = new HashMap<>();
    private final int batchSize;
    private double total = 0.0;
    private double logTotal = Math.log(0.0);

    public FrequencyLexicon() {
        this(DEFAULT_BATCH_SIZE);
    }

    /**
     * @param batchSize number of tokens applied per write-lock acquisition in {@link #load(Iterator)}
     */
    public FrequencyLexicon(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    /**
     * Inserts or overwrites a word, adds its missing prefixes and updates the totals.
     */
    public void addToken(Token token) {
        lock.writeLock().lock();
        try {
            put(token);
            logTotal = Math.log(total);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Loads all tokens from a lazily produced sequence.
     *
     * Tokens are applied in batches; the logarithm of the total is recomputed
     * once per batch, before the write lock is released. If the iterator
     * throws, the tokens applied so far stay in the lexicon and the exception
     * propagates.
     *
     * @return number of tokens applied
     */
    public long load(Iterator<Token> tokens) {
        long loaded = 0;
        while (tokens.hasNext()) {
            int inBatch = 0;
            lock.writeLock().lock();
            try {
                while (inBatch < batchSize && tokens.hasNext()) {
                    put(tokens.next());
                    inBatch++;
                }
            } finally {
                logTotal = Math.log(total);
                lock.writeLock().unlock();
            }
            loaded += inBatch;
            logger.debug("Applied batch of {} tokens ({} so far)", inBatch, loaded);
        }
        return loaded;
    }

    public long load(Iterable<Token> tokens) {
        return load(tokens.iterator());
    }

    /**
     * Gets the stored frequency of a word.
     *
     * @return the frequency, or empty if the word is neither a word nor a prefix of one
     */
    public OptionalDouble frequency(String word) {
        lock.readLock().lock();
        try {
            Double value = frequencies.get(word);
            return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String word) {
        lock.readLock().lock();
        try {
            return frequencies.containsKey(word);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sum of all inserted frequencies.
     */
    public double total() {
        lock.readLock().lock();
        try {
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Natural logarithm of {@link #total()}; negative infinity while empty.
     */
    public double logTotal() {
        lock.readLock().lock();
        try {
            return logTotal;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Both totals read under one lock acquisition.
     */
    public Totals totals() {
        lock.readLock().lock();
        try {
            return new Totals(total, logTotal);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of stored keys, prefixes included.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return frequencies.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock.
    private void put(Token token) {
        String text = token.text();
        frequencies.put(text, token.frequency());
        total += token.frequency();
        int end = text.offsetByCodePoints(0, 1);
        while (end < text.length()) {
            frequencies.putIfAbsent(text.substring(0, end), 0.0);
            end = text.offsetByCodePoints(end, 1);
        }
    }

    /**
     * Consistent view of the lexicon's aggregate frequency.
     */
    public record Totals(double total, double logTotal) {
    }

    @Override
    public String toString() {
        return String.format("FrequencyLexicon[%d entries, total=%.1f]", size(), total());
    }
}
