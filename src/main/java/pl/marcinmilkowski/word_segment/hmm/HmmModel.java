package pl.marcinmilkowski.word_segment.hmm;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Parameters of the four-state boundary model: start and transition
 * log-probabilities (fixed, from the reference jieba model) plus an injected
 * emission table.
 *
 * Immutable and shared across decode calls.
 */
public final class HmmModel {

    /** Log-probability used for impossible events. Finite, so sums stay well-defined. */
    public static final double MIN_FLOAT = -3.14e100;

    private static final Map<State, Double> PROB_START = new EnumMap<>(Map.of(
        State.B, -0.26268660809250016,
        State.E, MIN_FLOAT,
        State.M, MIN_FLOAT,
        State.S, -1.4652633398537678
    ));

    private static final double[][] PROB_TRANS = new double[State.values().length][State.values().length];

    static {
        for (double[] row : PROB_TRANS) {
            Arrays.fill(row, MIN_FLOAT);
        }
        trans(State.B, State.E, -0.510825623765990);
        trans(State.B, State.M, -0.916290731874155);
        trans(State.E, State.B, -0.5897149736854513);
        trans(State.E, State.S, -0.8085250474669937);
        trans(State.M, State.E, -0.33344856811948514);
        trans(State.M, State.M, -1.2603623820268226);
        trans(State.S, State.B, -0.7211965654669841);
        trans(State.S, State.S, -0.6658631448798212);
    }

    private static void trans(State from, State to, double logProbability) {
        PROB_TRANS[from.ordinal()][to.ordinal()] = logProbability;
    }

    private final EmissionTable emissions;

    public HmmModel(EmissionTable emissions) {
        if (emissions == null) {
            throw new IllegalArgumentException("Emission table is required");
        }
        this.emissions = emissions;
    }

    /**
     * Log-probability that a sequence starts in {@code state}.
     */
    public double startProbability(State state) {
        return PROB_START.get(state);
    }

    /**
     * Log-probability of moving from {@code from} to {@code to}; {@link #MIN_FLOAT} if not allowed.
     */
    public double transitionProbability(State from, State to) {
        return PROB_TRANS[from.ordinal()][to.ordinal()];
    }

    public double emissionProbability(State state, int codePoint) {
        return emissions.logProbability(state, codePoint);
    }

    public EmissionTable getEmissions() {
        return emissions;
    }
}
