package pl.marcinmilkowski.word_segment.hmm;

import java.util.Arrays;
import java.util.List;

/**
 * Finds the most probable B/M/E/S tag sequence for a run of characters.
 *
 * Scores are summed in log space. Only the transitions listed by
 * {@link State#prevStates()} are evaluated, and only {@link State#E} and
 * {@link State#S} may end a sequence. Equal scores resolve to the state that
 * comes later in {@link State} order, which makes the result reproducible.
 *
 * The decoder is stateless apart from its model; each call allocates its own
 * trellis, so one instance can serve any number of threads.
 */
public class ViterbiDecoder {

    private static final State[] STATES = State.values();

    private final HmmModel model;

    public ViterbiDecoder(HmmModel model) {
        this.model = model;
    }

    public DecodeResult decode(String text) {
        return decode(text.codePoints().toArray());
    }

    /**
     * Decode a sequence of Unicode code points.
     *
     * @throws IllegalArgumentException if the input is empty
     */
    public DecodeResult decode(int[] codePoints) {
        int n = codePoints.length;
        if (n == 0) {
            throw new IllegalArgumentException("Cannot decode an empty sequence");
        }

        // score[t][y]: best log-probability of any path ending in state y at t
        // back[t][y]: predecessor state ordinal on that path
        double[][] score = new double[n][STATES.length];
        int[][] back = new int[n][STATES.length];

        for (State y : STATES) {
            score[0][y.ordinal()] = model.startProbability(y) + model.emissionProbability(y, codePoints[0]);
            back[0][y.ordinal()] = -1;
        }

        for (int t = 1; t < n; t++) {
            for (State y : STATES) {
                double emit = model.emissionProbability(y, codePoints[t]);
                State best = null;
                double bestScore = 0.0;
                for (State y0 : y.prevStates()) {
                    double candidate = score[t - 1][y0.ordinal()] + model.transitionProbability(y0, y) + emit;
                    if (best == null || wins(candidate, y0, bestScore, best)) {
                        best = y0;
                        bestScore = candidate;
                    }
                }
                score[t][y.ordinal()] = bestScore;
                back[t][y.ordinal()] = best.ordinal();
            }
        }

        double[] last = score[n - 1];
        State end = wins(last[State.S.ordinal()], State.S, last[State.E.ordinal()], State.E) ? State.S : State.E;

        State[] path = new State[n];
        int current = end.ordinal();
        for (int t = n - 1; t >= 0; t--) {
            path[t] = STATES[current];
            current = back[t][current];
        }
        return new DecodeResult(last[end.ordinal()], Arrays.asList(path));
    }

    public HmmModel getModel() {
        return model;
    }

    private static boolean wins(double score, State state, double otherScore, State other) {
        if (score != otherScore) {
            return score > otherScore;
        }
        return state.compareTo(other) > 0;
    }

    /**
     * Convenience for tests and diagnostics: tags as a compact string, e.g. "BEBMES".
     */
    public static String tags(List<State> states) {
        StringBuilder sb = new StringBuilder(states.size());
        for (State state : states) {
            sb.append(state.name());
        }
        return sb.toString();
    }
}
