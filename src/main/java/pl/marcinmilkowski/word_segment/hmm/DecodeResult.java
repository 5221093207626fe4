package pl.marcinmilkowski.word_segment.hmm;

import java.util.List;

/**
 * Outcome of a Viterbi decode: the best path's log-probability and its state
 * sequence, one state per input character.
 */
public record DecodeResult(
    double score,
    List<State> states
) {

    public DecodeResult {
        states = List.copyOf(states);
    }

    public int size() {
        return states.size();
    }

    @Override
    public String toString() {
        return String.format("DecodeResult[%s score=%.4f]", ViterbiDecoder.tags(states), score);
    }
}
