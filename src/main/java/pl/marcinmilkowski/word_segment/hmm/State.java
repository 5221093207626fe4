package pl.marcinmilkowski.word_segment.hmm;

import java.util.List;

/**
 * Word-boundary tags of the four-state segmentation model.
 *
 * Declaration order is identifier order (B &lt; E &lt; M &lt; S); the decoder
 * breaks score ties in favour of the later constant.
 */
public enum State {
    /** First character of a multi-character word. */
    B,
    /** Last character of a multi-character word. */
    E,
    /** Inner character of a word of three or more characters. */
    M,
    /** Single-character word. */
    S;

    /**
     * States allowed to precede this one.
     */
    public List<State> prevStates() {
        return switch (this) {
            case B -> List.of(E, S);
            case M -> List.of(M, B);
            case S -> List.of(S, E);
            case E -> List.of(B, M);
        };
    }

    /**
     * Whether a sequence may end in this state.
     */
    public boolean isTerminal() {
        return this == E || this == S;
    }
}
