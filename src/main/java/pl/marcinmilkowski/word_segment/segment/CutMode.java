package pl.marcinmilkowski.word_segment.segment;

import java.util.List;

/**
 * Segmentation strategies offered by {@link Segmenter}.
 */
public enum CutMode {
    /** Maximum-probability dictionary path, unknown runs handed to the HMM. */
    ACCURATE,
    /** Maximum-probability dictionary path only. */
    ACCURATE_NO_HMM,
    /** Every dictionary word found in the text, overlapping. */
    FULL,
    /** Accurate mode plus the known 2- and 3-character words inside long words. */
    SEARCH;

    public List<String> cut(Segmenter segmenter, String text) {
        return switch (this) {
            case ACCURATE -> segmenter.cut(text, true);
            case ACCURATE_NO_HMM -> segmenter.cut(text, false);
            case FULL -> segmenter.cutAll(text);
            case SEARCH -> segmenter.cutForSearch(text, true);
        };
    }
}
