package pl.marcinmilkowski.word_segment.lucene;

import org.apache.lucene.analysis.Analyzer;
import pl.marcinmilkowski.word_segment.config.SegmenterConfig;
import pl.marcinmilkowski.word_segment.segment.CutMode;
import pl.marcinmilkowski.word_segment.segment.Segmenter;

/**
 * Analyzer over {@link SegmentingTokenizer}, with no token filters.
 */
public class SegmentingAnalyzer extends Analyzer {

    private final Segmenter segmenter;
    private final CutMode mode;

    public SegmentingAnalyzer(Segmenter segmenter, CutMode mode) {
        this.segmenter = segmenter;
        this.mode = mode;
    }

    /**
     * Accurate mode, with or without the HMM as the config says.
     */
    public static SegmentingAnalyzer forConfig(Segmenter segmenter, SegmenterConfig config) {
        return new SegmentingAnalyzer(segmenter, config.isHmmEnabled() ? CutMode.ACCURATE : CutMode.ACCURATE_NO_HMM);
    }

    public CutMode getMode() {
        return mode;
    }

    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
        return new TokenStreamComponents(new SegmentingTokenizer(segmenter, mode));
    }
}
