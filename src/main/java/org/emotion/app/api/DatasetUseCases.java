package org.emotion.app.api;

import org.emotion.model.Dataset;
import org.emotion.model.FrameSequence;
import org.emotion.model.Vector;

import java.nio.file.Path;

/**
 * Entry points for building datasets, one per source granularity.
 * Every method either returns a complete dataset or throws a
 * {@link org.emotion.error.DatasetBuildException}.
 */
public interface DatasetUseCases {

    /** One feature vector per utterance, from a text or packed attribute file. */
    Dataset<Vector> loadUtterances(Path file);

    /**
     * Frame-level attribute file regrouped into one sequence per utterance. Frames are
     * normalized before grouping.
     */
    Dataset<FrameSequence> loadFrames(Path file);

    /** One feature vector per utterance, from a gridded-array file, sorted by name. */
    Dataset<Vector> loadGridded(Path file, String corpusId);

    /** Raw waveforms from a file list; not normalized. */
    Dataset<FrameSequence> loadRaw(Path fileList, String corpusId);
}
