package org.emotion.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameSequenceTest {

    private static FrameSequence ofLength(int length, int dim) {
        double[][] frames = new double[length][dim];
        for (int i = 0; i < length; i++) {
            for (int j = 0; j < dim; j++) {
                frames[i][j] = i + 1 + j / 10.0;
            }
        }
        return new FrameSequence(frames);
    }

    @Test
    void padTo_roundsUpToNextMultiple_withZeroFrames() {
        FrameSequence s = ofLength(33, 2);
        FrameSequence padded = s.padTo(32);

        assertEquals(64, padded.length());
        assertEquals(2, padded.dim());
        for (int i = 0; i < 33; i++) {
            assertEquals(s.get(i, 1), padded.get(i, 1));
        }
        for (int i = 33; i < 64; i++) {
            assertEquals(0.0, padded.get(i, 0));
            assertEquals(0.0, padded.get(i, 1));
        }
    }

    @Test
    void padTo_alignedLength_returnsSameSequence() {
        FrameSequence s = ofLength(64, 3);
        assertSame(s, s.padTo(32));
    }

    @Test
    void padTo_isIdempotent() {
        FrameSequence once = ofLength(5, 1).padTo(32);
        assertEquals(once, once.padTo(32));
        assertEquals(32, once.length());
    }

    @Test
    void padTo_invalidMultiple_throws() {
        assertThrows(IllegalArgumentException.class, () -> ofLength(3, 1).padTo(0));
    }

    @Test
    void constructor_rejectsEmptyAndRaggedFrames() {
        assertThrows(IllegalArgumentException.class, () -> new FrameSequence(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> new FrameSequence(new double[][]{{1, 2}, {3}}));
    }

    @Test
    void ofSamples_buildsSingleChannelFrames() {
        FrameSequence s = FrameSequence.ofSamples(new float[]{0.5f, -0.25f, 0f});
        assertEquals(3, s.length());
        assertEquals(1, s.dim());
        assertEquals(-0.25, s.get(1, 0), 1e-9);
    }

    @Test
    void toArrayCopy_doesNotExposeState() {
        FrameSequence s = ofLength(2, 2);
        double[][] copy = s.toArrayCopy();
        copy[0][0] = 42;
        assertEquals(1.0, s.get(0, 0));
    }
}
