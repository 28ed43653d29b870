package com.example.keyseq_backend.model;

/**
 * Event x frame similarity scores. Rows follow the event list, columns follow the frame list the
 * matrix was computed for.
 */
public final class SimilarityMatrix {

    private final double[][] values;
    private final int frameCount;

    private SimilarityMatrix(double[][] values, int frameCount) {
        this.values = values;
        this.frameCount = frameCount;
    }

    public static SimilarityMatrix of(double[][] values) {
        int frames = values.length == 0 ? 0 : values[0].length;
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != frames) {
                throw new IllegalArgumentException("ragged similarity matrix at row " + i);
            }
            copy[i] = values[i].clone();
        }
        return new SimilarityMatrix(copy, frames);
    }

    public static SimilarityMatrix empty(int eventCount) {
        return new SimilarityMatrix(new double[eventCount][0], 0);
    }

    public int eventCount() {
        return values.length;
    }

    public int frameCount() {
        return frameCount;
    }

    public double get(int eventIndex, int frameIndex) {
        return values[eventIndex][frameIndex];
    }

    /**
     * Whether a score exists for the given cell.
     */
    public boolean covers(int eventIndex, int frameIndex) {
        return eventIndex >= 0 && eventIndex < values.length && frameIndex >= 0 && frameIndex < frameCount;
    }
}
