package org.janelia.transients.detect;

/**
 * Pixel neighborhoods for connected component labeling.
 */
public enum Connectivity {

    /** Horizontal and vertical neighbors only. */
    FOUR(new int[][] { {1, 0}, {-1, 0}, {0, 1}, {0, -1} }),

    /** Horizontal, vertical, and diagonal neighbors. */
    EIGHT(new int[][] { {1, 0}, {-1, 0}, {0, 1}, {0, -1}, {1, 1}, {1, -1}, {-1, 1}, {-1, -1} });

    private final int[][] offsets;

    Connectivity(final int[][] offsets) {
        this.offsets = offsets;
    }

    /**
     * @return { dx, dy } offsets of all neighbors.
     */
    public int[][] getOffsets() {
        return offsets;
    }
}
