package org.janelia.transients.detect;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ConnectedComponentLabeler} class.
 */
public class ConnectedComponentLabelerTest {

    @Test
    public void testDiagonalNeighbors() {

        final int width = 4;
        final boolean[] mask = buildMask(width, 4, new int[][] { {1, 1}, {2, 2} });

        final List<int[]> fourConnected = new ConnectedComponentLabeler(Connectivity.FOUR).label(mask, width, 4);
        Assert.assertEquals("diagonal pixels should be separate with 4-connectivity", 2, fourConnected.size());

        final List<int[]> eightConnected = new ConnectedComponentLabeler(Connectivity.EIGHT).label(mask, width, 4);
        Assert.assertEquals("diagonal pixels should be joined with 8-connectivity", 1, eightConnected.size());
        Assert.assertArrayEquals("bad component pixels", new int[] { 5, 10 }, eightConnected.get(0));
    }

    @Test
    public void testOnePixelGap() {

        final int width = 5;
        final boolean[] mask = buildMask(width, 3, new int[][] { {0, 1}, {2, 1}, {4, 1} });

        for (final Connectivity connectivity : Connectivity.values()) {
            final List<int[]> components = new ConnectedComponentLabeler(connectivity).label(mask, width, 3);
            Assert.assertEquals("gap should separate pixels with " + connectivity, 3, components.size());
        }
    }

    @Test
    public void testComponentOrderAndShape() {

        final int width = 6;
        // U shape that is only joined at the bottom, plus a single pixel scanned earlier
        final boolean[] mask = buildMask(width, 5, new int[][] {
                {5, 0},
                {1, 1}, {3, 1},
                {1, 2}, {3, 2},
                {1, 3}, {2, 3}, {3, 3}
        });

        final List<int[]> components = new ConnectedComponentLabeler(Connectivity.FOUR).label(mask, width, 5);

        Assert.assertEquals("bad component count", 2, components.size());
        Assert.assertArrayEquals("first component should hold first scanned pixel",
                                 new int[] { 5 }, components.get(0));
        Assert.assertArrayEquals("U shape should be one sorted component",
                                 new int[] { 7, 9, 13, 15, 19, 20, 21 }, components.get(1));
    }

    @Test
    public void testLargeComponent() {
        final int width = 300;
        final int height = 300;
        final boolean[] mask = new boolean[width * height];
        Arrays.fill(mask, true);

        final List<int[]> components = new ConnectedComponentLabeler(Connectivity.EIGHT).label(mask, width, height);
        Assert.assertEquals("bad component count", 1, components.size());
        Assert.assertEquals("bad component size", width * height, components.get(0).length);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMaskSizeMismatch() {
        new ConnectedComponentLabeler(Connectivity.FOUR).label(new boolean[10], 3, 3);
    }

    private static boolean[] buildMask(final int width,
                                       final int height,
                                       final int[][] flaggedPixels) {
        final boolean[] mask = new boolean[width * height];
        for (final int[] pixel : flaggedPixels) {
            mask[(pixel[1] * width) + pixel[0]] = true;
        }
        return mask;
    }
}
