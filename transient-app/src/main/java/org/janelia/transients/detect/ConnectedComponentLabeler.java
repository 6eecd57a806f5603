package org.janelia.transients.detect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Groups flagged pixels of a row-major mask into connected components.
 * Components are returned in the order of their first pixel in a row-major scan,
 * and each component's pixel indexes are sorted, so results are deterministic.
 */
public class ConnectedComponentLabeler {

    private final Connectivity connectivity;

    public ConnectedComponentLabeler(final Connectivity connectivity) {
        this.connectivity = connectivity;
    }

    /**
     * @param  mask    row-major flags, true for pixels to group.
     * @param  width   mask width.
     * @param  height  mask height.
     *
     * @return list of components, each an array of row-major pixel indexes.
     */
    public List<int[]> label(final boolean[] mask,
                             final int width,
                             final int height) {

        if (mask.length != width * height) {
            throw new IllegalArgumentException("mask length " + mask.length + " does not match " +
                                               width + "x" + height);
        }

        final int[][] offsets = connectivity.getOffsets();
        final boolean[] visited = new boolean[mask.length];
        final int[] stack = new int[mask.length];
        final List<int[]> components = new ArrayList<>();

        for (int start = 0; start < mask.length; start++) {

            if ((! mask[start]) || visited[start]) {
                continue;
            }

            int[] component = new int[16];
            int componentSize = 0;
            int stackSize = 0;

            stack[stackSize++] = start;
            visited[start] = true;

            while (stackSize > 0) {
                final int index = stack[--stackSize];
                if (componentSize == component.length) {
                    component = Arrays.copyOf(component, component.length * 2);
                }
                component[componentSize++] = index;

                final int x = index % width;
                final int y = index / width;
                for (final int[] offset : offsets) {
                    final int nx = x + offset[0];
                    final int ny = y + offset[1];
                    if ((nx >= 0) && (ny >= 0) && (nx < width) && (ny < height)) {
                        final int neighbor = (ny * width) + nx;
                        if (mask[neighbor] && (! visited[neighbor])) {
                            visited[neighbor] = true;
                            stack[stackSize++] = neighbor;
                        }
                    }
                }
            }

            component = Arrays.copyOf(component, componentSize);
            Arrays.sort(component);
            components.add(component);
        }

        return components;
    }
}
