package org.janelia.transients.track;

import java.io.Serializable;
import java.util.Objects;

import org.janelia.transients.spec.SkyCoordinate;

/**
 * Coarse sky grid cell used to shuffle candidates into reduce units.
 * Cells are fixed size in RA and Dec degrees, so they shrink (in true angle) towards the poles.
 */
public class SpatialPartitionKey
        implements Comparable<SpatialPartitionKey>, Serializable {

    private final int raIndex;
    private final int decIndex;

    public SpatialPartitionKey(final int raIndex,
                               final int decIndex) {
        this.raIndex = raIndex;
        this.decIndex = decIndex;
    }

    public static SpatialPartitionKey forCoordinate(final SkyCoordinate coordinate,
                                                    final double cellArcsec) {
        final double cellDegrees = cellArcsec / SkyCoordinate.ARCSEC_PER_DEGREE;
        return new SpatialPartitionKey((int) Math.floor(coordinate.getRa() / cellDegrees),
                                       (int) Math.floor((coordinate.getDec() + 90.0) / cellDegrees));
    }

    public int getRaIndex() {
        return raIndex;
    }

    public int getDecIndex() {
        return decIndex;
    }

    @Override
    public int compareTo(final SpatialPartitionKey that) {
        int result = Integer.compare(this.decIndex, that.decIndex);
        if (result == 0) {
            result = Integer.compare(this.raIndex, that.raIndex);
        }
        return result;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SpatialPartitionKey that = (SpatialPartitionKey) o;
        return raIndex == that.raIndex && decIndex == that.decIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(raIndex, decIndex);
    }

    @Override
    public String toString() {
        return "cell_" + raIndex + "_" + decIndex;
    }
}
