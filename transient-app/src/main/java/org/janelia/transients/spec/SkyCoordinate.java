package org.janelia.transients.spec;

import java.io.Serializable;
import java.util.Objects;

/**
 * Equatorial sky coordinate in degrees.
 * Right ascension is normalized to [0, 360) and declination must lie within [-90, 90].
 */
public class SkyCoordinate
        implements Serializable {

    public static final double ARCSEC_PER_DEGREE = 3600.0;

    private final double ra;
    private final double dec;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SkyCoordinate() {
        this.ra = 0.0;
        this.dec = 0.0;
    }

    /**
     * @param  ra   right ascension in degrees (any value, will be normalized).
     * @param  dec  declination in degrees.
     *
     * @throws IllegalArgumentException
     *   if either value is not finite or the declination is outside [-90, 90].
     */
    public SkyCoordinate(final double ra,
                         final double dec)
            throws IllegalArgumentException {

        if (! (Double.isFinite(ra) && Double.isFinite(dec))) {
            throw new IllegalArgumentException("coordinate values must be finite, ra=" + ra + ", dec=" + dec);
        }
        if ((dec < -90.0) || (dec > 90.0)) {
            throw new IllegalArgumentException("dec " + dec + " must be between -90 and 90");
        }

        double normalizedRa = ra % 360.0;
        if (normalizedRa < 0) {
            normalizedRa += 360.0;
        }
        // tiny negative values round up to 360
        if (normalizedRa >= 360.0) {
            normalizedRa = 0.0;
        }

        this.ra = normalizedRa;
        this.dec = dec;
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    /**
     * @return angular separation between this coordinate and the other in arcseconds,
     *         computed with the Vincenty formula which is stable at both small and large separations.
     */
    public double separationArcsec(final SkyCoordinate other) {
        final double ra1 = Math.toRadians(ra);
        final double dec1 = Math.toRadians(dec);
        final double ra2 = Math.toRadians(other.ra);
        final double dec2 = Math.toRadians(other.dec);

        final double deltaRa = ra2 - ra1;
        final double sinDec1 = Math.sin(dec1);
        final double cosDec1 = Math.cos(dec1);
        final double sinDec2 = Math.sin(dec2);
        final double cosDec2 = Math.cos(dec2);
        final double cosDeltaRa = Math.cos(deltaRa);

        final double a = cosDec2 * Math.sin(deltaRa);
        final double b = (cosDec1 * sinDec2) - (sinDec1 * cosDec2 * cosDeltaRa);
        final double numerator = Math.sqrt((a * a) + (b * b));
        final double denominator = (sinDec1 * sinDec2) + (cosDec1 * cosDec2 * cosDeltaRa);

        return Math.toDegrees(Math.atan2(numerator, denominator)) * ARCSEC_PER_DEGREE;
    }

    /**
     * @return cartesian unit vector { x, y, z } for this coordinate.
     */
    public double[] toUnitVector() {
        final double raRadians = Math.toRadians(ra);
        final double decRadians = Math.toRadians(dec);
        final double cosDec = Math.cos(decRadians);
        return new double[] { cosDec * Math.cos(raRadians), cosDec * Math.sin(raRadians), Math.sin(decRadians) };
    }

    /**
     * @return coordinate for the direction of the specified (not necessarily unit length) vector.
     *
     * @throws IllegalArgumentException
     *   if the vector has zero length.
     */
    public static SkyCoordinate fromVector(final double x,
                                           final double y,
                                           final double z)
            throws IllegalArgumentException {
        final double xy = Math.sqrt((x * x) + (y * y));
        if ((xy == 0.0) && (z == 0.0)) {
            throw new IllegalArgumentException("cannot derive coordinate from zero length vector");
        }
        final double ra = Math.toDegrees(Math.atan2(y, x));
        final double dec = Math.toDegrees(Math.atan2(z, xy));
        return new SkyCoordinate(ra, dec);
    }

    /**
     * @return coordinate offset from this one by the specified tangent plane distances.
     *         Only accurate for offsets much smaller than a degree.
     */
    public SkyCoordinate offsetArcsec(final double eastArcsec,
                                      final double northArcsec) {
        final double cosDec = Math.cos(Math.toRadians(dec));
        final double deltaRa = cosDec > 0 ? (eastArcsec / ARCSEC_PER_DEGREE) / cosDec : 0.0;
        return new SkyCoordinate(ra + deltaRa, dec + (northArcsec / ARCSEC_PER_DEGREE));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SkyCoordinate that = (SkyCoordinate) o;
        return Double.compare(that.ra, ra) == 0 &&
               Double.compare(that.dec, dec) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ra, dec);
    }

    @Override
    public String toString() {
        return "(" + ra + ", " + dec + ")";
    }
}
