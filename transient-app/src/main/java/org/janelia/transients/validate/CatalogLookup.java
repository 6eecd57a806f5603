package org.janelia.transients.validate;

import java.util.List;

import org.janelia.transients.spec.CatalogEntry;
import org.janelia.transients.spec.SkyCoordinate;

/**
 * Cone search capability of an external catalog of known transients.
 */
public interface CatalogLookup {

    /**
     * @return entries whose coordinate is within the radius (inclusive) of the center.
     *
     * @throws ValidationLookupException
     *   if the catalog cannot be queried.
     */
    List<CatalogEntry> coneSearch(final SkyCoordinate center,
                                  final double radiusArcsec)
            throws ValidationLookupException;

}
