package org.janelia.transients.validate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.RadiusNeighborSearchOnKDTree;
import net.imglib2.type.numeric.integer.IntType;

import org.janelia.transients.spec.CatalogEntry;
import org.janelia.transients.spec.SkyCoordinate;
import org.janelia.transients.util.FileUtil;

/**
 * Catalog held in memory, searched with a KD-tree over entry unit vectors.
 */
public class InMemoryCatalog
        implements CatalogLookup {

    private final List<CatalogEntry> entries;
    private final KDTree<IntType> kdTree;

    public InMemoryCatalog(final Collection<CatalogEntry> entries) {
        this.entries = new ArrayList<>(entries);
        if (this.entries.isEmpty()) {
            this.kdTree = null;
        } else {
            final List<IntType> indexes = new ArrayList<>(this.entries.size());
            final List<RealPoint> points = new ArrayList<>(this.entries.size());
            for (int i = 0; i < this.entries.size(); i++) {
                indexes.add(new IntType(i));
                points.add(new RealPoint(this.entries.get(i).getCoordinate().toUnitVector()));
            }
            this.kdTree = new KDTree<>(indexes, points);
        }
    }

    public static InMemoryCatalog fromJsonFile(final String path)
            throws IOException {
        return new InMemoryCatalog(FileUtil.loadJsonArrayFile(path, CatalogEntry.class));
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return matching entries sorted by separation from the center, then entry id.
     */
    @Override
    public List<CatalogEntry> coneSearch(final SkyCoordinate center,
                                         final double radiusArcsec) {

        final List<CatalogEntry> matches = new ArrayList<>();
        if (kdTree == null) {
            return matches;
        }

        final double maxSeparation = radiusArcsec + TrackValidator.MATCH_EPSILON_ARCSEC;
        final double chordRadius =
                2.0 * Math.sin(Math.toRadians(maxSeparation / SkyCoordinate.ARCSEC_PER_DEGREE) / 2.0) * (1.0 + 1.0e-6);

        final RadiusNeighborSearchOnKDTree<IntType> radius = new RadiusNeighborSearchOnKDTree<>(kdTree);
        radius.search(new RealPoint(center.toUnitVector()), chordRadius, false);

        for (int i = 0; i < radius.numNeighbors(); i++) {
            final CatalogEntry entry = entries.get(radius.getSampler(i).get().get());
            if (center.separationArcsec(entry.getCoordinate()) <= maxSeparation) {
                matches.add(entry);
            }
        }

        matches.sort(Comparator.comparingDouble((CatalogEntry e) -> center.separationArcsec(e.getCoordinate()))
                             .thenComparing(CatalogEntry::getEntryId));

        return matches;
    }
}
