package org.janelia.transients.track;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.RadiusNeighborSearchOnKDTree;
import net.imglib2.type.numeric.integer.IntType;

import org.janelia.transients.parameters.TrackParameters;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.SkyCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups candidates into independent reduce units.
 * <p>
 * Each candidate is first assigned to its sky grid cell. Two candidates that could end up in the
 * same track are never more than twice the link tolerance apart, so whenever candidates in
 * different cells are that close their cells are unioned. Each resulting group is keyed by its
 * smallest cell and can be merged independently of every other group.
 */
public class PartitionPlanner {

    private final double cellArcsec;
    private final double neighborArcsec;

    public PartitionPlanner(final TrackParameters parameters) {
        this.cellArcsec = parameters.partitionCellArcsec;
        this.neighborArcsec = 2 * parameters.linkToleranceArcsec;
    }

    /**
     * @return group key for each candidate id.
     */
    public Map<String, SpatialPartitionKey> planGroupKeys(final Collection<Candidate> candidates) {

        final List<Candidate> candidateList = new ArrayList<>(candidates);
        final List<SpatialPartitionKey> cellKeys = new ArrayList<>(candidateList.size());
        final Map<SpatialPartitionKey, SpatialPartitionKey> parents = new HashMap<>();

        for (final Candidate candidate : candidateList) {
            final SpatialPartitionKey cellKey = SpatialPartitionKey.forCoordinate(candidate.getCoordinate(), cellArcsec);
            cellKeys.add(cellKey);
            parents.putIfAbsent(cellKey, cellKey);
        }

        int unionCount = 0;
        if (parents.size() > 1) {

            final List<IntType> indexes = new ArrayList<>(candidateList.size());
            final List<RealPoint> points = new ArrayList<>(candidateList.size());
            for (int i = 0; i < candidateList.size(); i++) {
                indexes.add(new IntType(i));
                points.add(new RealPoint(candidateList.get(i).getCoordinate().toUnitVector()));
            }

            final KDTree<IntType> kdTree = new KDTree<>(indexes, points);
            final RadiusNeighborSearchOnKDTree<IntType> radius = new RadiusNeighborSearchOnKDTree<>(kdTree);
            final double chordRadius = toChordLength(neighborArcsec) * (1.0 + CHORD_MARGIN);

            for (int i = 0; i < candidateList.size(); i++) {
                radius.search(new RealPoint(candidateList.get(i).getCoordinate().toUnitVector()), chordRadius, false);
                for (int n = 0; n < radius.numNeighbors(); n++) {
                    final int j = radius.getSampler(n).get().get();
                    if ((j != i) &&
                        (! cellKeys.get(i).equals(cellKeys.get(j))) &&
                        (candidateList.get(i).getCoordinate().separationArcsec(
                                candidateList.get(j).getCoordinate()) <= neighborArcsec)) {
                        if (union(parents, cellKeys.get(i), cellKeys.get(j))) {
                            unionCount++;
                        }
                    }
                }
            }
        }

        final Map<String, SpatialPartitionKey> groupKeys = new HashMap<>();
        for (int i = 0; i < candidateList.size(); i++) {
            groupKeys.put(candidateList.get(i).getCandidateId(), find(parents, cellKeys.get(i)));
        }

        LOG.debug("planGroupKeys: assigned {} candidates from {} cells, merged {} cell pairs across boundaries",
                  candidateList.size(), parents.size(), unionCount);

        return groupKeys;
    }

    /**
     * @return candidates grouped into reduce units, each list sorted by observation time then candidate id.
     */
    public SortedMap<SpatialPartitionKey, List<Candidate>> plan(final Collection<Candidate> candidates) {

        final Map<String, SpatialPartitionKey> groupKeys = planGroupKeys(candidates);
        final SortedMap<SpatialPartitionKey, List<Candidate>> groups = new TreeMap<>();
        for (final Candidate candidate : candidates) {
            groups.computeIfAbsent(groupKeys.get(candidate.getCandidateId()), k -> new ArrayList<>()).add(candidate);
        }
        for (final List<Candidate> group : groups.values()) {
            group.sort(TIME_ORDER);
        }

        LOG.info("plan: split {} candidates into {} partition groups", candidates.size(), groups.size());

        return groups;
    }

    public static final Comparator<Candidate> TIME_ORDER =
            Comparator.comparingLong(Candidate::getObservationTime).thenComparing(Candidate::getCandidateId);

    private static double toChordLength(final double arcsec) {
        return 2.0 * Math.sin(Math.toRadians(arcsec / SkyCoordinate.ARCSEC_PER_DEGREE) / 2.0);
    }

    private static SpatialPartitionKey find(final Map<SpatialPartitionKey, SpatialPartitionKey> parents,
                                            final SpatialPartitionKey key) {
        SpatialPartitionKey root = key;
        while (! root.equals(parents.get(root))) {
            root = parents.get(root);
        }
        SpatialPartitionKey current = key;
        while (! current.equals(root)) {
            final SpatialPartitionKey next = parents.get(current);
            parents.put(current, root);
            current = next;
        }
        return root;
    }

    private static boolean union(final Map<SpatialPartitionKey, SpatialPartitionKey> parents,
                                 final SpatialPartitionKey a,
                                 final SpatialPartitionKey b) {
        final SpatialPartitionKey rootA = find(parents, a);
        final SpatialPartitionKey rootB = find(parents, b);
        if (rootA.equals(rootB)) {
            return false;
        }
        // smallest key stays root so group keys do not depend on candidate order
        if (rootA.compareTo(rootB) < 0) {
            parents.put(rootB, rootA);
        } else {
            parents.put(rootA, rootB);
        }
        return true;
    }

    private static final double CHORD_MARGIN = 1.0e-6;

    private static final Logger LOG = LoggerFactory.getLogger(PartitionPlanner.class);
}
