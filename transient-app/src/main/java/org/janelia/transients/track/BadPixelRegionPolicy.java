package org.janelia.transients.track;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.transients.spec.Candidate;
import org.janelia.transients.util.FileUtil;

/**
 * Rejects tracks whose detections all coincide with registered bad pixel regions.
 */
public class BadPixelRegionPolicy
        implements ArtifactPolicy {

    private final List<BadPixelRegion> regions;

    public BadPixelRegionPolicy(final List<BadPixelRegion> regions) {
        this.regions = new ArrayList<>(regions);
    }

    public static BadPixelRegionPolicy fromJsonFile(final String path)
            throws IOException {
        return new BadPixelRegionPolicy(FileUtil.loadJsonArrayFile(path, BadPixelRegion.class));
    }

    public int getRegionCount() {
        return regions.size();
    }

    @Override
    public String findArtifact(final EventTrack track) {
        BadPixelRegion lastRegion = null;
        for (final Candidate candidate : track.getCandidates()) {
            lastRegion = findRegion(candidate);
            if (lastRegion == null) {
                return null;
            }
        }
        return "all " + track.getCandidateCount() + " detections fall in bad pixel regions (last " + lastRegion + ")";
    }

    private BadPixelRegion findRegion(final Candidate candidate) {
        for (final BadPixelRegion region : regions) {
            if (region.contains(candidate)) {
                return region;
            }
        }
        return null;
    }
}
