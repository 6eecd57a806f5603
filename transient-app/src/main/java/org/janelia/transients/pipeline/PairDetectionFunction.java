package org.janelia.transients.pipeline;

import java.io.Serializable;
import java.util.List;

import org.janelia.transients.align.ImageAligner;
import org.janelia.transients.detect.CandidateExtractor;
import org.janelia.transients.difference.DifferenceComputer;
import org.janelia.transients.parameters.DetectionPipelineParameters;
import org.janelia.transients.registry.ImageRegistry;
import org.janelia.transients.registry.RegistryUnavailableException;
import org.janelia.transients.spec.AlignedPair;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.DataQualityException;
import org.janelia.transients.spec.DifferenceMap;
import org.janelia.transients.spec.ImagePair;
import org.janelia.transients.spec.ImagePairId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map unit: aligns one image pair, differences it, and extracts its candidates.
 * Holds only parameters, so it can be shipped to remote executors and called concurrently.
 */
public class PairDetectionFunction
        implements Serializable {

    private final DetectionPipelineParameters parameters;

    public PairDetectionFunction(final DetectionPipelineParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @throws DataQualityException
     *   if the pair cannot be aligned, normalized, or differenced.
     */
    public List<Candidate> detect(final ImagePair pair)
            throws DataQualityException {

        final AlignedPair alignedPair = new ImageAligner(parameters.alignment).align(pair);
        final DifferenceMap differenceMap =
                new DifferenceComputer(parameters.noise.buildNoiseModel()).compute(alignedPair);
        final List<Candidate> candidates = new CandidateExtractor(parameters.extraction).extract(differenceMap);

        LOG.debug("detect: pair {} produced {} candidates", pair.getPairId(), candidates.size());

        return candidates;
    }

    /**
     * Fetches the pair from the registry before detecting.
     *
     * @throws DataQualityException
     *   if the pair's data is missing, corrupt, or unusable.
     *
     * @throws RegistryUnavailableException
     *   if the registry cannot be reached.
     */
    public List<Candidate> detect(final ImageRegistry registry,
                                  final ImagePairId pairId)
            throws DataQualityException, RegistryUnavailableException {
        return detect(registry.fetchImagePair(pairId));
    }

    private static final Logger LOG = LoggerFactory.getLogger(PairDetectionFunction.class);
}
