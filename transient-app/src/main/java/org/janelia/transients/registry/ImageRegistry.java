package org.janelia.transients.registry;

import java.util.List;

import org.janelia.transients.spec.ImagePair;
import org.janelia.transients.spec.ImagePairId;

/**
 * Source of science and reference exposure pairs.
 * Implementations must be safe for concurrent fetches.
 */
public interface ImageRegistry {

    /**
     * @return ids of all pairs available for processing, sorted.
     *
     * @throws RegistryUnavailableException
     *   if the registry cannot be reached.
     */
    List<ImagePairId> listImagePairIds()
            throws RegistryUnavailableException;

    /**
     * @throws InvalidInputException
     *   if the pair's images or metadata are missing or corrupt.
     *
     * @throws RegistryUnavailableException
     *   if the registry cannot be reached.
     */
    ImagePair fetchImagePair(final ImagePairId pairId)
            throws InvalidInputException, RegistryUnavailableException;

    default ImagePair fetchImagePair(final String fieldId,
                                     final String sensorRegionId,
                                     final String filter,
                                     final long observationTime)
            throws InvalidInputException, RegistryUnavailableException {
        return fetchImagePair(new ImagePairId(fieldId, sensorRegionId, filter, observationTime));
    }

}
