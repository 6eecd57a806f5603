package org.janelia.transients.registry;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.janelia.transients.json.JsonUtils;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.util.FileUtil;

/**
 * JSON description of the FITS files for a batch of image pairs.
 * Relative paths are resolved against the base directory.
 */
public class ImagePairManifest
        implements Serializable {

    /**
     * Files for one pair.
     */
    public static class Entry
            implements Serializable {

        public String fieldId;
        public String sensorRegionId;
        public String filter;

        /** Science observation time in milliseconds since the epoch. */
        public long observationTime;

        public String sciencePath;
        public String referencePath;

        /**
         * Optional, exposures on the reference pixel grid that are median-combined into the reference
         * when no reference path is specified.
         */
        public List<String> referenceStackPaths;

        /** Optional, non-zero mask pixels are excluded. */
        public String scienceMaskPath;

        /** Optional, non-zero mask pixels are excluded. */
        public String referenceMaskPath;

        public Entry() {
        }

        public Entry(final ImagePairId pairId,
                     final String sciencePath,
                     final String referencePath) {
            this.fieldId = pairId.getFieldId();
            this.sensorRegionId = pairId.getSensorRegionId();
            this.filter = pairId.getFilter();
            this.observationTime = pairId.getObservationTime();
            this.sciencePath = sciencePath;
            this.referencePath = referencePath;
        }

        public ImagePairId getPairId() {
            return new ImagePairId(fieldId, sensorRegionId, filter, observationTime);
        }
    }

    public String baseDirectory;
    public List<Entry> pairs;

    public ImagePairManifest() {
        this.pairs = new ArrayList<>();
    }

    public ImagePairManifest(final String baseDirectory,
                             final List<Entry> pairs) {
        this.baseDirectory = baseDirectory;
        this.pairs = new ArrayList<>(pairs);
    }

    /**
     * @return absolute path for the specified manifest path, or null if the path is null.
     */
    public Path resolve(final String path) {
        if (path == null) {
            return null;
        }
        final Path p = Paths.get(path);
        if (p.isAbsolute() || (baseDirectory == null)) {
            return p.toAbsolutePath();
        }
        return Paths.get(baseDirectory, path).toAbsolutePath();
    }

    public static ImagePairManifest fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * Loads a manifest file, using the file's directory as the base directory when none is specified.
     */
    public static ImagePairManifest fromJsonFile(final String dataFile)
            throws IOException {
        final Path path = Paths.get(dataFile).toAbsolutePath();
        final ImagePairManifest manifest;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path.toString())) {
            manifest = fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse " + path, e);
        }
        if (manifest.baseDirectory == null) {
            manifest.baseDirectory = path.getParent().toString();
        }
        return manifest;
    }

    private static final JsonUtils.Helper<ImagePairManifest> JSON_HELPER =
            new JsonUtils.Helper<>(ImagePairManifest.class);
}
