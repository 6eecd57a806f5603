package org.janelia.transients.registry;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

import org.janelia.transients.align.ReferenceStacker;
import org.janelia.transients.spec.Exposure;
import org.janelia.transients.spec.ImagePair;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.spec.PixelFlags;
import org.janelia.transients.spec.WorldCoordinateMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of FITS exposure pairs described by an {@link ImagePairManifest}.
 * <p>
 * Pixel values have BSCALE and BZERO applied. Pixels that are not finite, equal to BLANK,
 * at or above SATURATE, or non-zero in an optional mask image are flagged invalid.
 * The coordinate mapping is read from CRVAL, CRPIX, and either CD or CDELT/CROTA2 cards;
 * exposures without them (or with a non-TAN projection) have no mapping.
 * <p>
 * Reference exposures are shared by many science exposures, so they are cached.
 * A reference may also be listed as several exposures on one pixel grid, which are combined
 * with a {@link ReferenceStacker}.
 */
public class FitsImageRegistry
        implements ImageRegistry {

    private final ImagePairManifest manifest;
    private final Map<ImagePairId, ImagePairManifest.Entry> entries;
    private final LoadingCache<ReferenceKey, Exposure> referenceCache;

    public FitsImageRegistry(final ImagePairManifest manifest,
                             final long maximumCachedReferences) {

        this.manifest = manifest;
        this.entries = new TreeMap<>();
        for (final ImagePairManifest.Entry entry : manifest.pairs) {
            this.entries.put(entry.getPairId(), entry);
        }

        final CacheLoader<ReferenceKey, Exposure> loader =
                new CacheLoader<ReferenceKey, Exposure>() {
                    @Override
                    public Exposure load(final ReferenceKey key)
                            throws InvalidInputException {
                        return readReference(key);
                    }
                };

        this.referenceCache = CacheBuilder.newBuilder()
                .maximumSize(maximumCachedReferences)
                .build(loader);
    }

    public static FitsImageRegistry fromManifestFile(final String manifestPath,
                                                     final long maximumCachedReferences)
            throws IOException {
        return new FitsImageRegistry(ImagePairManifest.fromJsonFile(manifestPath), maximumCachedReferences);
    }

    @Override
    public List<ImagePairId> listImagePairIds()
            throws RegistryUnavailableException {
        checkBaseDirectory();
        return new ArrayList<>(entries.keySet());
    }

    @Override
    public ImagePair fetchImagePair(final ImagePairId pairId)
            throws InvalidInputException, RegistryUnavailableException {

        checkBaseDirectory();

        final ImagePairManifest.Entry entry = entries.get(pairId);
        if (entry == null) {
            throw new InvalidInputException("pair " + pairId + " is not in the manifest");
        }

        final Path sciencePath = manifest.resolve(entry.sciencePath);
        final List<Path> referencePaths = new ArrayList<>();
        if (entry.referencePath != null) {
            referencePaths.add(manifest.resolve(entry.referencePath));
        } else if (entry.referenceStackPaths != null) {
            entry.referenceStackPaths.forEach(path -> referencePaths.add(manifest.resolve(path)));
        }
        if ((sciencePath == null) || referencePaths.isEmpty()) {
            throw new InvalidInputException("pair " + pairId + " is missing a science or reference path");
        }

        final Exposure science = readExposure(sciencePath.toString(),
                                              entry.fieldId,
                                              entry.sensorRegionId,
                                              entry.filter,
                                              sciencePath,
                                              manifest.resolve(entry.scienceMaskPath));

        final ReferenceKey referenceKey = new ReferenceKey(entry.fieldId,
                                                           entry.sensorRegionId,
                                                           entry.filter,
                                                           referencePaths,
                                                           manifest.resolve(entry.referenceMaskPath));
        final Exposure reference;
        try {
            reference = referenceCache.get(referenceKey);
        } catch (final ExecutionException | UncheckedExecutionException e) {
            if (e.getCause() instanceof InvalidInputException) {
                throw (InvalidInputException) e.getCause();
            }
            throw new InvalidInputException("failed to load reference " + referencePaths, e.getCause());
        }

        try {
            return new ImagePair(pairId, science, reference);
        } catch (final IllegalArgumentException e) {
            throw new InvalidInputException("inconsistent exposures for pair " + pairId, e);
        }
    }

    /**
     * @return the single reference exposure for the key, or the median combination of its exposures.
     */
    private static Exposure readReference(final ReferenceKey key)
            throws InvalidInputException {

        if (key.paths.size() == 1) {
            final Path path = key.paths.get(0);
            return readExposure(path.toString(), key.fieldId, key.sensorRegionId, key.filter, path, key.maskPath);
        }

        final List<Exposure> exposures = new ArrayList<>(key.paths.size());
        for (final Path path : key.paths) {
            exposures.add(readExposure(path.toString(),
                                       key.fieldId,
                                       key.sensorRegionId,
                                       key.filter,
                                       path,
                                       key.maskPath));
        }

        LOG.info("readReference: combining {} exposures for {} {} {}",
                 exposures.size(), key.fieldId, key.sensorRegionId, key.filter);

        try {
            return new ReferenceStacker().stack(key.paths.get(0).toString(), exposures);
        } catch (final IllegalArgumentException e) {
            throw new InvalidInputException("failed to combine reference exposures " + key.paths, e);
        }
    }

    public long getCachedReferenceCount() {
        return referenceCache.size();
    }

    private void checkBaseDirectory()
            throws RegistryUnavailableException {
        if ((manifest.baseDirectory != null) && (! Files.isDirectory(Paths.get(manifest.baseDirectory)))) {
            throw new RegistryUnavailableException("base directory " + manifest.baseDirectory + " is not accessible");
        }
    }

    /**
     * Reads one exposure (and its optional mask) from FITS files.
     *
     * @throws InvalidInputException
     *   if either file is missing or unreadable, if the dimensions differ,
     *   or if the FILTER card contradicts the expected filter.
     */
    public static Exposure readExposure(final String exposureId,
                                        final String fieldId,
                                        final String sensorRegionId,
                                        final String filter,
                                        final Path imagePath,
                                        final Path maskPath)
            throws InvalidInputException {

        final FitsImage image = readImage(imagePath);

        final String headerFilter = image.header.getStringValue("FILTER");
        if ((headerFilter != null) && (! headerFilter.trim().equals(filter))) {
            throw new InvalidInputException("FILTER " + headerFilter.trim() + " in " + imagePath +
                                            " does not match expected filter " + filter);
        }

        final int width = image.width;
        final int height = image.height;
        final FloatProcessor pixels = new FloatProcessor(width, height);
        final ByteProcessor flags = new ByteProcessor(width, height);

        final double saturate = image.header.getDoubleValue("SATURATE", Double.POSITIVE_INFINITY);
        final boolean hasBlank = image.isInteger && image.header.containsKey("BLANK");
        final long blank = hasBlank ? image.header.getLongValue("BLANK", 0) : 0;

        int flaggedCount = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final double raw = image.getRawValue(x, y);
                final double value = image.bzero + (image.bscale * raw);
                int flag = PixelFlags.VALID;
                if (hasBlank && ((long) raw == blank)) {
                    flag |= PixelFlags.MASKED;
                } else if (! Double.isFinite(value)) {
                    flag |= PixelFlags.NON_FINITE;
                } else if (value >= saturate) {
                    flag |= PixelFlags.SATURATED;
                }
                pixels.setf(x, y, (float) value);
                flags.set(x, y, flag);
                if (flag != PixelFlags.VALID) {
                    flaggedCount++;
                }
            }
        }

        if (maskPath != null) {
            final FitsImage mask = readImage(maskPath);
            if ((mask.width != width) || (mask.height != height)) {
                throw new InvalidInputException("mask " + maskPath + " dimensions " + mask.width + "x" + mask.height +
                                                " differ from image dimensions " + width + "x" + height);
            }
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    if (mask.getRawValue(x, y) != 0) {
                        final int flag = flags.get(x, y);
                        if (flag == PixelFlags.VALID) {
                            flaggedCount++;
                        }
                        flags.set(x, y, flag | PixelFlags.MASKED);
                    }
                }
            }
        }

        final WorldCoordinateMapping mapping = readCoordinateMapping(image.header, imagePath);

        LOG.debug("readExposure: loaded {}x{} exposure {} with {} flagged pixels",
                  width, height, imagePath, flaggedCount);

        return new Exposure(exposureId, fieldId, sensorRegionId, filter, pixels, flags, mapping);
    }

    /**
     * @return mapping from the header's WCS cards, or null if they are missing or not a TAN projection.
     */
    static WorldCoordinateMapping readCoordinateMapping(final Header header,
                                                        final Path imagePath) {

        final String ctype1 = header.getStringValue("CTYPE1");
        if ((ctype1 != null) && (! ctype1.trim().endsWith("TAN"))) {
            LOG.warn("readCoordinateMapping: unsupported projection {} in {}", ctype1.trim(), imagePath);
            return null;
        }

        for (final String key : new String[] {"CRVAL1", "CRVAL2", "CRPIX1", "CRPIX2"}) {
            if (! header.containsKey(key)) {
                LOG.warn("readCoordinateMapping: {} is missing {}", imagePath, key);
                return null;
            }
        }

        final double cd11;
        final double cd12;
        final double cd21;
        final double cd22;
        if (header.containsKey("CD1_1") || header.containsKey("CD2_2")) {
            cd11 = header.getDoubleValue("CD1_1", 0.0);
            cd12 = header.getDoubleValue("CD1_2", 0.0);
            cd21 = header.getDoubleValue("CD2_1", 0.0);
            cd22 = header.getDoubleValue("CD2_2", 0.0);
        } else if (header.containsKey("CDELT1") && header.containsKey("CDELT2")) {
            final double cdelt1 = header.getDoubleValue("CDELT1", 0.0);
            final double cdelt2 = header.getDoubleValue("CDELT2", 0.0);
            final double rotation = Math.toRadians(header.getDoubleValue("CROTA2", 0.0));
            final double cos = Math.cos(rotation);
            final double sin = Math.sin(rotation);
            cd11 = cdelt1 * cos;
            cd12 = -cdelt2 * sin;
            cd21 = cdelt1 * sin;
            cd22 = cdelt2 * cos;
        } else {
            LOG.warn("readCoordinateMapping: {} has neither CD nor CDELT cards", imagePath);
            return null;
        }

        // FITS reference pixels are one-based
        return new WorldCoordinateMapping(header.getDoubleValue("CRPIX1", 0.0) - 1.0,
                                          header.getDoubleValue("CRPIX2", 0.0) - 1.0,
                                          header.getDoubleValue("CRVAL1", 0.0),
                                          header.getDoubleValue("CRVAL2", 0.0),
                                          cd11, cd12, cd21, cd22);
    }

    private static FitsImage readImage(final Path path)
            throws InvalidInputException {

        final File file = path.toFile();
        if (! file.isFile()) {
            throw new InvalidInputException("missing FITS file " + path);
        }

        try (final Fits fits = new Fits(file)) {

            final BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new InvalidInputException("no image HDU in " + path);
            }

            final Header header = hdu.getHeader();
            final int naxis = header.getIntValue("NAXIS", 0);
            if (naxis != 2) {
                throw new InvalidInputException(path + " has " + naxis + " axes, expected 2");
            }

            return new FitsImage(header, toRawRows(hdu.getKernel(), path));

        } catch (final FitsException | IOException e) {
            throw new InvalidInputException("failed to read " + path, e);
        }
    }

    /**
     * @return unscaled pixel values of the specified image kernel, indexed [y][x].
     *
     * @throws InvalidInputException
     *   if the kernel is not a supported two dimensional array.
     */
    private static double[][] toRawRows(final Object kernel,
                                        final Path path)
            throws InvalidInputException {

        final double[][] rows;
        if (kernel instanceof byte[][]) {
            final byte[][] b = (byte[][]) kernel;
            rows = new double[b.length][];
            for (int y = 0; y < b.length; y++) {
                rows[y] = new double[b[y].length];
                for (int x = 0; x < b[y].length; x++) {
                    rows[y][x] = b[y][x] & 0xff;
                }
            }
        } else if (kernel instanceof short[][]) {
            final short[][] sh = (short[][]) kernel;
            rows = new double[sh.length][];
            for (int y = 0; y < sh.length; y++) {
                rows[y] = new double[sh[y].length];
                for (int x = 0; x < sh[y].length; x++) {
                    rows[y][x] = sh[y][x];
                }
            }
        } else if (kernel instanceof int[][]) {
            final int[][] in = (int[][]) kernel;
            rows = new double[in.length][];
            for (int y = 0; y < in.length; y++) {
                rows[y] = new double[in[y].length];
                for (int x = 0; x < in[y].length; x++) {
                    rows[y][x] = in[y][x];
                }
            }
        } else if (kernel instanceof long[][]) {
            final long[][] l = (long[][]) kernel;
            rows = new double[l.length][];
            for (int y = 0; y < l.length; y++) {
                rows[y] = new double[l[y].length];
                for (int x = 0; x < l[y].length; x++) {
                    rows[y][x] = l[y][x];
                }
            }
        } else if (kernel instanceof float[][]) {
            final float[][] f = (float[][]) kernel;
            rows = new double[f.length][];
            for (int y = 0; y < f.length; y++) {
                rows[y] = new double[f[y].length];
                for (int x = 0; x < f[y].length; x++) {
                    rows[y][x] = f[y][x];
                }
            }
        } else if (kernel instanceof double[][]) {
            rows = (double[][]) kernel;
        } else {
            throw new InvalidInputException("unsupported pixel data " +
                                            (kernel == null ? null : kernel.getClass().getSimpleName()) +
                                            " in " + path);
        }
        return rows;
    }

    /**
     * Header and unscaled pixel values of a two dimensional FITS image.
     */
    private static class FitsImage {

        private final Header header;
        private final double[][] rows;
        private final int width;
        private final int height;
        private final boolean isInteger;
        private final double bscale;
        private final double bzero;

        FitsImage(final Header header,
                  final double[][] rows) {
            this.header = header;
            this.rows = rows;
            this.height = rows.length;
            this.width = rows.length == 0 ? 0 : rows[0].length;
            final int bitpix = header.getIntValue("BITPIX", -32);
            this.isInteger = bitpix > 0;
            this.bscale = header.getDoubleValue("BSCALE", 1.0);
            this.bzero = header.getDoubleValue("BZERO", 0.0);
        }

        double getRawValue(final int x,
                           final int y) {
            return rows[y][x];
        }
    }

    private static class ReferenceKey {

        private final String fieldId;
        private final String sensorRegionId;
        private final String filter;
        private final List<Path> paths;
        private final Path maskPath;

        ReferenceKey(final String fieldId,
                     final String sensorRegionId,
                     final String filter,
                     final List<Path> paths,
                     final Path maskPath) {
            this.fieldId = fieldId;
            this.sensorRegionId = sensorRegionId;
            this.filter = filter;
            this.paths = paths;
            this.maskPath = maskPath;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            final ReferenceKey that = (ReferenceKey) o;
            return Objects.equals(fieldId, that.fieldId) &&
                   Objects.equals(sensorRegionId, that.sensorRegionId) &&
                   Objects.equals(filter, that.filter) &&
                   Objects.equals(paths, that.paths) &&
                   Objects.equals(maskPath, that.maskPath);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fieldId, sensorRegionId, filter, paths, maskPath);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitsImageRegistry.class);
}
