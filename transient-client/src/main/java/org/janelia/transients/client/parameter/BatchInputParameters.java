package org.janelia.transients.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Input and output locations for a detection batch.
 */
public class BatchInputParameters
        implements Serializable {

    @Parameter(
            names = "--manifest",
            description = "JSON manifest listing science/reference FITS files for each image pair",
            required = true)
    public String manifest;

    @Parameter(
            names = "--catalog",
            description = "JSON array of known transient catalog entries used for cross-matching",
            required = true)
    public String catalog;

    @Parameter(
            names = "--expectedEntries",
            description = "JSON array of catalog entry ids the batch is expected to find (enables recall)")
    public String expectedEntries;

    @Parameter(
            names = "--parametersJson",
            description = "JSON file with detection parameters, replaces all detection command line options")
    public String parametersJson;

    @Parameter(
            names = "--tracksOutput",
            description = "Path for track records (JSON lines, gzipped if path ends with .gz)",
            required = true)
    public String tracksOutput;

    @Parameter(
            names = "--diagnosticsOutput",
            description = "Path for the batch diagnostics JSON report")
    public String diagnosticsOutput;

    @Parameter(
            names = "--maxCachedReferences",
            description = "Maximum number of reference exposures kept in memory")
    public long maxCachedReferences = 16;

    public BatchInputParameters() {
    }

    public void validate()
            throws IllegalArgumentException {
        if (maxCachedReferences < 1) {
            throw new IllegalArgumentException("maxCachedReferences must be at least 1");
        }
    }
}
