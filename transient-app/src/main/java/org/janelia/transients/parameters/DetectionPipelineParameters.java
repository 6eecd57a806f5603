package org.janelia.transients.parameters;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.transients.json.JsonUtils;
import org.janelia.transients.util.FileUtil;

/**
 * All tunable values for a detection batch, grouped by component.
 * Can be populated from the command line (as a delegate) or from a JSON file.
 */
public class DetectionPipelineParameters
        implements Serializable {

    @ParametersDelegate
    public AlignmentParameters alignment = new AlignmentParameters();

    @ParametersDelegate
    public NoiseModelParameters noise = new NoiseModelParameters();

    @ParametersDelegate
    public ExtractionParameters extraction = new ExtractionParameters();

    @ParametersDelegate
    public TrackParameters track = new TrackParameters();

    @ParametersDelegate
    public ValidationParameters validation = new ValidationParameters();

    @ParametersDelegate
    public ExecutionParameters execution = new ExecutionParameters();

    public DetectionPipelineParameters() {
    }

    /**
     * @throws IllegalArgumentException
     *   if any component's parameters are invalid.
     */
    public void validate()
            throws IllegalArgumentException {
        alignment.validate();
        noise.validate();
        extraction.validate();
        track.validate();
        validation.validate();
        execution.validate();
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static DetectionPipelineParameters fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static DetectionPipelineParameters fromJsonFile(final String dataFile)
            throws IOException {
        final DetectionPipelineParameters parameters;
        final Path path = Paths.get(dataFile).toAbsolutePath();
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path.toString())) {
            parameters = fromJson(reader);
        }
        return parameters;
    }

    private static final JsonUtils.Helper<DetectionPipelineParameters> JSON_HELPER =
            new JsonUtils.Helper<>(DetectionPipelineParameters.class);
}
