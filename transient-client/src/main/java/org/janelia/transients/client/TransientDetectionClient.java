package org.janelia.transients.client;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

import org.janelia.transients.client.parameter.BatchInputParameters;
import org.janelia.transients.client.parameter.CommandLineParameters;
import org.janelia.transients.parameters.DetectionPipelineParameters;
import org.janelia.transients.pipeline.BatchAbortedException;
import org.janelia.transients.pipeline.BatchDiagnostics;
import org.janelia.transients.pipeline.BatchResult;
import org.janelia.transients.pipeline.JsonLinesRecordSink;
import org.janelia.transients.pipeline.TransientPipeline;
import org.janelia.transients.registry.FitsImageRegistry;
import org.janelia.transients.track.TrackAggregator;
import org.janelia.transients.util.FileUtil;
import org.janelia.transients.validate.InMemoryCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for running a transient detection batch over a FITS manifest on a local worker pool.
 */
public class TransientDetectionClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public BatchInputParameters input = new BatchInputParameters();

        @ParametersDelegate
        public DetectionPipelineParameters detection = new DetectionPipelineParameters();

        /**
         * @return detection parameters from the JSON file when one is specified, otherwise from the command line.
         */
        public DetectionPipelineParameters getDetectionParameters()
                throws IOException {
            return input.parametersJson == null ?
                   detection : DetectionPipelineParameters.fromJsonFile(input.parametersJson);
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final TransientDetectionClient client = new TransientDetectionClient(parameters);
                client.run();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public TransientDetectionClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public BatchResult run()
            throws IOException {

        parameters.input.validate();
        final DetectionPipelineParameters detection = parameters.getDetectionParameters();
        detection.validate();

        final FitsImageRegistry registry = FitsImageRegistry.fromManifestFile(parameters.input.manifest,
                                                                             parameters.input.maxCachedReferences);
        final InMemoryCatalog catalog = InMemoryCatalog.fromJsonFile(parameters.input.catalog);
        final List<String> expectedEntryIds = parameters.input.expectedEntries == null ?
                                              null : FileUtil.loadJsonArrayFile(parameters.input.expectedEntries,
                                                                                String.class);

        final TransientPipeline pipeline = new TransientPipeline(detection,
                                                                 registry,
                                                                 catalog,
                                                                 TrackAggregator.buildArtifactPolicies(detection.track));

        final BatchResult result;
        try (final JsonLinesRecordSink sink = new JsonLinesRecordSink(Paths.get(parameters.input.tracksOutput))) {
            result = pipeline.run(expectedEntryIds, sink);
        } catch (final BatchAbortedException e) {
            saveDiagnostics(e.getDiagnostics());
            throw e;
        }

        saveDiagnostics(result.getDiagnostics());

        if (result.getDiagnostics().hasPartialFailures()) {
            LOG.warn("run: batch completed with {} failed units, see diagnostics for details",
                     result.getDiagnostics().getTotalFailureCount());
        }

        return result;
    }

    private void saveDiagnostics(final BatchDiagnostics diagnostics)
            throws IOException {
        if ((parameters.input.diagnosticsOutput != null) && (diagnostics != null)) {
            FileUtil.saveJsonFile(parameters.input.diagnosticsOutput, diagnostics);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TransientDetectionClient.class);
}
