package org.janelia.transients.client;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.janelia.transients.client.parameter.CommandLineParameters;
import org.janelia.transients.detect.Connectivity;
import org.janelia.transients.parameters.DetectionPipelineParameters;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link TransientDetectionClient} class.
 */
public class TransientDetectionClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new TransientDetectionClient.Parameters());
    }

    @Test
    public void testCommandLineDetectionParameters() throws Exception {

        final TransientDetectionClient.Parameters parameters = new TransientDetectionClient.Parameters();
        final boolean parsed = parameters.parse(new String[] {
                "--manifest", "/data/manifest.json",
                "--catalog", "/data/catalog.json",
                "--tracksOutput", "/data/tracks.jsonl",
                "--detectionThreshold", "6.5",
                "--connectivity", "FOUR"
        }, TransientDetectionClient.class, false);

        Assert.assertTrue("arguments should parse", parsed);

        final DetectionPipelineParameters detection = parameters.getDetectionParameters();
        Assert.assertEquals("bad threshold", 6.5, detection.extraction.detectionThreshold, 0.0);
        Assert.assertEquals("bad connectivity", Connectivity.FOUR, detection.extraction.connectivity);
    }

    @Test
    public void testJsonDetectionParameters() throws Exception {

        final File parametersFile = temporaryFolder.newFile("detection.json");
        Files.write(parametersFile.toPath(),
                    "{ \"extraction\": { \"minBlobPixelCount\": 3 } }".getBytes(StandardCharsets.UTF_8));

        final TransientDetectionClient.Parameters parameters = new TransientDetectionClient.Parameters();
        parameters.parse(new String[] {
                "--manifest", "/data/manifest.json",
                "--catalog", "/data/catalog.json",
                "--tracksOutput", "/data/tracks.jsonl",
                "--minBlobPixelCount", "20",
                "--parametersJson", parametersFile.getAbsolutePath()
        }, TransientDetectionClient.class, false);

        final DetectionPipelineParameters detection = parameters.getDetectionParameters();
        Assert.assertEquals("JSON file should replace command line options",
                            3, detection.extraction.minBlobPixelCount);
        Assert.assertEquals("bad default threshold", 5.0, detection.extraction.detectionThreshold, 0.0);
    }

    public static void main(final String[] args) {

        final String[] effectiveArgs = (args != null) && (args.length > 0) ? args : new String[]{
                "--manifest", "/nrs/survey/field-1/manifest.json",
                "--catalog", "/nrs/survey/catalogs/known_transients.json",
                "--tracksOutput", "/nrs/survey/field-1/tracks.jsonl.gz",
                "--diagnosticsOutput", "/nrs/survey/field-1/diagnostics.json",
                "--detectionThreshold", "5",
                "--threads", "8"
        };

        TransientDetectionClient.main(effectiveArgs);
    }

}
