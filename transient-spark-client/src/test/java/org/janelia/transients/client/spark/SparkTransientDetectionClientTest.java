package org.janelia.transients.client.spark;

import org.janelia.transients.client.parameter.CommandLineParameters;
import org.junit.Test;

/**
 * Tests the {@link SparkTransientDetectionClient} class.
 */
public class SparkTransientDetectionClientTest {

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new SparkTransientDetectionClient.Parameters());
    }

}
