package org.janelia.transients.client.spark;

import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Utility methods for managing logging on Spark nodes.
 */
public class LogUtilities {

    /**
     * Tags subsequent log statements on the current executor thread with the specified context
     * (rendered by the %X{context} pattern element).
     */
    public static void setupExecutorLog(final String context) {
        MDC.put(CONTEXT_KEY, context);
    }

    public static void clearExecutorLog() {
        MDC.remove(CONTEXT_KEY);
    }

    /**
     * Logs basic information about the current Spark context.
     */
    public static void logSparkClusterInfo(final JavaSparkContext sparkContext) {
        LOG.info("logSparkClusterInfo: appId is {}, master is {}, defaultParallelism is {}",
                 sparkContext.getConf().getAppId(), sparkContext.master(), sparkContext.defaultParallelism());
    }

    private static final String CONTEXT_KEY = "context";

    private static final Logger LOG = LoggerFactory.getLogger(LogUtilities.class);
}
