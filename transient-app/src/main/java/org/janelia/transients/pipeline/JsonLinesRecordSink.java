package org.janelia.transients.pipeline;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

import org.janelia.transients.json.JsonUtils;
import org.janelia.transients.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one JSON object per line (gzipped when the path ends with .gz).
 */
public class JsonLinesRecordSink
        implements EventTrackRecordSink {

    private final Path path;
    private final Writer writer;
    private long recordCount;

    public JsonLinesRecordSink(final Path path)
            throws IOException {
        this.path = path.toAbsolutePath();
        this.writer = FileUtil.DEFAULT_INSTANCE.getExtensionBasedWriter(this.path.toString());
        this.recordCount = 0;
    }

    @Override
    public void write(final EventTrackRecord record)
            throws IOException {
        writer.write(JsonUtils.FAST_MAPPER.writeValueAsString(record));
        writer.write('\n');
        recordCount++;
    }

    @Override
    public void close()
            throws IOException {
        writer.close();
        LOG.info("close: wrote {} records to {}", recordCount, path);
    }

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesRecordSink.class);
}
