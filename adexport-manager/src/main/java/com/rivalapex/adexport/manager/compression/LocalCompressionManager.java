package com.rivalapex.adexport.manager.compression;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.springframework.stereotype.Component;

/**
 * 基于 commons-compress 的本地 gzip 实现。
 */
@Component
public class LocalCompressionManager implements CompressionManager {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public OutputStream gzipOutput(OutputStream out) throws IOException {
        GzipParameters parameters = new GzipParameters();
        parameters.setBufferSize(BUFFER_SIZE);
        return new GzipCompressorOutputStream(new BufferedOutputStream(out, BUFFER_SIZE), parameters);
    }
}
