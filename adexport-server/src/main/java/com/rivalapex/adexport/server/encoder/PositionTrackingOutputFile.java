package com.rivalapex.adexport.server.encoder;

import java.io.IOException;
import java.io.OutputStream;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

/**
 * 把已打开的输出流适配为 Parquet OutputFile，使 Parquet 可以写入 .tmp 交付文件。
 * 关闭时只刷新，不关闭底层流。
 */
class PositionTrackingOutputFile implements OutputFile {

    private final OutputStream delegate;

    PositionTrackingOutputFile(OutputStream delegate) {
        this.delegate = delegate;
    }

    @Override
    public PositionOutputStream create(long blockSizeHint) {
        return new TrackingStream(delegate);
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) {
        return new TrackingStream(delegate);
    }

    @Override
    public boolean supportsBlockSize() {
        return false;
    }

    @Override
    public long defaultBlockSize() {
        return 0;
    }

    private static final class TrackingStream extends PositionOutputStream {

        private final OutputStream out;
        private long position;

        TrackingStream(OutputStream out) {
            this.out = out;
        }

        @Override
        public long getPos() {
            return position;
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            position++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            position += len;
        }

        @Override
        public void flush() throws IOException {
            out.flush();
        }

        @Override
        public void close() throws IOException {
            out.flush();
        }
    }
}
