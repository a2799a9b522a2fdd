package io.retrystreams.core;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Bridges between {@link ByteSink} and {@link OutputStream}.
 */
public final class ByteSinks {

    private ByteSinks() {}

    /**
     * Adapts an output stream. Every primitive write hands all bytes to the stream.
     */
    public static <T extends OutputStream> OutputStreamSink<T> of(T out) {
        return new OutputStreamSink<>(out);
    }

    /**
     * Exposes a sink as an output stream. Each write loops over the sink's primitive
     * {@link ByteSink#write(byte[], int, int)} until every byte is accepted.
     */
    public static OutputStream asOutputStream(ByteSink sink) {
        return new SinkOutputStream(sink);
    }

    /**
     * {@link ByteSink} writing to an {@link OutputStream}.
     */
    public static final class OutputStreamSink<T extends OutputStream> implements ByteSink {
        private final T out;

        OutputStreamSink(T out) {
            this.out = Objects.requireNonNull(out, "out");
        }

        @Override
        public int write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            return len;
        }

        @Override
        public void flush() throws IOException {
            out.flush();
        }

        @Override
        public void close() throws IOException {
            out.close();
        }

        /** Returns the adapted stream. */
        public T unwrap() {
            return out;
        }

        @Override
        public String toString() {
            return "OutputStreamSink[" + out + "]";
        }
    }

    private static final class SinkOutputStream extends OutputStream {
        private final ByteSink sink;

        SinkOutputStream(ByteSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            while (len > 0) {
                int n = sink.write(b, off, len);
                if (n <= 0) {
                    throw new IOException("failed to write whole buffer");
                }
                off += n;
                len -= n;
            }
        }

        @Override
        public void flush() throws IOException {
            sink.flush();
        }

        @Override
        public void close() throws IOException {
            sink.close();
        }
    }
}
