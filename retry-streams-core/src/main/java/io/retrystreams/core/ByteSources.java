package io.retrystreams.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Bridges between {@link ByteSource} and {@link InputStream}.
 */
public final class ByteSources {

    private ByteSources() {}

    /**
     * Adapts an input stream. Each primitive read is one call to {@link InputStream#read(byte[], int, int)}.
     */
    public static <T extends InputStream> InputStreamSource<T> of(T in) {
        return new InputStreamSource<>(in);
    }

    /**
     * Exposes a source as an input stream. Reads go straight to the source's primitive.
     */
    public static InputStream asInputStream(ByteSource source) {
        return new SourceInputStream(source);
    }

    /**
     * {@link ByteSource} reading from an {@link InputStream}.
     */
    public static final class InputStreamSource<T extends InputStream> implements ByteSource {
        private final T in;

        InputStreamSource(T in) {
            this.in = Objects.requireNonNull(in, "in");
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return in.read(b, off, len);
        }

        @Override
        public long readToEnd(ByteArrayOutputStream out) throws IOException {
            Objects.requireNonNull(out, "out");
            return in.transferTo(out);
        }

        @Override
        public void close() throws IOException {
            in.close();
        }

        /** Returns the adapted stream. */
        public T unwrap() {
            return in;
        }

        @Override
        public String toString() {
            return "InputStreamSource[" + in + "]";
        }
    }

    private static final class SourceInputStream extends InputStream {
        private final ByteSource source;
        private final byte[] single = new byte[1];

        SourceInputStream(ByteSource source) {
            this.source = Objects.requireNonNull(source, "source");
        }

        @Override
        public int read() throws IOException {
            int n;
            do {
                n = source.read(single, 0, 1);
            } while (n == 0);
            return n < 0 ? -1 : single[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            return source.read(b, off, len);
        }

        @Override
        public void close() throws IOException {
            source.close();
        }
    }
}
