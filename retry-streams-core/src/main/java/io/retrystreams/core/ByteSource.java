package io.retrystreams.core;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Objects;

/**
 * Sequential byte input.
 *
 * <p>{@link #read(byte[], int, int)} is the primitive: a single attempt that transfers at most
 * {@code len} bytes and follows the {@link java.io.InputStream} conventions ({@code -1} at end of
 * stream, {@code 0} only for a zero-length request). The remaining operations are composites built
 * on the primitive. Implementations may override them with something more efficient.
 *
 * <p>The default composites propagate every failure of the primitive, including
 * {@link java.io.InterruptedIOException}.
 */
@FunctionalInterface
public interface ByteSource extends ByteResource {

    /**
     * Reads up to {@code len} bytes into {@code b} starting at {@code off}.
     *
     * @return number of bytes read, or {@code -1} at end of stream
     */
    int read(byte[] b, int off, int len) throws IOException;

    default int read(byte[] b) throws IOException {
        Objects.requireNonNull(b, "b");
        return read(b, 0, b.length);
    }

    /**
     * Reads exactly {@code len} bytes.
     *
     * @throws EOFException if the source ends before {@code len} bytes were read
     */
    default void readFully(byte[] b, int off, int len) throws IOException {
        Objects.requireNonNull(b, "b");
        Objects.checkFromIndexSize(off, len, b.length);
        int done = 0;
        while (done < len) {
            int n = read(b, off + done, len - done);
            if (n < 0) {
                throw new EOFException("Source ended after " + done + " of " + len + " bytes");
            }
            done += n;
        }
    }

    default void readFully(byte[] b) throws IOException {
        Objects.requireNonNull(b, "b");
        readFully(b, 0, b.length);
    }

    /**
     * Appends everything up to end of stream to {@code out}.
     *
     * @return number of bytes appended
     */
    default long readToEnd(ByteArrayOutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        byte[] chunk = new byte[8192];
        long total = 0;
        int n;
        while ((n = read(chunk, 0, chunk.length)) >= 0) {
            out.write(chunk, 0, n);
            total += n;
        }
        return total;
    }

    /**
     * Reads to end of stream and appends the UTF-8 decoded text to {@code out}.
     *
     * <p>Nothing is appended if the bytes are not valid UTF-8.
     *
     * @return number of bytes consumed from the source
     * @throws java.nio.charset.CharacterCodingException if the input is malformed
     */
    default int readToString(StringBuilder out) throws IOException {
        Objects.requireNonNull(out, "out");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        long n = readToEnd(bytes);
        out.append(Utf8.decode(bytes.toByteArray()));
        return Math.toIntExact(n);
    }
}
