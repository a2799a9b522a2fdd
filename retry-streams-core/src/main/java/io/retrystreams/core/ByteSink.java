package io.retrystreams.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Byte output.
 *
 * <p>{@link #write(byte[], int, int)} is the primitive: a single attempt that may accept fewer
 * bytes than offered, in the manner of {@link java.nio.channels.WritableByteChannel}. The
 * {@code writeAll} and {@code writeFormatted} composites loop over it.
 */
public interface ByteSink extends ByteResource {

    /**
     * Writes up to {@code len} bytes from {@code b} starting at {@code off}.
     *
     * @return number of bytes accepted, possibly {@code 0}
     */
    int write(byte[] b, int off, int len) throws IOException;

    default int write(byte[] b) throws IOException {
        Objects.requireNonNull(b, "b");
        return write(b, 0, b.length);
    }

    /** Pushes buffered output to its destination. */
    void flush() throws IOException;

    /**
     * Writes all {@code len} bytes, looping over {@link #write(byte[], int, int)}.
     *
     * @throws IOException if a write accepts no bytes
     */
    default void writeAll(byte[] b, int off, int len) throws IOException {
        Objects.requireNonNull(b, "b");
        Objects.checkFromIndexSize(off, len, b.length);
        while (len > 0) {
            int n = write(b, off, len);
            if (n <= 0) {
                throw new IOException("failed to write whole buffer");
            }
            off += n;
            len -= n;
        }
    }

    default void writeAll(byte[] b) throws IOException {
        Objects.requireNonNull(b, "b");
        writeAll(b, 0, b.length);
    }

    /**
     * Formats with {@link String#format(Locale, String, Object...)} in {@link Locale#ROOT} and
     * writes the UTF-8 encoding with {@link #writeAll(byte[])}.
     */
    default void writeFormatted(String format, Object... args) throws IOException {
        Objects.requireNonNull(format, "format");
        writeAll(String.format(Locale.ROOT, format, args).getBytes(StandardCharsets.UTF_8));
    }
}
