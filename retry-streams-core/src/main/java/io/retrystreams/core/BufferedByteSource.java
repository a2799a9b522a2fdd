package io.retrystreams.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Byte input with an internal look-ahead buffer.
 *
 * <p>{@link #fillBuffer()} is the primitive: it exposes the buffered, unread bytes and refills
 * from the underlying source only when none are left. {@link #consume(int)} performs no I/O.
 */
public interface BufferedByteSource extends ByteSource {

    /**
     * Returns a read-only view of the buffered, unread bytes, refilling if the buffer is empty.
     *
     * <p>An empty view means end of stream. The view is invalidated by the next call to any
     * other method of this source.
     */
    ByteBuffer fillBuffer() throws IOException;

    /**
     * Marks {@code n} bytes of the current buffer as read.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     */
    void consume(int n);

    /**
     * Appends bytes up to and including {@code delimiter}, or up to end of stream, to {@code out}.
     *
     * @return number of bytes appended
     */
    default long readUntil(byte delimiter, ByteArrayOutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        long total = 0;
        while (true) {
            ByteBuffer available = fillBuffer();
            if (!available.hasRemaining()) {
                return total;
            }
            int start = available.position();
            int end = available.limit();
            int used = end - start;
            boolean found = false;
            for (int i = start; i < end; i++) {
                if (available.get(i) == delimiter) {
                    used = i - start + 1;
                    found = true;
                    break;
                }
            }
            byte[] chunk = new byte[used];
            available.get(chunk);
            out.write(chunk, 0, used);
            consume(used);
            total += used;
            if (found) {
                return total;
            }
        }
    }

    /**
     * Reads one line, including its {@code '\n'} terminator if present, as UTF-8 text.
     *
     * @return number of bytes read, {@code 0} at end of stream
     * @throws java.nio.charset.CharacterCodingException if the line is not valid UTF-8
     */
    default int readLine(StringBuilder out) throws IOException {
        Objects.requireNonNull(out, "out");
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        long n = readUntil((byte) '\n', line);
        out.append(Utf8.decode(line.toByteArray()));
        return Math.toIntExact(n);
    }
}
