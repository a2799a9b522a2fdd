package io.retrystreams.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingBufferedSourceTest {

    private static final byte[] DATA = "Read test".getBytes(StandardCharsets.UTF_8);

    @Test
    void fillBufferRetriesInterruptedRefill() throws Exception {
        FlakySource flaky = new FlakySource(DATA, new InterruptedIOException());
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source =
                Retry.buffered(new BufferedSourceReader<>(flaky, DATA.length));

        ByteBuffer view = source.fillBuffer();

        assertThat(bytes(view)).isEqualTo(DATA);
        assertThat(flaky.attempts).isEqualTo(2);
    }

    @Test
    void fillBufferReturnsBufferedBytesWithoutFurtherReads() throws Exception {
        FlakySource flaky = new FlakySource(DATA);
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source =
                Retry.buffered(new BufferedSourceReader<>(flaky, 4));

        assertThat(bytes(source.fillBuffer())).isEqualTo("Read".getBytes(StandardCharsets.UTF_8));
        source.consume(2);
        assertThat(bytes(source.fillBuffer())).isEqualTo("ad".getBytes(StandardCharsets.UTF_8));
        assertThat(flaky.attempts).isEqualTo(1);
    }

    @Test
    void fillBufferPropagatesOtherFailures() {
        AccessDeniedException denied = new AccessDeniedException("/secret");
        FlakySource flaky = new FlakySource(DATA, denied);
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source =
                Retry.buffered(new BufferedSourceReader<>(flaky));

        assertThatThrownBy(source::fillBuffer).isSameAs(denied);
        assertThat(flaky.attempts).isEqualTo(1);
    }

    @Test
    void fillBufferAtEndOfStreamIsEmpty() throws Exception {
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source =
                Retry.buffered(new BufferedSourceReader<>(new FlakySource(new byte[0], new InterruptedIOException())));

        assertThat(source.fillBuffer().hasRemaining()).isFalse();
    }

    @Test
    void readIsRetriedOnBufferedSource() throws Exception {
        FlakySource flaky = new FlakySource(DATA, new InterruptedIOException());
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source =
                Retry.buffered(new BufferedSourceReader<>(flaky));

        byte[] out = new byte[DATA.length];
        assertThat(source.read(out)).isEqualTo(DATA.length);
        assertThat(out).isEqualTo(DATA);
    }

    @Test
    void readLineIsForwardedWithoutRetry() {
        InterruptedIOException interruption = new InterruptedIOException();
        FlakySource flaky = new FlakySource("one\ntwo\n".getBytes(StandardCharsets.UTF_8), interruption);
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source =
                Retry.buffered(new BufferedSourceReader<>(flaky));

        assertThatThrownBy(() -> source.readLine(new StringBuilder())).isSameAs(interruption);
    }

    @Test
    void readLineAndReadUntilUseInnerImplementation() throws Exception {
        FlakySource flaky = new FlakySource("one\ntwo;three".getBytes(StandardCharsets.UTF_8));
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source =
                Retry.buffered(new BufferedSourceReader<>(flaky, 3));

        StringBuilder line = new StringBuilder();
        assertThat(source.readLine(line)).isEqualTo(4);
        assertThat(line.toString()).isEqualTo("one\n");

        ByteArrayOutputStream field = new ByteArrayOutputStream();
        assertThat(source.readUntil((byte) ';', field)).isEqualTo(4);
        assertThat(field.toString(StandardCharsets.UTF_8)).isEqualTo("two;");

        ByteArrayOutputStream rest = new ByteArrayOutputStream();
        assertThat(source.readUntil((byte) ';', rest)).isEqualTo(5);
        assertThat(rest.toString(StandardCharsets.UTF_8)).isEqualTo("three");
    }

    @Test
    void unwrapReturnsReaderWithItsBufferIntact() throws Exception {
        BufferedSourceReader<FlakySource> reader = new BufferedSourceReader<>(new FlakySource(DATA), 16);
        RetryingBufferedSource<BufferedSourceReader<FlakySource>> source = Retry.buffered(reader);
        source.fillBuffer();
        source.consume(5);

        assertThat(source.unwrap()).isSameAs(reader);
        assertThat(reader.buffered()).isEqualTo(4);
    }

    private static byte[] bytes(ByteBuffer view) {
        byte[] out = new byte[view.remaining()];
        view.duplicate().get(out);
        return out;
    }
}
