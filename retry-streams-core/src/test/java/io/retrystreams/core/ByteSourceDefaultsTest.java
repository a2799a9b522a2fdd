package io.retrystreams.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ByteSourceDefaultsTest {

    @Test
    void readFullyLoopsOverShortReads() throws Exception {
        ByteSource oneAtATime = oneByteAtATime("abcdef".getBytes(StandardCharsets.UTF_8));

        byte[] out = new byte[6];
        oneAtATime.readFully(out);

        assertThat(new String(out, StandardCharsets.UTF_8)).isEqualTo("abcdef");
    }

    @Test
    void readFullyThrowsOnShortSource() {
        ByteSource source = oneByteAtATime("abc".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> source.readFully(new byte[4]))
                .isInstanceOf(EOFException.class)
                .hasMessageContaining("3 of 4");
    }

    @Test
    void readToStringRejectsMalformedUtf8() {
        ByteSource source = oneByteAtATime(new byte[] {'o', 'k', (byte) 0xC3});
        StringBuilder out = new StringBuilder();

        assertThatThrownBy(() -> source.readToString(out)).isInstanceOf(CharacterCodingException.class);
        assertThat(out).isEmpty();
    }

    @Test
    void readToStringDecodesMultiByteText() throws Exception {
        ByteSource source = oneByteAtATime("héllo".getBytes(StandardCharsets.UTF_8));
        StringBuilder out = new StringBuilder();

        assertThat(source.readToString(out)).isEqualTo(6);
        assertThat(out.toString()).isEqualTo("héllo");
    }

    @Test
    void inputStreamSourceReadsAndUnwraps() throws Exception {
        ByteArrayInputStream in = new ByteArrayInputStream("stream".getBytes(StandardCharsets.UTF_8));
        ByteSources.InputStreamSource<ByteArrayInputStream> source = ByteSources.of(in);

        byte[] head = new byte[3];
        assertThat(source.read(head)).isEqualTo(3);
        ByteArrayOutputStream rest = new ByteArrayOutputStream();
        assertThat(source.readToEnd(rest)).isEqualTo(3);

        assertThat(new String(head, StandardCharsets.UTF_8)).isEqualTo("str");
        assertThat(rest.toString(StandardCharsets.UTF_8)).isEqualTo("eam");
        assertThat(source.unwrap()).isSameAs(in);
        assertThat(source.read(head)).isEqualTo(-1);
    }

    @Test
    void asInputStreamSupportsSingleByteReads() throws Exception {
        InputStream in = ByteSources.asInputStream(oneByteAtATime(new byte[] {(byte) 0xFF, 1}));

        assertThat(in.read()).isEqualTo(255);
        assertThat(in.read()).isEqualTo(1);
        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    void writeAllFailsWhenSinkAcceptsNothing() {
        ByteSink stuck = new ByteSink() {
            @Override
            public int write(byte[] b, int off, int len) {
                return 0;
            }

            @Override
            public void flush() {
            }
        };

        assertThatThrownBy(() -> stuck.writeAll(new byte[] {1}))
                .isInstanceOf(IOException.class)
                .hasMessage("failed to write whole buffer");
    }

    @Test
    void outputStreamSinkWritesEverythingAndUnwraps() throws Exception {
        ByteArrayOutputStream target = new ByteArrayOutputStream();
        ByteSinks.OutputStreamSink<ByteArrayOutputStream> sink = ByteSinks.of(target);

        assertThat(sink.write(new byte[] {1, 2, 3}, 1, 2)).isEqualTo(2);
        sink.writeFormatted("%d", 7);

        assertThat(target.toByteArray()).containsExactly(2, 3, '7');
        assertThat(sink.unwrap()).isSameAs(target);
    }

    private static ByteSource oneByteAtATime(byte[] data) {
        int[] pos = {0};
        return (b, off, len) -> {
            if (len == 0) return 0;
            if (pos[0] >= data.length) return -1;
            b[off] = data[pos[0]++];
            return 1;
        };
    }
}
