package io.retrystreams.core;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Entry point for wrapping a resource so that its primitive operations are retried when they
 * fail with a transient interruption (see {@link Interruptions#isTransient}).
 *
 * <p>Each factory takes ownership of the resource and returns a wrapper exposing the same
 * capability. Every other failure reaches the caller unchanged on its first occurrence.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryingSink<ByteSinks.OutputStreamSink<ByteArrayOutputStream>> sink =
 *         Retry.sink(ByteSinks.of(new ByteArrayOutputStream()));
 * sink.write(payload);
 * ByteArrayOutputStream written = sink.unwrap().unwrap();
 * }</pre>
 *
 * <p>Without an explicit {@link RetryPolicy} the retry loop is unbounded and spins for as long as
 * the resource keeps reporting interruptions.
 */
public final class Retry {

    private Retry() {}

    public static <S extends ByteSource> RetryingSource<S> source(S source) {
        return source(source, RetryPolicy.unbounded());
    }

    public static <S extends ByteSource> RetryingSource<S> source(S source, RetryPolicy policy) {
        return new RetryingSource<>(source, policy);
    }

    public static <B extends BufferedByteSource> RetryingBufferedSource<B> buffered(B source) {
        return buffered(source, RetryPolicy.unbounded());
    }

    public static <B extends BufferedByteSource> RetryingBufferedSource<B> buffered(B source, RetryPolicy policy) {
        return new RetryingBufferedSource<>(source, policy);
    }

    public static <K extends ByteSink> RetryingSink<K> sink(K sink) {
        return sink(sink, RetryPolicy.unbounded());
    }

    public static <K extends ByteSink> RetryingSink<K> sink(K sink, RetryPolicy policy) {
        return new RetryingSink<>(sink, policy);
    }

    public static <T extends ByteSource & ByteSink> RetryingDuplex<T> duplex(T resource) {
        return duplex(resource, RetryPolicy.unbounded());
    }

    public static <T extends ByteSource & ByteSink> RetryingDuplex<T> duplex(T resource, RetryPolicy policy) {
        return new RetryingDuplex<>(resource, policy);
    }

    public static <T extends BufferedByteSource & ByteSink> RetryingBufferedDuplex<T> bufferedDuplex(T resource) {
        return bufferedDuplex(resource, RetryPolicy.unbounded());
    }

    public static <T extends BufferedByteSource & ByteSink> RetryingBufferedDuplex<T> bufferedDuplex(T resource,
            RetryPolicy policy) {
        return new RetryingBufferedDuplex<>(resource, policy);
    }

    public static RetryingInputStream inputStream(InputStream in) {
        return inputStream(in, RetryPolicy.unbounded());
    }

    public static RetryingInputStream inputStream(InputStream in, RetryPolicy policy) {
        return new RetryingInputStream(in, policy);
    }

    public static RetryingOutputStream outputStream(OutputStream out) {
        return outputStream(out, RetryPolicy.unbounded());
    }

    public static RetryingOutputStream outputStream(OutputStream out, RetryPolicy policy) {
        return new RetryingOutputStream(out, policy);
    }
}
