/**
 * Byte-stream decorators that retry operations interrupted before making progress.
 *
 * <p>This module contains:
 * <ul>
 *   <li>The capability interfaces {@link io.retrystreams.core.ByteSource},
 *       {@link io.retrystreams.core.BufferedByteSource} and {@link io.retrystreams.core.ByteSink}</li>
 *   <li>Adapters to and from {@code java.io} streams, and a buffered reader</li>
 *   <li>The retrying wrappers, created through {@link io.retrystreams.core.Retry}</li>
 * </ul>
 *
 * <p>Only the single-step primitives (read, buffer refill, write) are retried. Composite
 * operations are forwarded once to the wrapped resource. Everything runs on the calling thread.
 */
package io.retrystreams.core;
