/**
 * Fault-injecting sources and sinks for exercising code against short and interrupted I/O.
 */
package io.retrystreams.testkit;
