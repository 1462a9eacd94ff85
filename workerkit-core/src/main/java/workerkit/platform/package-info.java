/**
 * Thread-backed implementations of the {@linkplain workerkit.spi worker and transport SPIs}.
 *
 * <p>{@link workerkit.platform.ThreadWorkerPlatform} spawns one daemon thread per worker and is
 * the dispatcher's default. {@link workerkit.platform.ExecutorWorkerPlatform} runs workers on a
 * pooled executor. {@link workerkit.platform.ThreadMessageTransport} backs cross-worker channels.
 */
package workerkit.platform;
