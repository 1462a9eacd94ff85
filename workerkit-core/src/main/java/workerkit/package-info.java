/**
 * Concurrency toolkit for offloading work to isolated workers and coordinating tasks
 * through channels.
 *
 * <h2>Core Design</h2>
 * <p>Callers hand {@link workerkit.Task tasks} to a
 * {@linkplain workerkit.dispatch.WorkerDispatcher dispatcher}, which spawns one worker per
 * task and reports back through a {@link workerkit.ResultPromise}. A
 * {@linkplain workerkit.dispatch.ConcurrencyLimiter limiter} caps how many workers run at
 * once using a FIFO {@linkplain workerkit.sync.Semaphore semaphore}.
 * {@linkplain workerkit.channel.Channel Channels} carry values between concurrently running
 * tasks, locally or across a {@linkplain workerkit.spi.MessageTransport transport}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>workerkit-core</b>: promises, dispatcher, limiter, channels (zero external deps)</li>
 *   <li><b>workerkit-micrometer</b>: {@linkplain workerkit.spi.MetricsExporter metrics}
 *       bridge to Micrometer</li>
 *   <li><b>workerkit-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (WorkerDispatcher dispatcher = WorkerDispatcher.builder().build()) {
 *     ResultPromise<Long> sum = dispatcher.launch(() -> LongStream.range(0, 1_000_000).sum());
 *     List<String> pages = dispatcher.launchWithLimit(
 *         urls.stream().<Task<String>>map(url -> () -> fetch(url)).toList(), 5).await();
 *
 *     Channel<String> lines = Channel.buffered(16);
 *     dispatcher.launch(() -> {
 *         for (String line : pages) lines.send(line);
 *         lines.close();
 *         return null;
 *     });
 *     lines.stream().forEach(System.out::println);
 * }
 * }</pre>
 *
 * @see workerkit.dispatch.WorkerDispatcher
 * @see workerkit.channel.Channel
 * @see workerkit.ResultPromise
 */
package workerkit;
