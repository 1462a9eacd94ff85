/**
 * Spring Boot auto-configuration for workerkit.
 *
 * <p>{@link workerkit.spring.boot.WorkerKitAutoConfiguration} wires a
 * {@link workerkit.dispatch.WorkerDispatcher} and its collaborators from {@code workerkit.*}
 * application properties. {@link workerkit.spring.boot.WorkerKitMicrometerAutoConfiguration}
 * adds Micrometer metrics when a meter registry is present.
 *
 * @see workerkit.spring.boot.WorkerKitProperties
 */
package workerkit.spring.boot;
