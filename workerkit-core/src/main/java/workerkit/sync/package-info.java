/**
 * Admission control. {@link workerkit.sync.Semaphore} bounds how many holders proceed at once
 * and queues the rest in arrival order.
 */
package workerkit.sync;
