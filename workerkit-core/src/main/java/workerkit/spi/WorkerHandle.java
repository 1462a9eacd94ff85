package workerkit.spi;

/**
 * Control handle for one spawned worker.
 */
public interface WorkerHandle {

    String name();

    /**
     * Tears the worker down and releases its messaging resources.
     *
     * <p>Idempotent. Once the worker has delivered its result, terminating it only releases
     * resources and never disturbs the delivery.
     */
    void terminate();
}
