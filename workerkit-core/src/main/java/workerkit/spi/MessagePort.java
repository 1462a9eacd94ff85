package workerkit.spi;

/**
 * Sending side of a one-directional, FIFO message transport.
 *
 * @param <M> the message type
 */
public interface MessagePort<M> extends AutoCloseable {

    /**
     * Posts a message without blocking. Messages are delivered in posting order.
     *
     * @param message the message
     * @throws IllegalStateException if the port is closed
     */
    void post(M message);

    /**
     * Stops accepting messages. Messages already posted are still delivered, after which the
     * port releases its resources. Idempotent.
     */
    @Override
    void close();
}
