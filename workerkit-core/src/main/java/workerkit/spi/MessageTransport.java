package workerkit.spi;

import java.util.function.Consumer;

/**
 * Platform message-transport primitive used to link channel endpoints across workers.
 *
 * @see workerkit.platform.ThreadMessageTransport
 * @see workerkit.channel.LinkedChannels
 */
public interface MessageTransport {

    /**
     * Opens a port whose messages are handed to {@code receiver}, one at a time and in
     * posting order.
     *
     * @param name     port name, for diagnostics
     * @param receiver consumer invoked for every delivered message
     * @param <M>      the message type
     * @return the sending side of the port
     */
    <M> MessagePort<M> open(String name, Consumer<? super M> receiver);
}
