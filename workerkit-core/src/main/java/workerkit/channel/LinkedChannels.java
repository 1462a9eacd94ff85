package workerkit.channel;

import workerkit.spi.MessagePort;
import workerkit.spi.MessageTransport;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Opens a pair of channel endpoints connected through a {@link MessageTransport}, so that
 * two workers that share no memory can exchange values.
 *
 * <p>A value sent on one endpoint is received on the other; the link is bidirectional and
 * each direction is FIFO. Sends on a linked endpoint never block: the peer buffers without
 * limit.
 *
 * <p>Closing is a two-step handshake. {@link Channel#close()} on one endpoint stops its
 * sends and transmits an end marker behind every value already sent. The peer, on reading
 * the marker, stops receiving once drained and closes its own side, which answers with its
 * own marker. A send that returned normally is therefore always delivered, even when the
 * peer closes concurrently.
 */
public final class LinkedChannels {
    private static final Logger logger = Logger.getLogger(LinkedChannels.class.getName());
    private static final AtomicLong LINK_COUNTER = new AtomicLong();

    private LinkedChannels() {
    }

    /**
     * The two ends of a link.
     *
     * @param first  one endpoint
     * @param second the other endpoint
     */
    public record Endpoints<T>(Channel<T> first, Channel<T> second) {
    }

    public static <T> Endpoints<T> open(MessageTransport transport) {
        return open(transport, "link-" + LINK_COUNTER.incrementAndGet());
    }

    /**
     * Opens a linked pair.
     *
     * @param transport transport carrying both directions
     * @param name      link name used for the underlying ports
     * @param <T>       the element type
     * @return the connected endpoints
     */
    public static <T> Endpoints<T> open(MessageTransport transport, String name) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(name, "name");
        Channel<T> first = Channel.linkedEndpoint();
        Channel<T> second = Channel.linkedEndpoint();
        String forward = name + "-forward";
        String backward = name + "-backward";
        MessagePort<Frame<T>> toSecond = transport.open(forward, new Inbound<T>(second, forward));
        MessagePort<Frame<T>> toFirst = transport.open(backward, new Inbound<T>(first, backward));
        first.attach(new Link<>(toSecond));
        second.attach(new Link<>(toFirst));
        return new Endpoints<>(first, second);
    }

    sealed interface Frame<T> permits Value, End {
        long seq();
    }

    record Value<T>(long seq, T value) implements Frame<T> {
    }

    record End<T>(long seq, Throwable cause) implements Frame<T> {
    }

    /**
     * Outbound side of an endpoint. Called only under the owning channel's lock, which keeps
     * sequence numbers and posting order aligned.
     */
    static final class Link<T> {
        private final MessagePort<Frame<T>> port;
        private long nextSeq;

        Link(MessagePort<Frame<T>> port) {
            this.port = port;
        }

        void transmit(T value) {
            port.post(new Value<>(nextSeq++, value));
        }

        void transmitEnd(Throwable cause) {
            port.post(new End<>(nextSeq++, cause));
            port.close();
        }
    }

    private static final class Inbound<T> implements Consumer<Frame<T>> {
        private final Channel<T> channel;
        private final String portName;
        private long expectedSeq;

        Inbound(Channel<T> channel, String portName) {
            this.channel = channel;
            this.portName = portName;
        }

        @Override
        public void accept(Frame<T> frame) {
            if (frame.seq() != expectedSeq) {
                logger.severe("Out-of-order frame on " + portName
                    + ": expected seq " + expectedSeq + ", got " + frame.seq());
            }
            expectedSeq = frame.seq() + 1;
            if (frame instanceof Value<T> value) {
                channel.acceptInbound(value.value());
            } else if (frame instanceof End<T> end) {
                channel.finishInbound(end.cause());
            }
        }
    }
}
