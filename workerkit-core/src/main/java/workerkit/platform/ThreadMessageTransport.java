package workerkit.platform;

import workerkit.spi.MessagePort;
import workerkit.spi.MessageTransport;
import workerkit.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Message transport that gives each port an unbounded queue drained by a dedicated daemon
 * thread.
 *
 * <p>Messages posted to one port are delivered strictly in posting order. The delivery
 * thread exits after the port is closed and its queue is drained.
 */
public final class ThreadMessageTransport implements MessageTransport {
    private static final Logger logger = Logger.getLogger(ThreadMessageTransport.class.getName());

    private static final Object END_OF_PORT = new Object();

    private final DaemonThreadFactory threadFactory;

    public ThreadMessageTransport() {
        this.threadFactory = new DaemonThreadFactory("workerkit-port-");
    }

    @Override
    public <M> MessagePort<M> open(String name, Consumer<? super M> receiver) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(receiver, "receiver");
        QueuePort<M> port = new QueuePort<>(name, receiver);
        threadFactory.newNamedThread(port::deliverLoop, name).start();
        return port;
    }

    private static final class QueuePort<M> implements MessagePort<M> {
        private final String name;
        private final Consumer<? super M> receiver;
        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
        private boolean closed;

        QueuePort(String name, Consumer<? super M> receiver) {
            this.name = name;
            this.receiver = receiver;
        }

        @Override
        public synchronized void post(M message) {
            Objects.requireNonNull(message, "message");
            if (closed) {
                throw new IllegalStateException("Port " + name + " is closed");
            }
            queue.add(message);
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            queue.add(END_OF_PORT);
        }

        @SuppressWarnings("unchecked")
        void deliverLoop() {
            while (true) {
                Object next;
                try {
                    next = queue.take();
                } catch (InterruptedException e) {
                    logger.log(Level.WARNING, "Port " + name + " interrupted with "
                        + queue.size() + " undelivered messages");
                    Thread.currentThread().interrupt();
                    return;
                }
                if (next == END_OF_PORT) {
                    return;
                }
                try {
                    receiver.accept((M) next);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Message delivery failed on port " + name, e);
                }
            }
        }
    }
}
