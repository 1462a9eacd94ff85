package workerkit.channel;

import workerkit.ResultPromise;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * FIFO message channel between concurrently running tasks, with explicit close semantics.
 *
 * <p>A channel created with {@link #Channel()} is unbuffered: a send completes only when a
 * receiver takes the value. {@link #buffered(int)} creates a channel whose sends complete
 * immediately while fewer than {@code capacity} values are waiting. A sent value goes
 * straight to the oldest waiting receiver when there is one, bypassing the buffer, so a value
 * is never both buffered and in a receiver's hand.
 *
 * <p>Once {@linkplain #close() closed}, a channel accepts no new values; values already
 * buffered stay receivable in order, and only once they are drained does
 * {@link #receive()} fail with {@link ChannelClosedException}. Closing with a cause marks the
 * channel as failed: receivers see the cause on the exception.
 *
 * <p>Blocking operations have promise-returning counterparts ({@link #sendAsync},
 * {@link #receiveAsync}). A blocking call interrupted while waiting is withdrawn from the
 * queue and throws {@link InterruptedException}; if the hand-off already happened it
 * completes normally with the interrupt flag set instead, so no value is lost.
 *
 * <p>The channel is {@link Iterable}: each {@link #iterator()} or {@link #stream()} is a fresh
 * subscription that receives until the channel is closed and drained.
 *
 * <p>Values must not be {@code null}. This class is thread-safe; waiters are settled outside
 * the internal lock.
 *
 * @param <T> the element type
 * @see LinkedChannels
 * @see ChannelCombinators
 */
public final class Channel<T> implements Iterable<T> {
    private static final Logger logger = Logger.getLogger(Channel.class.getName());

    static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private final ArrayDeque<Receiver<? super T>> receivers = new ArrayDeque<>();
    private final ArrayDeque<PendingSend<T>> senders = new ArrayDeque<>();
    private boolean sendClosed;
    private boolean receiveClosed;
    private Throwable failure;
    private LinkedChannels.Link<T> link;

    /**
     * Creates an unbuffered channel.
     */
    public Channel() {
        this(0);
    }

    private Channel(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Creates a channel that buffers up to {@code capacity} values.
     *
     * @param capacity maximum number of buffered values
     * @param <T>      the element type
     * @return a new channel
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public static <T> Channel<T> buffered(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        return new Channel<>(capacity);
    }

    static <T> Channel<T> linkedEndpoint() {
        return new Channel<>(UNBOUNDED);
    }

    void attach(LinkedChannels.Link<T> outbound) {
        lock.lock();
        try {
            this.link = outbound;
        } finally {
            lock.unlock();
        }
    }

    // ── Sending ─────────────────────────────────────────────────────

    /**
     * Sends a value, blocking while the buffer is full and no receiver is waiting.
     *
     * @param value the value
     * @throws ChannelClosedException if the channel is closed, or closes while waiting
     * @throws InterruptedException   if interrupted before the value was accepted
     */
    public void send(T value) throws InterruptedException {
        PendingSend<T> pending = submit(value);
        try {
            pending.promise.await();
        } catch (InterruptedException e) {
            if (withdraw(pending)) {
                throw e;
            }
            try {
                pending.promise.awaitUninterruptibly();
            } finally {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Sends a value without blocking the caller.
     *
     * @param value the value
     * @return promise fulfilled once the value is accepted, or failed with
     *     {@link ChannelClosedException}
     */
    public ResultPromise<Void> sendAsync(T value) {
        return submit(value).promise;
    }

    /**
     * Sends a value only if that needs no waiting.
     *
     * @param value the value
     * @return {@code true} if the value was handed to a receiver or buffered; always
     *     {@code false} once the channel is closed
     */
    public boolean trySend(T value) {
        Objects.requireNonNull(value, "value");
        Receiver<? super T> receiver;
        lock.lock();
        try {
            if (sendClosed) {
                return false;
            }
            if (link != null) {
                link.transmit(value);
                return true;
            }
            receiver = claimReceiver();
            if (receiver == null) {
                if (buffer.size() < capacity) {
                    buffer.addLast(value);
                    return true;
                }
                return false;
            }
        } finally {
            lock.unlock();
        }
        receiver.deliver(value);
        return true;
    }

    private PendingSend<T> submit(T value) {
        Objects.requireNonNull(value, "value");
        PendingSend<T> pending = new PendingSend<>(value);
        Receiver<? super T> receiver;
        lock.lock();
        try {
            if (sendClosed) {
                pending.promise.fail(closedException());
                return pending;
            }
            if (link != null) {
                link.transmit(value);
                pending.promise.complete(null);
                return pending;
            }
            receiver = claimReceiver();
            if (receiver == null) {
                if (buffer.size() < capacity) {
                    buffer.addLast(value);
                    pending.promise.complete(null);
                } else {
                    senders.addLast(pending);
                }
                return pending;
            }
        } finally {
            lock.unlock();
        }
        receiver.deliver(value);
        pending.promise.complete(null);
        return pending;
    }

    private Receiver<? super T> claimReceiver() {
        Receiver<? super T> receiver;
        while ((receiver = receivers.pollFirst()) != null) {
            if (receiver.claim()) {
                return receiver;
            }
        }
        return null;
    }

    private boolean withdraw(PendingSend<T> pending) {
        lock.lock();
        try {
            return senders.remove(pending);
        } finally {
            lock.unlock();
        }
    }

    // ── Receiving ───────────────────────────────────────────────────

    /**
     * Receives the oldest value, blocking until one is available.
     *
     * @return the value
     * @throws ChannelClosedException if the channel is closed and drained
     * @throws InterruptedException   if interrupted before a value was handed over
     */
    public T receive() throws InterruptedException {
        PromiseReceiver<T> receiver = new PromiseReceiver<>();
        register(receiver);
        try {
            return receiver.promise.await();
        } catch (InterruptedException e) {
            if (withdraw(receiver)) {
                throw e;
            }
            try {
                return receiver.promise.awaitUninterruptibly();
            } finally {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Receives the oldest value without blocking the caller.
     *
     * @return promise of the value, failed with {@link ChannelClosedException} once the
     *     channel is closed and drained
     */
    public ResultPromise<T> receiveAsync() {
        PromiseReceiver<T> receiver = new PromiseReceiver<>();
        register(receiver);
        return receiver.promise;
    }

    /**
     * Takes the oldest value if one is ready. Never waits and never joins the receiver queue.
     *
     * @return the value, or empty
     */
    public Optional<T> tryReceive() {
        Taken<T> taken;
        lock.lock();
        try {
            if (!hasAvailable()) {
                return Optional.empty();
            }
            taken = take();
        } finally {
            lock.unlock();
        }
        taken.admit();
        return Optional.of(taken.value);
    }

    /**
     * Offers the oldest ready value to {@code receiver}, or queues it.
     */
    void register(Receiver<? super T> receiver) {
        Taken<T> taken = null;
        ChannelClosedException closed = null;
        lock.lock();
        try {
            if (hasAvailable()) {
                if (!receiver.claim()) {
                    return;
                }
                taken = take();
            } else if (receiveClosed) {
                closed = closedException();
            } else {
                receivers.addLast(receiver);
                return;
            }
        } finally {
            lock.unlock();
        }
        if (closed != null) {
            receiver.channelClosed(closed);
        } else {
            taken.admit();
            receiver.deliver(taken.value);
        }
    }

    boolean withdraw(Receiver<? super T> receiver) {
        lock.lock();
        try {
            return receivers.remove(receiver);
        } finally {
            lock.unlock();
        }
    }

    private boolean hasAvailable() {
        return !buffer.isEmpty() || !senders.isEmpty();
    }

    // Caller holds the lock and has checked hasAvailable()
    private Taken<T> take() {
        if (buffer.isEmpty()) {
            PendingSend<T> direct = senders.pollFirst();
            return new Taken<>(direct.value, direct);
        }
        T value = buffer.pollFirst();
        PendingSend<T> admitted = senders.pollFirst();
        if (admitted != null) {
            buffer.addLast(admitted.value);
        }
        return new Taken<>(value, admitted);
    }

    // ── Closing ─────────────────────────────────────────────────────

    /**
     * Closes the channel. Idempotent.
     *
     * <p>Further sends fail, waiting receivers fail with {@link ChannelClosedException}, and
     * buffered values remain receivable. On a {@linkplain LinkedChannels linked} endpoint the
     * close is transmitted to the peer and this endpoint keeps receiving until the peer
     * acknowledges.
     */
    public void close() {
        closeInternal(null);
    }

    /**
     * Closes the channel as failed. Receivers that find the channel drained get a
     * {@link ChannelClosedException} whose cause is {@code cause}.
     *
     * @param cause the failure to report
     */
    public void close(Throwable cause) {
        closeInternal(Objects.requireNonNull(cause, "cause"));
    }

    private void closeInternal(Throwable cause) {
        List<Receiver<? super T>> waiting;
        List<PendingSend<T>> rejected;
        lock.lock();
        try {
            if (sendClosed) {
                return;
            }
            sendClosed = true;
            if (link != null) {
                link.transmitEnd(cause);
                return;
            }
            receiveClosed = true;
            failure = cause;
            waiting = new ArrayList<>(receivers);
            receivers.clear();
            rejected = new ArrayList<>(senders);
            senders.clear();
        } finally {
            lock.unlock();
        }
        for (PendingSend<T> pending : rejected) {
            pending.promise.fail(closedException());
        }
        failReceivers(waiting);
    }

    void acceptInbound(T value) {
        Receiver<? super T> receiver;
        lock.lock();
        try {
            if (receiveClosed) {
                logger.warning("Dropping value received after end of stream");
                return;
            }
            receiver = claimReceiver();
            if (receiver == null) {
                buffer.addLast(value);
                return;
            }
        } finally {
            lock.unlock();
        }
        receiver.deliver(value);
    }

    void finishInbound(Throwable cause) {
        List<Receiver<? super T>> waiting;
        lock.lock();
        try {
            if (receiveClosed) {
                return;
            }
            receiveClosed = true;
            failure = cause;
            waiting = new ArrayList<>(receivers);
            receivers.clear();
        } finally {
            lock.unlock();
        }
        failReceivers(waiting);
        // The peer's close applies here too: stop sending and answer with our own end marker
        closeInternal(cause);
    }

    private void failReceivers(List<Receiver<? super T>> waiting) {
        for (Receiver<? super T> receiver : waiting) {
            receiver.channelClosed(closedException());
        }
    }

    private ChannelClosedException closedException() {
        return failure == null
            ? new ChannelClosedException()
            : new ChannelClosedException("Channel closed with failure", failure);
    }

    // ── State ───────────────────────────────────────────────────────

    /**
     * Returns {@code true} once the channel no longer accepts values.
     *
     * @return whether the channel is closed
     */
    public boolean isClosed() {
        lock.lock();
        try {
            return sendClosed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of buffered values.
     *
     * @return the buffer length
     */
    public int length() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /**
     * Returns the buffer capacity: {@code 0} for unbuffered channels and
     * {@link Integer#MAX_VALUE} for linked endpoints.
     *
     * @return the capacity
     */
    public int capacity() {
        return capacity;
    }

    // ── Sequence view ───────────────────────────────────────────────

    /**
     * Returns a new subscription that receives values until the channel is closed and drained.
     *
     * <p>{@code hasNext()} blocks. A failed channel ends the iteration by throwing its
     * {@link ChannelClosedException}; an interrupt ends it with a {@link CancellationException}.
     *
     * @return a receiving iterator
     */
    @Override
    public Iterator<T> iterator() {
        return new ReceivingIterator();
    }

    /**
     * Returns a lazy stream over a new subscription.
     *
     * @return a sequential, ordered stream
     * @see #iterator()
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    private final class ReceivingIterator implements Iterator<T> {
        private T next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            try {
                next = receive();
                return true;
            } catch (ChannelClosedException e) {
                finished = true;
                if (e.isFailure()) {
                    throw e;
                }
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for a channel value");
            }
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T value = next;
            next = null;
            return value;
        }
    }

    private static final class PendingSend<T> {
        private final T value;
        private final ResultPromise<Void> promise = new ResultPromise<>();

        PendingSend(T value) {
            this.value = value;
        }
    }

    private static final class Taken<T> {
        private final T value;
        private final PendingSend<T> admitted;

        Taken(T value, PendingSend<T> admitted) {
            this.value = value;
            this.admitted = admitted;
        }

        void admit() {
            if (admitted != null) {
                admitted.promise.complete(null);
            }
        }
    }

    private static final class PromiseReceiver<T> implements Receiver<T> {
        private final ResultPromise<T> promise = new ResultPromise<>();
        private boolean claimed;

        @Override
        public boolean claim() {
            if (claimed) {
                return false;
            }
            claimed = true;
            return true;
        }

        @Override
        public void deliver(T value) {
            promise.complete(value);
        }

        @Override
        public void channelClosed(ChannelClosedException closed) {
            promise.fail(closed);
        }
    }
}
