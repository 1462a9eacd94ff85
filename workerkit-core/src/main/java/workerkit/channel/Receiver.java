package workerkit.channel;

/**
 * A party waiting in a channel's receiver queue.
 *
 * <p>{@link #claim()} is called under the channel's lock and decides whether this receiver
 * takes the value on offer; it returns {@code false} once the receiver is satisfied
 * elsewhere, in which case the channel skips it. {@link #deliver} and {@link #channelClosed}
 * run after the lock is released.
 */
interface Receiver<T> {

    boolean claim();

    void deliver(T value);

    void channelClosed(ChannelClosedException closed);
}
