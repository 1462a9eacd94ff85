package workerkit.channel;

/**
 * Thrown when sending to a closed channel, or receiving from a channel that is closed and
 * drained.
 *
 * <p>A channel closed with {@link Channel#close(Throwable)} reports that error as the
 * {@linkplain #getCause() cause}; a plain {@link Channel#close()} leaves the cause
 * {@code null}, marking normal completion.
 */
public class ChannelClosedException extends RuntimeException {

    public ChannelClosedException() {
        super("Channel is closed");
    }

    public ChannelClosedException(String message) {
        super(message);
    }

    public ChannelClosedException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns whether the channel was closed because of an error rather than completed.
     *
     * @return {@code true} if a cause is attached
     */
    public boolean isFailure() {
        return getCause() != null;
    }
}
