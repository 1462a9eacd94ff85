package workerkit.channel;

/**
 * Value chosen by {@link ChannelCombinators#select(java.util.List)}.
 *
 * @param index position of the source channel in the list passed to {@code select}
 * @param value the value received from that channel
 */
public record Selected<T>(int index, T value) {
}
