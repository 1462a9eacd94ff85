/**
 * Message channels.
 *
 * <p>{@link workerkit.channel.Channel} is an in-process FIFO channel, unbuffered or buffered,
 * usable as a blocking queue, through promises, or as an {@link java.lang.Iterable}.
 * {@link workerkit.channel.LinkedChannels} connects two endpoints over a
 * {@link workerkit.spi.MessageTransport} for workers that share no memory.
 * {@link workerkit.channel.ChannelCombinators} selects across, merges and maps channels.
 */
package workerkit.channel;
