package workerkit.channel;

import workerkit.ResultPromise;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Operations over several channels: first-ready selection, fan-in and mapping.
 */
public final class ChannelCombinators {

    private ChannelCombinators() {
    }

    /**
     * Receives exactly one value from whichever source has one first.
     *
     * <p>The selection joins every source's receiver queue; the first source able to hand
     * over a value claims the selection and the others are withdrawn before they can take a
     * value, so nothing is consumed from a channel that did not win. Sources with a value
     * already available are favored in list order.
     *
     * <p>The promise fails with the source's {@link ChannelClosedException} as soon as any
     * source is found closed with a failure, and with a cause-less
     * {@code ChannelClosedException} once every source is closed and drained.
     *
     * @param sources channels to select from
     * @param <T>     common element type
     * @return promise of the chosen value and the index of its source
     * @throws IllegalArgumentException if {@code sources} is empty
     */
    public static <T> ResultPromise<Selected<T>> select(List<? extends Channel<? extends T>> sources) {
        Objects.requireNonNull(sources, "sources");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("select needs at least one channel");
        }
        return Selection.<T>start(sources, 0).promise;
    }

    /**
     * Interleaves the values of several channels into one lazy stream.
     *
     * <p>Each element is obtained by a fresh selection whose starting channel rotates, so a
     * busy channel cannot starve the others. The stream ends once every channel is closed and
     * drained, and throws {@link ChannelClosedException} if any channel fails.
     *
     * @param channels channels to merge
     * @param <T>      common element type
     * @return a sequential stream of the merged values
     */
    public static <T> Stream<T> merge(List<? extends Channel<? extends T>> channels) {
        Objects.requireNonNull(channels, "channels");
        if (channels.isEmpty()) {
            return Stream.empty();
        }
        Iterator<T> merged = new MergeIterator<T>(List.<Channel<? extends T>>copyOf(channels));
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(merged, Spliterator.NONNULL), false);
    }

    /**
     * Maps the values of {@code source} lazily, one at a time as they are received.
     *
     * @param source    channel to read
     * @param transform function applied to every value
     * @param <T>       source element type
     * @param <R>       result element type
     * @return a stream of transformed values that ends when {@code source} completes
     */
    public static <T, R> Stream<R> pipeline(Channel<T> source, Function<? super T, ? extends R> transform) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        return source.stream().map(transform);
    }

    private static final class Selection<T> {
        private final ResultPromise<Selected<T>> promise = new ResultPromise<>();
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final AtomicInteger closedSources = new AtomicInteger();
        private final int sourceCount;
        private final List<Registration<T>> registrations = new ArrayList<>();

        private Selection(int sourceCount) {
            this.sourceCount = sourceCount;
        }

        static <T> Selection<T> start(List<? extends Channel<? extends T>> sources, int offset) {
            int size = sources.size();
            Selection<T> selection = new Selection<>(size);
            for (int k = 0; k < size && !selection.claimed.get(); k++) {
                int index = (offset + k) % size;
                Channel<? extends T> source = sources.get(index);
                Receiver<T> receiver = selection.new SourceReceiver(index);
                selection.registrations.add(new Registration<>(source, receiver));
                source.register(receiver);
            }
            selection.promise.onComplete(outcome -> selection.withdrawAll());
            return selection;
        }

        /**
         * Abandons the selection if no source has claimed it yet.
         *
         * @return {@code true} if cancelled; {@code false} if a source already won
         */
        boolean cancel() {
            if (claimed.compareAndSet(false, true)) {
                promise.fail(new CancellationException("Selection cancelled"));
                return true;
            }
            return false;
        }

        // Runs once settled; registrations is no longer modified by then
        private void withdrawAll() {
            for (Registration<T> registration : registrations) {
                registration.withdraw();
            }
        }

        private final class SourceReceiver implements Receiver<T> {
            private final int index;

            SourceReceiver(int index) {
                this.index = index;
            }

            @Override
            public boolean claim() {
                return claimed.compareAndSet(false, true);
            }

            @Override
            public void deliver(T value) {
                promise.complete(new Selected<>(index, value));
            }

            @Override
            public void channelClosed(ChannelClosedException closed) {
                if (closed.isFailure()) {
                    if (claimed.compareAndSet(false, true)) {
                        promise.fail(closed);
                    }
                    return;
                }
                if (closedSources.incrementAndGet() == sourceCount && claimed.compareAndSet(false, true)) {
                    promise.fail(new ChannelClosedException("All selected channels are closed"));
                }
            }
        }
    }

    private record Registration<T>(Channel<? extends T> source, Receiver<T> receiver) {
        void withdraw() {
            source.withdraw(receiver);
        }
    }

    private static final class MergeIterator<T> implements Iterator<T> {
        private final List<Channel<? extends T>> channels;
        private int offset;
        private T next;
        private boolean finished;

        MergeIterator(List<Channel<? extends T>> channels) {
            this.channels = channels;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            Selection<T> selection = Selection.start(channels, offset);
            offset = (offset + 1) % channels.size();
            try {
                try {
                    next = selection.promise.await().value();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    if (selection.cancel()) {
                        throw new CancellationException("Interrupted while merging channels");
                    }
                    next = selection.promise.awaitUninterruptibly().value();
                }
                return true;
            } catch (ChannelClosedException e) {
                finished = true;
                if (e.isFailure()) {
                    throw e;
                }
                return false;
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
}
