package workerkit.channel;

import org.junit.jupiter.api.Test;
import workerkit.ResultPromise;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelCombinatorsTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    // ── select ──────────────────────────────────────────────────────

    @Test
    void selectRejectsEmptyList() {
        assertThrows(IllegalArgumentException.class, () -> ChannelCombinators.select(List.of()));
    }

    @Test
    void selectTakesReadyValue() throws Exception {
        Channel<String> a = Channel.buffered(1);
        Channel<String> b = Channel.buffered(1);
        b.trySend("from-b");

        Selected<String> selected = ChannelCombinators.<String>select(List.of(a, b)).await(WAIT);

        assertEquals(1, selected.index());
        assertEquals("from-b", selected.value());
    }

    @Test
    void selectWaitsForFirstSender() throws Exception {
        Channel<Integer> a = new Channel<>();
        Channel<Integer> b = new Channel<>();
        ResultPromise<Selected<Integer>> selection = ChannelCombinators.select(List.of(a, b));

        assertFalse(selection.isDone());
        assertTrue(a.trySend(10));

        assertEquals(new Selected<>(0, 10), selection.await(WAIT));
    }

    @Test
    void losingSourcesKeepTheirValues() throws Exception {
        Channel<String> a = new Channel<>();
        Channel<String> b = Channel.buffered(2);
        ResultPromise<Selected<String>> selection = ChannelCombinators.select(List.of(a, b));

        b.trySend("winner");
        selection.await(WAIT);
        b.trySend("kept");

        assertFalse(a.trySend("no receiver left"));
        assertEquals(Optional.of("kept"), b.tryReceive());
    }

    @Test
    void selectFailsWhenAllSourcesClosed() {
        Channel<String> a = Channel.buffered(1);
        Channel<String> b = Channel.buffered(1);
        ResultPromise<Selected<String>> selection = ChannelCombinators.select(List.of(a, b));

        a.close();
        assertFalse(selection.isDone());
        b.close();

        ChannelClosedException closed = assertThrows(ChannelClosedException.class, () -> selection.await(WAIT));
        assertFalse(closed.isFailure());
    }

    @Test
    void selectFailsFastOnFailedSource() {
        Channel<String> healthy = Channel.buffered(1);
        Channel<String> broken = Channel.buffered(1);
        broken.close(new IllegalStateException("broken"));

        ChannelClosedException closed = assertThrows(ChannelClosedException.class,
                () -> ChannelCombinators.<String>select(List.of(healthy, broken)).await(WAIT));
        assertTrue(closed.isFailure());
    }

    @Test
    void selectPrefersBufferedValueOverClosure() throws Exception {
        Channel<String> a = Channel.buffered(1);
        a.trySend("last");
        a.close();

        assertEquals("last", ChannelCombinators.<String>select(List.of(a)).await(WAIT).value());
    }

    // ── merge ───────────────────────────────────────────────────────

    @Test
    void mergeCollectsEveryValueAndEnds() {
        List<Channel<Integer>> channels = new ArrayList<>();
        for (int c = 0; c < 3; c++) {
            Channel<Integer> channel = Channel.buffered(10);
            for (int i = 0; i < 5; i++) {
                channel.trySend(c * 100 + i);
            }
            channel.close();
            channels.add(channel);
        }

        List<Integer> merged = ChannelCombinators.<Integer>merge(channels).collect(Collectors.toList());

        assertEquals(15, merged.size());
        assertEquals(15, new HashSet<>(merged).size());
    }

    @Test
    void mergeKeepsPerChannelOrder() {
        Channel<Integer> a = Channel.buffered(10);
        Channel<Integer> b = Channel.buffered(10);
        for (int i = 0; i < 5; i++) {
            a.trySend(i);
            b.trySend(100 + i);
        }
        a.close();
        b.close();

        List<Integer> merged = ChannelCombinators.<Integer>merge(List.of(a, b)).collect(Collectors.toList());

        List<Integer> fromA = merged.stream().filter(v -> v < 100).collect(Collectors.toList());
        List<Integer> fromB = merged.stream().filter(v -> v >= 100).collect(Collectors.toList());
        assertEquals(List.of(0, 1, 2, 3, 4), fromA);
        assertEquals(List.of(100, 101, 102, 103, 104), fromB);
    }

    @Test
    void mergeDoesNotStarveQuietChannel() {
        Channel<String> busy = Channel.buffered(100);
        Channel<String> quiet = Channel.buffered(1);
        for (int i = 0; i < 100; i++) {
            busy.trySend("busy");
        }
        quiet.trySend("quiet");

        List<String> firstFew = ChannelCombinators.<String>merge(List.of(busy, quiet))
                .limit(4)
                .collect(Collectors.toList());

        assertTrue(firstFew.contains("quiet"), "merged: " + firstFew);
    }

    @Test
    void mergeWaitsForConcurrentProducers() {
        Channel<Integer> a = new Channel<>();
        Channel<Integer> b = new Channel<>();
        startProducer(a, 0, 10);
        startProducer(b, 10, 20);

        Set<Integer> merged = ChannelCombinators.<Integer>merge(List.of(a, b)).collect(Collectors.toSet());

        assertEquals(20, merged.size());
    }

    @Test
    void mergeThrowsOnFailedChannel() {
        Channel<String> a = Channel.buffered(1);
        a.close(new IllegalStateException("failed"));

        assertThrows(ChannelClosedException.class,
                () -> ChannelCombinators.<String>merge(List.of(a)).collect(Collectors.toList()));
    }

    @Test
    void mergeOfNothingIsEmpty() {
        assertEquals(0, ChannelCombinators.<String>merge(List.of()).count());
    }

    // ── pipeline ────────────────────────────────────────────────────

    @Test
    void pipelineMapsInOrder() {
        Channel<Integer> source = Channel.buffered(4);
        for (int i = 1; i <= 4; i++) {
            source.trySend(i);
        }
        source.close();

        List<String> mapped = ChannelCombinators.pipeline(source, i -> "#" + i).collect(Collectors.toList());

        assertEquals(List.of("#1", "#2", "#3", "#4"), mapped);
    }

    @Test
    void pipelineIsLazy() {
        Channel<Integer> source = Channel.buffered(2);
        source.trySend(1);
        source.trySend(2);
        List<Integer> applied = new ArrayList<>();

        Optional<Integer> first = ChannelCombinators.pipeline(source, i -> {
            applied.add(i);
            return i * 10;
        }).findFirst();

        assertEquals(Optional.of(10), first);
        assertEquals(List.of(1), applied);
        assertEquals(1, source.length());
    }

    private static void startProducer(Channel<Integer> channel, int from, int to) {
        new Thread(() -> {
            try {
                for (int i = from; i < to; i++) {
                    channel.send(i);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                channel.close();
            }
        }).start();
    }
}
