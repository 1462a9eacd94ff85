package workerkit.channel;

import org.junit.jupiter.api.Test;
import workerkit.dispatch.WorkerDispatcher;
import workerkit.platform.ThreadMessageTransport;
import workerkit.spi.MessagePort;
import workerkit.spi.MessageTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkedChannelsTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    void valuesFlowBothWays() throws Exception {
        LinkedChannels.Endpoints<String> link = LinkedChannels.open(new ThreadMessageTransport());

        link.first().send("ping");
        assertEquals("ping", link.second().receiveAsync().await(WAIT));

        link.second().send("pong");
        assertEquals("pong", link.first().receiveAsync().await(WAIT));
    }

    @Test
    void sendsNeverBlock() {
        LinkedChannels.Endpoints<Integer> link = LinkedChannels.open(new ThreadMessageTransport());

        for (int i = 0; i < 1000; i++) {
            assertTrue(link.first().trySend(i));
        }
        assertEquals(Integer.MAX_VALUE, link.first().capacity());
    }

    @Test
    void closeDeliversEverythingSentBefore() {
        LinkedChannels.Endpoints<Integer> link = LinkedChannels.open(new ThreadMessageTransport());
        for (int i = 0; i < 50; i++) {
            link.first().trySend(i);
        }

        link.first().close();

        List<Integer> received = link.second().stream().collect(Collectors.toList());
        assertEquals(50, received.size());
        assertEquals(49, received.get(49));
    }

    @Test
    void closeIsAppliedAtPeer() throws Exception {
        LinkedChannels.Endpoints<String> link = LinkedChannels.open(new ThreadMessageTransport());

        link.first().close();
        assertTrue(link.first().isClosed());
        assertThrows(ChannelClosedException.class, () -> link.second().receiveAsync().await(WAIT));

        assertTrue(link.second().isClosed());
        assertFalse(link.second().trySend("after peer closed"));
        assertThrows(ChannelClosedException.class, () -> link.first().receiveAsync().await(WAIT));
    }

    @Test
    void failureTravelsToPeer() {
        LinkedChannels.Endpoints<String> link = LinkedChannels.open(new ThreadMessageTransport());
        IllegalStateException cause = new IllegalStateException("worker failed");

        link.first().close(cause);

        ChannelClosedException closed = assertThrows(ChannelClosedException.class,
                () -> link.second().receiveAsync().await(WAIT));
        assertSame(cause, closed.getCause());
    }

    @Test
    void simultaneousCloseLosesNoAcceptedValue() throws Exception {
        for (int round = 0; round < 20; round++) {
            LinkedChannels.Endpoints<Integer> link = LinkedChannels.open(new ThreadMessageTransport());
            List<Integer> accepted = new ArrayList<>();
            Thread sender = new Thread(() -> {
                for (int i = 0; i < 100; i++) {
                    if (!link.first().trySend(i)) {
                        return;
                    }
                    accepted.add(i);
                }
                link.first().close();
            });
            sender.start();
            link.second().close();
            sender.join(5_000);

            List<Integer> received = link.second().stream().collect(Collectors.toList());
            assertEquals(accepted, received);
        }
    }

    @Test
    void workersExchangeValuesOverLink() throws Exception {
        LinkedChannels.Endpoints<Integer> link = LinkedChannels.open(new ThreadMessageTransport(), "squares");
        try (var d = WorkerDispatcher.builder().build()) {
            var producer = d.launch(() -> {
                for (int i = 1; i <= 5; i++) {
                    link.first().send(i * i);
                }
                link.first().close();
                return "produced";
            });
            var consumer = d.launch(() -> link.second().stream().mapToInt(Integer::intValue).sum());

            assertEquals("produced", producer.await(WAIT));
            assertEquals(55, consumer.await(WAIT));
        }
    }

    @Test
    void outOfOrderFramesAreStillDelivered() throws Exception {
        CapturingTransport transport = new CapturingTransport();
        LinkedChannels.Endpoints<String> link = LinkedChannels.open(transport, "manual");
        Consumer<Object> toSecond = transport.receivers.get(0);

        toSecond.accept(new LinkedChannels.Value<>(1, "skipped-ahead"));

        assertEquals("skipped-ahead", link.second().receiveAsync().await(WAIT));
    }

    /** Transport that hands frames back to the test instead of delivering them. */
    private static final class CapturingTransport implements MessageTransport {
        final List<Consumer<Object>> receivers = new ArrayList<>();

        @Override
        @SuppressWarnings("unchecked")
        public <M> MessagePort<M> open(String name, Consumer<? super M> receiver) {
            receivers.add((Consumer<Object>) receiver);
            return new MessagePort<>() {
                @Override
                public void post(M message) {
                }

                @Override
                public void close() {
                }
            };
        }
    }
}
