package workerkit.platform;

import org.junit.jupiter.api.Test;
import workerkit.spi.MessagePort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadMessageTransportTest {

    @Test
    void deliversInPostingOrder() throws Exception {
        ThreadMessageTransport transport = new ThreadMessageTransport();
        List<Integer> received = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch all = new CountDownLatch(100);

        MessagePort<Integer> port = transport.open("ordered", (Integer m) -> {
            received.add(m);
            all.countDown();
        });
        for (int i = 0; i < 100; i++) {
            port.post(i);
        }

        assertTrue(all.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 100; i++) {
            assertEquals(i, received.get(i));
        }
    }

    @Test
    void closeDrainsPostedMessagesThenRejectsPosts() throws Exception {
        ThreadMessageTransport transport = new ThreadMessageTransport();
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch delivered = new CountDownLatch(3);

        MessagePort<String> port = transport.open("draining", (String m) -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.countDown();
        });
        port.post("a");
        port.post("b");
        port.post("c");
        port.close();
        port.close();
        gate.countDown();

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertThrows(IllegalStateException.class, () -> port.post("d"));
    }

    @Test
    void failingReceiverDoesNotStopDelivery() throws Exception {
        ThreadMessageTransport transport = new ThreadMessageTransport();
        CountDownLatch second = new CountDownLatch(1);

        MessagePort<String> port = transport.open("faulty", (String m) -> {
            if (m.equals("bad")) {
                throw new IllegalArgumentException("rejected");
            }
            second.countDown();
        });
        port.post("bad");
        port.post("good");

        assertTrue(second.await(5, TimeUnit.SECONDS));
    }
}
