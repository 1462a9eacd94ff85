package workerkit.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void numberedThreadsAreDaemonsInSequence() {
        DaemonThreadFactory factory = new DaemonThreadFactory("pool-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertTrue(t1.isDaemon());
        assertEquals("pool-1", t1.getName());
        assertEquals("pool-2", t2.getName());
    }

    @Test
    void namedThreadCarriesWorkerName() {
        DaemonThreadFactory factory = new DaemonThreadFactory("workerkit-");

        Thread thread = factory.newNamedThread(() -> {
        }, "worker-7");

        assertTrue(thread.isDaemon());
        assertEquals("workerkit-worker-7", thread.getName());
    }

    @Test
    void namedThreadsDoNotAdvanceCounter() {
        DaemonThreadFactory factory = new DaemonThreadFactory("t-");

        factory.newNamedThread(() -> {
        }, "a");
        Thread numbered = factory.newThread(() -> {
        });

        assertEquals("t-1", numbered.getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }

    @Test
    void nullNameThrows() {
        DaemonThreadFactory factory = new DaemonThreadFactory("t-");
        assertThrows(NullPointerException.class, () -> factory.newNamedThread(() -> {
        }, null));
    }
}
