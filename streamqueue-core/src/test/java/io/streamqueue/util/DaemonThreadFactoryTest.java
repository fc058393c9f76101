package io.streamqueue.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsSequentiallyNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("streamqueue-removal-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertTrue(t1.isDaemon());
        assertEquals("streamqueue-removal-1", t1.getName());
        assertEquals("streamqueue-removal-2", t2.getName());
    }

    @Test
    void installsUncaughtExceptionHandler() throws Exception {
        Thread thread = new DaemonThreadFactory("test-").newThread(() -> {
            throw new IllegalStateException("boom");
        });

        assertNotNull(thread.getUncaughtExceptionHandler());
        thread.start();
        thread.join(5_000);
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
