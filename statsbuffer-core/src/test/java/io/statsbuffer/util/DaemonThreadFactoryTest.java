package io.statsbuffer.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsSequentiallyNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("flush-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertTrue(t1.isDaemon());
        assertEquals("flush-1", t1.getName());
        assertEquals("flush-2", t2.getName());
    }

    @Test
    void uncaughtExceptionsReachTheHandler() throws InterruptedException {
        AtomicReference<Throwable> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        DaemonThreadFactory factory = new DaemonThreadFactory("loop-", (thread, error) -> {
            seen.set(error);
            latch.countDown();
        });
        RuntimeException failure = new RuntimeException("fault");

        factory.newThread(() -> {
            throw failure;
        }).start();

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertSame(failure, seen.get());
    }

    @Test
    void nullArgumentsThrow() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory("x-", null));
    }
}
