package io.statsbuffer;

import io.statsbuffer.event.Event;
import io.statsbuffer.spi.Transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport stub that records every call and can be told to fail sends for given keys.
 */
class RecordingTransport implements Transport {
    final ConcurrentLinkedQueue<String> operations = new ConcurrentLinkedQueue<>();
    final Map<String, Event> sent = new ConcurrentHashMap<>();
    final AtomicInteger sendCount = new AtomicInteger();
    final AtomicInteger closeCount = new AtomicInteger();
    final Set<String> failingKeys = ConcurrentHashMap.newKeySet();
    volatile Exception closeFailure;
    volatile CountDownLatch sendLatch = new CountDownLatch(0);

    @Override
    public void send(Event event) throws Exception {
        sendCount.incrementAndGet();
        operations.add("send:" + event.key());
        try {
            if (failingKeys.contains(event.key())) {
                throw new java.io.IOException("send failed for " + event.key());
            }
            sent.put(event.key(), event);
        } finally {
            sendLatch.countDown();
        }
    }

    @Override
    public void close() throws Exception {
        closeCount.incrementAndGet();
        operations.add("close");
        if (closeFailure != null) {
            throw closeFailure;
        }
    }

    List<String> sendsFor(String key) {
        List<String> result = new ArrayList<>();
        for (String op : operations) {
            if (op.equals("send:" + key)) {
                result.add(op);
            }
        }
        return result;
    }
}
