package io.statsbuffer;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class NoopStatsdClientTest {

    @Test
    void acceptsEverythingAndStaysUsableAfterClose() {
        StatsdClient client = new NoopStatsdClient();
        assertDoesNotThrow(() -> {
            client.increment("a", 1);
            client.decrement("a", 1);
            client.timing("t", Duration.ofMillis(3));
            client.timing("t", 3);
            client.gauge("g", 1);
            client.gaugeDelta("g", -1);
            client.absolute("abs", 2);
            client.total("tot", 9);
            client.close();
            client.increment("a", 1);
        });
    }
}
