package io.statsbuffer.spi;

import io.statsbuffer.event.Timing;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingTransportTest {

    private final Logger logger = Logger.getLogger(LoggingTransport.class.getName());
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attachHandler() {
        logger.addHandler(handler);
        logger.setLevel(Level.ALL);
    }

    @AfterEach
    void detachHandler() {
        logger.removeHandler(handler);
        logger.setLevel(null);
    }

    @Test
    void logsEveryRenderedLine() {
        LoggingTransport transport = new LoggingTransport(Level.FINE);
        transport.send(new Timing("rt", 12));

        assertEquals(4, records.size());
        assertEquals("rt.count:1|c", records.get(0).getMessage());
        assertEquals(Level.FINE, records.get(0).getLevel());
    }

    @Test
    void rejectsSendAfterClose() {
        LoggingTransport transport = new LoggingTransport();
        transport.close();

        assertTrue(transport.isClosed());
        assertThrows(IllegalStateException.class, () -> transport.send(new Timing("rt", 1)));
    }
}
