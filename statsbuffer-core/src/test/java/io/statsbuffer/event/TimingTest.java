package io.statsbuffer.event;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimingTest {

    @Test
    void mergeAccumulatesCountSumMinMax() {
        Timing timing = new Timing("db.query", 40);
        timing.merge(new Timing("db.query", Duration.ofMillis(10)));
        timing.merge(new Timing("db.query", 25));

        assertEquals(3, timing.count());
        assertEquals(75, timing.sum());
        assertEquals(10, timing.min());
        assertEquals(40, timing.max());
        assertEquals(25, timing.average());
    }

    @Test
    void rendersCountAverageMinMax() {
        Timing timing = new Timing("db.query", 10);
        timing.merge(new Timing("db.query", 21));

        assertEquals(List.of(
                "db.query.count:2|c",
                "db.query.avg:15|ms",
                "db.query.min:10|ms",
                "db.query.max:21|ms"), timing.stats());
    }

    @Test
    void percentileUsesNearestRankOverAllMergedSamples() {
        Timing timing = new Timing("rt", 1);
        for (int i = 2; i <= 100; i++) {
            Timing other = new Timing("rt", 101 - i);
            other.merge(new Timing("rt", 0));
            timing.merge(other);
        }
        // samples: 0 x99, 1..99 and 1 once more
        assertEquals(199, timing.count());
        assertEquals(99, timing.percentile(100));
        assertEquals(0, timing.percentile(40));
        assertEquals(50, timing.percentile(75));
    }

    @Test
    void rejectsNegativeSampleAndBadPercentile() {
        assertThrows(IllegalArgumentException.class, () -> new Timing("rt", -1));
        Timing timing = new Timing("rt", 5);
        assertThrows(IllegalArgumentException.class, () -> timing.percentile(0));
        assertThrows(IllegalArgumentException.class, () -> timing.percentile(101));
    }
}
