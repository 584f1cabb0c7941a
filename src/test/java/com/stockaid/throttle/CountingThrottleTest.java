package com.stockaid.throttle;

import com.stockaid.support.ManualThrottleClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CountingThrottleTest {

    private ManualThrottleClock clock;
    private CountingThrottle throttle;

    @BeforeEach
    void setUp() {
        clock = new ManualThrottleClock(0);
        throttle = new CountingThrottle(clock, 5);
    }

    @Test
    void testBurstUpToLimitPassesImmediately() {
        for (int i = 0; i < 5; i++) {
            throttle.acquire();
        }

        assertTrue(clock.getSleeps().isEmpty());
        assertEquals(5, throttle.currentCount());
    }

    @Test
    void testCallOverLimitStallsForAMinuteAndResets() {
        for (int i = 0; i < 5; i++) {
            throttle.acquire();
        }

        throttle.acquire();

        assertEquals(List.of(Duration.ofSeconds(60)), clock.getSleeps());
        assertEquals(0, throttle.currentCount());
    }

    @Test
    void testStallRepeatsEveryWindow() {
        // 6th call stalls and resets; the counter then climbs again from zero
        for (int i = 0; i < 6; i++) {
            throttle.acquire();
        }
        for (int i = 0; i < 5; i++) {
            throttle.acquire();
        }
        assertEquals(1, clock.getSleeps().size());

        throttle.acquire();
        throttle.acquire();

        assertEquals(2, clock.getSleeps().size());
        assertEquals(Duration.ofSeconds(120), clock.totalSlept());
    }

    @Test
    void testConcurrentCallersCountEveryCall() throws Exception {
        // each window is 5 free calls plus the one that stalls
        int threads = 6;
        int callsPerThread = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        throttle.acquire();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(10, clock.getSleeps().size());
        assertEquals(Duration.ofMinutes(10), clock.totalSlept());
        assertEquals(0, throttle.currentCount());
    }

    @Test
    void testRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new CountingThrottle(clock, 0));
    }
}
