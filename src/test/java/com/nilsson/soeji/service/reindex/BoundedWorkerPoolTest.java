package com.nilsson.soeji.service.reindex;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BoundedWorkerPoolTest {

    @Test
    void testDrain_neverExceedsConcurrency() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> done = Collections.synchronizedList(new ArrayList<>());
        List<Integer> items = IntStream.range(0, 20).boxed().collect(Collectors.toList());

        try (BoundedWorkerPool pool = new BoundedWorkerPool(3)) {
            pool.drain(items, item -> {
                int now = active.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(5);
                active.decrementAndGet();
                done.add(item);
            }, (item, error) -> fail("unexpected failure for " + item));
        }

        assertEquals(20, done.size());
        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
    }

    @Test
    void testDrain_failuresAreReportedAndOthersContinue() throws Exception {
        Map<Integer, Exception> failures = new ConcurrentHashMap<>();
        AtomicInteger processed = new AtomicInteger();

        try (BoundedWorkerPool pool = new BoundedWorkerPool(2)) {
            pool.drain(List.of(1, 2, 3, 4, 5), item -> {
                if (item % 2 == 0) throw new IllegalStateException("even " + item);
                processed.incrementAndGet();
            }, failures::put);
        }

        assertEquals(3, processed.get());
        assertEquals(2, failures.size());
        assertEquals("even 4", failures.get(4).getMessage());
    }

    @Test
    void testDrain_reusableAcrossBatches() throws Exception {
        AtomicInteger processed = new AtomicInteger();

        try (BoundedWorkerPool pool = new BoundedWorkerPool(4)) {
            pool.drain(List.of("a", "b"), item -> processed.incrementAndGet(), (item, error) -> fail());
            pool.drain(List.of(), item -> processed.incrementAndGet(), (item, error) -> fail());
            pool.drain(List.of("c"), item -> processed.incrementAndGet(), (item, error) -> fail());
        }

        assertEquals(3, processed.get());
    }
}
