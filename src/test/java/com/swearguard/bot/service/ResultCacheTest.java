package com.swearguard.bot.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class ResultCacheTest {

    @Test
    void evictsOldestInsertedEntryWhenFull() {
        ResultCache cache = new ResultCache(2);
        cache.put("a", true);
        cache.put("b", false);
        cache.get("a");
        cache.put("c", true);

        assertEquals(Optional.empty(), cache.get("a"));
        assertEquals(Optional.of(false), cache.get("b"));
        assertEquals(Optional.of(true), cache.get("c"));
        assertEquals(2, cache.size());
    }

    @Test
    void overwritingAnExistingKeyDoesNotEvict() {
        ResultCache cache = new ResultCache(2);
        cache.put("a", true);
        cache.put("b", true);
        cache.put("a", false);

        assertEquals(2, cache.size());
        assertEquals(Optional.of(false), cache.get("a"));
        assertEquals(Optional.of(true), cache.get("b"));
    }

    @Test
    void countsHitsAndMissesIncludingFalseVerdicts() {
        ResultCache cache = new ResultCache(10);
        cache.get("x");
        cache.put("x", false);
        cache.get("x");

        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    void clearEmptiesTheCache() {
        ResultCache cache = new ResultCache(10);
        cache.put("a", true);
        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(Optional.empty(), cache.get("a"));
    }

    @Test
    void concurrentWritersNeverExceedTheBound() throws Exception {
        ResultCache cache = new ResultCache(50);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                int offset = worker * 1_000;
                futures.add(executor.submit(() -> {
                    for (int index = 0; index < 1_000; index++) {
                        cache.put("message-" + (offset + index), index % 2 == 0);
                        cache.get("message-" + index);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
        assertTrue(cache.size() <= 50, "size was " + cache.size());
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThrows(IllegalArgumentException.class, () -> new ResultCache(0));
    }
}
