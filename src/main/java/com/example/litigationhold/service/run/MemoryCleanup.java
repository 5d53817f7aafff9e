package com.example.litigationhold.service.run;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodic memory pressure relief between batches of large runs.
 * Purely advisory; a skipped or ineffective cleanup changes nothing else.
 */
@Slf4j
public final class MemoryCleanup {

    private MemoryCleanup() {
    }

    /**
     * Request a collection every {@code interval} batches
     *
     * @param batchIndex 1-based index of the batch just finished
     * @param interval   Batches between cleanups, 0 or less disables cleanup
     * @return true if a cleanup was requested
     */
    public static boolean runIfDue(int batchIndex, int interval) {
        if (interval <= 0 || batchIndex % interval != 0) {
            return false;
        }

        var runtime = Runtime.getRuntime();
        var usedBefore = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);
        System.gc();
        var usedAfter = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);

        log.debug("Memory cleanup after batch {}: {} MB -> {} MB used", batchIndex, usedBefore, usedAfter);
        return true;
    }
}
