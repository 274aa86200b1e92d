package com.schedq.executor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight invocation counts per job key. Keys with no invocation in flight are absent.
 */
public class RunningJobsTable {

    private final ConcurrentHashMap<String, Integer> running = new ConcurrentHashMap<>();

    /**
     * Increments the count for {@code key} unless it already reached {@code maxInstances}.
     */
    public boolean tryAcquire(String key, int maxInstances) {
        boolean[] acquired = new boolean[1];
        running.compute(key, (k, count) -> {
            int current = count == null ? 0 : count;
            if (current >= maxInstances) {
                return count;
            }
            acquired[0] = true;
            return current + 1;
        });
        return acquired[0];
    }

    public void release(String key) {
        running.computeIfPresent(key, (k, count) -> count <= 1 ? null : count - 1);
    }

    public int count(String key) {
        return running.getOrDefault(key, 0);
    }

    public int total() {
        int total = 0;
        for (int count : running.values()) {
            total += count;
        }
        return total;
    }

    public Map<String, Integer> snapshot() {
        return Map.copyOf(running);
    }
}
