package com.di.silverline.coordinator;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide set of (table, logical date) pairs currently being ingested. A second run for a pair
 * that is in flight is rejected instead of queued.
 */
@Component
public class InFlightRuns {

    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String tableName, LocalDate logicalDate) {
        return active.add(key(tableName, logicalDate));
    }

    public void release(String tableName, LocalDate logicalDate) {
        active.remove(key(tableName, logicalDate));
    }

    public boolean isActive(String tableName, LocalDate logicalDate) {
        return active.contains(key(tableName, logicalDate));
    }

    private static String key(String tableName, LocalDate logicalDate) {
        return tableName + "@" + logicalDate;
    }
}
