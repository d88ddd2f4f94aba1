package com.chaincustody.deposit.monitor;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory state of one monitor. Lost on restart; the durable transaction store remains the authority
 * for what was credited.
 */
class MonitorState {

    private final Set<String> processedHashes = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> lastBroadcastConfirmations = new ConcurrentHashMap<>();
    private volatile int consecutiveErrorCount;
    private volatile String lastError;

    boolean isProcessed(String hash) {
        return processedHashes.contains(hash);
    }

    void markProcessed(String hash) {
        processedHashes.add(hash);
        lastBroadcastConfirmations.remove(hash);
    }

    /**
     * Records the confirmation count for a pending hash.
     *
     * @return true when it differs from the last broadcast count (or none was broadcast yet)
     */
    boolean advancePending(String hash, int confirmations) {
        Integer previous = lastBroadcastConfirmations.put(hash, confirmations);
        return previous == null || previous != confirmations;
    }

    int recordFailure(String error) {
        lastError = error;
        return ++consecutiveErrorCount;
    }

    void recordSuccess() {
        consecutiveErrorCount = 0;
    }

    void resetErrors() {
        consecutiveErrorCount = 0;
        lastError = null;
    }

    int getConsecutiveErrorCount() {
        return consecutiveErrorCount;
    }

    String getLastError() {
        return lastError;
    }

    int processedCount() {
        return processedHashes.size();
    }
}
