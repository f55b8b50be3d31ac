package com.eainde.loganalyzer.dedup;

import java.time.LocalDate;

/**
 * Cross-run idempotency store. Lets downstream collaborators act on a signature at most once per day.
 */
public interface DedupStore {

    /**
     * Records the key.
     *
     * @return true when the key was already present before this call
     */
    boolean checkAndSet(String key);

    /** Day-scoped key, {@code yyyy-MM-dd|signature}. */
    static String dailyKey(LocalDate day, String signature) {
        return day + "|" + signature;
    }
}
