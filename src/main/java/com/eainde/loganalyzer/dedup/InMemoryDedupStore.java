package com.eainde.loganalyzer.dedup;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDedupStore implements DedupStore {

    private final Set<String> keys = ConcurrentHashMap.newKeySet();

    @Override
    public boolean checkAndSet(String key) {
        return !keys.add(key);
    }
}
