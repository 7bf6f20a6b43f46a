package com.adharvest.listings.engine;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Listing ids already emitted in the current run. Lives and dies with its {@link RunContext};
 * nothing is persisted, so a new run may emit listings an earlier run already produced.
 */
public class FingerprintStore {

    private final Set<String> ids = ConcurrentHashMap.newKeySet();

    public boolean seen(String id) {
        return ids.contains(id);
    }

    public void record(String id) {
        ids.add(id);
    }

    /**
     * Atomic check-and-record.
     *
     * @return true if the id was new and has now been recorded
     */
    public boolean recordIfAbsent(String id) {
        return ids.add(id);
    }

    public int size() {
        return ids.size();
    }
}
