package com.adharvest.listings.engine;

import com.adharvest.listings.model.NormalizedRecord;

/**
 * Receives records as they are produced. Calls are serialized by the engine even when
 * scopes run in parallel.
 */
@FunctionalInterface
public interface RecordListener {

    void onRecord(NormalizedRecord record);

    static RecordListener noop() {
        return record -> { };
    }
}
