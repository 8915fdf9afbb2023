package com.ledgermatch.dedup;

/**
 * Called after each incoming record has been through Tier 1.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int processed, int total);
}
