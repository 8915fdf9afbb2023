package com.ledgermatch.dedup;

import java.time.Instant;

/**
 * Per-run options for the full pipeline.
 *
 * @param useVerifier      escalate uncertain records to the semantic verifier when it is available
 * @param deadline         no verifier batch starts at or after this instant; null for none
 * @param progressListener optional, called on the run thread
 */
public record DedupOptions(boolean useVerifier, Instant deadline, ProgressListener progressListener) {

    public static DedupOptions defaults() {
        return new DedupOptions(true, null, null);
    }

    public static DedupOptions deterministicOnly() {
        return new DedupOptions(false, null, null);
    }

    public DedupOptions withDeadline(Instant deadline) {
        return new DedupOptions(useVerifier, deadline, progressListener);
    }

    public DedupOptions withProgressListener(ProgressListener listener) {
        return new DedupOptions(useVerifier, deadline, listener);
    }

    void reportProgress(int processed, int total) {
        if (progressListener != null) {
            progressListener.onProgress(processed, total);
        }
    }
}
