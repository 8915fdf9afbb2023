package com.ledgermatch.common;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Spaces outbound requests evenly to stay under a requests-per-minute quota.
 * A non-positive quota disables throttling.
 */
public class RequestThrottle {

    private final long intervalNanos;
    private final AtomicLong nextSlotNanos = new AtomicLong(Long.MIN_VALUE);

    /**
     * @param requestsPerMinute e.g. 60 for one request per second; 0 or less for unlimited
     */
    public RequestThrottle(int requestsPerMinute) {
        this.intervalNanos = requestsPerMinute <= 0 ? 0 : 60_000_000_000L / requestsPerMinute;
    }

    public boolean isUnlimited() {
        return intervalNanos == 0;
    }

    /**
     * Reserves the next slot and sleeps until it starts.
     *
     * @return milliseconds spent waiting
     * @throws InterruptedException if interrupted while waiting; the reserved slot is not returned
     */
    public long acquire() throws InterruptedException {
        if (isUnlimited()) {
            return 0;
        }
        long now = System.nanoTime();
        long slot = reserve(now);
        long waitNanos = slot - now;
        if (waitNanos <= 0) {
            return 0;
        }
        Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
        return waitNanos / 1_000_000;
    }

    private long reserve(long now) {
        while (true) {
            long next = nextSlotNanos.get();
            long slot = (next == Long.MIN_VALUE || now >= next) ? now : next;
            if (nextSlotNanos.compareAndSet(next, slot + intervalNanos)) {
                return slot;
            }
        }
    }
}
