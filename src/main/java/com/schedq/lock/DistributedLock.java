package com.schedq.lock;

import java.time.Duration;

/**
 * Cross-process mutual exclusion with expiring grants.
 * <p>
 * At most one live grant exists per key. A grant expires {@code timeout} after it was
 * acquired or last extended, so a holder that dies without releasing cannot block the
 * key forever.
 */
public interface DistributedLock {

    /**
     * Tries once to take {@code key}. Does not wait for a current holder.
     *
     * @param timeout lifetime of the grant
     * @return whether this caller now holds the key
     */
    boolean acquire(String key, Duration timeout);

    /**
     * @return {@code false} if this caller did not hold a live grant on {@code key}
     */
    boolean release(String key);

    /**
     * Resets the expiry of a grant held by this caller to {@code timeout} from now.
     */
    boolean extend(String key, Duration timeout);

    /**
     * Short name for logging.
     */
    String getStrategyName();
}
