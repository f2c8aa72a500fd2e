package com.secretnotes.core;

/**
 * Admission gate consulted before any note operation.
 * Budgets are tracked per (action class, client identity) pair.
 */
public interface RateLimiter {

    /**
     * Record a request and decide whether it is admitted, using the
     * configured limit for the action class.
     *
     * @param identity client identity (IP address or a shared sentinel)
     * @param action   budget class the request draws from
     * @return true if admitted, false if the budget for the window is spent
     */
    boolean tryAcquire(String identity, ActionClass action);

    /**
     * Same as {@link #tryAcquire(String, ActionClass)} with an explicit
     * per-window limit.
     *
     * @param limit maximum requests admitted within one window
     */
    boolean tryAcquire(String identity, ActionClass action, long limit);
}
