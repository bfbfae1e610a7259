package com.meganode.scheduler;

import com.meganode.core.exception.InvariantViolationException;
import com.meganode.core.model.MegaConfig;

/**
 * Memory accounting for user nodes, in units of one per-user estimate.
 *
 * The hard limit is an absolute admission ceiling. The soft limit keeps
 * {@code bufferSlots} users' worth of headroom free for bursts, in-flight starts,
 * and nodes that were told to stop but have not released their memory yet.
 *
 * Invariants:
 * - softLimit <= hardLimit
 * - count * perUserEstimate <= hardLimit, as long as callers check {@link #wouldFit} first
 */
public final class MemoryBudget {

    private final long hardLimit;
    private final long softLimit;
    private final long perUserEstimate;
    private int count;

    public MemoryBudget(long totalMemory, long memoryOverhead, long perUserEstimate, int bufferSlots) {
        if (perUserEstimate <= 0) {
            throw new IllegalArgumentException("perUserEstimate must be > 0");
        }
        this.perUserEstimate = perUserEstimate;
        this.hardLimit = Math.max(0, totalMemory - memoryOverhead);
        long targetBuffer = (long) bufferSlots * perUserEstimate;
        this.softLimit = Math.max(0, hardLimit - targetBuffer);
    }

    public static MemoryBudget fromConfig(MegaConfig config) {
        return new MemoryBudget(
            config.totalMemory(),
            config.memoryOverhead(),
            config.userMemoryEstimate(),
            config.userBufferSlots()
        );
    }

    /**
     * Whether {@code more} additional users fit under the hard limit.
     */
    public boolean wouldFit(int more) {
        return (count + (long) more) * perUserEstimate <= hardLimit;
    }

    /**
     * Whether {@code more} additional users would push usage above the soft limit.
     */
    public boolean overSoft(int more) {
        return (count + (long) more) * perUserEstimate > softLimit;
    }

    /**
     * How many users must release their slot before {@code more} additional users fit
     * under the hard limit. Zero if they already fit.
     */
    public int slotsOverHard(int more) {
        return (int) Math.max(0, count + (long) more - maxUsers());
    }

    /**
     * How many users must release their slot before {@code more} additional users stay
     * within the soft limit. Zero if they already do.
     */
    public int slotsOverSoft(int more) {
        return (int) Math.max(0, count + (long) more - softLimit / perUserEstimate);
    }

    /**
     * Account for one admitted user. Callers must have checked {@link #wouldFit(int)}.
     */
    void reserve() {
        if (!wouldFit(1)) {
            throw new InvariantViolationException(String.format(
                "Reserving a user slot would exceed the hard limit: %d users, %d bytes each, limit %d",
                count, perUserEstimate, hardLimit));
        }
        count++;
    }

    /**
     * Release one user's slot once its node has actually stopped.
     */
    void release() {
        if (count == 0) {
            throw new InvariantViolationException("Released a user slot that was never reserved");
        }
        count--;
    }

    public int count() {
        return count;
    }

    public long currentMemory() {
        return count * perUserEstimate;
    }

    public long hardLimit() {
        return hardLimit;
    }

    public long softLimit() {
        return softLimit;
    }

    public long perUserEstimate() {
        return perUserEstimate;
    }

    public long targetBuffer() {
        return hardLimit - softLimit;
    }

    /**
     * Most users that can ever be admitted at once.
     */
    public long maxUsers() {
        return hardLimit / perUserEstimate;
    }

    @Override
    public String toString() {
        return String.format("MemoryBudget[%d users, %d / %d bytes, soft %d]",
            count, currentMemory(), hardLimit, softLimit);
    }
}
