package com.meganode.core.model;

import java.time.Duration;

/**
 * Static configuration of one meganode, fixed at startup.
 *
 * Invariants:
 * - userMemoryEstimate > 0
 * - all durations positive
 * - leaseRenewalInterval < leaseLifetime
 */
public record MegaConfig(
    MegaId megaId,

    // Memory accounting, in bytes
    long totalMemory,
    long memoryOverhead,
    long userMemoryEstimate,
    int userBufferSlots,

    // Inactivity
    Duration userInactivity,
    Duration megaInactivity,
    Duration sweepInterval,

    // How long to wait for user nodes to stop when the meganode shuts down
    Duration userShutdownTimeout,

    // Leases (advisory)
    Duration leaseLifetime,
    Duration leaseRenewalInterval,

    // Upstream runner, protocol://host:port; blank disables activity reporting
    String runnerUrl,

    // Throw on invariant violations instead of logging them
    boolean strictInvariants
) {
    public static final long MIB = 1L << 20;

    /** 2 GiB enclave heap. */
    public static final long DEFAULT_TOTAL_MEMORY = 0x8000_0000L;
    /** Network graph, runtime, connection pools and other shared components. */
    public static final long DEFAULT_MEMORY_OVERHEAD = 200 * MIB;
    public static final long DEFAULT_USER_MEMORY_ESTIMATE = 64 * MIB;
    public static final int DEFAULT_USER_BUFFER_SLOTS = 2;
    public static final Duration DEFAULT_USER_INACTIVITY = Duration.ofHours(1);
    public static final Duration DEFAULT_MEGA_INACTIVITY = Duration.ofHours(2);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_USER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(25);
    public static final Duration DEFAULT_LEASE_LIFETIME = Duration.ofSeconds(60);
    public static final Duration DEFAULT_LEASE_RENEWAL_INTERVAL = Duration.ofSeconds(30);

    public MegaConfig {
        if (megaId == null) {
            throw new IllegalArgumentException("megaId must not be null");
        }
        if (totalMemory < 0 || memoryOverhead < 0) {
            throw new IllegalArgumentException("Memory sizes must be >= 0");
        }
        if (userMemoryEstimate <= 0) {
            throw new IllegalArgumentException("userMemoryEstimate must be > 0");
        }
        if (userBufferSlots < 0) {
            throw new IllegalArgumentException("userBufferSlots must be >= 0");
        }
        requirePositive("userInactivity", userInactivity);
        requirePositive("megaInactivity", megaInactivity);
        requirePositive("sweepInterval", sweepInterval);
        requirePositive("userShutdownTimeout", userShutdownTimeout);
        requirePositive("leaseLifetime", leaseLifetime);
        requirePositive("leaseRenewalInterval", leaseRenewalInterval);
        if (leaseRenewalInterval.compareTo(leaseLifetime) >= 0) {
            throw new IllegalArgumentException("leaseRenewalInterval must be shorter than leaseLifetime");
        }
        runnerUrl = runnerUrl == null ? "" : runnerUrl;
    }

    /**
     * Production defaults for the given meganode.
     */
    public static MegaConfig defaults(MegaId megaId) {
        return builder(megaId).build();
    }

    public static Builder builder(MegaId megaId) {
        return new Builder(megaId);
    }

    public Builder toBuilder() {
        return new Builder(megaId)
            .totalMemory(totalMemory)
            .memoryOverhead(memoryOverhead)
            .userMemoryEstimate(userMemoryEstimate)
            .userBufferSlots(userBufferSlots)
            .userInactivity(userInactivity)
            .megaInactivity(megaInactivity)
            .sweepInterval(sweepInterval)
            .userShutdownTimeout(userShutdownTimeout)
            .leaseLifetime(leaseLifetime)
            .leaseRenewalInterval(leaseRenewalInterval)
            .runnerUrl(runnerUrl)
            .strictInvariants(strictInvariants);
    }

    public boolean hasRunnerUrl() {
        return !runnerUrl.isBlank();
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    public static final class Builder {
        private final MegaId megaId;
        private long totalMemory = DEFAULT_TOTAL_MEMORY;
        private long memoryOverhead = DEFAULT_MEMORY_OVERHEAD;
        private long userMemoryEstimate = DEFAULT_USER_MEMORY_ESTIMATE;
        private int userBufferSlots = DEFAULT_USER_BUFFER_SLOTS;
        private Duration userInactivity = DEFAULT_USER_INACTIVITY;
        private Duration megaInactivity = DEFAULT_MEGA_INACTIVITY;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private Duration userShutdownTimeout = DEFAULT_USER_SHUTDOWN_TIMEOUT;
        private Duration leaseLifetime = DEFAULT_LEASE_LIFETIME;
        private Duration leaseRenewalInterval = DEFAULT_LEASE_RENEWAL_INTERVAL;
        private String runnerUrl = "";
        private boolean strictInvariants = false;

        private Builder(MegaId megaId) {
            this.megaId = megaId;
        }

        public Builder totalMemory(long totalMemory) {
            this.totalMemory = totalMemory;
            return this;
        }

        public Builder memoryOverhead(long memoryOverhead) {
            this.memoryOverhead = memoryOverhead;
            return this;
        }

        public Builder userMemoryEstimate(long userMemoryEstimate) {
            this.userMemoryEstimate = userMemoryEstimate;
            return this;
        }

        public Builder userBufferSlots(int userBufferSlots) {
            this.userBufferSlots = userBufferSlots;
            return this;
        }

        public Builder userInactivity(Duration userInactivity) {
            this.userInactivity = userInactivity;
            return this;
        }

        public Builder megaInactivity(Duration megaInactivity) {
            this.megaInactivity = megaInactivity;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder userShutdownTimeout(Duration userShutdownTimeout) {
            this.userShutdownTimeout = userShutdownTimeout;
            return this;
        }

        public Builder leaseLifetime(Duration leaseLifetime) {
            this.leaseLifetime = leaseLifetime;
            return this;
        }

        public Builder leaseRenewalInterval(Duration leaseRenewalInterval) {
            this.leaseRenewalInterval = leaseRenewalInterval;
            return this;
        }

        public Builder runnerUrl(String runnerUrl) {
            this.runnerUrl = runnerUrl;
            return this;
        }

        public Builder strictInvariants(boolean strictInvariants) {
            this.strictInvariants = strictInvariants;
            return this;
        }

        public MegaConfig build() {
            return new MegaConfig(
                megaId,
                totalMemory,
                memoryOverhead,
                userMemoryEstimate,
                userBufferSlots,
                userInactivity,
                megaInactivity,
                sweepInterval,
                userShutdownTimeout,
                leaseLifetime,
                leaseRenewalInterval,
                runnerUrl,
                strictInvariants
            );
        }
    }
}
