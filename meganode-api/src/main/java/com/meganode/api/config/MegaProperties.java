package com.meganode.api.config;

import com.meganode.core.model.MegaConfig;
import com.meganode.core.model.MegaId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Meganode settings bound from {@code meganode.*} in application.yml.
 * Unset values fall back to the {@link MegaConfig} defaults.
 */
@ConfigurationProperties(prefix = "meganode")
public class MegaProperties {

    /**
     * This meganode's id. Random when unset.
     */
    private Integer megaId;

    private DataSize totalMemory = DataSize.ofBytes(MegaConfig.DEFAULT_TOTAL_MEMORY);
    private DataSize memoryOverhead = DataSize.ofBytes(MegaConfig.DEFAULT_MEMORY_OVERHEAD);
    private DataSize userMemoryEstimate = DataSize.ofBytes(MegaConfig.DEFAULT_USER_MEMORY_ESTIMATE);
    private int userBufferSlots = MegaConfig.DEFAULT_USER_BUFFER_SLOTS;

    private Duration userInactivity = MegaConfig.DEFAULT_USER_INACTIVITY;
    private Duration megaInactivity = MegaConfig.DEFAULT_MEGA_INACTIVITY;
    private Duration sweepInterval = MegaConfig.DEFAULT_SWEEP_INTERVAL;
    private Duration userShutdownTimeout = MegaConfig.DEFAULT_USER_SHUTDOWN_TIMEOUT;
    private Duration leaseLifetime = MegaConfig.DEFAULT_LEASE_LIFETIME;
    private Duration leaseRenewalInterval = MegaConfig.DEFAULT_LEASE_RENEWAL_INTERVAL;

    private String runnerUrl = "";
    private boolean strictInvariants = false;

    private final Simulation simulation = new Simulation();

    public MegaConfig toMegaConfig() {
        MegaId id = megaId != null ? MegaId.of(megaId) : MegaId.random();
        return MegaConfig.builder(id)
            .totalMemory(totalMemory.toBytes())
            .memoryOverhead(memoryOverhead.toBytes())
            .userMemoryEstimate(userMemoryEstimate.toBytes())
            .userBufferSlots(userBufferSlots)
            .userInactivity(userInactivity)
            .megaInactivity(megaInactivity)
            .sweepInterval(sweepInterval)
            .userShutdownTimeout(userShutdownTimeout)
            .leaseLifetime(leaseLifetime)
            .leaseRenewalInterval(leaseRenewalInterval)
            .runnerUrl(runnerUrl)
            .strictInvariants(strictInvariants)
            .build();
    }

    /**
     * Behavior of the built-in simulated user node.
     */
    public static class Simulation {
        private Duration startupDelay = Duration.ofMillis(200);
        private Duration syncDuration = Duration.ofSeconds(1);
        private int basePort = 20000;

        public Duration getStartupDelay() {
            return startupDelay;
        }

        public void setStartupDelay(Duration startupDelay) {
            this.startupDelay = startupDelay;
        }

        public Duration getSyncDuration() {
            return syncDuration;
        }

        public void setSyncDuration(Duration syncDuration) {
            this.syncDuration = syncDuration;
        }

        public int getBasePort() {
            return basePort;
        }

        public void setBasePort(int basePort) {
            this.basePort = basePort;
        }
    }

    public Integer getMegaId() {
        return megaId;
    }

    public void setMegaId(Integer megaId) {
        this.megaId = megaId;
    }

    public DataSize getTotalMemory() {
        return totalMemory;
    }

    public void setTotalMemory(DataSize totalMemory) {
        this.totalMemory = totalMemory;
    }

    public DataSize getMemoryOverhead() {
        return memoryOverhead;
    }

    public void setMemoryOverhead(DataSize memoryOverhead) {
        this.memoryOverhead = memoryOverhead;
    }

    public DataSize getUserMemoryEstimate() {
        return userMemoryEstimate;
    }

    public void setUserMemoryEstimate(DataSize userMemoryEstimate) {
        this.userMemoryEstimate = userMemoryEstimate;
    }

    public int getUserBufferSlots() {
        return userBufferSlots;
    }

    public void setUserBufferSlots(int userBufferSlots) {
        this.userBufferSlots = userBufferSlots;
    }

    public Duration getUserInactivity() {
        return userInactivity;
    }

    public void setUserInactivity(Duration userInactivity) {
        this.userInactivity = userInactivity;
    }

    public Duration getMegaInactivity() {
        return megaInactivity;
    }

    public void setMegaInactivity(Duration megaInactivity) {
        this.megaInactivity = megaInactivity;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getUserShutdownTimeout() {
        return userShutdownTimeout;
    }

    public void setUserShutdownTimeout(Duration userShutdownTimeout) {
        this.userShutdownTimeout = userShutdownTimeout;
    }

    public Duration getLeaseLifetime() {
        return leaseLifetime;
    }

    public void setLeaseLifetime(Duration leaseLifetime) {
        this.leaseLifetime = leaseLifetime;
    }

    public Duration getLeaseRenewalInterval() {
        return leaseRenewalInterval;
    }

    public void setLeaseRenewalInterval(Duration leaseRenewalInterval) {
        this.leaseRenewalInterval = leaseRenewalInterval;
    }

    public String getRunnerUrl() {
        return runnerUrl;
    }

    public void setRunnerUrl(String runnerUrl) {
        this.runnerUrl = runnerUrl;
    }

    public boolean isStrictInvariants() {
        return strictInvariants;
    }

    public void setStrictInvariants(boolean strictInvariants) {
        this.strictInvariants = strictInvariants;
    }

    public Simulation getSimulation() {
        return simulation;
    }
}
