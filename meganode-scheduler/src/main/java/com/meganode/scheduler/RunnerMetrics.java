package com.meganode.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the user runner.
 *
 * Metrics exposed:
 * - User counts by state and memory in use
 * - Admissions, denials and misrouted requests
 * - Evictions by reason
 * - User node startup latency and completions by outcome
 * - Invariant violations and mega shutdowns
 */
public class RunnerMetrics implements MeterBinder {

    public static final String USERS = "meganode.users";
    public static final String MEMORY_USED = "meganode.memory.used";
    public static final String MEMORY_HARD_LIMIT = "meganode.memory.hard_limit";
    public static final String MEMORY_SOFT_LIMIT = "meganode.memory.soft_limit";

    public static final String ADMISSIONS = "meganode.admissions";
    public static final String RENEWALS = "meganode.renewals";
    public static final String MISROUTED = "meganode.requests.misrouted";
    public static final String EVICTIONS = "meganode.evictions";
    public static final String STARTUP_DURATION = "meganode.user.startup";
    public static final String FINISHED = "meganode.users.finished";
    public static final String INVARIANT_VIOLATIONS = "meganode.invariant.violations";
    public static final String MEGA_SHUTDOWNS = "meganode.shutdowns";
    public static final String ACTIVITY_DROPPED = "meganode.activity.dropped";

    /**
     * Why an eviction started.
     */
    public enum EvictionReason {
        REQUESTED,
        INACTIVE,
        PROACTIVE,
        CAPACITY
    }

    public enum UserGauge {
        STARTING,
        RUNNING,
        EVICTING
    }

    private MeterRegistry registry;

    private final Map<UserGauge, AtomicInteger> userGauges = new EnumMap<>(UserGauge.class);
    private final AtomicLong memoryUsed = new AtomicLong();
    private final AtomicLong hardLimit = new AtomicLong();
    private final AtomicLong softLimit = new AtomicLong();

    public RunnerMetrics() {
        for (UserGauge state : UserGauge.values()) {
            userGauges.put(state, new AtomicInteger(0));
        }
    }

    /**
     * Metrics bound to a private registry; for tests and tools that do not export metrics.
     */
    public static RunnerMetrics unexported() {
        RunnerMetrics metrics = new RunnerMetrics();
        metrics.bindTo(new SimpleMeterRegistry());
        return metrics;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (UserGauge state : UserGauge.values()) {
            Gauge.builder(USERS, userGauges.get(state), AtomicInteger::get)
                .tag("state", state.name())
                .description("Number of user nodes in " + state + " state")
                .register(registry);
        }
        Gauge.builder(MEMORY_USED, memoryUsed, AtomicLong::get)
            .baseUnit("bytes")
            .description("Memory accounted to admitted user nodes")
            .register(registry);
        Gauge.builder(MEMORY_HARD_LIMIT, hardLimit, AtomicLong::get)
            .baseUnit("bytes")
            .description("Admission ceiling for user node memory")
            .register(registry);
        Gauge.builder(MEMORY_SOFT_LIMIT, softLimit, AtomicLong::get)
            .baseUnit("bytes")
            .description("Proactive eviction threshold for user node memory")
            .register(registry);
    }

    // ========== Gauges ==========

    public void recordState(int starting, int running, int evicting, MemoryBudget budget) {
        userGauges.get(UserGauge.STARTING).set(starting);
        userGauges.get(UserGauge.RUNNING).set(running);
        userGauges.get(UserGauge.EVICTING).set(evicting);
        memoryUsed.set(budget.currentMemory());
        hardLimit.set(budget.hardLimit());
        softLimit.set(budget.softLimit());
    }

    public int userGauge(UserGauge state) {
        return userGauges.get(state).get();
    }

    // ========== Admission ==========

    public void userAdmitted() {
        admission("admitted");
    }

    public void admissionDenied() {
        admission("denied");
    }

    public void runRequestWhileEvicting() {
        admission("evicting");
    }

    private void admission(String outcome) {
        Counter.builder(ADMISSIONS)
            .tag("outcome", outcome)
            .description("Run requests for users not yet admitted, by outcome")
            .register(registry)
            .increment();
    }

    public void leaseRenewed() {
        Counter.builder(RENEWALS)
            .description("Run requests renewing an admitted user")
            .register(registry)
            .increment();
    }

    public void requestMisrouted(String command) {
        Counter.builder(MISROUTED)
            .tag("command", command)
            .description("Requests addressed to another meganode")
            .register(registry)
            .increment();
    }

    // ========== Lifecycle ==========

    public void evictionStarted(EvictionReason reason) {
        Counter.builder(EVICTIONS)
            .tag("reason", reason.name().toLowerCase())
            .description("User evictions started")
            .register(registry)
            .increment();
    }

    public void userReady(Duration startup) {
        Timer.builder(STARTUP_DURATION)
            .description("Time from admission until a user node reports ready")
            .register(registry)
            .record(startup);
    }

    public void userFinished(boolean success, String errorType) {
        Counter.builder(FINISHED)
            .tag("outcome", success ? "success" : "failure")
            .tag("error_type", errorType)
            .description("User node tasks that ended")
            .register(registry)
            .increment();
    }

    // ========== Process ==========

    public void invariantViolated() {
        Counter.builder(INVARIANT_VIOLATIONS)
            .description("Runner bookkeeping errors detected")
            .register(registry)
            .increment();
    }

    public void megaShutdown(String reason) {
        Counter.builder(MEGA_SHUTDOWNS)
            .tag("reason", reason)
            .description("Meganode shutdowns initiated by the runner")
            .register(registry)
            .increment();
    }

    public void activityReportDropped() {
        Counter.builder(ACTIVITY_DROPPED)
            .description("Activity reports dropped because the task channel was full")
            .register(registry)
            .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
