package com.meganode.scheduler;

import com.meganode.core.exception.AdmissionDeniedException;
import com.meganode.core.exception.InvariantViolationException;
import com.meganode.core.exception.MisroutedRequestException;
import com.meganode.core.exception.RunnerBusyException;
import com.meganode.core.exception.ShuttingDownException;
import com.meganode.core.exception.UserEvictedException;
import com.meganode.core.exception.UserEvictingException;
import com.meganode.core.exception.UserNodeStoppedException;
import com.meganode.core.logging.LoggingContext;
import com.meganode.core.model.EvictUserRequest;
import com.meganode.core.model.MegaConfig;
import com.meganode.core.model.RunPorts;
import com.meganode.core.model.RunUserRequest;
import com.meganode.core.model.RunnerCommand;
import com.meganode.core.model.UserActivity;
import com.meganode.core.model.UserPk;
import com.meganode.core.model.UserRunResponse;
import com.meganode.core.model.UserState;
import com.meganode.core.signal.NotifyOnce;
import com.meganode.core.task.NamedTask;
import com.meganode.core.task.TaskSink;
import com.meganode.scheduler.RunnerMetrics.EvictionReason;
import com.meganode.worker.UserNodeEvent;
import com.meganode.worker.UserNodeHandle;
import com.meganode.worker.UserNodeOutcome;
import com.meganode.worker.UserNodeSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs user nodes upon request, within this meganode's memory budget.
 *
 * Responsibilities:
 * - Admit users, evicting idle ones to keep memory headroom
 * - Track every user node from admission until its task completes
 * - Evict users that have been inactive for too long
 * - Shut the meganode down once no user has been active for too long
 *
 * All state is owned by the thread executing {@link #run()}; other threads only
 * {@link #submit} commands and read {@link #status()} snapshots. The handler
 * methods are public so that tests can drive the runner step by step without
 * starting the loop.
 */
public class UserRunner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(UserRunner.class);

    public static final int COMMAND_QUEUE_CAPACITY = 1024;
    public static final String ACTIVITY_TASK_NAME = "(megarunner-activity-notif)";

    private final MegaConfig config;
    private final UserNodeSupervisor supervisor;
    private final NotifyOnce megaShutdown;
    private final Clock clock;
    private final RunnerMetrics metrics;
    private final TaskSink ephemeralTasks;
    private final ActivityReporter activityReporter;

    private final BlockingQueue<RunnerCommand> commands = new LinkedBlockingQueue<>(COMMAND_QUEUE_CAPACITY);
    private final Semaphore wakeups = new Semaphore(0);
    private final Object submitLock = new Object();
    private boolean closed;

    // Owned by the loop thread
    private final Map<UserPk, UserEntry> users = new HashMap<>();
    private final UserLru lru = new UserLru();
    private final MemoryBudget budget;
    private final Set<UserPk> activityQueue = new LinkedHashSet<>();
    private Instant lastMegaActivity;

    private volatile RunnerStatus status;

    /**
     * @param activityReporter Receives batches of active users; null disables reporting
     */
    public UserRunner(
            MegaConfig config,
            UserNodeSupervisor supervisor,
            NotifyOnce megaShutdown,
            Clock clock,
            RunnerMetrics metrics,
            TaskSink ephemeralTasks,
            ActivityReporter activityReporter) {
        this.config = config;
        this.supervisor = supervisor;
        this.megaShutdown = megaShutdown;
        this.clock = clock;
        this.metrics = metrics;
        this.ephemeralTasks = ephemeralTasks;
        this.activityReporter = activityReporter;
        this.budget = MemoryBudget.fromConfig(config);
        this.lastMegaActivity = clock.instant();

        supervisor.setEventListener(wakeups::release);
        megaShutdown.onSend(wakeups::release);
        publishStatus();
    }

    // ========== Inbound ==========

    /**
     * Enqueue a command for the loop. Safe to call from any thread.
     *
     * @return false if the command was rejected; its waiter has been completed
     */
    public boolean submit(RunnerCommand command) {
        synchronized (submitLock) {
            if (!closed && commands.offer(command)) {
                wakeups.release();
                return true;
            }
            if (closed) {
                rejectOnShutdown(command);
            } else {
                rejectBusy(command);
            }
            return false;
        }
    }

    public RunnerStatus status() {
        return status;
    }

    // ========== Loop ==========

    /**
     * Run the control loop until the mega shutdown signal is sent, then stop
     * every user node and wait (bounded) for them to finish.
     */
    @Override
    public void run() {
        LoggingContext.setMegaId(config.megaId());
        log.info("User runner started: max {} users, soft limit {} of {} bytes",
            budget.maxUsers(), budget.softLimit(), budget.hardLimit());

        Instant nextSweep = clock.instant().plus(config.sweepInterval());
        try {
            while (!megaShutdown.isSent()) {
                RunnerCommand command = commands.poll();
                if (command != null) {
                    step(() -> handleCommand(command, clock.instant()));
                    continue;
                }

                UserNodeEvent event = supervisor.pollEvent();
                if (event != null) {
                    step(() -> handleEvent(event, clock.instant()));
                    continue;
                }

                Instant now = clock.instant();
                if (!now.isBefore(nextSweep)) {
                    step(() -> sweep(now));
                    nextSweep = now.plus(config.sweepInterval());
                    continue;
                }

                long waitMillis = Math.max(1, Duration.between(now, nextSweep).toMillis());
                if (wakeups.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
                    wakeups.drainPermits();
                }
            }
            log.info("Received mega shutdown signal");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("User runner interrupted, shutting down");
            megaShutdown.send();
        } finally {
            shutdownUsers();
            LoggingContext.clearAll();
        }
    }

    private void step(Runnable action) {
        try {
            action.run();
        } catch (InvariantViolationException e) {
            metrics.invariantViolated();
            if (config.strictInvariants()) {
                log.error("Invariant violated, shutting down meganode", e);
                megaShutdown.send();
                throw e;
            }
            log.error("Invariant violated, continuing with degraded guarantees", e);
        }
    }

    public void handleCommand(RunnerCommand command, Instant now) {
        if (command instanceof RunUserRequest run) {
            handleRunRequest(run, now);
        } else if (command instanceof EvictUserRequest evict) {
            handleEvictRequest(evict, now);
        } else if (command instanceof UserActivity activity) {
            handleActivity(activity.userPk(), now);
        } else {
            throw new IllegalArgumentException("Unknown runner command: " + command.getClass().getName());
        }
    }

    public void handleEvent(UserNodeEvent event, Instant now) {
        if (event instanceof UserNodeEvent.Finished finished) {
            handleFinished(finished.outcome(), now);
        } else if (event instanceof UserNodeEvent.Ready ready) {
            handleUserReady(ready.userPk(), ready.taskId(), ready.ports(), now);
        } else if (event instanceof UserNodeEvent.Active active) {
            if (isCurrentTask(active.userPk(), active.taskId())) {
                handleActivity(active.userPk(), now);
            }
        } else {
            throw new IllegalArgumentException("Unknown user node event: " + event.getClass().getName());
        }
    }

    /**
     * Drain every pending worker event. Used by tests and by shutdown.
     *
     * @return the number of events handled
     */
    public int handlePendingEvents(Instant now) {
        int handled = 0;
        UserNodeEvent event;
        while ((event = supervisor.pollEvent()) != null) {
            handleEvent(event, now);
            handled++;
        }
        return handled;
    }

    // ========== Commands ==========

    /**
     * Admit a user, or renew an admitted user's lease.
     */
    public void handleRunRequest(RunUserRequest req, Instant now) {
        UserPk userPk = req.userPk();
        try (var ctx = LoggingContext.forUser(userPk, req.leaseId())) {
            if (!config.megaId().equals(req.megaId())) {
                log.debug("Ignoring run request addressed to meganode {}", req.megaId());
                metrics.requestMisrouted("run");
                req.readyWaiter().completeExceptionally(
                    new MisroutedRequestException(req.megaId(), config.megaId()));
            } else {
                lastMegaActivity = later(lastMegaActivity, now);
                UserEntry existing = users.get(userPk);
                if (existing != null) {
                    renew(existing, req, now);
                } else {
                    admit(req, now);
                }
            }
        }
        afterMutation();
    }

    private void renew(UserEntry entry, RunUserRequest req, Instant now) {
        switch (entry.state()) {
            case EVICTING -> {
                log.info("Rejecting run request for user being evicted");
                metrics.runRequestWhileEvicting();
                req.readyWaiter().completeExceptionally(new UserEvictingException(entry.userPk()));
            }
            case RUNNING -> {
                renewLease(entry, req, now);
                req.readyWaiter().complete(UserRunResponse.ready(entry.ports()));
            }
            case STARTING -> {
                renewLease(entry, req, now);
                entry.addReadyWaiter(req.readyWaiter());
            }
        }
    }

    private void renewLease(UserEntry entry, RunUserRequest req, Instant now) {
        entry.renewLease(req.leaseId(), now.plus(config.leaseLifetime()));
        entry.markActive(now);
        lru.touch(entry.userPk(), now);
        metrics.leaseRenewed();
        log.debug("Renewed lease of {} user", entry.state());
    }

    private void admit(RunUserRequest req, Instant now) {
        UserPk userPk = req.userPk();

        if (!budget.wouldFit(1)) {
            // Evicting frees memory only once the victim's task completes,
            // so the caller has to come back later either way.
            boolean freeing = ensureEvicting(budget.slotsOverHard(1), EvictionReason.CAPACITY);
            log.warn("Admission denied at {}; room being freed: {}", budget, freeing);
            metrics.admissionDenied();
            req.readyWaiter().completeExceptionally(new AdmissionDeniedException(
                userPk, budget.currentMemory(), budget.hardLimit(), freeing));
            return;
        }

        ensureEvicting(budget.slotsOverSoft(1), EvictionReason.PROACTIVE);

        UserNodeHandle handle = supervisor.spawn(userPk, req.leaseId(), req.shutdownAfterSync());
        UserEntry entry = new UserEntry(
            userPk,
            req.leaseId(),
            req.shutdownAfterSync(),
            handle,
            now,
            now.plus(config.leaseLifetime())
        );
        entry.addReadyWaiter(req.readyWaiter());
        users.put(userPk, entry);
        lru.touch(userPk, now);
        budget.reserve();
        metrics.userAdmitted();

        log.info("Admitted user (shutdownAfterSync={}), now {}", req.shutdownAfterSync(), budget);
    }

    /**
     * Make sure at least {@code slots} users are evicting, counting evictions already
     * in flight, by evicting the least recently active running users.
     *
     * @return true if enough evictions are in flight to free {@code slots} slots
     */
    private boolean ensureEvicting(int slots, EvictionReason reason) {
        int inFlight = (int) users.values().stream()
            .filter(entry -> entry.state() == UserState.EVICTING)
            .count();
        while (inFlight < slots && evictLeastRecentRunning(reason)) {
            inFlight++;
        }
        return inFlight >= slots;
    }

    /**
     * Begin evicting the least recently active running user, if there is one.
     */
    private boolean evictLeastRecentRunning(EvictionReason reason) {
        UserEntry victim = null;
        for (UserPk candidate : lru.users()) {
            UserEntry entry = users.get(candidate);
            if (entry != null && entry.state() == UserState.RUNNING) {
                victim = entry;
                break;
            }
        }
        if (victim == null) {
            return false;
        }
        beginEviction(victim, reason);
        return true;
    }

    /**
     * Stop a user. Any evict request addressed to this meganode counts as
     * meganode activity, even for a user that is not running here.
     */
    public void handleEvictRequest(EvictUserRequest req, Instant now) {
        UserPk userPk = req.userPk();
        try (var ctx = LoggingContext.forUser(userPk)) {
            UserEntry entry = users.get(userPk);
            if (!config.megaId().equals(req.megaId())) {
                log.debug("Ignoring evict request addressed to meganode {}", req.megaId());
                metrics.requestMisrouted("evict");
                req.stoppedWaiter().complete(null);
            } else {
                lastMegaActivity = later(lastMegaActivity, now);
                if (entry == null) {
                    log.debug("Evict request for user not running here");
                    req.stoppedWaiter().complete(null);
                } else {
                    if (entry.state().isLive()) {
                        beginEviction(entry, EvictionReason.REQUESTED);
                    }
                    entry.addStoppedWaiter(req.stoppedWaiter());
                }
            }
        }
        afterMutation();
    }

    /**
     * Record activity of a user. Ignored for unknown or evicting users, since
     * activity can race benignly with eviction.
     */
    public void handleActivity(UserPk userPk, Instant now) {
        UserEntry entry = users.get(userPk);
        if (entry == null || entry.state() == UserState.EVICTING) {
            log.trace("Ignoring activity for user {} that is not running", userPk.shortId());
            return;
        }
        entry.markActive(now);
        lru.touch(userPk, now);
        activityQueue.add(userPk);
        lastMegaActivity = later(lastMegaActivity, now);
        afterMutation();
    }

    // ========== Worker events ==========

    /**
     * A user node reported it is ready to serve.
     */
    public void handleUserReady(UserPk userPk, long taskId, RunPorts ports, Instant now) {
        try (var ctx = LoggingContext.forUser(userPk)) {
            UserEntry entry = users.get(userPk);
            if (entry == null || entry.handle().taskId() != taskId) {
                log.debug("Ignoring readiness of stale task {}", taskId);
                return;
            }
            if (entry.state() != UserState.STARTING) {
                log.debug("Ignoring readiness of {} user", entry.state());
                return;
            }

            entry.transitionTo(UserState.RUNNING);
            entry.setPorts(ports);
            entry.markActive(now);
            lru.touch(userPk, now);
            lastMegaActivity = later(lastMegaActivity, now);

            Duration startup = Duration.between(entry.admittedAt(), now);
            metrics.userReady(startup.isNegative() ? Duration.ZERO : startup);
            log.info("User ready on app port {} after {}", ports.appPort(), startup);

            UserRunResponse response = UserRunResponse.ready(ports);
            entry.takeReadyWaiters().forEach(waiter -> waiter.complete(response));
        }
        afterMutation();
    }

    /**
     * A user node's task completed. Frees the user's slot and resolves all of
     * its waiters, whatever the reason the task ended.
     */
    public void handleFinished(UserNodeOutcome outcome, Instant now) {
        UserPk userPk = outcome.userPk();
        try (var ctx = LoggingContext.forUser(userPk)) {
            UserEntry entry = users.get(userPk);
            if (entry == null || entry.handle().taskId() != outcome.taskId()) {
                violation(String.format("Observed completion of untracked task %d for user %s",
                    outcome.taskId(), userPk.shortId()));
                return;
            }

            // Every removal passes through EVICTING
            if (entry.state().isLive()) {
                entry.transitionTo(UserState.EVICTING);
            }
            users.remove(userPk);
            lru.remove(userPk);
            budget.release();

            List<CompletableFuture<Void>> stoppedWaiters = entry.takeStoppedWaiters();
            List<CompletableFuture<UserRunResponse>> readyWaiters = entry.takeReadyWaiters();
            boolean anyoneWaiting = !stoppedWaiters.isEmpty() || !readyWaiters.isEmpty();

            if (outcome.isSuccess()) {
                log.info("User node stopped after {}, now {}", outcome.runtime(), budget);
            } else if (anyoneWaiting) {
                log.warn("User node failed: {}", outcome.errorType(), outcome.cause());
            } else {
                log.error("User node failed with nobody waiting: {}", outcome.errorType(), outcome.cause());
            }
            metrics.userFinished(outcome.isSuccess(), outcome.errorType());

            stoppedWaiters.forEach(waiter -> waiter.complete(null));
            for (CompletableFuture<UserRunResponse> waiter : readyWaiters) {
                if (outcome.isSuccess() && entry.shutdownAfterSync()) {
                    waiter.complete(UserRunResponse.syncCompleted(userPk));
                } else if (outcome.isSuccess()) {
                    waiter.completeExceptionally(new UserNodeStoppedException(userPk, "exited"));
                } else {
                    waiter.completeExceptionally(new UserNodeStoppedException(userPk, outcome.cause()));
                }
            }
        }
        afterMutation();
    }

    // ========== Sweeps ==========

    /**
     * Periodic pass: inactivity eviction, mega shutdown check, activity reporting.
     */
    public void sweep(Instant now) {
        evictInactiveUsers(now);
        shutdownIfInactive(now);
        flushActivity();
    }

    /**
     * Begin evicting every running user inactive for longer than the user
     * inactivity timeout.
     */
    public void evictInactiveUsers(Instant now) {
        List<UserEntry> inactive = users.values().stream()
            .filter(entry -> entry.state() == UserState.RUNNING)
            .filter(entry -> Duration.between(entry.lastActiveAt(), now).compareTo(config.userInactivity()) > 0)
            .sorted(Comparator.comparing(UserEntry::lastActiveAt))
            .toList();

        for (UserEntry entry : inactive) {
            try (var ctx = LoggingContext.forUser(entry.userPk(), entry.leaseId())) {
                log.info("User inactive since {}", entry.lastActiveAt());
                beginEviction(entry, EvictionReason.INACTIVE);
            }
        }
        afterMutation();
    }

    /**
     * Send the mega shutdown signal if no user is tracked at all and the whole
     * meganode has been inactive for longer than the mega inactivity timeout.
     */
    public void shutdownIfInactive(Instant now) {
        if (!users.isEmpty() || megaShutdown.isSent()) {
            return;
        }
        Duration idle = Duration.between(lastMegaActivity, now);
        if (idle.compareTo(config.megaInactivity()) > 0 && megaShutdown.send()) {
            log.info("Meganode inactive for {}, sending shutdown signal", idle);
            metrics.megaShutdown("inactive");
        }
    }

    private void flushActivity() {
        if (activityQueue.isEmpty()) {
            return;
        }
        Set<UserPk> batch = Set.copyOf(activityQueue);
        activityQueue.clear();
        if (activityReporter == null) {
            return;
        }

        NamedTask task = new NamedTask(ACTIVITY_TASK_NAME, () -> {
            try {
                activityReporter.reportActivity(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while notifying runner of activity");
            } catch (Exception e) {
                log.warn("Couldn't notify runner of activity: {}", e.getMessage());
            }
        });
        if (!ephemeralTasks.trySend(task)) {
            metrics.activityReportDropped();
            log.warn("Dropped activity report for {} users", batch.size());
        }
    }

    // ========== Eviction ==========

    private void beginEviction(UserEntry entry, EvictionReason reason) {
        UserPk userPk = entry.userPk();
        entry.transitionTo(UserState.EVICTING);
        lru.remove(userPk);
        entry.handle().stop();

        UserEvictedException evicted = new UserEvictedException(userPk);
        entry.takeReadyWaiters().forEach(waiter -> waiter.completeExceptionally(evicted));

        metrics.evictionStarted(reason);
        log.info("Evicting user {} ({})", userPk.shortId(), reason);
    }

    // ========== Shutdown ==========

    private void shutdownUsers() {
        List<RunnerCommand> unprocessed = new ArrayList<>();
        synchronized (submitLock) {
            closed = true;
            commands.drainTo(unprocessed);
        }

        for (UserEntry entry : List.copyOf(users.values())) {
            if (entry.state().isLive()) {
                entry.transitionTo(UserState.EVICTING);
                lru.remove(entry.userPk());
                entry.handle().stop();
            }
            ShuttingDownException shuttingDown = new ShuttingDownException();
            entry.takeReadyWaiters().forEach(waiter -> waiter.completeExceptionally(shuttingDown));
        }
        for (RunnerCommand command : unprocessed) {
            UserEntry entry = users.get(command.userPk());
            if (command instanceof EvictUserRequest evict && entry != null) {
                entry.addStoppedWaiter(evict.stoppedWaiter());
            } else {
                rejectOnShutdown(command);
            }
        }

        if (!users.isEmpty()) {
            log.info("Waiting up to {} for {} user nodes to stop", config.userShutdownTimeout(), users.size());
            awaitUsersStopped();
        }
        if (!users.isEmpty()) {
            log.warn("{} user nodes did not stop in time: {}", users.size(), users.keySet());
            ShuttingDownException shuttingDown = new ShuttingDownException();
            for (UserEntry entry : users.values()) {
                entry.takeStoppedWaiters().forEach(waiter -> waiter.completeExceptionally(shuttingDown));
            }
        }
        publishStatus();
        log.info("User runner stopped");
    }

    private void awaitUsersStopped() {
        long deadline = System.nanoTime() + config.userShutdownTimeout().toNanos();
        while (!users.isEmpty()) {
            UserNodeEvent event = supervisor.pollEvent();
            if (event instanceof UserNodeEvent.Finished finished) {
                try {
                    handleFinished(finished.outcome(), clock.instant());
                } catch (InvariantViolationException e) {
                    metrics.invariantViolated();
                    log.error("Invariant violated during shutdown", e);
                }
                continue;
            }
            if (event != null) {
                continue;
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                return;
            }
            try {
                wakeups.tryAcquire(remainingNanos, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void rejectOnShutdown(RunnerCommand command) {
        if (command instanceof RunUserRequest run) {
            run.readyWaiter().completeExceptionally(new ShuttingDownException());
        } else if (command instanceof EvictUserRequest evict) {
            // Every user node is being stopped anyway
            evict.stoppedWaiter().complete(null);
        }
    }

    private void rejectBusy(RunnerCommand command) {
        log.warn("Command queue full, rejecting {}", command.getClass().getSimpleName());
        RunnerBusyException busy = new RunnerBusyException(COMMAND_QUEUE_CAPACITY);
        if (command instanceof RunUserRequest run) {
            run.readyWaiter().completeExceptionally(busy);
        } else if (command instanceof EvictUserRequest evict) {
            evict.stoppedWaiter().completeExceptionally(busy);
        }
    }

    // ========== Invariants ==========

    /**
     * Check the runner's bookkeeping. Throws {@link InvariantViolationException}
     * when invariants are strict, otherwise logs and counts the violation.
     */
    public void assertInvariants() {
        List<String> violations = new ArrayList<>();
        int live = 0;

        for (Map.Entry<UserPk, UserEntry> e : users.entrySet()) {
            UserPk userPk = e.getKey();
            UserEntry entry = e.getValue();
            String user = userPk.shortId();
            UserState state = entry.state();

            if (!entry.userPk().equals(userPk) || !entry.handle().userPk().equals(userPk)) {
                violations.add("entry for " + user + " belongs to another user");
            }
            if (state.isLive()) {
                live++;
            }
            if (state.isLive() != lru.contains(userPk)) {
                violations.add(String.format("%s user %s %s in the LRU",
                    state, user, state.isLive() ? "missing" : "still"));
            }
            if (state != UserState.STARTING && entry.readyWaiterCount() > 0) {
                violations.add(String.format("%s user %s has %d pending ready waiters",
                    state, user, entry.readyWaiterCount()));
            }
            if (state != UserState.EVICTING && entry.stoppedWaiterCount() > 0) {
                violations.add(String.format("%s user %s has %d pending stopped waiters",
                    state, user, entry.stoppedWaiterCount()));
            }
            if (state == UserState.EVICTING && !entry.handle().isStopRequested()) {
                violations.add("evicting user " + user + " was never told to stop");
            }
            if (state == UserState.RUNNING && entry.ports() == null) {
                violations.add("running user " + user + " has no ports");
            }
        }

        if (lru.size() != live) {
            violations.add(String.format("LRU has %d users but %d are starting or running", lru.size(), live));
        }
        if (budget.count() != users.size()) {
            violations.add(String.format("budget counts %d users but %d are tracked", budget.count(), users.size()));
        }
        if (!budget.wouldFit(0)) {
            violations.add("memory in use exceeds the hard limit: " + budget);
        }

        if (!violations.isEmpty()) {
            violation(String.join("; ", violations));
        }
    }

    private void violation(String message) {
        if (config.strictInvariants()) {
            throw new InvariantViolationException(message);
        }
        metrics.invariantViolated();
        log.error("Invariant violated: {}", message);
    }

    private void afterMutation() {
        assertInvariants();
        publishStatus();
    }

    private void publishStatus() {
        int starting = 0;
        int running = 0;
        int evicting = 0;
        List<RunnerStatus.UserStatus> snapshot = new ArrayList<>(users.size());
        for (UserEntry entry : users.values()) {
            switch (entry.state()) {
                case STARTING -> starting++;
                case RUNNING -> running++;
                case EVICTING -> evicting++;
            }
            snapshot.add(new RunnerStatus.UserStatus(
                entry.userPk(),
                entry.state(),
                entry.leaseId(),
                entry.lastActiveAt(),
                entry.leaseExpiresAt()
            ));
        }
        snapshot.sort(Comparator.comparing(RunnerStatus.UserStatus::userPk));

        metrics.recordState(starting, running, evicting, budget);
        status = new RunnerStatus(
            config.megaId(),
            starting,
            running,
            evicting,
            budget.currentMemory(),
            budget.softLimit(),
            budget.hardLimit(),
            lastMegaActivity,
            megaShutdown.isSent(),
            List.copyOf(snapshot)
        );
    }

    // ========== Accessors for tests ==========

    private boolean isCurrentTask(UserPk userPk, long taskId) {
        UserEntry entry = users.get(userPk);
        return entry != null && entry.handle().taskId() == taskId;
    }

    UserEntry entry(UserPk userPk) {
        return users.get(userPk);
    }

    Map<UserPk, UserEntry> users() {
        return users;
    }

    UserLru lru() {
        return lru;
    }

    MemoryBudget budget() {
        return budget;
    }

    Set<UserPk> activityQueue() {
        return activityQueue;
    }

    Instant lastMegaActivity() {
        return lastMegaActivity;
    }

    MegaConfig config() {
        return config;
    }

    private static Instant later(Instant a, Instant b) {
        return b.isAfter(a) ? b : a;
    }
}
