package com.meganode.worker;

import com.meganode.core.logging.LoggingContext;
import com.meganode.core.model.LeaseId;
import com.meganode.core.model.UserPk;
import com.meganode.core.signal.NotifyOnce;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the set of spawned user node tasks.
 *
 * Responsibilities:
 * - Spawn one task per admitted user on a dedicated thread
 * - Merge readiness, activity and completion of all tasks into one event sequence
 * - Forward cooperative stop requests
 *
 * The event sequence is drained by a single consumer (the user runner), which is
 * woken through the listener installed with {@link #setEventListener(Runnable)}.
 */
public class UserNodeSupervisor {

    private static final Logger log = LoggerFactory.getLogger(UserNodeSupervisor.class);

    private final UserNode userNode;
    private final ExecutorService executor;
    private final Queue<UserNodeEvent> events = new ConcurrentLinkedQueue<>();
    private final Map<Long, TaskHandle> liveTasks = new ConcurrentHashMap<>();
    private final AtomicLong nextTaskId = new AtomicLong(1);
    private volatile Runnable eventListener = () -> { };

    public UserNodeSupervisor(UserNode userNode) {
        this(userNode, Executors.newCachedThreadPool(new UserNodeThreadFactory()));
    }

    public UserNodeSupervisor(UserNode userNode, ExecutorService executor) {
        this.userNode = userNode;
        this.executor = executor;
    }

    /**
     * Install the callback run after every new event. Must be quick and non-blocking.
     */
    public void setEventListener(Runnable eventListener) {
        this.eventListener = eventListener;
    }

    /**
     * Spawn a user node task.
     *
     * @param userPk The user to run
     * @param leaseId The lease the user was admitted under
     * @param shutdownAfterSync Forwarded to the node unchanged
     * @return A handle to the spawned task
     */
    public UserNodeHandle spawn(UserPk userPk, LeaseId leaseId, boolean shutdownAfterSync) {
        long taskId = nextTaskId.getAndIncrement();
        TaskHandle handle = new TaskHandle(userPk, taskId);

        UserNodeContext context = new UserNodeContext(
            userPk,
            leaseId,
            shutdownAfterSync,
            handle.stopSignal,
            ports -> publish(new UserNodeEvent.Ready(userPk, taskId, ports)),
            pk -> publish(new UserNodeEvent.Active(pk, taskId))
        );

        liveTasks.put(taskId, handle);
        try {
            executor.execute(() -> runUserNode(handle, context));
        } catch (RuntimeException e) {
            // Executor rejected the task; report it as finished so the slot is freed
            log.error("Failed to spawn user node {}", userPk.shortId(), e);
            finish(handle, UserNodeOutcome.failed(userPk, taskId, e, Duration.ZERO));
        }
        log.debug("Spawned user node {} as task {}", userPk.shortId(), taskId);
        return handle;
    }

    /**
     * Take the next event, or null if none is pending.
     */
    public UserNodeEvent pollEvent() {
        return events.poll();
    }

    /**
     * Number of tasks spawned whose completion has not been published yet.
     */
    public int liveTaskCount() {
        return liveTasks.size();
    }

    /**
     * Ask every live task to stop.
     */
    public void stopAll() {
        liveTasks.values().forEach(TaskHandle::stop);
    }

    /**
     * Stop every task and wait for them to finish.
     *
     * @param timeout How long to wait before interrupting remaining tasks
     * @return Names of tasks still alive when the timeout hit
     */
    public List<String> shutdown(Duration timeout) {
        stopAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<String> hung = liveTasks.values().stream()
                    .map(h -> "user-node-" + h.userPk.shortId())
                    .toList();
                log.warn("User node shutdown timed out with {} tasks still running: {}", hung.size(), hung);
                executor.shutdownNow();
                return hung;
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        return List.of();
    }

    private void runUserNode(TaskHandle handle, UserNodeContext context) {
        long startNanos = System.nanoTime();
        UserNodeOutcome outcome = null;
        try (var ctx = LoggingContext.forUser(handle.userPk, context.getLeaseId())) {
            log.info("User node started");
            userNode.run(context);
            outcome = UserNodeOutcome.completed(handle.userPk, handle.taskId, elapsed(startNanos));
            log.info("User node finished");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (handle.isStopRequested()) {
                outcome = UserNodeOutcome.completed(handle.userPk, handle.taskId, elapsed(startNanos));
                log.info("User node interrupted after stop request");
            } else {
                outcome = UserNodeOutcome.failed(handle.userPk, handle.taskId, e, elapsed(startNanos));
                log.warn("User node interrupted without stop request");
            }
        } catch (UserNodeException e) {
            outcome = UserNodeOutcome.failed(handle.userPk, handle.taskId, e, elapsed(startNanos));
            log.warn("User node failed: {} - {}", e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            outcome = UserNodeOutcome.failed(handle.userPk, handle.taskId, e, elapsed(startNanos));
            log.error("User node failed with unexpected error", e);
        } finally {
            if (outcome == null) {
                outcome = UserNodeOutcome.failed(handle.userPk, handle.taskId,
                    new IllegalStateException("User node terminated abnormally"), elapsed(startNanos));
            }
            finish(handle, outcome);
        }
    }

    private void finish(TaskHandle handle, UserNodeOutcome outcome) {
        if (!handle.outcome.complete(outcome)) {
            return;
        }
        liveTasks.remove(handle.taskId);
        publish(new UserNodeEvent.Finished(outcome));
    }

    private void publish(UserNodeEvent event) {
        events.add(event);
        eventListener.run();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static final class TaskHandle implements UserNodeHandle {
        private final UserPk userPk;
        private final long taskId;
        private final NotifyOnce stopSignal = new NotifyOnce();
        private final CompletableFuture<UserNodeOutcome> outcome = new CompletableFuture<>();

        private TaskHandle(UserPk userPk, long taskId) {
            this.userPk = userPk;
            this.taskId = taskId;
        }

        @Override
        public UserPk userPk() {
            return userPk;
        }

        @Override
        public long taskId() {
            return taskId;
        }

        @Override
        public void stop() {
            if (stopSignal.send()) {
                log.debug("Requested stop of user node {} (task {})", userPk.shortId(), taskId);
            }
        }

        @Override
        public boolean isStopRequested() {
            return stopSignal.isSent();
        }

        @Override
        public boolean isFinished() {
            return outcome.isDone();
        }

        @Override
        public Optional<UserNodeOutcome> join(Duration timeout) throws InterruptedException {
            try {
                return Optional.of(outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                return Optional.empty();
            } catch (ExecutionException e) {
                // The outcome future is only ever completed normally
                throw new IllegalStateException(e);
            }
        }

        @Override
        public String toString() {
            return "user-node-" + userPk.shortId() + "#" + taskId;
        }
    }

    private static final class UserNodeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "user-node-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
