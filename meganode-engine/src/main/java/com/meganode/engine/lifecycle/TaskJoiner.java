package com.meganode.engine.lifecycle;

import com.meganode.core.signal.NotifyOnce;
import com.meganode.core.task.NamedTask;
import com.meganode.core.task.TaskSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Supervises the meganode's long-lived (static) tasks and its short-lived
 * (ephemeral) helper tasks, and shuts them all down together.
 *
 * On shutdown:
 * 1. Stops accepting ephemeral tasks
 * 2. Waits for every task to finish, up to the shutdown timeout
 * 3. Reports tasks that are still running as hung
 *
 * Static tasks are expected to run until the shutdown signal is sent. A static
 * task that returns or throws before then sends the signal itself, so one dead
 * component takes the whole meganode down instead of leaving it half alive.
 */
public class TaskJoiner implements TaskSink {

    private static final Logger log = LoggerFactory.getLogger(TaskJoiner.class);

    public static final int DEFAULT_EPHEMERAL_CAPACITY = 64;

    private final NotifyOnce shutdown;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;
    private final Semaphore ephemeralPermits;

    private final List<NamedTask> staticTasks = new ArrayList<>();
    private final Map<Long, String> liveTasks = new ConcurrentHashMap<>();
    private final Set<String> failedTasks = ConcurrentHashMap.newKeySet();
    private final AtomicLong nextTaskId = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean closed;
    private JoinResult result;

    public TaskJoiner(NotifyOnce shutdown, Duration shutdownTimeout) {
        this(shutdown, shutdownTimeout, DEFAULT_EPHEMERAL_CAPACITY);
    }

    public TaskJoiner(NotifyOnce shutdown, Duration shutdownTimeout, int ephemeralCapacity) {
        this.shutdown = shutdown;
        this.shutdownTimeout = shutdownTimeout;
        this.ephemeralPermits = new Semaphore(ephemeralCapacity);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "meganode-task");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Register a task that runs for the lifetime of the meganode. Must be called before {@link #start()}.
     */
    public void addStatic(NamedTask task) {
        if (started.get()) {
            throw new IllegalStateException("Cannot add static task after start: " + task.name());
        }
        staticTasks.add(task);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting {} static tasks: {}", staticTasks.size(),
            staticTasks.stream().map(NamedTask::name).toList());
        for (NamedTask task : staticTasks) {
            launch(task, true);
        }
    }

    /**
     * Hand off a short-lived helper task. Never blocks.
     *
     * @return false if the joiner is shutting down or too many helper tasks are running
     */
    @Override
    public boolean trySend(NamedTask task) {
        if (closed || shutdown.isSent()) {
            log.debug("Rejecting ephemeral task {} during shutdown", task.name());
            return false;
        }
        if (!ephemeralPermits.tryAcquire()) {
            log.warn("Too many ephemeral tasks running, dropping {}", task.name());
            return false;
        }
        if (!launch(task, false)) {
            ephemeralPermits.release();
            return false;
        }
        return true;
    }

    /**
     * Wait for the shutdown signal, then for every task to finish.
     * Safe to call from several threads; all of them get the same result.
     */
    public synchronized JoinResult join() throws InterruptedException {
        if (result != null) {
            return result;
        }
        shutdown.await();
        closed = true;

        log.info("Shutting down; waiting up to {} for {} tasks", shutdownTimeout, liveTasks.size());
        executor.shutdown();
        List<String> hung = List.of();
        if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            hung = List.copyOf(liveTasks.values());
            log.warn("Shutdown timed out with {} tasks still running: {}", hung.size(), hung);
            executor.shutdownNow();
        } else {
            log.info("All tasks finished");
        }

        result = new JoinResult(hung, List.copyOf(failedTasks));
        return result;
    }

    public int liveTaskCount() {
        return liveTasks.size();
    }

    private boolean launch(NamedTask task, boolean isStatic) {
        long id = nextTaskId.incrementAndGet();
        liveTasks.put(id, task.name());
        try {
            executor.execute(() -> runTask(id, task, isStatic));
            return true;
        } catch (RejectedExecutionException e) {
            liveTasks.remove(id);
            log.warn("Task {} rejected: executor is shut down", task.name());
            return false;
        }
    }

    private void runTask(long id, NamedTask task, boolean isStatic) {
        Thread thread = Thread.currentThread();
        String previousName = thread.getName();
        thread.setName(task.name());
        try {
            task.body().run();
            if (isStatic && !shutdown.isSent()) {
                log.error("Static task {} finished before shutdown", task.name());
                failedTasks.add(task.name());
            }
        } catch (RuntimeException e) {
            log.error("Task {} failed", task.name(), e);
            failedTasks.add(task.name());
        } finally {
            liveTasks.remove(id);
            if (!isStatic) {
                ephemeralPermits.release();
            }
            thread.setName(previousName);
            if (isStatic && shutdown.send()) {
                log.info("Static task {} exited, sent shutdown signal", task.name());
            }
        }
    }

    /**
     * Outcome of joining all tasks.
     *
     * @param hungTasks Tasks still running when the shutdown timeout hit
     * @param failedTasks Tasks that threw, and static tasks that exited before shutdown
     */
    public record JoinResult(List<String> hungTasks, List<String> failedTasks) {
        public boolean isClean() {
            return hungTasks.isEmpty() && failedTasks.isEmpty();
        }
    }
}
