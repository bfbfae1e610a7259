package com.meganode.engine;

import com.meganode.core.logging.LoggingContext;
import com.meganode.core.model.MegaConfig;
import com.meganode.core.model.RunnerCommand;
import com.meganode.core.signal.NotifyOnce;
import com.meganode.core.task.NamedTask;
import com.meganode.engine.lifecycle.TaskJoiner;
import com.meganode.scheduler.ActivityReporter;
import com.meganode.scheduler.RunnerMetrics;
import com.meganode.scheduler.RunnerStatus;
import com.meganode.scheduler.UserRunner;
import com.meganode.worker.UserNode;
import com.meganode.worker.UserNodeSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One meganode: the user runner, its user node supervisor, and the task joiner
 * that owns their threads, all tied to a single shutdown signal.
 *
 * <pre>
 * MegaNode megaNode = new MegaNode(config, userNode, metrics, reporter, Clock.systemUTC());
 * megaNode.start();
 * megaNode.submit(RunUserRequest.of(userPk, leaseId, config.megaId(), false));
 * ...
 * TaskJoiner.JoinResult result = megaNode.awaitTermination();
 * </pre>
 */
public class MegaNode {

    private static final Logger log = LoggerFactory.getLogger(MegaNode.class);

    public static final String USER_RUNNER_TASK = "(user-runner)";

    // Extra time the joiner allows on top of the runner's own wait for user nodes
    private static final Duration JOIN_GRACE = Duration.ofSeconds(5);

    private final MegaConfig config;
    private final RunnerMetrics metrics;
    private final NotifyOnce shutdown = new NotifyOnce();
    private final UserNodeSupervisor supervisor;
    private final TaskJoiner joiner;
    private final UserRunner runner;

    public MegaNode(
            MegaConfig config,
            UserNode userNode,
            RunnerMetrics metrics,
            ActivityReporter activityReporter,
            Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.supervisor = new UserNodeSupervisor(userNode);
        this.joiner = new TaskJoiner(shutdown, config.userShutdownTimeout().plus(JOIN_GRACE));
        this.runner = new UserRunner(config, supervisor, shutdown, clock, metrics, joiner, activityReporter);
        joiner.addStatic(new NamedTask(USER_RUNNER_TASK, runner));
    }

    public void start() {
        LoggingContext.setMegaId(config.megaId());
        log.info("Starting meganode {} (runner url: {})", config.megaId(),
            config.hasRunnerUrl() ? config.runnerUrl() : "none");
        joiner.start();
    }

    /**
     * Hand a command to the user runner.
     *
     * @return false if it was rejected; its waiter has already been completed
     */
    public boolean submit(RunnerCommand command) {
        return runner.submit(command);
    }

    public RunnerStatus status() {
        return runner.status();
    }

    /**
     * Ask the meganode to shut down. Only the first request has any effect.
     */
    public boolean requestShutdown(String reason) {
        if (!shutdown.send()) {
            return false;
        }
        log.info("Shutdown requested: {}", reason);
        metrics.megaShutdown(reason);
        return true;
    }

    public boolean isShutdownRequested() {
        return shutdown.isSent();
    }

    /**
     * Block until the meganode has shut down, whoever requested it.
     */
    public TaskJoiner.JoinResult awaitTermination() throws InterruptedException {
        TaskJoiner.JoinResult result = joiner.join();
        List<String> hungNodes = supervisor.shutdown(Duration.ofSeconds(1));
        if (hungNodes.isEmpty()) {
            return result;
        }
        List<String> hung = new ArrayList<>(result.hungTasks());
        hung.addAll(hungNodes);
        return new TaskJoiner.JoinResult(List.copyOf(hung), result.failedTasks());
    }

    public MegaConfig config() {
        return config;
    }

    /**
     * Signal sent once the meganode begins shutting down.
     */
    public NotifyOnce shutdownSignal() {
        return shutdown;
    }
}
