package com.meganode.api.node;

import com.meganode.core.model.LeaseId;
import com.meganode.core.model.RunPorts;
import com.meganode.core.model.UserPk;
import com.meganode.core.signal.NotifyOnce;
import com.meganode.worker.UserNodeContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class SimulatedUserNodeTest {

    private final List<RunPorts> readied = new CopyOnWriteArrayList<>();
    private final SimulatedUserNode node =
        new SimulatedUserNode(Duration.ofMillis(10), Duration.ofMillis(20), 30000);

    private UserNodeContext context(long user, boolean shutdownAfterSync, NotifyOnce stop) {
        return new UserNodeContext(UserPk.fromLong(user), LeaseId.of(1), shutdownAfterSync, stop,
            readied::add, userPk -> { });
    }

    @Test
    @DisplayName("Becomes ready on a fresh pair of ports and runs until stopped")
    void readyUntilStopped() throws Exception {
        NotifyOnce stopFirst = new NotifyOnce();
        NotifyOnce stopSecond = new NotifyOnce();
        CompletableFuture<Void> first = runAsync(context(1, false, stopFirst));
        CompletableFuture<Void> second = runAsync(context(2, false, stopSecond));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (readied.size() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }

        assertThat(readied).hasSize(2);
        assertThat(readied).extracting(RunPorts::appPort).containsExactlyInAnyOrder(30000, 30002);
        assertThat(readied).allMatch(ports -> ports.lexePort() == ports.appPort() + 1);
        assertThat(first).isNotDone();

        stopFirst.send();
        stopSecond.send();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("A sync-only run exits after syncing without becoming ready")
    void syncOnly() throws Exception {
        runAsync(context(1, true, new NotifyOnce())).get(5, TimeUnit.SECONDS);

        assertThat(readied).isEmpty();
    }

    @Test
    @DisplayName("A stop during startup exits without becoming ready")
    void stoppedDuringStartup() throws Exception {
        NotifyOnce stop = new NotifyOnce();
        stop.send();

        runAsync(context(1, false, stop)).get(5, TimeUnit.SECONDS);

        assertThat(readied).isEmpty();
    }

    private CompletableFuture<Void> runAsync(UserNodeContext context) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                node.run(context);
                done.complete(null);
            } catch (Exception e) {
                done.completeExceptionally(e);
            }
        });
        thread.setDaemon(true);
        thread.start();
        return done;
    }
}
