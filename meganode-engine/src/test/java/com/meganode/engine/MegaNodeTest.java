package com.meganode.engine;

import com.meganode.core.exception.ShuttingDownException;
import com.meganode.core.model.EvictUserRequest;
import com.meganode.core.model.LeaseId;
import com.meganode.core.model.MegaConfig;
import com.meganode.core.model.MegaId;
import com.meganode.core.model.RunUserRequest;
import com.meganode.core.model.UserPk;
import com.meganode.core.model.UserRunResponse;
import com.meganode.engine.lifecycle.TaskJoiner;
import com.meganode.scheduler.RunnerMetrics;
import com.meganode.worker.UserNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class MegaNodeTest {

    private static final MegaId MEGA = MegaId.of(3);
    private static final UserPk ALICE = UserPk.fromLong(1);

    // Becomes ready at once, then runs until stopped
    private static final UserNode READY_NODE = ctx -> {
        ctx.markReady(9000, 9001);
        ctx.reportActivity();
        ctx.awaitStop();
    };

    private final MegaConfig config = MegaConfig.builder(MEGA)
        .sweepInterval(Duration.ofMillis(50))
        .userShutdownTimeout(Duration.ofSeconds(2))
        .strictInvariants(true)
        .build();

    private final CopyOnWriteArrayList<Set<UserPk>> reported = new CopyOnWriteArrayList<>();
    private MegaNode megaNode;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (megaNode != null) {
            megaNode.requestShutdown("test");
            megaNode.awaitTermination();
        }
    }

    private MegaNode start(UserNode userNode) {
        megaNode = new MegaNode(config, userNode, RunnerMetrics.unexported(), reported::add, Clock.systemUTC());
        megaNode.start();
        return megaNode;
    }

    @Test
    @DisplayName("Run, evict and shutdown flow through the running meganode")
    void endToEnd() throws Exception {
        start(READY_NODE);

        RunUserRequest run = RunUserRequest.of(ALICE, LeaseId.of(1), MEGA, false);
        assertThat(megaNode.submit(run)).isTrue();
        UserRunResponse response = run.readyWaiter().get(5, TimeUnit.SECONDS);
        assertThat(response.ports().appPort()).isEqualTo(9000);

        EvictUserRequest evict = EvictUserRequest.of(ALICE, MEGA);
        megaNode.submit(evict);
        evict.stoppedWaiter().get(5, TimeUnit.SECONDS);

        assertThat(megaNode.requestShutdown("test")).isTrue();
        assertThat(megaNode.requestShutdown("again")).isFalse();
        TaskJoiner.JoinResult result = megaNode.awaitTermination();

        assertThat(result.isClean()).isTrue();
        assertThat(megaNode.status().shutdownRequested()).isTrue();
    }

    @Test
    @DisplayName("Activity of running users is reported on the sweep tick")
    void activityReported() throws Exception {
        start(READY_NODE);

        RunUserRequest run = RunUserRequest.of(ALICE, LeaseId.of(1), MEGA, false);
        megaNode.submit(run);
        run.readyWaiter().get(5, TimeUnit.SECONDS);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (reported.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(reported).first().isEqualTo(Set.of(ALICE));
    }

    @Test
    @DisplayName("Commands submitted after shutdown are rejected")
    void submitAfterShutdown() throws Exception {
        start(READY_NODE);
        megaNode.requestShutdown("test");
        megaNode.awaitTermination();

        RunUserRequest run = RunUserRequest.of(ALICE, LeaseId.of(1), MEGA, false);

        assertThat(megaNode.submit(run)).isFalse();
        assertThatThrownBy(run.readyWaiter()::join).hasCauseInstanceOf(ShuttingDownException.class);
    }
}
