package com.meganode.worker;

import com.meganode.core.model.LeaseId;
import com.meganode.core.model.UserPk;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class UserNodeSupervisorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final UserPk ALICE = UserPk.fromLong(1);
    private static final LeaseId LEASE = LeaseId.of(42);

    private UserNodeSupervisor supervisor;
    private final Semaphore wakeups = new Semaphore(0);

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.shutdown(TIMEOUT);
        }
    }

    private void start(UserNode node) {
        supervisor = new UserNodeSupervisor(node);
        supervisor.setEventListener(wakeups::release);
    }

    private UserNodeEvent nextEvent() throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (System.nanoTime() < deadline) {
            UserNodeEvent event = supervisor.pollEvent();
            if (event != null) {
                return event;
            }
            wakeups.tryAcquire(50, TimeUnit.MILLISECONDS);
        }
        throw new AssertionError("No event within " + TIMEOUT);
    }

    @Test
    @DisplayName("Ready then stop produces Ready followed by a successful Finished")
    void readyThenStop() throws InterruptedException {
        start(ctx -> {
            ctx.markReady(1000, 1001);
            ctx.awaitStop();
        });

        UserNodeHandle handle = supervisor.spawn(ALICE, LEASE, false);

        UserNodeEvent ready = nextEvent();
        assertThat(ready).isInstanceOf(UserNodeEvent.Ready.class);
        assertThat(((UserNodeEvent.Ready) ready).ports().appPort()).isEqualTo(1000);
        assertThat(ready.taskId()).isEqualTo(handle.taskId());
        assertThat(handle.isFinished()).isFalse();

        handle.stop();
        handle.stop();

        UserNodeEvent finished = nextEvent();
        assertThat(finished).isInstanceOf(UserNodeEvent.Finished.class);
        assertThat(((UserNodeEvent.Finished) finished).outcome().isSuccess()).isTrue();
        assertThat(handle.join(TIMEOUT)).isPresent();
        assertThat(supervisor.liveTaskCount()).isZero();
    }

    @Test
    @DisplayName("A failing node is reported as a failed outcome with its error code")
    void failureIsReported() throws InterruptedException {
        start(ctx -> {
            throw new UserNodeException("SYNC_FAILED", "esplora unreachable");
        });

        supervisor.spawn(ALICE, LEASE, false);

        UserNodeEvent event = nextEvent();
        assertThat(event).isInstanceOf(UserNodeEvent.Finished.class);
        UserNodeOutcome outcome = ((UserNodeEvent.Finished) event).outcome();
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.errorType()).isEqualTo("SYNC_FAILED");
    }

    @Test
    @DisplayName("Unexpected runtime exceptions still free the task")
    void runtimeExceptionIsReported() throws InterruptedException {
        start(ctx -> {
            throw new IllegalStateException("boom");
        });

        supervisor.spawn(ALICE, LEASE, false);

        UserNodeOutcome outcome = ((UserNodeEvent.Finished) nextEvent()).outcome();
        assertThat(outcome.errorType()).isEqualTo("IllegalStateException");
        assertThat(supervisor.liveTaskCount()).isZero();
    }

    @Test
    @DisplayName("Readiness is reported at most once per task")
    void readyOnlyOnce() throws InterruptedException {
        List<Boolean> results = new ArrayList<>();
        start(ctx -> {
            results.add(ctx.markReady(1, 2));
            results.add(ctx.markReady(3, 4));
        });

        supervisor.spawn(ALICE, LEASE, true);

        assertThat(nextEvent()).isInstanceOf(UserNodeEvent.Ready.class);
        assertThat(nextEvent()).isInstanceOf(UserNodeEvent.Finished.class);
        assertThat(results).containsExactly(true, false);
    }

    @Test
    @DisplayName("Context forwards identity, sync flag and activity")
    void contextForwardsIdentity() throws InterruptedException {
        CountDownLatch seen = new CountDownLatch(1);
        start(ctx -> {
            assertThat(ctx.getUserPk()).isEqualTo(ALICE);
            assertThat(ctx.getLeaseId()).isEqualTo(LEASE);
            assertThat(ctx.shutdownAfterSync()).isTrue();
            ctx.reportActivity();
            seen.countDown();
        });

        supervisor.spawn(ALICE, LEASE, true);

        assertThat(seen.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(nextEvent()).isInstanceOf(UserNodeEvent.Active.class);
        assertThat(nextEvent()).isInstanceOf(UserNodeEvent.Finished.class);
    }

    @Test
    @DisplayName("Events of different tasks are merged into one sequence")
    void eventsAreMerged() throws InterruptedException {
        start(UserNodeContext::awaitStop);

        UserNodeHandle a = supervisor.spawn(UserPk.fromLong(1), LEASE, false);
        UserNodeHandle b = supervisor.spawn(UserPk.fromLong(2), LEASE, false);
        assertThat(supervisor.liveTaskCount()).isEqualTo(2);
        assertThat(a.taskId()).isNotEqualTo(b.taskId());

        supervisor.stopAll();

        List<Long> finished = new ArrayList<>();
        finished.add(nextEvent().taskId());
        finished.add(nextEvent().taskId());
        assertThat(finished).containsExactlyInAnyOrder(a.taskId(), b.taskId());
    }

    @Test
    @DisplayName("Shutdown reports nodes that ignore the stop request")
    void shutdownReportsHungNodes() {
        start(ctx -> Thread.sleep(60_000));

        supervisor.spawn(ALICE, LEASE, false);

        List<String> hung = supervisor.shutdown(Duration.ofMillis(100));
        assertThat(hung).containsExactly("user-node-" + ALICE.shortId());
        supervisor = null;
    }
}
