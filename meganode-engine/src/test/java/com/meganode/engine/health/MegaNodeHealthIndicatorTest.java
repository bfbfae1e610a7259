package com.meganode.engine.health;

import com.meganode.core.model.MegaConfig;
import com.meganode.core.model.MegaId;
import com.meganode.engine.MegaNode;
import com.meganode.scheduler.RunnerMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;

import static org.assertj.core.api.Assertions.*;

class MegaNodeHealthIndicatorTest {

    private final MegaNode megaNode = new MegaNode(MegaConfig.builder(MegaId.of(9)).build(),
        ctx -> ctx.awaitStop(), RunnerMetrics.unexported(), null, Clock.systemUTC());
    private final MegaNodeHealthIndicator indicator = new MegaNodeHealthIndicator(megaNode);

    @AfterEach
    void tearDown() throws InterruptedException {
        megaNode.requestShutdown("test");
        megaNode.awaitTermination();
    }

    @Test
    @DisplayName("Up with user counts and memory while running")
    void up() {
        megaNode.start();

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("megaId", 9)
            .containsEntry("running", 0)
            .containsKeys("memoryUsed", "memorySoftLimit", "memoryHardLimit");
    }

    @Test
    @DisplayName("Down once shutdown was requested")
    void downAfterShutdown() {
        megaNode.start();
        megaNode.requestShutdown("test");

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
