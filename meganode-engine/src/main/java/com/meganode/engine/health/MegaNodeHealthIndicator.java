package com.meganode.engine.health;

import com.meganode.engine.MegaNode;
import com.meganode.scheduler.RunnerStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the meganode as down once it has started shutting down, with user
 * counts and memory usage as details.
 */
@Component
public class MegaNodeHealthIndicator implements HealthIndicator {

    private final MegaNode megaNode;

    public MegaNodeHealthIndicator(MegaNode megaNode) {
        this.megaNode = megaNode;
    }

    @Override
    public Health health() {
        RunnerStatus status = megaNode.status();
        Health.Builder builder = megaNode.isShutdownRequested() ? Health.down() : Health.up();
        return builder
            .withDetail("megaId", status.megaId().value())
            .withDetail("starting", status.starting())
            .withDetail("running", status.running())
            .withDetail("evicting", status.evicting())
            .withDetail("memoryUsed", status.currentMemory())
            .withDetail("memorySoftLimit", status.softLimit())
            .withDetail("memoryHardLimit", status.hardLimit())
            .build();
    }
}
