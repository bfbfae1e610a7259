package com.meganode.engine.lifecycle;

import com.meganode.engine.MegaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Shuts the meganode down with the application context.
 *
 * On context close:
 * 1. Sends the mega shutdown signal, which stops admissions
 * 2. Waits for the user runner to stop every user node
 * 3. Logs tasks that did not stop in time
 */
@Component
public class MegaNodeShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(MegaNodeShutdownHandler.class);

    private final MegaNode megaNode;

    public MegaNodeShutdownHandler(MegaNode megaNode) {
        this.megaNode = megaNode;
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        log.info("Initiating graceful shutdown for meganode {}", megaNode.config().megaId());
        megaNode.requestShutdown("context-closed");
        try {
            TaskJoiner.JoinResult result = megaNode.awaitTermination();
            if (result.isClean()) {
                log.info("Graceful shutdown complete");
            } else {
                log.warn("Shutdown finished with hung tasks {} and failed tasks {}",
                    result.hungTasks(), result.failedTasks());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for meganode tasks to finish");
        }
    }
}
