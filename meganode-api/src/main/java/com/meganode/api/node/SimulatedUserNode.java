package com.meganode.api.node;

import com.meganode.worker.UserNode;
import com.meganode.worker.UserNodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stand-in user node for running a meganode without real Lightning nodes.
 *
 * Sync-only runs sleep for the sync duration and exit without ever becoming
 * ready. Other runs become ready after the startup delay on a fresh pair of
 * ports, then wait to be stopped.
 */
public class SimulatedUserNode implements UserNode {

    private static final Logger log = LoggerFactory.getLogger(SimulatedUserNode.class);

    private final Duration startupDelay;
    private final Duration syncDuration;
    private final AtomicInteger nextPort;

    public SimulatedUserNode(Duration startupDelay, Duration syncDuration, int basePort) {
        this.startupDelay = startupDelay;
        this.syncDuration = syncDuration;
        this.nextPort = new AtomicInteger(basePort);
    }

    @Override
    public void run(UserNodeContext context) throws InterruptedException {
        if (context.shutdownAfterSync()) {
            if (context.awaitStop(syncDuration)) {
                log.info("Stopped during sync");
            } else {
                log.info("Sync complete, shutting down");
            }
            return;
        }

        if (context.awaitStop(startupDelay)) {
            log.info("Stopped before becoming ready");
            return;
        }
        int appPort = nextPort.getAndAdd(2);
        context.markReady(appPort, appPort + 1);
        context.awaitStop();
    }
}
