package com.meganode.api.config;

import com.meganode.engine.MegaNode;
import com.meganode.engine.client.RunnerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the meganode once the web server is listening, then tells the
 * upstream runner (if any) where to reach it.
 */
@Component
public class MegaNodeLauncher {

    private static final Logger log = LoggerFactory.getLogger(MegaNodeLauncher.class);

    private final MegaNode megaNode;
    private final ObjectProvider<RunnerClient> runnerClient;

    public MegaNodeLauncher(MegaNode megaNode, ObjectProvider<RunnerClient> runnerClient) {
        this.megaNode = megaNode;
        this.runnerClient = runnerClient;
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        megaNode.start();

        RunnerClient client = runnerClient.getIfAvailable();
        if (client == null) {
            return;
        }
        int port = event.getWebServer().getPort();
        try {
            client.megaReady(megaNode.config().megaId().value(), port, port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            megaNode.requestShutdown("interrupted");
        } catch (RuntimeException e) {
            // Without the runner knowing about us no user will ever be sent here
            log.error("Failed to notify runner that meganode is ready", e);
            megaNode.requestShutdown("runner-unreachable");
        }
    }
}
