package com.meganode.api.config;

import com.meganode.api.node.SimulatedUserNode;
import com.meganode.core.model.MegaConfig;
import com.meganode.engine.MegaNode;
import com.meganode.engine.client.RunnerClient;
import com.meganode.scheduler.RunnerMetrics;
import com.meganode.worker.UserNode;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the meganode from {@link MegaProperties}.
 */
@Configuration
public class MegaNodeConfiguration {

    @Bean
    public MegaConfig megaConfig(MegaProperties properties) {
        return properties.toMegaConfig();
    }

    @Bean
    @ConditionalOnMissingBean(UserNode.class)
    public UserNode simulatedUserNode(MegaProperties properties) {
        MegaProperties.Simulation simulation = properties.getSimulation();
        return new SimulatedUserNode(
            simulation.getStartupDelay(),
            simulation.getSyncDuration(),
            simulation.getBasePort()
        );
    }

    @Bean
    @ConditionalOnExpression("!'${meganode.runner-url:}'.isBlank()")
    public RunnerClient runnerClient(MegaConfig config) {
        return new RunnerClient(config.runnerUrl());
    }

    @Bean
    public MegaNode megaNode(
            MegaConfig config,
            UserNode userNode,
            RunnerMetrics runnerMetrics,
            ObjectProvider<RunnerClient> runnerClient) {
        return new MegaNode(config, userNode, runnerMetrics, runnerClient.getIfAvailable(), Clock.systemUTC());
    }
}
