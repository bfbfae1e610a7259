package com.meganode.api;

import com.meganode.engine.MegaNode;
import com.meganode.engine.lifecycle.TaskJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the meganode.
 *
 * The process lives as long as the meganode does: once the user runner has shut
 * the meganode down (inactivity, {@code /lexe/shutdown}, or a dead task), the
 * application context is closed and the process exits.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@ComponentScan(basePackages = {
    "com.meganode.api",
    "com.meganode.engine"
})
public class MegaNodeApplication {

    private static final Logger log = LoggerFactory.getLogger(MegaNodeApplication.class);

    public static void main(String[] args) throws InterruptedException {
        ConfigurableApplicationContext context = SpringApplication.run(MegaNodeApplication.class, args);
        MegaNode megaNode = context.getBean(MegaNode.class);

        TaskJoiner.JoinResult result = megaNode.awaitTermination();
        if (!result.isClean()) {
            log.error("Meganode stopped uncleanly: hung {}, failed {}", result.hungTasks(), result.failedTasks());
        }
        if (context.isActive()) {
            System.exit(SpringApplication.exit(context, () -> result.isClean() ? 0 : 1));
        }
    }
}
