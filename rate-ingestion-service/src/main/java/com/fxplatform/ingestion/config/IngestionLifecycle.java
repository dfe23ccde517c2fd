package com.fxplatform.ingestion.config;

import com.fxplatform.ingestion.orchestrator.IngestionOrchestrator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts ingestion once the application is ready and stops it on shutdown.
 * Disable with {@code fx.ingestion.auto-start=false} to start it through the REST API instead.
 */
@Component
public class IngestionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(IngestionLifecycle.class);

    private final IngestionOrchestrator orchestrator;

    @Value("${fx.ingestion.auto-start:true}")
    private boolean autoStart;

    public IngestionLifecycle(IngestionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!autoStart) {
            log.info("Ingestion auto-start disabled. state={}", orchestrator.state());
            return;
        }
        orchestrator.start()
            .subscribe(
                state -> log.info("Ingestion auto-started. state={}", state),
                e -> log.error("Ingestion auto-start failed", e)
            );
    }

    @PreDestroy
    public void shutdown() {
        orchestrator.stop().block(Duration.ofSeconds(5));
    }
}
