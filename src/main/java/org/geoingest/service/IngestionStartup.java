package org.geoingest.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.geoingest.configuration.IngestionProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionStartup {

    private final IngestionCoordinator coordinator;
    private final IngestionProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getCatalog().isLoadOnStartup()) {
            coordinator.initializeSources();
        }
        if (properties.getScheduler().isAutoStart()) {
            coordinator.startIngestion();
        } else {
            log.info("Scheduled ingestion not started automatically; use POST /api/ingestion/start");
        }
    }
}
