package com.example.notebookengine.engine.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers every cell handler bean at application startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CellHandlerRegistrationConfig {

    private final CellHandlerRegistry registry;
    private final List<CellHandler> allHandlers;

    @EventListener(ApplicationReadyEvent.class)
    public void registerHandlers() {
        log.info("Registering {} cell handlers...", allHandlers.size());
        allHandlers.forEach(registry::register);
        log.info("Cell handler registration complete. {} types available:", registry.getHandlerCount());
        registry.listCellTypes().forEach((type, desc) -> log.info("  - {}: {}", type, desc));
    }
}
