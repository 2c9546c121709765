package com.example.notebookengine.engine.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of cell handlers keyed by cell type tag. New cell types are added by
 * declaring another {@link CellHandler} bean.
 */
@Slf4j
@Component
public class CellHandlerRegistry {

    private final Map<String, CellHandler> handlers = new ConcurrentHashMap<>();

    public void register(CellHandler handler) {
        CellHandler previous = handlers.put(handler.getCellType(), handler);
        if (previous != null && previous != handler) {
            log.warn("Cell handler for '{}' replaced: {} -> {}", handler.getCellType(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            log.info("Registered cell handler: {}", handler.getCellType());
        }
    }

    public void unregister(String cellType) {
        handlers.remove(cellType);
        log.info("Unregistered cell handler: {}", cellType);
    }

    public Optional<CellHandler> getHandler(String cellType) {
        if (cellType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(cellType));
    }

    public boolean supports(String cellType) {
        return getHandler(cellType).isPresent();
    }

    /** Type tag to description, sorted by tag. */
    public Map<String, String> listCellTypes() {
        Map<String, String> types = new TreeMap<>();
        handlers.values().forEach(h -> types.put(h.getCellType(), h.getDescription()));
        return types;
    }

    public int getHandlerCount() {
        return handlers.size();
    }
}
