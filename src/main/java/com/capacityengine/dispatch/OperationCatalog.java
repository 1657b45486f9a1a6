package com.capacityengine.dispatch;

import com.capacityengine.common.exception.OperationNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of the operations that can be dispatched by name.
 */
@Service
@Slf4j
public class OperationCatalog {

    private final Map<String, OperationHandler> handlers = new TreeMap<>();

    public OperationCatalog(List<OperationHandler> handlers) {
        for (OperationHandler handler : handlers) {
            if (this.handlers.putIfAbsent(handler.getName(), handler) != null) {
                throw new IllegalStateException("Duplicate operation handler: " + handler.getName());
            }
        }
        log.info("Registered operations: {}", this.handlers.keySet());
    }

    public Operation resolve(String name, String payload) {
        OperationHandler handler = handlers.get(name);
        if (handler == null) {
            throw new OperationNotFoundException(name);
        }
        return handler.prepare(payload);
    }

    public Collection<String> getOperationNames() {
        return handlers.keySet();
    }
}
