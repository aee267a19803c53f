package io.shiftwatch.core;

import io.shiftwatch.JobHandler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class JobHandlerRegistry {

    private final Map<FunctionKind, JobHandler> handlersByKind = new EnumMap<>(FunctionKind.class);

    public JobHandlerRegistry(List<? extends JobHandler> handlers) {
        for (JobHandler handler : handlers) {
            JobHandler previous = handlersByKind.putIfAbsent(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate JobHandler for kind: " + handler.kind());
            }
        }
    }

    public JobHandler getRequired(FunctionKind kind) {
        JobHandler handler = handlersByKind.get(kind);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for kind: " + kind);
        }
        return handler;
    }
}
