package com.cso.dispatch.handler;

import com.cso.dispatch.source.RepositorySourceFetcher;
import com.cso.dispatch.task.TaskType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each {@link TaskType} to its {@link DeploymentHandler}.
 */
public final class DeploymentHandlerRegistry {

    private final Map<TaskType, DeploymentHandler> handlers = new EnumMap<>(TaskType.class);

    public DeploymentHandlerRegistry(List<DeploymentHandler> handlerList) {
        for (DeploymentHandler handler : handlerList) {
            for (TaskType type : handler.supportedTypes()) {
                handlers.put(type, handler);
            }
        }
    }

    /** Registry with the repository, image and destroy handlers. */
    public static DeploymentHandlerRegistry standard() {
        return new DeploymentHandlerRegistry(List.of(
                new DeployRepositoryHandler(RepositorySourceFetcher.create()),
                new DeployImageHandler(),
                new DestroyJobHandler()));
    }

    /** @return the handler for {@code type}, or null when none is registered */
    public DeploymentHandler forType(TaskType type) {
        if (type == null) {
            return null;
        }
        return handlers.get(type);
    }

    public Set<TaskType> supportedTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
