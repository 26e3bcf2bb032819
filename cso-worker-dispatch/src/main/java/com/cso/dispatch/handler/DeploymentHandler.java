package com.cso.dispatch.handler;

import com.cso.dispatch.task.TaskParams;
import com.cso.dispatch.task.TaskType;

import java.util.Set;

/**
 * Drives one task kind to completion. Handlers run on a dedicated thread, observe the
 * execution context at every blocking step and report failure by throwing.
 */
public interface DeploymentHandler {

    Set<TaskType> supportedTypes();

    /** Parameter type this handler accepts; the dispatcher rejects anything else. */
    Class<? extends TaskParams> paramsType();

    void handle(HandlerContext ctx, TaskParams params) throws Exception;
}
