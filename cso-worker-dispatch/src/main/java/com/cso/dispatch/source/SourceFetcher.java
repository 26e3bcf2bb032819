package com.cso.dispatch.source;

import com.cso.dispatch.task.DeployRepositoryParams;
import com.cso.executioncontext.ExecutionContext;

import java.nio.file.Path;

/**
 * Places a repository deployment's source tree into a working directory.
 */
public interface SourceFetcher {

    /**
     * @param targetDir empty directory to populate
     * @return the root of the fetched source tree
     * @throws Exception when the source cannot be fetched; cancellation is reported as
     *                   {@link com.cso.executioncontext.ExecutionCancelledException}
     */
    Path fetch(ExecutionContext ctx, DeployRepositoryParams params, Path targetDir) throws Exception;
}
