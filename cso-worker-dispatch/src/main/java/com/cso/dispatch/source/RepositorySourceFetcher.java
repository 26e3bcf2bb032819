package com.cso.dispatch.source;

import com.cso.dispatch.task.DeployRepositoryParams;
import com.cso.executioncontext.ExecutionContext;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;

/** Fetches uploaded tarballs for {@code local_upload} sources and clones everything else. */
public final class RepositorySourceFetcher implements SourceFetcher {

    private final SourceFetcher git;
    private final SourceFetcher upload;

    public RepositorySourceFetcher(SourceFetcher git, SourceFetcher upload) {
        this.git = git;
        this.upload = upload;
    }

    public static RepositorySourceFetcher create() {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new RepositorySourceFetcher(new GitSource(), new UploadedSource(http));
    }

    @Override
    public Path fetch(ExecutionContext ctx, DeployRepositoryParams params, Path targetDir) throws Exception {
        return params.isLocalUpload()
                ? upload.fetch(ctx, params, targetDir)
                : git.fetch(ctx, params, targetDir);
    }
}
