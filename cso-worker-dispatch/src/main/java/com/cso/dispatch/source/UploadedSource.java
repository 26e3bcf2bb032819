package com.cso.dispatch.source;

import com.cso.dispatch.task.DeployRepositoryParams;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.CommandFailedException;
import com.cso.plugin.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Downloads an uploaded source tarball ({@code sourceUrl}, a pre-signed object storage URL)
 * and extracts it with {@code tar -xzf}. Only HTTP 200 is accepted.
 */
public final class UploadedSource implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(UploadedSource.class);

    static final String ARCHIVE_NAME = "source.tar.gz";
    static final String EXTRACT_DIR = "src";
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);

    private final HttpClient httpClient;

    public UploadedSource(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Path fetch(ExecutionContext ctx, DeployRepositoryParams params, Path targetDir) throws Exception {
        Path archive = targetDir.resolve(ARCHIVE_NAME);
        Path extracted = Files.createDirectories(targetDir.resolve(EXTRACT_DIR));

        ctx.logLine("Downloading source from storage...");
        log.info("Downloading uploaded source (uploadId={})", params.getUploadId());
        download(ctx, params.getSourceUrl(), archive);

        ctx.logLine("Extracting source archive...");
        try {
            CommandRunner.of("tar", "-xzf", archive.toString(), "-C", extracted.toString())
                    .quiet()
                    .runChecked(ctx);
        } catch (CommandFailedException e) {
            throw new SourceFetchException("failed to extract source archive: " + e.getMessage(), e);
        } finally {
            Files.deleteIfExists(archive);
        }
        ctx.logLine("Source extracted successfully");
        return extracted;
    }

    void download(ExecutionContext ctx, String url, Path destination) throws Exception {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url)).timeout(REQUEST_TIMEOUT).GET().build();
        } catch (IllegalArgumentException e) {
            throw new SourceFetchException("invalid source URL: " + e.getMessage(), e);
        }
        HttpResponse<Path> response;
        try {
            response = ctx.await(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(destination)));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SourceFetchException("failed to download tarball: " + cause.getMessage(), cause);
        }
        if (response.statusCode() != 200) {
            Files.deleteIfExists(destination);
            throw new SourceFetchException("failed to download tarball: HTTP " + response.statusCode());
        }
        long size = sizeOf(destination);
        log.info("Downloaded source archive ({} bytes)", size);
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return -1;
        }
    }
}
