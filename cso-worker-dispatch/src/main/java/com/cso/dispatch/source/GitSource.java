package com.cso.dispatch.source;

import com.cso.dispatch.task.DeployRepositoryParams;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.CommandFailedException;
import com.cso.plugin.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Clones {@code owner/repo} from the provider with {@code git clone --branch}. A token
 * ({@code gitPass}) is embedded in the clone URL and redacted from every message and log.
 */
public final class GitSource implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitSource.class);

    static final String CHECKOUT_DIR = "src";

    @Override
    public Path fetch(ExecutionContext ctx, DeployRepositoryParams params, Path targetDir) throws Exception {
        GitProvider provider = GitProvider.fromName(params.getProvider());
        String token = params.getGitPass();
        Path checkout = targetDir.resolve(CHECKOUT_DIR);

        ctx.logLine("Cloning repository " + params.getRepository() + " (branch: " + params.getBranch() + ")...");
        log.info("Cloning repository {} (branch={}, provider={})", params.getRepository(), params.getBranch(), provider);
        try {
            CommandRunner.of(cloneCommand(authUrl(params.getRepository(), token, provider), params.getBranch(), checkout))
                    .env("GIT_TERMINAL_PROMPT", "0")
                    .redact(token)
                    .runChecked(ctx);
        } catch (CommandFailedException e) {
            throw new SourceFetchException("failed to clone repository " + params.getRepository()
                    + " (branch: " + params.getBranch() + "): " + e.getMessage(), e);
        }
        ctx.logLine("Clone completed successfully");
        log.info("Cloned repository {} into {}", params.getRepository(), checkout);
        return checkout;
    }

    /**
     * Clone URL for {@code repository} ({@code owner/name}). Bitbucket tokens use the
     * {@code x-token-auth} user, GitHub and GitLab tokens {@code x-access-token}.
     */
    static String authUrl(String repository, String token, GitProvider provider) {
        String base = provider.getHost();
        if (token == null || token.isEmpty()) {
            return "https://" + base + "/" + repository + ".git";
        }
        String user = provider == GitProvider.BITBUCKET ? "x-token-auth" : "x-access-token";
        return "https://" + user + ":" + token + "@" + base + "/" + repository + ".git";
    }

    static List<String> cloneCommand(String url, String branch, Path destination) {
        List<String> args = new ArrayList<>(List.of("git", "clone"));
        if (branch != null && !branch.isEmpty()) {
            args.add("--branch");
            args.add(branch);
        }
        args.add(url);
        args.add(destination.toString());
        return args;
    }
}
