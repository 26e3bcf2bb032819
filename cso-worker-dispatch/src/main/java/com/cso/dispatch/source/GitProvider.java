package com.cso.dispatch.source;

/** Git hosting provider of a repository deployment. */
public enum GitProvider {
    GITHUB("github", "github.com"),
    GITLAB("gitlab", "gitlab.com"),
    BITBUCKET("bitbucket", "bitbucket.org");

    private final String name;
    private final String host;

    GitProvider(String name, String host) {
        this.name = name;
        this.host = host;
    }

    public String getHost() {
        return host;
    }

    /** Provider for {@code name}; unknown or blank names resolve to GitHub. */
    public static GitProvider fromName(String name) {
        if (name != null) {
            for (GitProvider p : values()) {
                if (p.name.equalsIgnoreCase(name.trim())) return p;
            }
        }
        return GITHUB;
    }
}
