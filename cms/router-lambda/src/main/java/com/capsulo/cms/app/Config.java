package com.capsulo.cms.app;

import java.time.Duration;

public record Config(
        // GitHub
        String githubApiUrl,
        String githubToken,        // fallback when a request carries no bearer token
        String repoOwner,
        String repoName,

        // Branches
        String draftBranch,

        // Engine tuning
        Duration branchCacheTtl,
        int commitMaxAttempts,
        Duration commitRetryBaseDelay,
        Duration httpTimeout
) {
    public static Config fromEnv() {
        return new Config(
                env("GITHUB_API_URL", "https://api.github.com"),
                env("GITHUB_TOKEN", ""),
                env("REPO_OWNER", ""),
                env("REPO_NAME", ""),

                env("CMS_DRAFT_BRANCH", "cms-draft"),

                Duration.ofSeconds(envLong("BRANCH_CACHE_TTL_SECONDS", 30)),
                (int) envLong("COMMIT_MAX_ATTEMPTS", 3),
                Duration.ofMillis(envLong("COMMIT_RETRY_BASE_DELAY_MS", 500)),
                Duration.ofSeconds(envLong("HTTP_TIMEOUT_SECONDS", 15))
        );
    }

    private static String env(String key, String def) {
        // Lambda uses env vars; unit tests can use System properties.
        String v = System.getenv(key);
        if (v == null) v = System.getProperty(key);
        if (v == null) return def;
        v = v.trim();
        return v.isEmpty() ? def : v;
    }

    private static long envLong(String key, long def) {
        String v = env(key, "");
        if (v.isEmpty()) return def;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number, got: " + v, e);
        }
    }
}
