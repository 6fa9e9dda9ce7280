package com.leakmonitor.backend.scan.github;

public record RepoDetails(
    String fullName,
    String htmlUrl,
    String description,
    String ownerLogin,
    long sizeKb,
    String defaultBranch,
    String language,
    int stargazersCount,
    boolean fork,
    String pushedAt) {}
