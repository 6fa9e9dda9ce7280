package com.leakmonitor.backend.scan.github;

/** One file hit returned by GitHub code search, with its repository. */
public record CodeSearchHit(
    String repoFullName,
    String repoHtmlUrl,
    String description,
    String ownerLogin,
    String ownerType,
    boolean fork,
    String filePath) {}
