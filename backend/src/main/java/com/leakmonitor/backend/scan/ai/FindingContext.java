package com.leakmonitor.backend.scan.ai;

public record FindingContext(
    String repoFullName,
    String repoDescription,
    String scanner,
    String detectorName,
    boolean verified,
    String filePath,
    Integer lineNumber,
    String severity,
    String snippet,
    String keywordContext,
    String operatorInstruction) {}
