package com.leakmonitor.backend.scan.ai;

/**
 * AI triage of repositories and findings. Both operations degrade instead of failing: relevance
 * falls back to a score of 1.0 and finding assessments to an empty string.
 */
public interface AssessmentClient {

  RelevanceVerdict assessRelevance(RepoProfile profile);

  String assessFinding(FindingContext context);
}
