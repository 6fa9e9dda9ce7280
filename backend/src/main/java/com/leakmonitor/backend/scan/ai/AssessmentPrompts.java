package com.leakmonitor.backend.scan.ai;

import org.springframework.util.StringUtils;

final class AssessmentPrompts {

  private AssessmentPrompts() {}

  static String relevance(RepoProfile profile) {
    StringBuilder builder = new StringBuilder();
    builder
        .append("You triage public GitHub repositories for an organization's security team.\n")
        .append("The repository was found by searching code for these keywords: ")
        .append(String.join(", ", profile.matchedKeywords()))
        .append(".\nDecide how likely it is that the repository really relates to the organization")
        .append(" and could contain its internal data or credentials.\n")
        .append("Ignore generic libraries and tutorials that merely mention a keyword.\n\n")
        .append("Repository: ")
        .append(profile.fullName())
        .append("\nDescription: ")
        .append(orNone(profile.description()))
        .append("\nLanguage: ")
        .append(orNone(profile.language()))
        .append("\nREADME excerpt:\n")
        .append(orNone(profile.readmeExcerpt()))
        .append("\n\nAnswer with JSON only: {\"score\": <0.0-1.0>, \"summary\": \"<one sentence>\"}");
    return builder.toString();
  }

  static String finding(FindingContext context) {
    StringBuilder builder = new StringBuilder();
    builder
        .append("You are a security analyst reviewing a potential secret leak.\n")
        .append("Repository: ")
        .append(context.repoFullName())
        .append("\nRepository description: ")
        .append(orNone(context.repoDescription()))
        .append("\nScanner: ")
        .append(context.scanner())
        .append(" (detector: ")
        .append(context.detectorName())
        .append(", verified: ")
        .append(context.verified())
        .append(", severity: ")
        .append(context.severity())
        .append(")\nFile: ")
        .append(orNone(context.filePath()))
        .append(context.lineNumber() != null ? ":" + context.lineNumber() : "")
        .append("\nMatched content:\n")
        .append(orNone(context.snippet()));
    if (StringUtils.hasText(context.keywordContext())) {
      builder.append("\n\nWhy the repository was flagged:\n").append(context.keywordContext());
    }
    builder.append(
        "\n\nIn at most five sentences: is this a real credential or sensitive datum, what could"
            + " an attacker do with it, and what should be done (rotate, ignore as test data, ...)?");
    if (StringUtils.hasText(context.operatorInstruction())) {
      builder.append("\n\nAdditional instructions:\n").append(context.operatorInstruction().strip());
    }
    return builder.toString();
  }

  private static String orNone(String value) {
    return StringUtils.hasText(value) ? value : "(none)";
  }
}
