package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.AppSetting;
import com.leakmonitor.backend.scan.domain.Keyword;
import com.leakmonitor.backend.scan.domain.KeywordCategory;
import com.leakmonitor.backend.scan.domain.RepoKeywordMatch;
import com.leakmonitor.backend.scan.persistence.AppSettingRepository;
import com.leakmonitor.backend.scan.persistence.KeywordRepository;
import com.leakmonitor.backend.scan.persistence.RepoKeywordMatchRepository;
import com.leakmonitor.backend.scan.scanner.CustomPattern;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Keyword-derived inputs of the analysis stage: custom patterns for the working-tree matcher, and
 * prompt material explaining why a repository matched.
 */
@Service
public class KeywordContextService {

  private final RepoKeywordMatchRepository matchRepository;
  private final AppSettingRepository appSettingRepository;
  private final KeywordRepository keywordRepository;

  public KeywordContextService(
      RepoKeywordMatchRepository matchRepository,
      AppSettingRepository appSettingRepository,
      KeywordRepository keywordRepository) {
    this.matchRepository = matchRepository;
    this.appSettingRepository = appSettingRepository;
    this.keywordRepository = keywordRepository;
  }

  public List<CustomPattern> customPatterns() {
    return keywordRepository.findByActiveTrueAndCategory(KeywordCategory.CUSTOM).stream()
        .map(Keyword::getTerm)
        .filter(StringUtils::hasText)
        .map(CustomPattern::forKeyword)
        .toList();
  }

  public String describeMatches(Long repoId) {
    List<RepoKeywordMatch> matches = matchRepository.findByRepoIdAndActiveTrueOrderByIdAsc(repoId);
    if (matches.isEmpty()) {
      return "";
    }
    StringBuilder builder = new StringBuilder();
    for (RepoKeywordMatch match : matches) {
      builder.append("- keyword \"").append(match.getKeyword()).append("\" via ").append(match.getMatchSource());
      if (!match.getMatchFiles().isEmpty()) {
        builder.append(" in ").append(String.join(", ", match.getMatchFiles()));
      }
      builder.append('\n');
    }
    return builder.toString().strip();
  }

  public String operatorInstruction() {
    return appSettingRepository
        .findById(AppSetting.FINDING_PROMPT)
        .map(AppSetting::getValue)
        .filter(StringUtils::hasText)
        .orElse("");
  }
}
