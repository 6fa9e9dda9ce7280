package com.leakmonitor.backend.scan.osint;

import com.leakmonitor.backend.scan.domain.Keyword;
import com.leakmonitor.backend.scan.domain.ModuleSetting;
import com.leakmonitor.backend.scan.domain.OsintResult;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.DiscoveredKeyword;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.Observation;
import com.leakmonitor.backend.scan.persistence.KeywordRepository;
import com.leakmonitor.backend.scan.persistence.ModuleSettingRepository;
import com.leakmonitor.backend.scan.persistence.OsintResultRepository;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.CancellationToken;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Stage 1: runs the enabled intelligence modules and merges their keywords into the run. */
@Service
public class OsintService {

  private static final Logger log = LoggerFactory.getLogger(OsintService.class);

  private final IntelligenceModuleRegistry registry;
  private final ModuleSettingRepository moduleSettingRepository;
  private final OsintResultRepository osintResultRepository;
  private final KeywordRepository keywordRepository;
  private final ScanProgressTracker progress;

  public OsintService(
      IntelligenceModuleRegistry registry,
      ModuleSettingRepository moduleSettingRepository,
      OsintResultRepository osintResultRepository,
      KeywordRepository keywordRepository,
      ScanProgressTracker progress) {
    this.registry = registry;
    this.moduleSettingRepository = moduleSettingRepository;
    this.osintResultRepository = osintResultRepository;
    this.keywordRepository = keywordRepository;
    this.progress = progress;
  }

  /**
   * Runs every enabled module against the keyword set. A failing module is logged and skipped.
   *
   * @return keywords not yet known (case-insensitively), in discovery order
   */
  public List<String> expandKeywords(Scan scan, List<String> keywords, CancellationToken token) {
    List<ModuleSetting> enabled = moduleSettingRepository.findByEnabledTrueOrderByIdAsc();
    Set<String> known = new HashSet<>();
    keywords.forEach(keyword -> known.add(normalize(keyword)));
    List<String> current = new ArrayList<>(keywords);
    List<String> added = new ArrayList<>();

    int index = 0;
    for (ModuleSetting setting : enabled) {
      token.throwIfCancelled();
      index++;
      progress.progress(index, enabled.size(), setting.getDisplayName());
      Optional<IntelligenceModule> module = registry.find(setting.getModuleKey());
      if (module.isEmpty()) {
        log.warn("No intelligence module registered for key {}", setting.getModuleKey());
        continue;
      }
      IntelligenceResult result;
      try {
        result = module.get().run(List.copyOf(current), setting.getConfig());
      } catch (RuntimeException ex) {
        log.warn("Intelligence module {} failed", setting.getModuleKey(), ex);
        progress.activity(ActivityType.ERROR, "OSINT %s failed".formatted(setting.getDisplayName()));
        continue;
      }
      record(scan, setting.getModuleKey(), result.observations());

      int fresh = 0;
      for (DiscoveredKeyword discovered : result.newKeywords()) {
        String term = discovered.term() == null ? "" : discovered.term().trim();
        if (term.isEmpty() || !known.add(normalize(term))) {
          continue;
        }
        current.add(term);
        added.add(term);
        fresh++;
        if (!keywordRepository.existsByTermIgnoreCase(term)) {
          keywordRepository.save(new Keyword(term, discovered.category()));
        }
      }
      progress.log(
          "  %s: %d observations, %d new keywords"
              .formatted(setting.getModuleKey(), result.observations().size(), fresh));
      if (fresh > 0 || !result.observations().isEmpty()) {
        progress.activity(
            ActivityType.OSINT,
            "%s: %d new keywords".formatted(setting.getDisplayName(), fresh));
      }
    }
    return added;
  }

  private void record(Scan scan, String moduleKey, List<Observation> observations) {
    if (observations.isEmpty()) {
      return;
    }
    List<OsintResult> rows =
        observations.stream()
            .map(
                observation ->
                    new OsintResult(
                        scan,
                        moduleKey,
                        observation.resultType(),
                        observation.value(),
                        observation.source(),
                        observation.metadata()))
            .toList();
    osintResultRepository.saveAll(rows);
  }

  private static String normalize(String keyword) {
    return keyword.trim().toLowerCase(Locale.ROOT);
  }
}
