package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Keyword;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.scan.osint.OsintService;
import com.leakmonitor.backend.scan.persistence.DiscoveredRepoRepository;
import com.leakmonitor.backend.scan.persistence.KeywordRepository;
import com.leakmonitor.backend.scan.persistence.ScanRepository;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.CancellationToken;
import com.leakmonitor.backend.scan.progress.PipelineStage;
import com.leakmonitor.backend.scan.progress.ScanCancelledException;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import com.leakmonitor.backend.scan.scanner.CustomPattern;
import com.leakmonitor.backend.scan.service.RepoAnalysisService.RepoOutcome;
import com.leakmonitor.backend.scan.service.ScanRunGuard.Admission;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Full scan run: keywords, intelligence expansion, code search, per-repository analysis and
 * finalization. Only one run (or recovery operation) executes at a time, gated by {@link
 * ScanRunGuard}.
 */
@Service
public class ScanPipelineService {

  private static final Logger log = LoggerFactory.getLogger(ScanPipelineService.class);

  public static final String OPERATION = "scan";

  private final ScanRunGuard runGuard;
  private final ScanProgressTracker progress;
  private final ScanRepository scanRepository;
  private final KeywordRepository keywordRepository;
  private final DiscoveredRepoRepository repoRepository;
  private final OsintService osintService;
  private final KeywordSearchService keywordSearchService;
  private final RepoAnalysisService repoAnalysisService;
  private final KeywordContextService keywordContextService;
  private final ScanFinalizer finalizer;

  public ScanPipelineService(
      ScanRunGuard runGuard,
      ScanProgressTracker progress,
      ScanRepository scanRepository,
      KeywordRepository keywordRepository,
      DiscoveredRepoRepository repoRepository,
      OsintService osintService,
      KeywordSearchService keywordSearchService,
      RepoAnalysisService repoAnalysisService,
      KeywordContextService keywordContextService,
      ScanFinalizer finalizer) {
    this.runGuard = runGuard;
    this.progress = progress;
    this.scanRepository = scanRepository;
    this.keywordRepository = keywordRepository;
    this.repoRepository = repoRepository;
    this.osintService = osintService;
    this.keywordSearchService = keywordSearchService;
    this.repoAnalysisService = repoAnalysisService;
    this.keywordContextService = keywordContextService;
    this.finalizer = finalizer;
  }

  /** Runs on the calling thread; returns {@link ScanRunResult#alreadyRunning()} when rejected. */
  public ScanRunResult run(ScanTrigger trigger) {
    Optional<Admission> admission = runGuard.tryAdmit(OPERATION);
    if (admission.isEmpty()) {
      log.info(
          "Scan ({}) rejected: {} already running",
          trigger,
          runGuard.currentOperation().orElse(OPERATION));
      return ScanRunResult.alreadyRunning();
    }
    return run(admission.get(), trigger);
  }

  /** Runs with a slot admitted by the caller. The admission is released when this returns. */
  public ScanRunResult run(Admission admission, ScanTrigger trigger) {
    Scan scan = null;
    try {
      scan = scanRepository.save(new Scan(trigger));
      progress.start(scan.getId());
      progress.activity(ActivityType.START, "Scan #%d started (%s)".formatted(scan.getId(), trigger));
      log.info("Scan {} started ({})", scan.getId(), trigger);
      return ScanRunResult.of(execute(scan, progress));
    } catch (ScanCancelledException ex) {
      log.info("Scan {} cancelled by request", scan == null ? null : scan.getId());
      return ScanRunResult.of(scan == null ? null : finalizer.cancel(scan));
    } catch (RuntimeException ex) {
      log.error("Scan pipeline failed", ex);
      return ScanRunResult.of(scan == null ? null : failQuietly(scan));
    } finally {
      progress.reset();
      admission.close();
    }
  }

  private Scan execute(Scan scan, CancellationToken token) {
    token.throwIfCancelled();
    progress.stage(PipelineStage.PREPARATION, "Loading keywords");
    List<String> keywords =
        new ArrayList<>(
            keywordRepository.findByActiveTrueOrderByIdAsc().stream().map(Keyword::getTerm).toList());
    if (keywords.isEmpty()) {
      log.info("No active keywords, scan {} completes without work", scan.getId());
      progress.activity(ActivityType.WARN, "No active keywords");
      return finalizer.complete(scan);
    }
    List<CustomPattern> patterns = keywordContextService.customPatterns();
    progress.log("%d keywords, %d custom patterns".formatted(keywords.size(), patterns.size()));

    token.throwIfCancelled();
    progress.stage(PipelineStage.OSINT, "Running intelligence modules");
    List<String> discovered = osintService.expandKeywords(scan, keywords, token);
    keywords.addAll(discovered);
    scan.setKeywordsUsed(keywords.size());
    scanRepository.save(scan);

    token.throwIfCancelled();
    progress.stage(PipelineStage.CODE_SEARCH, "Searching %d keywords".formatted(keywords.size()));
    scan.setReposFound(keywordSearchService.search(keywords, token));
    scanRepository.save(scan);

    token.throwIfCancelled();
    List<DiscoveredRepo> repos = repoRepository.findAllByOrderByIdAsc();
    progress.stage(PipelineStage.REPO_ANALYSIS, "Analyzing %d repositories".formatted(repos.size()));
    int index = 0;
    for (DiscoveredRepo repo : repos) {
      token.throwIfCancelled();
      index++;
      progress.progress(index, repos.size(), repo.getFullName());
      RepoOutcome outcome = repoAnalysisService.analyze(repo, scan, patterns, token);
      if (outcome.scanned()) {
        tally(scan, outcome);
      }
    }

    token.throwIfCancelled();
    progress.stage(PipelineStage.FINALIZE, "Finalizing");
    return finalizer.complete(scan);
  }

  private void tally(Scan scan, RepoOutcome outcome) {
    scan.setReposScanned(scan.getReposScanned() + 1);
    scan.setNewFindings(scan.getNewFindings() + outcome.newFindings());
    scan.setTotalFindings(scan.getTotalFindings() + outcome.totalFindings());
    scanRepository.save(scan);
    progress.repoScanned();
    progress.addFindings(outcome.newFindings());
  }

  private Scan failQuietly(Scan scan) {
    try {
      return finalizer.fail(scan);
    } catch (RuntimeException ex) {
      log.error("Could not mark scan {} as failed", scan.getId(), ex);
      return scan;
    }
  }
}
