package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Finding;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.persistence.DiscoveredRepoRepository;
import com.leakmonitor.backend.scan.persistence.FindingRepository;
import com.leakmonitor.backend.scan.scanner.RawFinding;
import com.leakmonitor.backend.scan.service.FindingUpsertService.UpsertResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Transaction boundaries of the analysis stage: one commit per repository. */
@Service
public class RepoScanRecorder {

  private final DiscoveredRepoRepository repoRepository;
  private final FindingRepository findingRepository;
  private final FindingUpsertService findingUpsertService;

  public RepoScanRecorder(
      DiscoveredRepoRepository repoRepository,
      FindingRepository findingRepository,
      FindingUpsertService findingUpsertService) {
    this.repoRepository = repoRepository;
    this.findingRepository = findingRepository;
    this.findingUpsertService = findingUpsertService;
  }

  /** Persists a short-circuit decision; a {@code null} status keeps the stored one. */
  @Transactional
  public DiscoveredRepo recordDecision(DiscoveredRepo repo, @Nullable RepoScanStatus status) {
    if (status != null) {
      repo.setScanStatus(status);
    }
    return repoRepository.save(repo);
  }

  /**
   * Upserts the scanner output and settles the repository status in a single transaction.
   *
   * @return findings created by this call
   */
  @Transactional
  public List<Finding> recordScanResult(
      DiscoveredRepo repo,
      Scan scan,
      List<RawFinding> rawFindings,
      Instant scannedAt,
      double durationSeconds) {
    List<Finding> created = new ArrayList<>();
    for (RawFinding raw : rawFindings) {
      UpsertResult result = findingUpsertService.upsert(raw, repo, scan, scannedAt);
      if (result.created()) {
        created.add(result.finding());
      }
    }
    repo.setLastScanned(scannedAt);
    repo.setScanDurationSeconds(durationSeconds);
    repo.setScanStatus(
        findingRepository.existsByRepoIdAndResolvedFalse(repo.getId())
            ? RepoScanStatus.FINDINGS
            : RepoScanStatus.CLEAN);
    repoRepository.save(repo);
    return created;
  }

  @Transactional
  public void recordAssessment(Long findingId, String assessment) {
    findingRepository
        .findById(findingId)
        .ifPresent(
            finding -> {
              finding.setAiAssessment(assessment);
              findingRepository.save(finding);
            });
  }

  @Transactional
  public void confirmFinding(Long findingId, String snippet, Instant seenAt) {
    findingRepository
        .findById(findingId)
        .ifPresent(
            finding -> {
              finding.setLastSeen(seenAt);
              if (snippet != null && !snippet.isBlank()) {
                finding.setMatchedSnippet(snippet);
              }
              findingRepository.save(finding);
            });
  }

  @Transactional
  public void resolveFinding(Long findingId, String note, Instant resolvedAt) {
    findingRepository
        .findById(findingId)
        .ifPresent(
            finding -> {
              finding.resolve(note, resolvedAt);
              findingRepository.save(finding);
            });
  }

  /** Re-derives FINDINGS/CLEAN after findings were resolved outside a full scan. */
  @Transactional
  public void refreshFindingStatus(Long repoId) {
    repoRepository
        .findById(repoId)
        .ifPresent(
            repo -> {
              if (repo.getScanStatus() == RepoScanStatus.FINDINGS
                  && !findingRepository.existsByRepoIdAndResolvedFalse(repoId)) {
                repo.setScanStatus(RepoScanStatus.CLEAN);
                repoRepository.save(repo);
              }
            });
  }
}
