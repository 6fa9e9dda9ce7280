package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Finding;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.persistence.FindingRepository;
import com.leakmonitor.backend.scan.scanner.RawFinding;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Insert-once storage keyed by the finding hash. A detection seen again only moves {@code
 * lastSeen}; resolved findings stay resolved.
 */
@Service
public class FindingUpsertService {

  private final FindingRepository findingRepository;

  public FindingUpsertService(FindingRepository findingRepository) {
    this.findingRepository = findingRepository;
  }

  @Transactional
  public UpsertResult upsert(RawFinding raw, DiscoveredRepo repo, Scan scan, Instant now) {
    String hash = raw.identity(repo.getFullName());
    Optional<Finding> existing = findingRepository.findByFindingHash(hash);
    if (existing.isPresent()) {
      Finding finding = existing.get();
      finding.setLastSeen(now);
      return new UpsertResult(findingRepository.save(finding), false);
    }
    Finding finding = new Finding(hash, repo, scan);
    finding.setScanner(raw.scanner());
    finding.setDetectorName(raw.detectorName());
    finding.setVerified(raw.verified());
    finding.setFilePath(raw.filePath());
    finding.setCommitHash(raw.commit());
    finding.setLineNumber(raw.lineNumber());
    finding.setSeverity(raw.severity());
    finding.setMatchedSnippet(raw.snippet());
    finding.setLastSeen(now);
    return new UpsertResult(findingRepository.save(finding), true);
  }

  public record UpsertResult(Finding finding, boolean created) {}
}
