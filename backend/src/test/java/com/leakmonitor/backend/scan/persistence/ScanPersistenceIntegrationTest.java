package com.leakmonitor.backend.scan.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Finding;
import com.leakmonitor.backend.scan.domain.FindingSeverity;
import com.leakmonitor.backend.scan.domain.RepoKeywordMatch;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.support.PostgresTestContainer;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ScanPersistenceIntegrationTest extends PostgresTestContainer {

  @Autowired private TestEntityManager entityManager;
  @Autowired private ScanRepository scanRepository;
  @Autowired private DiscoveredRepoRepository repoRepository;
  @Autowired private FindingRepository findingRepository;
  @Autowired private RepoKeywordMatchRepository matchRepository;

  @Test
  void storesRepositoriesWithJsonKeywordLists() {
    DiscoveredRepo repo = new DiscoveredRepo("acme/api");
    repo.mergeMatchedKeywords(List.of("acme", "acme.com"));
    repoRepository.save(repo);
    RepoKeywordMatch match = new RepoKeywordMatch(repo, "acme", RepoKeywordMatch.SOURCE_CODE_SEARCH);
    match.mergeMatchFiles(List.of("a.env", "config/b.yml"));
    matchRepository.save(match);
    entityManager.flush();
    entityManager.clear();

    DiscoveredRepo loaded = repoRepository.findByFullName("acme/api").orElseThrow();
    assertThat(loaded.getMatchedKeywords()).containsExactly("acme", "acme.com");
    assertThat(loaded.getScanStatus()).isEqualTo(RepoScanStatus.PENDING);
    assertThat(loaded.getFirstSeen()).isNotNull();
    assertThat(repoRepository.findByRepoSizeKbIsNull()).extracting(DiscoveredRepo::getFullName).contains("acme/api");
    assertThat(repoRepository.countByScanStatus(RepoScanStatus.PENDING)).isEqualTo(1);
    assertThat(
            matchRepository
                .findByRepoIdAndKeywordAndMatchSource(
                    loaded.getId(), "acme", RepoKeywordMatch.SOURCE_CODE_SEARCH)
                .orElseThrow()
                .getMatchFiles())
        .containsExactly("a.env", "config/b.yml");
  }

  @Test
  void findsOpenFindingsWithTheirRepository() {
    Scan scan = scanRepository.save(new Scan(ScanTrigger.MANUAL));
    DiscoveredRepo repo = repoRepository.save(new DiscoveredRepo("acme/web"));
    Finding open = findingRepository.save(finding("hash-open", repo, scan));
    Finding closed = finding("hash-closed", repo, scan);
    closed.resolve("Auto-resolved", Instant.now());
    findingRepository.save(closed);
    entityManager.flush();
    entityManager.clear();

    assertThat(findingRepository.countByResolvedFalse()).isEqualTo(1);
    assertThat(findingRepository.existsByRepoIdAndResolvedFalse(repo.getId())).isTrue();
    assertThat(findingRepository.findOpenWithRepo())
        .singleElement()
        .satisfies(
            finding -> {
              assertThat(finding.getId()).isEqualTo(open.getId());
              assertThat(finding.getRepo().getFullName()).isEqualTo("acme/web");
            });
    assertThat(findingRepository.findByFindingHash("hash-closed"))
        .hasValueSatisfying(finding -> assertThat(finding.getNotes()).isEqualTo("Auto-resolved"));
    assertThat(scanRepository.findFirstByOrderByStartedAtDesc()).isPresent();
  }

  @Test
  void resumedScanKeepsItsResumptionInstant() {
    Scan scan = new Scan(ScanTrigger.MANUAL);
    scan.setStartedAt(Instant.parse("2024-05-01T01:00:00Z"));
    scan.reopen(Instant.parse("2024-05-03T09:00:00Z"));
    Long id = scanRepository.save(scan).getId();
    entityManager.flush();
    entityManager.clear();

    Scan loaded = scanRepository.findById(id).orElseThrow();
    assertThat(loaded.getResumedAt()).isEqualTo(Instant.parse("2024-05-03T09:00:00Z"));
    assertThat(loaded.getStartedAt()).isEqualTo(Instant.parse("2024-05-01T01:00:00Z"));
  }

  private static Finding finding(String hash, DiscoveredRepo repo, Scan scan) {
    Finding finding = new Finding(hash, repo, scan);
    finding.setScanner("gitleaks");
    finding.setDetectorName("aws-access-token");
    finding.setFilePath("deploy/creds.sh");
    finding.setLineNumber(3);
    finding.setSeverity(FindingSeverity.HIGH);
    return finding;
  }
}
