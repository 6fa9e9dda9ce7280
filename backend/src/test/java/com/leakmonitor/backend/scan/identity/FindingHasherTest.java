package com.leakmonitor.backend.scan.identity;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FindingHasherTest {

  @Test
  void hashIsDeterministicAndFixedLength() {
    String first = FindingHasher.hash("trufflehog", "AWS", "acme/api", "config.yml", "abc12345", 12);
    String second = FindingHasher.hash("trufflehog", "AWS", "acme/api", "config.yml", "abc12345", 12);

    assertThat(first).isEqualTo(second);
    assertThat(first).hasSize(FindingHasher.HASH_LENGTH).matches("[0-9a-f]{16}");
  }

  @Test
  void missingCommitAndLineAreStable() {
    String withNulls = FindingHasher.hash("custom", "IBAN", "acme/api", "a.txt", null, null);
    String withEmpty = FindingHasher.hash("custom", "IBAN", "acme/api", "a.txt", "", null);

    assertThat(withNulls).isEqualTo(withEmpty);
  }

  @Test
  void everyPartContributesToIdentity() {
    String base = FindingHasher.hash("gitleaks", "generic", "acme/api", "a.env", "deadbeef", 3);

    assertThat(FindingHasher.hash("trufflehog", "generic", "acme/api", "a.env", "deadbeef", 3)).isNotEqualTo(base);
    assertThat(FindingHasher.hash("gitleaks", "aws", "acme/api", "a.env", "deadbeef", 3)).isNotEqualTo(base);
    assertThat(FindingHasher.hash("gitleaks", "generic", "acme/web", "a.env", "deadbeef", 3)).isNotEqualTo(base);
    assertThat(FindingHasher.hash("gitleaks", "generic", "acme/api", "b.env", "deadbeef", 3)).isNotEqualTo(base);
    assertThat(FindingHasher.hash("gitleaks", "generic", "acme/api", "a.env", "cafebabe", 3)).isNotEqualTo(base);
    assertThat(FindingHasher.hash("gitleaks", "generic", "acme/api", "a.env", "deadbeef", 4)).isNotEqualTo(base);
  }

  @Test
  void noCollisionsAcrossHundredThousandDistinctInputs() {
    String[] scanners = {"trufflehog", "gitleaks", "custom"};
    Set<String> hashes = new HashSet<>();
    for (int i = 0; i < 100_000; i++) {
      hashes.add(
          FindingHasher.hash(
              scanners[i % 3],
              "detector-" + (i % 17),
              "org-" + (i % 101) + "/repo-" + (i / 101),
              "src/file-" + i + ".txt",
              i % 2 == 0 ? "" : Integer.toHexString(i),
              i % 5 == 0 ? null : i % 997));
    }

    assertThat(hashes).hasSize(100_000);
  }
}
