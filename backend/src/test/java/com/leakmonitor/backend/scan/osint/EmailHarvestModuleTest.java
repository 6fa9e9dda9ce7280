package com.leakmonitor.backend.scan.osint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.leakmonitor.backend.scan.domain.KeywordCategory;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.DiscoveredKeyword;
import com.leakmonitor.backend.scan.scanner.ProcessExecutionException;
import com.leakmonitor.backend.scan.scanner.ProcessResult;
import com.leakmonitor.backend.scan.scanner.ProcessRunner;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmailHarvestModuleTest {

  @Mock private ProcessRunner processRunner;

  @Test
  void keepsOnlyAddressesOfTheHarvestedDomain() {
    when(processRunner.run(
            eq(List.of("theHarvester", "-d", "acme.com", "-b", "crtsh", "-l", "50")),
            isNull(),
            eq(Duration.ofSeconds(30))))
        .thenReturn(
            new ProcessResult(
                0,
                "[*] Emails found: 3\nJane.Doe@Acme.com\nops@acme.com\nspam@other.org\nops@acme.com\n",
                ""));
    EmailHarvestModule module = new EmailHarvestModule(processRunner);

    IntelligenceResult result =
        module.run(
            List.of("Acme Corp", "acme.com"),
            Map.of("sources", "crtsh", "limit", "50", "timeout_seconds", "30"));

    assertThat(result.newKeywords())
        .containsExactly(
            new DiscoveredKeyword("jane.doe@acme.com", KeywordCategory.EMAIL),
            new DiscoveredKeyword("ops@acme.com", KeywordCategory.EMAIL));
    assertThat(result.observations())
        .allSatisfy(
            observation -> {
              assertThat(observation.resultType()).isEqualTo("email");
              assertThat(observation.metadata()).containsEntry("domain", "acme.com");
            });
  }

  @Test
  void failedRunIsSkipped() {
    when(processRunner.run(anyList(), any(), any()))
        .thenThrow(
            new ProcessExecutionException(ProcessExecutionException.Kind.START_FAILED, "not found"));
    EmailHarvestModule module = new EmailHarvestModule(processRunner);

    IntelligenceResult result = module.run(List.of("acme.com"), Map.of());

    assertThat(result.newKeywords()).isEmpty();
    assertThat(result.observations()).isEmpty();
  }

  @Test
  void keywordsWithoutDomainsNeverStartTheTool() {
    EmailHarvestModule module = new EmailHarvestModule(processRunner);

    IntelligenceResult result = module.run(List.of("Acme Corp", "sk_live_"), Map.of());

    assertThat(result.newKeywords()).isEmpty();
    verify(processRunner, never()).run(anyList(), any(), any());
  }
}
