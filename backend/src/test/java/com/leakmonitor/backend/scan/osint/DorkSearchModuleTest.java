package com.leakmonitor.backend.scan.osint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.leakmonitor.backend.scan.config.GitHubProperties;
import com.leakmonitor.backend.scan.github.CodeSearchClient;
import com.leakmonitor.backend.scan.github.CodeSearchException;
import com.leakmonitor.backend.scan.github.CodeSearchHit;
import com.leakmonitor.backend.scan.github.CodeSearchPage;
import com.leakmonitor.backend.scan.github.GitHubRateLimiter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DorkSearchModuleTest {

  @Mock private CodeSearchClient codeSearchClient;
  @Mock private GitHubRateLimiter rateLimiter;

  private DorkSearchModule module;

  @BeforeEach
  void setUp() {
    lenient().when(rateLimiter.acquire(any())).thenReturn(true);
    module = new DorkSearchModule(codeSearchClient, rateLimiter, new GitHubProperties());
  }

  @Test
  void recordsHitsAsObservationsWithoutNewKeywords() {
    CodeSearchHit hit =
        new CodeSearchHit(
            "octo/app", "https://github.com/octo/app", null, "octo", "User", false, "config/.env");
    when(codeSearchClient.searchQuery(anyString(), anyInt()))
        .thenReturn(new CodeSearchPage(List.of(), 0, 29, 1_700_000_000L));
    when(codeSearchClient.searchQuery(eq("\"acme\" filename:.env"), eq(1)))
        .thenReturn(new CodeSearchPage(List.of(hit), 1, 28, 1_700_000_000L));

    IntelligenceResult result = module.run(List.of("acme", "globex"), Map.of("max_keywords", "1"));

    assertThat(result.newKeywords()).isEmpty();
    assertThat(result.observations()).hasSize(1);
    assertThat(result.observations().get(0).value()).isEqualTo("octo/app/config/.env");
    assertThat(result.observations().get(0).metadata())
        .containsEntry("keyword", "acme")
        .containsEntry("dork", "filename:.env");
    verify(codeSearchClient, times(DorkSearchModule.DORKS.size())).searchQuery(anyString(), anyInt());
    verify(codeSearchClient, never()).searchQuery(eq("\"globex\" filename:.env"), anyInt());
  }

  @Test
  void failedDorkDoesNotStopTheRest() {
    when(codeSearchClient.searchQuery(anyString(), anyInt()))
        .thenThrow(new CodeSearchException(CodeSearchException.Reason.VALIDATION, "bad query", 10, null));

    IntelligenceResult result = module.run(List.of("acme"), Map.of());

    assertThat(result.observations()).isEmpty();
    verify(codeSearchClient, times(DorkSearchModule.DORKS.size())).searchQuery(anyString(), anyInt());
    verify(rateLimiter, times(DorkSearchModule.DORKS.size())).adapt(10, null);
  }

  @Test
  void stopsWhenNoRateLimitTokenArrives() {
    when(rateLimiter.acquire(any())).thenReturn(false);

    IntelligenceResult result = module.run(List.of("acme"), Map.of());

    assertThat(result.observations()).isEmpty();
    verify(codeSearchClient, never()).searchQuery(anyString(), anyInt());
  }
}
