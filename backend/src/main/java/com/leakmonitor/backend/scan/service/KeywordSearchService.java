package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.config.GitHubProperties;
import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.RepoKeywordMatch;
import com.leakmonitor.backend.scan.github.CodeSearchClient;
import com.leakmonitor.backend.scan.github.CodeSearchException;
import com.leakmonitor.backend.scan.github.CodeSearchHit;
import com.leakmonitor.backend.scan.github.CodeSearchPage;
import com.leakmonitor.backend.scan.github.GitHubRateLimiter;
import com.leakmonitor.backend.scan.github.RepoDetails;
import com.leakmonitor.backend.scan.github.RepositoryMetadataClient;
import com.leakmonitor.backend.scan.persistence.DiscoveredRepoRepository;
import com.leakmonitor.backend.scan.persistence.RepoKeywordMatchRepository;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.CancellationToken;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Code search stage: pages GitHub code search per keyword, aggregates hits per repository and
 * upserts {@link DiscoveredRepo} and {@link RepoKeywordMatch} rows.
 */
@Service
public class KeywordSearchService {

  private static final Logger log = LoggerFactory.getLogger(KeywordSearchService.class);

  private final CodeSearchClient codeSearchClient;
  private final RepositoryMetadataClient metadataClient;
  private final GitHubRateLimiter rateLimiter;
  private final GitHubProperties properties;
  private final DiscoveredRepoRepository repoRepository;
  private final RepoKeywordMatchRepository matchRepository;
  private final ScanProgressTracker progress;
  private final Clock clock;
  private final RetryTemplate searchRetryTemplate;

  public KeywordSearchService(
      CodeSearchClient codeSearchClient,
      RepositoryMetadataClient metadataClient,
      GitHubRateLimiter rateLimiter,
      GitHubProperties properties,
      DiscoveredRepoRepository repoRepository,
      RepoKeywordMatchRepository matchRepository,
      ScanProgressTracker progress,
      @Nullable Clock clock) {
    this.codeSearchClient = codeSearchClient;
    this.metadataClient = metadataClient;
    this.rateLimiter = rateLimiter;
    this.properties = properties;
    this.repoRepository = repoRepository;
    this.matchRepository = matchRepository;
    this.progress = progress;
    this.clock = clock != null ? clock : Clock.systemUTC();
    this.searchRetryTemplate =
        RetryTemplate.builder()
            .maxAttempts(2)
            .noBackoff()
            .retryOn(KeywordSearchService::isQuotaExhausted)
            .withListener(new QuotaExhaustionListener())
            .build();
  }

  /**
   * Searches every keyword and persists the aggregated repositories.
   *
   * @return number of distinct repositories matched in this pass
   */
  public int search(List<String> keywords, CancellationToken token) {
    Map<String, RepoAggregate> aggregates = new LinkedHashMap<>();
    int index = 0;
    for (String keyword : keywords) {
      token.throwIfCancelled();
      index++;
      progress.progress(index, keywords.size(), keyword);
      progress.activity(ActivityType.KEYWORD, "Searching \"%s\"".formatted(keyword));
      int hits = searchKeyword(keyword, aggregates, token);
      progress.log("  \"%s\": %d hits".formatted(keyword, hits));
    }

    token.throwIfCancelled();
    for (RepoAggregate aggregate : aggregates.values()) {
      persist(aggregate);
    }
    progress.activity(
        ActivityType.GITHUB, "%d repositories matched".formatted(aggregates.size()));
    backfillMissingDetails(token);
    return aggregates.size();
  }

  private int searchKeyword(String keyword, Map<String, RepoAggregate> aggregates, CancellationToken token) {
    int hitCount = 0;
    for (int page = 1; page <= properties.getSearchMaxPages(); page++) {
      token.throwIfCancelled();
      Optional<CodeSearchPage> result = fetchPage(keyword, page);
      if (result.isEmpty()) {
        break;
      }
      CodeSearchPage searchPage = result.get();
      rateLimiter.adapt(searchPage.remaining(), searchPage.resetEpochSeconds());
      for (CodeSearchHit hit : searchPage.hits()) {
        aggregates
            .computeIfAbsent(hit.repoFullName(), name -> new RepoAggregate(hit))
            .add(keyword, hit.filePath(), properties.getMaxMatchFilesPerKeyword());
        hitCount++;
      }
      boolean lastPage =
          searchPage.hits().size() < properties.getSearchPerPage()
              || (long) page * properties.getSearchPerPage() >= searchPage.totalCount();
      if (lastPage) {
        break;
      }
    }
    return hitCount;
  }

  /**
   * One page. An exhausted quota is retried once, after the limiter has taken the reported reset
   * into account; rejected queries and transient failures end the keyword.
   */
  private Optional<CodeSearchPage> fetchPage(String keyword, int page) {
    try {
      return searchRetryTemplate.execute(
          context -> {
            if (!rateLimiter.acquire(properties.getSearchAcquireTimeout())) {
              log.warn(
                  "No search quota for \"{}\" page {} within {}",
                  keyword,
                  page,
                  properties.getSearchAcquireTimeout());
              progress.activity(
                  ActivityType.WARN, "Search quota wait timed out for \"%s\"".formatted(keyword));
              return Optional.<CodeSearchPage>empty();
            }
            return Optional.of(codeSearchClient.search(keyword, page));
          });
    } catch (CodeSearchException ex) {
      switch (ex.getReason()) {
        case VALIDATION -> log.info("GitHub rejected query \"{}\": {}", keyword, ex.getMessage());
        case EXHAUSTED -> log.warn("Search quota still exhausted for \"{}\" page {}", keyword, page);
        default -> {
          log.warn("Code search failed for \"{}\" page {}: {}", keyword, page, ex.getMessage());
          progress.activity(ActivityType.WARN, "Search failed for \"%s\"".formatted(keyword));
        }
      }
      return Optional.empty();
    }
  }

  private static boolean isQuotaExhausted(Throwable throwable) {
    return throwable instanceof CodeSearchException ex
        && ex.getReason() == CodeSearchException.Reason.EXHAUSTED;
  }

  private void persist(RepoAggregate aggregate) {
    Instant now = clock.instant();
    DiscoveredRepo repo =
        repoRepository
            .findByFullName(aggregate.fullName)
            .orElseGet(() -> new DiscoveredRepo(aggregate.fullName));
    CodeSearchHit sample = aggregate.sample;
    if (repo.getHtmlUrl() == null) {
      repo.setHtmlUrl(sample.repoHtmlUrl());
    }
    if (sample.description() != null) {
      repo.setDescription(sample.description());
    }
    repo.setOwnerLogin(sample.ownerLogin());
    repo.setOwnerType(sample.ownerType());
    repo.setFork(sample.fork());
    repo.setLastSeen(now);
    repo.mergeMatchedKeywords(aggregate.filesByKeyword.keySet());
    DiscoveredRepo saved = repoRepository.save(repo);

    aggregate.filesByKeyword.forEach(
        (keyword, files) -> {
          RepoKeywordMatch match =
              matchRepository
                  .findByRepoIdAndKeywordAndMatchSource(
                      saved.getId(), keyword, RepoKeywordMatch.SOURCE_CODE_SEARCH)
                  .orElseGet(
                      () -> new RepoKeywordMatch(saved, keyword, RepoKeywordMatch.SOURCE_CODE_SEARCH));
          match.mergeMatchFiles(files);
          matchRepository.save(match);
        });
  }

  private void backfillMissingDetails(CancellationToken token) {
    List<DiscoveredRepo> missing = repoRepository.findByRepoSizeKbIsNull();
    if (missing.isEmpty()) {
      return;
    }
    log.info("Fetching details for {} repositories", missing.size());
    int index = 0;
    for (DiscoveredRepo repo : missing) {
      token.throwIfCancelled();
      index++;
      progress.progress(index, missing.size(), repo.getFullName());
      if (!rateLimiter.acquire(properties.getDetailsAcquireTimeout())) {
        log.warn("Skipping details of {}: rate limiter wait timed out", repo.getFullName());
        continue;
      }
      Optional<RepoDetails> details;
      try {
        details = metadataClient.fetchDetails(repo.getFullName());
      } catch (RuntimeException ex) {
        log.warn("Details lookup for {} failed: {}", repo.getFullName(), ex.getMessage());
        continue;
      }
      details.ifPresent(
          d -> {
            repo.setRepoSizeKb(d.sizeKb());
            repo.setDefaultBranch(d.defaultBranch());
            repo.setLanguage(d.language());
            repo.setStargazersCount(d.stargazersCount());
            repo.setGithubPushedAt(d.pushedAt());
            if (d.description() != null) {
              repo.setDescription(d.description());
            }
            if (repo.getHtmlUrl() == null) {
              repo.setHtmlUrl(d.htmlUrl());
            }
            repoRepository.save(repo);
          });
    }
  }

  static final class RepoAggregate {

    private final String fullName;
    private final CodeSearchHit sample;
    private final Map<String, Set<String>> filesByKeyword = new LinkedHashMap<>();

    RepoAggregate(CodeSearchHit sample) {
      this.fullName = sample.repoFullName();
      this.sample = sample;
    }

    void add(String keyword, String filePath, int maxFiles) {
      Set<String> files = filesByKeyword.computeIfAbsent(keyword, k -> new LinkedHashSet<>());
      if (filePath != null && files.size() < maxFiles) {
        files.add(filePath);
      }
    }
  }

  /** Feeds the quota reported by an exhausted search into the limiter before the retry. */
  private final class QuotaExhaustionListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(
        RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
      if (isQuotaExhausted(throwable)) {
        CodeSearchException ex = (CodeSearchException) throwable;
        log.info("Search quota exhausted (attempt {}), backing off", context.getRetryCount());
        rateLimiter.adapt(
            ex.getRemaining() == null ? 0 : ex.getRemaining(), ex.getResetEpochSeconds());
      }
    }
  }
}
