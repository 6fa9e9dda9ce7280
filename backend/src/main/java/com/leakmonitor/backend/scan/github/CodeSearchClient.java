package com.leakmonitor.backend.scan.github;

public interface CodeSearchClient {

  /**
   * Fetches one page of code search results for a raw GitHub search query.
   *
   * @throws CodeSearchException with a reason separating rejected queries, quota exhaustion and
   *     transient failures
   */
  CodeSearchPage searchQuery(String query, int page);

  /** Exact-phrase search for a keyword. */
  default CodeSearchPage search(String keyword, int page) {
    return searchQuery("\"" + keyword + "\"", page);
  }
}
