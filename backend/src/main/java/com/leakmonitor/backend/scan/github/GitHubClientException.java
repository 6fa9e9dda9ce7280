package com.leakmonitor.backend.scan.github;

class GitHubClientException extends RuntimeException {

  GitHubClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
