package com.leakmonitor.backend.scan.github;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket gating outbound GitHub calls. Tokens refill continuously at {@code capacity / 60}
 * per second and never exceed the capacity. State lives in memory only.
 */
public class GitHubRateLimiter {

  private static final Logger log = LoggerFactory.getLogger(GitHubRateLimiter.class);

  private static final long MAX_WAIT_STEP_MILLIS = 1000L;

  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final ReentrantLock lock = new ReentrantLock();
  private final int capacity;
  private final double refillPerMilli;
  private final Clock clock;
  private final Sleeper sleeper;

  private double tokens;
  private long lastRefillMillis;

  public GitHubRateLimiter(int capacity) {
    this(capacity, Clock.systemUTC(), Thread::sleep);
  }

  public GitHubRateLimiter(int capacity, Clock clock, Sleeper sleeper) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.refillPerMilli = capacity / 60_000.0;
    this.clock = clock;
    this.sleeper = sleeper;
    this.tokens = capacity;
    this.lastRefillMillis = clock.millis();
  }

  /**
   * Waits for a token.
   *
   * @return {@code false} when the timeout elapsed or the thread was interrupted
   */
  public boolean acquire(Duration timeout) {
    long deadline = clock.millis() + Math.max(0L, timeout.toMillis());
    while (true) {
      long waitMillis;
      lock.lock();
      try {
        refill();
        if (tokens >= 1.0) {
          tokens -= 1.0;
          return true;
        }
        waitMillis = (long) Math.ceil((1.0 - tokens) / refillPerMilli);
      } finally {
        lock.unlock();
      }
      long remaining = deadline - clock.millis();
      if (remaining <= 0) {
        return false;
      }
      if (!sleepQuietly(Math.max(1L, Math.min(Math.min(waitMillis, remaining), MAX_WAIT_STEP_MILLIS)))) {
        return false;
      }
    }
  }

  /**
   * Adjusts the bucket to the quota GitHub reported. With two or fewer calls left the caller sleeps
   * until the reset instant and the bucket is refilled afterwards; below five the burst is limited to
   * one token.
   */
  public void adapt(Integer remaining, Long resetEpochSeconds) {
    if (remaining == null) {
      return;
    }
    if (remaining <= 2) {
      lock.lock();
      try {
        tokens = 0;
      } finally {
        lock.unlock();
      }
      long resetMillis = resetEpochSeconds == null ? 0L : resetEpochSeconds * 1000L;
      long sleepMillis = Math.max(1000L, resetMillis - clock.millis());
      log.info("GitHub quota nearly exhausted ({} left), pausing {} ms until reset", remaining, sleepMillis);
      sleepQuietly(sleepMillis);
      lock.lock();
      try {
        tokens = capacity;
        lastRefillMillis = clock.millis();
      } finally {
        lock.unlock();
      }
    } else if (remaining < 5) {
      lock.lock();
      try {
        tokens = Math.min(tokens, 1.0);
      } finally {
        lock.unlock();
      }
    }
  }

  public double availableTokens() {
    lock.lock();
    try {
      refill();
      return tokens;
    } finally {
      lock.unlock();
    }
  }

  public int getCapacity() {
    return capacity;
  }

  private void refill() {
    long now = clock.millis();
    long elapsed = now - lastRefillMillis;
    if (elapsed > 0) {
      tokens = Math.min(capacity, tokens + elapsed * refillPerMilli);
      lastRefillMillis = now;
    }
  }

  private boolean sleepQuietly(long millis) {
    try {
      sleeper.sleep(millis);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
