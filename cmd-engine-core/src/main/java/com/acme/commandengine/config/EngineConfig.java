package com.acme.commandengine.config;

import java.time.Duration;

/** Engine tuning: snapshots, worker pool and retry of concurrency conflicts. Pure POJO. */
public class EngineConfig {

  private int snapshotThreshold = 100; // events replayed before a snapshot is written
  private int commandConcurrency = 4;
  private int maxAttempts = 3;
  private Duration retryBackoff = Duration.ofMillis(100);
  private boolean recoverUnpublishedOnStartup = true;

  public int getSnapshotThreshold() {
    return snapshotThreshold;
  }

  public void setSnapshotThreshold(int snapshotThreshold) {
    this.snapshotThreshold = snapshotThreshold;
  }

  public int getCommandConcurrency() {
    return commandConcurrency;
  }

  public void setCommandConcurrency(int commandConcurrency) {
    this.commandConcurrency = commandConcurrency;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    this.retryBackoff = retryBackoff;
  }

  public long getRetryBackoffMillis() {
    return retryBackoff.toMillis();
  }

  public boolean isRecoverUnpublishedOnStartup() {
    return recoverUnpublishedOnStartup;
  }

  public void setRecoverUnpublishedOnStartup(boolean recoverUnpublishedOnStartup) {
    this.recoverUnpublishedOnStartup = recoverUnpublishedOnStartup;
  }
}
