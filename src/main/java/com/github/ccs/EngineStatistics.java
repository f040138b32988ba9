package com.github.ccs;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals of one engine. This is the only state an engine shares between calls, all counters
 * are atomic so concurrent callers may update them.
 */
public final class EngineStatistics {
  private final String engineId;
  private final long startTstampMillis = System.currentTimeMillis();

  private final AtomicLong totalExplorations = new AtomicLong();
  private final AtomicLong totalExploredStates = new AtomicLong();
  private final AtomicLong totalExploredEdges = new AtomicLong();
  private final AtomicLong totalExplorationNanos = new AtomicLong();
  private final AtomicLong totalChecks = new AtomicLong();
  private final AtomicLong totalBisimilarChecks = new AtomicLong();
  private final AtomicLong totalCheckNanos = new AtomicLong();
  private final AtomicLong totalFailures = new AtomicLong();

  EngineStatistics(final String engineId) {
    this.engineId = engineId;
  }

  void recordExploration(final Lts lts, final long elapsedNanos) {
    totalExplorations.incrementAndGet();
    totalExploredStates.addAndGet(lts.stateCount());
    totalExploredEdges.addAndGet(lts.edgeCount());
    totalExplorationNanos.addAndGet(elapsedNanos);
  }

  void recordCheck(final BisimulationResult result) {
    totalChecks.incrementAndGet();
    if (result.isBisimilar()) {
      totalBisimilarChecks.incrementAndGet();
    }
    totalCheckNanos.addAndGet(result.getElapsedNanos());
  }

  void recordFailure() {
    totalFailures.incrementAndGet();
  }

  public String getEngineId() {
    return engineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getTotalExplorations() {
    return totalExplorations.get();
  }

  public long getTotalExploredStates() {
    return totalExploredStates.get();
  }

  public long getTotalExploredEdges() {
    return totalExploredEdges.get();
  }

  public long getTotalExplorationNanos() {
    return totalExplorationNanos.get();
  }

  public long getTotalChecks() {
    return totalChecks.get();
  }

  public long getTotalBisimilarChecks() {
    return totalBisimilarChecks.get();
  }

  public long getTotalCheckNanos() {
    return totalCheckNanos.get();
  }

  public long getTotalFailures() {
    return totalFailures.get();
  }

  @Override
  public String toString() {
    return "EngineStatistics [engineId=" + engineId + ", startTstampMillis=" + startTstampMillis
        + ", totalExplorations=" + totalExplorations + ", totalExploredStates="
        + totalExploredStates + ", totalExploredEdges=" + totalExploredEdges + ", totalChecks="
        + totalChecks + ", totalBisimilarChecks=" + totalBisimilarChecks + ", totalFailures="
        + totalFailures + "]";
  }

}
