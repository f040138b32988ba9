package com.github.ccs;

import java.util.Optional;

/**
 * Outcome of one equivalence query. A counterexample is present iff the states are not bisimilar.
 */
public final class BisimulationResult {
  private final boolean bisimilar;
  private final int leftState;
  private final int rightState;
  private final Counterexample counterexample;
  private final int relationSize;
  private final long elapsedNanos;
  private final BisimulationAlgorithmType algorithm;

  BisimulationResult(final int leftState, final int rightState,
      final Counterexample counterexample, final int relationSize, final long elapsedNanos,
      final BisimulationAlgorithmType algorithm) {
    this.bisimilar = counterexample == null;
    this.leftState = leftState;
    this.rightState = rightState;
    this.counterexample = counterexample;
    this.relationSize = relationSize;
    this.elapsedNanos = elapsedNanos;
    this.algorithm = algorithm;
  }

  public boolean isBisimilar() {
    return bisimilar;
  }

  public int getLeftState() {
    return leftState;
  }

  public int getRightState() {
    return rightState;
  }

  public Optional<Counterexample> getCounterexample() {
    return Optional.ofNullable(counterexample);
  }

  /**
   * Number of pairs in the largest bisimulation between both systems.
   */
  public int getRelationSize() {
    return relationSize;
  }

  /**
   * Time spent computing the relation and the counterexample.
   */
  public long getElapsedNanos() {
    return elapsedNanos;
  }

  public BisimulationAlgorithmType getAlgorithm() {
    return algorithm;
  }

  @Override
  public String toString() {
    return "BisimulationResult [bisimilar=" + bisimilar + ", leftState=" + leftState
        + ", rightState=" + rightState + ", counterexample=" + counterexample + ", relationSize="
        + relationSize + ", elapsedNanos=" + elapsedNanos + ", algorithm=" + algorithm + "]";
  }
}
