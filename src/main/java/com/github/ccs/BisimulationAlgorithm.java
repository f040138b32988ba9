package com.github.ccs;

/**
 * Computes the largest strong bisimulation between the states of two transition systems. Both
 * arguments may be the same instance, which checks two states of one system against each other.
 *
 * Implementations must be free of side effects on their arguments: the systems are only read, and
 * every call builds and returns its own relation.
 */
public interface BisimulationAlgorithm {

  /**
   * Returns the relation R such that (p, q) is in R iff state p of left is bisimilar to state q of
   * right.
   */
  StateRelation computeBisimulation(final Lts left, final Lts right) throws CcsException;

  BisimulationAlgorithmType getType();
}
