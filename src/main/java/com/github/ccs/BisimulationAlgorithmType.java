package com.github.ccs;

/**
 * This represents the refinement strategy used to compute the largest bisimulation. All strategies
 * produce the same relation, they only differ in time and memory profile.
 */
public enum BisimulationAlgorithmType {
  // start from all pairs, sweep once, then only re-check pairs whose successor pair was removed
  WORKLIST_FIXPOINT,
  // start from all pairs and re-scan the whole relation every pass until nothing is removed.
  // Passes can be split across refinement workers.
  NAIVE_FIXPOINT,
  // split blocks of the disjoint union of both systems by transition signature until stable
  PARTITION_REFINEMENT;
}
