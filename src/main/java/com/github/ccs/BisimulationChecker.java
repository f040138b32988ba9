package com.github.ccs;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides strong bisimilarity of two states, each taken from a transition system. Both systems may
 * be the same instance, which is how two roots of one specification are compared.
 *
 * The largest bisimulation is computed by the configured {@link BisimulationAlgorithm}. On a
 * mismatch, the checker picks one move of either state that the other state cannot answer under
 * that relation. Such a move always exists: a pair that survives one more round of the bisimulation
 * game would have been part of the largest bisimulation.
 */
public final class BisimulationChecker {
  private static final Logger logger =
      LogManager.getLogger(BisimulationChecker.class.getSimpleName());

  private final BisimulationAlgorithm algorithm;

  public BisimulationChecker() {
    this(new WorklistBisimulation());
  }

  public BisimulationChecker(final BisimulationAlgorithm algorithm) {
    if (algorithm == null) {
      throw new IllegalArgumentException("Bisimulation algorithm cannot be null");
    }
    this.algorithm = algorithm;
  }

  /**
   * @param workers only used by {@link BisimulationAlgorithmType#NAIVE_FIXPOINT}
   */
  public static BisimulationChecker forType(final BisimulationAlgorithmType type,
      final int workers) {
    switch (type) {
      case WORKLIST_FIXPOINT:
        return new BisimulationChecker(new WorklistBisimulation());
      case NAIVE_FIXPOINT:
        return new BisimulationChecker(new NaiveFixpointBisimulation(workers));
      case PARTITION_REFINEMENT:
        return new BisimulationChecker(new PartitionRefinementBisimulation());
      default:
        throw new IllegalArgumentException("Unsupported bisimulation algorithm: " + type);
    }
  }

  /**
   * The full largest bisimulation between the states of both systems.
   */
  public StateRelation relation(final Lts left, final Lts right) throws CcsException {
    return algorithm.computeBisimulation(left, right);
  }

  public BisimulationResult check(final Lts left, final Process leftTerm, final Lts right,
      final Process rightTerm) throws CcsException {
    return check(left, left.indexOf(leftTerm), right, right.indexOf(rightTerm));
  }

  public BisimulationResult check(final Lts lts, final int leftState, final int rightState)
      throws CcsException {
    return check(lts, leftState, lts, rightState);
  }

  public BisimulationResult check(final Lts left, final int leftState, final Lts right,
      final int rightState) throws CcsException {
    checkState(left, leftState);
    checkState(right, rightState);
    final long startNanos = System.nanoTime();
    final StateRelation relation = algorithm.computeBisimulation(left, right);
    Counterexample counterexample = null;
    if (!relation.contains(leftState, rightState)) {
      counterexample = findCounterexample(left, leftState, right, rightState, relation);
    }
    final long elapsedNanos = System.nanoTime() - startNanos;
    final BisimulationResult result = new BisimulationResult(leftState, rightState,
        counterexample, relation.size(), elapsedNanos, algorithm.getType());
    logger.info(String.format("%s ~ %s: %s, %d related pairs, %s in %d ms",
        left.getState(leftState), right.getState(rightState), result.isBisimilar(),
        result.getRelationSize(), algorithm.getType(), elapsedNanos / 1_000_000L));
    return result;
  }

  public BisimulationAlgorithmType getAlgorithmType() {
    return algorithm.getType();
  }

  private static void checkState(final Lts lts, final int state) throws CcsException {
    if (state < 0 || state >= lts.stateCount()) {
      throw new CcsException(CcsException.Code.UNKNOWN_STATE,
          "State " + state + " is not a state of " + lts);
    }
  }

  /**
   * Prefers a label the other state does not offer at all, since that is the most direct
   * explanation. Moves of the left state are tried before moves of the right state.
   */
  private static Counterexample findCounterexample(final Lts left, final int p, final Lts right,
      final int q, final StateRelation relation) {
    Counterexample found = unofferedMove(left, p, right, q, Counterexample.Side.LEFT);
    if (found == null) {
      found = unofferedMove(right, q, left, p, Counterexample.Side.RIGHT);
    }
    if (found == null) {
      found = unmatchedMove(left, p, right, q, relation, Counterexample.Side.LEFT);
    }
    if (found == null) {
      found = unmatchedMove(right, q, left, p, relation, Counterexample.Side.RIGHT);
    }
    if (found == null) {
      throw new IllegalStateException(String.format(
          "States %d and %d are not related but every move is matched", p, q));
    }
    return found;
  }

  private static Counterexample unofferedMove(final Lts moverLts, final int mover,
      final Lts otherLts, final int other, final Counterexample.Side side) {
    for (final Lts.Edge move : moverLts.outgoing(mover)) {
      if (!offers(otherLts.outgoing(other), move.getLabel())) {
        return newCounterexample(moverLts, mover, other, side, move, false);
      }
    }
    return null;
  }

  private static Counterexample unmatchedMove(final Lts moverLts, final int mover,
      final Lts otherLts, final int other, final StateRelation relation,
      final Counterexample.Side side) {
    for (final Lts.Edge move : moverLts.outgoing(mover)) {
      boolean matched = false;
      for (final Lts.Edge answer : otherLts.outgoing(other)) {
        if (!answer.getLabel().equals(move.getLabel())) {
          continue;
        }
        matched = side == Counterexample.Side.LEFT
            ? relation.contains(move.getTarget(), answer.getTarget())
            : relation.contains(answer.getTarget(), move.getTarget());
        if (matched) {
          break;
        }
      }
      if (!matched) {
        return newCounterexample(moverLts, mover, other, side, move, true);
      }
    }
    return null;
  }

  private static boolean offers(final List<Lts.Edge> moves, final Action label) {
    for (final Lts.Edge move : moves) {
      if (move.getLabel().equals(label)) {
        return true;
      }
    }
    return false;
  }

  private static Counterexample newCounterexample(final Lts moverLts, final int mover,
      final int other, final Counterexample.Side side, final Lts.Edge move,
      final boolean labelOffered) {
    final int leftState = side == Counterexample.Side.LEFT ? mover : other;
    final int rightState = side == Counterexample.Side.LEFT ? other : mover;
    return new Counterexample(leftState, rightState, side, move.getLabel(), move.getTarget(),
        moverLts.getState(mover), moverLts.getState(move.getTarget()), labelOffered);
  }

}
