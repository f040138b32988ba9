package com.github.ccs;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Relational fixpoint with a dirty-pair worklist.
 *
 * The relation starts as the full cross product. One sweep removes every pair that fails the
 * bisimulation game against the current relation. From then on a pair is only re-examined when it
 * lands on the worklist, which happens when a pair of its equally labelled successors was removed.
 * Pairs that stay stable are never scanned again.
 */
public final class WorklistBisimulation implements BisimulationAlgorithm {
  private static final Logger logger =
      LogManager.getLogger(WorklistBisimulation.class.getSimpleName());

  @Override
  public StateRelation computeBisimulation(final Lts left, final Lts right) throws CcsException {
    final Map<Action, Integer> labelIds = TransitionTable.labelIds(left, right);
    final TransitionTable leftTable = new TransitionTable(left, labelIds);
    final TransitionTable rightTable =
        left == right ? leftTable : new TransitionTable(right, labelIds);
    final StateRelation relation =
        StateRelation.full(leftTable.stateCount(), rightTable.stateCount());
    final BitSet queued = new BitSet();
    final IntStack dirty = new IntStack();
    long checks = 0L, removed = 0L;

    // 1. initial sweep over every pair
    for (int p = 0; p < leftTable.stateCount(); p++) {
      for (int q = 0; q < rightTable.stateCount(); q++) {
        if (!relation.contains(p, q)) {
          continue;
        }
        checks++;
        if (!TransitionTable.stable(leftTable, p, rightTable, q, relation)) {
          relation.remove(p, q);
          removed++;
          markPredecessors(leftTable, p, rightTable, q, relation, queued, dirty);
        }
      }
    }

    // 2. drain pairs whose successors changed
    while (!dirty.isEmpty()) {
      final int pair = dirty.pop();
      queued.clear(pair);
      final int p = relation.leftOf(pair);
      final int q = relation.rightOf(pair);
      if (!relation.contains(p, q)) {
        continue;
      }
      checks++;
      if (!TransitionTable.stable(leftTable, p, rightTable, q, relation)) {
        relation.remove(p, q);
        removed++;
        markPredecessors(leftTable, p, rightTable, q, relation, queued, dirty);
      }
    }

    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Worklist refinement: %d pair checks, %d pairs removed", checks,
          removed));
    }
    return relation;
  }

  @Override
  public BisimulationAlgorithmType getType() {
    return BisimulationAlgorithmType.WORKLIST_FIXPOINT;
  }

  // every related pair (p0, q0) with p0 -a-> p and q0 -a-> q may have lost its only match
  private static void markPredecessors(final TransitionTable leftTable, final int p,
      final TransitionTable rightTable, final int q, final StateRelation relation,
      final BitSet queued, final IntStack dirty) {
    final int[] leftLabels = leftTable.predecessorLabels[p];
    final int[] leftSources = leftTable.predecessors[p];
    final int[] rightLabels = rightTable.predecessorLabels[q];
    final int[] rightSources = rightTable.predecessors[q];
    for (int i = 0; i < leftSources.length; i++) {
      for (int j = 0; j < rightSources.length; j++) {
        if (leftLabels[i] != rightLabels[j]) {
          continue;
        }
        final int p0 = leftSources[i];
        final int q0 = rightSources[j];
        if (relation.contains(p0, q0)) {
          final int pair = relation.pairIndex(p0, q0);
          if (!queued.get(pair)) {
            queued.set(pair);
            dirty.push(pair);
          }
        }
      }
    }
  }

  /**
   * Growable stack of pair indices, avoids boxing on the hot path.
   */
  private static final class IntStack {
    private int[] elements = new int[64];
    private int size;

    private void push(final int element) {
      if (size == elements.length) {
        elements = Arrays.copyOf(elements, size * 2);
      }
      elements[size++] = element;
    }

    private int pop() {
      return elements[--size];
    }

    private boolean isEmpty() {
      return size == 0;
    }
  }

}
