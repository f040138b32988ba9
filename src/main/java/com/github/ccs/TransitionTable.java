package com.github.ccs;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Array form of an {@link Lts} for the refinement loops: labels are small integers shared by both
 * sides of a check, and successors as well as predecessors are plain int arrays per state.
 */
final class TransitionTable {
  final int[][] labels;
  final int[][] targets;
  final int[][] predecessorLabels;
  final int[][] predecessors;

  TransitionTable(final Lts lts, final Map<Action, Integer> labelIds) {
    final int count = lts.stateCount();
    labels = new int[count][];
    targets = new int[count][];
    predecessorLabels = new int[count][];
    predecessors = new int[count][];
    for (int state = 0; state < count; state++) {
      final List<Lts.Edge> out = lts.outgoing(state);
      labels[state] = new int[out.size()];
      targets[state] = new int[out.size()];
      for (int iter = 0; iter < out.size(); iter++) {
        labels[state][iter] = labelIds.get(out.get(iter).getLabel());
        targets[state][iter] = out.get(iter).getTarget();
      }
      final List<Lts.Edge> in = lts.incoming(state);
      predecessorLabels[state] = new int[in.size()];
      predecessors[state] = new int[in.size()];
      for (int iter = 0; iter < in.size(); iter++) {
        predecessorLabels[state][iter] = labelIds.get(in.get(iter).getLabel());
        predecessors[state][iter] = in.get(iter).getSource();
      }
    }
  }

  int stateCount() {
    return labels.length;
  }

  /**
   * Number every label used by either system.
   */
  static Map<Action, Integer> labelIds(final Lts left, final Lts right) {
    final Map<Action, Integer> ids = new HashMap<>();
    for (final Action label : left.getAlphabet()) {
      ids.putIfAbsent(label, ids.size());
    }
    for (final Action label : right.getAlphabet()) {
      ids.putIfAbsent(label, ids.size());
    }
    return ids;
  }

  /**
   * One step of the bisimulation game for the pair (p, q) against the given relation: every move
   * of p is answered by an equally labelled move of q into a related pair, and vice versa.
   */
  static boolean stable(final TransitionTable left, final int p, final TransitionTable right,
      final int q, final StateRelation relation) {
    final int[] leftLabels = left.labels[p];
    final int[] leftTargets = left.targets[p];
    final int[] rightLabels = right.labels[q];
    final int[] rightTargets = right.targets[q];
    for (int i = 0; i < leftLabels.length; i++) {
      boolean matched = false;
      for (int j = 0; j < rightLabels.length && !matched; j++) {
        matched = leftLabels[i] == rightLabels[j]
            && relation.contains(leftTargets[i], rightTargets[j]);
      }
      if (!matched) {
        return false;
      }
    }
    for (int j = 0; j < rightLabels.length; j++) {
      boolean matched = false;
      for (int i = 0; i < leftLabels.length && !matched; i++) {
        matched = leftLabels[i] == rightLabels[j]
            && relation.contains(leftTargets[i], rightTargets[j]);
      }
      if (!matched) {
        return false;
      }
    }
    return true;
  }
}
