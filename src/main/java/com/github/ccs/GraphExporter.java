package com.github.ccs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Serializes a transition system into a {@link GraphDescription}. Node labels are the display
 * terms of the states in the input language, edge labels are action names with τ printed as
 * {@value Action#TAU_SYMBOL}.
 */
public final class GraphExporter {

  public static GraphDescription export(final Lts lts) {
    final Set<Integer> roots = new HashSet<>(lts.getRoots());
    final List<GraphDescription.Node> nodes = new ArrayList<>(lts.stateCount());
    for (int state = 0; state < lts.stateCount(); state++) {
      nodes.add(new GraphDescription.Node(state, lts.getState(state).toString(),
          roots.contains(state)));
    }
    final List<GraphDescription.Edge> edges = new ArrayList<>(lts.edgeCount());
    for (final Lts.Edge edge : lts.getEdges()) {
      if (edge.getSource() < 0 || edge.getSource() >= nodes.size() || edge.getTarget() < 0
          || edge.getTarget() >= nodes.size()) {
        throw new IllegalStateException(
            CcsException.Code.MALFORMED_GRAPH.getDescription() + ": dangling edge " + edge);
      }
      edges.add(new GraphDescription.Edge(edge.getSource(), edge.getLabel().toString(),
          edge.getTarget()));
    }
    return new GraphDescription(nodes, edges);
  }

  private GraphExporter() {}
}
