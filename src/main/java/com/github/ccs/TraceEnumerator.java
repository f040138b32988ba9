package com.github.ccs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates the observable behaviour of a transition system as action sequences. Traces are a
 * coarser view than bisimulation: bisimilar states have equal traces, the converse does not hold.
 */
public final class TraceEnumerator {

  /**
   * All distinct non-empty traces of at most maxLength actions starting at the root of the system.
   * τ steps are part of a trace like any other label. Traces are ordered by length, then by
   * discovery.
   */
  public static Set<List<Action>> traces(final Lts lts, final int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("Trace length cannot be negative, got " + maxLength);
    }
    final Set<List<Action>> traces = new LinkedHashSet<>();
    // a trace can be reached in several states, keep one entry per (trace, state)
    Set<Path> layer = new LinkedHashSet<>();
    layer.add(new Path(Collections.<Action>emptyList(), lts.getRoot()));
    for (int length = 1; length <= maxLength && !layer.isEmpty(); length++) {
      final Set<Path> next = new LinkedHashSet<>();
      for (final Path path : layer) {
        for (final Lts.Edge edge : lts.outgoing(path.state)) {
          final List<Action> trace = new ArrayList<>(path.trace.size() + 1);
          trace.addAll(path.trace);
          trace.add(edge.getLabel());
          final List<Action> extended = Collections.unmodifiableList(trace);
          traces.add(extended);
          next.add(new Path(extended, edge.getTarget()));
        }
      }
      layer = next;
    }
    return Collections.unmodifiableSet(traces);
  }

  private static final class Path {
    private final List<Action> trace;
    private final int state;

    private Path(final List<Action> trace, final int state) {
      this.trace = trace;
      this.state = state;
    }

    @Override
    public int hashCode() {
      return 31 * trace.hashCode() + state;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Path)) {
        return false;
      }
      final Path other = (Path) obj;
      return state == other.state && trace.equals(other.trace);
    }
  }

  private TraceEnumerator() {}
}
