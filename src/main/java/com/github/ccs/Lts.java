package com.github.ccs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.ccs.CcsException.Code;

/**
 * Labelled transition system produced by {@link LtsExplorer}. States are numbered densely from 0 in
 * discovery order and edges refer to states by number, so the structure is acyclic in memory even
 * when the behaviour it describes is cyclic.
 *
 * This object is immutable once built.
 */
public final class Lts {
  private final List<Process> states;
  // K=state term with its top-level references resolved, V=state number
  private final Map<Process, Integer> stateIndex;
  private final Environment environment;
  private final List<Edge> edges;
  private final List<List<Edge>> outgoing;
  private final List<List<Edge>> incoming;
  private final List<Integer> roots;

  Lts(final List<Process> states, final Map<Process, Integer> stateIndex,
      final Environment environment, final List<Edge> edges, final List<Integer> roots) {
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.stateIndex = Collections.unmodifiableMap(stateIndex);
    this.environment = environment;
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
    final List<List<Edge>> out = new ArrayList<>(states.size());
    final List<List<Edge>> in = new ArrayList<>(states.size());
    for (int iter = 0; iter < states.size(); iter++) {
      out.add(new ArrayList<>());
      in.add(new ArrayList<>());
    }
    for (final Edge edge : edges) {
      out.get(edge.source).add(edge);
      in.get(edge.target).add(edge);
    }
    for (int iter = 0; iter < states.size(); iter++) {
      out.set(iter, Collections.unmodifiableList(out.get(iter)));
      in.set(iter, Collections.unmodifiableList(in.get(iter)));
    }
    this.outgoing = Collections.unmodifiableList(out);
    this.incoming = Collections.unmodifiableList(in);
  }

  public int stateCount() {
    return states.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  /**
   * Display term of the state, ie. the first term through which it was discovered.
   */
  public Process getState(final int state) {
    return states.get(state);
  }

  public List<Process> getStates() {
    return states;
  }

  public List<Edge> getEdges() {
    return edges;
  }

  public List<Edge> outgoing(final int state) {
    return outgoing.get(state);
  }

  public List<Edge> incoming(final int state) {
    return incoming.get(state);
  }

  public List<Integer> getRoots() {
    return roots;
  }

  public int getRoot() {
    return roots.get(0);
  }

  /**
   * The environment the states were derived in.
   */
  public Environment getEnvironment() {
    return environment;
  }

  /**
   * Look up the state number of a term. The term is matched structurally after resolving its
   * top-level process references, so a process name finds the state of its defining term.
   */
  public int indexOf(final Process term) throws CcsException {
    final Integer index = findIndex(term);
    if (index == null) {
      throw new CcsException(Code.UNKNOWN_STATE,
          "Process " + term + " is not a state of this transition system");
    }
    return index;
  }

  public boolean contains(final Process term) {
    return findIndex(term) != null;
  }

  private Integer findIndex(final Process term) {
    Process head = term;
    while (head != null && head.getKind() == Process.Kind.REFERENCE) {
      head = environment.getDefinitions().get(((Process.Reference) head).getName());
    }
    return head == null ? null : stateIndex.get(head);
  }

  /**
   * All labels used by at least one edge, in order of first use.
   */
  public Set<Action> getAlphabet() {
    final Set<Action> alphabet = new LinkedHashSet<>();
    for (final Edge edge : edges) {
      alphabet.add(edge.label);
    }
    return Collections.unmodifiableSet(alphabet);
  }

  @Override
  public String toString() {
    return "Lts [states=" + states.size() + ", edges=" + edges.size() + ", roots=" + roots + "]";
  }

  /**
   * A labelled arc between two state numbers.
   */
  public static final class Edge {
    private final int source;
    private final Action label;
    private final int target;

    Edge(final int source, final Action label, final int target) {
      this.source = source;
      this.label = label;
      this.target = target;
    }

    public int getSource() {
      return source;
    }

    public Action getLabel() {
      return label;
    }

    public int getTarget() {
      return target;
    }

    @Override
    public int hashCode() {
      final int prime = 31;
      int result = 1;
      result = prime * result + source;
      result = prime * result + label.hashCode();
      result = prime * result + target;
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Edge)) {
        return false;
      }
      final Edge other = (Edge) obj;
      return source == other.source && target == other.target && label.equals(other.label);
    }

    @Override
    public String toString() {
      return source + " --" + label + "--> " + target;
    }
  }

}
