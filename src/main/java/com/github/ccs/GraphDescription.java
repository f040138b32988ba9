package com.github.ccs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renderer-neutral node/edge description of a transition system. Node ids are dense from 0 and
 * edges refer to nodes by id.
 */
public final class GraphDescription {
  private final List<Node> nodes;
  private final List<Edge> edges;

  public GraphDescription(final List<Node> nodes, final List<Edge> edges) {
    this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
  }

  public List<Node> getNodes() {
    return nodes;
  }

  public List<Edge> getEdges() {
    return edges;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  @Override
  public int hashCode() {
    return 31 * nodes.hashCode() + edges.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GraphDescription)) {
      return false;
    }
    final GraphDescription other = (GraphDescription) obj;
    return nodes.equals(other.nodes) && edges.equals(other.edges);
  }

  @Override
  public String toString() {
    return "GraphDescription [nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
  }

  public static final class Node {
    private final int id;
    private final String label;
    private final boolean root;

    public Node(final int id, final String label, final boolean root) {
      this.id = id;
      this.label = label;
      this.root = root;
    }

    public int getId() {
      return id;
    }

    public String getLabel() {
      return label;
    }

    public boolean isRoot() {
      return root;
    }

    @Override
    public int hashCode() {
      return 31 * (31 * id + label.hashCode()) + (root ? 1231 : 1237);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Node)) {
        return false;
      }
      final Node other = (Node) obj;
      return id == other.id && root == other.root && label.equals(other.label);
    }

    @Override
    public String toString() {
      return "Node [id=" + id + ", label=" + label + ", root=" + root + "]";
    }
  }

  public static final class Edge {
    private final int source;
    private final String label;
    private final int target;

    public Edge(final int source, final String label, final int target) {
      this.source = source;
      this.label = label;
      this.target = target;
    }

    public int getSource() {
      return source;
    }

    public String getLabel() {
      return label;
    }

    public int getTarget() {
      return target;
    }

    @Override
    public int hashCode() {
      return 31 * (31 * source + label.hashCode()) + target;
    }

    @Override
    public boolean equals(Object obj) {
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
