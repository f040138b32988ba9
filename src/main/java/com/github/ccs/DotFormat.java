package com.github.ccs;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.ccs.CcsException.Code;

/**
 * Graphviz {@code digraph} text form of a {@link GraphDescription}, one statement per line. Root
 * nodes are drawn with a double border. {@link #read(String)} accepts exactly what
 * {@link #write(GraphDescription)} produces, so a written graph reads back with the same nodes and
 * edges.
 */
public final class DotFormat {
  private static final String LABEL = "\"((?:[^\"\\\\]|\\\\.)*)\"";
  private static final Pattern headerPattern = Pattern.compile("digraph\\s+\\w+\\s*\\{");
  private static final Pattern nodePattern =
      Pattern.compile("node_(\\d+)\\s*\\[label=" + LABEL + "(,\\s*peripheries=2)?\\];");
  private static final Pattern edgePattern =
      Pattern.compile("node_(\\d+)\\s*->\\s*node_(\\d+)\\s*\\[label=" + LABEL + "\\];");

  public static String write(final GraphDescription graph) {
    final StringBuilder builder = new StringBuilder("digraph G {\n");
    for (final GraphDescription.Node node : graph.getNodes()) {
      builder.append("  node_").append(node.getId()).append(" [label=\"")
          .append(escape(node.getLabel())).append('"');
      if (node.isRoot()) {
        builder.append(", peripheries=2");
      }
      builder.append("];\n");
    }
    for (final GraphDescription.Edge edge : graph.getEdges()) {
      builder.append("  node_").append(edge.getSource()).append(" -> node_")
          .append(edge.getTarget()).append(" [label=\"").append(escape(edge.getLabel()))
          .append("\"];\n");
    }
    return builder.append("}\n").toString();
  }

  /**
   * @throws CcsException with {@link Code#MALFORMED_GRAPH} naming the offending line
   */
  public static GraphDescription read(final String text) throws CcsException {
    if (text == null) {
      throw new CcsException(Code.MALFORMED_GRAPH, "Graph text cannot be null");
    }
    final String[] lines = text.split("\r?\n");
    final List<GraphDescription.Node> nodes = new ArrayList<>();
    final List<GraphDescription.Edge> edges = new ArrayList<>();
    boolean opened = false, closed = false;
    for (int lineNumber = 1; lineNumber <= lines.length; lineNumber++) {
      final String line = lines[lineNumber - 1].trim();
      if (line.isEmpty()) {
        continue;
      }
      if (closed) {
        throw malformed(lineNumber, "content after closing brace");
      }
      if (!opened) {
        if (!headerPattern.matcher(line).matches()) {
          throw malformed(lineNumber, "expected digraph header");
        }
        opened = true;
        continue;
      }
      if (line.equals("}")) {
        closed = true;
        continue;
      }
      Matcher matcher = nodePattern.matcher(line);
      if (matcher.matches()) {
        final int id = parseId(matcher.group(1), lineNumber);
        if (id != nodes.size()) {
          throw malformed(lineNumber, "expected node_" + nodes.size() + " but found node_" + id);
        }
        nodes.add(new GraphDescription.Node(id, unescape(matcher.group(2)),
            matcher.group(3) != null));
        continue;
      }
      matcher = edgePattern.matcher(line);
      if (matcher.matches()) {
        final int source = parseId(matcher.group(1), lineNumber);
        final int target = parseId(matcher.group(2), lineNumber);
        if (source >= nodes.size() || target >= nodes.size()) {
          throw malformed(lineNumber, "edge refers to an undeclared node");
        }
        edges.add(new GraphDescription.Edge(source, unescape(matcher.group(3)), target));
        continue;
      }
      throw malformed(lineNumber, "unrecognized statement: " + line);
    }
    if (!closed) {
      throw new CcsException(Code.MALFORMED_GRAPH, "Graph text is not closed by }");
    }
    return new GraphDescription(nodes, edges);
  }

  private static int parseId(final String digits, final int lineNumber) throws CcsException {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException exception) {
      throw malformed(lineNumber, "node id out of range: " + digits);
    }
  }

  private static CcsException malformed(final int lineNumber, final String reason) {
    return new CcsException(Code.MALFORMED_GRAPH, "Line " + lineNumber + ": " + reason);
  }

  private static String escape(final String label) {
    return label.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static String unescape(final String label) {
    final StringBuilder builder = new StringBuilder(label.length());
    for (int iter = 0; iter < label.length(); iter++) {
      final char current = label.charAt(iter);
      if (current == '\\' && iter + 1 < label.length()) {
        iter++;
        builder.append(label.charAt(iter));
      } else {
        builder.append(current);
      }
    }
    return builder.toString();
  }

  private DotFormat() {}
}
