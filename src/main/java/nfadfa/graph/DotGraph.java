package nfadfa.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * <p>Compile the output using {@code dot -Tpng fsm.dot > fsm.png}.
 *
 * @param <V> vertex in the graph
 * @param <E> edge label in the graph
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edges starts (or the entry point if {@code null})
   * @param to vertex where the edges ends
   * @param label label on the edge (or {@code null} for the entry edge)
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param label label associated with an edge
   * @return HTML label string
   */
  default String renderEdgeLabel(E label) {
    return label == null ? "" : label.toString();
  }

  /**
   * Render a full Dot graph.
   *
   * <p>Parallel edges between the same two vertices are drawn as one edge
   * whose label lists every symbol. The entry point is drawn as a point
   * forced to the left of the layout.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + "];\n");
    }

    // Collapse parallel edges, remembering first-seen order
    record Endpoints<V>(V from, V to) { }
    final Map<Endpoints<V>, List<E>> grouped = edges()
      .collect(Collectors.groupingBy(
        edge -> new Endpoints<>(edge.from(), edge.to()),
        LinkedHashMap::new,
        Collectors.mapping(Edge::label, Collectors.toList())
      ));

    int entries = 0;
    for (Map.Entry<Endpoints<V>, List<E>> entry : grouped.entrySet()) {
      final var to = escapeId(entry.getKey().to().toString());

      if (entry.getKey().from() == null) {
        final var entryId = escapeId("_entry" + entries++);
        builder.append("  { rank = source; " + entryId + " [shape = point]; }\n");
        builder.append("  " + entryId + " -> " + to + ";\n");
        continue;
      }

      final var from = escapeId(entry.getKey().from().toString());
      final var label = entry
        .getValue()
        .stream()
        .map(this::renderEdgeLabel)
        .collect(Collectors.joining(", "));
      builder.append("  " + from + " -> " + to + " [label = <" + label + ">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")". Backslashes are escaped first so that
   * one at the end of the string cannot swallow the closing quote.
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
