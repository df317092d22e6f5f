package nfadfa.graph;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.stream.Stream;

/**
 * Finite state machine over string symbols, as seen by code which only reads
 * it (serialization, rendering, simulation).
 *
 * <p>Implementations are immutable. All collections returned are unmodifiable
 * and iterate in sorted order.
 *
 * @param <T> transition target: a set of states or a single state
 */
public interface Automaton<T> extends DotGraph<String, String> {

  /**
   * Initial state
   *
   * @return starting state in the machine
   */
  String startState();

  /**
   * All states
   *
   * @return every declared state (even ones that are not reachable)
   */
  SortedSet<String> states();

  /**
   * Accepting states
   *
   * @return accepting states in the machine
   */
  SortedSet<String> finalStates();

  /**
   * State transitions, indexed along starting states and then symbols.
   *
   * <p>Every declared state has an entry, even if it has no outgoing
   * transitions.
   *
   * @return transition table
   */
  SortedMap<String, SortedMap<String, T>> transitions();

  /**
   * Look up the transitions out of one state.
   *
   * @param state state inside the automaton
   * @return map of symbols to targets (empty for unknown states)
   */
  default SortedMap<String, T> transitionsFrom(String state) {
    final SortedMap<String, T> found = transitions().get(state);
    return found == null ? Collections.emptySortedMap() : found;
  }

  /**
   * Targets of a transition, as a stream of states.
   *
   * @param target transition target
   * @return states in the target
   */
  Stream<String> targetStates(T target);

  @Override
  default Stream<DotGraph.Vertex<String>> vertices() {
    return states()
      .stream()
      .map(id -> new DotGraph.Vertex<String>(id, finalStates().contains(id)));
  }

  @Override
  default Stream<DotGraph.Edge<String, String>> edges() {
    final var transitionEdges = transitions()
      .entrySet()
      .stream()
      .flatMap((Map.Entry<String, SortedMap<String, T>> perState) -> {
        final String from = perState.getKey();
        return perState
          .getValue()
          .entrySet()
          .stream()
          .flatMap((Map.Entry<String, T> perSymbol) ->
            targetStates(perSymbol.getValue())
              .map(to -> new DotGraph.Edge<>(from, to, perSymbol.getKey()))
          );
      });
    final var initialEdge = Stream
      .of(new DotGraph.Edge<String, String>(null, startState(), null));
    return Stream.concat(initialEdge, transitionEdges);
  }

  @Override
  default String renderEdgeLabel(String symbol) {
    return symbol == null ? "" : Symbols.dotLabel(symbol);
  }
}
