package nfadfa.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Non-deterministic finite automaton with epsilon transitions.
 *
 * <p>Instances are only created through {@link Builder} and are immutable.
 * Epsilon transitions are always stored under {@link Symbols#EPSILON}.
 */
public final class Nfa implements Automaton<SortedSet<String>> {

  /**
   * State transitions, indexed along starting states.
   *
   * <p>This has an entry for every declared state. None of the nested maps or
   * sets are modifiable, and no target set is empty.
   */
  private final SortedMap<String, SortedMap<String, SortedSet<String>>> transitions;

  private final String startState;
  private final SortedSet<String> states;
  private final SortedSet<String> finalStates;

  private Nfa(
    String startState,
    SortedSet<String> states,
    SortedSet<String> finalStates,
    SortedMap<String, SortedMap<String, SortedSet<String>>> transitions
  ) {
    this.startState = startState;
    this.states = states;
    this.finalStates = finalStates;
    this.transitions = transitions;
  }

  public static class Builder {

    private boolean used = false;
    private final String startState;
    private final SortedSet<String> states = new TreeSet<>();
    private final SortedSet<String> finalStates = new TreeSet<>();
    private final SortedMap<String, SortedMap<String, SortedSet<String>>> transitions = new TreeMap<>();

    public Builder(String startState) {
      this.startState = startState;
    }

    /**
     * Declare a state.
     *
     * <p>Declaring a state more than once is allowed. The state is final if any
     * of the declarations said so.
     *
     * @param name state identifier
     * @param isFinal whether the state is accepting
     * @return this builder
     */
    public Builder addState(String name, boolean isFinal) {
      states.add(name);
      if (isFinal) {
        finalStates.add(name);
      }
      transitions.computeIfAbsent(name, k -> new TreeMap<>());
      return this;
    }

    /**
     * Add a transition, normalizing the symbol if it spells epsilon.
     *
     * <p>The states need not be declared yet, but they must be by the time
     * {@link #build()} is called.
     *
     * @param from source state
     * @param symbol symbol as it appeared in the input
     * @param to target state
     * @return this builder
     */
    public Builder addTransition(String from, String symbol, String to) {
      transitions
        .computeIfAbsent(from, k -> new TreeMap<>())
        .computeIfAbsent(Symbols.canonical(symbol), k -> new TreeSet<>())
        .add(to);
      return this;
    }

    /**
     * Finalize the construction of the NFA.
     *
     * @return valid NFA
     * @throws AutomatonException if a referenced state was never declared
     */
    public Nfa build() throws AutomatonException {
      if (used) {
        throw new IllegalStateException("build may only be called once on an NFA builder");
      } else {
        used = true;
      }

      if (!states.contains(startState)) {
        throw new AutomatonException(
          AutomatonException.Kind.DANGLING_REFERENCE,
          "start state " + startState + " is not a declared state"
        );
      }

      final var frozen = new TreeMap<String, SortedMap<String, SortedSet<String>>>();
      for (var perState : transitions.entrySet()) {
        final String from = perState.getKey();
        if (!states.contains(from)) {
          throw new AutomatonException(
            AutomatonException.Kind.DANGLING_REFERENCE,
            "transitions declared out of undeclared state " + from
          );
        }

        final var frozenPerState = new TreeMap<String, SortedSet<String>>();
        for (var perSymbol : perState.getValue().entrySet()) {
          for (String to : perSymbol.getValue()) {
            if (!states.contains(to)) {
              throw new AutomatonException(
                AutomatonException.Kind.DANGLING_REFERENCE,
                "transition " + from + " --" + perSymbol.getKey() + "--> " + to + " targets an undeclared state"
              );
            }
          }
          frozenPerState.put(perSymbol.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(perSymbol.getValue())));
        }
        frozen.put(from, Collections.unmodifiableSortedMap(frozenPerState));
      }

      return new Nfa(
        startState,
        Collections.unmodifiableSortedSet(new TreeSet<>(states)),
        Collections.unmodifiableSortedSet(new TreeSet<>(finalStates)),
        Collections.unmodifiableSortedMap(frozen)
      );
    }
  }

  @Override
  public String startState() {
    return startState;
  }

  @Override
  public SortedSet<String> states() {
    return states;
  }

  @Override
  public SortedSet<String> finalStates() {
    return finalStates;
  }

  @Override
  public SortedMap<String, SortedMap<String, SortedSet<String>>> transitions() {
    return transitions;
  }

  @Override
  public Stream<String> targetStates(SortedSet<String> target) {
    return target.stream();
  }

  /**
   * Input symbols used in the NFA.
   *
   * @return every non-epsilon symbol on some transition, in lexicographic order
   */
  public SortedSet<String> alphabet() {
    return transitions
      .values()
      .stream()
      .flatMap(perState -> perState.keySet().stream())
      .filter(symbol -> !symbol.equals(Symbols.EPSILON))
      .collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * Explore all states reachable using only epsilon transitions.
   *
   * <p>The result always contains the input states. It does not depend on the
   * order in which the search visits states.
   *
   * @param seeds states from which to start the search
   * @return closure of the seed states under epsilon transitions
   */
  public SortedSet<String> epsilonClosure(Collection<String> seeds) {
    final var closure = new TreeSet<String>(seeds);
    final var toVisit = new Stack<String>();
    toVisit.addAll(seeds);

    while (!toVisit.isEmpty()) {
      final String next = toVisit.pop();
      final SortedSet<String> targets = transitionsFrom(next).get(Symbols.EPSILON);
      if (targets == null) {
        continue;
      }

      for (String target : targets) {
        if (closure.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return Collections.unmodifiableSortedSet(closure);
  }

  /**
   * States reachable by consuming exactly one symbol.
   *
   * @param from states from which to take the transition
   * @param symbol non-epsilon symbol to consume
   * @return union of the targets of every state on that symbol
   */
  public SortedSet<String> move(Collection<String> from, String symbol) {
    if (symbol.equals(Symbols.EPSILON)) {
      throw new IllegalArgumentException("move is not defined for the epsilon marker");
    }

    final var reached = new TreeSet<String>();
    for (String state : from) {
      final SortedSet<String> targets = transitionsFrom(state).get(symbol);
      if (targets != null) {
        reached.addAll(targets);
      }
    }

    return Collections.unmodifiableSortedSet(reached);
  }

  /**
   * Simulate the NFA on an input, tracking every state it could be in.
   *
   * @param input symbols to consume
   * @return whether some run ends in an accepting state
   */
  public boolean accepts(List<String> input) {
    SortedSet<String> current = epsilonClosure(List.of(startState));
    for (String symbol : input) {
      if (current.isEmpty() || Symbols.isEpsilon(symbol)) {
        return false;
      }
      current = epsilonClosure(move(current, symbol));
    }
    return current.stream().anyMatch(finalStates::contains);
  }

  @Override
  public String toString() {
    return "Nfa(" + states.size() + " states, start " + startState + ", final " + finalStates + ")";
  }
}
