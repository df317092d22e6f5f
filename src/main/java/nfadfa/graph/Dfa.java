package nfadfa.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deterministic finite automaton.
 *
 * <p>Transitions are partial: a missing transition means the input is
 * rejected (the implicit dead state is never materialized). There are never
 * epsilon transitions.
 */
public final class Dfa implements Automaton<String> {

  /**
   * Sentinel group index for "no transition" during minimization.
   */
  public static final int NO_GROUP = -1;

  /**
   * State transitions, indexed along starting states.
   *
   * <p>This has an entry for every declared state. None of the nested maps are
   * modifiable.
   */
  private final SortedMap<String, SortedMap<String, String>> transitions;

  private final String startState;
  private final SortedSet<String> states;
  private final SortedSet<String> finalStates;

  /**
   * For DFAs made by subset construction, the NFA states behind each state.
   */
  private final SortedMap<String, StateSet> subsets;

  private Dfa(
    String startState,
    SortedSet<String> states,
    SortedSet<String> finalStates,
    SortedMap<String, SortedMap<String, String>> transitions,
    SortedMap<String, StateSet> subsets
  ) {
    this.startState = startState;
    this.states = states;
    this.finalStates = finalStates;
    this.transitions = transitions;
    this.subsets = subsets;
  }

  public static class Builder {

    private boolean used = false;
    private final String startState;
    private final SortedSet<String> states = new TreeSet<>();
    private final SortedSet<String> finalStates = new TreeSet<>();
    private final SortedMap<String, SortedMap<String, String>> transitions = new TreeMap<>();
    private final SortedMap<String, StateSet> subsets = new TreeMap<>();

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
     * Set the target of a transition.
     *
     * <p>Setting the same target twice is a no-op, but a second, different
     * target would make the automaton non-deterministic and is rejected.
     *
     * @param from source state
     * @param symbol non-epsilon symbol
     * @param to target state
     * @return this builder
     */
    public Builder addTransition(String from, String symbol, String to) {
      if (Symbols.isEpsilon(symbol)) {
        throw new IllegalArgumentException("DFA transition " + from + " --> " + to + " cannot be an epsilon transition");
      }

      final String previous = transitions
        .computeIfAbsent(from, k -> new TreeMap<>())
        .putIfAbsent(symbol, to);
      if (previous != null && !previous.equals(to)) {
        throw new IllegalArgumentException(
          "DFA state " + from + " already goes to " + previous + " on " + symbol + ", not " + to
        );
      }
      return this;
    }

    /**
     * Remember which NFA states a DFA state stands for.
     *
     * @param name DFA state
     * @param subset NFA states
     * @return this builder
     */
    Builder addSubset(String name, StateSet subset) {
      subsets.put(name, subset);
      return this;
    }

    /**
     * Finalize the construction of the DFA.
     *
     * @return valid DFA
     * @throws AutomatonException if a referenced state was never declared
     */
    public Dfa build() throws AutomatonException {
      if (used) {
        throw new IllegalStateException("build may only be called once on a DFA builder");
      } else {
        used = true;
      }

      if (!states.contains(startState)) {
        throw new AutomatonException(
          AutomatonException.Kind.DANGLING_REFERENCE,
          "start state " + startState + " is not a declared state"
        );
      }

      final var frozen = new TreeMap<String, SortedMap<String, String>>();
      for (var perState : transitions.entrySet()) {
        final String from = perState.getKey();
        if (!states.contains(from)) {
          throw new AutomatonException(
            AutomatonException.Kind.DANGLING_REFERENCE,
            "transitions declared out of undeclared state " + from
          );
        }
        for (var perSymbol : perState.getValue().entrySet()) {
          if (!states.contains(perSymbol.getValue())) {
            throw new AutomatonException(
              AutomatonException.Kind.DANGLING_REFERENCE,
              "transition " + from + " --" + perSymbol.getKey() + "--> " + perSymbol.getValue() + " targets an undeclared state"
            );
          }
        }
        frozen.put(from, Collections.unmodifiableSortedMap(new TreeMap<>(perState.getValue())));
      }

      return new Dfa(
        startState,
        Collections.unmodifiableSortedSet(new TreeSet<>(states)),
        Collections.unmodifiableSortedSet(new TreeSet<>(finalStates)),
        Collections.unmodifiableSortedMap(frozen),
        Collections.unmodifiableSortedMap(new TreeMap<>(subsets))
      );
    }
  }

  /**
   * Determinization of an NFA using the subset construction.
   *
   * <p>DFA states are named {@code S0}, {@code S1}, ... in the order in which
   * their subsets are discovered: the worklist is first-in first-out and
   * symbols are expanded in lexicographic order, so the same NFA always
   * produces the same DFA. Subsets which turn out empty get no transition.
   *
   * @param nfa non-deterministic automaton
   * @param printDebugInfo print to STDERR a trace of what is happening
   * @return deterministic automaton accepting the same language
   */
  public static Dfa fromNfa(Nfa nfa, boolean printDebugInfo) {
    final SortedSet<String> alphabet = nfa.alphabet();

    // Fresh DFA state names come from here
    final IntSupplier dfaStateIdSupplier = new IntSupplier() {
      int nextDfaState = 0;

      @Override
      public int getAsInt() {
        return nextDfaState++;
      }
    };

    final var names = new HashMap<StateSet, String>();
    final var processed = new HashSet<StateSet>();
    final Queue<StateSet> toVisit = new ArrayDeque<>();

    final var initialSubset = new StateSet(nfa.epsilonClosure(List.of(nfa.startState())));
    final String initialState = "S" + dfaStateIdSupplier.getAsInt();
    final var builder = new Builder(initialState);
    names.put(initialSubset, initialState);
    builder
      .addState(initialState, initialSubset.stream().anyMatch(nfa.finalStates()::contains))
      .addSubset(initialState, initialSubset);
    toVisit.add(initialSubset);

    if (printDebugInfo) {
      System.err.println("[DFA] alphabet " + alphabet);
      System.err.println("[DFA] " + initialState + " = " + initialSubset);
    }

    while (!toVisit.isEmpty()) {
      final StateSet subset = toVisit.remove();
      if (!processed.add(subset)) {
        continue;
      }
      final String from = names.get(subset);

      for (String symbol : alphabet) {
        final var reached = new StateSet(nfa.epsilonClosure(nfa.move(subset.toList(), symbol)));

        // Implicit dead state
        if (reached.isEmpty()) {
          if (printDebugInfo) {
            System.err.println("[DFA] " + from + " --" + symbol + "--> (dead)");
          }
          continue;
        }

        String to = names.get(reached);
        if (to == null) {
          to = "S" + dfaStateIdSupplier.getAsInt();
          names.put(reached, to);
          builder
            .addState(to, reached.stream().anyMatch(nfa.finalStates()::contains))
            .addSubset(to, reached);
          toVisit.add(reached);

          if (printDebugInfo) {
            System.err.println("[DFA] " + to + " = " + reached);
          }
        }

        builder.addTransition(from, symbol, to);
        if (printDebugInfo) {
          System.err.println("[DFA] " + from + " --" + symbol + "--> " + to);
        }
      }
    }

    try {
      return builder.build();
    } catch (AutomatonException err) {
      throw new IllegalStateException("subset construction referenced an undeclared state", err);
    }
  }

  public static Dfa fromNfa(Nfa nfa) {
    return fromNfa(nfa, false);
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
  public SortedMap<String, SortedMap<String, String>> transitions() {
    return transitions;
  }

  @Override
  public Stream<String> targetStates(String target) {
    return Stream.of(target);
  }

  /**
   * NFA states behind a DFA state.
   *
   * @param state DFA state
   * @return subset of NFA states, if this DFA came out of subset construction
   */
  public Optional<StateSet> subsetOf(String state) {
    return Optional.ofNullable(subsets.get(state));
  }

  /**
   * Input symbols used in the DFA.
   *
   * @return every symbol on some transition, in lexicographic order
   */
  public SortedSet<String> alphabet() {
    return transitions
      .values()
      .stream()
      .flatMap(perState -> perState.keySet().stream())
      .collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * States reachable from the start state.
   *
   * @return set of all reachable states
   */
  public SortedSet<String> reachableStates() {
    final var seen = new TreeSet<String>();
    final var toVisit = new Stack<String>();

    seen.add(startState);
    toVisit.push(startState);

    while (!toVisit.isEmpty()) {
      for (String target : transitionsFrom(toVisit.pop()).values()) {
        if (seen.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return Collections.unmodifiableSortedSet(seen);
  }

  /**
   * Run the DFA to completion or to a missing transition.
   *
   * @param input symbols to consume
   * @return whether the DFA ended in an accepting state
   */
  public boolean accepts(List<String> input) {
    String currentState = startState;
    for (String symbol : input) {
      currentState = transitionsFrom(currentState).get(symbol);
      if (currentState == null) {
        return false;
      }
    }
    return finalStates.contains(currentState);
  }

  /**
   * Index of the group containing a state.
   *
   * @param groupOf mapping from every grouped state to its group index
   * @param state state to look up (or {@code null} for a missing transition)
   * @return group index or {@link #NO_GROUP}
   */
  public static int groupIndex(Map<String, Integer> groupOf, String state) {
    if (state == null) {
      return NO_GROUP;
    }
    final Integer index = groupOf.get(state);
    return index == null ? NO_GROUP : index;
  }

  /**
   * Perform minimization and return a partition of the DFA states.
   *
   * <p>This is Moore-style refinement: starting from non-accepting and
   * accepting states, every group is split against its first member until a
   * whole pass splits nothing. During a pass, targets are looked up in the
   * partition as it was at the start of that pass. Two states that both lack
   * a transition on some symbol agree on that symbol.
   *
   * @param printDebugInfo print to STDERR a trace of what is happening
   * @return groups of equivalent states, in discovery order
   */
  public List<SortedSet<String>> minimizedPartition(boolean printDebugInfo) {
    final SortedSet<String> alphabet = alphabet();

    // Set up initial partition
    List<SortedSet<String>> partition = new ArrayList<>();
    final var nonFinal = new TreeSet<String>(states);
    nonFinal.removeAll(finalStates);
    if (!nonFinal.isEmpty()) {
      partition.add(nonFinal);
    }
    if (!finalStates.isEmpty()) {
      partition.add(new TreeSet<String>(finalStates));
    }

    boolean splitOccurred = true;
    int pass = 0;
    while (splitOccurred) {
      splitOccurred = false;
      pass++;

      final Map<String, Integer> groupOf = groupIndices(partition);
      final var refined = new ArrayList<SortedSet<String>>();

      for (SortedSet<String> group : partition) {
        if (group.size() <= 1) {
          refined.add(group);
          continue;
        }

        final String representative = group.first();
        final var matching = new TreeSet<String>();
        final var notMatching = new TreeSet<String>();
        for (String state : group) {
          if (agree(groupOf, alphabet, representative, state)) {
            matching.add(state);
          } else {
            notMatching.add(state);
          }
        }

        if (notMatching.isEmpty()) {
          refined.add(group);
        } else {
          refined.add(matching);
          refined.add(notMatching);
          splitOccurred = true;
        }
      }

      partition = refined;
      if (printDebugInfo) {
        System.err.println("[MIN] pass " + pass + ": " + partition);
      }
    }

    return Collections.unmodifiableList(partition);
  }

  /**
   * Minimize the DFA.
   *
   * <p>Group {@code i} of {@link #minimizedPartition(boolean)} becomes state
   * {@code S<i>}. Transitions of a group are those of its first member.
   *
   * @param printDebugInfo print to STDERR a trace of what is happening
   * @return new DFA with the same language and no more states
   */
  public Dfa minimized(boolean printDebugInfo) {
    final List<SortedSet<String>> partition = minimizedPartition(printDebugInfo);

    final var stateToName = new HashMap<String, String>();
    for (int i = 0; i < partition.size(); i++) {
      for (String state : partition.get(i)) {
        stateToName.put(state, "S" + i);
      }
    }

    final var builder = new Builder(stateToName.get(startState));
    for (int i = 0; i < partition.size(); i++) {
      final SortedSet<String> group = partition.get(i);
      builder.addState("S" + i, group.stream().anyMatch(finalStates::contains));
    }

    for (SortedSet<String> group : partition) {
      final String representative = group.first();
      final String from = stateToName.get(representative);

      for (Map.Entry<String, String> transition : transitionsFrom(representative).entrySet()) {
        final String to = stateToName.get(transition.getValue());
        if (to == null) {
          if (printDebugInfo) {
            System.err.println("[MIN] dropping " + representative + " --" + transition.getKey() + "--> " + transition.getValue());
          }
          continue;
        }
        builder.addTransition(from, transition.getKey(), to);
      }
    }

    try {
      return builder.build();
    } catch (AutomatonException err) {
      throw new IllegalStateException("minimization referenced an undeclared state", err);
    }
  }

  public Dfa minimized() {
    return minimized(false);
  }

  /**
   * Find a renaming of states under which the two DFAs are identical.
   *
   * <p>Only the parts reachable from the start states are compared: states
   * which cannot be reached do not affect the language and are left out of
   * the renaming.
   *
   * @param that other DFA
   * @return mapping from reachable states in this DFA to reachable states in {@code that}
   */
  public Optional<Map<String, String>> isomorphism(Dfa that) {
    final var thisToThat = new HashMap<String, String>();
    final var thatToThis = new HashMap<String, String>();
    final var toVisit = new Stack<String>();

    thisToThat.put(startState, that.startState);
    thatToThis.put(that.startState, startState);
    toVisit.push(startState);

    while (!toVisit.isEmpty()) {
      final String thisState = toVisit.pop();
      final String thatState = thisToThat.get(thisState);

      if (finalStates.contains(thisState) != that.finalStates.contains(thatState)) {
        return Optional.empty();
      }

      final SortedMap<String, String> thisTransitions = transitionsFrom(thisState);
      final SortedMap<String, String> thatTransitions = that.transitionsFrom(thatState);
      if (!thisTransitions.keySet().equals(thatTransitions.keySet())) {
        return Optional.empty();
      }

      for (Map.Entry<String, String> transition : thisTransitions.entrySet()) {
        final String thisTarget = transition.getValue();
        final String thatTarget = thatTransitions.get(transition.getKey());

        final String mappedThis = thisToThat.get(thisTarget);
        final String mappedThat = thatToThis.get(thatTarget);
        if (mappedThis == null && mappedThat == null) {
          thisToThat.put(thisTarget, thatTarget);
          thatToThis.put(thatTarget, thisTarget);
          toVisit.push(thisTarget);
        } else if (!thatTarget.equals(mappedThis) || !thisTarget.equals(mappedThat)) {
          return Optional.empty();
        }
      }
    }

    return Optional.of(Collections.unmodifiableMap(thisToThat));
  }

  @Override
  public String toString() {
    return "Dfa(" + states.size() + " states, start " + startState + ", final " + finalStates + ")";
  }

  // Do two states go to the same groups on every symbol?
  private boolean agree(
    Map<String, Integer> groupOf,
    SortedSet<String> alphabet,
    String state1,
    String state2
  ) {
    final SortedMap<String, String> transitions1 = transitionsFrom(state1);
    final SortedMap<String, String> transitions2 = transitionsFrom(state2);
    for (String symbol : alphabet) {
      final int group1 = groupIndex(groupOf, transitions1.get(symbol));
      final int group2 = groupIndex(groupOf, transitions2.get(symbol));
      if (group1 != group2) {
        return false;
      }
    }
    return true;
  }

  // Mapping from states to the index of their group
  private static Map<String, Integer> groupIndices(List<SortedSet<String>> partition) {
    final var groupOf = new HashMap<String, Integer>();
    for (int i = 0; i < partition.size(); i++) {
      for (String state : partition.get(i)) {
        groupOf.put(state, i);
      }
    }
    return groupOf;
  }
}
