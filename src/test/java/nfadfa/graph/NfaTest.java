package nfadfa.graph;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import nfadfa.RandomAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class NfaTest {

  // S0 -ε-> S1 -ε-> S2, S2 -ε-> S0, S1 -a-> S3, S3 -ε-> S4
  private static Nfa epsilonCycle() throws AutomatonException {
    return new Nfa.Builder("S0")
      .addState("S0", false)
      .addState("S1", false)
      .addState("S2", false)
      .addState("S3", false)
      .addState("S4", true)
      .addTransition("S0", "epsilon", "S1")
      .addTransition("S1", "ε", "S2")
      .addTransition("S2", "", "S0")
      .addTransition("S1", "a", "S3")
      .addTransition("S3", "Epsilon", "S4")
      .build();
  }

  @Test
  void builderNormalizesEpsilonAndDeduplicates() throws AutomatonException {
    final Nfa nfa = new Nfa.Builder("S0")
      .addState("S0", false)
      .addTransition("S0", "a", "S1")
      .addTransition("S0", "a", "S1")
      .addTransition("S0", "EPSILON", "S1")
      .addTransition("S0", "Îµ", "S0")
      .addState("S1", true)
      .build();

    Assertions.assertEquals(Set.of("S1"), nfa.transitionsFrom("S0").get("a"));
    Assertions.assertEquals(Set.of("S0", "S1"), nfa.transitionsFrom("S0").get(Symbols.EPSILON));
    Assertions.assertEquals(Set.of("a", Symbols.EPSILON), nfa.transitionsFrom("S0").keySet());
    Assertions.assertEquals(Set.of("a"), nfa.alphabet());
    Assertions.assertTrue(nfa.transitionsFrom("S1").isEmpty());
  }

  @Test
  void finalWinsWhenRedeclared() throws AutomatonException {
    final Nfa nfa = new Nfa.Builder("S0")
      .addState("S0", true)
      .addState("S0", false)
      .addState("S1", false)
      .addState("S1", true)
      .build();

    Assertions.assertEquals(Set.of("S0", "S1"), nfa.finalStates());
    Assertions.assertEquals(Set.of("S0", "S1"), nfa.states());
  }

  @Test
  void finalStatesMayBeEmpty() throws AutomatonException {
    final Nfa nfa = new Nfa.Builder("S0")
      .addState("S0", false)
      .addTransition("S0", "a", "S0")
      .build();

    Assertions.assertTrue(nfa.finalStates().isEmpty());
    Assertions.assertFalse(nfa.accepts(List.of()));
    Assertions.assertFalse(nfa.accepts(List.of("a", "a")));
  }

  @Test
  void danglingReferences() {
    final var undeclaredStart = Assertions.assertThrows(
      AutomatonException.class,
      () -> new Nfa.Builder("S9").addState("S0", false).build()
    );
    Assertions.assertEquals(AutomatonException.Kind.DANGLING_REFERENCE, undeclaredStart.kind);

    final var undeclaredTarget = Assertions.assertThrows(
      AutomatonException.class,
      () -> new Nfa.Builder("S0").addState("S0", false).addTransition("S0", "a", "S1").build()
    );
    Assertions.assertEquals(AutomatonException.Kind.DANGLING_REFERENCE, undeclaredTarget.kind);

    final var undeclaredSource = Assertions.assertThrows(
      AutomatonException.class,
      () -> new Nfa.Builder("S0").addState("S0", false).addTransition("S5", "a", "S0").build()
    );
    Assertions.assertEquals(AutomatonException.Kind.DANGLING_REFERENCE, undeclaredSource.kind);
  }

  @Test
  void builderIsSingleUse() throws AutomatonException {
    final var builder = new Nfa.Builder("S0").addState("S0", true);
    final Nfa nfa = builder.build();
    Assertions.assertThrows(IllegalStateException.class, builder::build);

    // Later changes to the builder do not leak into the NFA
    builder.addState("S1", true).addTransition("S0", "a", "S1");
    Assertions.assertEquals(Set.of("S0"), nfa.states());
    Assertions.assertTrue(nfa.transitionsFrom("S0").isEmpty());
  }

  @Test
  void epsilonClosureFollowsCycles() throws AutomatonException {
    final Nfa nfa = epsilonCycle();

    Assertions.assertEquals(Set.of("S0", "S1", "S2"), nfa.epsilonClosure(List.of("S0")));
    Assertions.assertEquals(Set.of("S0", "S1", "S2"), nfa.epsilonClosure(List.of("S2")));
    Assertions.assertEquals(Set.of("S3", "S4"), nfa.epsilonClosure(List.of("S3")));
    Assertions.assertEquals(Set.of("S4"), nfa.epsilonClosure(List.of("S4")));
    Assertions.assertEquals(Set.of(), nfa.epsilonClosure(List.of()));
  }

  @Test
  void epsilonClosureIsIdempotent() {
    for (long seed = 0; seed < 40; seed++) {
      final Nfa nfa = RandomAutomata.nfa(seed, 6);
      for (String state : nfa.states()) {
        final SortedSet<String> once = nfa.epsilonClosure(List.of(state, "q0"));
        Assertions.assertEquals(once, nfa.epsilonClosure(once), "seed " + seed);
        Assertions.assertTrue(once.contains(state));
      }
    }
  }

  @Test
  void epsilonClosureDoesNotDependOnSeedOrder() {
    for (long seed = 0; seed < 20; seed++) {
      final Nfa nfa = RandomAutomata.nfa(seed, 7);
      final var forward = nfa.epsilonClosure(List.of("q1", "q3", "q5"));
      final var backward = nfa.epsilonClosure(List.of("q5", "q3", "q1"));
      Assertions.assertEquals(forward, backward);
    }
  }

  @Test
  void move() throws AutomatonException {
    final Nfa nfa = epsilonCycle();

    Assertions.assertEquals(Set.of("S3"), nfa.move(List.of("S0", "S1", "S2"), "a"));
    Assertions.assertEquals(Set.of(), nfa.move(List.of("S0"), "a"));
    Assertions.assertEquals(Set.of(), nfa.move(List.of("S0", "S1"), "b"));
    Assertions.assertEquals(Set.of(), nfa.move(List.of(), "a"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> nfa.move(List.of("S0"), Symbols.EPSILON));
  }

  @Test
  void moveDoesNotMutate() {
    final Nfa nfa = RandomAutomata.nfa(7, 5);
    final var before = nfa.transitions().toString();
    final var from = new TreeSet<String>(nfa.states());

    final var reached = nfa.move(from, "a");
    Assertions.assertEquals(before, nfa.transitions().toString());
    Assertions.assertEquals(nfa.states(), from);
    Assertions.assertThrows(UnsupportedOperationException.class, () -> reached.add("q0"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> nfa.transitionsFrom("q0").clear());
  }

  @Test
  void accepts() throws AutomatonException {
    final Nfa nfa = epsilonCycle();

    Assertions.assertTrue(nfa.accepts(List.of("a")));
    Assertions.assertFalse(nfa.accepts(List.of()));
    Assertions.assertFalse(nfa.accepts(List.of("a", "a")));
    Assertions.assertFalse(nfa.accepts(List.of("b")));
    Assertions.assertFalse(nfa.accepts(List.of("epsilon", "a")));
  }
}
