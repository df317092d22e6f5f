package nfadfa.graph;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import nfadfa.Fixtures;
import nfadfa.RandomAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class MinimizationTest {

  private static SortedSet<String> group(String... states) {
    return new TreeSet<>(List.of(states));
  }

  @Test
  void alreadyMinimal() throws AutomatonException {
    final Dfa dfa = Dfa.fromNfa(Fixtures.nfa("a_star_ab.json"));
    final Dfa minimized = dfa.minimized();

    Assertions.assertEquals(3, minimized.states().size());
    Assertions.assertTrue(dfa.isomorphism(minimized).isPresent());
    Assertions.assertTrue(minimized.subsetOf("S0").isEmpty());
  }

  @Test
  void refinementPasses() throws AutomatonException {
    final Dfa dfa = Dfa.fromNfa(Fixtures.nfa("ab_star_abb.json"));

    Assertions.assertEquals(
      List.of(group("S0", "S2"), group("S1"), group("S3"), group("S4")),
      dfa.minimizedPartition(false)
    );
  }

  @Test
  void mergesEquivalentStates() throws AutomatonException {
    final Dfa minimized = Dfa.fromNfa(Fixtures.nfa("ab_star_abb.json")).minimized();

    Assertions.assertEquals("S0", minimized.startState());
    Assertions.assertEquals(Set.of("S0", "S1", "S2", "S3"), minimized.states());
    Assertions.assertEquals(Set.of("S3"), minimized.finalStates());
    Assertions.assertEquals(Map.of("a", "S1", "b", "S0"), minimized.transitionsFrom("S0"));
    Assertions.assertEquals(Map.of("a", "S1", "b", "S2"), minimized.transitionsFrom("S1"));
    Assertions.assertEquals(Map.of("a", "S1", "b", "S3"), minimized.transitionsFrom("S2"));
    Assertions.assertEquals(Map.of("a", "S1", "b", "S0"), minimized.transitionsFrom("S3"));

    Assertions.assertTrue(minimized.accepts(List.of("a", "b", "b")));
    Assertions.assertTrue(minimized.accepts(List.of("b", "a", "a", "b", "a", "b", "b")));
    Assertions.assertFalse(minimized.accepts(List.of("a", "b", "b", "a")));
  }

  @Test
  void missingTransitionsAgree() throws AutomatonException {
    final Dfa dfa = new Dfa.Builder("A")
      .addState("A", false)
      .addState("B", false)
      .addState("C", false)
      .addState("D", false)
      .addState("F", true)
      .addTransition("A", "x", "F")
      .addTransition("B", "x", "F")
      .build();

    Assertions.assertEquals(
      List.of(group("A", "B"), group("C", "D"), group("F")),
      dfa.minimizedPartition(false)
    );

    final Dfa minimized = dfa.minimized();
    Assertions.assertEquals(Set.of("S0", "S1", "S2"), minimized.states());
    Assertions.assertEquals(Map.of("x", "S2"), minimized.transitionsFrom("S0"));
    Assertions.assertEquals(Map.of(), minimized.transitionsFrom("S1"));
  }

  @Test
  void groupIndexSentinel() {
    final Map<String, Integer> groupOf = Map.of("A", 0, "B", 1);

    Assertions.assertEquals(0, Dfa.groupIndex(groupOf, "A"));
    Assertions.assertEquals(1, Dfa.groupIndex(groupOf, "B"));
    Assertions.assertEquals(Dfa.NO_GROUP, Dfa.groupIndex(groupOf, null));
    Assertions.assertEquals(Dfa.NO_GROUP, Dfa.groupIndex(groupOf, "C"));
  }

  @Test
  void noFinalStates() throws AutomatonException {
    final Dfa dfa = new Dfa.Builder("A")
      .addState("A", false)
      .addState("B", false)
      .addTransition("A", "x", "B")
      .addTransition("B", "x", "A")
      .build();

    final Dfa minimized = dfa.minimized();
    Assertions.assertEquals(List.of(group("A", "B")), dfa.minimizedPartition(false));
    Assertions.assertEquals(Set.of("S0"), minimized.states());
    Assertions.assertTrue(minimized.finalStates().isEmpty());
    Assertions.assertEquals(Map.of("x", "S0"), minimized.transitionsFrom("S0"));
  }

  @Test
  void onlyFinalStates() throws AutomatonException {
    final Dfa dfa = new Dfa.Builder("A")
      .addState("A", true)
      .addState("B", true)
      .addTransition("A", "x", "B")
      .addTransition("B", "x", "A")
      .build();

    Assertions.assertEquals(List.of(group("A", "B")), dfa.minimizedPartition(false));
    Assertions.assertEquals(Set.of("S0"), dfa.minimized().finalStates());
  }

  @Test
  void neverGrowsAndIsIdempotent() {
    for (long seed = 0; seed < 50; seed++) {
      final Dfa dfa = RandomAutomata.dfa(seed, 7);
      final Dfa minimized = dfa.minimized();
      final Dfa twice = minimized.minimized();

      Assertions.assertTrue(minimized.states().size() <= dfa.states().size(), "seed " + seed);
      Assertions.assertEquals(minimized.states().size(), twice.states().size(), "seed " + seed);
      Assertions.assertTrue(minimized.isomorphism(twice).isPresent(), "seed " + seed);
    }
  }

  @Test
  void partitionCoversEveryStateOnce() {
    for (long seed = 0; seed < 30; seed++) {
      final Dfa dfa = RandomAutomata.dfa(seed, 8);
      final var seen = new TreeSet<String>();
      for (SortedSet<String> group : dfa.minimizedPartition(false)) {
        Assertions.assertFalse(group.isEmpty());
        for (String state : group) {
          Assertions.assertTrue(seen.add(state), "state " + state + " in two groups");
          Assertions.assertEquals(
            dfa.finalStates().contains(group.first()),
            dfa.finalStates().contains(state)
          );
        }
      }
      Assertions.assertEquals(dfa.states(), seen);
    }
  }

  @Test
  void sameLanguage() {
    final List<List<String>> words = RandomAutomata.words(RandomAutomata.ALPHABET, 5);
    for (long seed = 0; seed < 40; seed++) {
      final Dfa dfa = RandomAutomata.dfa(seed, 6);
      final Dfa minimized = dfa.minimized();
      for (List<String> word : words) {
        Assertions.assertEquals(dfa.accepts(word), minimized.accepts(word), "seed " + seed + " on " + word);
      }

      final Nfa nfa = RandomAutomata.nfa(seed, 5);
      final Dfa fromNfa = Dfa.fromNfa(nfa).minimized();
      for (List<String> word : words) {
        Assertions.assertEquals(nfa.accepts(word), fromNfa.accepts(word), "seed " + seed + " on " + word);
      }
    }
  }

  @Test
  void isomorphismIgnoresUnreachableStates() throws AutomatonException {
    final Dfa dfa = new Dfa.Builder("A")
      .addState("A", false)
      .addState("B", true)
      .addState("C", false)
      .addTransition("A", "x", "B")
      .addTransition("C", "x", "A")
      .build();

    Assertions.assertEquals(Map.of("A", "A", "B", "B"), dfa.isomorphism(dfa).orElseThrow());

    final Dfa minimized = dfa.minimized();
    Assertions.assertTrue(dfa.isomorphism(minimized).isPresent());
    Assertions.assertTrue(minimized.isomorphism(minimized.minimized()).isPresent());
  }

  @Test
  void isomorphismRejectsDifferentAutomata() throws AutomatonException {
    final Dfa abb = Dfa.fromNfa(Fixtures.nfa("ab_star_abb.json"));
    final Dfa ab = Dfa.fromNfa(Fixtures.nfa("a_star_ab.json"));
    Assertions.assertTrue(abb.isomorphism(ab).isEmpty());

    final Dfa flipped = new Dfa.Builder("S0")
      .addState("S0", false)
      .addState("S1", true)
      .addState("S2", false)
      .addTransition("S0", "a", "S1")
      .addTransition("S1", "a", "S1")
      .addTransition("S1", "b", "S2")
      .build();
    Assertions.assertTrue(ab.isomorphism(flipped).isEmpty());

    final Dfa renamed = new Dfa.Builder("x")
      .addState("x", false)
      .addState("y", false)
      .addState("z", true)
      .addTransition("x", "a", "y")
      .addTransition("y", "a", "y")
      .addTransition("y", "b", "z")
      .build();
    Assertions.assertEquals(
      Map.of("S0", "x", "S1", "y", "S2", "z"),
      ab.isomorphism(renamed).orElseThrow()
    );
  }
}
