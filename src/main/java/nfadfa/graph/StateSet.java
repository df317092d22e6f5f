package nfadfa.graph;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable set of state identifiers.
 *
 * <p>This is the identity of a DFA state built by subset construction: two
 * sets of NFA states are the same DFA state exactly when they contain the same
 * identifiers, no matter the order in which they were discovered.
 */
public final class StateSet implements Comparable<StateSet> {

  // Sorted and distinct elements
  private final String[] elements;

  public static StateSet of(String... elems) {
    return new StateSet(Arrays.asList(elems));
  }

  public StateSet(Collection<String> elems) {
    this.elements = new TreeSet<String>(elems).toArray(String[]::new);
  }

  public Stream<String> stream() {
    return Arrays.stream(elements);
  }

  public List<String> toList() {
    return List.of(elements);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(String state) {
    return Arrays.binarySearch(elements, state) >= 0;
  }

  @Override
  public int compareTo(StateSet other) {
    return Arrays.compare(elements, other.elements);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof StateSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((StateSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(elements)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
