package nfadfa.codegen;

/**
 * Membership test over inputs whose symbols have been interned to integers.
 *
 * <p>Generated DFA classes implement this interface.
 */
public interface SymbolAcceptor {

  /**
   * Run the automaton over an interned input.
   *
   * @param symbols symbol ids, where a negative id is a symbol outside the alphabet
   * @return whether the input is accepted
   */
  boolean accepts(int[] symbols);
}
