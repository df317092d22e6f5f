package nfadfa;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import nfadfa.codegen.CompiledDfa;
import nfadfa.codegen.SymbolAcceptor;
import nfadfa.graph.Dfa;
import org.objectweb.asm.Opcodes;

/**
 * Membership test for the language of a DFA.
 *
 * <p>Symbols are interned to integer ids (in lexicographic order of the DFA
 * alphabet) before a run, and symbols outside the alphabet make the input
 * rejected. The compiled flavour generates a fresh hidden class where every
 * DFA state is a block of bytecode and transitions are jumps, while the
 * interpreted flavour walks the transition table.
 */
abstract public class DfaAcceptor {

  private final Dfa dfa;
  private final Map<String, Integer> symbolIds;

  protected DfaAcceptor(Dfa dfa) {
    this.dfa = dfa;

    final var ids = new TreeMap<String, Integer>();
    for (String symbol : dfa.alphabet()) {
      ids.put(symbol, ids.size());
    }
    this.symbolIds = Collections.unmodifiableMap(ids);
  }

  /**
   * Compile a DFA into a generated class.
   *
   * @param dfa deterministic automaton
   * @return compiled acceptor
   */
  public static DfaAcceptor compiled(Dfa dfa) throws IllegalAccessException, NoSuchMethodException {
    return new CompiledDfaAcceptor(dfa, false);
  }

  /**
   * Compile a DFA into a generated class, optionally tracing runs.
   *
   * @param dfa deterministic automaton
   * @param printDebugInfo generated code prints states entered to STDERR
   * @return compiled acceptor
   */
  public static DfaAcceptor compiled(
    Dfa dfa,
    boolean printDebugInfo
  ) throws IllegalAccessException, NoSuchMethodException {
    return new CompiledDfaAcceptor(dfa, printDebugInfo);
  }

  /**
   * Walk a DFA without generating any bytecode.
   *
   * @param dfa deterministic automaton
   * @return interpreted acceptor
   */
  public static DfaAcceptor interpreted(Dfa dfa) {
    return new InterpretedDfaAcceptor(dfa);
  }

  /**
   * Automaton whose language this acceptor tests.
   *
   * @return source DFA
   */
  public Dfa dfa() {
    return dfa;
  }

  /**
   * Interned ids of the alphabet symbols.
   *
   * @return unmodifiable mapping from symbol to id
   */
  public Map<String, Integer> symbolIds() {
    return symbolIds;
  }

  /**
   * Check whether an input is in the language.
   *
   * @param input sequence of symbols
   * @return whether the DFA accepts the input
   */
  public boolean accepts(List<String> input) {
    final int[] symbols = new int[input.size()];
    for (int i = 0; i < symbols.length; i++) {
      symbols[i] = symbolIds.getOrDefault(input.get(i), -1);
    }
    return acceptsSymbols(symbols);
  }

  /**
   * Check whether an interned input is in the language.
   *
   * @param symbols symbol ids (negative for symbols outside the alphabet)
   * @return whether the DFA accepts the input
   */
  protected abstract boolean acceptsSymbols(int[] symbols);

  final static public class CompiledDfaAcceptor extends DfaAcceptor {

    private final SymbolAcceptor generated;

    public CompiledDfaAcceptor(
      Dfa dfa,
      boolean printDebugInfo
    ) throws IllegalAccessException, NoSuchMethodException {
      super(dfa);

      final String className = "nfadfa/DfaAcceptor$Compiled";
      final int classFlags = Opcodes.ACC_PRIVATE | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC;
      final byte[] classBytes = CompiledDfa
        .generateAcceptorClass(dfa, symbolIds(), className, classFlags, printDebugInfo)
        .toByteArray();

      // Load the class and get a handle on the constructor
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );

      try {
        this.generated = (SymbolAcceptor) constructor.invoke();
      } catch (Throwable error) {
        throw new IllegalStateException("Failed to construct compiled acceptor", error);
      }
    }

    @Override
    protected boolean acceptsSymbols(int[] symbols) {
      return generated.accepts(symbols);
    }

    @Override
    public String toString() {
      return "DfaAcceptor.CompiledDfaAcceptor(" + dfa() + ")";
    }
  }

  final static public class InterpretedDfaAcceptor extends DfaAcceptor {

    // Transition table indexed by state id, then symbol id (-1 for no transition)
    private final int[][] table;
    private final boolean[] accepting;
    private final int initial;

    public InterpretedDfaAcceptor(Dfa dfa) {
      super(dfa);

      final var stateIds = new TreeMap<String, Integer>();
      for (String state : dfa.states()) {
        stateIds.put(state, stateIds.size());
      }

      this.table = new int[stateIds.size()][symbolIds().size()];
      this.accepting = new boolean[stateIds.size()];
      for (Map.Entry<String, Integer> state : stateIds.entrySet()) {
        final int[] row = table[state.getValue()];
        Arrays.fill(row, -1);
        for (Map.Entry<String, String> transition : dfa.transitionsFrom(state.getKey()).entrySet()) {
          row[symbolIds().get(transition.getKey())] = stateIds.get(transition.getValue());
        }
        accepting[state.getValue()] = dfa.finalStates().contains(state.getKey());
      }
      this.initial = stateIds.get(dfa.startState());
    }

    @Override
    protected boolean acceptsSymbols(int[] symbols) {
      int currentState = initial;
      for (int symbol : symbols) {
        if (symbol < 0) {
          return false;
        }
        currentState = table[currentState][symbol];
        if (currentState < 0) {
          return false;
        }
      }
      return accepting[currentState];
    }

    @Override
    public String toString() {
      return "DfaAcceptor.InterpretedDfaAcceptor(" + dfa() + ")";
    }
  }
}
