package nfadfa;

import com.fasterxml.jackson.databind.JsonNode;
import nfadfa.graph.AutomatonException;
import nfadfa.graph.Dfa;
import nfadfa.graph.Nfa;
import nfadfa.json.AutomatonJson;

/**
 * The whole NFA to minimal DFA pipeline over document trees.
 *
 * <p>Any {@link AutomatonException} aborts the conversion before an automaton
 * is produced, so callers never see a partial result.
 */
public final class Conversion {

  /**
   * Every automaton produced along the way.
   *
   * @param nfa automaton read from the input document
   * @param dfa result of subset construction
   * @param minimizedDfa result of minimizing {@code dfa} (the same instance if minimization was skipped)
   */
  public record Result(Nfa nfa, Dfa dfa, Dfa minimizedDfa) {

    public JsonNode dfaDocument() {
      return AutomatonJson.toJson(dfa);
    }

    public JsonNode minimizedDfaDocument() {
      return AutomatonJson.toJson(minimizedDfa);
    }
  }

  private Conversion() { }

  /**
   * Convert an NFA document.
   *
   * @param nfaDocument parsed NFA document
   * @param minimize whether to minimize the DFA
   * @param printDebugInfo print to STDERR a trace of what is happening
   * @return NFA, DFA and minimized DFA
   * @throws AutomatonException if the document does not describe a valid NFA
   */
  public static Result run(
    JsonNode nfaDocument,
    boolean minimize,
    boolean printDebugInfo
  ) throws AutomatonException {
    final Nfa nfa = AutomatonJson.readNfa(nfaDocument);
    if (printDebugInfo) {
      System.err.println("[NFA] loaded " + nfa);
    }

    final Dfa dfa = Dfa.fromNfa(nfa, printDebugInfo);
    final Dfa minimized = minimize ? dfa.minimized(printDebugInfo) : dfa;
    return new Result(nfa, dfa, minimized);
  }

  public static Result run(JsonNode nfaDocument) throws AutomatonException {
    return run(nfaDocument, true, false);
  }
}
