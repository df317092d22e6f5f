package nfadfa.graph;

/**
 * Input which cannot be turned into an automaton.
 *
 * <p>Any of these aborts a conversion: no partial automaton is produced.
 */
public class AutomatonException extends Exception {

  @java.io.Serial
  private static final long serialVersionUID = 4021157093861234517L;

  /**
   * Category of failure.
   */
  public enum Kind {

    /**
     * The input document could not be located or opened.
     */
    MISSING_SOURCE,

    /**
     * The input document does not have the expected shape.
     */
    MALFORMED_DOCUMENT,

    /**
     * A transition or the start state names a state that was never declared.
     */
    DANGLING_REFERENCE
  }

  public final Kind kind;

  public AutomatonException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public AutomatonException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}
