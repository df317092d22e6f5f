package nfadfa.graph;

/**
 * Alphabet symbols and the epsilon marker.
 *
 * <p>Input documents spell the empty transition in a handful of ways. All of
 * them are collapsed onto {@link #EPSILON} when transitions are added to an
 * {@link Nfa.Builder}, so nothing past that point ever has to recognize the
 * other spellings.
 */
public final class Symbols {

  /**
   * Canonical epsilon marker.
   */
  public static final String EPSILON = "";

  // Greek small letter epsilon
  private static final String GREEK_EPSILON = "\u03b5";

  // UTF-8 bytes of U+03B5 decoded as ISO-8859-1
  private static final String MISENCODED_EPSILON = "\u00ce\u00b5";

  private Symbols() { }

  /**
   * Check if a raw symbol spells epsilon.
   *
   * @param symbol symbol as it appeared in the input
   * @return whether the symbol is one of the epsilon spellings
   */
  public static boolean isEpsilon(String symbol) {
    return symbol.isEmpty()
      || symbol.equalsIgnoreCase("epsilon")
      || symbol.equals(GREEK_EPSILON)
      || symbol.equals(MISENCODED_EPSILON);
  }

  /**
   * Normalize a raw symbol.
   *
   * @param symbol symbol as it appeared in the input
   * @return {@link #EPSILON} for epsilon spellings, otherwise the symbol itself
   */
  public static String canonical(String symbol) {
    return isEpsilon(symbol) ? EPSILON : symbol;
  }

  /**
   * Render a symbol for an HTML-like DOT label.
   *
   * @param symbol canonical symbol
   * @return escaped label
   */
  public static String dotLabel(String symbol) {
    if (symbol.equals(EPSILON)) {
      return "&epsilon;";
    }
    return symbol
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }
}
