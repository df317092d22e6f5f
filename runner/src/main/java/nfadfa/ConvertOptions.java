package nfadfa;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Command line options for {@link ConvertMain}.
 */
final class ConvertOptions {

  static final String USAGE = String.join(
    "\n",
    "usage: ConvertMain [options] <nfa.json> <dfa.json> <min-dfa.json>",
    "",
    "  --dot <dir>       write nfa.dot, dfa.dot and min_dfa.dot into <dir>",
    "  --png             also render the DOT files with Graphviz `dot -Tpng`",
    "  --no-minimize     skip minimization (min-dfa.json gets the plain DFA)",
    "  --test <symbols>  check a space separated input against the minimized DFA",
    "  --compiled        use a compiled acceptor for --test",
    "  --debug           print a trace of the algorithms to standard error"
  );

  /**
   * Thrown for command lines which do not parse.
   */
  static final class UsageException extends Exception {

    @java.io.Serial
    private static final long serialVersionUID = -2390547161209334870L;

    UsageException(String message) {
      super(message);
    }
  }

  final Path nfaPath;
  final Path dfaPath;
  final Path minDfaPath;
  final Optional<Path> dotDirectory;
  final boolean renderPng;
  final boolean minimize;
  final boolean compiled;
  final boolean printDebugInfo;
  final List<List<String>> testInputs;

  private ConvertOptions(
    Path nfaPath,
    Path dfaPath,
    Path minDfaPath,
    Optional<Path> dotDirectory,
    boolean renderPng,
    boolean minimize,
    boolean compiled,
    boolean printDebugInfo,
    List<List<String>> testInputs
  ) {
    this.nfaPath = nfaPath;
    this.dfaPath = dfaPath;
    this.minDfaPath = minDfaPath;
    this.dotDirectory = dotDirectory;
    this.renderPng = renderPng;
    this.minimize = minimize;
    this.compiled = compiled;
    this.printDebugInfo = printDebugInfo;
    this.testInputs = testInputs;
  }

  static ConvertOptions parse(String[] args) throws UsageException {
    final var positional = new ArrayList<String>();
    final var testInputs = new ArrayList<List<String>>();
    Optional<Path> dotDirectory = Optional.empty();
    boolean renderPng = false;
    boolean minimize = true;
    boolean compiled = false;
    boolean printDebugInfo = false;

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--dot":
          dotDirectory = Optional.of(Path.of(requireValue(args, ++i, "--dot")));
          break;
        case "--png":
          renderPng = true;
          break;
        case "--no-minimize":
          minimize = false;
          break;
        case "--test":
          final String input = requireValue(args, ++i, "--test").trim();
          testInputs.add(input.isEmpty() ? List.of() : Arrays.asList(input.split("\\s+")));
          break;
        case "--compiled":
          compiled = true;
          break;
        case "--debug":
          printDebugInfo = true;
          break;
        default:
          if (args[i].startsWith("--")) {
            throw new UsageException("unknown option " + args[i]);
          }
          positional.add(args[i]);
      }
    }

    if (positional.size() != 3) {
      throw new UsageException("expected 3 file arguments but got " + positional.size());
    }
    if (renderPng && dotDirectory.isEmpty()) {
      throw new UsageException("--png requires --dot");
    }

    return new ConvertOptions(
      Path.of(positional.get(0)),
      Path.of(positional.get(1)),
      Path.of(positional.get(2)),
      dotDirectory,
      renderPng,
      minimize,
      compiled,
      printDebugInfo,
      Collections.unmodifiableList(testInputs)
    );
  }

  private static String requireValue(String[] args, int index, String option) throws UsageException {
    if (index >= args.length) {
      throw new UsageException(option + " expects a value");
    }
    return args[index];
  }
}
