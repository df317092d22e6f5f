package nfadfa;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import nfadfa.graph.AutomatonException;
import nfadfa.graph.Dfa;
import nfadfa.graph.DotGraph;
import nfadfa.json.AutomatonJson;
import org.objectweb.asm.ClassTooLargeException;
import org.objectweb.asm.MethodTooLargeException;

/**
 * Converts an NFA JSON file into DFA and minimized DFA JSON files.
 *
 * <p>Progress and errors go to standard error. Results of {@code --test}
 * inputs go to standard output, one line per input.
 */
class ConvertMain {

  public static void main(String[] args) {
    final ConvertOptions options;
    try {
      options = ConvertOptions.parse(args);
    } catch (ConvertOptions.UsageException err) {
      System.err.println(err.getMessage());
      System.err.println(ConvertOptions.USAGE);
      System.exit(2);
      return;
    }

    System.exit(run(options));
  }

  /**
   * Run a full conversion.
   *
   * @param options parsed command line
   * @return process exit status
   */
  static int run(ConvertOptions options) {

    // Nothing is written unless the whole conversion succeeds
    final Conversion.Result result;
    try {
      final JsonNode document = AutomatonJson.readTree(options.nfaPath);
      result = Conversion.run(document, options.minimize, options.printDebugInfo);
    } catch (AutomatonException err) {
      System.err.println("Error (" + err.kind + "): " + err.getMessage());
      return 1;
    }

    System.err.println("Loaded NFA with " + result.nfa().states().size() + " states.");
    System.err.println("Generated DFA with " + result.dfa().states().size() + " states.");
    if (options.minimize) {
      System.err.println("Minimized DFA has " + result.minimizedDfa().states().size() + " states.");
    }

    final var documents = new LinkedHashMap<Path, JsonNode>();
    documents.put(options.dfaPath, result.dfaDocument());
    documents.put(options.minDfaPath, result.minimizedDfaDocument());
    try {
      writeAll(documents);
      System.err.println("  -> DFA saved to " + options.dfaPath);
      System.err.println("  -> minimized DFA saved to " + options.minDfaPath);
    } catch (IOException err) {
      System.err.println("Failed to write output: " + err.getMessage());
      return 1;
    }

    options.dotDirectory.ifPresent(directory -> renderAll(result, directory, options.renderPng));

    if (!options.testInputs.isEmpty()) {
      final DfaAcceptor acceptor;
      try {
        acceptor = acceptor(result.minimizedDfa(), options.compiled, options.printDebugInfo);
      } catch (IllegalAccessException | NoSuchMethodException err) {
        System.err.println("Failed to compile acceptor: " + err.getMessage());
        return 1;
      }

      for (List<String> input : options.testInputs) {
        final String verdict = acceptor.accepts(input) ? "accepted" : "rejected";
        System.out.println("[" + String.join(" ", input) + "] " + verdict);
      }
    }

    return 0;
  }

  /**
   * Pick the acceptor used for {@code --test} inputs.
   *
   * <p>A DFA too large to fit in one generated method is run by the
   * interpreted acceptor instead.
   *
   * @param dfa automaton to run
   * @param compiled whether a compiled acceptor was asked for
   * @param printDebugInfo generated code prints a trace to STDERR
   * @return acceptor for the DFA
   */
  static DfaAcceptor acceptor(
    Dfa dfa,
    boolean compiled,
    boolean printDebugInfo
  ) throws IllegalAccessException, NoSuchMethodException {
    if (!compiled) {
      return DfaAcceptor.interpreted(dfa);
    }

    try {
      return DfaAcceptor.compiled(dfa, printDebugInfo);
    } catch (MethodTooLargeException | ClassTooLargeException err) {
      System.err.println("DFA too large to compile (" + err.getMessage() + "), interpreting it instead");
      return DfaAcceptor.interpreted(dfa);
    }
  }

  /**
   * Write several documents, leaving none of them behind unless all succeed.
   *
   * <p>Every document first goes to a temporary file next to its destination.
   * Only once all of them are written are they moved into place.
   *
   * @param documents documents to write, by destination
   */
  static void writeAll(Map<Path, JsonNode> documents) throws IOException {
    final var staged = new LinkedHashMap<Path, Path>();
    try {
      for (Map.Entry<Path, JsonNode> document : documents.entrySet()) {
        final Path destination = document.getKey().toAbsolutePath();
        final Path temporary = Files.createTempFile(
          destination.getParent(),
          destination.getFileName().toString(),
          ".tmp"
        );
        staged.put(temporary, destination);
        AutomatonJson.write(temporary, document.getValue());
      }

      for (Map.Entry<Path, Path> move : staged.entrySet()) {
        Files.move(move.getKey(), move.getValue(), StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      for (Path temporary : staged.keySet()) {
        try {
          Files.deleteIfExists(temporary);
        } catch (IOException err) {
          System.err.println("  -> could not remove " + temporary + ": " + err.getMessage());
        }
      }
    }
  }

  /**
   * Draw every automaton of the conversion, reporting (but otherwise
   * ignoring) failures.
   */
  private static void renderAll(Conversion.Result result, Path directory, boolean renderPng) {
    final var renderer = new DotRenderer(directory, renderPng);
    record Drawing(DotGraph<?, ?> graph, String name) { }

    for (Drawing drawing : List.of(
      new Drawing(result.nfa(), "nfa"),
      new Drawing(result.dfa(), "dfa"),
      new Drawing(result.minimizedDfa(), "min_dfa")
    )) {
      try {
        final Path written = renderer.render(drawing.graph(), drawing.name());
        System.err.println("  -> image saved to " + written);
      } catch (IOException err) {
        System.err.println("  -> rendering " + drawing.name() + " failed (ignored): " + err.getMessage());
      } catch (InterruptedException err) {
        Thread.currentThread().interrupt();
        System.err.println("  -> rendering " + drawing.name() + " interrupted");
        return;
      }
    }
  }
}
