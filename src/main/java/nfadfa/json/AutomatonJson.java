package nfadfa.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedSet;
import nfadfa.graph.AutomatonException;
import nfadfa.graph.Dfa;
import nfadfa.graph.Nfa;
import nfadfa.graph.Symbols;

/**
 * Reading and writing automata in the JSON document shape.
 *
 * <p>A document is an object with a {@code "startingState"} key and one key
 * per state. Each state object has an {@code "isTerminatingState"} flag, and
 * every other key is a transition symbol:
 *
 * <pre>{@code
 * {
 *   "startingState": "S0",
 *   "S0": { "isTerminatingState": false, "a": ["S0", "S1"] },
 *   "S1": { "isTerminatingState": true }
 * }
 * }</pre>
 *
 * <p>NFA documents accept a single state or an array of states as transition
 * targets. DFA documents only accept single states.
 */
public final class AutomatonJson {

  public static final String STARTING_STATE = "startingState";
  public static final String IS_TERMINATING_STATE = "isTerminatingState";

  // Anything after the top-level value makes the document unparsable
  private static final ObjectMapper MAPPER = new ObjectMapper()
    .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
    .enable(SerializationFeature.INDENT_OUTPUT);

  private AutomatonJson() { }

  /**
   * Parse a JSON document from a file.
   *
   * @param path file to read
   * @return parsed document
   * @throws AutomatonException if the file is missing or is not JSON
   */
  public static JsonNode readTree(Path path) throws AutomatonException {
    if (!Files.isRegularFile(path)) {
      throw new AutomatonException(AutomatonException.Kind.MISSING_SOURCE, "file not found: " + path);
    }

    try (InputStream in = Files.newInputStream(path)) {
      return MAPPER.readTree(in);
    } catch (JsonProcessingException err) {
      throw new AutomatonException(
        AutomatonException.Kind.MALFORMED_DOCUMENT,
        "invalid JSON in " + path + ": " + err.getOriginalMessage(),
        err
      );
    } catch (NoSuchFileException err) {
      throw new AutomatonException(AutomatonException.Kind.MISSING_SOURCE, "file not found: " + path, err);
    } catch (IOException err) {
      throw new AutomatonException(
        AutomatonException.Kind.MISSING_SOURCE,
        "could not read " + path + ": " + err.getMessage(),
        err
      );
    }
  }

  /**
   * Parse a JSON document from a string.
   *
   * @param json source text
   * @return parsed document
   * @throws AutomatonException if the text is not JSON
   */
  public static JsonNode readTree(String json) throws AutomatonException {
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException err) {
      throw new AutomatonException(
        AutomatonException.Kind.MALFORMED_DOCUMENT,
        "invalid JSON: " + err.getOriginalMessage(),
        err
      );
    }
  }

  /**
   * Build an NFA from a document.
   *
   * @param document parsed document
   * @return NFA with all epsilon spellings normalized
   * @throws AutomatonException if the document is malformed or references undeclared states
   */
  public static Nfa readNfa(JsonNode document) throws AutomatonException {
    final var builder = new Nfa.Builder(startingState(document));

    final Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      if (field.getKey().equals(STARTING_STATE)) {
        continue;
      }

      final String state = field.getKey();
      final JsonNode stateObject = stateObject(state, field.getValue());
      builder.addState(state, isTerminating(state, stateObject));

      final Iterator<Map.Entry<String, JsonNode>> transitions = stateObject.fields();
      while (transitions.hasNext()) {
        final Map.Entry<String, JsonNode> transition = transitions.next();
        final String symbol = transition.getKey();
        if (symbol.equals(IS_TERMINATING_STATE)) {
          continue;
        }

        final JsonNode target = transition.getValue();
        if (target.isTextual()) {
          builder.addTransition(state, symbol, target.textValue());
        } else if (target.isArray()) {
          for (JsonNode element : target) {
            if (!element.isTextual()) {
              throw malformed("state " + state + " has a non-string target on " + describe(symbol));
            }
            builder.addTransition(state, symbol, element.textValue());
          }
        } else {
          throw malformed("state " + state + " has a target on " + describe(symbol) + " which is neither a string nor an array");
        }
      }
    }

    return builder.build();
  }

  /**
   * Build a DFA from a document, such as one written by {@link #toJson(Dfa)}.
   *
   * @param document parsed document
   * @return DFA
   * @throws AutomatonException if the document is malformed, non-deterministic, or references undeclared states
   */
  public static Dfa readDfa(JsonNode document) throws AutomatonException {
    final var builder = new Dfa.Builder(startingState(document));

    final Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      if (field.getKey().equals(STARTING_STATE)) {
        continue;
      }

      final String state = field.getKey();
      final JsonNode stateObject = stateObject(state, field.getValue());
      builder.addState(state, isTerminating(state, stateObject));

      final Iterator<Map.Entry<String, JsonNode>> transitions = stateObject.fields();
      while (transitions.hasNext()) {
        final Map.Entry<String, JsonNode> transition = transitions.next();
        final String symbol = transition.getKey();
        if (symbol.equals(IS_TERMINATING_STATE)) {
          continue;
        }
        if (Symbols.isEpsilon(symbol)) {
          throw malformed("state " + state + " has an epsilon transition, which a DFA cannot have");
        }
        if (!transition.getValue().isTextual()) {
          throw malformed("state " + state + " must have a single string target on " + describe(symbol));
        }
        builder.addTransition(state, symbol, transition.getValue().textValue());
      }
    }

    return builder.build();
  }

  /**
   * Render a DFA as a document.
   *
   * @param dfa automaton to render
   * @return document with states in sorted order and single-state targets
   */
  public static ObjectNode toJson(Dfa dfa) {
    final ObjectNode document = MAPPER.createObjectNode();
    document.put(STARTING_STATE, dfa.startState());

    for (String state : dfa.states()) {
      final ObjectNode stateObject = document.putObject(state);
      stateObject.put(IS_TERMINATING_STATE, dfa.finalStates().contains(state));
      for (Map.Entry<String, String> transition : dfa.transitionsFrom(state).entrySet()) {
        stateObject.put(transition.getKey(), transition.getValue());
      }
    }

    return document;
  }

  /**
   * Render an NFA as a document.
   *
   * <p>Epsilon transitions are written under the empty string key.
   *
   * @param nfa automaton to render
   * @return document with states in sorted order and array targets
   */
  public static ObjectNode toJson(Nfa nfa) {
    final ObjectNode document = MAPPER.createObjectNode();
    document.put(STARTING_STATE, nfa.startState());

    for (String state : nfa.states()) {
      final ObjectNode stateObject = document.putObject(state);
      stateObject.put(IS_TERMINATING_STATE, nfa.finalStates().contains(state));
      for (Map.Entry<String, SortedSet<String>> transition : nfa.transitionsFrom(state).entrySet()) {
        final ArrayNode targets = stateObject.putArray(transition.getKey());
        transition.getValue().forEach(targets::add);
      }
    }

    return document;
  }

  /**
   * Pretty print a document.
   *
   * @param document document to print
   * @return indented JSON text
   */
  public static String writeString(JsonNode document) {
    try {
      return MAPPER.writeValueAsString(document);
    } catch (JsonProcessingException err) {
      throw new IllegalStateException("JSON tree could not be serialized", err);
    }
  }

  /**
   * Pretty print a document to a file, replacing any existing content.
   *
   * @param path destination file
   * @param document document to write
   * @throws IOException if the file cannot be written
   */
  public static void write(Path path, JsonNode document) throws IOException {
    try (OutputStream out = Files.newOutputStream(path)) {
      MAPPER.writeValue(out, document);
    }
  }

  private static String startingState(JsonNode document) throws AutomatonException {
    if (document == null || !document.isObject()) {
      throw malformed("document must be a JSON object");
    }
    final JsonNode start = document.get(STARTING_STATE);
    if (start == null) {
      throw malformed("missing '" + STARTING_STATE + "' key");
    }
    if (!start.isTextual()) {
      throw malformed("'" + STARTING_STATE + "' must be a string");
    }
    return start.textValue();
  }

  private static JsonNode stateObject(String state, JsonNode value) throws AutomatonException {
    if (!value.isObject()) {
      throw malformed("state " + state + " must be described by a JSON object");
    }
    return value;
  }

  // Absent means not terminating
  private static boolean isTerminating(String state, JsonNode stateObject) throws AutomatonException {
    final JsonNode flag = stateObject.get(IS_TERMINATING_STATE);
    if (flag == null) {
      return false;
    }
    if (!flag.isBoolean()) {
      throw malformed("'" + IS_TERMINATING_STATE + "' of state " + state + " must be a boolean");
    }
    return flag.booleanValue();
  }

  private static String describe(String symbol) {
    return Symbols.isEpsilon(symbol) ? "epsilon" : "'" + symbol + "'";
  }

  private static AutomatonException malformed(String message) {
    return new AutomatonException(AutomatonException.Kind.MALFORMED_DOCUMENT, message);
  }
}
