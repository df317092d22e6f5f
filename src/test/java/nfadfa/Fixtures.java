package nfadfa;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URISyntaxException;
import java.nio.file.Path;
import nfadfa.graph.AutomatonException;
import nfadfa.graph.Nfa;
import nfadfa.json.AutomatonJson;

/**
 * Access to the NFA documents under {@code src/test/resources/nfa}.
 */
public final class Fixtures {

  private Fixtures() { }

  public static Path path(String name) {
    try {
      return Path.of(Fixtures.class.getResource("/nfa/" + name).toURI());
    } catch (URISyntaxException err) {
      throw new IllegalStateException(err);
    }
  }

  public static JsonNode document(String name) throws AutomatonException {
    return AutomatonJson.readTree(path(name));
  }

  public static Nfa nfa(String name) throws AutomatonException {
    return AutomatonJson.readNfa(document(name));
  }
}
