package nfadfa;

import java.util.Set;
import nfadfa.graph.AutomatonException;
import nfadfa.json.AutomatonJson;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ConversionTest {

  @Test
  void fullPipeline() throws AutomatonException {
    final Conversion.Result result = Conversion.run(Fixtures.document("ab_star_abb.json"));

    Assertions.assertEquals(11, result.nfa().states().size());
    Assertions.assertEquals(5, result.dfa().states().size());
    Assertions.assertEquals(4, result.minimizedDfa().states().size());
    Assertions.assertEquals(Set.of("S3"), result.minimizedDfa().finalStates());

    Assertions.assertEquals("S0", result.dfaDocument().get(AutomatonJson.STARTING_STATE).textValue());
    Assertions.assertTrue(result.minimizedDfaDocument().get("S3").get(AutomatonJson.IS_TERMINATING_STATE).booleanValue());
    Assertions.assertEquals("S0", result.minimizedDfaDocument().get("S3").get("b").textValue());
  }

  @Test
  void skippingMinimization() throws AutomatonException {
    final Conversion.Result result = Conversion.run(Fixtures.document("ab_star_abb.json"), false, false);

    Assertions.assertSame(result.dfa(), result.minimizedDfa());
    Assertions.assertEquals(result.dfaDocument(), result.minimizedDfaDocument());
  }

  @Test
  void invalidDocumentsAbort() throws AutomatonException {
    final var dangling = Assertions.assertThrows(
      AutomatonException.class,
      () -> Conversion.run(Fixtures.document("dangling_target.json"))
    );
    Assertions.assertEquals(AutomatonException.Kind.DANGLING_REFERENCE, dangling.kind);

    final var malformed = Assertions.assertThrows(
      AutomatonException.class,
      () -> Conversion.run(Fixtures.document("missing_start.json"))
    );
    Assertions.assertEquals(AutomatonException.Kind.MALFORMED_DOCUMENT, malformed.kind);
  }
}
