package FSA;

import FSA.Model.Automaton;
import FSA.Model.Cancellation;
import FSA.Model.InvalidAutomatonException;
import FSA.Regex.ThompsonConstruction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class FSACommandLineTest {
  private static final List<String> AUTOMATON_OPS =
      List.of("trim", "determinize", "minimise-nfa");

  @Test
  void testLanguagePreservingOperations(@TempDir Path dir) throws IOException {
    String file = write(dir, "nfa.json", Fixtures.endsWithAb());
    for (String op : AUTOMATON_OPS) {
      FSACommandLine.Outcome outcome = FSACommandLine.execute(op, List.of(file));
      Assertions.assertNotNull(outcome.automaton(), op);
      Assertions.assertTrue(Equivalence.areEquivalent(Fixtures.endsWithAb(), outcome.automaton()), op);
      Assertions.assertEquals(outcome.automaton(), FSAJson.read(outcome.text()), op);
    }
  }

  @Test
  void testInterruptedMinimisation(@TempDir Path dir) throws IOException {
    String file = write(dir, "nfa.json", Fixtures.endsWithAb());
    FSACommandLine.Outcome outcome =
        FSACommandLine.execute("minimise-nfa", List.of(file), new Cancellation(true, Integer.MAX_VALUE));
    Assertions.assertEquals(Fixtures.endsWithAb(), outcome.automaton());
  }

  @Test
  void testDFAOperations(@TempDir Path dir) throws IOException {
    String file = write(dir, "dfa.json", Fixtures.threeEquivalentStates());
    Assertions.assertEquals(2, FSACommandLine.execute("minimise-dfa", List.of(file)).automaton().size());
    Assertions.assertEquals(4, FSACommandLine.execute("complete", List.of(file)).automaton().size());
    Assertions.assertEquals(4, FSACommandLine.execute("complement", List.of(file)).automaton().size());
    Assertions.assertEquals("deterministic: true\ncomplete: true\nconnected: true",
        FSACommandLine.execute("properties", List.of(file)).text());

    String nfa = write(dir, "nfa.json", Fixtures.endsWithAb());
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> FSACommandLine.execute("minimise-dfa", List.of(nfa)));
  }

  @Test
  void testEquivalentAndRegex(@TempDir Path dir) throws IOException {
    String nfa = write(dir, "nfa.json", Fixtures.endsWithAb());
    String dfa = write(dir, "dfa.json", PowersetDeterminizer.determinize(Fixtures.endsWithAb()));
    Assertions.assertEquals("equivalent: true", FSACommandLine.execute("equivalent", List.of(nfa, dfa)).text());
    Assertions.assertTrue(FSACommandLine.execute("EQUIVALENT", List.of(nfa, write(dir, "a.json", Fixtures.endsWithA())))
        .text().startsWith("equivalent: false\nreason: "));

    String regex = FSACommandLine.execute("to-regex", List.of(nfa)).text().split("\n")[0];
    Assertions.assertTrue(Equivalence.automatonRegexEquivalent(Fixtures.endsWithAb(), regex), regex);

    Automaton thompson = FSACommandLine.execute("from-regex", List.of("a|b")).automaton();
    Assertions.assertTrue(Equivalence.automatonRegexEquivalent(thompson, "b|a"));
    Assertions.assertEquals("a*", FSACommandLine.execute("simplify", List.of("a**")).text());
  }

  @Test
  void testSimulate(@TempDir Path dir) throws IOException {
    String dfa = write(dir, "dfa.json", Fixtures.endsWithA());
    Assertions.assertEquals("accepted\n[S0 -b-> S0, S0 -a-> S1]",
        FSACommandLine.execute("simulate", List.of(dfa, "ba")).text());
    Assertions.assertEquals("rejected", FSACommandLine.execute("simulate", List.of(dfa, "ab")).text());

    String nfa = write(dir, "nfa.json", Fixtures.endsWithAb());
    Assertions.assertEquals("accepted (1 paths)\n[S0 -a-> S1, S1 -b-> S2]",
        FSACommandLine.execute("simulate", List.of(nfa, "ab")).text());
    Assertions.assertTrue(FSACommandLine.execute("simulate", List.of(nfa, "ac")).text()
        .startsWith("rejected: Symbol 'c'"));

    String epsilon = write(dir, "epsilon.json", ThompsonConstruction.toEpsilonNFA("ε"));
    Assertions.assertEquals("accepted (1 paths)\n[q0 -ε-> q1]",
        FSACommandLine.execute("simulate", List.of(epsilon, "")).text());
  }

  @Test
  void testBadInvocations() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> FSACommandLine.execute("frobnicate", List.of("x")));
    Assertions.assertThrows(IllegalArgumentException.class, () -> FSACommandLine.execute("simplify", List.of()));
  }

  @Test
  void testMalformedFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("broken.json");
    Files.writeString(file, "{\"states\": [");
    InvalidAutomatonException e = Assertions.assertThrows(InvalidAutomatonException.class,
        () -> FSACommandLine.execute("trim", List.of(file.toString())));
    Assertions.assertTrue(e.getMessage().contains("malformed JSON in broken.json"), e.getMessage());
  }

  private static String write(Path dir, String name, Automaton a) throws IOException {
    File file = dir.resolve(name).toFile();
    FSAJson.write(a, file);
    return file.getPath();
  }
}
