package FSA.Regex;

import FSA.Equivalence;
import FSA.Model.Automaton;
import FSA.Simulation.FSASimulator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class ThompsonConstructionTest {
  @Test
  void testConcatenation() {
    Automaton nfa = ThompsonConstruction.toEpsilonNFA("ab");
    Assertions.assertEquals(Set.of("q0", "q1", "q2", "q3"), nfa.getStates());
    Assertions.assertEquals("q0", nfa.getStartingState());
    Assertions.assertEquals(Set.of("q3"), nfa.getAcceptingStates());
    Assertions.assertEquals(Set.of("q1"), nfa.getTransitions("q0", "a"));
    Assertions.assertEquals(Set.of("q2"), nfa.getTransitions("q1", Automaton.EPSILON));
    Assertions.assertEquals(Set.of("a", "b"), nfa.getAlphabet());
  }

  @Test
  void testStar() {
    Automaton nfa = ThompsonConstruction.toEpsilonNFA("a*");
    Assertions.assertEquals(4, nfa.size());
    Assertions.assertEquals("q2", nfa.getStartingState());
    Assertions.assertEquals(Set.of("q0", "q3"), nfa.getTransitions("q2", Automaton.EPSILON));
    Assertions.assertEquals(Set.of("q3", "q0"), nfa.getTransitions("q1", Automaton.EPSILON));
  }

  @Test
  void testLanguages() {
    Assertions.assertTrue(FSASimulator.simulateNondeterministic(ThompsonConstruction.toEpsilonNFA("a*"), "").accepted());
    Assertions.assertTrue(FSASimulator.simulateNondeterministic(ThompsonConstruction.toEpsilonNFA("a*"), "aaa").accepted());
    Assertions.assertFalse(FSASimulator.simulateNondeterministic(ThompsonConstruction.toEpsilonNFA("a+"), "").accepted());
    Assertions.assertTrue(FSASimulator.simulateNondeterministic(ThompsonConstruction.toEpsilonNFA("a?b"), "b").accepted());
    Assertions.assertFalse(FSASimulator.simulateNondeterministic(ThompsonConstruction.toEpsilonNFA("a?b"), "aab").accepted());

    Assertions.assertTrue(Equivalence.regexEquivalent("a?", "ε|a"));
    Assertions.assertTrue(Equivalence.regexEquivalent("a*+", "a*"));
    Assertions.assertTrue(Equivalence.regexEquivalent("a()b", "ab"));
    Assertions.assertTrue(Equivalence.regexEquivalent("a|", "a?"));
    Assertions.assertTrue(Equivalence.areEquivalent(ThompsonConstruction.toEpsilonNFA("∅"), Automaton.empty()));
    Assertions.assertTrue(Equivalence.regexEquivalent("a∅|b", "b"));
  }

  @Test
  void testValidate() {
    Assertions.assertTrue(ThompsonConstruction.validate("(a|b)*c").valid());
    Assertions.assertNull(ThompsonConstruction.validate("").error());

    ThompsonConstruction.RegexValidation invalid = ThompsonConstruction.validate("a(b");
    Assertions.assertFalse(invalid.valid());
    Assertions.assertEquals("Invalid regex 'a(b': Expected ')' at position 3", invalid.error());

    Assertions.assertThrows(RegexSyntaxException.class, () -> ThompsonConstruction.toEpsilonNFA("+"));
  }
}
