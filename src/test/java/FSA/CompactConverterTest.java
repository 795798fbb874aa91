package FSA;

import FSA.Model.Automaton;
import FSA.Model.NondeterministicAutomatonException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class CompactConverterTest {
  @Test
  void testToCompactNFA() {
    Automaton nfa = Fixtures.endsWithAb();
    CompactNFA<String> compact = CompactConverter.toCompactNFA(nfa);
    Assertions.assertEquals(3, compact.size());
    Assertions.assertEquals(1, compact.getInitialStates().size());
    Assertions.assertTrue(compact.accepts(List.of("a", "b")));
    Assertions.assertFalse(compact.accepts(List.of("b", "a")));

    Automaton back = CompactConverter.fromNFA(compact, compact.getInputAlphabet(), "c");
    Assertions.assertEquals(List.of("c0", "c1", "c2"), List.copyOf(back.getStates()));
    Assertions.assertTrue(Equivalence.areEquivalent(nfa, back));
  }

  @Test
  void testRejectsEpsilon() {
    Automaton epsilon = Automaton.builder().addStates("p", "q")
        .addEpsilonTransition("p", "q").setStartingState("p").build();
    Assertions.assertThrows(IllegalArgumentException.class, () -> CompactConverter.toCompactNFA(epsilon));
    Assertions.assertThrows(NondeterministicAutomatonException.class,
        () -> CompactConverter.toCompactDFA(Fixtures.endsWithAb()));
  }

  @Test
  void testDFARoundTrip() {
    Automaton dfa = Fixtures.endsWithA();
    CompactDFA<String> compact = CompactConverter.toCompactDFA(dfa);
    Alphabet<String> alphabet = compact.getInputAlphabet();
    CompactDFA<String> oracle = NFAs.determinize(CompactConverter.toCompactNFA(dfa), alphabet);
    Assertions.assertTrue(Automata.testEquivalence(compact, oracle, alphabet));

    Automaton back = CompactConverter.fromDFA(compact, alphabet, "d");
    Assertions.assertTrue(Equivalence.areEquivalent(dfa, back));
  }

  @Test
  void testMultipleInitialStates() {
    CompactNFA<String> compact = CompactConverter.toCompactNFA(Fixtures.endsWithAb());
    compact.setInitial(2, true); // S2 accepts the empty word
    Automaton merged = CompactConverter.fromNFA(compact, compact.getInputAlphabet(), "m");
    Assertions.assertEquals("minit", merged.getStartingState());
    Assertions.assertTrue(merged.isAccepting("minit"));
    Assertions.assertTrue(Equivalence.automatonRegexEquivalent(merged, "(a|b)*ab|ε"));

    CompactNFA<String> none = new CompactNFA<>(compact.getInputAlphabet());
    none.addState(true);
    Assertions.assertTrue(CompactConverter.fromNFA(none, none.getInputAlphabet(), "n").isEmpty());
  }
}
