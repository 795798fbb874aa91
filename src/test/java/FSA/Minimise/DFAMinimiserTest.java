package FSA.Minimise;

import FSA.Equivalence;
import FSA.Fixtures;
import FSA.PowersetDeterminizer;
import FSA.Regex.ThompsonConstruction;
import FSA.Model.Automaton;
import FSA.Model.NondeterministicAutomatonException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class DFAMinimiserTest {
  @Test
  void testAlreadyMinimal() {
    Automaton minimal = DFAMinimiser.minimise(Fixtures.endsWithA());
    Assertions.assertEquals(2, minimal.size());
    Assertions.assertEquals(Set.of("S0", "S1"), minimal.getStates());
  }

  @Test
  void testEquivalentStatesCollapse() {
    Automaton minimal = DFAMinimiser.minimise(Fixtures.threeEquivalentStates());
    Assertions.assertEquals(2, minimal.size());
    Assertions.assertEquals("S0_S1_S2", minimal.getStartingState());
    Assertions.assertEquals(Set.of("S3"), minimal.getAcceptingStates());
    Assertions.assertEquals("S0_S1_S2", minimal.getSuccessor("S0_S1_S2", "a"));
    Assertions.assertEquals("S3", minimal.getSuccessor("S0_S1_S2", "b"));
    Assertions.assertTrue(Equivalence.areEquivalent(Fixtures.threeEquivalentStates(), minimal));
  }

  @Test
  void testIdempotent() {
    Automaton dfa = PowersetDeterminizer.determinize(Fixtures.thirdFromEndIsA());
    Automaton once = DFAMinimiser.minimise(dfa);
    Automaton twice = DFAMinimiser.minimise(once);
    Assertions.assertEquals(8, once.size());
    Assertions.assertEquals(once.size(), twice.size());
    Assertions.assertTrue(Equivalence.areEquivalent(once, twice));
  }

  @Test
  void testPartialDFA() {
    // S0 accepts "a" but S1 does not, although both accept the empty word
    Automaton distinct = Automaton.builder()
        .addState("S0", true)
        .addState("S1", true)
        .addTransition("S0", "a", "S1")
        .setStartingState("S0")
        .build();
    Assertions.assertEquals(2, DFAMinimiser.minimise(distinct).size());

    Automaton mergeable = Automaton.builder()
        .addState("S0")
        .addState("S1", true)
        .addState("S2", true)
        .addTransition("S0", "a", "S1")
        .addTransition("S0", "b", "S2")
        .setStartingState("S0")
        .build();
    Automaton minimal = DFAMinimiser.minimise(mergeable);
    Assertions.assertEquals(2, minimal.size());
    Assertions.assertEquals(Set.of("S1_S2"), minimal.getAcceptingStates());
  }

  @Test
  void testDegenerate() {
    Assertions.assertTrue(DFAMinimiser.minimise(Automaton.empty()).isEmpty());

    Automaton noSymbols = Automaton.builder()
        .addState("S0", true)
        .addState("S1", true)
        .setStartingState("S0")
        .build();
    Assertions.assertEquals(1, DFAMinimiser.minimise(noSymbols).size());

    Assertions.assertThrows(NondeterministicAutomatonException.class,
        () -> DFAMinimiser.minimise(Fixtures.endsWithAb()));
  }

  @Test
  void testRejectsEpsilonOnlyAutomaton() {
    Automaton epsilon = ThompsonConstruction.toEpsilonNFA("ε");
    Assertions.assertThrows(NondeterministicAutomatonException.class, () -> DFAMinimiser.minimise(epsilon));
  }
}
