package FSA;

import FSA.Model.Automaton;
import FSA.Model.FSAProperties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class NFATrimTest {
  @Test
  void testEmpty() {
    Automaton empty = Automaton.empty();
    Assertions.assertEquals(0, NFATrim.trim(empty).size());
    Assertions.assertEquals(0, NFATrim.reverse(empty, "start").size());
    Assertions.assertEquals(0, NFATrim.bisim(empty).size());
    Assertions.assertSame(empty, NFATrim.removeEpsilon(empty));
  }

  @Test
  void testSmallTrim() {
    Automaton a = Automaton.builder()
        .addStates("S0", "S1", "S2", "S3")
        .addTransition("S0", "a", "S1")
        .addTransition("S0", "b", "S3") // S3 is dead
        .addTransition("S2", "a", "S1") // S2 is unreachable
        .setStartingState("S0")
        .addAcceptingState("S1")
        .build();

    Automaton reachable = NFATrim.removeUnreachable(a);
    Assertions.assertEquals(Set.of("S0", "S1", "S3"), reachable.getStates());
    Assertions.assertEquals(Set.of("a", "b"), reachable.getAlphabet()); // alphabet kept

    Automaton trimmed = NFATrim.trim(a);
    Assertions.assertEquals(Set.of("S0", "S1"), trimmed.getStates());
    Assertions.assertEquals(Set.of("a"), trimmed.getAlphabet()); // unused symbol pruned
    Assertions.assertTrue(Equivalence.areEquivalent(a, trimmed));

    Assertions.assertSame(trimmed, NFATrim.trim(trimmed)); // idempotent, nothing left to remove
  }

  @Test
  void testDeadStart() {
    Automaton a = Automaton.builder()
        .addStates("S0", "S1")
        .addTransition("S0", "a", "S1")
        .setStartingState("S0")
        .build();
    Assertions.assertTrue(NFATrim.trim(a).isEmpty());
  }

  @Test
  void testReverse() {
    Automaton reversed = NFATrim.reverse(Fixtures.endsWithAb(), "S0"); // name taken, gets suffixed
    Assertions.assertEquals(4, reversed.size());
    Assertions.assertEquals("S0_1", reversed.getStartingState());
    Assertions.assertEquals(Set.of("S0"), reversed.getAcceptingStates());
    Assertions.assertEquals(Set.of("S2"), reversed.getTransitions("S0_1", Automaton.EPSILON));
    Assertions.assertEquals(Set.of("S1"), reversed.getTransitions("S2", "b"));
    Assertions.assertEquals(Set.of("S0"), reversed.getTransitions("S1", "a"));

    // reversal of "ends with ab" accepts words starting with "ba"
    Assertions.assertTrue(Equivalence.automatonRegexEquivalent(reversed, "ba(a|b)*"));
  }

  @Test
  void testEpsilonClosure() {
    Automaton a = Automaton.builder()
        .addStates("p", "q", "r", "s")
        .addEpsilonTransition("p", "q")
        .addEpsilonTransition("q", "r")
        .addEpsilonTransition("r", "p")
        .addTransition("r", "a", "s")
        .setStartingState("p")
        .addAcceptingState("s")
        .build();
    Assertions.assertEquals(Set.of("p", "q", "r"), NFATrim.epsilonClosure(a, List.of("p")));
    Assertions.assertEquals(Set.of("s"), NFATrim.epsilonClosure(a, List.of("s")));

    Automaton free = NFATrim.removeEpsilon(a);
    Assertions.assertFalse(free.hasEpsilonTransitions());
    Assertions.assertEquals(Set.of("s"), free.getTransitions("p", "a"));
    Assertions.assertTrue(Equivalence.areEquivalent(a, free));
  }

  @Test
  void testRemoveEpsilonAcceptance() {
    Automaton a = Automaton.builder()
        .addStates("p", "q")
        .addSymbol("a")
        .addEpsilonTransition("p", "q")
        .setStartingState("p")
        .addAcceptingState("q")
        .build();
    Automaton free = NFATrim.removeEpsilon(a);
    Assertions.assertTrue(free.isAccepting("p")); // closure of p meets q
    Assertions.assertTrue(FSAProperties.isDeterministic(free));
  }

  @Test
  void testBisim() {
    // two interchangeable branches collapse
    Automaton a = Automaton.builder()
        .addStates("S0", "S1", "S2", "S3")
        .addTransition("S0", "a", "S1")
        .addTransition("S0", "a", "S2")
        .addTransition("S1", "b", "S3")
        .addTransition("S2", "b", "S3")
        .setStartingState("S0")
        .addAcceptingState("S3")
        .build();
    Automaton reduced = NFATrim.bisim(a);
    Assertions.assertEquals(3, reduced.size());
    Assertions.assertTrue(Equivalence.areEquivalent(a, reduced));

    Automaton minimal = Fixtures.endsWithA();
    Assertions.assertSame(minimal, NFATrim.bisim(minimal)); // no difference
  }
}
