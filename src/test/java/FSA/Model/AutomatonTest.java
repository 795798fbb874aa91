package FSA.Model;

import FSA.Fixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class AutomatonTest {
  @Test
  void testBuilderAddsSymbols() {
    Automaton a = Automaton.builder()
        .addStates("p", "q")
        .addTransition("p", "x", "q")
        .addEpsilonTransition("q", "p")
        .setStartingState("p")
        .addAcceptingState("q")
        .build();
    Assertions.assertEquals(Set.of("x"), a.getAlphabet()); // epsilon never joins the alphabet
    Assertions.assertEquals(Set.of("q"), a.getTransitions("p", "x"));
    Assertions.assertEquals(Set.of("p"), a.getTransitions("q", Automaton.EPSILON));
    Assertions.assertTrue(a.hasEpsilonTransitions());
    Assertions.assertEquals(2, a.transitionCount());
    Assertions.assertEquals(4, a.complexity());
    Assertions.assertEquals("q", a.getSuccessor("p", "x"));
    Assertions.assertNull(a.getSuccessor("q", "x"));
  }

  @Test
  void testEmpty() {
    Automaton empty = Automaton.empty();
    Assertions.assertTrue(empty.isEmpty());
    Assertions.assertEquals(0, empty.size());
    Assertions.assertNull(empty.getStartingState());
    Assertions.assertEquals(empty, Automaton.builder().build());
  }

  @Test
  void testToBuilderRoundTrip() {
    Automaton a = Fixtures.endsWithAb();
    Assertions.assertEquals(a, a.toBuilder().build());
    Assertions.assertEquals(a.hashCode(), a.toBuilder().build().hashCode());
    Assertions.assertNotEquals(a, a.toBuilder().addState("extra").build());
  }

  @Test
  void testFreshStateName() {
    AutomatonBuilder builder = Automaton.builder().addStates("DEAD", "DEAD_1");
    Assertions.assertEquals("DEAD_2", builder.freshStateName("DEAD"));
    Assertions.assertEquals("other", builder.freshStateName("other"));
    Assertions.assertTrue(builder.containsState("DEAD_1"));
  }

  @Test
  void testImmutable() {
    Automaton a = Fixtures.endsWithA();
    Assertions.assertThrows(UnsupportedOperationException.class, () -> a.getStates().add("S9"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> a.getAcceptingStates().clear());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> a.getTransitions().remove("S0"));
  }

  @Test
  void testValidation() {
    InvalidAutomatonException e = Assertions.assertThrows(InvalidAutomatonException.class,
        () -> Automaton.builder().addState("S0").addTransition("S0", "a", "S1").setStartingState("S0").build());
    Assertions.assertTrue(e.getMessage().contains("'S1' not in states list"), e.getMessage());

    e = Assertions.assertThrows(InvalidAutomatonException.class,
        () -> Automaton.builder().addState("S0").setStartingState("S9").build());
    Assertions.assertTrue(e.getMessage().contains("starting state"), e.getMessage());

    e = Assertions.assertThrows(InvalidAutomatonException.class,
        () -> Automaton.builder().addState("S0").build());
    Assertions.assertTrue(e.getMessage().contains("missing required key 'startingState'"), e.getMessage());

    e = Assertions.assertThrows(InvalidAutomatonException.class,
        () -> Automaton.builder().addState("S0").setStartingState("S0").addAcceptingState("S1").build());
    Assertions.assertTrue(e.getMessage().contains("accepting state 'S1'"), e.getMessage());

    Map<String, Map<String, Set<String>>> transitions = new LinkedHashMap<>();
    transitions.put("S0", Map.of("z", Set.of("S0")));
    e = Assertions.assertThrows(InvalidAutomatonException.class,
        () -> new Automaton(Set.of("S0"), Set.of("a"), transitions, "S0", Set.of()));
    Assertions.assertTrue(e.getMessage().contains("not in alphabet"), e.getMessage());

    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> new Automaton(Set.of("S0"), Set.of(Automaton.EPSILON), Map.of(), "S0", Set.of()));
    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> AutomatonValidator.requireDistinct("states", java.util.List.of("S0", "S0")));
  }
}
