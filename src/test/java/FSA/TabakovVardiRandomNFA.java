package FSA;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import net.automatalib.common.util.random.RandomUtil;

import java.util.List;
import java.util.Random;

public class TabakovVardiRandomNFA {
    static final List<String> BINARY = List.of("a", "b");

    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param td
     *      transition density, in [0,size]
     * @param ad
     *      acceptance density, in (0,1]. 0.5 is the usual value
     * @param alphabet
     *      alphabet
     * @return
     *      a random NFA with states s0..s(size-1), not necessarily connected
     */
    public static Automaton generateNFA(Random r, int size, float td, float ad, List<String> alphabet) {
        return generateNFA(r, size, Math.round(td * size), Math.max(1, Math.round(ad * size)), alphabet);
    }

    /**
     * Generate random NFA, with fixed number of accept states and edges (per letter).
     */
    public static Automaton generateNFA(Random r, int size, int edgeNum, int acceptNum, List<String> alphabet) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size*size;

        final AutomatonBuilder builder = Automaton.builder();
        alphabet.forEach(builder::addSymbol);
        for (int i = 0; i < size; i++) {
            builder.addState(name(i));
        }
        // per the paper, the first state is always initial and accepting
        builder.setStartingState(name(0)).addAcceptingState(name(0));

        // exactly acceptNum-1 further final states, from [1,size)
        if (acceptNum > 1) {
            for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
                builder.addAcceptingState(name(f));
            }
        }

        // For each letter, add edgeNum transitions.
        for (String a : alphabet) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size*size)) {
                builder.addTransition(name(edgeIndex / size), a, name(edgeIndex % size));
            }
        }
        return builder.build();
    }

    static String name(int i) {
        return "s" + i;
    }

    public static Automaton getRandomAutomaton(int randomSeed, int size) {
        final float td = 1.25f;
        final float ad = 0.5f;
        return generateNFA(new Random(randomSeed), size, td, ad, BINARY);
    }

    public static Automaton getRandomTrimAutomaton(int randomSeed, int size) {
        return NFATrim.trim(getRandomAutomaton(randomSeed, size));
    }
}
