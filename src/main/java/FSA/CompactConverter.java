package FSA;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.FSAProperties;
import FSA.Model.NondeterministicAutomatonException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Bridges named {@link Automaton} values and AutomataLib's integer-addressed compact automata.
 * State {@code i} of a compact automaton is the {@code i}-th state in the automaton's state order.
 */
public final class CompactConverter {

    private CompactConverter() {}

    public static Alphabet<String> alphabetOf(Automaton a) {
        return Alphabets.fromCollection(a.getAlphabet());
    }

    /**
     * @param a - epsilon-free automaton
     * @return compact NFA over {@link #alphabetOf(Automaton)}
     */
    public static CompactNFA<String> toCompactNFA(Automaton a) {
        if (a.hasEpsilonTransitions()) {
            throw new IllegalArgumentException("Epsilon transitions must be removed before conversion");
        }
        final Alphabet<String> alphabet = alphabetOf(a);
        final CompactNFA<String> out = new CompactNFA<>(alphabet, a.size());
        final List<String> names = new ArrayList<>(a.getStates());
        for (String s : names) {
            out.addState(a.isAccepting(s));
        }
        if (a.getStartingState() != null) {
            out.setInitial(names.indexOf(a.getStartingState()), true);
        }
        for (int i = 0; i < names.size(); i++) {
            for (String symbol : alphabet) {
                for (String t : a.getTransitions(names.get(i), symbol)) {
                    out.addTransition(i, symbol, names.indexOf(t));
                }
            }
        }
        return out;
    }

    public static CompactDFA<String> toCompactDFA(Automaton a) {
        if (!FSAProperties.isDeterministic(a)) {
            throw new NondeterministicAutomatonException("Conversion to a compact DFA");
        }
        final Alphabet<String> alphabet = alphabetOf(a);
        final CompactDFA<String> out = new CompactDFA<>(alphabet, a.size());
        final List<String> names = new ArrayList<>(a.getStates());
        for (String s : names) {
            if (s.equals(a.getStartingState())) {
                out.addInitialState(a.isAccepting(s));
            } else {
                out.addState(a.isAccepting(s));
            }
        }
        // addInitialState appends like addState, so indices still follow the name order
        for (int i = 0; i < names.size(); i++) {
            for (String symbol : alphabet) {
                final String t = a.getSuccessor(names.get(i), symbol);
                if (t != null) {
                    out.setTransition(i, symbol, Integer.valueOf(names.indexOf(t)));
                }
            }
        }
        return out;
    }

    /**
     * Converts back to a named automaton; states are named {@code prefix + index}.
     * Several initial states are merged into a fresh start state that copies their outgoing
     * transitions and acceptance; no initial state yields the empty automaton.
     */
    public static <S> Automaton fromNFA(NFA<S, String> nfa, Alphabet<String> alphabet, String prefix) {
        final Set<S> inits = nfa.getInitialStates();
        if (inits.isEmpty()) {
            return Automaton.empty();
        }
        final List<S> order = new ArrayList<>(nfa.getStates());
        final AutomatonBuilder builder = Automaton.builder();
        alphabet.forEach(builder::addSymbol);
        for (int i = 0; i < order.size(); i++) {
            builder.addState(prefix + i, nfa.isAccepting(order.get(i)));
        }
        for (int i = 0; i < order.size(); i++) {
            for (String symbol : alphabet) {
                for (S t : nfa.getTransitions(order.get(i), symbol)) {
                    builder.addTransition(prefix + i, symbol, prefix + order.indexOf(t));
                }
            }
        }
        if (inits.size() == 1) {
            builder.setStartingState(prefix + order.indexOf(inits.iterator().next()));
            return builder.build();
        }
        final String start = builder.freshStateName(prefix + "init");
        boolean accepting = false;
        builder.addState(start);
        for (S init : inits) {
            accepting |= nfa.isAccepting(init);
            for (String symbol : alphabet) {
                for (S t : nfa.getTransitions(init, symbol)) {
                    builder.addTransition(start, symbol, prefix + order.indexOf(t));
                }
            }
        }
        if (accepting) {
            builder.addAcceptingState(start);
        }
        return builder.setStartingState(start).build();
    }

    public static <S> Automaton fromDFA(DFA<S, String> dfa, Alphabet<String> alphabet, String prefix) {
        return fromNFA(dfa, alphabet, prefix);
    }
}
