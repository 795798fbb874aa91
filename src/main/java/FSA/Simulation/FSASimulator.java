package FSA.Simulation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import FSA.Model.Automaton;
import FSA.Model.FSAProperties;
import FSA.Model.NondeterministicAutomatonException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs input words through automata.
 * Strings are split into one-character symbols; use the list overloads for longer symbols.
 */
public class FSASimulator {
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private FSASimulator() {}

    /**
     * @return the path taken when the word is accepted, empty when it is rejected
     * @throws NondeterministicAutomatonException if the automaton is not deterministic
     */
    public static Optional<List<Step>> simulateDeterministic(Automaton a, String input) {
        return simulateDeterministic(a, symbols(input));
    }

    public static Optional<List<Step>> simulateDeterministic(Automaton a, List<String> input) {
        if (!FSAProperties.isDeterministic(a)) {
            throw new NondeterministicAutomatonException("deterministic simulation");
        }
        String current = a.getStartingState();
        if (current == null) {
            return Optional.empty();
        }
        final List<Step> path = new ArrayList<>(input.size());
        for (String symbol : input) {
            if (!a.getAlphabet().contains(symbol)) {
                return Optional.empty();
            }
            final String next = a.getSuccessor(current, symbol);
            if (next == null) {
                return Optional.empty();
            }
            path.add(new Step(current, symbol, next));
            current = next;
        }
        return a.isAccepting(current) ? Optional.of(path) : Optional.empty();
    }

    public static NFASimulationResult simulateNondeterministic(Automaton a, String input) {
        return simulateNondeterministic(a, symbols(input), DEFAULT_MAX_DEPTH);
    }

    /**
     * Collects every accepting path, epsilon moves included.
     *
     * @param maxDepth - longest path explored, in steps
     */
    public static NFASimulationResult simulateNondeterministic(Automaton a, List<String> input, int maxDepth) {
        final List<List<Step>> paths = new ArrayList<>();
        String reason = null;
        final Iterator<SimulationEvent> events = new Exploration(a, input, maxDepth);
        while (events.hasNext()) {
            final SimulationEvent event = events.next();
            if (event.type() == SimulationEvent.Type.ACCEPT) {
                paths.add(event.path());
            } else if (event.type() == SimulationEvent.Type.REJECT) {
                reason = event.reason();
            }
        }
        return paths.isEmpty() ? NFASimulationResult.rejected(reason) : NFASimulationResult.accepted(paths);
    }

    public static Stream<SimulationEvent> stream(Automaton a, String input) {
        return stream(a, symbols(input), DEFAULT_MAX_DEPTH);
    }

    /**
     * Lazily explores the runs of {@code a} on {@code input} depth first. Nothing is computed until
     * the stream is consumed.
     */
    public static Stream<SimulationEvent> stream(Automaton a, List<String> input, int maxDepth) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(new Exploration(a, input, maxDepth),
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    static List<String> symbols(String input) {
        return input.codePoints().mapToObj(Character::toString).collect(Collectors.toList());
    }

    /**
     * Depth-first search over (state, position) configurations. Each frame carries the configurations
     * already visited on its own path, so epsilon cycles are never re-entered.
     */
    private static final class Exploration implements Iterator<SimulationEvent> {
        private final Automaton a;
        private final List<String> input;
        private final int maxDepth;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Deque<SimulationEvent> pending = new ArrayDeque<>();
        private boolean anyAccepted;
        private boolean truncated;
        private boolean finished;

        Exploration(Automaton a, List<String> input, int maxDepth) {
            if (maxDepth <= 0) {
                throw new IllegalArgumentException("maxDepth must be a positive integer");
            }
            this.a = a;
            this.input = input;
            this.maxDepth = maxDepth;

            final String rejection = precheck();
            if (rejection != null) {
                pending.add(SimulationEvent.reject(rejection));
                finished = true;
            } else {
                final String start = a.getStartingState();
                stack.push(new Frame(start, 0, List.of(), Set.of(key(start, 0))));
            }
        }

        private @Nullable String precheck() {
            if (a.getStartingState() == null) {
                return "Automaton has no starting state";
            }
            for (int i = 0; i < input.size(); i++) {
                if (!a.getAlphabet().contains(input.get(i))) {
                    return "Symbol '" + input.get(i) + "' at position " + i + " is not in alphabet";
                }
            }
            return null;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !finished) {
                advance();
            }
            return !pending.isEmpty();
        }

        @Override
        public SimulationEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void advance() {
            if (stack.isEmpty()) {
                finished = true;
                if (!anyAccepted) {
                    pending.add(SimulationEvent.reject(truncated
                            ? "No accepting paths found within " + maxDepth + " steps"
                            : "No accepting paths found"));
                }
                return;
            }
            final Frame frame = stack.pop();
            if (!frame.path().isEmpty()) {
                pending.add(SimulationEvent.step(frame.path()));
            }
            if (frame.position() == input.size() && a.isAccepting(frame.state())) {
                anyAccepted = true;
                pending.add(SimulationEvent.accept(frame.path()));
            }
            if (frame.path().size() >= maxDepth) {
                truncated = true;
                return;
            }

            // pushed in reverse so that epsilon moves are explored first, then symbol moves
            final List<Frame> successors = new ArrayList<>();
            for (String target : a.getTransitions(frame.state(), Automaton.EPSILON)) {
                final Frame f = frame.extend(Automaton.EPSILON_LABEL, target, frame.position());
                if (f != null) {
                    successors.add(f);
                }
            }
            if (frame.position() < input.size()) {
                final String symbol = input.get(frame.position());
                for (String target : a.getTransitions(frame.state(), symbol)) {
                    final Frame f = frame.extend(symbol, target, frame.position() + 1);
                    if (f != null) {
                        successors.add(f);
                    }
                }
            }
            for (int i = successors.size() - 1; i >= 0; i--) {
                stack.push(successors.get(i));
            }
        }
    }

    private static String key(String state, int position) {
        return position + ":" + state;
    }

    private record Frame(String state, int position, List<Step> path, Set<String> seen) {

        // null when the target configuration was already visited on this path
        @Nullable Frame extend(String symbol, String target, int nextPosition) {
            final String k = key(target, nextPosition);
            if (seen.contains(k)) {
                return null;
            }
            final List<Step> nextPath = new ArrayList<>(path.size() + 1);
            nextPath.addAll(path);
            nextPath.add(new Step(state, symbol, target));
            final Set<String> nextSeen = new HashSet<>(seen);
            nextSeen.add(k);
            return new Frame(target, nextPosition, nextPath, nextSeen);
        }
    }
}
