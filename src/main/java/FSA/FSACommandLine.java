package FSA;

import FSA.Minimise.DFAMinimiser;
import FSA.Minimise.MinimisationConfig;
import FSA.Minimise.MinimisationResult;
import FSA.Minimise.NFAMinimiser;
import FSA.Model.Automaton;
import FSA.Model.Cancellation;
import FSA.Model.FSAProperties;
import FSA.Regex.FSAToRegex;
import FSA.Regex.RegexConversionResult;
import FSA.Regex.RegexSimplifier;
import FSA.Regex.ThompsonConstruction;
import FSA.Simulation.FSASimulator;
import FSA.Simulation.NFASimulationResult;
import FSA.Simulation.Step;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class FSACommandLine {
  public static void main(String[] args) {
    String filename = null;
    int timeoutSeconds = 0;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        NFAMinimiser.DEBUG = true;
      } else if ("--output".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --output");
          printUsageAndExit(); // exits
        }
        filename = args[++i]; // consume the value
      } else if ("--timeout".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length) {
          System.err.println("Missing value for --timeout");
          printUsageAndExit();
        }
        try {
          timeoutSeconds = Integer.parseInt(args[++i]);
        } catch (NumberFormatException e) {
          System.err.println("Invalid value for --timeout: " + args[i]);
          printUsageAndExit();
        }
      } else if (arg.startsWith("-") && arg.length() > 1) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2 || positional.size() > 3) {
      printUsageAndExit();
    }

    String operation = positional.get(0);
    Cancellation cancellation = new Cancellation();
    ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    if (timeoutSeconds > 0) {
      cancellation.setBackref(timer.schedule(cancellation::setInterrupted, timeoutSeconds, TimeUnit.SECONDS));
    }
    long before = System.currentTimeMillis();
    final Outcome outcome;
    try {
      outcome = execute(operation, positional.subList(1, positional.size()), cancellation);
    } catch (IllegalArgumentException e) {
      System.err.println(operation + " failed: " + e.getMessage());
      System.exit(1);
      return;
    } finally {
      cancellation.cancel();
      timer.shutdownNow();
    }
    long after = System.currentTimeMillis();
    System.out.println(outcome.text());
    System.out.println(operation + " duration: " + ((after - before) / 1000f) + "s");

    if (filename != null) {
      if (outcome.automaton() == null) {
        System.err.println(operation + " does not produce an automaton; nothing written");
      } else {
        writeJsonFile(filename, outcome.automaton());
      }
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "FSA [--debug] [--timeout <seconds>] [--output <JSON output file>] <operation> <JSON file> [<JSON file>|<regex>|<input>]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--timeout <seconds>] : Stop NFA minimisation after the given time, keeping the best verified result");
    System.out.println("[--output <JSON output file>] : Write the resulting automaton to the specified file");
    System.out.println();
    System.out.println("<operation> : one of the choices below:");
    System.out.println("  properties <file>: determinism, completeness and connectivity.");
    System.out.println("  trim <file>: remove unreachable and dead states.");
    System.out.println("  determinize <file>: subset construction.");
    System.out.println("  complete <file>: add a dead state for missing DFA transitions.");
    System.out.println("  complement <file>: complement of a DFA.");
    System.out.println("  minimise-dfa <file>: partition-refinement DFA minimisation.");
    System.out.println("  minimise-nfa <file>: verified NFA minimisation pipeline.");
    System.out.println("  equivalent <file> <file>: language equivalence.");
    System.out.println("  to-regex <file>: state elimination with verified simplification.");
    System.out.println("  from-regex <regex>: Thompson construction.");
    System.out.println("  simplify <regex>: AST regex simplification.");
    System.out.println("  simulate <file> <input>: run a word through the automaton.");
    System.out.println();
    System.out.println("<JSON file> : {states, alphabet, transitions, startingState, acceptingStates}");
    System.exit(0);
  }

  /**
   * Result of an operation: printable text, plus the automaton it produced if any.
   */
  record Outcome(String text, @Nullable Automaton automaton) {
    static Outcome of(Automaton a) {
      return new Outcome(FSAJson.write(a), a);
    }

    static Outcome text(String text) {
      return new Outcome(text, null);
    }
  }

  static Outcome execute(String operation, List<String> args) {
    return execute(operation, args, Cancellation.none());
  }

  /**
   * Choose operation to run.
   * @param operation - operation passed in from command-line
   * @param args - remaining positional arguments
   * @param cancellation - interrupts NFA minimisation between stages
   * @return - printable result
   */
  static Outcome execute(String operation, List<String> args, Cancellation cancellation) {
    return switch (operation.toLowerCase()) {
      case "properties" -> {
        FSAProperties.PropertyReport report = FSAProperties.checkAll(load(args, 0));
        yield Outcome.text("deterministic: " + report.deterministic()
            + "\ncomplete: " + report.complete()
            + "\nconnected: " + report.connected());
      }
      case "trim" -> Outcome.of(NFATrim.trim(load(args, 0)));
      case "determinize" -> Outcome.of(PowersetDeterminizer.determinize(load(args, 0)));
      case "complete" -> Outcome.of(PowersetDeterminizer.complete(load(args, 0)));
      case "complement" -> Outcome.of(PowersetDeterminizer.complement(load(args, 0)));
      case "minimise-dfa" -> Outcome.of(DFAMinimiser.minimise(load(args, 0)));
      case "minimise-nfa" -> minimiseNFA(load(args, 0), cancellation);
      case "equivalent" -> {
        Equivalence.EquivalenceResult result = Equivalence.check(load(args, 0), load(args, 1));
        yield Outcome.text("equivalent: " + result.equivalent()
            + (result.equivalent() ? "" : "\nreason: " + result.reason()));
      }
      case "to-regex" -> {
        RegexConversionResult result = FSAToRegex.convert(load(args, 0));
        yield Outcome.text(result.regex()
            + "\nstates: " + result.originalStates() + " -> " + result.minimisedStates()
            + "\nverification: " + result.verification().strategy());
      }
      case "from-regex" -> Outcome.of(ThompsonConstruction.toEpsilonNFA(argument(args, 0)));
      case "simplify" -> Outcome.text(RegexSimplifier.simplify(argument(args, 0)));
      case "simulate" -> simulate(load(args, 0), args.size() > 1 ? args.get(1) : "");
      default -> throw new IllegalArgumentException("Unexpected operation choice: " + operation);
    };
  }

  private static Outcome minimiseNFA(Automaton nfa, Cancellation cancellation) {
    MinimisationResult result = new NFAMinimiser(MinimisationConfig.defaults(), cancellation).run(nfa);
    System.out.println("Original NFA size: " + result.originalStates());
    System.out.println("Stages: " + String.join(", ", result.stages()));
    System.out.println(result.method() + " minimised NFA size: " + result.finalStates());
    return Outcome.of(result.nfa());
  }

  private static Outcome simulate(Automaton a, String input) {
    if (FSAProperties.isDeterministic(a)) {
      Optional<List<Step>> path = FSASimulator.simulateDeterministic(a, input);
      return Outcome.text(path.map(steps -> "accepted\n" + formatPath(steps)).orElse("rejected"));
    }
    NFASimulationResult result = FSASimulator.simulateNondeterministic(a, input);
    if (!result.accepted()) {
      return Outcome.text("rejected: " + result.rejectionReason());
    }
    StringBuilder sb = new StringBuilder("accepted (" + result.paths().size() + " paths)");
    for (List<Step> path : result.paths()) {
      sb.append('\n').append(formatPath(path));
    }
    return Outcome.text(sb.toString());
  }

  private static String formatPath(List<Step> path) {
    List<String> steps = new ArrayList<>(path.size());
    for (Step step : path) {
      steps.add(step.toString());
    }
    return "[" + String.join(", ", steps) + "]";
  }

  private static String argument(List<String> args, int index) {
    if (index >= args.size()) {
      throw new IllegalArgumentException("Missing argument " + (index + 1));
    }
    return args.get(index);
  }

  private static Automaton load(List<String> args, int index) {
    try {
      return FSAJson.read(new File(argument(args, index)));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void writeJsonFile(String filename, Automaton a) {
    System.out.println("Writing to file: " + filename);
    try {
      FSAJson.write(a, new File(filename));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
