package FSA.Regex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Algebraic regex simplification. A textual pass collapses trivially redundant notation, then the
 * syntax tree is rewritten bottom-up to a fixpoint with language-preserving rules only.
 * Results are not trusted blindly: {@link FSAToRegex#verify} checks them against an automaton.
 */
public class RegexSimplifier {
    public static final int DEFAULT_MAX_ITERATIONS = 50;
    public static final int DEFAULT_MAX_COMPLEXITY = 5000;

    private static final int PATTERN_ROUNDS = 5;

    private static final Pattern EMPTY_GROUP = Pattern.compile("\\(\\)[*+?]*");
    private static final Pattern EPSILON_POSTFIX = Pattern.compile("ε[*+?]+");
    private static final Pattern SINGLE_SYMBOL_GROUP = Pattern.compile("\\(([^()|*+?])\\)");
    private static final Pattern STACKED_POSTFIX = Pattern.compile("[*+?]{2,}");

    private final int maxIterations;
    private final int maxComplexity;

    public RegexSimplifier(int maxIterations, int maxComplexity) {
        this.maxIterations = maxIterations;
        this.maxComplexity = maxComplexity;
    }

    public static String simplify(String regex) {
        return new RegexSimplifier(DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_COMPLEXITY).run(regex);
    }

    /**
     * @return the simplified regex; inputs longer than the complexity bound and unparsable inputs
     *         are returned unchanged
     */
    public String run(String regex) {
        if (regex.isEmpty()) {
            return String.valueOf(RegexNode.EPSILON);
        }
        if (regex.length() > maxComplexity) {
            return regex;
        }
        RegexNode ast;
        try {
            ast = RegexASTParser.parse(textualPass(regex));
        } catch (RegexSyntaxException e) {
            return regex;
        }
        for (int i = 0; i < maxIterations; i++) {
            RegexNode next = rewrite(ast);
            for (int round = 0; round < PATTERN_ROUNDS; round++) {
                final RegexNode patterned = concatPatterns(next);
                if (patterned.equals(next)) {
                    break;
                }
                next = patterned;
            }
            final boolean stable = equivalent(next, ast);
            ast = next;
            if (stable) {
                break;
            }
        }
        return ast.toRegex();
    }

    /**
     * Substring rewrites that hold in any context: {@code ()} and starred/plussed/optional epsilon
     * become {@code ε}, a parenthesized single symbol loses its parentheses, and stacked postfix
     * operators collapse to the dominant one.
     */
    static String textualPass(String regex) {
        String previous;
        String current = regex;
        do {
            previous = current;
            current = EMPTY_GROUP.matcher(current).replaceAll("ε");
            current = EPSILON_POSTFIX.matcher(current).replaceAll("ε");
            current = SINGLE_SYMBOL_GROUP.matcher(current).replaceAll("$1");
            current = STACKED_POSTFIX.matcher(current).replaceAll(m -> String.valueOf(dominant(m.group())));
        } while (!current.equals(previous));
        return current;
    }

    // star dominates plus dominates optional; plus with optional is star
    private static char dominant(String operators) {
        final boolean star = operators.indexOf('*') >= 0;
        final boolean plus = operators.indexOf('+') >= 0;
        final boolean optional = operators.indexOf('?') >= 0;
        if (star || (plus && optional)) {
            return '*';
        }
        return plus ? '+' : '?';
    }

    /**
     * Structural equality, unions compared up to commutation.
     */
    static boolean equivalent(RegexNode a, RegexNode b) {
        if (a.equals(b)) {
            return true;
        }
        if (a instanceof RegexNode.Union && b instanceof RegexNode.Union) {
            final RegexNode.Union u = (RegexNode.Union) a;
            final RegexNode.Union v = (RegexNode.Union) b;
            return (equivalent(u.left(), v.left()) && equivalent(u.right(), v.right()))
                    || (equivalent(u.left(), v.right()) && equivalent(u.right(), v.left()));
        }
        return false;
    }

    static RegexNode rewrite(RegexNode node) {
        if (node instanceof RegexNode.EmptyGroup) {
            return new RegexNode.Epsilon();
        } else if (node instanceof RegexNode.Union) {
            final RegexNode.Union u = (RegexNode.Union) node;
            return union(rewrite(u.left()), rewrite(u.right()));
        } else if (node instanceof RegexNode.Concat) {
            final RegexNode.Concat c = (RegexNode.Concat) node;
            return concat(rewrite(c.left()), rewrite(c.right()));
        } else if (node instanceof RegexNode.Star) {
            return star(rewrite(((RegexNode.Star) node).inner()));
        } else if (node instanceof RegexNode.Plus) {
            return plus(rewrite(((RegexNode.Plus) node).inner()));
        } else if (node instanceof RegexNode.Optional) {
            return optional(rewrite(((RegexNode.Optional) node).inner()));
        } else if (node instanceof RegexNode.MultiOperator) {
            final RegexNode.MultiOperator m = (RegexNode.MultiOperator) node;
            final StringBuilder operators = new StringBuilder();
            m.operators().forEach(operators::append);
            return postfix(rewrite(m.inner()), dominant(operators.toString()));
        }
        return node;
    }

    private static RegexNode postfix(RegexNode inner, char operator) {
        switch (operator) {
            case '*':
                return star(inner);
            case '+':
                return plus(inner);
            default:
                return optional(inner);
        }
    }

    // the smart constructors below expect already simplified operands

    private static RegexNode star(RegexNode inner) {
        if (inner instanceof RegexNode.Epsilon || inner instanceof RegexNode.EmptySet
                || inner instanceof RegexNode.EmptyGroup) {
            return new RegexNode.Epsilon();
        }
        if (inner instanceof RegexNode.Star) {
            return inner;
        }
        if (inner instanceof RegexNode.Plus) {
            return star(((RegexNode.Plus) inner).inner());
        }
        if (inner instanceof RegexNode.Optional) {
            return star(((RegexNode.Optional) inner).inner());
        }
        return new RegexNode.Star(inner);
    }

    private static RegexNode plus(RegexNode inner) {
        if (inner instanceof RegexNode.Epsilon || inner instanceof RegexNode.EmptyGroup) {
            return new RegexNode.Epsilon();
        }
        if (inner instanceof RegexNode.EmptySet || inner instanceof RegexNode.Star || inner instanceof RegexNode.Plus) {
            return inner;
        }
        if (inner instanceof RegexNode.Optional) {
            return star(((RegexNode.Optional) inner).inner());
        }
        return new RegexNode.Plus(inner);
    }

    private static RegexNode optional(RegexNode inner) {
        if (inner instanceof RegexNode.Epsilon || inner instanceof RegexNode.EmptySet
                || inner instanceof RegexNode.EmptyGroup) {
            return new RegexNode.Epsilon();
        }
        if (inner instanceof RegexNode.Star || inner instanceof RegexNode.Optional) {
            return inner;
        }
        if (inner instanceof RegexNode.Plus) {
            return star(((RegexNode.Plus) inner).inner());
        }
        return new RegexNode.Optional(inner);
    }

    private static RegexNode concat(RegexNode left, RegexNode right) {
        if (left instanceof RegexNode.EmptySet || right instanceof RegexNode.EmptySet) {
            return new RegexNode.EmptySet();
        }
        if (left instanceof RegexNode.Epsilon || left instanceof RegexNode.EmptyGroup) {
            return right;
        }
        if (right instanceof RegexNode.Epsilon || right instanceof RegexNode.EmptyGroup) {
            return left;
        }
        // RR* = R*R = R+
        if (right instanceof RegexNode.Star && equivalent(left, ((RegexNode.Star) right).inner())) {
            return plus(left);
        }
        if (left instanceof RegexNode.Star && equivalent(right, ((RegexNode.Star) left).inner())) {
            return plus(right);
        }
        if (right instanceof RegexNode.Concat) {
            final RegexNode.Concat rest = (RegexNode.Concat) right;
            // X(YX)*Y = (XY)+
            if (rest.left() instanceof RegexNode.Star
                    && ((RegexNode.Star) rest.left()).inner() instanceof RegexNode.Concat) {
                final RegexNode.Concat block = (RegexNode.Concat) ((RegexNode.Star) rest.left()).inner();
                if (equivalent(block.right(), left) && equivalent(block.left(), rest.right())) {
                    return plus(concat(left, rest.right()));
                }
            }
            // XY(XY)* = (XY)+
            if (rest.right() instanceof RegexNode.Star
                    && ((RegexNode.Star) rest.right()).inner() instanceof RegexNode.Concat) {
                final RegexNode.Concat block = (RegexNode.Concat) ((RegexNode.Star) rest.right()).inner();
                if (equivalent(block.left(), left) && equivalent(block.right(), rest.left())) {
                    return plus(concat(left, rest.left()));
                }
            }
        }
        return new RegexNode.Concat(left, right);
    }

    private static RegexNode union(RegexNode left, RegexNode right) {
        if (equivalent(left, right)) {
            return left;
        }
        if (left instanceof RegexNode.EmptySet) {
            return right;
        }
        if (right instanceof RegexNode.EmptySet) {
            return left;
        }
        if (left instanceof RegexNode.Star && right instanceof RegexNode.Plus) {
            return equivalent(((RegexNode.Star) left).inner(), ((RegexNode.Plus) right).inner())
                    ? left
                    : union(left, star(((RegexNode.Plus) right).inner()));
        }
        if (right instanceof RegexNode.Star && left instanceof RegexNode.Plus) {
            return equivalent(((RegexNode.Star) right).inner(), ((RegexNode.Plus) left).inner())
                    ? right
                    : union(star(((RegexNode.Plus) left).inner()), right);
        }
        if (left instanceof RegexNode.Epsilon && right instanceof RegexNode.Star) {
            return right;
        }
        if (right instanceof RegexNode.Epsilon && left instanceof RegexNode.Star) {
            return left;
        }
        if (left instanceof RegexNode.Epsilon && right instanceof RegexNode.Plus) {
            return star(((RegexNode.Plus) right).inner());
        }
        if (right instanceof RegexNode.Epsilon && left instanceof RegexNode.Plus) {
            return star(((RegexNode.Plus) left).inner());
        }
        // X|YX = YX|X = Y?X
        if (right instanceof RegexNode.Concat && equivalent(left, ((RegexNode.Concat) right).right())) {
            return concat(optional(((RegexNode.Concat) right).left()), left);
        }
        if (left instanceof RegexNode.Concat && equivalent(right, ((RegexNode.Concat) left).right())) {
            return concat(optional(((RegexNode.Concat) left).left()), right);
        }
        if (right instanceof RegexNode.Optional && equivalent(((RegexNode.Optional) right).inner(), left)) {
            return right;
        }
        if (left instanceof RegexNode.Optional && equivalent(((RegexNode.Optional) left).inner(), right)) {
            return left;
        }
        if (left instanceof RegexNode.Epsilon) {
            return optional(right);
        }
        if (right instanceof RegexNode.Epsilon) {
            return optional(left);
        }
        return new RegexNode.Union(left, right);
    }

    /**
     * Flattens concatenation chains to merge neighbours {@code R R*} and {@code R* R} into
     * {@code R+}, which the binary tree shape can hide.
     */
    static RegexNode concatPatterns(RegexNode node) {
        if (node instanceof RegexNode.Concat) {
            final List<RegexNode> items = new ArrayList<>();
            flatten(node, items);
            final List<RegexNode> merged = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                final RegexNode current = items.get(i);
                if (i + 1 < items.size()) {
                    final RegexNode next = items.get(i + 1);
                    if (next instanceof RegexNode.Star && equivalent(current, ((RegexNode.Star) next).inner())) {
                        merged.add(plus(current));
                        i++;
                        continue;
                    }
                    if (current instanceof RegexNode.Star && equivalent(next, ((RegexNode.Star) current).inner())) {
                        merged.add(plus(next));
                        i++;
                        continue;
                    }
                }
                merged.add(current);
            }
            RegexNode result = merged.get(merged.size() - 1);
            for (int i = merged.size() - 2; i >= 0; i--) {
                result = concat(merged.get(i), result);
            }
            return result;
        } else if (node instanceof RegexNode.Union) {
            final RegexNode.Union u = (RegexNode.Union) node;
            return union(concatPatterns(u.left()), concatPatterns(u.right()));
        } else if (node instanceof RegexNode.Star) {
            return star(concatPatterns(((RegexNode.Star) node).inner()));
        } else if (node instanceof RegexNode.Plus) {
            return plus(concatPatterns(((RegexNode.Plus) node).inner()));
        } else if (node instanceof RegexNode.Optional) {
            return optional(concatPatterns(((RegexNode.Optional) node).inner()));
        }
        return node;
    }

    private static void flatten(RegexNode node, List<RegexNode> into) {
        if (node instanceof RegexNode.Concat) {
            flatten(((RegexNode.Concat) node).left(), into);
            flatten(((RegexNode.Concat) node).right(), into);
        } else {
            into.add(concatPatterns(node));
        }
    }
}
