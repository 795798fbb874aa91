package FSA.Regex;

import java.util.List;

/**
 * Regular-expression syntax tree. Nodes are immutable; structural equality is record equality.
 */
public sealed interface RegexNode permits RegexNode.Symbol, RegexNode.Epsilon, RegexNode.EmptySet,
        RegexNode.EmptyGroup, RegexNode.Union, RegexNode.Concat, RegexNode.Star, RegexNode.Plus,
        RegexNode.Optional, RegexNode.MultiOperator {

    char EPSILON = 'ε';
    char EMPTY_SET = '∅';

    /**
     * Flat regex text; parsing it again yields an equivalent tree.
     */
    String toRegex();

    record Symbol(char symbol) implements RegexNode {
        @Override
        public String toRegex() {
            return String.valueOf(symbol);
        }
    }

    record Epsilon() implements RegexNode {
        @Override
        public String toRegex() {
            return String.valueOf(EPSILON);
        }
    }

    record EmptySet() implements RegexNode {
        @Override
        public String toRegex() {
            return String.valueOf(EMPTY_SET);
        }
    }

    /**
     * {@code ()}, which denotes the empty word.
     */
    record EmptyGroup() implements RegexNode {
        @Override
        public String toRegex() {
            return "()";
        }
    }

    record Union(RegexNode left, RegexNode right) implements RegexNode {
        @Override
        public String toRegex() {
            return left.toRegex() + "|" + right.toRegex();
        }
    }

    record Concat(RegexNode left, RegexNode right) implements RegexNode {
        @Override
        public String toRegex() {
            return wrapUnion(left) + wrapUnion(right);
        }

        private static String wrapUnion(RegexNode node) {
            return node instanceof Union ? "(" + node.toRegex() + ")" : node.toRegex();
        }
    }

    record Star(RegexNode inner) implements RegexNode {
        @Override
        public String toRegex() {
            return RegexNode.operand(inner) + "*";
        }
    }

    record Plus(RegexNode inner) implements RegexNode {
        @Override
        public String toRegex() {
            return RegexNode.operand(inner) + "+";
        }
    }

    record Optional(RegexNode inner) implements RegexNode {
        @Override
        public String toRegex() {
            return RegexNode.operand(inner) + "?";
        }
    }

    /**
     * Stacked postfix operators such as {@code a*+}, kept in source order.
     */
    record MultiOperator(RegexNode inner, List<Character> operators) implements RegexNode {
        public MultiOperator {
            operators = List.copyOf(operators);
        }

        @Override
        public String toRegex() {
            final StringBuilder sb = new StringBuilder(RegexNode.operand(inner));
            operators.forEach(sb::append);
            return sb.toString();
        }
    }

    private static String operand(RegexNode inner) {
        return inner instanceof Union || inner instanceof Concat ? "(" + inner.toRegex() + ")" : inner.toRegex();
    }
}
