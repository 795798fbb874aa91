package FSA.Regex;

import FSA.Equivalence;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class RegexSimplifierTest {
  @Test
  void testTextualPass() {
    Assertions.assertEquals("aεb", RegexSimplifier.textualPass("a()b"));
    Assertions.assertEquals("aεb", RegexSimplifier.textualPass("a()*b"));
    Assertions.assertEquals("a", RegexSimplifier.textualPass("((a))"));
    Assertions.assertEquals("a*", RegexSimplifier.textualPass("a**++"));
    Assertions.assertEquals("a*", RegexSimplifier.textualPass("a+?"));
    Assertions.assertEquals("(a|b)", RegexSimplifier.textualPass("(a|b)"));
  }

  @Test
  void testSimplify() {
    Map<String, String> expected = Map.ofEntries(
        Map.entry("", "ε"),
        Map.entry("aεb", "ab"),
        Map.entry("a()b", "ab"),
        Map.entry("a**", "a*"),
        Map.entry("a++", "a+"),
        Map.entry("a*+", "a*"),
        Map.entry("a+*", "a*"),
        Map.entry("((a))", "a"),
        Map.entry("a**++", "a*"),
        Map.entry("a|a", "a"),
        Map.entry("∅|a", "a"),
        Map.entry("aa*", "a+"),
        Map.entry("a*a", "a+"),
        Map.entry("ε|a", "a?"),
        Map.entry("a*|ε", "a*"),
        Map.entry("a+|ε", "a*"),
        Map.entry("a|ba", "b?a"),
        Map.entry("ab(ab)*", "(ab)+"),
        Map.entry("((a|b))", "a|b"),
        Map.entry("(ab)*", "(ab)*"));
    expected.forEach((input, output) ->
        Assertions.assertEquals(output, RegexSimplifier.simplify(input), input));
  }

  @Test
  void testLanguagePreserved() {
    for (String regex : List.of("a()b", "a|ba", "ab(ab)*", "(a|b)*a(a|b)", "ε|a*|aa*", "(ab|ab)c?", "a(b*)*b")) {
      String simplified = RegexSimplifier.simplify(regex);
      Assertions.assertTrue(Equivalence.regexEquivalent(regex, simplified), regex + " -> " + simplified);
      Assertions.assertTrue(simplified.length() <= regex.length(), simplified);
      Assertions.assertEquals(simplified, RegexSimplifier.simplify(simplified));
    }
  }

  @Test
  void testUnchangedInputs() {
    Assertions.assertEquals("(a", RegexSimplifier.simplify("(a"));
    Assertions.assertEquals("*a", RegexSimplifier.simplify("*a"));
    Assertions.assertEquals("aaaa*", new RegexSimplifier(50, 3).run("aaaa*"));
    Assertions.assertEquals("aaa+", new RegexSimplifier(50, 5).run("aaaa*"));
  }

  @Test
  void testRewriteStructure() {
    RegexNode ast = RegexASTParser.parse("a*|ε");
    Assertions.assertEquals(new RegexNode.Star(new RegexNode.Symbol('a')), RegexSimplifier.rewrite(ast));
    Assertions.assertTrue(RegexSimplifier.equivalent(RegexASTParser.parse("a|b"), RegexASTParser.parse("b|a")));
    Assertions.assertFalse(RegexSimplifier.equivalent(RegexASTParser.parse("ab"), RegexASTParser.parse("ba")));
  }
}
