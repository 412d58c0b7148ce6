package rulegen;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;

/** Splits a {@link Rule} into its pattern, optional condition and result. */
public final class RuleParser {
  private static final String AND = "&&";
  private static final char REDIRECT = '@';

  @AutoValue
  public abstract static class ParsedRule {
    public abstract Rule rule();

    // Raw text of the three parts, echoed into the generated code.
    public abstract String matchText();

    public abstract Optional<String> condition();

    public abstract String resultText();

    public abstract Sexpr.Operation pattern();

    // Expression evaluating to the block that new values should be placed in.
    public abstract Optional<String> redirect();

    public abstract Sexpr result();

    public final RuleReader.Pos pos() {
      return rule().pos();
    }

    public final String opcode() {
      return pattern().opcode();
    }
  }

  private RuleParser() {}

  public static ParsedRule parse(Rule rule) throws CompilerException {
    String text = rule.text();
    int arrow = indexOfTopLevel(text, RuleReader.ARROW);
    if (arrow < 0) {
      throw new CompilerException(rule.pos(), String.format("no arrow in %s", rule));
    }

    String match = text.substring(0, arrow).trim();
    String result = text.substring(arrow + RuleReader.ARROW.length()).trim();
    if (indexOfTopLevel(result, RuleReader.ARROW) >= 0) {
      throw new CompilerException(rule.pos(), String.format("more than one arrow in %s", rule));
    }
    Optional<String> condition = Optional.empty();
    int and = indexOfTopLevel(match, AND);
    if (and >= 0) {
      condition = Optional.of(match.substring(and + AND.length()).trim());
      match = match.substring(0, and).trim();
      if (condition.get().isEmpty()) {
        throw new CompilerException(rule.pos(), String.format("empty condition in %s", rule));
      }
    }
    if (match.isEmpty()) {
      throw new CompilerException(rule.pos(), String.format("no pattern in %s", rule));
    }

    String resultText = result;
    Optional<String> redirect = Optional.empty();
    if (!result.isEmpty() && result.charAt(0) == REDIRECT) {
      int space = CharMatcher.whitespace().indexIn(result);
      if (space < 0) {
        throw new CompilerException(
            rule.pos(), String.format("missing result after block redirect in %s", rule));
      } else if (space == 1) {
        throw new CompilerException(
            rule.pos(), String.format("missing block after '@' in %s", rule));
      }
      redirect = Optional.of(result.substring(1, space));
      result = result.substring(space).trim();
    }
    if (result.isEmpty()) {
      throw new CompilerException(rule.pos(), String.format("no result in %s", rule));
    }

    SexprParser parser = new SexprParser(rule.pos());
    return new AutoValue_RuleParser_ParsedRule(
        rule,
        match,
        condition,
        resultText,
        parser.parseOperation(match),
        redirect,
        parser.parse(result));
  }

  // Returns the index of the first occurrence of token outside of any (), [] or {}.
  static int indexOfTopLevel(String s, String token) {
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '(' || ch == '[' || ch == '{') {
        depth++;
      } else if (ch == ')' || ch == ']' || ch == '}') {
        depth--;
      } else if (depth == 0 && s.startsWith(token, i)) {
        return i;
      }
    }
    return -1;
  }
}
