package rulegen;

import java.util.Comparator;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Splits the text of a rules file into individual rules.
 *
 * <p>Comments run from {@code //} to the end of the line. Comment stripping does not know about
 * string literals, so a {@code //} inside a quoted aux value truncates the line.
 */
public class RuleReader {
  public static class Pos implements Comparable<Pos> {
    private final String file;
    private final int lineNumber;

    public Pos(String file, int lineNumber) {
      this.file = file;
      this.lineNumber = lineNumber;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.comparing(Pos::file).thenComparing(Pos::lineNumber).compare(this, pos);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      Pos that = (Pos) o;
      return file.equals(that.file) && lineNumber == that.lineNumber;
    }

    @Override
    public int hashCode() {
      return file.hashCode() * 31 + lineNumber;
    }

    @Override
    public String toString() {
      return file + ":" + lineNumber;
    }
  }

  public static final String ARROW = "->";
  private static final String COMMENT = "//";

  private final String file;
  private final ImmutableList<String> lines;

  public RuleReader(String file, String content) {
    this.file = file;
    this.lines =
        ImmutableList.copyOf(
            Splitter.on('\n').split(CharMatcher.is('\r').removeFrom(content)));
  }

  public ImmutableList<Rule> read() throws CompilerException {
    ImmutableList.Builder<Rule> rules = ImmutableList.builder();

    String rule = "";
    int lineNumber = 0;
    int ruleStartLineNumber = 0;
    int ruleLineNumber = 0; // Line of the first "->".
    for (String line : lines) {
      lineNumber++;
      int comment = line.indexOf(COMMENT);
      if (comment >= 0) {
        line = line.substring(0, comment);
      }

      rule = (rule + " " + line).trim();
      if (rule.isEmpty()) {
        continue;
      }
      if (ruleStartLineNumber == 0) {
        ruleStartLineNumber = lineNumber;
      }
      if (!rule.contains(ARROW)) {
        continue;
      }
      if (ruleLineNumber == 0) {
        ruleLineNumber = lineNumber;
      }
      if (rule.endsWith(ARROW) || !isBalanced(rule)) {
        continue;
      }

      rules.add(Rule.create(rule, new Pos(file, ruleLineNumber)));
      rule = "";
      ruleStartLineNumber = 0;
      ruleLineNumber = 0;
    }

    if (!rule.isEmpty()) {
      throw new CompilerException(
          new Pos(file, ruleStartLineNumber),
          String.format("%s rule: %s", isBalanced(rule) ? "incomplete" : "unbalanced", rule));
    }
    return rules.build();
  }

  // Counts only; the rule parser reports misordered brackets.
  static boolean isBalanced(String s) {
    int parens = 0;
    int brackets = 0;
    int braces = 0;
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '(':
          parens++;
          break;
        case ')':
          parens--;
          break;
        case '[':
          brackets++;
          break;
        case ']':
          brackets--;
          break;
        case '{':
          braces++;
          break;
        case '}':
          braces--;
          break;
        default:
          break;
      }
    }
    return parens == 0 && brackets == 0 && braces == 0;
  }
}
