package rulegen;

import com.google.auto.value.AutoValue;

/** One complete rule as it appeared in the rules file, possibly joined from several lines. */
@AutoValue
public abstract class Rule {
  public abstract String text();

  public abstract RuleReader.Pos pos();

  public static Rule create(String text, RuleReader.Pos pos) {
    return new AutoValue_Rule(text, pos);
  }

  @Override
  public final String toString() {
    return String.format("rule \"%s\" at %s", text(), pos());
  }
}
