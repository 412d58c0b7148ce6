package rulegen;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

/**
 * Parsed rules grouped by the opcode at the top of their pattern. Groups are ordered by opcode name
 * and rules keep their file order within a group.
 */
public final class RuleSet {
  private final ImmutableListMultimap<String, RuleParser.ParsedRule> valueRules;
  private final ImmutableListMultimap<String, RuleParser.ParsedRule> blockRules;

  private RuleSet(
      ImmutableListMultimap<String, RuleParser.ParsedRule> valueRules,
      ImmutableListMultimap<String, RuleParser.ParsedRule> blockRules) {
    this.valueRules = valueRules;
    this.blockRules = blockRules;
  }

  public static RuleSet group(ImmutableList<Rule> rules, OpRegistry registry)
      throws CompilerException {
    ListMultimap<String, RuleParser.ParsedRule> valueRules =
        MultimapBuilder.treeKeys().arrayListValues().build();
    ListMultimap<String, RuleParser.ParsedRule> blockRules =
        MultimapBuilder.treeKeys().arrayListValues().build();
    for (Rule rule : rules) {
      RuleParser.ParsedRule parsed = RuleParser.parse(rule);
      if (registry.isBlock(parsed.opcode())) {
        blockRules.put(parsed.opcode(), parsed);
      } else {
        valueRules.put(parsed.opcode(), parsed);
      }
    }
    return new RuleSet(
        ImmutableListMultimap.copyOf(valueRules), ImmutableListMultimap.copyOf(blockRules));
  }

  public ImmutableListMultimap<String, RuleParser.ParsedRule> valueRules() {
    return valueRules;
  }

  public ImmutableListMultimap<String, RuleParser.ParsedRule> blockRules() {
    return blockRules;
  }
}
