package rulegen;

import javax.lang.model.element.Modifier;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.errorprone.annotations.ForOverride;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;

/**
 * Shared structure of the value and block generators: one public dispatch method that switches on
 * the kind, and one private procedure per group that tries its rules in order.
 *
 * <p>Each rule is a {@code while (true)} loop that runs at most once. Failed tests {@code break}
 * to the next rule and a successful rewrite returns {@code true}.
 */
abstract class RewriteGenerator {
  protected final OpRegistry registry;
  protected final RuntimeNames names;
  protected final RuleGen.Options options;
  // Capitalized arch name used in method names, e.g. "Generic" or "AMD64".
  protected final String archSuffix;

  RewriteGenerator(
      OpRegistry registry, RuntimeNames names, RuleGen.Options options, String archSuffix) {
    this.registry = registry;
    this.names = names;
    this.options = options;
    this.archSuffix = archSuffix;
  }

  /** The dispatch method followed by one procedure per group, in group order. */
  final ImmutableList<MethodSpec> generate(
      ImmutableListMultimap<String, RuleParser.ParsedRule> groups) throws CompilerException {
    ImmutableList.Builder<MethodSpec> procedures = ImmutableList.builder();
    CodeBlock.Builder dispatch = CodeBlock.builder().beginControlFlow("switch ($L)", switchOn());
    for (String opcode : groups.keySet()) {
      ImmutableList<RuleParser.ParsedRule> rules = groups.get(opcode);
      String constantName = constantName(rules.get(0));
      String procedureName = dispatchName() + "_" + constantName;

      dispatch.add("case $L:\n", constantName).indent();
      dispatch.addStatement("return $L($L)", procedureName, argumentList()).unindent();

      CodeBlock.Builder code = CodeBlock.builder();
      code.add(prologue());
      boolean canFail = false;
      for (int i = 0; i < rules.size(); i++) {
        RuleParser.ParsedRule rule = rules.get(i);
        code.add("// match: $L\n", rule.matchText());
        code.add("// cond:$L\n", rule.condition().map(c -> " " + c).orElse(""));
        code.add("// result: $L\n", rule.resultText());
        code.beginControlFlow("while (true)");
        canFail = compileRule(rule, code);
        if (!canFail && i != rules.size() - 1) {
          throw new CompilerException(
              rule.pos(),
              String.format(
                  "%s always applies, so the %s rules after it are unreachable",
                  rule, opcode));
        }
        if (options.log()) {
          code.addStatement("$T.out.println($S)", System.class, "rewrite " + rule.pos());
        }
        code.addStatement("return true");
        code.endControlFlow();
      }
      if (canFail) {
        code.addStatement("return false");
      }

      procedures.add(
          MethodSpec.methodBuilder(procedureName)
              .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
              .returns(boolean.class)
              .addParameters(parameters())
              .addCode(code.build())
              .build());
    }
    dispatch.endControlFlow().addStatement("return false");

    return ImmutableList.<MethodSpec>builder()
        .add(
            MethodSpec.methodBuilder(dispatchName())
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(boolean.class)
                .addParameters(parameters())
                .addCode(dispatch.build())
                .build())
        .addAll(procedures.build())
        .build();
  }

  // e.g. "rewriteValueAMD64".
  abstract String dispatchName();

  // Expression the dispatch method switches on.
  abstract String switchOn();

  abstract ImmutableList<ParameterSpec> parameters();

  // Names of parameters() joined for a call.
  abstract String argumentList();

  // Enum constant the group's opcode resolves to. Fails for names of the wrong kind.
  abstract String constantName(RuleParser.ParsedRule rule) throws CompilerException;

  // Statements at the top of each procedure.
  @ForOverride
  abstract CodeBlock prologue();

  /**
   * Emits the body of one rule's loop up to, but not including, the final {@code return true}.
   * Returns true if the rule can fail to apply.
   */
  @ForOverride
  abstract boolean compileRule(RuleParser.ParsedRule rule, CodeBlock.Builder code)
      throws CompilerException;
}
