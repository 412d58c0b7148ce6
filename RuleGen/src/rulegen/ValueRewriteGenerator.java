package rulegen;

import com.google.common.collect.ImmutableList;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.ParameterSpec;

/** Generates {@code rewriteValue<Arch>} and one procedure per opcode that has rules. */
final class ValueRewriteGenerator extends RewriteGenerator {

  ValueRewriteGenerator(
      OpRegistry registry, RuntimeNames names, RuleGen.Options options, String archSuffix) {
    super(registry, names, options, archSuffix);
  }

  @Override
  String dispatchName() {
    return "rewriteValue" + archSuffix;
  }

  @Override
  String switchOn() {
    return "v.op";
  }

  @Override
  ImmutableList<ParameterSpec> parameters() {
    return ImmutableList.of(
        ParameterSpec.builder(names.value(), "v").build(),
        ParameterSpec.builder(names.config(), "config").build());
  }

  @Override
  String argumentList() {
    return "v, config";
  }

  @Override
  String constantName(RuleParser.ParsedRule rule) throws CompilerException {
    return registry.resolveOp(rule.opcode(), rule.pos()).constantName();
  }

  @Override
  CodeBlock prologue() {
    return CodeBlock.builder().addStatement("$T b = v.block", names.block()).build();
  }

  @Override
  boolean compileRule(RuleParser.ParsedRule rule, CodeBlock.Builder code)
      throws CompilerException {
    Bindings bindings = new Bindings();
    bindings.bind("v", Bindings.Kind.VALUE);
    boolean canFail =
        new MatchCompiler(registry, names, rule.pos(), bindings, code).compileTop(rule.pattern());
    if (rule.condition().isPresent()) {
      code.beginControlFlow("if (!($L))", rule.condition().get())
          .addStatement("break")
          .endControlFlow();
      canFail = true;
    }
    new ResultCompiler(registry, names, rule.pos(), bindings, code, "v.line")
        .compileTop(rule.result(), rule.redirect());
    return canFail;
  }
}
