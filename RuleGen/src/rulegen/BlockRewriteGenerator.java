package rulegen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.ParameterSpec;

/**
 * Generates {@code rewriteBlock<Arch>} and one procedure per block kind that has rules.
 *
 * <p>A block pattern is {@code (Kind control succ...)}. The control is {@code nil}, a variable, or
 * an operation matched against {@code b.control}. Successors are names (or {@code _}) bound to
 * {@code b.succs}. The result names a kind, a new control and a permutation of a subset of the
 * named successors. Dropped successors lose {@code b} as a predecessor.
 */
final class BlockRewriteGenerator extends RewriteGenerator {
  private static final String NIL = "nil";

  BlockRewriteGenerator(
      OpRegistry registry, RuntimeNames names, RuleGen.Options options, String archSuffix) {
    super(registry, names, options, archSuffix);
  }

  @Override
  String dispatchName() {
    return "rewriteBlock" + archSuffix;
  }

  @Override
  String switchOn() {
    return "b.kind";
  }

  @Override
  ImmutableList<ParameterSpec> parameters() {
    return ImmutableList.of(ParameterSpec.builder(names.block(), "b").build());
  }

  @Override
  String argumentList() {
    return "b";
  }

  @Override
  String constantName(RuleParser.ParsedRule rule) throws CompilerException {
    return registry.resolveBlock(rule.opcode(), rule.pos()).constantName();
  }

  @Override
  CodeBlock prologue() {
    return CodeBlock.builder().addStatement("$T config = b.func.config", names.config()).build();
  }

  @Override
  boolean compileRule(RuleParser.ParsedRule rule, CodeBlock.Builder code)
      throws CompilerException {
    RuleReader.Pos pos = rule.pos();
    Sexpr.Operation pattern = rule.pattern();
    checkNoQualifiers(pattern, pos);
    if (rule.redirect().isPresent()) {
      throw new CompilerException(pos, "block rules can't redirect their result");
    }
    if (pattern.numChildren() < 1) {
      throw new CompilerException(
          pos, String.format("block %s needs a control in its pattern", pattern.opcode()));
    }

    Bindings bindings = new Bindings();
    boolean canFail = matchControl(pattern.child(0), pos, bindings, code);

    // Names of the matched successors in order, "_" for the unnamed ones.
    List<String> oldSuccs = new ArrayList<>();
    for (int i = 1; i < pattern.numChildren(); i++) {
      Sexpr succ = pattern.child(i);
      if (succ.isWildcard()) {
        oldSuccs.add(Sexpr.Wildcard.TOKEN);
        continue;
      }
      String name = successorName(succ, pos);
      if (bindings.isBound(name) || Bindings.IMPLICIT_NAMES.contains(name)) {
        throw new CompilerException(pos, String.format("repeated successor name %s", name));
      }
      bindings.bind(name, Bindings.Kind.BLOCK);
      code.addStatement("$T $L = b.succs.get($L)", names.block(), name, i - 1);
      oldSuccs.add(name);
    }

    if (rule.condition().isPresent()) {
      code.beginControlFlow("if (!($L))", rule.condition().get())
          .addStatement("break")
          .endControlFlow();
      canFail = true;
    }

    compileResult(rule, bindings, oldSuccs, code);
    return canFail;
  }

  // Returns true if the match can fail.
  private boolean matchControl(
      Sexpr control, RuleReader.Pos pos, Bindings bindings, CodeBlock.Builder code)
      throws CompilerException {
    switch (control.type()) {
      case WILDCARD:
        return false;
      case VARIABLE:
        {
          String name = control.<Sexpr.Variable>cast().name();
          if (name.equals(NIL)) {
            return false;
          }
          if (!Sexpr.isIdentifier(name) || Bindings.IMPLICIT_NAMES.contains(name)) {
            throw new CompilerException(
                pos, String.format("expected a variable for the control, got '%s'", name));
          }
          bindings.bind(name, Bindings.Kind.VALUE);
          code.addStatement("$T $L = b.control", names.value(), name);
          return false;
        }
      case OPERATION:
        {
          Sexpr.Operation operation = control.cast();
          String name = operation.boundName().orElse("v");
          if (operation.boundName().isPresent() && Bindings.IMPLICIT_NAMES.contains(name)) {
            throw new CompilerException(
                pos, String.format("%s can't be used as a variable name", name));
          }
          bindings.bind(name, Bindings.Kind.VALUE);
          code.addStatement("$T $L = b.control", names.value(), name);
          return new MatchCompiler(registry, names, pos, bindings, code)
              .compile(operation, name, false);
        }
    }
    throw new AssertionError(control.type());
  }

  private void compileResult(
      RuleParser.ParsedRule rule,
      Bindings bindings,
      List<String> oldSuccs,
      CodeBlock.Builder code)
      throws CompilerException {
    RuleReader.Pos pos = rule.pos();
    if (!rule.result().isOperation()) {
      throw new CompilerException(
          pos, String.format("block result must be a block kind, got '%s'", rule.resultText()));
    }
    Sexpr.Operation result = rule.result().cast();
    checkNoQualifiers(result, pos);
    OpRegistry.Resolution kind = registry.resolveBlock(result.opcode(), pos);
    if (result.numChildren() < 1) {
      throw new CompilerException(
          pos, String.format("block %s needs a control in its result", result.opcode()));
    }

    List<String> newSuccs = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (int i = 1; i < result.numChildren(); i++) {
      Sexpr succ = result.child(i);
      String name = succ.isVariable() ? succ.<Sexpr.Variable>cast().name() : succ.toString();
      if (!succ.isVariable() || bindings.kind(name).orElse(null) != Bindings.Kind.BLOCK) {
        throw new CompilerException(pos, String.format("unknown successor %s in result", name));
      }
      if (!seen.add(name)) {
        throw new CompilerException(
            pos, String.format("successor %s appears twice in result", name));
      }
      newSuccs.add(name);
    }

    for (int i = 0; i < oldSuccs.size(); i++) {
      String name = oldSuccs.get(i);
      if (name.equals(Sexpr.Wildcard.TOKEN)) {
        code.addStatement("b.func.removePredecessor(b, b.succs.get($L))", i);
      } else if (!seen.contains(name)) {
        code.addStatement("b.func.removePredecessor(b, $L)", name);
      }
    }

    code.addStatement("b.kind = $L", names.blockKindConstant(kind.constantName()));

    Sexpr control = result.child(0);
    if (control.isVariable() && control.<Sexpr.Variable>cast().name().equals(NIL)) {
      code.addStatement("b.setControl(null)");
    } else {
      String value =
          new ResultCompiler(registry, names, pos, bindings, code, "b.line").compileValue(control);
      code.addStatement("b.setControl($L)", value);
    }

    if (newSuccs.size() < oldSuccs.size()) {
      code.addStatement("b.succs.subList($L, b.succs.size()).clear()", newSuccs.size());
    }
    for (int i = 0; i < newSuccs.size(); i++) {
      code.addStatement("b.succs.set($L, $L)", i, newSuccs.get(i));
    }

    // A prediction only carries over between two-way branches with the same successors.
    boolean twoWay = newSuccs.size() == 2 && oldSuccs.size() == 2;
    boolean swapped =
        twoWay
            && newSuccs.get(0).equals(oldSuccs.get(1))
            && newSuccs.get(1).equals(oldSuccs.get(0));
    if (swapped) {
      code.addStatement("b.likely = b.likely.invert()");
    } else if (!twoWay || !newSuccs.equals(oldSuccs)) {
      code.addStatement("b.likely = $T.UNKNOWN", names.branchPrediction());
    }
  }

  private static String successorName(Sexpr succ, RuleReader.Pos pos) throws CompilerException {
    if (!succ.isVariable() || !succ.<Sexpr.Variable>cast().isIdentifier()) {
      throw new CompilerException(
          pos, String.format("expected a successor name, got '%s'", succ));
    }
    return succ.<Sexpr.Variable>cast().name();
  }

  private static void checkNoQualifiers(Sexpr.Operation operation, RuleReader.Pos pos)
      throws CompilerException {
    if (operation.typeQualifier().isPresent()
        || operation.auxIntQualifier().isPresent()
        || operation.auxQualifier().isPresent()
        || operation.boundName().isPresent()) {
      throw new CompilerException(
          pos, String.format("block %s can't have qualifiers", operation.opcode()));
    }
  }
}
