package rulegen;

import java.util.Optional;

import com.squareup.javapoet.CodeBlock;

/** Emits the statements that build a rule's replacement. */
final class ResultCompiler {

  enum ConstructionMode {
    // Reuse the matched value "v" for the result's top operation.
    MUTATE_IN_PLACE,
    // Allocate a fresh value in the current block.
    ALLOCATE_NEW;
  }

  private final OpRegistry registry;
  private final RuntimeNames names;
  private final RuleReader.Pos pos;
  private final Bindings bindings;
  private final CodeBlock.Builder code;
  // Source line new values are attributed to: "v.line" in value rules, "b.line" in block rules.
  private final String line;
  private int allocated = 0;

  ResultCompiler(
      OpRegistry registry,
      RuntimeNames names,
      RuleReader.Pos pos,
      Bindings bindings,
      CodeBlock.Builder code,
      String line) {
    this.registry = registry;
    this.names = names;
    this.pos = pos;
    this.bindings = bindings;
    this.code = code;
    this.line = line;
  }

  /**
   * Rewrites the matched value "v" into {@code result}. With a redirect, "b" is reassigned first so
   * new values land in the target block, and the top operation is built there and copied into "v".
   */
  void compileTop(Sexpr result, Optional<String> redirect) throws CompilerException {
    redirect.ifPresent(block -> code.addStatement("b = $L", block));

    switch (result.type()) {
      case WILDCARD:
        throw wildcardInResult();
      case VARIABLE:
        {
          Sexpr.Variable variable = result.cast();
          checkValueReference(variable.name());
          code.addStatement("v.reset($L)", copyOp())
              .addStatement("v.type = $L.type", variable.name())
              .addStatement("v.addArg($L)", variable.name());
          return;
        }
      case OPERATION:
        {
          if (redirect.isPresent()) {
            String top = construct(result.cast(), ConstructionMode.ALLOCATE_NEW);
            code.addStatement("v.reset($L)", copyOp()).addStatement("v.addArg($L)", top);
          } else {
            construct(result.cast(), ConstructionMode.MUTATE_IN_PLACE);
          }
          return;
        }
    }
  }

  /** Returns an expression for {@code result}, emitting allocations for any operations in it. */
  String compileValue(Sexpr result) throws CompilerException {
    switch (result.type()) {
      case WILDCARD:
        throw wildcardInResult();
      case VARIABLE:
        {
          String name = result.<Sexpr.Variable>cast().name();
          checkValueReference(name);
          return name;
        }
      case OPERATION:
        return construct(result.cast(), ConstructionMode.ALLOCATE_NEW);
    }
    throw new AssertionError(result.type());
  }

  // Returns the name of the constructed value.
  private String construct(Sexpr.Operation result, ConstructionMode mode)
      throws CompilerException {
    OpRegistry.Resolution resolution = registry.resolveOp(result.opcode(), pos);
    OpDescriptor op = resolution.op();
    CodeBlock opConstant = names.opConstant(resolution.constantName());
    if (result.boundName().isPresent()) {
      throw new CompilerException(
          pos,
          String.format("can't bind a name in a result: %s:%s", result.boundName().get(), result));
    }

    CodeBlock type = null;
    if (result.typeQualifier().isPresent()) {
      type = CodeBlock.of("$L", result.typeQualifier().get().text());
    } else if (op.defaultType().isPresent()) {
      type = names.defaultType(op.defaultType().get());
    }

    String target;
    if (mode == ConstructionMode.MUTATE_IN_PLACE) {
      target = "v";
      code.addStatement("v.reset($L)", opConstant);
      // reset keeps the type, so only an explicit override is applied.
      if (result.typeQualifier().isPresent()) {
        code.addStatement("v.type = $L", type);
      }
    } else {
      if (type == null) {
        throw new CompilerException(
            pos,
            String.format(
                "sub-expression %s (op=%s) must have a type", result, resolution.constantName()));
      }
      target = "v" + allocated++;
      code.addStatement(
          "$T $L = b.newValue0($L, $L, $L)", names.value(), target, line, opConstant, type);
    }

    if (result.auxIntQualifier().isPresent()) {
      if (!op.auxKind().allowsAuxInt()) {
        throw new CompilerException(
            pos, String.format("op %s %s can't have auxint", op.name(), op.auxKind()));
      }
      code.addStatement("$L.auxInt = $L", target, result.auxIntQualifier().get().text());
    }
    if (result.auxQualifier().isPresent()) {
      if (!op.auxKind().allowsAux()) {
        throw new CompilerException(
            pos, String.format("op %s %s can't have aux", op.name(), op.auxKind()));
      }
      code.addStatement("$L.aux = $L", target, result.auxQualifier().get().text());
    }

    int argnum = 0;
    for (Sexpr child : result.children()) {
      String arg = compileValue(child);
      code.addStatement("$L.addArg($L)", target, arg);
      argnum++;
    }
    if (!op.hasVariableArity() && op.argLength() != argnum) {
      throw new CompilerException(
          pos,
          String.format("op %s should have %d args, has %d", op.name(), op.argLength(), argnum));
    }
    return target;
  }

  // Identifiers must name a bound value; anything else is passed through as a Java expression.
  private void checkValueReference(String text) throws CompilerException {
    if (!Sexpr.isIdentifier(text)) {
      return;
    }
    Bindings.Kind kind =
        bindings
            .kind(text)
            .orElseThrow(
                () -> new CompilerException(pos, String.format("unbound variable %s", text)));
    if (kind != Bindings.Kind.VALUE) {
      throw new CompilerException(
          pos,
          String.format(
              "%s is bound to %s and can't be used as an argument",
              text, MatchCompiler.describe(kind)));
    }
  }

  private CodeBlock copyOp() throws CompilerException {
    return names.opConstant(registry.resolveOp(OpRegistry.COPY, pos).constantName());
  }

  private CompilerException wildcardInResult() {
    return new CompilerException(pos, "_ can't appear in a result");
  }
}
