package rulegen;

import java.util.Objects;
import java.util.Optional;

import com.squareup.javapoet.CodeBlock;

/**
 * Emits the statements that match one pattern against a value and bind its variables. Every failed
 * test is a {@code break} out of the enclosing rule loop.
 */
final class MatchCompiler {
  private final OpRegistry registry;
  private final RuntimeNames names;
  private final RuleReader.Pos pos;
  private final Bindings bindings;
  private final CodeBlock.Builder code;

  MatchCompiler(
      OpRegistry registry,
      RuntimeNames names,
      RuleReader.Pos pos,
      Bindings bindings,
      CodeBlock.Builder code) {
    this.registry = registry;
    this.names = names;
    this.pos = pos;
    this.bindings = bindings;
    this.code = code;
  }

  // Matches the rule's whole pattern against "v". Returns true if the match can fail.
  boolean compileTop(Sexpr.Operation pattern) throws CompilerException {
    return compile(pattern, "v", true);
  }

  /**
   * Matches {@code pattern} against the value named {@code v}. The opcode test is skipped for the
   * top of a value rule, where dispatch already selected the opcode. Returns true if the match can
   * fail.
   */
  boolean compile(Sexpr.Operation pattern, String v, boolean top) throws CompilerException {
    OpRegistry.Resolution resolution = registry.resolveOp(pattern.opcode(), pos);
    OpDescriptor op = resolution.op();
    boolean canFail = false;

    if (!top) {
      breakIf(CodeBlock.of("$L.op != $L", v, names.opConstant(resolution.constantName())));
      canFail = true;
    }

    Optional<Sexpr.Qualifier> type = pattern.typeQualifier();
    if (type.isPresent()) {
      canFail |= matchQualifier(type.get(), Bindings.Kind.TYPE, v + ".type");
    }

    Optional<Sexpr.Qualifier> auxInt = pattern.auxIntQualifier();
    if (auxInt.isPresent()) {
      if (!op.auxKind().allowsAuxInt()) {
        throw new CompilerException(
            pos, String.format("op %s %s can't have auxint", op.name(), op.auxKind()));
      }
      canFail |= matchQualifier(auxInt.get(), Bindings.Kind.AUX_INT, v + ".auxInt");
    }

    Optional<Sexpr.Qualifier> aux = pattern.auxQualifier();
    if (aux.isPresent()) {
      if (!op.auxKind().allowsAux()) {
        throw new CompilerException(
            pos, String.format("op %s %s can't have aux", op.name(), op.auxKind()));
      }
      canFail |= matchQualifier(aux.get(), Bindings.Kind.AUX, v + ".aux");
    }

    // Checked before any argument is read.
    if (op.hasVariableArity()) {
      breakIf(CodeBlock.of("$L.args.size() != $L", v, pattern.numChildren()));
      canFail = true;
    } else if (op.argLength() != pattern.numChildren()) {
      throw new CompilerException(
          pos,
          String.format(
              "op %s should have %d args, has %d",
              op.name(), op.argLength(), pattern.numChildren()));
    }

    int argnum = 0;
    for (Sexpr child : pattern.children()) {
      switch (child.type()) {
        case WILDCARD:
          break;
        case VARIABLE:
          {
            Sexpr.Variable variable = child.cast();
            if (!variable.isIdentifier()) {
              throw new CompilerException(
                  pos, String.format("expected a variable, got '%s'", variable.name()));
            }
            String name = variable.name();
            if (Bindings.IMPLICIT_NAMES.contains(name)) {
              throw new CompilerException(
                  pos, String.format("%s can't be used as a variable name", name));
            }
            if (bindings.isBound(name)) {
              // Values are compared by identity, which relies on CSE having run.
              checkKind(name, Bindings.Kind.VALUE);
              breakIf(CodeBlock.of("$L != $L.args.get($L)", name, v, argnum));
              canFail = true;
            } else {
              bind(name, Bindings.Kind.VALUE, CodeBlock.of("$L.args.get($L)", v, argnum));
            }
            break;
          }
        case OPERATION:
          {
            Sexpr.Operation operation = child.cast();
            String name = operation.boundName().orElse(v + "_" + argnum);
            if (bindings.isBound(name)) {
              throw new CompilerException(pos, String.format("variable %s is bound twice", name));
            }
            bind(name, Bindings.Kind.VALUE, CodeBlock.of("$L.args.get($L)", v, argnum));
            canFail |= compile(operation, name, false);
            break;
          }
      }
      argnum++;
    }
    return canFail;
  }

  // Binds a fresh variable qualifier or tests a repeated variable or expression. Returns true if
  // a test was emitted.
  private boolean matchQualifier(Sexpr.Qualifier qualifier, Bindings.Kind kind, String field)
      throws CompilerException {
    String text = qualifier.text();
    if (qualifier.isVariable()) {
      if (!bindings.isBound(text)) {
        bind(text, kind, CodeBlock.of("$L", field));
        return false;
      }
      checkKind(text, kind);
    }
    if (kind == Bindings.Kind.AUX) {
      // Aux values are objects; everything else compares with ==.
      breakIf(CodeBlock.of("!$T.equals($L, $L)", Objects.class, field, text));
    } else {
      breakIf(CodeBlock.of("$L != $L", field, text));
    }
    return true;
  }

  private void bind(String name, Bindings.Kind kind, CodeBlock initializer)
      throws CompilerException {
    if (Bindings.IMPLICIT_NAMES.contains(name)) {
      throw new CompilerException(pos, String.format("%s can't be used as a variable name", name));
    }
    bindings.bind(name, kind);
    code.addStatement("$T $L = $L", kind.javaType(names), name, initializer);
  }

  private void checkKind(String name, Bindings.Kind expected) throws CompilerException {
    Bindings.Kind actual = bindings.kind(name).get();
    if (actual != expected) {
      throw new CompilerException(
          pos,
          String.format(
              "%s is bound to %s and can't be matched as %s",
              name, describe(actual), describe(expected)));
    }
  }

  static String describe(Bindings.Kind kind) {
    switch (kind) {
      case VALUE:
        return "a value";
      case TYPE:
        return "a type";
      case AUX_INT:
        return "an auxint";
      case AUX:
        return "an aux";
      case BLOCK:
        return "a block";
    }
    throw new AssertionError(kind);
  }

  private void breakIf(CodeBlock condition) {
    code.beginControlFlow("if ($L)", condition)
        .addStatement("break")
        .endControlFlow();
  }
}
