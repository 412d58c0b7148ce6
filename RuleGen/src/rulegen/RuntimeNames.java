package rulegen;

import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;

/**
 * The IR classes generated rewrite code is compiled against. They are expected in the same package
 * as the generated class.
 */
public final class RuntimeNames {
  // Default types that are singletons on the Type class rather than frontend factory methods.
  private static final ImmutableSet<String> STATIC_TYPES =
      ImmutableSet.of("Flags", "Mem", "Void", "Int128");

  private final String packageName;
  private final ClassName value;
  private final ClassName block;
  private final ClassName op;
  private final ClassName blockKind;
  private final ClassName type;
  private final ClassName config;
  private final ClassName branchPrediction;

  public RuntimeNames(String packageName) {
    this.packageName = packageName;
    this.value = ClassName.get(packageName, "Value");
    this.block = ClassName.get(packageName, "Block");
    this.op = ClassName.get(packageName, "Op");
    this.blockKind = ClassName.get(packageName, "BlockKind");
    this.type = ClassName.get(packageName, "Type");
    this.config = ClassName.get(packageName, "Config");
    this.branchPrediction = ClassName.get(packageName, "BranchPrediction");
  }

  public String packageName() {
    return packageName;
  }

  public ClassName value() {
    return value;
  }

  public ClassName block() {
    return block;
  }

  public ClassName op() {
    return op;
  }

  public ClassName blockKind() {
    return blockKind;
  }

  public ClassName type() {
    return type;
  }

  public ClassName config() {
    return config;
  }

  public ClassName branchPrediction() {
    return branchPrediction;
  }

  public CodeBlock opConstant(String constantName) {
    return CodeBlock.of("$T.$L", op, constantName);
  }

  public CodeBlock blockKindConstant(String constantName) {
    return CodeBlock.of("$T.$L", blockKind, constantName);
  }

  // Expression for an op's default type, e.g. Type.TypeMem or config.fe.typeInt64().
  public CodeBlock defaultType(String typeName) {
    if (STATIC_TYPES.contains(typeName)) {
      return CodeBlock.of("$T.Type$L", type, typeName);
    }
    return CodeBlock.of("config.fe.type$L()", typeName);
  }
}
