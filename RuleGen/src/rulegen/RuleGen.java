package rulegen;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;

/**
 * Compiles one architecture's rules file into a rewrite class.
 *
 * <pre>
 *   rules text -> RuleReader -> RuleSet -> value and block generators -> RewriteEmitter
 * </pre>
 *
 * Generation is deterministic: the same rules and descriptor pools always produce the same source.
 */
public final class RuleGen {

  @AutoValue
  public abstract static class Options {
    // Emit a trace statement naming each rule as it fires.
    public abstract boolean log();

    // Package of the generated class and of the IR classes it uses.
    public abstract String packageName();

    public static Builder builder() {
      return new AutoValue_RuleGen_Options.Builder().setLog(false);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setLog(boolean log);

      public abstract Builder setPackageName(String packageName);

      public abstract Options build();
    }
  }

  private final OpRegistry registry;
  private final Options options;
  private final RuntimeNames names;
  private final RewriteEmitter emitter;

  public RuleGen(OpRegistry registry, Options options) {
    this.registry = registry;
    this.options = options;
    this.names = new RuntimeNames(options.packageName());
    this.emitter = new RewriteEmitter(names);
  }

  public RewriteEmitter emitter() {
    return emitter;
  }

  /**
   * Generates the rewrite class for {@code content}, the text of {@code rulesFileName}. The result
   * has been checked to parse as Java.
   */
  public JavaFile generate(String rulesFileName, String content) throws CompilerException {
    ImmutableList<Rule> rules = new RuleReader(rulesFileName, content).read();
    RuleSet ruleSet = RuleSet.group(rules, registry);

    String archSuffix = archSuffix(registry.archName());
    ImmutableList<MethodSpec> valueMethods =
        new ValueRewriteGenerator(registry, names, options, archSuffix)
            .generate(ruleSet.valueRules());
    ImmutableList<MethodSpec> blockMethods =
        new BlockRewriteGenerator(registry, names, options, archSuffix)
            .generate(ruleSet.blockRules());

    JavaFile javaFile =
        emitter.assemble(rulesFileName, archSuffix, Iterables.concat(valueMethods, blockMethods));
    emitter.validate(javaFile);
    return javaFile;
  }

  // "generic" -> "Generic", "AMD64" -> "AMD64".
  static String archSuffix(String archName) {
    return Character.toUpperCase(archName.charAt(0)) + archName.substring(1);
  }
}
