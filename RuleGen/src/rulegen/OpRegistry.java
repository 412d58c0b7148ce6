package rulegen;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Read-only view of the generic and architecture descriptor pools.
 *
 * <p>Names are resolved once, up front. Block kinds shadow operations of the same name, and the
 * architecture pool shadows the generic pool. The Java constant a name maps to follows the pool it
 * was found in: generic {@code Add64} is {@code OpAdd64}, AMD64 {@code ADDQ} is {@code
 * OpAMD64ADDQ}.
 */
public final class OpRegistry {

  @AutoValue
  public abstract static class Resolution {
    public enum Kind {
      OPERATION,
      BLOCK,
      NOT_FOUND;
    }

    public abstract Kind kind();

    public abstract String name();

    abstract Optional<OpDescriptor> maybeOp();

    abstract Optional<String> maybeConstantName();

    public final boolean isOperation() {
      return kind() == Kind.OPERATION;
    }

    public final boolean isBlock() {
      return kind() == Kind.BLOCK;
    }

    public final OpDescriptor op() {
      Preconditions.checkState(isOperation(), "%s is not an op", name());
      return maybeOp().get();
    }

    // Name of the Op or BlockKind enum constant.
    public final String constantName() {
      Preconditions.checkState(kind() != Kind.NOT_FOUND, "%s was not found", name());
      return maybeConstantName().get();
    }

    static Resolution operation(OpDescriptor op, String constantName) {
      return new AutoValue_OpRegistry_Resolution(
          Kind.OPERATION, op.name(), Optional.of(op), Optional.of(constantName));
    }

    static Resolution block(BlockDescriptor block, String constantName) {
      return new AutoValue_OpRegistry_Resolution(
          Kind.BLOCK, block.name(), Optional.empty(), Optional.of(constantName));
    }

    static Resolution notFound(String name) {
      return new AutoValue_OpRegistry_Resolution(
          Kind.NOT_FOUND, name, Optional.empty(), Optional.empty());
    }
  }

  public static final String COPY = "Copy";

  private final String archName;
  private final ImmutableMap<String, Resolution> resolutions;

  public OpRegistry(Arch generic, Arch arch) {
    Preconditions.checkArgument(generic.isGeneric(), "%s is not the generic pool", generic.name());
    this.archName = arch.name();

    Map<String, Resolution> byName = new HashMap<>();
    generic.ops().forEach(op -> byName.put(op.name(), Resolution.operation(op, "Op" + op.name())));
    if (!arch.isGeneric()) {
      arch.ops()
          .forEach(
              op -> byName.put(op.name(), Resolution.operation(op, "Op" + archName + op.name())));
    }
    generic
        .blocks()
        .forEach(b -> byName.put(b.name(), Resolution.block(b, "Block" + b.name())));
    if (!arch.isGeneric()) {
      arch.blocks()
          .forEach(b -> byName.put(b.name(), Resolution.block(b, "Block" + archName + b.name())));
    }
    this.resolutions = ImmutableMap.copyOf(byName);
  }

  public static OpRegistry forGeneric(Arch generic) {
    return new OpRegistry(generic, generic);
  }

  public String archName() {
    return archName;
  }

  public Resolution resolve(String name) {
    Resolution resolution = resolutions.get(name);
    return resolution != null ? resolution : Resolution.notFound(name);
  }

  public boolean isBlock(String name) {
    return resolve(name).isBlock();
  }

  public Resolution resolveOp(String name, RuleReader.Pos pos) throws CompilerException {
    Resolution resolution = resolve(name);
    switch (resolution.kind()) {
      case OPERATION:
        return resolution;
      case BLOCK:
        throw new CompilerException(pos, String.format("%s is a block kind, not an op", name));
      default:
        throw new CompilerException(pos, String.format("unknown op %s", name));
    }
  }

  public Resolution resolveBlock(String name, RuleReader.Pos pos) throws CompilerException {
    Resolution resolution = resolve(name);
    if (!resolution.isBlock()) {
      throw new CompilerException(pos, String.format("unknown block kind %s", name));
    }
    return resolution;
  }
}
