package rulegen;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** A pool of operation and block descriptors: the generic one, or one per architecture. */
@AutoValue
public abstract class Arch {
  public static final String GENERIC = "generic";

  public abstract String name();

  public abstract ImmutableList<OpDescriptor> ops();

  public abstract ImmutableList<BlockDescriptor> blocks();

  public final boolean isGeneric() {
    return name().equals(GENERIC);
  }

  public static Builder builder(String name) {
    return new AutoValue_Arch.Builder().setName(name);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    abstract ImmutableList.Builder<OpDescriptor> opsBuilder();

    abstract ImmutableList.Builder<BlockDescriptor> blocksBuilder();

    @CanIgnoreReturnValue
    public final Builder addOp(OpDescriptor op) {
      opsBuilder().add(op);
      return this;
    }

    @CanIgnoreReturnValue
    public final Builder addOp(String name, int argLength) {
      return addOp(OpDescriptor.of(name, argLength));
    }

    @CanIgnoreReturnValue
    public final Builder addOp(String name, int argLength, AuxKind auxKind) {
      return addOp(OpDescriptor.builder(name).setArgLength(argLength).setAuxKind(auxKind).build());
    }

    @CanIgnoreReturnValue
    public final Builder addTypedOp(String name, int argLength, AuxKind auxKind, String type) {
      return addOp(
          OpDescriptor.builder(name)
              .setArgLength(argLength)
              .setAuxKind(auxKind)
              .setDefaultType(type)
              .build());
    }

    @CanIgnoreReturnValue
    public final Builder addBlocks(String... names) {
      for (String name : names) {
        blocksBuilder().add(BlockDescriptor.of(name));
      }
      return this;
    }

    public abstract Arch build();
  }
}
