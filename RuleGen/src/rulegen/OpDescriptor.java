package rulegen;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class OpDescriptor {
  public static final int VARIABLE_ARITY = -1;

  public abstract String name();

  // Number of arguments, or VARIABLE_ARITY.
  public abstract int argLength();

  public abstract AuxKind auxKind();

  // Name of the type a new value of this op gets when a rule does not say, e.g. "Int64" or "Mem".
  public abstract Optional<String> defaultType();

  public final boolean hasVariableArity() {
    return argLength() == VARIABLE_ARITY;
  }

  public static Builder builder(String name) {
    return new AutoValue_OpDescriptor.Builder()
        .setName(name)
        .setArgLength(0)
        .setAuxKind(AuxKind.NONE);
  }

  public static OpDescriptor of(String name, int argLength) {
    return builder(name).setArgLength(argLength).build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setArgLength(int argLength);

    public abstract Builder setAuxKind(AuxKind auxKind);

    public abstract Builder setDefaultType(String defaultType);

    abstract OpDescriptor autoBuild();

    public final OpDescriptor build() {
      OpDescriptor op = autoBuild();
      Preconditions.checkState(
          op.argLength() >= VARIABLE_ARITY, "bad arg length %s for %s", op.argLength(), op.name());
      return op;
    }
  }
}
