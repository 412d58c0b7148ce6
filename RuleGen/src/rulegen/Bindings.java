package rulegen;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.TypeName;

/** Variables bound while matching one rule, in binding order. */
public final class Bindings {

  public enum Kind {
    VALUE,
    TYPE,
    AUX_INT,
    AUX,
    BLOCK;

    TypeName javaType(RuntimeNames names) {
      switch (this) {
        case VALUE:
          return names.value();
        case TYPE:
          return names.type();
        case AUX_INT:
          return TypeName.LONG;
        case AUX:
          return TypeName.OBJECT;
        case BLOCK:
          return names.block();
      }
      throw new AssertionError(this);
    }
  }

  // Always in scope in generated procedures.
  public static final ImmutableSet<String> IMPLICIT_NAMES = ImmutableSet.of("v", "b", "config");

  private final Map<String, Kind> bound = new LinkedHashMap<>();

  public boolean isBound(String name) {
    return bound.containsKey(name);
  }

  public Optional<Kind> kind(String name) {
    return Optional.ofNullable(bound.get(name));
  }

  public void bind(String name, Kind kind) {
    Preconditions.checkState(bound.putIfAbsent(name, kind) == null, "%s is already bound", name);
  }

  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(bound.keySet());
  }
}
