package rulegen;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

// Typed s-expression tree shared by rule patterns and rule results.
public abstract class Sexpr {

  public enum Type {
    VARIABLE,
    WILDCARD,
    OPERATION;
  }

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z_0-9]*");

  public static boolean isIdentifier(String s) {
    return IDENTIFIER.matcher(s).matches();
  }

  public abstract Type type();

  public final boolean isVariable() {
    return type() == Type.VARIABLE;
  }

  public final boolean isWildcard() {
    return type() == Type.WILDCARD;
  }

  public final boolean isOperation() {
    return type() == Type.OPERATION;
  }

  @SuppressWarnings("unchecked")
  public <T extends Sexpr> T cast() {
    return (T) this;
  }

  // A bare token. In a pattern this is always an identifier; in a result it may be any expression.
  @AutoValue
  public abstract static class Variable extends Sexpr {
    public abstract String name();

    @Override
    public final Type type() {
      return Type.VARIABLE;
    }

    public final boolean isIdentifier() {
      return Sexpr.isIdentifier(name());
    }

    public static Variable create(String name) {
      return new AutoValue_Sexpr_Variable(name);
    }

    @Override
    public final String toString() {
      return name();
    }
  }

  @AutoValue
  public abstract static class Wildcard extends Sexpr {
    public static final String TOKEN = "_";

    private static final Wildcard INSTANCE = new AutoValue_Sexpr_Wildcard();

    @Override
    public final Type type() {
      return Type.WILDCARD;
    }

    public static Wildcard instance() {
      return INSTANCE;
    }

    @Override
    public final String toString() {
      return TOKEN;
    }
  }

  // The contents of a <type>, [auxint] or {aux} segment.
  @AutoValue
  public abstract static class Qualifier {
    public enum Kind {
      TYPE('<', '>'),
      AUX_INT('[', ']'),
      AUX('{', '}');

      private final char open;
      private final char close;

      Kind(char open, char close) {
        this.open = open;
        this.close = close;
      }

      public char open() {
        return open;
      }

      public char close() {
        return close;
      }
    }

    public abstract Kind kind();

    public abstract String text();

    public final boolean isVariable() {
      return Sexpr.isIdentifier(text());
    }

    public static Qualifier create(Kind kind, String text) {
      return new AutoValue_Sexpr_Qualifier(kind, text);
    }

    @Override
    public final String toString() {
      return kind().open() + text() + kind().close();
    }
  }

  @AutoValue
  public abstract static class Operation extends Sexpr {
    public abstract String opcode();

    // Set by the "name:(...)" form.
    public abstract Optional<String> boundName();

    public abstract Optional<Qualifier> typeQualifier();

    public abstract Optional<Qualifier> auxIntQualifier();

    public abstract Optional<Qualifier> auxQualifier();

    public abstract ImmutableList<Sexpr> children();

    @Override
    public final Type type() {
      return Type.OPERATION;
    }

    public final int numChildren() {
      return children().size();
    }

    public final Sexpr child(int index) {
      return children().get(index);
    }

    public static Builder builder(String opcode) {
      return new AutoValue_Sexpr_Operation.Builder().setOpcode(opcode);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setOpcode(String opcode);

      public abstract Builder setBoundName(String boundName);

      public abstract Builder setTypeQualifier(Qualifier qualifier);

      public abstract Builder setAuxIntQualifier(Qualifier qualifier);

      public abstract Builder setAuxQualifier(Qualifier qualifier);

      public abstract ImmutableList.Builder<Sexpr> childrenBuilder();

      public final Builder addChild(Sexpr child) {
        childrenBuilder().add(child);
        return this;
      }

      public abstract Operation build();
    }

    @Override
    public final String toString() {
      String body =
          Stream.of(
                  Stream.of(opcode()),
                  typeQualifier().map(Qualifier::toString).stream(),
                  auxIntQualifier().map(Qualifier::toString).stream(),
                  auxQualifier().map(Qualifier::toString).stream(),
                  children().stream().map(Sexpr::toString))
              .flatMap(s -> s)
              .collect(Collectors.joining(" ", "(", ")"));
      return boundName().map(n -> n + ":" + body).orElse(body);
    }
  }
}
