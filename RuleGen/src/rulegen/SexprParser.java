package rulegen;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** Parses the pattern or result side of a rule into a {@link Sexpr} tree. */
public final class SexprParser {
  private static final String OPENERS = "(<[{";
  private static final String CLOSERS = ")>]}";

  private final RuleReader.Pos pos;

  public SexprParser(RuleReader.Pos pos) {
    this.pos = pos;
  }

  public Sexpr parse(String text) throws CompilerException {
    text = text.trim();
    if (text.isEmpty()) {
      throw error("empty expression");
    }
    if (text.charAt(0) == '(') {
      return parseOperation(text, Optional.empty());
    }
    return parseLeaf(text);
  }

  public Sexpr.Operation parseOperation(String text) throws CompilerException {
    Sexpr sexpr = parse(text);
    if (!sexpr.isOperation()) {
      throw error(String.format("expected a parenthesized expression, got '%s'", text.trim()));
    }
    return sexpr.cast();
  }

  private Sexpr parseLeaf(String token) {
    if (token.equals(Sexpr.Wildcard.TOKEN)) {
      return Sexpr.Wildcard.instance();
    }
    return Sexpr.Variable.create(token);
  }

  private Sexpr.Operation parseOperation(String text, Optional<String> boundName)
      throws CompilerException {
    if (text.charAt(text.length() - 1) != ')') {
      throw error(String.format("non-compound expression '%s'", text));
    }

    ImmutableList<String> tokens = split(text.substring(1, text.length() - 1));
    if (tokens.isEmpty() || !Sexpr.isIdentifier(tokens.get(0))) {
      throw error(String.format("missing opcode in '%s'", text));
    }

    Sexpr.Operation.Builder builder = Sexpr.Operation.builder(tokens.get(0));
    boundName.ifPresent(builder::setBoundName);

    Optional<Sexpr.Qualifier> typeQualifier = Optional.empty();
    Optional<Sexpr.Qualifier> auxIntQualifier = Optional.empty();
    Optional<Sexpr.Qualifier> auxQualifier = Optional.empty();
    for (String token : tokens.subList(1, tokens.size())) {
      switch (token.charAt(0)) {
        case '<':
          typeQualifier = qualifier(typeQualifier, Sexpr.Qualifier.Kind.TYPE, token);
          break;
        case '[':
          auxIntQualifier = qualifier(auxIntQualifier, Sexpr.Qualifier.Kind.AUX_INT, token);
          break;
        case '{':
          auxQualifier = qualifier(auxQualifier, Sexpr.Qualifier.Kind.AUX, token);
          break;
        default:
          builder.addChild(parseChild(token));
          break;
      }
    }
    typeQualifier.ifPresent(builder::setTypeQualifier);
    auxIntQualifier.ifPresent(builder::setAuxIntQualifier);
    auxQualifier.ifPresent(builder::setAuxQualifier);
    return builder.build();
  }

  private Sexpr parseChild(String token) throws CompilerException {
    if (token.charAt(0) == '(') {
      return parseOperation(token, Optional.empty());
    }

    // name:(op ...)
    int colon = token.indexOf(':');
    int openParen = token.indexOf('(');
    if (colon > 0 && openParen == colon + 1) {
      String name = token.substring(0, colon);
      if (!Sexpr.isIdentifier(name)) {
        throw error(String.format("illegal binding name '%s'", name));
      }
      return parseOperation(token.substring(openParen), Optional.of(name));
    }

    return parseLeaf(token);
  }

  private Optional<Sexpr.Qualifier> qualifier(
      Optional<Sexpr.Qualifier> previous, Sexpr.Qualifier.Kind kind, String token)
      throws CompilerException {
    if (previous.isPresent()) {
      throw error(String.format("duplicate %c%c qualifier: %s", kind.open(), kind.close(), token));
    }
    if (token.charAt(token.length() - 1) != kind.close()) {
      throw error(String.format("malformed qualifier '%s'", token));
    }
    String text = token.substring(1, token.length() - 1).trim();
    if (text.isEmpty()) {
      throw error(String.format("empty qualifier '%s'", token));
    }
    return Optional.of(Sexpr.Qualifier.create(kind, text));
  }

  /**
   * Splits on spaces and tabs that are not enclosed by (), <>, [] or {}. Only the kind of bracket
   * that opened the current group is counted, so a '>' inside [c > 0] does not close anything.
   */
  ImmutableList<String> split(String s) throws CompilerException {
    ImmutableList.Builder<String> tokens = ImmutableList.builder();
    int depth = 0;
    char open = 0;
    char close = 0;
    int start = -1;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (depth > 0) {
        if (ch == open) {
          depth++;
        } else if (ch == close) {
          depth--;
        }
        continue;
      }

      if (ch == ' ' || ch == '\t') {
        if (start >= 0) {
          tokens.add(s.substring(start, i));
          start = -1;
        }
        continue;
      }

      if (start < 0) {
        start = i;
      }
      int kind = OPENERS.indexOf(ch);
      if (kind >= 0) {
        open = ch;
        close = CLOSERS.charAt(kind);
        depth = 1;
      }
    }

    if (depth != 0) {
      throw error(String.format("imbalanced expression: %s", s.substring(Math.max(start, 0))));
    }
    if (start >= 0) {
      tokens.add(s.substring(start));
    }
    return tokens.build();
  }

  private CompilerException error(String msg) {
    return new CompilerException(pos, msg);
  }
}
