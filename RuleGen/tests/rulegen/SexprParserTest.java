package rulegen;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class SexprParserTest {

  private static final SexprParser PARSER = new SexprParser(new RuleReader.Pos("test.rules", 7));

  private static Sexpr.Operation parseOperation(String text) throws CompilerException {
    return PARSER.parseOperation(text);
  }

  private static void assertErrors(String errorSubstr, String text) {
    CompilerException ex = assertThrows(CompilerException.class, () -> PARSER.parse(text));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
    assertThat(ex.pos().lineNumber()).isEqualTo(7);
  }

  @Test
  public void leaves() throws CompilerException {
    assertThat(PARSER.parse("x").isVariable()).isTrue();
    assertThat(PARSER.parse("_")).isSameInstanceAs(Sexpr.Wildcard.instance());
    assertThat(PARSER.parse("x.args.get(0)").<Sexpr.Variable>cast().isIdentifier()).isFalse();
  }

  @Test
  public void operationWithChildren() throws CompilerException {
    Sexpr.Operation op = parseOperation("(Add64 x (Const64 [0]))");

    assertThat(op.opcode()).isEqualTo("Add64");
    assertThat(op.numChildren()).isEqualTo(2);
    assertThat(op.child(0)).isEqualTo(Sexpr.Variable.create("x"));
    Sexpr.Operation constant = op.child(1).cast();
    assertThat(constant.opcode()).isEqualTo("Const64");
    assertThat(constant.auxIntQualifier().get().text()).isEqualTo("0");
    assertThat(constant.children()).isEmpty();
  }

  @Test
  public void qualifiersInAnyOrder() throws CompilerException {
    Sexpr.Operation op = parseOperation("(MOVQload {sym} [off] <t> ptr mem)");

    assertThat(op.typeQualifier().get())
        .isEqualTo(Sexpr.Qualifier.create(Sexpr.Qualifier.Kind.TYPE, "t"));
    assertThat(op.auxIntQualifier().get().text()).isEqualTo("off");
    assertThat(op.auxQualifier().get().text()).isEqualTo("sym");
    assertThat(op.numChildren()).isEqualTo(2);
    assertThat(op.toString()).isEqualTo("(MOVQload <t> [off] {sym} ptr mem)");
  }

  @Test
  public void qualifierExpressionsKeepSpacesAndOtherBrackets() throws CompilerException {
    Sexpr.Operation op = parseOperation("(Const64 <config.fe.typeInt64()> [c > 0 ? c : -c])");

    assertThat(op.typeQualifier().get().text()).isEqualTo("config.fe.typeInt64()");
    assertThat(op.typeQualifier().get().isVariable()).isFalse();
    assertThat(op.auxIntQualifier().get().text()).isEqualTo("c > 0 ? c : -c");
  }

  @Test
  public void boundName() throws CompilerException {
    Sexpr.Operation op = parseOperation("(Store ptr x:(Load ptr mem) mem)");

    Sexpr.Operation load = op.child(1).cast();
    assertThat(load.boundName().get()).isEqualTo("x");
    assertThat(load.opcode()).isEqualTo("Load");
    assertThat(op.toString()).isEqualTo("(Store ptr x:(Load ptr mem) mem)");
  }

  @Test
  public void extraSpacesAndTabs() throws CompilerException {
    Sexpr.Operation op = parseOperation("(  Add64 \t x   y )");

    assertThat(op.opcode()).isEqualTo("Add64");
    assertThat(op.numChildren()).isEqualTo(2);
  }

  @Test
  public void errors() {
    assertErrors("duplicate", "(Const64 [0] [1])");
    assertErrors("empty qualifier", "(Const64 [])");
    assertErrors("imbalanced", "(Add64 (Neg64 x)");
    assertErrors("missing opcode", "()");
    assertErrors("missing opcode", "((Add64 x y))");
    assertErrors("non-compound", "(Add64 x y) z");
    assertErrors("illegal binding name", "(Add64 1x:(Neg64 y) z)");
    assertErrors("empty expression", "   ");
  }

  @Test
  public void patternMustBeAnOperation() {
    CompilerException ex =
        assertThrows(CompilerException.class, () -> PARSER.parseOperation("x"));
    assertThat(ex).hasMessageThat().contains("expected a parenthesized expression");
  }

  @Test
  public void split() throws CompilerException {
    assertThat(PARSER.split("a (b c) <d e> [f] {g h}"))
        .containsExactly("a", "(b c)", "<d e>", "[f]", "{g h}")
        .inOrder();
    // Only the opening bracket kind counts, so '>' inside [] is plain text.
    assertThat(PARSER.split("[c > 0] x")).containsExactly("[c > 0]", "x").inOrder();
  }
}
