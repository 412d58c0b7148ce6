package rulegen;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class RuleReaderTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<Rule> read() throws CompilerException {
    return new RuleReader("test.rules", file.toString()).read();
  }

  @Test
  public void emptyFile() throws CompilerException {
    assertThat(read()).isEmpty();
  }

  @Test
  public void commentsAndBlankLines() throws CompilerException {
    println("// Lowering rules.");
    println("");
    println("   // indented comment");

    assertThat(read()).isEmpty();
  }

  @Test
  public void singleLineRule() throws CompilerException {
    println("(Add64 x (Const64 [0])) -> x // identity");

    ImmutableList<Rule> rules = read();

    assertThat(rules).hasSize(1);
    assertThat(rules.get(0).text()).isEqualTo("(Add64 x (Const64 [0])) -> x");
    assertThat(rules.get(0).pos()).isEqualTo(new RuleReader.Pos("test.rules", 1));
  }

  @Test
  public void ruleContinuesAfterTrailingArrow() throws CompilerException {
    println("// header");
    println("(Sub64 x x) ->");
    println("(Const64 [0])");

    ImmutableList<Rule> rules = read();

    assertThat(rules).hasSize(1);
    assertThat(rules.get(0).text()).isEqualTo("(Sub64 x x) -> (Const64 [0])");
    assertThat(rules.get(0).pos().lineNumber()).isEqualTo(2);
  }

  @Test
  public void ruleContinuesUntilBalanced() throws CompilerException {
    println("(Mul64 x (Const64 [c])) && isPowerOfTwo(c) -> (Lsh64x64 x");
    println("(Const64 <config.fe.typeUInt64()> [log2(c)]))");
    println("(Neg64 (Neg64 x)) -> x");

    ImmutableList<Rule> rules = read();

    assertThat(rules).hasSize(2);
    assertThat(rules.get(0).text())
        .isEqualTo(
            "(Mul64 x (Const64 [c])) && isPowerOfTwo(c) -> (Lsh64x64 x "
                + "(Const64 <config.fe.typeUInt64()> [log2(c)]))");
    assertThat(rules.get(1).pos().lineNumber()).isEqualTo(3);
  }

  @Test
  public void positionIsLineOfArrow() throws CompilerException {
    println("(Add64");
    println("  x");
    println("  y) -> (Add64 y x)");

    assertThat(read().get(0).pos().lineNumber()).isEqualTo(3);
  }

  @Test
  public void carriageReturnsIgnored() throws CompilerException {
    file.append("(Neg64 (Neg64 x)) -> x\r\n(Not (Not x)) -> x\r\n");

    assertThat(read()).hasSize(2);
  }

  @Test
  public void unbalancedAtEndOfFile() {
    println("(Add64 x y) -> x");
    println("");
    println("(Add64 (Const64 [c]) -> x");
    println("");

    CompilerException ex = assertThrows(CompilerException.class, this::read);
    assertThat(ex).hasMessageThat().contains("unbalanced rule");
    assertThat(ex.pos()).isEqualTo(new RuleReader.Pos("test.rules", 3));
  }

  @Test
  public void danglingArrowAtEndOfFile() {
    println("(Add64 x y) -> x");
    println("(Add64 x y) ->");
    println("");

    CompilerException ex = assertThrows(CompilerException.class, this::read);
    assertThat(ex).hasMessageThat().contains("incomplete rule");
    // Reported where the rule starts, not at the last line read.
    assertThat(ex.pos()).isEqualTo(new RuleReader.Pos("test.rules", 2));
  }

  @Test
  public void innerWhitespaceIsKept() throws CompilerException {
    println("(Add64 x");
    println("    y) -> (Add64 y x)");

    assertThat(read().get(0).text()).isEqualTo("(Add64 x     y) -> (Add64 y x)");
  }

  @Test
  public void commentInsideStringIsStillAComment() throws CompilerException {
    // Comment stripping does not look at quotes.
    println("(ConstString {\"a//b\"}) -> (ConstNil)");

    CompilerException ex = assertThrows(CompilerException.class, this::read);
    assertThat(ex).hasMessageThat().contains("unbalanced rule");
  }

  @Test
  public void isBalanced() {
    assertThat(RuleReader.isBalanced("(a [b] {c})")).isTrue();
    assertThat(RuleReader.isBalanced("(a (b)")).isFalse();
    assertThat(RuleReader.isBalanced("[c]]")).isFalse();
    assertThat(RuleReader.isBalanced("{")).isFalse();
  }
}
