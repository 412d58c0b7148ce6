package rulegen;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class OpRegistryTest {

  private static final RuleReader.Pos POS = new RuleReader.Pos("TEST.rules", 3);

  private final OpRegistry registry = SyntheticArchs.testRegistry();

  @Test
  public void genericOp() throws CompilerException {
    OpRegistry.Resolution resolution = registry.resolveOp("Add64", POS);

    assertThat(resolution.isOperation()).isTrue();
    assertThat(resolution.constantName()).isEqualTo("OpAdd64");
    assertThat(resolution.op().argLength()).isEqualTo(2);
  }

  @Test
  public void archOp() throws CompilerException {
    OpRegistry.Resolution resolution = registry.resolveOp("ADDQconst", POS);

    assertThat(resolution.constantName()).isEqualTo("OpTESTADDQconst");
    assertThat(resolution.op().auxKind()).isEqualTo(AuxKind.INT64);
  }

  @Test
  public void archPoolShadowsGeneric() throws CompilerException {
    assertThat(registry.resolveOp("Neg64", POS).constantName()).isEqualTo("OpTESTNeg64");
    assertThat(SyntheticArchs.genericRegistry().resolveOp("Neg64", POS).constantName())
        .isEqualTo("OpNeg64");
  }

  @Test
  public void blocks() throws CompilerException {
    assertThat(registry.isBlock("If")).isTrue();
    assertThat(registry.isBlock("LT")).isTrue();
    assertThat(registry.isBlock("Add64")).isFalse();
    assertThat(registry.resolveBlock("If", POS).constantName()).isEqualTo("BlockIf");
    assertThat(registry.resolveBlock("LT", POS).constantName()).isEqualTo("BlockTESTLT");
  }

  @Test
  public void blockShadowsOpOfSameName() {
    Arch generic =
        Arch.builder(Arch.GENERIC).addOp("Copy", 1).addOp("Exit", 1).addBlocks("Exit").build();
    OpRegistry shadowed = OpRegistry.forGeneric(generic);

    assertThat(shadowed.resolve("Exit").isBlock()).isTrue();
    CompilerException ex =
        assertThrows(CompilerException.class, () -> shadowed.resolveOp("Exit", POS));
    assertThat(ex).hasMessageThat().contains("Exit is a block kind, not an op");
  }

  @Test
  public void notFound() {
    assertThat(registry.resolve("Bogus").kind()).isEqualTo(OpRegistry.Resolution.Kind.NOT_FOUND);

    CompilerException ex =
        assertThrows(CompilerException.class, () -> registry.resolveOp("Bogus", POS));
    assertThat(ex).hasMessageThat().contains("unknown op Bogus");
    assertThat(ex.pos()).isEqualTo(POS);

    ex = assertThrows(CompilerException.class, () -> registry.resolveBlock("Add64", POS));
    assertThat(ex).hasMessageThat().contains("unknown block kind Add64");
  }

  @Test
  public void archNameOfGenericRegistry() {
    assertThat(SyntheticArchs.genericRegistry().archName()).isEqualTo(Arch.GENERIC);
    assertThat(registry.archName()).isEqualTo(SyntheticArchs.TEST_ARCH);
  }

  @Test
  public void rejectsNonGenericBase() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new OpRegistry(SyntheticArchs.test(), SyntheticArchs.test()));
  }
}
