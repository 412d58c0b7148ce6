package rulegen;

import com.google.auto.service.AutoService;

/** A subset of the AMD64 machine ops: integer arithmetic, compares, flags and loads/stores. */
@AutoService(ArchProvider.class)
public final class Amd64Arch implements ArchProvider {
  public static final String NAME = "AMD64";

  @Override
  public Arch arch() {
    Arch.Builder arch = Arch.builder(NAME);

    for (String suffix : new String[] {"Q", "L"}) {
      arch.addOp("ADD" + suffix, 2)
          .addOp("ADD" + suffix + "const", 1, AuxKind.INT64)
          .addOp("SUB" + suffix, 2)
          .addOp("SUB" + suffix + "const", 1, AuxKind.INT64)
          .addOp("IMUL" + suffix, 2)
          .addOp("AND" + suffix, 2)
          .addOp("AND" + suffix + "const", 1, AuxKind.INT64)
          .addOp("OR" + suffix, 2)
          .addOp("XOR" + suffix, 2)
          .addOp("NEG" + suffix, 1)
          .addOp("NOT" + suffix, 1)
          .addOp("SHL" + suffix, 2)
          .addOp("SHL" + suffix + "const", 1, AuxKind.INT64)
          .addTypedOp("CMP" + suffix, 2, AuxKind.NONE, "Flags")
          .addTypedOp("CMP" + suffix + "const", 1, AuxKind.INT64, "Flags")
          .addTypedOp("TEST" + suffix, 2, AuxKind.NONE, "Flags");
    }
    arch.addTypedOp("MOVQconst", 0, AuxKind.INT64, "UInt64")
        .addTypedOp("MOVLconst", 0, AuxKind.INT32, "UInt32")
        .addTypedOp("MOVBconst", 0, AuxKind.INT8, "UInt8")
        .addTypedOp("InvertFlags", 1, AuxKind.NONE, "Flags");

    for (String cond : new String[] {"EQ", "NE", "L", "LE", "G", "GE", "B", "BE", "A", "AE"}) {
      arch.addTypedOp("SET" + cond, 1, AuxKind.NONE, "UInt8");
    }

    arch.addOp("LEAQ", 1, AuxKind.SYM_OFF)
        .addOp("MOVQload", 2, AuxKind.SYM_OFF)
        .addOp("MOVLload", 2, AuxKind.SYM_OFF)
        .addOp("MOVBload", 2, AuxKind.SYM_OFF)
        .addTypedOp("MOVQstore", 3, AuxKind.SYM_OFF, "Mem")
        .addTypedOp("MOVLstore", 3, AuxKind.SYM_OFF, "Mem")
        .addTypedOp("MOVBstore", 3, AuxKind.SYM_OFF, "Mem")
        .addTypedOp("MOVQstoreconst", 2, AuxKind.SYM_VAL_AND_OFF, "Mem")
        .addTypedOp("CALLstatic", 1, AuxKind.SYM_OFF, "Mem")
        .addOp("LoweredGetClosurePtr", 0)
        .addOp("LoweredNilCheck", 2);

    arch.addBlocks("EQ", "NE", "LT", "LE", "GT", "GE", "ULT", "ULE", "UGT", "UGE");
    return arch.build();
  }
}
