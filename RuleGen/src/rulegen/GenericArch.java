package rulegen;

import com.google.auto.service.AutoService;

/** Machine-independent ops and block kinds. Every architecture's rules may use these. */
@AutoService(ArchProvider.class)
public final class GenericArch implements ArchProvider {

  @Override
  public Arch arch() {
    Arch.Builder arch = Arch.builder(Arch.GENERIC);

    for (String width : new String[] {"8", "16", "32", "64"}) {
      arch.addOp("Add" + width, 2)
          .addOp("Sub" + width, 2)
          .addOp("Mul" + width, 2)
          .addOp("And" + width, 2)
          .addOp("Or" + width, 2)
          .addOp("Xor" + width, 2)
          .addOp("Neg" + width, 1)
          .addOp("Com" + width, 1)
          .addOp("Lsh" + width + "x64", 2)
          .addOp("Rsh" + width + "x64", 2)
          .addOp("Rsh" + width + "Ux64", 2)
          .addTypedOp("Eq" + width, 2, AuxKind.NONE, "Bool")
          .addTypedOp("Neq" + width, 2, AuxKind.NONE, "Bool")
          .addTypedOp("Less" + width, 2, AuxKind.NONE, "Bool")
          .addTypedOp("Leq" + width, 2, AuxKind.NONE, "Bool")
          .addTypedOp("Greater" + width, 2, AuxKind.NONE, "Bool")
          .addTypedOp("Geq" + width, 2, AuxKind.NONE, "Bool");
    }
    arch.addTypedOp("Const8", 0, AuxKind.INT8, "Int8")
        .addTypedOp("Const16", 0, AuxKind.INT16, "Int16")
        .addTypedOp("Const32", 0, AuxKind.INT32, "Int32")
        .addTypedOp("Const64", 0, AuxKind.INT64, "Int64")
        .addTypedOp("Const32F", 0, AuxKind.FLOAT32, "Float32")
        .addTypedOp("Const64F", 0, AuxKind.FLOAT64, "Float64")
        .addTypedOp("ConstBool", 0, AuxKind.BOOL, "Bool")
        .addOp("ConstString", 0, AuxKind.STRING)
        .addOp("ConstNil", 0)
        .addOp("ConstSlice", 0)
        .addOp("ConstInterface", 0);

    arch.addOp("AddPtr", 2)
        .addOp("OffPtr", 1, AuxKind.INT64)
        .addOp("PtrIndex", 2)
        .addTypedOp("EqPtr", 2, AuxKind.NONE, "Bool")
        .addTypedOp("NeqPtr", 2, AuxKind.NONE, "Bool")
        .addTypedOp("Not", 1, AuxKind.NONE, "Bool")
        .addTypedOp("AndB", 2, AuxKind.NONE, "Bool")
        .addTypedOp("OrB", 2, AuxKind.NONE, "Bool")
        .addTypedOp("IsNonNil", 1, AuxKind.NONE, "Bool")
        .addTypedOp("IsInBounds", 2, AuxKind.NONE, "Bool")
        .addTypedOp("IsSliceInBounds", 2, AuxKind.NONE, "Bool");

    // SSA plumbing.
    arch.addOp("Phi", OpDescriptor.VARIABLE_ARITY)
        .addOp("Copy", 1)
        .addOp("Convert", 2)
        .addOp("FwdRef", 0, AuxKind.SYM)
        .addOp("Arg", 0, AuxKind.SYM_OFF)
        .addOp("Addr", 1, AuxKind.SYM)
        .addTypedOp("SP", 0, AuxKind.NONE, "Uintptr")
        .addTypedOp("SB", 0, AuxKind.NONE, "Uintptr")
        .addTypedOp("InitMem", 0, AuxKind.NONE, "Mem")
        .addOp("GetClosurePtr", 0);

    // Memory.
    arch.addOp("Load", 2)
        .addTypedOp("Store", 3, AuxKind.INT64, "Mem")
        .addTypedOp("Move", 3, AuxKind.INT64, "Mem")
        .addTypedOp("Zero", 2, AuxKind.INT64, "Mem")
        .addTypedOp("VarDef", 1, AuxKind.SYM, "Mem")
        .addTypedOp("VarKill", 1, AuxKind.SYM, "Mem")
        .addTypedOp("ClosureCall", 3, AuxKind.INT64, "Mem")
        .addTypedOp("StaticCall", 1, AuxKind.SYM_OFF, "Mem");

    // Composite values.
    arch.addOp("StringMake", 2)
        .addOp("StringPtr", 1)
        .addOp("StringLen", 1)
        .addOp("SliceMake", 3)
        .addOp("SlicePtr", 1)
        .addOp("SliceLen", 1)
        .addOp("SliceCap", 1)
        .addOp("IMake", 2)
        .addOp("ITab", 1)
        .addOp("IData", 1)
        .addOp("StructMake0", 0)
        .addOp("StructMake1", 1)
        .addOp("StructMake2", 2)
        .addOp("StructSelect", 1, AuxKind.INT64);

    arch.addBlocks(
        "Plain", "If", "Call", "Check", "Defer", "Ret", "RetJmp", "Exit", "First", "Dead");
    return arch.build();
  }
}
