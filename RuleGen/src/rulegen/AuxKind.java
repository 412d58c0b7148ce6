package rulegen;

/** What an operation stores in its auxint and aux fields. */
public enum AuxKind {
  NONE(false, false),
  BOOL(true, false),
  INT8(true, false),
  INT16(true, false),
  INT32(true, false),
  INT64(true, false),
  INT128(true, false),
  FLOAT32(true, false),
  FLOAT64(true, false),
  SYM_OFF(true, true),
  SYM_VAL_AND_OFF(true, true),
  SYM_INT32(true, true),
  STRING(false, true),
  SYM(false, true);

  private final boolean allowsAuxInt;
  private final boolean allowsAux;

  AuxKind(boolean allowsAuxInt, boolean allowsAux) {
    this.allowsAuxInt = allowsAuxInt;
    this.allowsAux = allowsAux;
  }

  public boolean allowsAuxInt() {
    return allowsAuxInt;
  }

  public boolean allowsAux() {
    return allowsAux;
  }
}
