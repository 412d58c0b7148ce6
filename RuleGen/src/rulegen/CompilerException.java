package rulegen;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final RuleReader.Pos pos;
  private final String errorMsg;

  public CompilerException(RuleReader.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public RuleReader.Pos pos() {
    return pos;
  }

  public void print() {
    System.err.println(String.format("ERROR: %s %s", pos, errorMsg));
  }
}
