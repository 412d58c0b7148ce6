package rulegen.ir;

public enum BlockKind {
  BlockInvalid,
  BlockPlain,
  BlockIf,
  BlockFirst,
  BlockExit,
  BlockDead,
  BlockTESTLT,
  BlockTESTGE;
}
