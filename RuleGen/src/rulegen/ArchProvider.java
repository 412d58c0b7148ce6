package rulegen;

/**
 * Supplies one descriptor pool. Implementations are registered with
 * {@code @AutoService(ArchProvider.class)} and discovered by {@link RuleGenMain}.
 */
public interface ArchProvider {
  Arch arch();
}
