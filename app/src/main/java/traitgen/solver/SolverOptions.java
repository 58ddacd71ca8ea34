package traitgen.solver;

/** Tuning knobs of {@link ConstraintSolver}. */
public record SolverOptions(
    CandidateOrdering ordering, int deadEndCacheCapacity, long maxNodesPerSolve) {

  public static SolverOptions defaults() {
    return new SolverOptions(CandidateOrdering.RARITY_FIRST, 1000, 250_000L);
  }

  public static SolverOptions normalize(SolverOptions options) {
    if (options == null) {
      return defaults();
    }
    SolverOptions defaults = defaults();
    CandidateOrdering ordering =
        options.ordering() != null ? options.ordering() : defaults.ordering();
    int capacity = Math.max(0, options.deadEndCacheCapacity());
    long maxNodes =
        options.maxNodesPerSolve() > 0 ? options.maxNodesPerSolve() : defaults.maxNodesPerSolve();
    return new SolverOptions(ordering, capacity, maxNodes);
  }
}
