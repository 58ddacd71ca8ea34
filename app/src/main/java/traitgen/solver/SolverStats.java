package traitgen.solver;

/** Counters accumulated by one solver instance across its solve attempts. */
public final class SolverStats {
  private long attempts;
  private long solved;
  private long backtracks;
  private long deadEndHits;
  private long constraintChecks;
  private long revisions;
  private long uniquenessRejections;
  private long budgetExhaustions;

  void recordAttempt() {
    attempts++;
  }

  void recordSolved() {
    solved++;
  }

  void recordBacktrack() {
    backtracks++;
  }

  void recordDeadEndHit() {
    deadEndHits++;
  }

  void recordConstraintCheck() {
    constraintChecks++;
  }

  void recordRevision() {
    revisions++;
  }

  void recordUniquenessRejection() {
    uniquenessRejections++;
  }

  void recordBudgetExhaustion() {
    budgetExhaustions++;
  }

  public long attempts() {
    return attempts;
  }

  public long solved() {
    return solved;
  }

  public long failed() {
    return attempts - solved;
  }

  public long backtracks() {
    return backtracks;
  }

  public long deadEndHits() {
    return deadEndHits;
  }

  public long constraintChecks() {
    return constraintChecks;
  }

  public long uniquenessRejections() {
    return uniquenessRejections;
  }

  @Override
  public String toString() {
    return String.format(
        "attempts=%d solved=%d backtracks=%d deadEndHits=%d checks=%d revisions=%d"
            + " uniquenessRejections=%d budgetExhaustions=%d",
        attempts,
        solved,
        backtracks,
        deadEndHits,
        constraintChecks,
        revisions,
        uniquenessRejections,
        budgetExhaustions);
  }
}
