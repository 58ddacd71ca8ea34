package traitgen.core;

/** The requested count cannot be met; raised before any artifact is generated. */
public final class FeasibilityException extends GenerationException {
  private final int requested;
  private final long ceiling;

  public FeasibilityException(int requested, long ceiling, String message) {
    super(ErrorCode.INFEASIBLE, message);
    this.requested = requested;
    this.ceiling = ceiling;
  }

  public int requested() {
    return requested;
  }

  public long ceiling() {
    return ceiling;
  }
}
