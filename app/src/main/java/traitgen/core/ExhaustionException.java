package traitgen.core;

/** Too many consecutive items found no satisfying assignment. */
public final class ExhaustionException extends GenerationException {
  private final int generated;

  public ExhaustionException(int generated, int consecutiveFailures) {
    super(
        ErrorCode.EXHAUSTED,
        "Generation stopped: exhausted all possible unique combinations after "
            + consecutiveFailures
            + " consecutive failures. Successfully generated "
            + generated
            + " artifacts, but no more valid combinations are available with the current"
            + " uniqueness and compatibility configuration.");
    this.generated = generated;
  }

  public int generated() {
    return generated;
  }
}
