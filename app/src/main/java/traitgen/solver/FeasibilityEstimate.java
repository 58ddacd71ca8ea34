package traitgen.solver;

import java.util.Map;

/**
 * Upper bound on how many artifacts one run can produce.
 *
 * @param ceiling achievable count, {@link #UNBOUNDED} when uniqueness never limits the run
 * @param exact whether the ceiling is guaranteed: one active group, enumerated within budget
 * @param reason human-readable summary of the limiting factor
 * @param perGroup ceiling per active uniqueness group id
 */
public record FeasibilityEstimate(
    long ceiling, boolean exact, String reason, Map<String, Long> perGroup) {

  public static final long UNBOUNDED = Long.MAX_VALUE;

  public FeasibilityEstimate {
    perGroup = perGroup == null ? Map.of() : Map.copyOf(perGroup);
  }

  public boolean unbounded() {
    return ceiling == UNBOUNDED;
  }

  public boolean admits(long requested) {
    return requested <= ceiling;
  }

  @Override
  public String toString() {
    String shown = unbounded() ? "unbounded" : Long.toString(ceiling);
    return "FeasibilityEstimate[" + shown + (exact ? "" : " (approximate)") + ", " + reason + "]";
  }
}
