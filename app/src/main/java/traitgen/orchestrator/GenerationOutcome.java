package traitgen.orchestrator;

import traitgen.core.ErrorCode;
import traitgen.generation.RunStats;

/** Terminal notice of one submitted run. {@code code} is set only for failures. */
public record GenerationOutcome(
    Status status, int generated, int requested, String message, ErrorCode code, RunStats stats) {

  public enum Status {
    COMPLETED,
    FAILED,
    CANCELLED
  }

  public static GenerationOutcome completed(int generated, int requested, RunStats stats) {
    String message = "Generated " + generated + " artifacts";
    return new GenerationOutcome(Status.COMPLETED, generated, requested, message, null, stats);
  }

  public static GenerationOutcome failed(
      ErrorCode code, String message, int generated, int requested) {
    return new GenerationOutcome(Status.FAILED, generated, requested, message, code, null);
  }

  public static GenerationOutcome cancelled(int generated, int requested) {
    return new GenerationOutcome(
        Status.CANCELLED, generated, requested, "Cancelled after " + generated, null, null);
  }

  public boolean succeeded() {
    return status == Status.COMPLETED;
  }
}
