package traitgen.generation;

/** Lifecycle of one {@link GenerationController}. */
public enum RunState {
  IDLE,
  VALIDATING,
  RUNNING_STREAMING,
  RUNNING_CHUNKED,
  COMPLETED,
  CANCELLED,
  FAILED;

  public boolean terminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}
