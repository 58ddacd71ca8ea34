package traitgen.core;

/** Machine-readable failure classes carried by error notices. */
public enum ErrorCode {
  INVALID_CATALOG(false),
  INFEASIBLE(false),
  EXHAUSTED(false),
  RENDER_FAILED(true),
  TASK_TIMEOUT(false),
  POOL_EXHAUSTED(false),
  POOL_SHUTDOWN(false),
  WORKER_BUSY(true),
  UNKNOWN_MESSAGE(false),
  INTERNAL(false);

  private final boolean recoverable;

  ErrorCode(boolean recoverable) {
    this.recoverable = recoverable;
  }

  public boolean recoverable() {
    return recoverable;
  }
}
