package traitgen.generation;

/** Cooperative cancel flag, polled by the controller at loop boundaries. */
public final class CancellationToken {
  private volatile boolean cancelled;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
