package traitgen.orchestrator;

public enum WorkerHealth {
  INITIALIZING,
  HEALTHY,
  /** Answering, but slowly or with repeated task errors; scheduled only as a last resort. */
  DEGRADED,
  UNRESPONSIVE,
  REMOVED;

  public boolean schedulable() {
    return this == HEALTHY || this == DEGRADED;
  }

  public boolean live() {
    return this != REMOVED;
  }
}
