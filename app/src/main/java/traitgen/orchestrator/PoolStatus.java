package traitgen.orchestrator;

/** Point-in-time view of the pool, published after every orchestrator state change. */
public record PoolStatus(
    int workers, int healthy, int degraded, int removed, int restarts, int queued, int active) {

  public static PoolStatus empty() {
    return new PoolStatus(0, 0, 0, 0, 0, 0, 0);
  }
}
