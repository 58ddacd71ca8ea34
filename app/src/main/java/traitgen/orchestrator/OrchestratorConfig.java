package traitgen.orchestrator;

/**
 * Pool tuning. Durations are milliseconds. {@code maxWorkers} of zero derives the bound from the
 * device profile.
 */
public record OrchestratorConfig(
    int minWorkers,
    int maxWorkers,
    int maxRestarts,
    int maxTaskAttempts,
    long healthCheckIntervalMs,
    long healthTimeoutMs,
    long initTimeoutMs,
    long taskTimeoutMs,
    long scalingIntervalMs,
    long idleTimeoutMs,
    double scaleUpThreshold,
    double scaleDownThreshold) {

  public static OrchestratorConfig defaults() {
    return new OrchestratorConfig(
        1, 0, 3, 4, 5_000, 3_000, 5_000, 600_000, 2_000, 30_000, 1.5, 0.5);
  }

  public static OrchestratorConfig normalize(OrchestratorConfig config) {
    OrchestratorConfig d = defaults();
    if (config == null) {
      return d;
    }
    int min = Math.max(1, config.minWorkers());
    int max = config.maxWorkers() <= 0 ? 0 : Math.max(min, config.maxWorkers());
    return new OrchestratorConfig(
        min,
        max,
        Math.max(0, config.maxRestarts()),
        config.maxTaskAttempts() > 0 ? config.maxTaskAttempts() : d.maxTaskAttempts(),
        positiveOr(config.healthCheckIntervalMs(), d.healthCheckIntervalMs()),
        positiveOr(config.healthTimeoutMs(), d.healthTimeoutMs()),
        positiveOr(config.initTimeoutMs(), d.initTimeoutMs()),
        positiveOr(config.taskTimeoutMs(), d.taskTimeoutMs()),
        positiveOr(config.scalingIntervalMs(), d.scalingIntervalMs()),
        positiveOr(config.idleTimeoutMs(), d.idleTimeoutMs()),
        config.scaleUpThreshold() > 0 ? config.scaleUpThreshold() : d.scaleUpThreshold(),
        config.scaleDownThreshold() >= 0 ? config.scaleDownThreshold() : d.scaleDownThreshold());
  }

  public OrchestratorConfig withWorkers(int min, int max) {
    return new OrchestratorConfig(
        min,
        max,
        maxRestarts,
        maxTaskAttempts,
        healthCheckIntervalMs,
        healthTimeoutMs,
        initTimeoutMs,
        taskTimeoutMs,
        scalingIntervalMs,
        idleTimeoutMs,
        scaleUpThreshold,
        scaleDownThreshold);
  }

  public OrchestratorConfig withHealth(long intervalMs, long timeoutMs) {
    return new OrchestratorConfig(
        minWorkers,
        maxWorkers,
        maxRestarts,
        maxTaskAttempts,
        intervalMs,
        timeoutMs,
        initTimeoutMs,
        taskTimeoutMs,
        scalingIntervalMs,
        idleTimeoutMs,
        scaleUpThreshold,
        scaleDownThreshold);
  }

  public OrchestratorConfig withTaskTimeout(long timeoutMs) {
    return new OrchestratorConfig(
        minWorkers,
        maxWorkers,
        maxRestarts,
        maxTaskAttempts,
        healthCheckIntervalMs,
        healthTimeoutMs,
        initTimeoutMs,
        timeoutMs,
        scalingIntervalMs,
        idleTimeoutMs,
        scaleUpThreshold,
        scaleDownThreshold);
  }

  private static long positiveOr(long value, long fallback) {
    return value > 0 ? value : fallback;
  }
}
