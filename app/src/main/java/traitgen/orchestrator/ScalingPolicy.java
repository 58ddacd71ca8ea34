package traitgen.orchestrator;

import traitgen.generation.DeviceProfile;

/**
 * Pool sizing as a pure function of pool load, device profile and configuration. Moves at most one
 * worker per evaluation.
 */
public final class ScalingPolicy {
  static final double CPU_SHARE = 0.75;
  static final int MB_PER_WORKER = 128;
  static final int HARD_MAX = 4;

  private ScalingPolicy() {}

  /** Device-derived upper bound, unless the configuration sets one. */
  public static int maxWorkers(DeviceProfile device, OrchestratorConfig config) {
    if (config.maxWorkers() > 0) {
      return Math.max(config.minWorkers(), config.maxWorkers());
    }
    int byCpu = (int) Math.floor(device.cores() * CPU_SHARE);
    int byMemory = (int) Math.floor(device.memoryGb() * 1024 / MB_PER_WORKER);
    int max = Math.max(1, Math.min(HARD_MAX, Math.min(byCpu, byMemory)));
    if (device.mobile()) {
      max = Math.max(1, max / 2);
    }
    return Math.max(config.minWorkers(), max);
  }

  /**
   * Queue pressure: weighted queued plus active load per live worker. An empty pool with pending
   * work reports infinite pressure.
   */
  public static double pressure(double weightedLoad, int liveWorkers) {
    if (liveWorkers <= 0) {
      return weightedLoad > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }
    return weightedLoad / liveWorkers;
  }

  /**
   * Target worker count for the next evaluation.
   *
   * @param liveWorkers workers that are not removed
   * @param weightedLoad sum of the scaling weights of queued and running tasks
   */
  public static int target(
      int liveWorkers, double weightedLoad, DeviceProfile device, OrchestratorConfig config) {
    int min = config.minWorkers();
    int max = maxWorkers(device, config);
    if (liveWorkers < min) {
      return min;
    }
    if (liveWorkers > max) {
      return max;
    }
    double pressure = pressure(weightedLoad, liveWorkers);
    if (pressure > config.scaleUpThreshold() && liveWorkers < max) {
      return liveWorkers + 1;
    }
    if (pressure < config.scaleDownThreshold() && liveWorkers > min) {
      return liveWorkers - 1;
    }
    return liveWorkers;
  }
}
