package traitgen.orchestrator;

/**
 * Coarse cost class of one run, scored from requested count, layer count and output resolution.
 * Each tier scores 0 to 3 and the sum picks the class.
 */
public enum TaskComplexity {
  LOW(1, 10, 0.5),
  MEDIUM(2, 30, 1.0),
  HIGH(3, 80, 1.5),
  VERY_HIGH(4, 200, 2.0);

  private final int level;
  private final long millisPerItem;
  private final double scalingWeight;

  TaskComplexity(int level, long millisPerItem, double scalingWeight) {
    this.level = level;
    this.millisPerItem = millisPerItem;
    this.scalingWeight = scalingWeight;
  }

  public int level() {
    return level;
  }

  /** Share of one worker's capacity a queued or running task of this class represents. */
  public double scalingWeight() {
    return scalingWeight;
  }

  public long estimatedMillis(int count) {
    return Math.max(1, count) * millisPerItem;
  }

  public static TaskComplexity classify(int layerCount, int count, long pixelCount) {
    int score = countScore(count) + layerScore(layerCount) + pixelScore(pixelCount);
    if (score <= 1) {
      return LOW;
    } else if (score <= 4) {
      return MEDIUM;
    } else if (score <= 7) {
      return HIGH;
    }
    return VERY_HIGH;
  }

  private static int countScore(int count) {
    if (count <= 100) {
      return 0;
    } else if (count <= 1000) {
      return 1;
    } else if (count <= 5000) {
      return 2;
    }
    return 3;
  }

  private static int layerScore(int layers) {
    if (layers <= 3) {
      return 0;
    } else if (layers <= 10) {
      return 1;
    } else if (layers <= 20) {
      return 2;
    }
    return 3;
  }

  private static int pixelScore(long pixels) {
    if (pixels <= 512L * 512) {
      return 0;
    } else if (pixels <= 1024L * 1024) {
      return 1;
    } else if (pixels <= 1536L * 1536) {
      return 2;
    }
    return 3;
  }
}
