package traitgen.generation;

import traitgen.solver.CandidateOrdering;
import traitgen.solver.SolverOptions;

/**
 * Tuning of one generation run.
 *
 * @param streamingThreshold largest count delivered item by item
 * @param exhaustionThreshold consecutive item failures that end the run
 * @param feasibilityNodeBudget search nodes the pre-run estimate may visit per group
 * @param solver solver tuning, including candidate ordering
 * @param decodeCacheCapacity decoded trait surfaces kept per run
 * @param streamingProgressInterval items between progress notices when streaming
 * @param chunkedProgressInterval items between progress notices when chunked
 * @param previewInterval items between previews (streaming only)
 * @param previewSize longest side of a preview in pixels
 * @param lossyQuality JPEG quality in {@code (0, 1]}
 * @param seed RNG seed for candidate ordering, or {@code null} for a fresh seed
 */
public record GenerationOptions(
    int streamingThreshold,
    int exhaustionThreshold,
    long feasibilityNodeBudget,
    SolverOptions solver,
    int decodeCacheCapacity,
    int streamingProgressInterval,
    int chunkedProgressInterval,
    int previewInterval,
    int previewSize,
    float lossyQuality,
    Long seed) {

  public static GenerationOptions defaults() {
    return new GenerationOptions(
        1000, 1000, 100_000L, SolverOptions.defaults(), 64, 5, 50, 50, 100, 0.9f, null);
  }

  public static GenerationOptions normalize(GenerationOptions options) {
    GenerationOptions defaults = defaults();
    if (options == null) {
      return defaults;
    }
    return new GenerationOptions(
        options.streamingThreshold() >= 0
            ? options.streamingThreshold()
            : defaults.streamingThreshold(),
        positiveOr(options.exhaustionThreshold(), defaults.exhaustionThreshold()),
        options.feasibilityNodeBudget() > 0
            ? options.feasibilityNodeBudget()
            : defaults.feasibilityNodeBudget(),
        SolverOptions.normalize(options.solver()),
        Math.max(0, options.decodeCacheCapacity()),
        positiveOr(options.streamingProgressInterval(), defaults.streamingProgressInterval()),
        positiveOr(options.chunkedProgressInterval(), defaults.chunkedProgressInterval()),
        positiveOr(options.previewInterval(), defaults.previewInterval()),
        positiveOr(options.previewSize(), defaults.previewSize()),
        options.lossyQuality() > 0 && options.lossyQuality() <= 1
            ? options.lossyQuality()
            : defaults.lossyQuality(),
        options.seed());
  }

  public GenerationOptions withSeed(Long newSeed) {
    return new GenerationOptions(
        streamingThreshold,
        exhaustionThreshold,
        feasibilityNodeBudget,
        solver,
        decodeCacheCapacity,
        streamingProgressInterval,
        chunkedProgressInterval,
        previewInterval,
        previewSize,
        lossyQuality,
        newSeed);
  }

  public GenerationOptions withOrdering(CandidateOrdering ordering) {
    SolverOptions base = SolverOptions.normalize(solver);
    return withSolver(
        new SolverOptions(ordering, base.deadEndCacheCapacity(), base.maxNodesPerSolve()));
  }

  public GenerationOptions withSolver(SolverOptions newSolver) {
    return new GenerationOptions(
        streamingThreshold,
        exhaustionThreshold,
        feasibilityNodeBudget,
        newSolver,
        decodeCacheCapacity,
        streamingProgressInterval,
        chunkedProgressInterval,
        previewInterval,
        previewSize,
        lossyQuality,
        seed);
  }

  public GenerationOptions withFeasibilityNodeBudget(long budget) {
    return new GenerationOptions(
        streamingThreshold,
        exhaustionThreshold,
        budget,
        solver,
        decodeCacheCapacity,
        streamingProgressInterval,
        chunkedProgressInterval,
        previewInterval,
        previewSize,
        lossyQuality,
        seed);
  }

  public GenerationOptions withStreamingThreshold(int threshold) {
    return new GenerationOptions(
        threshold,
        exhaustionThreshold,
        feasibilityNodeBudget,
        solver,
        decodeCacheCapacity,
        streamingProgressInterval,
        chunkedProgressInterval,
        previewInterval,
        previewSize,
        lossyQuality,
        seed);
  }

  public GenerationOptions withExhaustionThreshold(int threshold) {
    return new GenerationOptions(
        streamingThreshold,
        threshold,
        feasibilityNodeBudget,
        solver,
        decodeCacheCapacity,
        streamingProgressInterval,
        chunkedProgressInterval,
        previewInterval,
        previewSize,
        lossyQuality,
        seed);
  }

  private static int positiveOr(int value, int fallback) {
    return value > 0 ? value : fallback;
  }
}
