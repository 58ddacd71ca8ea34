package traitgen.generation;

import com.google.common.base.Stopwatch;
import com.google.gson.JsonObject;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.cache.RunCache;
import traitgen.core.CatalogValidationException;
import traitgen.core.ExhaustionException;
import traitgen.core.FeasibilityException;
import traitgen.core.GenerationException;
import traitgen.core.GenerationRequest;
import traitgen.core.model.Artifact;
import traitgen.core.model.Assignment;
import traitgen.core.model.Catalog;
import traitgen.metadata.MetadataFormatter;
import traitgen.render.CompositionPipeline;
import traitgen.render.RenderException;
import traitgen.render.RenderedImage;
import traitgen.render.TraitDecoder;
import traitgen.solver.ConstraintSolver;
import traitgen.solver.FeasibilityEstimate;
import traitgen.solver.FeasibilityEstimator;
import traitgen.uniqueness.UniquenessTracker;

/**
 * Drives one run: validate, estimate feasibility, then solve, render, track and deliver each index
 * in increasing order until the requested count is reached.
 *
 * <p>A controller is single-use and single-threaded. The uniqueness tracker, decode cache and
 * drawing surface it creates belong to this run only. Cancellation is checked between items.
 */
public final class GenerationController {
  private static final Logger LOG = LoggerFactory.getLogger(GenerationController.class);

  private final GenerationRequest request;
  private final GenerationOptions options;
  private final DeviceProfile device;
  private final MemoryMonitor memory;
  private final CancellationToken cancellation;
  private final GenerationListener listener;
  private volatile RunState state = RunState.IDLE;

  public GenerationController(
      GenerationRequest request,
      GenerationOptions options,
      DeviceProfile device,
      MemoryMonitor memory,
      CancellationToken cancellation,
      GenerationListener listener) {
    this.request = Objects.requireNonNull(request, "request");
    this.options = GenerationOptions.normalize(options);
    this.device = device == null ? DeviceProfile.detect() : device;
    this.memory = memory == null ? MemoryMonitor.runtime() : memory;
    this.cancellation = cancellation == null ? new CancellationToken() : cancellation;
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public RunState state() {
    return state;
  }

  public RunResult run() {
    return run(List.of());
  }

  /**
   * Runs to completion or cancellation.
   *
   * @param resumeFrom assignments already delivered for indices {@code 0..n-1} by an earlier
   *     attempt; they are treated as committed and generation continues at index {@code n}
   * @throws CatalogValidationException when the catalog is structurally invalid
   * @throws FeasibilityException when the count cannot be reached
   * @throws ExhaustionException when too many consecutive items fail
   */
  public RunResult run(List<Assignment> resumeFrom) {
    if (state != RunState.IDLE) {
      throw new IllegalStateException("controller already used: " + state);
    }
    Stopwatch timer = Stopwatch.createStarted();
    int count = request.count();
    if (count == 0) {
      state = RunState.COMPLETED;
      LOG.info("Nothing to generate; run completed immediately");
      return new RunResult(state, 0, 0, RunStats.empty());
    }
    try {
      return execute(resumeFrom == null ? List.of() : resumeFrom, timer);
    } catch (GenerationException | IllegalArgumentException e) {
      state = RunState.FAILED;
      throw e;
    }
  }

  private RunResult execute(List<Assignment> resumeFrom, Stopwatch timer) {
    state = RunState.VALIDATING;
    int count = request.count();
    Catalog catalog = new Catalog(request.layers());
    List<String> problems = new ArrayList<>(catalog.validate(request.uniqueness()));
    if (catalog.size() == 0) {
      problems.add("catalog has no layers");
    }
    if (!problems.isEmpty()) {
      throw new CatalogValidationException(problems);
    }

    Random random = options.seed() == null ? new Random() : new Random(options.seed());
    ConstraintSolver solver = new ConstraintSolver(catalog, options.solver(), random);
    LOG.debug(
        "Catalog has {} layers, {} traits and {} constraint arcs",
        catalog.size(),
        catalog.traitCount(),
        solver.graph().arcCount());
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(solver.graph(), options.feasibilityNodeBudget())
            .estimate(request.uniqueness());
    if (estimate.ceiling() == 0) {
      throw new FeasibilityException(
          count,
          0,
          "No valid combination exists: "
              + estimate.reason()
              + ". Review the compatibility rules.");
    }
    if (!estimate.admits(count)) {
      throw new FeasibilityException(
          count,
          estimate.ceiling(),
          "Cannot generate "
              + count
              + " unique artifacts: only "
              + estimate.ceiling()
              + " unique combinations are possible ("
              + estimate.reason()
              + "). Reduce the count or relax the uniqueness groups.");
    }
    if (!estimate.exact()) {
      LOG.info("Ceiling {} is an upper bound; the run may end in exhaustion", estimate.ceiling());
    }

    UniquenessTracker tracker = new UniquenessTracker(request.uniqueness());
    tracker.clear();
    for (Assignment delivered : resumeFrom) {
      tracker.commitAll(delivered);
    }

    RunCache<Integer, BufferedImage> decodeCache =
        RunCache.lru("decoded-traits", options.decodeCacheCapacity());
    TraitDecoder decoder = new TraitDecoder(request.outputSize(), decodeCache);
    CompositionPipeline pipeline =
        new CompositionPipeline(catalog, request.outputSize(), decoder, options.lossyQuality());
    MetadataFormatter formatter = request.metadataStandard().formatter();

    DeliveryMode mode = DeliveryMode.forCount(count, options.streamingThreshold());
    state = mode == DeliveryMode.STREAMING ? RunState.RUNNING_STREAMING : RunState.RUNNING_CHUNKED;
    LOG.info(
        "Generating {} artifacts ({} mode, ceiling {}, resuming at {})",
        count,
        mode,
        estimate.unbounded() ? "unbounded" : estimate.ceiling(),
        resumeFrom.size());
    listener.onProgress(
        new Progress(
            resumeFrom.size(), count, "Starting generation of " + count + " artifacts", sample()));

    Set<Integer> excluded = new HashSet<>();
    List<Artifact> chunk = new ArrayList<>();
    int chunkSize = ChunkSizer.initial(count, device);
    int index = Math.min(resumeFrom.size(), count);
    int consecutiveFailures = 0;
    int failedItems = 0;
    long retries = 0;

    while (index < count) {
      if (cancellation.isCancelled()) {
        flush(chunk);
        state = RunState.CANCELLED;
        LOG.info("Run cancelled after {} of {} artifacts", index, count);
        RunStats stats = stats(index, failedItems, retries, solver, tracker, decodeCache, timer);
        return new RunResult(state, index, count, stats);
      }

      Optional<Assignment> solved = solver.solve(tracker, excluded);
      if (solved.isEmpty()) {
        consecutiveFailures++;
        retries++;
        if (consecutiveFailures > options.exhaustionThreshold()) {
          flush(chunk);
          LOG.error(
              "Exhausted combinations after {} artifacts and {} consecutive failures",
              index,
              consecutiveFailures);
          throw new ExhaustionException(index, consecutiveFailures);
        }
        continue;
      }

      Assignment assignment = solved.get();
      RenderedImage rendered;
      try {
        rendered = pipeline.render(assignment);
      } catch (RenderException e) {
        failedItems++;
        consecutiveFailures++;
        Integer excludedTrait = null;
        if (!e.transientFailure() && e.traitId() != null && excluded.add(e.traitId())) {
          excludedTrait = e.traitId();
          decodeCache.evict(e.traitId());
        }
        LOG.warn("Item {} abandoned: {}", index + 1, e.getMessage(), e);
        listener.onItemFailed(new ItemFailure(index, e.getMessage(), excludedTrait));
        if (consecutiveFailures > options.exhaustionThreshold()) {
          flush(chunk);
          throw new ExhaustionException(index, consecutiveFailures);
        }
        continue;
      }

      tracker.commitAll(assignment);
      consecutiveFailures = 0;
      Artifact artifact = toArtifact(index, assignment, rendered, formatter);
      index++;

      if (mode == DeliveryMode.STREAMING) {
        listener.onArtifacts(List.of(artifact));
        if (index % options.previewInterval() == 0 || index == count) {
          byte[] png = pipeline.preview(options.previewSize());
          listener.onPreview(new Preview(artifact.index(), png));
        }
        if (index % options.streamingProgressInterval() == 0 || index == count) {
          listener.onProgress(progress(index, count));
        }
      } else {
        chunk.add(artifact);
        if (index % options.chunkedProgressInterval() == 0) {
          listener.onProgress(progress(index, count));
        }
        if (chunk.size() >= chunkSize || index == count) {
          flush(chunk);
          listener.onProgress(progress(index, count));
          MemorySnapshot memoryNow = sample();
          int adapted = ChunkSizer.adapt(chunkSize, memoryNow);
          if (adapted != chunkSize) {
            LOG.debug(
                "Chunk size {} -> {} ({} MB used)", chunkSize, adapted, memoryNow.usedMegabytes());
            chunkSize = adapted;
          }
        }
      }
    }

    flush(chunk);
    state = RunState.COMPLETED;
    RunStats stats = stats(index, failedItems, retries, solver, tracker, decodeCache, timer);
    LOG.info("Run completed: {}", stats);
    LOG.debug("Solver: {}; {}", solver.stats(), decodeCache);
    return new RunResult(state, index, count, stats);
  }

  private Artifact toArtifact(
      int index, Assignment assignment, RenderedImage rendered, MetadataFormatter formatter) {
    String imageName = Artifact.imageName(index, rendered.format());
    String displayName = request.projectName() + " #" + (index + 1);
    JsonObject metadata =
        formatter.format(
            displayName,
            request.projectDescription(),
            imageName,
            rendered.format(),
            rendered.attributes());
    return new Artifact(
        index,
        imageName,
        rendered.data(),
        rendered.format(),
        Artifact.metadataName(index),
        metadata,
        rendered.attributes(),
        assignment);
  }

  private void flush(List<Artifact> chunk) {
    if (chunk.isEmpty()) {
      return;
    }
    listener.onArtifacts(List.copyOf(chunk));
    chunk.clear();
  }

  private Progress progress(int generated, int total) {
    return new Progress(
        generated, total, "Generated " + generated + " of " + total + " artifacts", sample());
  }

  private MemorySnapshot sample() {
    return memory.sample();
  }

  private static RunStats stats(
      int generated,
      int failedItems,
      long retries,
      ConstraintSolver solver,
      UniquenessTracker tracker,
      RunCache<Integer, BufferedImage> decodeCache,
      Stopwatch timer) {
    return new RunStats(
        generated,
        failedItems,
        retries,
        solver.stats().backtracks(),
        solver.stats().deadEndHits(),
        tracker.hashedKeyCount(),
        decodeCache.stats().hitRate(),
        timer.elapsed(TimeUnit.MILLISECONDS));
  }
}
