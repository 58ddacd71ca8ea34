package traitgen.solver;

import com.google.common.base.Stopwatch;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.cache.RunCache;
import traitgen.core.model.Assignment;
import traitgen.core.model.Catalog;
import traitgen.uniqueness.UniquenessTracker;

/**
 * Finds one assignment per call that satisfies every compatibility rule and, when a tracker is
 * given, every active uniqueness group.
 *
 * <p>Search is backtracking over layers with arc consistency after each trial:
 *
 * <ol>
 *   <li>the constraint graph and the arc-consistent base domains are built once per instance;
 *   <li>the next layer is the undecided one with the fewest remaining traits (ties by stacking
 *       order);
 *   <li>optional layers try being skipped before being filled;
 *   <li>candidates follow the configured {@link CandidateOrdering};
 *   <li>every trial snapshots the domains and re-runs AC-3 before recursing;
 *   <li>complete assignments are checked against the uniqueness tracker, a rejection backtracks;
 *   <li>exhausted partial assignments are memoized in a bounded FIFO cache for the attempt.
 * </ol>
 */
public final class ConstraintSolver {
  private static final Logger LOG = LoggerFactory.getLogger(ConstraintSolver.class);
  private static final long SLOW_SOLVE_MS = 100;

  private final ConstraintGraph graph;
  private final SolverOptions options;
  private final Random random;
  private final SolverStats stats = new SolverStats();
  private final ArcConsistency arcConsistency;
  private final Domains baseDomains;
  private final boolean satisfiable;
  private final RunCache<String, Boolean> deadEnds;
  private long nodesThisAttempt;

  public ConstraintSolver(Catalog catalog, SolverOptions options, Random random) {
    this.graph = new ConstraintGraph(catalog);
    this.options = SolverOptions.normalize(options);
    this.random = random == null ? new Random() : random;
    this.arcConsistency = new ArcConsistency(graph, stats);
    this.baseDomains = Domains.full(graph);
    this.satisfiable = arcConsistency.enforceAll(baseDomains);
    this.deadEnds = RunCache.fifo("solver-dead-ends", this.options.deadEndCacheCapacity());
    if (!satisfiable) {
      LOG.warn("Compatibility rules leave a required layer without candidates");
    }
  }

  public ConstraintGraph graph() {
    return graph;
  }

  /** False when arc consistency alone proves the catalog unsatisfiable. */
  public boolean satisfiable() {
    return satisfiable;
  }

  public SolverStats stats() {
    return stats;
  }

  public Optional<Assignment> solve(UniquenessTracker tracker) {
    return solve(tracker, Set.of());
  }

  /**
   * Solves one artifact.
   *
   * @param tracker uniqueness state to honour, or {@code null} to ignore uniqueness
   * @param excludedTraitIds traits that must not be selected (for instance unreadable payloads)
   * @return a satisfying assignment, or empty when none exists within the node budget
   */
  public Optional<Assignment> solve(UniquenessTracker tracker, Set<Integer> excludedTraitIds) {
    stats.recordAttempt();
    if (!satisfiable) {
      return Optional.empty();
    }
    Stopwatch timer = Stopwatch.createStarted();
    deadEnds.clear();
    nodesThisAttempt = 0;

    Domains start = baseDomains.copy();
    Assignment result = null;
    if (excludedTraitIds == null
        || excludedTraitIds.isEmpty()
        || excludeAndPropagate(start, excludedTraitIds)) {
      result = backtrack(start, tracker);
    }

    long elapsed = timer.elapsed(TimeUnit.MILLISECONDS);
    if (elapsed > SLOW_SOLVE_MS) {
      LOG.warn(
          "Slow solve: {} ms, dead-end hits {}, backtracks {}",
          elapsed,
          stats.deadEndHits(),
          stats.backtracks());
    }
    if (result == null) {
      return Optional.empty();
    }
    stats.recordSolved();
    return Optional.of(result);
  }

  private boolean excludeAndPropagate(Domains domains, Set<Integer> excludedTraitIds) {
    domains.exclude(graph, excludedTraitIds);
    for (int i = 0; i < domains.layerCount(); i++) {
      if (domains.size(i) == 0 && domains.mustFill(graph, i)) {
        return false;
      }
    }
    return arcConsistency.enforceAll(domains);
  }

  private Assignment backtrack(Domains domains, UniquenessTracker tracker) {
    if (++nodesThisAttempt > options.maxNodesPerSolve()) {
      if (nodesThisAttempt == options.maxNodesPerSolve() + 1) {
        stats.recordBudgetExhaustion();
        LOG.warn("Solve abandoned after {} search nodes", options.maxNodesPerSolve());
      }
      return null;
    }
    String key = domains.decisionKey();
    if (deadEnds.get(key) != null) {
      stats.recordDeadEndHit();
      return null;
    }

    int layer = selectLayer(domains);
    if (layer < 0) {
      Assignment complete = domains.toAssignment(graph);
      if (tracker == null || tracker.checkAll(complete)) {
        return complete;
      }
      stats.recordUniquenessRejection();
      deadEnds.set(key, Boolean.TRUE);
      return null;
    }

    if (graph.optional(layer)) {
      Domains skipped = domains.copy();
      skipped.skip(layer);
      Assignment result = backtrack(skipped, tracker);
      if (result != null) {
        return result;
      }
    }

    List<Integer> candidates =
        options.ordering().order(graph.traits(layer), domains.values(layer), random);
    for (int candidate : candidates) {
      Domains trial = domains.copy();
      trial.assign(layer, candidate);
      if (arcConsistency.enforceAfter(trial, layer)) {
        Assignment result = backtrack(trial, tracker);
        if (result != null) {
          return result;
        }
      }
      stats.recordBacktrack();
    }

    deadEnds.set(key, Boolean.TRUE);
    return null;
  }

  /** MRV: the undecided layer with the fewest remaining traits, or -1 when all are decided. */
  private int selectLayer(Domains domains) {
    int best = -1;
    int bestSize = Integer.MAX_VALUE;
    for (int i = 0; i < domains.layerCount(); i++) {
      if (domains.decided(i)) {
        continue;
      }
      int size = domains.size(i);
      if (size < bestSize) {
        best = i;
        bestSize = size;
      }
    }
    return best;
  }
}
