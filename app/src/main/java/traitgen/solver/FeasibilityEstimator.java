package traitgen.solver;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.core.model.Catalog;
import traitgen.core.model.UniquenessConfig;
import traitgen.core.model.UniquenessGroup;

/**
 * Estimates the largest count one run can satisfy before any artifact is generated.
 *
 * <p>For each active uniqueness group the estimator enumerates, in a fixed order, the distinct
 * trait tuples of the group's layers that still extend to a complete valid assignment. The run's
 * ceiling is the smallest group count. A group that contains an optional layer never limits the run
 * because assignments that skip the layer are not covered by it. When the enumeration exceeds its
 * node budget the group falls back to the product of its arc-consistent domain sizes.
 *
 * <p>The ceiling is exact only for a single active group. Groups are counted independently, so with
 * several groups the smallest count is an upper bound: the combinations one group still allows may
 * reuse tuples another group has already spent. Such estimates are reported as not exact.
 *
 * <p>The result depends only on the catalog and configuration; no randomness is involved.
 */
public final class FeasibilityEstimator {
  private static final Logger LOG = LoggerFactory.getLogger(FeasibilityEstimator.class);

  private final ConstraintGraph graph;
  private final long nodeBudget;
  private final ArcConsistency arcConsistency;

  public FeasibilityEstimator(Catalog catalog, long nodeBudget) {
    this(new ConstraintGraph(catalog), nodeBudget);
  }

  public FeasibilityEstimator(ConstraintGraph graph, long nodeBudget) {
    this.graph = graph;
    this.nodeBudget = Math.max(1, nodeBudget);
    this.arcConsistency = new ArcConsistency(graph, new SolverStats());
  }

  public FeasibilityEstimate estimate(UniquenessConfig uniqueness) {
    Domains base = Domains.full(graph);
    if (!arcConsistency.enforceAll(base)) {
      return new FeasibilityEstimate(
          0, true, "compatibility rules leave a required layer without candidates", Map.of());
    }
    Search completion = new Search(nodeBudget);
    if (!completion.extendable(base.copy()) && !completion.overBudget()) {
      return new FeasibilityEstimate(0, true, "no combination satisfies every rule", Map.of());
    }

    List<UniquenessGroup> groups =
        uniqueness == null ? List.of() : uniqueness.activeGroups();
    if (groups.isEmpty()) {
      return new FeasibilityEstimate(
          FeasibilityEstimate.UNBOUNDED, true, "no active uniqueness group", Map.of());
    }

    Map<String, Long> perGroup = new LinkedHashMap<>();
    long ceiling = FeasibilityEstimate.UNBOUNDED;
    String limiting = "no group limits the run";
    boolean exact = true;
    for (UniquenessGroup group : groups) {
      GroupCount count = countGroup(group, base);
      perGroup.put(group.id(), count.value);
      exact &= count.exact;
      if (count.value < ceiling) {
        ceiling = count.value;
        limiting = "group '" + group.id() + "' allows " + count.value + " unique combinations";
      }
    }
    if (groups.size() > 1) {
      exact = false;
      limiting += " (upper bound across " + groups.size() + " groups)";
    }
    FeasibilityEstimate estimate = new FeasibilityEstimate(ceiling, exact, limiting, perGroup);
    LOG.debug("Feasibility: {}", estimate);
    return estimate;
  }

  private GroupCount countGroup(UniquenessGroup group, Domains base) {
    List<Integer> layers = new ArrayList<>();
    for (String layerId : group.layerIds()) {
      int index = graph.catalog().indexOf(layerId);
      if (index < 0) {
        continue;
      }
      if (graph.optional(index)) {
        return new GroupCount(FeasibilityEstimate.UNBOUNDED, true);
      }
      if (!layers.contains(index)) {
        layers.add(index);
      }
    }
    if (layers.isEmpty()) {
      return new GroupCount(FeasibilityEstimate.UNBOUNDED, true);
    }

    Search search = new Search(nodeBudget);
    long counted = search.countTuples(base.copy(), layers, 0);
    if (!search.overBudget()) {
      return new GroupCount(counted, true);
    }
    long product = 1;
    for (int layer : layers) {
      product = saturatingMultiply(product, base.size(layer));
    }
    LOG.info(
        "Feasibility enumeration for group '{}' exceeded {} nodes; using product bound {}",
        group.id(),
        nodeBudget,
        product);
    return new GroupCount(product, false);
  }

  private static long saturatingMultiply(long a, long b) {
    if (a == 0 || b == 0) {
      return 0;
    }
    if (a > FeasibilityEstimate.UNBOUNDED / b) {
      return FeasibilityEstimate.UNBOUNDED;
    }
    return a * b;
  }

  private record GroupCount(long value, boolean exact) {}

  /** Deterministic depth-first search sharing one node budget. */
  private final class Search {
    private final long budget;
    private long nodes;

    Search(long budget) {
      this.budget = budget;
    }

    boolean overBudget() {
      return nodes > budget;
    }

    /** Counts distinct tuples over {@code layers[from..]} that extend to a full assignment. */
    long countTuples(Domains domains, List<Integer> layers, int from) {
      if (overBudget()) {
        return 0;
      }
      if (from == layers.size()) {
        return extendable(domains) ? 1 : 0;
      }
      nodes++;
      int layer = layers.get(from);
      long total = 0;
      BitSet values = domains.values(layer);
      for (int a = values.nextSetBit(0); a >= 0; a = values.nextSetBit(a + 1)) {
        Domains trial = domains.copy();
        trial.assign(layer, a);
        if (arcConsistency.enforceAfter(trial, layer)) {
          total += countTuples(trial, layers, from + 1);
        }
        if (overBudget()) {
          return total;
        }
      }
      return total;
    }

    /** True when the undecided layers admit at least one completion. */
    boolean extendable(Domains domains) {
      if (overBudget()) {
        return false;
      }
      nodes++;
      int layer = -1;
      int best = Integer.MAX_VALUE;
      for (int i = 0; i < domains.layerCount(); i++) {
        if (!domains.decided(i) && domains.size(i) < best) {
          layer = i;
          best = domains.size(i);
        }
      }
      if (layer < 0) {
        return true;
      }
      if (graph.optional(layer)) {
        Domains skipped = domains.copy();
        skipped.skip(layer);
        if (extendable(skipped)) {
          return true;
        }
      }
      BitSet values = domains.values(layer);
      for (int a = values.nextSetBit(0); a >= 0; a = values.nextSetBit(a + 1)) {
        Domains trial = domains.copy();
        trial.assign(layer, a);
        if (arcConsistency.enforceAfter(trial, layer) && extendable(trial)) {
          return true;
        }
        if (overBudget()) {
          return false;
        }
      }
      return false;
    }
  }
}
