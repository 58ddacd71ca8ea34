package traitgen.solver;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import traitgen.core.model.Catalog;
import traitgen.core.model.CompatibilityRule;
import traitgen.core.model.Layer;
import traitgen.core.model.Trait;

/**
 * Static structure of one catalog: per-layer trait arrays, which layer pairs constrain each other,
 * and precomputed support sets for every constrained pair.
 *
 * <p>Two layers are linked when some ruler trait of either targets the other. Compatibility is
 * symmetric: trait {@code a} of layer {@code i} and trait {@code b} of layer {@code j} are
 * compatible only if {@code a}'s rule for {@code j} permits {@code b} and {@code b}'s rule for
 * {@code i} permits {@code a}.
 */
public final class ConstraintGraph {
  private final Catalog catalog;
  private final Trait[][] traits;
  private final boolean[] optional;
  private final int[][] neighbors;
  // support[i][j][a] = traits of layer j compatible with trait a of layer i; null when unlinked
  private final BitSet[][][] support;

  public ConstraintGraph(Catalog catalog) {
    this.catalog = catalog;
    int n = catalog.size();
    this.traits = new Trait[n][];
    this.optional = new boolean[n];
    for (int i = 0; i < n; i++) {
      Layer layer = catalog.layer(i);
      traits[i] = layer.traits().toArray(new Trait[0]);
      optional[i] = layer.optional();
    }

    boolean[][] linked = new boolean[n][n];
    for (int i = 0; i < n; i++) {
      for (Trait trait : traits[i]) {
        if (!trait.isRuler()) {
          continue;
        }
        for (CompatibilityRule rule : trait.rules()) {
          int j = catalog.indexOf(rule.targetLayerId());
          if (j >= 0 && j != i) {
            linked[i][j] = true;
            linked[j][i] = true;
          }
        }
      }
    }

    this.neighbors = new int[n][];
    this.support = new BitSet[n][n][];
    for (int i = 0; i < n; i++) {
      List<Integer> adjacent = new ArrayList<>();
      for (int j = 0; j < n; j++) {
        if (!linked[i][j]) {
          continue;
        }
        adjacent.add(j);
        BitSet[] perTrait = new BitSet[traits[i].length];
        for (int a = 0; a < traits[i].length; a++) {
          BitSet compatible = new BitSet(traits[j].length);
          for (int b = 0; b < traits[j].length; b++) {
            if (compatible(i, traits[i][a], j, traits[j][b])) {
              compatible.set(b);
            }
          }
          perTrait[a] = compatible;
        }
        support[i][j] = perTrait;
      }
      neighbors[i] = adjacent.stream().mapToInt(Integer::intValue).toArray();
    }
  }

  public Catalog catalog() {
    return catalog;
  }

  public int layerCount() {
    return traits.length;
  }

  public int domainSize(int layer) {
    return traits[layer].length;
  }

  public Trait trait(int layer, int index) {
    return traits[layer][index];
  }

  public Trait[] traits(int layer) {
    return traits[layer];
  }

  public boolean optional(int layer) {
    return optional[layer];
  }

  /** Layers that can restrict, or be restricted by, {@code layer}. */
  public int[] neighbors(int layer) {
    return neighbors[layer];
  }

  public boolean linked(int i, int j) {
    return support[i][j] != null;
  }

  /** Traits of layer {@code j} compatible with trait index {@code a} of layer {@code i}. */
  public BitSet support(int i, int a, int j) {
    BitSet[] perTrait = support[i][j];
    return perTrait == null ? null : perTrait[a];
  }

  /** True when the two selections are compatible with the layers' rules in both directions. */
  public boolean compatible(int i, int a, int j, int b) {
    BitSet supported = support(i, a, j);
    return supported == null || supported.get(b);
  }

  public int arcCount() {
    int arcs = 0;
    for (int[] adjacent : neighbors) {
      arcs += adjacent.length;
    }
    return arcs;
  }

  private boolean compatible(int i, Trait a, int j, Trait b) {
    CompatibilityRule forward = a.ruleFor(catalog.layer(j).id());
    if (forward != null && !forward.permits(b.id())) {
      return false;
    }
    CompatibilityRule backward = b.ruleFor(catalog.layer(i).id());
    return backward == null || backward.permits(a.id());
  }
}
