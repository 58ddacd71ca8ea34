package traitgen.solver;

import java.util.BitSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import traitgen.core.model.Assignment;
import traitgen.core.model.Catalog;
import traitgen.core.model.Trait;
import traitgen.util.Bitsets;

/**
 * Mutable search state: remaining trait candidates per layer plus which layers are decided.
 *
 * <p>An optional layer that is still undecided can always be skipped, so it never restricts its
 * neighbours; once skipped it is ignored entirely. Snapshots are full copies.
 */
final class Domains {
  private final BitSet[] values;
  private final boolean[] decided;
  private final boolean[] skipped;

  private Domains(BitSet[] values, boolean[] decided, boolean[] skipped) {
    this.values = values;
    this.decided = decided;
    this.skipped = skipped;
  }

  static Domains full(ConstraintGraph graph) {
    int n = graph.layerCount();
    BitSet[] values = new BitSet[n];
    for (int i = 0; i < n; i++) {
      values[i] = Bitsets.allOnes(graph.domainSize(i));
    }
    return new Domains(values, new boolean[n], new boolean[n]);
  }

  Domains copy() {
    return new Domains(Bitsets.deepCopy(values), decided.clone(), skipped.clone());
  }

  int layerCount() {
    return values.length;
  }

  BitSet values(int layer) {
    return values[layer];
  }

  int size(int layer) {
    return values[layer].cardinality();
  }

  boolean decided(int layer) {
    return decided[layer];
  }

  boolean skipped(int layer) {
    return skipped[layer];
  }

  void assign(int layer, int traitIndex) {
    values[layer] = Bitsets.singleton(traitIndex);
    decided[layer] = true;
    skipped[layer] = false;
  }

  void skip(int layer) {
    values[layer] = new BitSet();
    decided[layer] = true;
    skipped[layer] = true;
  }

  void exclude(ConstraintGraph graph, Set<Integer> traitIds) {
    if (traitIds == null || traitIds.isEmpty()) {
      return;
    }
    for (int i = 0; i < values.length; i++) {
      Trait[] traits = graph.traits(i);
      for (int a = 0; a < traits.length; a++) {
        if (traitIds.contains(traits[a].id())) {
          values[i].clear(a);
        }
      }
    }
  }

  /** A layer must end up with a trait: it is required, or it was decided as filled. */
  boolean mustFill(ConstraintGraph graph, int layer) {
    return decided[layer] ? !skipped[layer] : !graph.optional(layer);
  }

  /** Stable key of the decisions made so far, used to memoize dead ends. */
  String decisionKey() {
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      if (!decided[i]) {
        continue;
      }
      builder.append(i).append(':');
      if (skipped[i]) {
        builder.append('-');
      } else {
        builder.append(values[i].nextSetBit(0));
      }
      builder.append(';');
    }
    return builder.toString();
  }

  Assignment toAssignment(ConstraintGraph graph) {
    Catalog catalog = graph.catalog();
    Map<String, Trait> selections = new TreeMap<>();
    for (int i = 0; i < values.length; i++) {
      if (decided[i] && !skipped[i]) {
        selections.put(catalog.layer(i).id(), graph.trait(i, values[i].nextSetBit(0)));
      }
    }
    return Assignment.ordered(catalog, selections);
  }
}
