package traitgen.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over the layer list of one run, sorted back-to-front by stacking order, with id
 * lookups for layers and traits.
 */
public final class Catalog {
  private final List<Layer> layers;
  private final Map<String, Integer> layerIndex = new HashMap<>();
  private final Map<Integer, Trait> traitsById = new HashMap<>();

  public Catalog(List<Layer> layers) {
    List<Layer> sorted = new ArrayList<>(layers == null ? List.of() : layers);
    sorted.sort(Comparator.comparingInt(Layer::order));
    this.layers = List.copyOf(sorted);
    for (int i = 0; i < this.layers.size(); i++) {
      Layer layer = this.layers.get(i);
      layerIndex.putIfAbsent(layer.id(), i);
      for (Trait trait : layer.traits()) {
        traitsById.putIfAbsent(trait.id(), trait);
      }
    }
  }

  public List<Layer> layers() {
    return layers;
  }

  public int size() {
    return layers.size();
  }

  public Layer layer(int index) {
    return layers.get(index);
  }

  /** Position of the layer in stacking order, or -1. */
  public int indexOf(String layerId) {
    return layerIndex.getOrDefault(layerId, -1);
  }

  public Trait traitById(int traitId) {
    return traitsById.get(traitId);
  }

  public int traitCount() {
    return layers.stream().mapToInt(layer -> layer.traits().size()).sum();
  }

  /** Collects every structural problem; an empty list means the catalog is usable. */
  public List<String> validate(UniquenessConfig uniqueness) {
    List<String> problems = new ArrayList<>();
    Set<String> layerIds = new HashSet<>();
    Set<Integer> traitIds = new HashSet<>();
    for (Layer layer : layers) {
      if (!layerIds.add(layer.id())) {
        problems.add("duplicate layer id '" + layer.id() + "'");
      }
      if (layer.isEmpty() && !layer.optional()) {
        problems.add("required layer '" + layer.id() + "' has no traits");
      }
      for (Trait trait : layer.traits()) {
        if (trait.id() < 0) {
          problems.add("trait '" + trait.name() + "' has negative id " + trait.id());
        }
        if (!traitIds.add(trait.id())) {
          problems.add("duplicate trait id " + trait.id() + " in layer '" + layer.id() + "'");
        }
        if (trait.rarityWeight() <= 0) {
          problems.add(
              "trait '"
                  + trait.name()
                  + "' has non-positive rarity weight "
                  + trait.rarityWeight());
        }
      }
    }
    for (Layer layer : layers) {
      for (Trait trait : layer.traits()) {
        if (!trait.isRuler()) {
          continue;
        }
        Set<String> targets = new HashSet<>();
        for (CompatibilityRule rule : trait.rules()) {
          if (!targets.add(rule.targetLayerId())) {
            problems.add(
                "trait '"
                    + trait.name()
                    + "' has more than one rule for layer '"
                    + rule.targetLayerId()
                    + "'; merge them into one");
          }
          if (!layerIds.contains(rule.targetLayerId())) {
            problems.add(
                "rule on trait '"
                    + trait.name()
                    + "' targets unknown layer '"
                    + rule.targetLayerId()
                    + "'");
          } else if (rule.targetLayerId().equals(layer.id())) {
            problems.add("rule on trait '" + trait.name() + "' targets its own layer");
          }
        }
      }
    }
    if (uniqueness != null) {
      for (UniquenessGroup group : uniqueness.groups()) {
        if (group.layerIds().isEmpty()) {
          problems.add("uniqueness group '" + group.id() + "' lists no layers");
        }
        for (String layerId : group.layerIds()) {
          if (!layerIds.contains(layerId)) {
            problems.add(
                "uniqueness group '" + group.id() + "' references unknown layer '" + layerId + "'");
          }
        }
      }
    }
    return problems;
  }
}
