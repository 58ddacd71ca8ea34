package traitgen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One artifact's layer to trait selection. Layers absent from the mapping were skipped (only legal
 * for optional layers). Iteration follows the order the catalog lists its layers.
 */
public final class Assignment {
  private final Map<String, Trait> selections;

  private Assignment(Map<String, Trait> selections) {
    this.selections = Collections.unmodifiableMap(selections);
  }

  public static Assignment of(Map<String, Trait> selections) {
    Objects.requireNonNull(selections, "selections");
    return new Assignment(new LinkedHashMap<>(selections));
  }

  /** Builds an assignment ordered by the catalog's stacking order. */
  public static Assignment ordered(Catalog catalog, Map<String, Trait> selections) {
    Map<String, Trait> ordered = new LinkedHashMap<>();
    for (Layer layer : catalog.layers()) {
      Trait trait = selections.get(layer.id());
      if (trait != null) {
        ordered.put(layer.id(), trait);
      }
    }
    return new Assignment(ordered);
  }

  public Trait traitFor(String layerId) {
    return selections.get(layerId);
  }

  public boolean covers(String layerId) {
    return selections.containsKey(layerId);
  }

  public Map<String, Trait> selections() {
    return selections;
  }

  public int size() {
    return selections.size();
  }

  /** Complete when every non-optional layer has a trait. */
  public boolean isComplete(List<Layer> layers) {
    for (Layer layer : layers) {
      if (!layer.optional() && !selections.containsKey(layer.id())) {
        return false;
      }
    }
    return true;
  }

  /**
   * Trait ids selected for {@code layerIds}, or {@code null} when any of them is not covered.
   */
  public int[] traitIds(List<String> layerIds) {
    int[] ids = new int[layerIds.size()];
    for (int i = 0; i < layerIds.size(); i++) {
      Trait trait = selections.get(layerIds.get(i));
      if (trait == null) {
        return null;
      }
      ids[i] = trait.id();
    }
    return ids;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Assignment assignment && assignment.selections.equals(selections);
  }

  @Override
  public int hashCode() {
    return selections.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("Assignment{");
    boolean first = true;
    for (Map.Entry<String, Trait> entry : selections.entrySet()) {
      if (!first) {
        builder.append(", ");
      }
      builder.append(entry.getKey()).append('=').append(entry.getValue().name());
      first = false;
    }
    return builder.append('}').toString();
  }
}
