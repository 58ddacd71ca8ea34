package traitgen.core.model;

import java.util.List;
import java.util.Objects;

/** One stacking position of an artifact; its traits are mutually exclusive choices. */
public record Layer(String id, String name, int order, boolean optional, List<Trait> traits) {

  public Layer {
    Objects.requireNonNull(id, "id");
    name = name == null ? id : name;
    traits = traits == null ? List.of() : List.copyOf(traits);
  }

  public static Layer required(String id, int order, List<Trait> traits) {
    return new Layer(id, id, order, false, traits);
  }

  public static Layer optional(String id, int order, List<Trait> traits) {
    return new Layer(id, id, order, true, traits);
  }

  public boolean isEmpty() {
    return traits.isEmpty();
  }
}
