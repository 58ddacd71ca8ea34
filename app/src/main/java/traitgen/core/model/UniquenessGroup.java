package traitgen.core.model;

import java.util.List;
import java.util.Objects;

/** Layers whose joint selection must not repeat within one run. */
public record UniquenessGroup(
    String id, List<String> layerIds, boolean active, String description) {

  public UniquenessGroup {
    Objects.requireNonNull(id, "id");
    layerIds = layerIds == null ? List.of() : List.copyOf(layerIds);
    description = description == null ? "" : description;
  }

  public static UniquenessGroup active(String id, String... layerIds) {
    return new UniquenessGroup(id, List.of(layerIds), true, "");
  }
}
