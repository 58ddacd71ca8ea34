package traitgen.core.model;

import java.util.List;

/** Optional uniqueness-group configuration of one run. */
public record UniquenessConfig(boolean enabled, List<UniquenessGroup> groups) {

  public UniquenessConfig {
    groups = groups == null ? List.of() : List.copyOf(groups);
  }

  public static UniquenessConfig disabled() {
    return new UniquenessConfig(false, List.of());
  }

  public static UniquenessConfig of(UniquenessGroup... groups) {
    return new UniquenessConfig(true, List.of(groups));
  }

  public List<UniquenessGroup> activeGroups() {
    if (!enabled) {
      return List.of();
    }
    return groups.stream().filter(UniquenessGroup::active).toList();
  }
}
