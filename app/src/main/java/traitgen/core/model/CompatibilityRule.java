package traitgen.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * Constraint a ruler trait imposes on one target layer.
 *
 * <p>An empty allowed set leaves the target unrestricted; a forbidden match always wins over the
 * allowed whitelist.
 */
public record CompatibilityRule(
    String targetLayerId, Set<Integer> forbiddenTraitIds, Set<Integer> allowedTraitIds) {

  public CompatibilityRule {
    Objects.requireNonNull(targetLayerId, "targetLayerId");
    forbiddenTraitIds = forbiddenTraitIds == null ? Set.of() : Set.copyOf(forbiddenTraitIds);
    allowedTraitIds = allowedTraitIds == null ? Set.of() : Set.copyOf(allowedTraitIds);
  }

  public static CompatibilityRule forbid(String targetLayerId, Integer... traitIds) {
    return new CompatibilityRule(targetLayerId, Set.of(traitIds), Set.of());
  }

  public boolean permits(int traitId) {
    if (forbiddenTraitIds.contains(traitId)) {
      return false;
    }
    return allowedTraitIds.isEmpty() || allowedTraitIds.contains(traitId);
  }
}
