package traitgen.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One visual option within a layer.
 *
 * <p>Trait ids are unique across a catalog. Higher {@code rarityWeight} means more common (1 is the
 * rarest end of the usual 1..5 scale). Equality is by id; the payload is never compared.
 */
public record Trait(
    int id,
    String name,
    int rarityWeight,
    TraitRole role,
    List<CompatibilityRule> rules,
    byte[] payload) {

  public Trait {
    Objects.requireNonNull(name, "name");
    role = role == null ? TraitRole.NORMAL : role;
    rules = rules == null ? List.of() : List.copyOf(rules);
    payload = payload == null ? new byte[0] : payload;
  }

  public static Trait of(int id, String name, int rarityWeight, byte[] payload) {
    return new Trait(id, name, rarityWeight, TraitRole.NORMAL, List.of(), payload);
  }

  public static Trait ruler(
      int id, String name, int rarityWeight, byte[] payload, List<CompatibilityRule> rules) {
    return new Trait(id, name, rarityWeight, TraitRole.RULER, rules, payload);
  }

  public boolean isRuler() {
    return role == TraitRole.RULER && !rules.isEmpty();
  }

  /**
   * Returns the rule this trait imposes on {@code layerId}, or {@code null} when unconstrained.
   * Catalog validation admits at most one rule per target layer.
   */
  public CompatibilityRule ruleFor(String layerId) {
    if (!isRuler()) {
      return null;
    }
    for (CompatibilityRule rule : rules) {
      if (rule.targetLayerId().equals(layerId)) {
        return rule;
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Trait trait && trait.id == id;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }

  @Override
  public String toString() {
    return "Trait[" + id + ":" + name + ", weight=" + rarityWeight + "]";
  }
}
