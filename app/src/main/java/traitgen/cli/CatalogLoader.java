package traitgen.cli;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import traitgen.core.model.CompatibilityRule;
import traitgen.core.model.Layer;
import traitgen.core.model.Trait;
import traitgen.core.model.TraitRole;
import traitgen.core.model.UniquenessConfig;
import traitgen.core.model.UniquenessGroup;

/**
 * Reads a catalog description from JSON. Trait images are resolved relative to the catalog file.
 *
 * <pre>{@code
 * {
 *   "name": "Shapes", "description": "...",
 *   "layers": [
 *     {"id": "colour", "name": "Colour", "order": 0, "optional": false,
 *      "traits": [{"id": 1, "name": "red", "weight": 3, "image": "colour/red.png",
 *                  "rules": [{"layer": "shape", "forbidden": [4], "allowed": []}]}]}
 *   ],
 *   "uniqueness": {"enabled": true,
 *                  "groups": [{"id": "all", "layers": ["colour", "shape"], "active": true}]}
 * }
 * }</pre>
 */
final class CatalogLoader {
  private static final Gson GSON = new Gson();

  record LoadedCatalog(
      String name, String description, List<Layer> layers, UniquenessConfig uniqueness) {}

  private record CatalogFile(
      String name, String description, List<LayerEntry> layers, UniquenessEntry uniqueness) {}

  private record LayerEntry(
      String id, String name, Integer order, Boolean optional, List<TraitEntry> traits) {}

  private record TraitEntry(
      Integer id, String name, Integer weight, String image, List<RuleEntry> rules) {}

  private record RuleEntry(String layer, List<Integer> forbidden, List<Integer> allowed) {}

  private record UniquenessEntry(Boolean enabled, List<GroupEntry> groups) {}

  private record GroupEntry(String id, List<String> layers, Boolean active, String description) {}

  private CatalogLoader() {}

  static LoadedCatalog load(Path catalogFile) throws IOException {
    if (!Files.exists(catalogFile)) {
      throw new IllegalArgumentException("Catalog file not found: " + catalogFile);
    }
    CatalogFile file;
    try {
      file = GSON.fromJson(Files.readString(catalogFile), CatalogFile.class);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException(
          "Malformed catalog " + catalogFile + ": " + ex.getMessage(), ex);
    }
    if (file == null || file.layers() == null) {
      throw new IllegalArgumentException("Catalog " + catalogFile + " lists no layers");
    }
    Path baseDir = catalogFile.toAbsolutePath().getParent();

    List<Layer> layers = new ArrayList<>();
    int position = 0;
    for (LayerEntry entry : file.layers()) {
      if (entry.id() == null || entry.id().isBlank()) {
        throw new IllegalArgumentException("Layer #" + (position + 1) + " has no id");
      }
      List<Trait> traits = new ArrayList<>();
      if (entry.traits() != null) {
        for (TraitEntry trait : entry.traits()) {
          traits.add(toTrait(trait, entry.id(), baseDir));
        }
      }
      int order = entry.order() == null ? position : entry.order();
      boolean optional = Boolean.TRUE.equals(entry.optional());
      layers.add(new Layer(entry.id(), entry.name(), order, optional, traits));
      position++;
    }
    return new LoadedCatalog(
        file.name(), file.description(), layers, toUniqueness(file.uniqueness()));
  }

  private static Trait toTrait(TraitEntry entry, String layerId, Path baseDir) throws IOException {
    if (entry.id() == null) {
      throw new IllegalArgumentException(
          "Trait '" + entry.name() + "' in layer '" + layerId + "' has no id");
    }
    String name = entry.name() == null ? "trait-" + entry.id() : entry.name();
    byte[] payload = new byte[0];
    if (entry.image() != null && !entry.image().isBlank()) {
      Path image = baseDir.resolve(entry.image()).normalize();
      if (!Files.exists(image)) {
        throw new IllegalArgumentException("Image for trait '" + name + "' not found: " + image);
      }
      payload = Files.readAllBytes(image);
    }
    List<CompatibilityRule> rules = new ArrayList<>();
    if (entry.rules() != null) {
      for (RuleEntry rule : entry.rules()) {
        if (rule.layer() == null) {
          throw new IllegalArgumentException("Rule on trait '" + name + "' names no layer");
        }
        rules.add(
            new CompatibilityRule(rule.layer(), toSet(rule.forbidden()), toSet(rule.allowed())));
      }
    }
    TraitRole role = rules.isEmpty() ? TraitRole.NORMAL : TraitRole.RULER;
    int weight = entry.weight() == null ? 1 : entry.weight();
    return new Trait(entry.id(), name, weight, role, rules, payload);
  }

  private static UniquenessConfig toUniqueness(UniquenessEntry entry) {
    if (entry == null || entry.groups() == null) {
      return UniquenessConfig.disabled();
    }
    List<UniquenessGroup> groups = new ArrayList<>();
    for (GroupEntry group : entry.groups()) {
      groups.add(
          new UniquenessGroup(
              group.id(),
              group.layers(),
              !Boolean.FALSE.equals(group.active()),
              group.description()));
    }
    return new UniquenessConfig(!Boolean.FALSE.equals(entry.enabled()), groups);
  }

  private static Set<Integer> toSet(List<Integer> ids) {
    return ids == null ? Set.of() : new HashSet<>(ids);
  }
}
