package traitgen.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import traitgen.core.model.Layer;
import traitgen.core.model.Trait;
import traitgen.core.model.TraitRole;
import traitgen.core.model.UniquenessGroup;
import traitgen.render.PayloadFormat;

final class CatalogLoaderTest {
  @TempDir Path dir;

  @Test
  void loadsLayersTraitsRulesAndGroups() throws IOException {
    CatalogLoader.LoadedCatalog catalog = CatalogLoader.load(CatalogFixture.write(dir));

    assertEquals("Shapes", catalog.name());
    assertEquals(2, catalog.layers().size());
    Layer color = catalog.layers().get(0);
    assertEquals("Color", color.name());
    assertEquals(0, color.order());
    assertFalse(color.optional());

    Trait red = color.traits().get(0);
    assertEquals(TraitRole.RULER, red.role());
    assertEquals(2, red.rarityWeight());
    assertEquals(Set.of(4), red.ruleFor("shape").forbiddenTraitIds());
    assertEquals(PayloadFormat.PNG, PayloadFormat.detect(red.payload()));

    Trait blue = color.traits().get(1);
    assertEquals(TraitRole.NORMAL, blue.role());
    assertEquals(1, blue.rarityWeight());

    assertTrue(catalog.uniqueness().enabled());
    UniquenessGroup group = catalog.uniqueness().groups().get(0);
    assertTrue(group.active());
    assertEquals(List.of("color", "shape"), group.layerIds());
  }

  @Test
  void missingFilesAndImagesAreReported() throws IOException {
    assertThrows(
        IllegalArgumentException.class, () -> CatalogLoader.load(dir.resolve("absent.json")));

    Path catalog = CatalogFixture.write(dir);
    Files.delete(dir.resolve("traits").resolve("blue.png"));
    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> CatalogLoader.load(catalog));
    assertTrue(error.getMessage().contains("blue"));
  }

  @Test
  void malformedJsonIsRejected() throws IOException {
    Path catalog = dir.resolve("broken.json");
    Files.writeString(catalog, "{\"layers\": [ {\"id\": ");

    assertThrows(IllegalArgumentException.class, () -> CatalogLoader.load(catalog));
  }

  @Test
  void traitsWithoutIdsAreRejected() throws IOException {
    Path catalog = dir.resolve("noid.json");
    Files.writeString(catalog, "{\"layers\": [{\"id\": \"a\", \"traits\": [{\"name\": \"x\"}]}]}");

    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> CatalogLoader.load(catalog));
    assertTrue(error.getMessage().contains("has no id"));
  }
}
