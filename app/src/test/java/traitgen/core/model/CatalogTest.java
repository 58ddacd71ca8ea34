package traitgen.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static traitgen.testing.TestCatalogs.CIRCLE;
import static traitgen.testing.TestCatalogs.RED;
import static traitgen.testing.TestCatalogs.SQUARE;

import java.util.List;
import org.junit.jupiter.api.Test;
import traitgen.testing.TestCatalogs;

final class CatalogTest {

  @Test
  void wellFormedCatalogHasNoProblems() {
    Catalog catalog = new Catalog(TestCatalogs.redForbidsSquare());

    assertEquals(List.of(), catalog.validate(TestCatalogs.uniqueOver("color", "shape")));
  }

  @Test
  void twoRulesForOneTargetLayerAreRejected() {
    Trait red =
        Trait.ruler(
            RED,
            "red",
            1,
            new byte[0],
            List.of(
                CompatibilityRule.forbid("shape", SQUARE),
                CompatibilityRule.forbid("shape", CIRCLE)));
    Catalog catalog =
        new Catalog(
            List.of(
                Layer.required("color", 0, List.of(red)),
                Layer.required(
                    "shape",
                    1,
                    List.of(
                        TestCatalogs.trait(CIRCLE, "circle"),
                        TestCatalogs.trait(SQUARE, "square")))));

    List<String> problems = catalog.validate(UniquenessConfig.disabled());

    assertEquals(1, problems.size(), problems::toString);
    assertTrue(problems.get(0).contains("more than one rule for layer 'shape'"));
  }
}
