package traitgen.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static traitgen.testing.TestCatalogs.CIRCLE;
import static traitgen.testing.TestCatalogs.RED;
import static traitgen.testing.TestCatalogs.SQUARE;

import java.util.List;
import org.junit.jupiter.api.Test;
import traitgen.core.model.Catalog;
import traitgen.core.model.CompatibilityRule;
import traitgen.core.model.Layer;
import traitgen.core.model.Trait;
import traitgen.core.model.UniquenessConfig;
import traitgen.core.model.UniquenessGroup;
import traitgen.testing.TestCatalogs;

final class FeasibilityEstimatorTest {

  @Test
  void countsEveryCombinationOfAnUnconstrainedGroup() {
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(TestCatalogs.colorsAndShapes()), 10_000)
            .estimate(TestCatalogs.uniqueOver("color", "shape"));

    assertEquals(4, estimate.ceiling());
    assertTrue(estimate.exact());
    assertTrue(estimate.admits(4));
    assertFalse(estimate.admits(5));
  }

  @Test
  void rulesReduceTheExactCount() {
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(TestCatalogs.redForbidsSquare()), 10_000)
            .estimate(TestCatalogs.uniqueOver("color", "shape"));

    assertEquals(3, estimate.ceiling());
    assertEquals(3L, estimate.perGroup().get("combo"));
  }

  @Test
  void smallestGroupLimitsTheRun() {
    UniquenessConfig config =
        UniquenessConfig.of(
            UniquenessGroup.active("pair", "layer0", "layer1"),
            UniquenessGroup.active("single", "layer2"));
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(TestCatalogs.grid(3, 3)), 10_000).estimate(config);

    assertEquals(3, estimate.ceiling());
    assertEquals(9L, estimate.perGroup().get("pair"));
    assertTrue(estimate.reason().contains("single"));
  }

  @Test
  void severalGroupsGiveOnlyAnUpperBound() {
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(TestCatalogs.circleBottleneck()), 10_000)
            .estimate(TestCatalogs.uniquePerLayer("color", "shape"));

    assertEquals(3, estimate.ceiling());
    assertEquals(3L, estimate.perGroup().get("color"));
    assertEquals(3L, estimate.perGroup().get("shape"));
    assertFalse(estimate.exact());
    assertTrue(estimate.reason().contains("upper bound"));
  }

  @Test
  void singleGroupStaysExactWithinBudget() {
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(TestCatalogs.circleBottleneck()), 10_000)
            .estimate(TestCatalogs.uniqueOver("color", "shape"));

    assertEquals(5, estimate.ceiling());
    assertTrue(estimate.exact());
  }

  @Test
  void noActiveGroupIsUnbounded() {
    Catalog catalog = new Catalog(TestCatalogs.colorsAndShapes());
    assertTrue(new FeasibilityEstimator(catalog, 100).estimate(null).unbounded());
    assertTrue(
        new FeasibilityEstimator(catalog, 100).estimate(UniquenessConfig.disabled()).unbounded());
  }

  @Test
  void groupWithOptionalLayerDoesNotLimitTheRun() {
    List<Layer> layers =
        List.of(
            Layer.required("color", 0, List.of(TestCatalogs.trait(RED, "red"))),
            Layer.optional("hat", 1, List.of(TestCatalogs.trait(10, "cap"))));
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(layers), 1_000)
            .estimate(TestCatalogs.uniqueOver("color", "hat"));

    assertTrue(estimate.unbounded());
  }

  @Test
  void unsatisfiableRulesGiveZero() {
    Trait red =
        Trait.ruler(
            RED, "red", 1, new byte[0], List.of(CompatibilityRule.forbid("shape", CIRCLE, SQUARE)));
    List<Layer> layers =
        List.of(
            Layer.required("color", 0, List.of(red)),
            Layer.required(
                "shape",
                1,
                List.of(TestCatalogs.trait(CIRCLE, "circle"), TestCatalogs.trait(SQUARE, "s"))));

    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(layers), 1_000).estimate(UniquenessConfig.disabled());

    assertEquals(0, estimate.ceiling());
    assertFalse(estimate.admits(1));
  }

  @Test
  void overBudgetFallsBackToDomainProduct() {
    FeasibilityEstimate estimate =
        new FeasibilityEstimator(new Catalog(TestCatalogs.redForbidsSquare()), 1)
            .estimate(TestCatalogs.uniqueOver("color", "shape"));

    // the product bound ignores the forbidden pair
    assertEquals(4, estimate.ceiling());
    assertFalse(estimate.exact());
  }

  @Test
  void estimateIsDeterministic() {
    Catalog catalog = new Catalog(TestCatalogs.grid(4, 4));
    UniquenessConfig config = TestCatalogs.uniqueOver("layer0", "layer1", "layer3");

    FeasibilityEstimate first = new FeasibilityEstimator(catalog, 50).estimate(config);
    FeasibilityEstimate second = new FeasibilityEstimator(catalog, 50).estimate(config);

    assertEquals(first, second);
    assertEquals(64, first.ceiling());
  }
}
