package traitgen.testing;

/**
 * Test knobs that a runner can override through system properties or environment variables.
 */
public final class TestDefaults {
  private static final String SEED_PROPERTY = "traitgen.test.seed";
  private static final String SEED_ENV = "TRAITGEN_TEST_SEED";
  private static final long DEFAULT_SEED = 42L;

  private static final String SWEEP_PROPERTY = "traitgen.test.seedSweep";
  private static final String SWEEP_ENV = "TRAITGEN_TEST_SEED_SWEEP";
  private static final long DEFAULT_SWEEP = 40L;

  private TestDefaults() {}

  /** Solver seed for deterministic controller runs. Defaults to 42. */
  public static long seed() {
    return read(SEED_PROPERTY, SEED_ENV, DEFAULT_SEED);
  }

  /**
   * Number of seeds randomized solver tests sweep. Defaults to 40; raise it via {@code
   * traitgen.test.seedSweep} or {@code TRAITGEN_TEST_SEED_SWEEP} for a longer soak.
   */
  public static long seedSweep() {
    return Math.max(1L, read(SWEEP_PROPERTY, SWEEP_ENV, DEFAULT_SWEEP));
  }

  private static long read(String property, String env, long fallback) {
    String propertyValue = System.getProperty(property);
    if (propertyValue != null) {
      try {
        return Long.parseLong(propertyValue.trim());
      } catch (NumberFormatException ignored) {
        // fall back to env/default
      }
    }
    String envValue = System.getenv(env);
    if (envValue != null) {
      try {
        return Long.parseLong(envValue.trim());
      } catch (NumberFormatException ignored) {
        // fall through
      }
    }
    return fallback;
  }
}
