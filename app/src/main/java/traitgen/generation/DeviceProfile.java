package traitgen.generation;

/**
 * Capabilities of the host the pool runs on. Memory defaults to the JVM's max heap; both memory and
 * the mobile flag may be overridden with the {@code traitgen.device.memoryGb} and
 * {@code traitgen.device.mobile} system properties.
 */
public record DeviceProfile(int cores, double memoryGb, boolean mobile) {
  public static final String MEMORY_PROPERTY = "traitgen.device.memoryGb";
  public static final String MOBILE_PROPERTY = "traitgen.device.mobile";

  public DeviceProfile {
    cores = Math.max(1, cores);
    memoryGb = memoryGb > 0 ? memoryGb : 1.0;
  }

  public static DeviceProfile of(int cores, double memoryGb) {
    return new DeviceProfile(cores, memoryGb, false);
  }

  public static DeviceProfile detect() {
    Runtime runtime = Runtime.getRuntime();
    double memoryGb = runtime.maxMemory() / (1024.0 * 1024.0 * 1024.0);
    String override = System.getProperty(MEMORY_PROPERTY);
    if (override != null && !override.isBlank()) {
      try {
        memoryGb = Double.parseDouble(override.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Invalid " + MEMORY_PROPERTY + " value: " + override, e);
      }
    }
    boolean mobile = Boolean.getBoolean(MOBILE_PROPERTY);
    return new DeviceProfile(runtime.availableProcessors(), memoryGb, mobile);
  }
}
