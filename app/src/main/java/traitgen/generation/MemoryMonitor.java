package traitgen.generation;

/** Source of memory readings used to adapt chunk sizes. */
@FunctionalInterface
public interface MemoryMonitor {

  MemorySnapshot sample();

  static MemoryMonitor runtime() {
    return () -> {
      Runtime runtime = Runtime.getRuntime();
      long used = runtime.totalMemory() - runtime.freeMemory();
      return new MemorySnapshot(used, runtime.maxMemory());
    };
  }

  static MemoryMonitor fixed(double ratio) {
    long limit = 1L << 30;
    MemorySnapshot snapshot = new MemorySnapshot((long) (limit * ratio), limit);
    return () -> snapshot;
  }
}
