package traitgen.generation;

/** Heap usage at one instant; {@code limitBytes} is the most the run may use. */
public record MemorySnapshot(long usedBytes, long limitBytes) {

  public double ratio() {
    return limitBytes <= 0 ? 0.0 : (double) usedBytes / limitBytes;
  }

  public long usedMegabytes() {
    return usedBytes / (1024 * 1024);
  }
}
