package traitgen.generation;

/** Chunk sizes for chunked delivery: an initial size from the device, then memory-driven steps. */
public final class ChunkSizer {
  public static final int MIN_INITIAL = 10;
  public static final int MAX = 200;
  static final int LARGE_COLLECTION = 10_000;
  static final int LARGE_COLLECTION_CAP = 100;
  static final int SMALL_COLLECTION = 50;

  private ChunkSizer() {}

  public static int initial(int collectionSize, DeviceProfile device) {
    int byMemory = (int) Math.floor(device.memoryGb() * 1024 / 64);
    int chunk = Math.min(byMemory, device.cores() * 10);
    if (device.mobile()) {
      chunk = chunk / 2;
    }
    if (collectionSize > LARGE_COLLECTION) {
      chunk = Math.min(chunk, LARGE_COLLECTION_CAP);
    }
    chunk = Math.max(MIN_INITIAL, Math.min(chunk, MAX));
    if (collectionSize < SMALL_COLLECTION) {
      chunk = Math.min(chunk, collectionSize);
    }
    return Math.max(1, chunk);
  }

  /** Shrinks under memory pressure and grows under slack; other ratios keep the size. */
  public static int adapt(int current, MemorySnapshot memory) {
    if (memory == null) {
      return current;
    }
    double ratio = memory.ratio();
    if (ratio > 0.9) {
      return Math.max(5, (int) Math.floor(current * 0.3));
    } else if (ratio > 0.8) {
      return Math.max(10, (int) Math.floor(current * 0.5));
    } else if (ratio > 0.7) {
      return Math.max(15, (int) Math.floor(current * 0.7));
    } else if (ratio < 0.5 && current < MAX) {
      return Math.min(MAX, (int) Math.floor(current * 1.2));
    }
    return current;
  }
}
