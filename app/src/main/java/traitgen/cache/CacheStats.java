package traitgen.cache;

/** Hit, miss and eviction counters of one {@link RunCache}. */
public final class CacheStats {
  private long hits;
  private long misses;
  private long evictions;

  public CacheStats() {}

  private CacheStats(long hits, long misses, long evictions) {
    this.hits = hits;
    this.misses = misses;
    this.evictions = evictions;
  }

  public static CacheStats of(long hits, long misses, long evictions) {
    return new CacheStats(hits, misses, evictions);
  }

  void recordHit() {
    hits++;
  }

  void recordMiss() {
    misses++;
  }

  void recordEviction() {
    evictions++;
  }

  public long hits() {
    return hits;
  }

  public long misses() {
    return misses;
  }

  public long evictions() {
    return evictions;
  }

  public long lookups() {
    return hits + misses;
  }

  public double hitRate() {
    long total = lookups();
    return total == 0 ? 0.0 : hits / (double) total;
  }

  public CacheStats snapshot() {
    return CacheStats.of(hits, misses, evictions);
  }

  @Override
  public String toString() {
    return String.format(
        "hits=%d misses=%d evictions=%d hitRate=%.1f%%", hits, misses, evictions, hitRate() * 100);
  }
}
