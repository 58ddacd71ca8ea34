package traitgen.cache;

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded cache owned by exactly one run. Passed explicitly into the components that need it so no
 * cached state outlives or leaks across runs. Not thread-safe: a run is single-threaded.
 */
public final class RunCache<K, V> {
  private final String name;
  private final int capacity;
  private final EvictionPolicy<K> policy;
  private final Map<K, V> entries = new HashMap<>();
  private final CacheStats stats = new CacheStats();

  public RunCache(String name, int capacity, EvictionPolicy<K> policy) {
    Preconditions.checkArgument(capacity >= 0, "capacity must be non-negative: %s", capacity);
    this.name = Objects.requireNonNull(name, "name");
    this.capacity = capacity;
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public static <K, V> RunCache<K, V> fifo(String name, int capacity) {
    return new RunCache<>(name, capacity, EvictionPolicy.fifo());
  }

  public static <K, V> RunCache<K, V> lru(String name, int capacity) {
    return new RunCache<>(name, capacity, EvictionPolicy.lru());
  }

  public V get(K key) {
    V value = entries.get(key);
    if (value == null) {
      stats.recordMiss();
      return null;
    }
    stats.recordHit();
    policy.onAccess(key);
    return value;
  }

  public boolean contains(K key) {
    return entries.containsKey(key);
  }

  public void set(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (capacity == 0) {
      return;
    }
    if (!entries.containsKey(key)) {
      while (entries.size() >= capacity) {
        K victim = policy.victim();
        if (victim == null) {
          break;
        }
        evict(victim);
        stats.recordEviction();
      }
    }
    entries.put(key, value);
    policy.onInsert(key);
  }

  /** Removes {@code key}; returns the dropped value or {@code null}. */
  public V evict(K key) {
    V removed = entries.remove(key);
    policy.onRemove(key);
    return removed;
  }

  public void clear() {
    entries.clear();
    policy.clear();
  }

  public int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  public CacheStats stats() {
    return stats.snapshot();
  }

  @Override
  public String toString() {
    return name + "[" + entries.size() + "/" + capacity + ", " + stats + "]";
  }
}
