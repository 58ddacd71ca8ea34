package traitgen.cache;

import java.util.Iterator;
import java.util.LinkedHashSet;

/** Chooses which key a full {@link RunCache} gives up. */
public interface EvictionPolicy<K> {

  void onInsert(K key);

  void onAccess(K key);

  void onRemove(K key);

  /** Next key to evict, or {@code null} when nothing is tracked. */
  K victim();

  void clear();

  static <K> EvictionPolicy<K> fifo() {
    return new OrderedPolicy<>(false);
  }

  static <K> EvictionPolicy<K> lru() {
    return new OrderedPolicy<>(true);
  }

  /** Insertion-ordered tracking; with {@code refreshOnAccess} a hit moves the key to the tail. */
  final class OrderedPolicy<K> implements EvictionPolicy<K> {
    private final LinkedHashSet<K> order = new LinkedHashSet<>();
    private final boolean refreshOnAccess;

    OrderedPolicy(boolean refreshOnAccess) {
      this.refreshOnAccess = refreshOnAccess;
    }

    @Override
    public void onInsert(K key) {
      order.remove(key);
      order.add(key);
    }

    @Override
    public void onAccess(K key) {
      if (refreshOnAccess && order.remove(key)) {
        order.add(key);
      }
    }

    @Override
    public void onRemove(K key) {
      order.remove(key);
    }

    @Override
    public K victim() {
      Iterator<K> iterator = order.iterator();
      return iterator.hasNext() ? iterator.next() : null;
    }

    @Override
    public void clear() {
      order.clear();
    }
  }
}
