package traitgen.index;

/**
 * Membership key of one sorted trait-id tuple.
 *
 * <p>Two constructors share one {@code long} key space so a single set serves both:
 *
 * <ul>
 *   <li>{@link #packed(long)}: exact. Up to 8 ids of at most 255 each, 8 bits per slot, so distinct
 *       tuples never collide.
 *   <li>{@link #hashed(long)}: approximate. A 32-bit unsigned hash of the delimiter-joined ids. Two
 *       different tuples may share a value, and a hashed value may coincide with a packed one. A
 *       collision makes a fresh tuple look used, so it can only under-generate, never repeat.
 * </ul>
 *
 * <p>Equality compares the value only, matching how the uniqueness tracker stores keys.
 */
public final class CombinationKey {
  private final long value;
  private final boolean exact;

  private CombinationKey(long value, boolean exact) {
    this.value = value;
    this.exact = exact;
  }

  public static CombinationKey packed(long value) {
    return new CombinationKey(value, true);
  }

  public static CombinationKey hashed(long value) {
    if (value < 0 || value > 0xFFFF_FFFFL) {
      throw new IllegalArgumentException("hashed key must be a 32-bit unsigned value: " + value);
    }
    return new CombinationKey(value, false);
  }

  public long value() {
    return value;
  }

  public boolean exact() {
    return exact;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CombinationKey key && key.value == value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return (exact ? "packed:" : "hashed:") + Long.toHexString(value);
  }
}
