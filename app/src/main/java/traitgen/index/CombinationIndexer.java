package traitgen.index;

import com.google.common.base.Joiner;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Packs small trait-id tuples into one {@code long} for O(1) membership checks, with a hashed
 * fallback for tuples outside the packable bounds.
 */
public final class CombinationIndexer {
  public static final int BITS_PER_ID = 8;
  public static final int MAX_IDS = 8;
  public static final int MAX_ID = (1 << BITS_PER_ID) - 1;

  private static final long ID_MASK = MAX_ID;
  private static final HashFunction HASH = Hashing.murmur3_32_fixed();
  private static final Joiner DELIMITED = Joiner.on('|');

  private CombinationIndexer() {}

  /**
   * Packs ids in the given order, slot {@code i} occupying bits {@code 8i..8i+7}.
   *
   * @throws IllegalArgumentException when more than 8 ids are given or any id is outside 0..255
   */
  public static long pack(int... ids) {
    if (ids.length > MAX_IDS) {
      throw new IllegalArgumentException(
          "At most " + MAX_IDS + " ids can be packed; received " + ids.length);
    }
    long packed = 0L;
    for (int i = 0; i < ids.length; i++) {
      int id = ids[i];
      if (id < 0 || id > MAX_ID) {
        throw new IllegalArgumentException(
            "Id " + id + " is outside the packable range 0.." + MAX_ID);
      }
      packed |= ((long) id) << (i * BITS_PER_ID);
    }
    return packed;
  }

  /** Inverse of {@link #pack(int...)} for a tuple of {@code length} ids. */
  public static int[] unpack(long packed, int length) {
    if (length < 0 || length > MAX_IDS) {
      throw new IllegalArgumentException("length must be within 0.." + MAX_IDS + ": " + length);
    }
    int[] ids = new int[length];
    for (int i = 0; i < length; i++) {
      ids[i] = (int) ((packed >>> (i * BITS_PER_ID)) & ID_MASK);
    }
    return ids;
  }

  public static boolean packable(int... ids) {
    if (ids.length > MAX_IDS) {
      return false;
    }
    for (int id : ids) {
      if (id < 0 || id > MAX_ID) {
        return false;
      }
    }
    return true;
  }

  /** Deterministic 32-bit unsigned hash of the sorted, {@code |}-joined id list. */
  public static long hash(int... ids) {
    int[] sorted = sortedCopy(ids);
    String joined = DELIMITED.join(Arrays.stream(sorted).boxed().iterator());
    return Integer.toUnsignedLong(HASH.hashString(joined, StandardCharsets.UTF_8).asInt());
  }

  /**
   * Order-independent key for an id tuple: exact packing of the sorted ids when possible, the
   * hashed approximation otherwise.
   */
  public static CombinationKey key(int... ids) {
    int[] sorted = sortedCopy(ids);
    if (packable(sorted)) {
      return CombinationKey.packed(pack(sorted));
    }
    return CombinationKey.hashed(hash(sorted));
  }

  private static int[] sortedCopy(int[] ids) {
    int[] sorted = ids.clone();
    Arrays.sort(sorted);
    return sorted;
  }
}
