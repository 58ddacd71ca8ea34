package traitgen.util;

import java.util.BitSet;

/** Helpers for the {@link BitSet} trait domains used by the solver. */
public final class Bitsets {
  private Bitsets() {}

  public static BitSet allOnes(int size) {
    BitSet bitSet = new BitSet(size);
    bitSet.set(0, size);
    return bitSet;
  }

  public static BitSet copy(BitSet bitSet) {
    return bitSet == null ? new BitSet() : (BitSet) bitSet.clone();
  }

  public static BitSet[] deepCopy(BitSet[] domains) {
    BitSet[] copy = new BitSet[domains.length];
    for (int i = 0; i < domains.length; i++) {
      copy[i] = copy(domains[i]);
    }
    return copy;
  }

  public static BitSet singleton(int index) {
    BitSet bitSet = new BitSet(index + 1);
    bitSet.set(index);
    return bitSet;
  }
}
