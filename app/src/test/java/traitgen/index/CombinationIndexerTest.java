package traitgen.index;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class CombinationIndexerTest {

  @Test
  void packPlacesEachIdInItsOwnByte() {
    assertEquals(0x0302_01L, CombinationIndexer.pack(1, 2, 3));
    assertEquals(0xFFL << 56, CombinationIndexer.pack(0, 0, 0, 0, 0, 0, 0, 255));
  }

  @Test
  void unpackRestoresRandomTuples() {
    Random random = new Random(17);
    for (int trial = 0; trial < 200; trial++) {
      int length = random.nextInt(CombinationIndexer.MAX_IDS + 1);
      int[] ids = random.ints(length, 0, CombinationIndexer.MAX_ID + 1).toArray();
      assertArrayEquals(ids, CombinationIndexer.unpack(CombinationIndexer.pack(ids), length));
    }
  }

  @Test
  void packRejectsOutOfRangeTuples() {
    assertThrows(IllegalArgumentException.class, () -> CombinationIndexer.pack(256));
    assertThrows(IllegalArgumentException.class, () -> CombinationIndexer.pack(-1));
    assertThrows(
        IllegalArgumentException.class, () -> CombinationIndexer.pack(1, 2, 3, 4, 5, 6, 7, 8, 9));
    assertFalse(CombinationIndexer.packable(1, 300));
    assertTrue(CombinationIndexer.packable(0, 255));
  }

  @Test
  void keyIgnoresTupleOrder() {
    assertEquals(CombinationIndexer.key(3, 1, 2), CombinationIndexer.key(1, 2, 3));
    assertEquals(CombinationIndexer.key(300, 7), CombinationIndexer.key(7, 300));
    assertNotEquals(CombinationIndexer.key(1, 2), CombinationIndexer.key(1, 3));
  }

  @Test
  void largeIdsFallBackToHashedKeys() {
    CombinationKey packed = CombinationIndexer.key(10, 20);
    CombinationKey hashed = CombinationIndexer.key(10, 2000);
    CombinationKey longTuple = CombinationIndexer.key(1, 2, 3, 4, 5, 6, 7, 8, 9);

    assertTrue(packed.exact());
    assertFalse(hashed.exact());
    assertFalse(longTuple.exact());
    assertTrue(hashed.value() >= 0 && hashed.value() <= 0xFFFF_FFFFL);
    assertEquals(CombinationIndexer.hash(2000, 10), hashed.value());
  }

  @Test
  void hashedKeysAreDeterministicAndRarelyCollide() {
    Set<Long> seen = new HashSet<>();
    for (int a = 256; a < 356; a++) {
      for (int b = 1000; b < 1100; b++) {
        long first = CombinationIndexer.hash(a, b);
        assertEquals(first, CombinationIndexer.hash(b, a));
        seen.add(first);
      }
    }
    // 10k tuples into a 32-bit space; a handful of collisions would already be suspicious
    assertTrue(seen.size() >= 9_990, "unexpected collisions: " + (10_000 - seen.size()));
  }

  @Test
  void keySharesOneMembershipSpaceAcrossPaths() {
    Set<CombinationKey> used = new HashSet<>();
    used.add(CombinationIndexer.key(4, 9));
    used.add(CombinationIndexer.key(512, 9));

    assertTrue(used.contains(CombinationIndexer.key(9, 4)));
    assertTrue(used.contains(CombinationIndexer.key(9, 512)));
    assertFalse(used.contains(CombinationIndexer.key(4, 10)));
    assertEquals(2, used.size(), () -> "keys: " + Arrays.toString(used.toArray()));
  }
}
