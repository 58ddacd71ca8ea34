package traitgen.solver;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import traitgen.core.model.Trait;

/** Order in which the solver tries the remaining traits of a layer. */
public enum CandidateOrdering {
  /** Higher rarity weight first; equal weights shuffled uniformly. */
  RARITY_FIRST {
    @Override
    List<Integer> order(Trait[] traits, BitSet domain, Random random) {
      List<Integer> candidates = candidates(domain);
      Collections.shuffle(candidates, random);
      // stable sort keeps the shuffled order inside each weight band
      candidates.sort(Comparator.comparingInt((Integer a) -> traits[a].rarityWeight()).reversed());
      return candidates;
    }
  },

  /**
   * Weighted random permutation: each trait is drawn ahead of the rest with probability
   * proportional to its rarity weight.
   */
  WEIGHTED_RANDOM {
    @Override
    List<Integer> order(Trait[] traits, BitSet domain, Random random) {
      List<Integer> candidates = candidates(domain);
      double[] keys = new double[traits.length];
      for (int a : candidates) {
        double weight = Math.max(1, traits[a].rarityWeight());
        keys[a] = Math.pow(random.nextDouble(), 1.0 / weight);
      }
      candidates.sort(Comparator.comparingDouble((Integer a) -> keys[a]).reversed());
      return candidates;
    }
  };

  abstract List<Integer> order(Trait[] traits, BitSet domain, Random random);

  private static List<Integer> candidates(BitSet domain) {
    List<Integer> candidates = new ArrayList<>(domain.cardinality());
    for (int a = domain.nextSetBit(0); a >= 0; a = domain.nextSetBit(a + 1)) {
      candidates.add(a);
    }
    return candidates;
  }
}
