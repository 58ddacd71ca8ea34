package traitgen.solver;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * AC-3 over the directed arcs of a {@link ConstraintGraph}.
 *
 * <p>Revising arc {@code (i, j)} drops every trait of layer {@code i} with no compatible trait left
 * in layer {@code j}. A layer that may still be skipped supports everything. A revised domain
 * re-queues the arcs pointing into it.
 */
final class ArcConsistency {
  private final ConstraintGraph graph;
  private final SolverStats stats;

  ArcConsistency(ConstraintGraph graph, SolverStats stats) {
    this.graph = graph;
    this.stats = stats;
  }

  /** Runs AC-3 from every arc of the graph. */
  boolean enforceAll(Domains domains) {
    ArcQueue queue = new ArcQueue(graph.layerCount());
    for (int i = 0; i < graph.layerCount(); i++) {
      for (int j : graph.neighbors(i)) {
        queue.offer(i, j);
      }
    }
    return propagate(domains, queue);
  }

  /** Runs AC-3 after {@code layer} changed, starting from the arcs that point into it. */
  boolean enforceAfter(Domains domains, int layer) {
    ArcQueue queue = new ArcQueue(graph.layerCount());
    for (int k : graph.neighbors(layer)) {
      queue.offer(k, layer);
    }
    return propagate(domains, queue);
  }

  private boolean propagate(Domains domains, ArcQueue queue) {
    while (!queue.isEmpty()) {
      int[] arc = queue.poll();
      int i = arc[0];
      int j = arc[1];
      if (domains.decided(i) && domains.skipped(i)) {
        continue;
      }
      if (!domains.mustFill(graph, j)) {
        continue;
      }
      if (revise(domains, i, j)) {
        if (domains.size(i) == 0 && domains.mustFill(graph, i)) {
          return false;
        }
        for (int k : graph.neighbors(i)) {
          if (k != j) {
            queue.offer(k, i);
          }
        }
      }
    }
    return true;
  }

  private boolean revise(Domains domains, int i, int j) {
    BitSet source = domains.values(i);
    BitSet target = domains.values(j);
    boolean revised = false;
    for (int a = source.nextSetBit(0); a >= 0; a = source.nextSetBit(a + 1)) {
      stats.recordConstraintCheck();
      BitSet supported = graph.support(i, a, j);
      if (supported != null && !supported.intersects(target)) {
        source.clear(a);
        revised = true;
      }
    }
    if (revised) {
      stats.recordRevision();
    }
    return revised;
  }

  private static final class ArcQueue {
    private final Deque<int[]> arcs = new ArrayDeque<>();
    private final boolean[][] queued;

    ArcQueue(int layers) {
      this.queued = new boolean[layers][layers];
    }

    void offer(int i, int j) {
      if (!queued[i][j]) {
        queued[i][j] = true;
        arcs.addLast(new int[] {i, j});
      }
    }

    int[] poll() {
      int[] arc = arcs.pollFirst();
      queued[arc[0]][arc[1]] = false;
      return arc;
    }

    boolean isEmpty() {
      return arcs.isEmpty();
    }
  }
}
