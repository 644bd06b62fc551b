package spmwis.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spmwis.graph.AdjacencyGraph;

/**
 * Exhaustive maximum weight independent set, used as a reference for the tree DP. Sets are grown
 * one vertex at a time in increasing id order, and a branch is only extended while it is still
 * independent. Works on any graph, but is exponential and therefore capped at {@link
 * #MAX_TRACTABLE_VERTICES}.
 */
public final class BruteForceMwis {
  private static final Logger LOG = LoggerFactory.getLogger(BruteForceMwis.class);

  public static final int MAX_TRACTABLE_VERTICES = 25;

  public record Result(long value, List<Integer> vertices, long setsExamined) {
    public Result {
      vertices = List.copyOf(vertices);
    }
  }

  public Result solve(AdjacencyGraph graph, long[] weights) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(weights, "weights");
    int n = graph.vertexCount();
    if (n > MAX_TRACTABLE_VERTICES) {
      throw new IllegalArgumentException(
          "Brute force is limited to " + MAX_TRACTABLE_VERTICES + " vertices, got " + n);
    }
    if (weights.length != n) {
      throw new IllegalArgumentException("Expected " + n + " weights but got " + weights.length);
    }

    long[] conflicts = new long[n];
    for (int v = 0; v < n; v++) {
      for (int u : graph.neighbours(v)) {
        conflicts[v] |= 1L << u;
      }
    }

    Search search = new Search(n, weights, conflicts);
    search.sample(0, 0L, 0L, 0L);

    List<Integer> vertices = new ArrayList<>();
    for (int v = 0; v < n; v++) {
      if ((search.bestSet & (1L << v)) != 0) {
        vertices.add(v);
      }
    }
    LOG.debug("Brute force examined {} sets, best={}", search.examined, search.bestScore);
    return new Result(search.bestScore, Collections.unmodifiableList(vertices), search.examined);
  }

  private static final class Search {
    private final int n;
    private final long[] weights;
    private final long[] conflicts;
    private long bestScore;
    private long bestSet;
    private long examined;

    Search(int n, long[] weights, long[] conflicts) {
      this.n = n;
      this.weights = weights;
      this.conflicts = conflicts;
    }

    /** Scores {@code chosen}, then tries every extension by a vertex above {@code next}. */
    void sample(int next, long chosen, long blocked, long score) {
      examined++;
      if (score > bestScore) {
        bestScore = score;
        bestSet = chosen;
      }
      for (int v = next; v < n; v++) {
        long bit = 1L << v;
        // A self-loop makes v conflict with itself.
        if ((blocked & bit) != 0 || (conflicts[v] & bit) != 0) {
          continue;
        }
        sample(
            v + 1, chosen | bit, blocked | conflicts[v] | bit, Math.addExact(score, weights[v]));
      }
    }
  }
}
