package spmwis.solver;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spmwis.graph.AdjacencyGraph;

/**
 * Maximum weight independent set on a tree by dynamic programming over a DFS rooting.
 *
 * <p>For every vertex v with DFS children u:
 *
 * <ul>
 *   <li>{@code dp[v][0] = sum(max(dp[u][0], dp[u][1]))}
 *   <li>{@code dp[v][1] = weight[v] + sum(dp[u][0])}
 * </ul>
 *
 * and the optimum is {@code max(dp[root][0], dp[root][1])}.
 *
 * <p><b>Precondition:</b> the graph, with parallel edges collapsed, must be a tree (acyclic and
 * connected). This class does not check it. On any other input the DFS still terminates, but the
 * result only covers the root's component and cycle edges are ignored. Callers that cannot
 * guarantee the shape should run {@code TreeShapeValidator} first.
 *
 * <p>The DFS keeps an explicit stack of (vertex, next neighbour) frames, which visits vertices in
 * exactly the order the recursive formulation would without using the call stack.
 *
 * <p>Sums that overflow a {@code long} throw {@link ArithmeticException}.
 */
public final class TreeMwisSolver {
  private static final Logger LOG = LoggerFactory.getLogger(TreeMwisSolver.class);

  public static final int DEFAULT_ROOT = 0;

  public MwisTable solve(AdjacencyGraph graph, long[] weights) {
    return solve(graph, weights, DEFAULT_ROOT);
  }

  public MwisTable solve(AdjacencyGraph graph, long[] weights, int root) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(weights, "weights");
    int n = graph.vertexCount();
    if (weights.length != n) {
      throw new IllegalArgumentException(
          "Expected " + n + " weights but got " + weights.length);
    }
    if (root < 0 || root >= n) {
      throw new IllegalArgumentException("Root " + root + " outside vertex range 0.." + (n - 1));
    }

    long[] excluded = new long[n];
    long[] included = new long[n];
    boolean[] preferInclude = new boolean[n];
    boolean[] visited = new boolean[n];
    int[] parent = new int[n];
    Arrays.fill(parent, -1);
    int[][] children = new int[n][];
    int[] childCounts = new int[n];
    int visitedCount = 0;

    Deque<int[]> stack = new ArrayDeque<>();
    enter(root, graph, weights, visited, included, children);
    visitedCount++;
    stack.push(new int[] {root, 0});

    while (!stack.isEmpty()) {
      int[] frame = stack.peek();
      int v = frame[0];
      if (frame[1] < graph.degree(v)) {
        int u = graph.neighbour(v, frame[1]++);
        // Visited neighbours are the parent or a parallel copy of an edge already followed.
        if (!visited[u]) {
          parent[u] = v;
          children[v][childCounts[v]++] = u;
          enter(u, graph, weights, visited, included, children);
          visitedCount++;
          stack.push(new int[] {u, 0});
        }
        continue;
      }

      stack.pop();
      children[v] = Arrays.copyOf(children[v], childCounts[v]);
      preferInclude[v] = included[v] >= excluded[v];
      int p = parent[v];
      if (p >= 0) {
        excluded[p] = Math.addExact(excluded[p], Math.max(excluded[v], included[v]));
        included[p] = Math.addExact(included[p], excluded[v]);
      }
    }

    for (int v = 0; v < n; v++) {
      if (children[v] == null) {
        children[v] = new int[0];
      }
    }
    if (visitedCount < n) {
      LOG.warn(
          "{} of {} vertices are unreachable from root {} and were left out of the DP",
          n - visitedCount,
          n,
          root);
    }
    MwisTable table =
        new MwisTable(
            root, excluded, included, preferInclude, visited, parent, children, visitedCount);
    LOG.debug(
        "Tree DP finished: root={}, dp[root]=({}, {}), visited={}",
        root,
        excluded[root],
        included[root],
        visitedCount);
    return table;
  }

  private static void enter(
      int v,
      AdjacencyGraph graph,
      long[] weights,
      boolean[] visited,
      long[] included,
      int[][] children) {
    visited[v] = true;
    included[v] = weights[v];
    children[v] = new int[graph.degree(v)];
  }
}
