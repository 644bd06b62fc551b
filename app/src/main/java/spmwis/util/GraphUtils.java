package spmwis.util;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import spmwis.graph.AdjacencyGraph;
import spmwis.graph.Edge;

/** Graph utilities shared by validation, verification and tests. */
public final class GraphUtils {
  private GraphUtils() {}

  /** Vertices reachable from {@code start}, the start itself included. */
  public static BitSet reachableFrom(AdjacencyGraph graph, int start) {
    Objects.requireNonNull(graph, "graph");
    Objects.checkIndex(start, graph.vertexCount());
    BitSet visited = new BitSet(graph.vertexCount());
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(start);

    while (!stack.isEmpty()) {
      int current = stack.pop();
      if (visited.get(current)) {
        continue;
      }
      visited.set(current);
      for (int i = 0; i < graph.degree(current); i++) {
        int neighbour = graph.neighbour(current, i);
        if (!visited.get(neighbour)) {
          stack.push(neighbour);
        }
      }
    }
    return visited;
  }

  public static boolean isConnected(AdjacencyGraph graph) {
    if (graph.vertexCount() == 0) {
      return false;
    }
    return reachableFrom(graph, 0).cardinality() == graph.vertexCount();
  }

  /** Edges with parallel duplicates collapsed, each oriented smaller id first; self-loops kept. */
  public static Set<Edge> distinctEdges(AdjacencyGraph graph) {
    Set<Edge> distinct = new LinkedHashSet<>();
    for (Edge edge : graph.edges()) {
      distinct.add(edge.canonical());
    }
    return distinct;
  }

  /** True when no two of {@code vertices} are adjacent and none carries a self-loop. */
  public static boolean isIndependent(AdjacencyGraph graph, Collection<Integer> vertices) {
    BitSet members = new BitSet(graph.vertexCount());
    for (int v : vertices) {
      members.set(v);
    }
    for (Edge edge : graph.edges()) {
      if (members.get(edge.source()) && members.get(edge.target())) {
        return false;
      }
    }
    return true;
  }

  /** Sum of the weights of {@code vertices}; overflow throws {@link ArithmeticException}. */
  public static long weightOf(Collection<Integer> vertices, long[] weights) {
    long total = 0L;
    for (int v : vertices) {
      total = Math.addExact(total, weights[v]);
    }
    return total;
  }
}
