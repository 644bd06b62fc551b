package spmwis.pipeline;

import java.util.BitSet;
import java.util.Objects;
import java.util.Set;
import spmwis.graph.AdjacencyGraph;
import spmwis.graph.Edge;
import spmwis.pipeline.TreePreconditionException.Violation;
import spmwis.util.GraphUtils;

/**
 * Checks that a materialized graph is a tree once parallel edges are collapsed: no self-loops,
 * every vertex reachable from the root, and exactly {@code V - 1} distinct edges.
 */
public final class TreeShapeValidator {

  public void validate(AdjacencyGraph graph, int root) {
    Objects.requireNonNull(graph, "graph");
    for (Edge edge : graph.edges()) {
      if (edge.isSelfLoop()) {
        throw new TreePreconditionException(
            Violation.SELF_LOOP, "Self-loop on vertex " + edge.source());
      }
    }

    int n = graph.vertexCount();
    BitSet reachable = GraphUtils.reachableFrom(graph, root);
    if (reachable.cardinality() < n) {
      int firstMissing = reachable.nextClearBit(0);
      throw new TreePreconditionException(
          Violation.DISCONNECTED,
          (n - reachable.cardinality())
              + " of "
              + n
              + " vertices are unreachable from root "
              + root
              + " (first: "
              + firstMissing
              + ")");
    }

    Set<Edge> distinct = GraphUtils.distinctEdges(graph);
    if (distinct.size() != n - 1) {
      throw new TreePreconditionException(
          Violation.CYCLE,
          "Graph has "
              + distinct.size()
              + " distinct edges over "
              + n
              + " vertices; a tree needs exactly "
              + (n - 1));
    }
  }
}
