package spmwis.pipeline;

import java.util.List;
import java.util.Objects;
import spmwis.graph.AdjacencyGraph;
import spmwis.util.GraphUtils;

/** Re-checks a reconstructed set against the graph and the reported optimum. */
public final class SolutionVerifier {

  public void verify(AdjacencyGraph graph, long[] weights, List<Integer> vertices, long optimum) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(vertices, "vertices");
    if (!GraphUtils.isIndependent(graph, vertices)) {
      throw new IllegalStateException("Reconstructed set is not independent: " + vertices);
    }
    long weight = GraphUtils.weightOf(vertices, weights);
    if (weight != optimum) {
      throw new IllegalStateException(
          "Reconstructed set weighs " + weight + " but the optimum is " + optimum);
    }
  }
}
