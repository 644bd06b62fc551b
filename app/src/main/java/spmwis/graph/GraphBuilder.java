package spmwis.graph;

import java.util.Objects;
import spmwis.core.model.CompositionTree;
import spmwis.core.model.CompositionTrees;
import spmwis.core.model.Leaf;

/**
 * Materializes a composition tree into an {@link AdjacencyGraph}. Only leaves contribute: each
 * adds one undirected edge. Parallel and series nodes are pure structure here, so a tree with k
 * leaves yields exactly k edges.
 */
public final class GraphBuilder {

  public AdjacencyGraph build(CompositionTree root, int vertexCount) {
    Objects.requireNonNull(root, "root");
    AdjacencyGraph.Builder builder = AdjacencyGraph.builder(vertexCount);
    CompositionTrees.preOrder(
        root,
        node -> {
          if (node.kind() == CompositionTree.Kind.LEAF) {
            Leaf leaf = (Leaf) node;
            builder.addEdge(leaf.x(), leaf.y());
          }
        });
    return builder.build();
  }
}
