package spmwis.parse;

import java.util.Objects;
import spmwis.core.model.CompositionTree;

/**
 * Output of {@link SpTreeParser}: the tree plus the size of its vertex id space.
 *
 * @param root parsed tree
 * @param vertexCount one plus the largest vertex id seen anywhere in the tree
 * @param leafCount number of leaf nodes, i.e. edges the tree materializes into
 */
public record ParsedTree(CompositionTree root, int vertexCount, int leafCount) {

  public ParsedTree {
    Objects.requireNonNull(root, "root");
    if (vertexCount < 1) {
      throw new IllegalArgumentException("vertexCount must be positive");
    }
    if (leafCount < 1) {
      throw new IllegalArgumentException("leafCount must be positive");
    }
  }
}
