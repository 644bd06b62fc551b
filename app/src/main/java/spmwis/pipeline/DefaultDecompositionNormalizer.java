package spmwis.pipeline;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import spmwis.core.model.CompositionTree;
import spmwis.core.model.Parallel;
import spmwis.core.model.Series;

/**
 * Structure-preserving normalization: every node comes back with the same kind and terminals, and
 * only its children are replaced by their normalized forms. Since nothing is rewritten the input
 * instance itself is returned.
 */
public final class DefaultDecompositionNormalizer implements DecompositionNormalizer {

  @Override
  public CompositionTree normalize(CompositionTree root) {
    Objects.requireNonNull(root, "root");
    // Post-order: a node is rebuilt once both children sit on the results stack.
    Deque<CompositionTree> pending = new ArrayDeque<>();
    Deque<Boolean> expanded = new ArrayDeque<>();
    Deque<CompositionTree> results = new ArrayDeque<>();
    pending.push(root);
    expanded.push(false);

    while (!pending.isEmpty()) {
      CompositionTree node = pending.pop();
      boolean childrenDone = expanded.pop();
      switch (node.kind()) {
        case LEAF -> results.push(node);
        case PARALLEL -> {
          Parallel parallel = (Parallel) node;
          if (childrenDone) {
            CompositionTree right = results.pop();
            CompositionTree left = results.pop();
            results.push(parallel.withChildren(left, right));
          } else {
            schedule(pending, expanded, node, parallel.left(), parallel.right());
          }
        }
        case SERIES -> {
          Series series = (Series) node;
          if (childrenDone) {
            CompositionTree right = results.pop();
            CompositionTree left = results.pop();
            results.push(series.withChildren(left, right));
          } else {
            schedule(pending, expanded, node, series.left(), series.right());
          }
        }
      }
    }
    return results.pop();
  }

  private static void schedule(
      Deque<CompositionTree> pending,
      Deque<Boolean> expanded,
      CompositionTree node,
      CompositionTree left,
      CompositionTree right) {
    pending.push(node);
    expanded.push(true);
    pending.push(right);
    expanded.push(false);
    pending.push(left);
    expanded.push(false);
  }
}
