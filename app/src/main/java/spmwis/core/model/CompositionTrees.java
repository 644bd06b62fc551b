package spmwis.core.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Stack-based traversal helpers for {@link CompositionTree}. None of these recurse, so trees whose
 * depth is in the hundreds of thousands are fine.
 */
public final class CompositionTrees {
  private CompositionTrees() {}

  /** Children of {@code node} in left-to-right order; empty for leaves. */
  public static List<CompositionTree> children(CompositionTree node) {
    return switch (node.kind()) {
      case LEAF -> List.of();
      case PARALLEL -> {
        Parallel parallel = (Parallel) node;
        yield List.of(parallel.left(), parallel.right());
      }
      case SERIES -> {
        Series series = (Series) node;
        yield List.of(series.left(), series.right());
      }
    };
  }

  /** Visits every node, parents before children, left subtree before right. */
  public static void preOrder(CompositionTree root, Consumer<CompositionTree> visitor) {
    Objects.requireNonNull(root, "root");
    Deque<CompositionTree> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      CompositionTree node = stack.pop();
      visitor.accept(node);
      List<CompositionTree> children = children(node);
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  public static int leafCount(CompositionTree root) {
    int[] count = {0};
    preOrder(
        root,
        node -> {
          if (node.kind() == CompositionTree.Kind.LEAF) {
            count[0]++;
          }
        });
    return count[0];
  }

  /** Largest vertex id named anywhere in the tree, internal terminals included. */
  public static int maxVertexId(CompositionTree root) {
    int[] max = {-1};
    preOrder(root, node -> max[0] = Math.max(max[0], node.maxTerminal()));
    return max[0];
  }

  public static int depth(CompositionTree root) {
    Objects.requireNonNull(root, "root");
    Deque<CompositionTree> nodes = new ArrayDeque<>();
    Deque<Integer> depths = new ArrayDeque<>();
    nodes.push(root);
    depths.push(1);
    int deepest = 0;
    while (!nodes.isEmpty()) {
      CompositionTree node = nodes.pop();
      int depth = depths.pop();
      deepest = Math.max(deepest, depth);
      for (CompositionTree child : children(node)) {
        nodes.push(child);
        depths.push(depth + 1);
      }
    }
    return deepest;
  }

  /** Renders the tree in the same grammar the parser accepts. */
  public static String render(CompositionTree root) {
    Objects.requireNonNull(root, "root");
    StringBuilder out = new StringBuilder();
    Deque<Object> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Object item = stack.pop();
      if (item instanceof String literal) {
        out.append(literal);
        continue;
      }
      CompositionTree node = (CompositionTree) item;
      switch (node.kind()) {
        case LEAF -> {
          Leaf leaf = (Leaf) node;
          out.append("(L ").append(leaf.x()).append(' ').append(leaf.y()).append(')');
        }
        case PARALLEL -> {
          Parallel parallel = (Parallel) node;
          out.append("(P ").append(parallel.a()).append(' ').append(parallel.b()).append(' ');
          pushChildren(stack, parallel.left(), parallel.right());
        }
        case SERIES -> {
          Series series = (Series) node;
          out.append("(S ")
              .append(series.a())
              .append(' ')
              .append(series.b())
              .append(' ')
              .append(series.c())
              .append(' ');
          pushChildren(stack, series.left(), series.right());
        }
      }
    }
    return out.toString();
  }

  private static void pushChildren(Deque<Object> stack, CompositionTree left, CompositionTree right) {
    stack.push(")");
    stack.push(right);
    stack.push(" ");
    stack.push(left);
  }
}
