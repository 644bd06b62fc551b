package spmwis.core.model;

import java.util.Objects;

/** Two subgraphs glued at both endpoints; terminals are {@code a} and {@code b}. */
public record Parallel(int a, int b, CompositionTree left, CompositionTree right)
    implements CompositionTree {

  public Parallel {
    if (a < 0 || b < 0) {
      throw new IllegalArgumentException("Vertex ids must be non-negative: (" + a + ", " + b + ")");
    }
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public Kind kind() {
    return Kind.PARALLEL;
  }

  @Override
  public int source() {
    return a;
  }

  @Override
  public int sink() {
    return b;
  }

  @Override
  public int maxTerminal() {
    return Math.max(a, b);
  }

  /** Returns this node with its children replaced, or {@code this} when both are unchanged. */
  public Parallel withChildren(CompositionTree newLeft, CompositionTree newRight) {
    if (newLeft == left && newRight == right) {
      return this;
    }
    return new Parallel(a, b, newLeft, newRight);
  }

  @Override
  public String toString() {
    return CompositionTrees.render(this);
  }
}
