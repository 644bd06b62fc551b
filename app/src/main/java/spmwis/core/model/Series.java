package spmwis.core.model;

import java.util.Objects;

/**
 * Two subgraphs chained through the middle vertex {@code b}. The source is {@code a} and the sink
 * is {@code c}.
 */
public record Series(int a, int b, int c, CompositionTree left, CompositionTree right)
    implements CompositionTree {

  public Series {
    if (a < 0 || b < 0 || c < 0) {
      throw new IllegalArgumentException(
          "Vertex ids must be non-negative: (" + a + ", " + b + ", " + c + ")");
    }
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public Kind kind() {
    return Kind.SERIES;
  }

  @Override
  public int source() {
    return a;
  }

  @Override
  public int sink() {
    return c;
  }

  /** The vertex shared by the two halves. */
  public int middle() {
    return b;
  }

  @Override
  public int maxTerminal() {
    return Math.max(a, Math.max(b, c));
  }

  /** Returns this node with its children replaced, or {@code this} when both are unchanged. */
  public Series withChildren(CompositionTree newLeft, CompositionTree newRight) {
    if (newLeft == left && newRight == right) {
      return this;
    }
    return new Series(a, b, c, newLeft, newRight);
  }

  @Override
  public String toString() {
    return CompositionTrees.render(this);
  }
}
