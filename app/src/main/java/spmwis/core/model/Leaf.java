package spmwis.core.model;

/** A single undirected edge between {@code x} and {@code y}. */
public record Leaf(int x, int y) implements CompositionTree {

  public Leaf {
    if (x < 0 || y < 0) {
      throw new IllegalArgumentException("Vertex ids must be non-negative: (" + x + ", " + y + ")");
    }
  }

  @Override
  public Kind kind() {
    return Kind.LEAF;
  }

  @Override
  public int source() {
    return x;
  }

  @Override
  public int sink() {
    return y;
  }

  @Override
  public int maxTerminal() {
    return Math.max(x, y);
  }

  @Override
  public String toString() {
    return "(L " + x + " " + y + ")";
  }
}
