package spmwis.graph;

/** Undirected edge contributed by one leaf of the composition tree. */
public record Edge(int source, int target) {

  public boolean isSelfLoop() {
    return source == target;
  }

  /** Same edge with the smaller endpoint first, so parallel duplicates compare equal. */
  public Edge canonical() {
    return source <= target ? this : new Edge(target, source);
  }

  @Override
  public String toString() {
    return source + " -- " + target;
  }
}
