package spmwis.solver;

import java.util.Objects;

/**
 * Filled DP table of one {@link TreeMwisSolver} run: the exclude/include values per vertex, the
 * recorded branch decisions, and the DFS tree (parent and ordered children) rooted at {@link
 * #root()}. Entries of vertices the DFS never reached stay at zero.
 */
public final class MwisTable {
  private final int root;
  private final long[] excluded;
  private final long[] included;
  private final boolean[] preferInclude;
  private final boolean[] visited;
  private final int[] parent;
  private final int[][] children;
  private final int visitedCount;

  MwisTable(
      int root,
      long[] excluded,
      long[] included,
      boolean[] preferInclude,
      boolean[] visited,
      int[] parent,
      int[][] children,
      int visitedCount) {
    this.root = root;
    this.excluded = Objects.requireNonNull(excluded, "excluded");
    this.included = Objects.requireNonNull(included, "included");
    this.preferInclude = Objects.requireNonNull(preferInclude, "preferInclude");
    this.visited = Objects.requireNonNull(visited, "visited");
    this.parent = Objects.requireNonNull(parent, "parent");
    this.children = Objects.requireNonNull(children, "children");
    this.visitedCount = visitedCount;
  }

  public int root() {
    return root;
  }

  public int vertexCount() {
    return excluded.length;
  }

  /** dp[v][0]: best weight of v's DFS subtree with v left out. */
  public long excluded(int vertex) {
    return excluded[vertex];
  }

  /** dp[v][1]: best weight of v's DFS subtree with v taken. */
  public long included(int vertex) {
    return included[vertex];
  }

  public long value(int vertex, Branch branch) {
    return branch == Branch.INCLUDE ? included[vertex] : excluded[vertex];
  }

  /**
   * choice[v][branch]: whether {@code branch} is the one recorded as optimal for v on its own.
   * Exactly one of the two branches is chosen for every visited vertex; ties go to {@link
   * Branch#INCLUDE}.
   */
  public boolean choice(int vertex, Branch branch) {
    if (!visited[vertex]) {
      return false;
    }
    return (branch == Branch.INCLUDE) == preferInclude[vertex];
  }

  public Branch bestBranch(int vertex) {
    return preferInclude[vertex] ? Branch.INCLUDE : Branch.EXCLUDE;
  }

  /** max(dp[v][0], dp[v][1]). */
  public long best(int vertex) {
    return Math.max(excluded[vertex], included[vertex]);
  }

  /** MWIS weight of the component containing the root. */
  public long optimum() {
    return best(root);
  }

  public boolean isVisited(int vertex) {
    return visited[vertex];
  }

  public int visitedCount() {
    return visitedCount;
  }

  /** DFS parent of {@code vertex}, or -1 for the root and for unvisited vertices. */
  public int parent(int vertex) {
    return parent[vertex];
  }

  public int childCount(int vertex) {
    return children[vertex].length;
  }

  public int child(int vertex, int position) {
    return children[vertex][position];
  }

  /** DFS children in discovery order; the array is a copy. */
  public int[] children(int vertex) {
    return children[vertex].clone();
  }
}
