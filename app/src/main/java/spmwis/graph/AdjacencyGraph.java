package spmwis.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable undirected multigraph over vertices {@code 0..vertexCount-1}. Parallel edges and
 * self-loops are kept exactly as they were added, so a vertex may list the same neighbour twice.
 */
public final class AdjacencyGraph {
  private final int[][] adjacency;
  private final List<Edge> edges;

  private AdjacencyGraph(int[][] adjacency, List<Edge> edges) {
    this.adjacency = adjacency;
    this.edges = List.copyOf(edges);
  }

  public static Builder builder(int vertexCount) {
    return new Builder(vertexCount);
  }

  public int vertexCount() {
    return adjacency.length;
  }

  /** Number of undirected edges, parallel duplicates counted separately. */
  public int edgeCount() {
    return edges.size();
  }

  public List<Edge> edges() {
    return edges;
  }

  /** Total adjacency entries; twice the edge count. */
  public int adjacencyEntryCount() {
    int total = 0;
    for (int[] neighbours : adjacency) {
      total += neighbours.length;
    }
    return total;
  }

  public int degree(int vertex) {
    return adjacency[checkVertex(vertex)].length;
  }

  /** Neighbour ids of {@code vertex} in insertion order; the array is a copy. */
  public int[] neighbours(int vertex) {
    return adjacency[checkVertex(vertex)].clone();
  }

  /** Neighbour at {@code position} in insertion order, without copying the row. */
  public int neighbour(int vertex, int position) {
    return adjacency[checkVertex(vertex)][position];
  }

  public boolean areAdjacent(int u, int v) {
    checkVertex(v);
    for (int w : adjacency[checkVertex(u)]) {
      if (w == v) {
        return true;
      }
    }
    return false;
  }

  private int checkVertex(int vertex) {
    Objects.checkIndex(vertex, adjacency.length);
    return vertex;
  }

  @Override
  public String toString() {
    return "AdjacencyGraph{vertices=" + vertexCount() + ", edges=" + edgeCount() + "}";
  }

  /** Collects edges; rows grow by doubling and are trimmed on {@link #build()}. */
  public static final class Builder {
    private final int[][] rows;
    private final int[] sizes;
    private final List<Edge> edges = new ArrayList<>();

    private Builder(int vertexCount) {
      if (vertexCount < 0) {
        throw new IllegalArgumentException("vertexCount must be non-negative: " + vertexCount);
      }
      this.rows = new int[vertexCount][];
      this.sizes = new int[vertexCount];
    }

    public Builder addEdge(int u, int v) {
      if (u < 0 || u >= rows.length || v < 0 || v >= rows.length) {
        throw new IllegalArgumentException(
            "Edge (" + u + ", " + v + ") outside vertex range 0.." + (rows.length - 1));
      }
      append(u, v);
      append(v, u);
      edges.add(new Edge(u, v));
      return this;
    }

    private void append(int vertex, int neighbour) {
      int[] row = rows[vertex];
      if (row == null) {
        row = new int[2];
        rows[vertex] = row;
      } else if (sizes[vertex] == row.length) {
        row = Arrays.copyOf(row, row.length * 2);
        rows[vertex] = row;
      }
      row[sizes[vertex]++] = neighbour;
    }

    public AdjacencyGraph build() {
      int[][] adjacency = new int[rows.length][];
      for (int v = 0; v < rows.length; v++) {
        adjacency[v] = rows[v] == null ? new int[0] : Arrays.copyOf(rows[v], sizes[v]);
      }
      return new AdjacencyGraph(adjacency, edges);
    }
  }
}
