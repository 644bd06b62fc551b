package spmwis.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import spmwis.graph.AdjacencyGraph;

final class BruteForceMwisTest {

  private final BruteForceMwis bruteForce = new BruteForceMwis();

  @Test
  void solvesGraphsWithCycles() {
    // 4-cycle 0-1-2-3-0: the best set is one of the two diagonals.
    AdjacencyGraph cycle =
        AdjacencyGraph.builder(4).addEdge(0, 1).addEdge(1, 2).addEdge(2, 3).addEdge(3, 0).build();
    BruteForceMwis.Result result = bruteForce.solve(cycle, new long[] {3, 4, 3, 4});

    assertEquals(8, result.value());
    assertEquals(List.of(1, 3), result.vertices());
    assertTrue(result.setsExamined() > 1);
  }

  @Test
  void neverSelectsSelfLoopVertex() {
    AdjacencyGraph graph = AdjacencyGraph.builder(2).addEdge(0, 0).addEdge(0, 1).build();
    BruteForceMwis.Result result = bruteForce.solve(graph, new long[] {100, 1});
    assertEquals(List.of(1), result.vertices());
    assertEquals(1, result.value());
  }

  @Test
  void emptySetWhenAllWeightsNegative() {
    AdjacencyGraph graph = AdjacencyGraph.builder(2).addEdge(0, 1).build();
    BruteForceMwis.Result result = bruteForce.solve(graph, new long[] {-1, -2});
    assertEquals(0, result.value());
    assertTrue(result.vertices().isEmpty());
  }

  @Test
  void refusesLargeGraphs() {
    AdjacencyGraph graph =
        AdjacencyGraph.builder(BruteForceMwis.MAX_TRACTABLE_VERTICES + 1).addEdge(0, 1).build();
    assertThrows(
        IllegalArgumentException.class,
        () -> bruteForce.solve(graph, new long[BruteForceMwis.MAX_TRACTABLE_VERTICES + 1]));
  }
}
