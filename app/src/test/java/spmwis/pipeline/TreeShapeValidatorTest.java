package spmwis.pipeline;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import spmwis.graph.AdjacencyGraph;
import spmwis.graph.GraphBuilder;
import spmwis.parse.ParsedTree;
import spmwis.parse.SpTreeParser;
import spmwis.pipeline.TreePreconditionException.Violation;
import spmwis.testing.TestTrees;

final class TreeShapeValidatorTest {

  private final TreeShapeValidator validator = new TreeShapeValidator();

  private static AdjacencyGraph graphOf(String text) {
    ParsedTree parsed = new SpTreeParser().parse(text);
    return new GraphBuilder().build(parsed.root(), parsed.vertexCount());
  }

  private Violation violationOf(String text) {
    return assertThrows(
            TreePreconditionException.class, () -> validator.validate(graphOf(text), 0))
        .violation();
  }

  @Test
  void acceptsPathsAndParallelDuplicates() {
    assertDoesNotThrow(() -> validator.validate(graphOf("(S 0 1 2 (L 0 1) (L 1 2))"), 0));
    assertDoesNotThrow(() -> validator.validate(graphOf("(P 0 1 (L 0 1) (L 0 1))"), 1));
    assertDoesNotThrow(() -> validator.validate(graphOf(TestTrees.pathExpression(500)), 250));
  }

  @Test
  void detectsTriangle() {
    assertEquals(Violation.CYCLE, violationOf("(P 0 2 (S 0 1 2 (L 0 1) (L 1 2)) (L 0 2))"));
  }

  @Test
  void detectsDisconnectedGraphs() {
    assertEquals(Violation.DISCONNECTED, violationOf("(S 0 1 3 (L 0 1) (L 2 3))"));
    // Vertices 3 and 4 exist only because the terminal 5 raises the vertex count.
    TreePreconditionException ex =
        assertThrows(
            TreePreconditionException.class,
            () -> validator.validate(graphOf("(S 0 1 5 (L 0 1) (L 1 2))"), 0));
    assertEquals(Violation.DISCONNECTED, ex.violation());
    assertTrue(ex.getMessage().contains("3 of 6 vertices"), ex.getMessage());
    assertTrue(ex.getMessage().contains("first: 3"), ex.getMessage());
  }

  @Test
  void detectsSelfLoop() {
    assertEquals(Violation.SELF_LOOP, violationOf("(L 0 0)"));
  }
}
