package spmwis.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import spmwis.core.model.CompositionTree;
import spmwis.core.model.CompositionTrees;
import spmwis.core.model.Leaf;
import spmwis.core.model.Parallel;
import spmwis.core.model.Series;
import spmwis.testing.TestTrees;

final class SpTreeParserTest {

  private final SpTreeParser parser = new SpTreeParser();

  @Test
  void parsesSingleLeaf() {
    ParsedTree parsed = parser.parse("(L 0 1)");
    assertEquals(new Leaf(0, 1), parsed.root());
    assertEquals(2, parsed.vertexCount());
    assertEquals(1, parsed.leafCount());
  }

  @Test
  void parsesSeriesOfLeaves() {
    ParsedTree parsed = parser.parse("(S 0 1 2 (L 0 1) (L 1 2))");
    assertEquals(new Series(0, 1, 2, new Leaf(0, 1), new Leaf(1, 2)), parsed.root());
    assertEquals(3, parsed.vertexCount());
    assertEquals(2, parsed.leafCount());
  }

  @Test
  void parsesParallelAndNestedNodes() {
    ParsedTree parsed = parser.parse("(S 0 1 3 (P 0 1 (L 0 1) (L 0 1)) (S 1 2 3 (L 1 2) (L 2 3)))");
    CompositionTree expected =
        new Series(
            0,
            1,
            3,
            new Parallel(0, 1, new Leaf(0, 1), new Leaf(0, 1)),
            new Series(1, 2, 3, new Leaf(1, 2), new Leaf(2, 3)));
    assertEquals(expected, parsed.root());
    assertEquals(4, parsed.vertexCount());
    assertEquals(4, parsed.leafCount());
  }

  @Test
  void internalTerminalsCountTowardVertexSpace() {
    ParsedTree parsed = parser.parse("(S 0 1 7 (L 0 1) (L 1 2))");
    assertEquals(8, parsed.vertexCount(), "Series sink 7 exceeds every leaf id");

    ParsedTree parallel = parser.parse("(P 0 12 (L 0 1) (L 0 1))");
    assertEquals(13, parallel.vertexCount());
  }

  @Test
  void toleratesGluedParenthesesAndNewlines() {
    ParsedTree glued = parser.parse("(S 0 1 2(L 0 1)(L 1 2))");
    ParsedTree spaced = parser.parse("  ( S 0 1 2\n\t( L 0 1 )\r\n  ( L 1 2 ) )\n");
    assertEquals(glued.root(), spaced.root());
  }

  @Test
  void roundTripsThroughRenderedText() {
    String text = "(P 0 3 (S 0 1 3 (L 0 1) (L 1 3)) (S 0 2 3 (L 0 2) (L 2 3)))";
    CompositionTree root = parser.parse(text).root();
    assertEquals(text, CompositionTrees.render(root));
  }

  @Test
  void reportsTruncatedInputAtEnd() {
    TreeParseException ex = assertThrows(TreeParseException.class, () -> parser.parse("(L 0 1"));
    assertTrue(ex.detail().contains("end of input"), ex.getMessage());
    assertEquals(6, ex.offset());
    assertEquals(1, ex.line());
    assertEquals(7, ex.column());
  }

  @Test
  void reportsMissingSubtree() {
    TreeParseException ex =
        assertThrows(TreeParseException.class, () -> parser.parse("(P 0 1 (L 0 1))"));
    assertEquals("Expected '(' but found ')'", ex.detail());
    assertEquals(14, ex.offset());
    assertEquals(15, ex.column());
  }

  @Test
  void reportsUnknownTag() {
    TreeParseException ex = assertThrows(TreeParseException.class, () -> parser.parse("(X 0 1)"));
    assertTrue(ex.detail().startsWith("Unknown node tag 'X'"), ex.getMessage());
    assertEquals(2, ex.column());
  }

  @Test
  void reportsPositionOnLaterLines() {
    String text = "(S 0 1 2\n  (L 0 1)\n  (L 1 x))";
    TreeParseException ex = assertThrows(TreeParseException.class, () -> parser.parse(text));
    assertEquals("Expected vertex id but found word 'x'", ex.detail());
    assertEquals(3, ex.line());
    assertEquals(8, ex.column());
  }

  @Test
  void rejectsTrailingTokens() {
    TreeParseException ex =
        assertThrows(TreeParseException.class, () -> parser.parse("(L 0 1) (L 1 2)"));
    assertTrue(ex.detail().contains("after the end of the tree"), ex.getMessage());
    assertEquals(9, ex.column());
  }

  @Test
  void rejectsBadVertexIds() {
    TreeParseException negative =
        assertThrows(TreeParseException.class, () -> parser.parse("(L 0 -1)"));
    assertEquals(6, negative.column());

    assertThrows(TreeParseException.class, () -> parser.parse("(L 0 99999999999)"));
    assertThrows(TreeParseException.class, () -> parser.parse("(L 0)"));

    TreeParseException tooLarge =
        assertThrows(TreeParseException.class, () -> new SpTreeParser(10).parse("(L 0 11)"));
    assertTrue(tooLarge.detail().contains("exceeds"), tooLarge.getMessage());
  }

  @Test
  void rejectsEmptyInputAndStrayCharacters() {
    TreeParseException empty = assertThrows(TreeParseException.class, () -> parser.parse("  \n"));
    assertEquals("Empty input", empty.detail());

    TreeParseException stray =
        assertThrows(TreeParseException.class, () -> parser.parse("(L 0 1 #)"));
    assertEquals("Unexpected character '#'", stray.detail());
    assertEquals(8, stray.column());
  }

  @Test
  void parsesDeepNestingWithoutStackOverflow() {
    int n = 100_000;
    ParsedTree parsed = parser.parse(TestTrees.pathExpression(n));
    assertEquals(n, parsed.vertexCount());
    assertEquals(n - 1, parsed.leafCount());
    assertEquals(n - 1, CompositionTrees.depth(parsed.root()));
  }
}
