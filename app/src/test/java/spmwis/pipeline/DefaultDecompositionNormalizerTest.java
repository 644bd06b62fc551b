package spmwis.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;
import spmwis.core.model.CompositionTree;
import spmwis.core.model.CompositionTrees;
import spmwis.parse.SpTreeParser;
import spmwis.testing.TestTrees;

final class DefaultDecompositionNormalizerTest {

  private final DecompositionNormalizer normalizer = new DefaultDecompositionNormalizer();

  @Test
  void preservesShapeAndTerminals() {
    String text = "(S 0 1 4 (P 0 1 (L 0 1) (L 0 1)) (S 1 2 4 (L 1 2) (P 2 4 (L 2 3) (L 3 4))))";
    CompositionTree original = new SpTreeParser().parse(text).root();
    CompositionTree normalized = normalizer.normalize(original);

    assertEquals(original, normalized, "Normalization is an identity transform");
    assertEquals(text, CompositionTrees.render(normalized));
    assertSame(original, normalized, "Unchanged trees are returned as the same instance");
  }

  @Test
  void leavesAreReturnedUnchanged() {
    CompositionTree leaf = new SpTreeParser().parse("(L 3 5)").root();
    assertSame(leaf, normalizer.normalize(leaf));
  }

  @Test
  void normalizesDeepTreesIteratively() {
    CompositionTree deep = new SpTreeParser().parse(TestTrees.pathExpression(50_000)).root();
    assertSame(deep, normalizer.normalize(deep));
  }
}
