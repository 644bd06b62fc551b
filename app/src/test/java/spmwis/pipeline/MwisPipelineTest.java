package spmwis.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import spmwis.core.MwisOptions;
import spmwis.core.MwisResult;
import spmwis.io.WeightsFormatException;
import spmwis.parse.TreeParseException;

final class MwisPipelineTest {

  private static final String PATH_3 = "(S 0 1 2 (L 0 1) (L 1 2))";

  @TempDir Path tempDir;

  private final MwisPipeline pipeline = new MwisPipeline();

  @Test
  void solvesInMemoryInputs() {
    MwisResult result = pipeline.solve(PATH_3, new long[] {1, 10, 1}, MwisOptions.defaults());

    assertEquals(10, result.optimum());
    assertEquals(List.of(1), result.vertices());
    assertEquals(3, result.vertexCount());
    assertEquals(2, result.leafCount());
    assertEquals(2, result.edgeCount());
    assertEquals(10, result.selectedWeight());
    assertTrue(result.validated());
    assertFalse(result.crossChecked(), "Cross-check is off by default");
    assertTrue(result.stageMillis().containsKey("solve"));
  }

  @Test
  void solvesFromFiles() throws IOException {
    Path tree = Files.writeString(tempDir.resolve("tree.txt"), "(P 0 1 (L 0 1) (L 0 1))\n");
    Path weights = Files.writeString(tempDir.resolve("weights.txt"), "4 4\n");

    MwisResult result = pipeline.solve(tree, weights, MwisOptions.defaults());

    assertEquals(4, result.optimum());
    assertEquals(List.of(0), result.vertices());
    assertTrue(result.stageMillis().containsKey("weights"));
  }

  @Test
  void crossChecksSmallGraphs() {
    MwisResult result =
        pipeline.solve(
            PATH_3, new long[] {4, 1, 4}, MwisOptions.defaults().withCrossCheckLimit(10));
    assertTrue(result.crossChecked());
    assertEquals(8, result.optimum());
  }

  @Test
  void rejectsNonTreeGraphs() {
    TreePreconditionException ex =
        assertThrows(
            TreePreconditionException.class,
            () ->
                pipeline.solve(
                    "(S 0 1 3 (L 0 1) (L 2 3))", new long[] {1, 1, 5, 5}, MwisOptions.defaults()));
    assertEquals(TreePreconditionException.Violation.DISCONNECTED, ex.violation());
  }

  @Test
  void skippedValidationSolvesTheRootComponentOnly() {
    MwisResult result =
        pipeline.solve(
            "(S 0 1 3 (L 0 1) (L 2 3))",
            new long[] {1, 1, 5, 5},
            MwisOptions.defaults().withValidateTree(false));

    assertEquals(1, result.optimum());
    assertEquals(List.of(0), result.vertices());
    assertFalse(result.validated());
  }

  @Test
  void crossCheckDisagreementReportsTheShapeViolation() {
    // Without validation the DP only sees the root's component; brute force sees both.
    MwisOptions options =
        MwisOptions.defaults().withValidateTree(false).withCrossCheckLimit(Integer.MAX_VALUE);
    TreePreconditionException ex =
        assertThrows(
            TreePreconditionException.class,
            () -> pipeline.solve("(S 0 1 3 (L 0 1) (L 2 3))", new long[] {1, 1, 5, 5}, options));
    assertEquals(TreePreconditionException.Violation.DISCONNECTED, ex.violation());
  }

  @Test
  void unvalidatedCycleFailsAsPreconditionViolation() {
    // The DFS drops the back edge 0-2, so the reconstructed set {0, 2} is not independent.
    TreePreconditionException ex =
        assertThrows(
            TreePreconditionException.class,
            () ->
                pipeline.solve(
                    "(P 0 2 (S 0 1 2 (L 0 1) (L 1 2)) (L 0 2))",
                    new long[] {5, 1, 5},
                    MwisOptions.defaults().withValidateTree(false)));
    assertEquals(TreePreconditionException.Violation.CYCLE, ex.violation());
  }

  @Test
  void overflowingWeightsAreRejected() {
    long big = Long.MAX_VALUE / 2 + 1;
    assertThrows(
        ArithmeticException.class,
        () -> pipeline.solve(PATH_3, new long[] {big, 0, big}, MwisOptions.defaults()));
  }

  @Test
  void rejectsRootOutsideVertexRange() {
    assertThrows(
        IllegalArgumentException.class,
        () -> pipeline.solve(PATH_3, new long[] {1, 1, 1}, MwisOptions.defaults().withRoot(3)));
  }

  @Test
  void surfacesInputErrors() throws IOException {
    Path tree = Files.writeString(tempDir.resolve("tree.txt"), PATH_3);
    Path shortWeights = Files.writeString(tempDir.resolve("weights.txt"), "1 2");

    assertThrows(
        WeightsFormatException.class,
        () -> pipeline.solve(tree, shortWeights, MwisOptions.defaults()));
    assertThrows(
        IOException.class,
        () -> pipeline.solve(tempDir.resolve("missing.txt"), shortWeights, MwisOptions.defaults()));
    assertThrows(
        TreeParseException.class,
        () -> pipeline.solve("(L 0 1", new long[] {1, 1}, MwisOptions.defaults()));
  }

  @Test
  void usesSuppliedNormalizer() {
    AtomicInteger calls = new AtomicInteger();
    MwisPipeline custom =
        new MwisPipeline(
            root -> {
              calls.incrementAndGet();
              return root;
            });

    MwisResult result = custom.solve("(L 0 1)", new long[] {3, 5}, MwisOptions.defaults());

    assertEquals(1, calls.get());
    assertEquals(5, result.optimum());
  }
}
