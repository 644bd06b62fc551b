package spmwis.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spmwis.core.MwisOptions;
import spmwis.core.MwisResult;
import spmwis.core.model.CompositionTree;
import spmwis.core.model.CompositionTrees;
import spmwis.graph.AdjacencyGraph;
import spmwis.graph.GraphBuilder;
import spmwis.io.InputFiles;
import spmwis.parse.ParsedTree;
import spmwis.parse.SpTreeParser;
import spmwis.solver.BruteForceMwis;
import spmwis.solver.MwisBacktracker;
import spmwis.solver.MwisTable;
import spmwis.solver.TreeMwisSolver;
import spmwis.util.GraphUtils;
import spmwis.util.StageTimings;

/**
 * High-level orchestrator: parse, normalize, materialize, validate, solve, backtrack and verify.
 *
 * <p>Each call is an independent one-shot batch; the pipeline itself holds no per-run state and
 * may be reused.
 */
public final class MwisPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(MwisPipeline.class);

  private final DecompositionNormalizer normalizer;
  private final GraphBuilder graphBuilder = new GraphBuilder();
  private final TreeShapeValidator validator = new TreeShapeValidator();
  private final TreeMwisSolver solver = new TreeMwisSolver();
  private final MwisBacktracker backtracker = new MwisBacktracker();
  private final SolutionVerifier verifier = new SolutionVerifier();

  public MwisPipeline() {
    this(new DefaultDecompositionNormalizer());
  }

  public MwisPipeline(DecompositionNormalizer normalizer) {
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  /** Workflow 1: both inputs read from disk. The weights file is read after the tree is parsed. */
  public MwisResult solve(Path treeFile, Path weightsFile, MwisOptions options)
      throws IOException {
    Objects.requireNonNull(treeFile, "treeFile");
    Objects.requireNonNull(weightsFile, "weightsFile");
    MwisOptions effective = MwisOptions.normalize(options);
    StageTimings timings = StageTimings.start();

    LOG.info("Reading composition tree from {}", treeFile);
    ParsedTree parsed = parse(InputFiles.readTree(treeFile), effective, timings);
    long[] weights = InputFiles.readWeights(weightsFile, parsed.vertexCount());
    timings.mark("weights");
    LOG.info("Read {} weights from {}", weights.length, weightsFile);
    return run(parsed, weights, effective, timings);
  }

  /** Workflow 2: in-memory inputs. */
  public MwisResult solve(String treeText, long[] weights, MwisOptions options) {
    Objects.requireNonNull(treeText, "treeText");
    Objects.requireNonNull(weights, "weights");
    MwisOptions effective = MwisOptions.normalize(options);
    StageTimings timings = StageTimings.start();
    ParsedTree parsed = parse(treeText, effective, timings);
    return run(parsed, weights, effective, timings);
  }

  private ParsedTree parse(String treeText, MwisOptions options, StageTimings timings) {
    ParsedTree parsed = new SpTreeParser(options.maxVertexId()).parse(treeText);
    timings.mark("parse");
    LOG.info(
        "Parsed composition tree: {} vertices, {} leaves", parsed.vertexCount(), parsed.leafCount());
    return parsed;
  }

  private MwisResult run(
      ParsedTree parsed, long[] weights, MwisOptions options, StageTimings timings) {
    if (options.root() < 0 || options.root() >= parsed.vertexCount()) {
      throw new IllegalArgumentException(
          "Root "
              + options.root()
              + " outside vertex range 0.."
              + (parsed.vertexCount() - 1));
    }
    CompositionTree normalized = normalizer.normalize(parsed.root());
    int depth = CompositionTrees.depth(normalized);
    timings.mark("normalize");
    LOG.debug("Normalized tree depth: {}", depth);

    AdjacencyGraph graph = graphBuilder.build(normalized, parsed.vertexCount());
    timings.mark("build");
    LOG.info("Materialized graph: {} vertices, {} edges", graph.vertexCount(), graph.edgeCount());

    if (options.validateTree()) {
      validator.validate(graph, options.root());
      timings.mark("validate");
    } else {
      LOG.debug("Tree-shape validation skipped");
    }

    MwisTable table = solver.solve(graph, weights, options.root());
    timings.mark("solve");
    List<Integer> vertices = backtracker.reconstruct(table);
    timings.mark("backtrack");
    long optimum = table.optimum();

    boolean crossChecked;
    try {
      verifier.verify(graph, weights, vertices, optimum);
      crossChecked = crossCheck(graph, weights, optimum, options);
    } catch (IllegalStateException ex) {
      if (!options.validateTree()) {
        // Unvalidated input: report the shape violation behind the failure, if there is one.
        validator.validate(graph, options.root());
      }
      throw ex;
    }
    timings.mark("verify");

    LOG.info(
        "MWIS optimum {} with {} of {} vertices selected",
        optimum,
        vertices.size(),
        graph.vertexCount());
    return new MwisResult(
        graph.vertexCount(),
        parsed.leafCount(),
        graph.edgeCount(),
        depth,
        options.root(),
        optimum,
        vertices,
        GraphUtils.weightOf(vertices, weights),
        options.validateTree(),
        crossChecked,
        timings.stageMillis(),
        timings.elapsedMillis());
  }

  private boolean crossCheck(
      AdjacencyGraph graph, long[] weights, long optimum, MwisOptions options) {
    int limit = Math.min(options.crossCheckLimit(), BruteForceMwis.MAX_TRACTABLE_VERTICES);
    if (graph.vertexCount() > limit) {
      if (options.crossCheckLimit() > 0) {
        LOG.info(
            "Skipping brute-force cross-check: {} vertices exceed the limit of {}",
            graph.vertexCount(),
            limit);
      }
      return false;
    }
    BruteForceMwis.Result reference = new BruteForceMwis().solve(graph, weights);
    if (reference.value() != optimum) {
      throw new IllegalStateException(
          "Tree DP optimum " + optimum + " disagrees with brute force " + reference.value());
    }
    LOG.info("Brute-force cross-check agrees ({} sets examined)", reference.setsExamined());
    return true;
  }
}
