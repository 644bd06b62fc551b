package spmwis.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spmwis.core.MwisResult;
import spmwis.pipeline.MwisPipeline;

/** Handles the single solve command: {@code <tree-file> <weights-file> [options]}. */
final class SolveCommand {
  private static final Logger LOG = LoggerFactory.getLogger(SolveCommand.class);

  static final String USAGE =
      "Usage: spmwis <tree-file> <weights-file> [--json] [--skip-validation] [--cross-check]"
          + " [--root=<id>] [--max-vertex-id=<n>]";

  private final PrintStream out;
  private final MwisPipeline pipeline;

  SolveCommand(PrintStream out) {
    this(out, new MwisPipeline());
  }

  SolveCommand(PrintStream out, MwisPipeline pipeline) {
    this.out = Objects.requireNonNull(out, "out");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  int execute(CliOptions options) throws IOException {
    MwisResult result =
        pipeline.solve(options.treeFile(), options.weightsFile(), options.toMwisOptions());
    logSummary(result);
    if (options.json()) {
      out.println(new JsonReportBuilder().build(result));
    } else {
      printPlain(result);
    }
    return 0;
  }

  static CliOptions parseArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();
    String[] effectiveArgs = args == null ? new String[0] : args;

    for (int i = 0; i < effectiveArgs.length; i++) {
      String raw = effectiveArgs[i];
      if (!CliParsers.isOption(raw)) {
        builder.positional(raw);
        continue;
      }
      ParsedArg parsed = ParsedArg.parse(raw);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= effectiveArgs.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = effectiveArgs[++i];
        }
      } else if (value != null) {
        throw new IllegalArgumentException(parsed.option() + " does not take a value");
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    specs.put("--skip-validation", OptionSpec.flag(b -> b.skipValidation(true)));
    specs.put("--cross-check", OptionSpec.flag(b -> b.crossCheck(true)));
    specs.put(
        "--root",
        OptionSpec.withValue((b, raw) -> b.root(CliParsers.parseNonNegativeInt(raw, 0, "--root"))));
    specs.put(
        "--max-vertex-id",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxVertexId(CliParsers.parseNonNegativeInt(raw, 0, "--max-vertex-id"))));
    return specs;
  }

  private void printPlain(MwisResult result) {
    String vertices =
        result.vertices().stream().map(String::valueOf).collect(Collectors.joining(" "));
    out.println("Vertices in the Maximum Weighted Independent Set: " + vertices);
    out.println("Maximum Weighted Independent Set: " + result.optimum());
  }

  private void logSummary(MwisResult result) {
    LOG.info("Solve took {} ms", result.elapsedMillis());
    LOG.info(
        "Graph: {} vertices, {} edges from {} leaves (tree depth {})",
        result.vertexCount(),
        result.edgeCount(),
        result.leafCount(),
        result.treeDepth());
    result.stageMillis().forEach((stage, ms) -> LOG.debug("  {}: {} ms", stage, ms));
    List<Integer> vertices = result.vertices();
    LOG.info("Selected {} vertices, weight {}", vertices.size(), result.selectedWeight());
    if (result.crossChecked()) {
      LOG.info("Brute-force cross-check passed");
    }
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      int equalsIndex = raw.indexOf('=');
      if (equalsIndex > 0) {
        String option = raw.substring(0, equalsIndex);
        String value = raw.substring(equalsIndex + 1);
        return new ParsedArg(option, value.isEmpty() ? null : value);
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
