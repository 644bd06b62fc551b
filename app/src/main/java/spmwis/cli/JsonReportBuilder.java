package spmwis.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.LinkedHashMap;
import java.util.Map;
import spmwis.core.MwisResult;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(MwisResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result));
    root.put("graph", graph(result));
    root.put("mwis", mwis(result));
    root.put("checks", checks(result));
    root.put("stages_ms", result.stageMillis());
    return gson.toJson(root);
  }

  private Map<String, Object> meta(MwisResult result) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", result.elapsedMillis());
    return meta;
  }

  private Map<String, Object> graph(MwisResult result) {
    Map<String, Object> graph = new LinkedHashMap<>();
    graph.put("vertex_count", result.vertexCount());
    graph.put("edge_count", result.edgeCount());
    graph.put("leaf_count", result.leafCount());
    graph.put("tree_depth", result.treeDepth());
    graph.put("root", result.root());
    return graph;
  }

  private Map<String, Object> mwis(MwisResult result) {
    Map<String, Object> mwis = new LinkedHashMap<>();
    mwis.put("optimum", result.optimum());
    mwis.put("selected_count", result.selectedCount());
    mwis.put("vertices", result.vertices());
    return mwis;
  }

  private Map<String, Object> checks(MwisResult result) {
    Map<String, Object> checks = new LinkedHashMap<>();
    checks.put("tree_validated", result.validated());
    checks.put("weight_matches_optimum", result.selectedWeight() == result.optimum());
    checks.put("brute_force_cross_checked", result.crossChecked());
    return checks;
  }
}
