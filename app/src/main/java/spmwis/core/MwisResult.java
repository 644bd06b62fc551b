package spmwis.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Aggregated outcome of running the MWIS pipeline. */
public record MwisResult(
    int vertexCount,
    int leafCount,
    int edgeCount,
    int treeDepth,
    int root,
    long optimum,
    List<Integer> vertices,
    long selectedWeight,
    boolean validated,
    boolean crossChecked,
    Map<String, Double> stageMillis,
    long elapsedMillis) {

  public MwisResult {
    Objects.requireNonNull(vertices, "vertices");
    Objects.requireNonNull(stageMillis, "stageMillis");
    vertices = List.copyOf(vertices);
    stageMillis = Collections.unmodifiableMap(new LinkedHashMap<>(stageMillis));
  }

  public int selectedCount() {
    return vertices.size();
  }
}
