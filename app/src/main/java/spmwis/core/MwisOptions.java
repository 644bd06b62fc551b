package spmwis.core;

import spmwis.parse.SpTreeParser;
import spmwis.solver.TreeMwisSolver;

/**
 * Configuration for a single MWIS pipeline run.
 *
 * @param root vertex the DFS starts from
 * @param validateTree whether to reject graphs that are not trees before solving
 * @param crossCheckLimit run the brute-force reference when the graph has at most this many
 *     vertices; 0 disables it
 * @param maxVertexId largest vertex id the parser accepts
 */
public record MwisOptions(int root, boolean validateTree, int crossCheckLimit, int maxVertexId) {

  public static MwisOptions defaults() {
    return new MwisOptions(
        TreeMwisSolver.DEFAULT_ROOT, true, 0, SpTreeParser.DEFAULT_MAX_VERTEX_ID);
  }

  public static MwisOptions normalize(MwisOptions options) {
    if (options == null) {
      return defaults();
    }
    MwisOptions defaults = defaults();
    int crossCheckLimit = Math.max(0, options.crossCheckLimit());
    int maxVertexId = options.maxVertexId() > 0 ? options.maxVertexId() : defaults.maxVertexId();
    return new MwisOptions(
        options.root(), options.validateTree(), crossCheckLimit, maxVertexId);
  }

  public MwisOptions withRoot(int newRoot) {
    return new MwisOptions(newRoot, validateTree, crossCheckLimit, maxVertexId);
  }

  public MwisOptions withValidateTree(boolean newValidateTree) {
    return new MwisOptions(root, newValidateTree, crossCheckLimit, maxVertexId);
  }

  public MwisOptions withCrossCheckLimit(int newCrossCheckLimit) {
    return new MwisOptions(root, validateTree, newCrossCheckLimit, maxVertexId);
  }

  public MwisOptions withMaxVertexId(int newMaxVertexId) {
    return new MwisOptions(root, validateTree, crossCheckLimit, newMaxVertexId);
  }
}
