package spmwis.pipeline;

import spmwis.core.model.CompositionTree;

/**
 * Rewrites a composition tree before it is materialized. The shipped implementation keeps the tree
 * as is; a canonicalizing implementation (for example one producing a nice tree decomposition) can
 * be supplied to {@link MwisPipeline} instead.
 */
public interface DecompositionNormalizer {

  CompositionTree normalize(CompositionTree root);
}
