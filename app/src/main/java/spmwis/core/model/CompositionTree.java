package spmwis.core.model;

/**
 * Node of a series-parallel composition tree.
 *
 * <p>Every node carries its own source and sink terminals. They are supplied by whoever built the
 * node (normally the parser) and are never derived from the children. Callers dispatch on {@link
 * #kind()} rather than on the runtime class.
 */
public interface CompositionTree {

  Kind kind();

  /** Source terminal declared on this node. */
  int source();

  /** Sink terminal declared on this node. */
  int sink();

  /** Largest vertex id named by this node itself, children excluded. */
  int maxTerminal();

  enum Kind {
    LEAF,
    PARALLEL,
    SERIES
  }
}
