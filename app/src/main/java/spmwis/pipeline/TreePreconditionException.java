package spmwis.pipeline;

import java.util.Objects;

/** The materialized graph is not a tree, so the tree DP cannot be trusted on it. */
public class TreePreconditionException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final Violation violation;

  public TreePreconditionException(Violation violation, String message) {
    super(message);
    this.violation = Objects.requireNonNull(violation, "violation");
  }

  public Violation violation() {
    return violation;
  }

  public enum Violation {
    SELF_LOOP,
    CYCLE,
    DISCONNECTED;
  }
}
