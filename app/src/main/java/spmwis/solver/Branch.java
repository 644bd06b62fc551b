package spmwis.solver;

/** The two DP states of a vertex: left out of the set, or taken into it. */
public enum Branch {
  EXCLUDE,
  INCLUDE
}
