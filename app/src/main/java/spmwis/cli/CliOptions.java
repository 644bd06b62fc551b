package spmwis.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import spmwis.core.MwisOptions;

record CliOptions(
    Path treeFile,
    Path weightsFile,
    boolean json,
    boolean skipValidation,
    boolean crossCheck,
    int root,
    int maxVertexId) {

  CliOptions {
    Objects.requireNonNull(treeFile, "treeFile");
    Objects.requireNonNull(weightsFile, "weightsFile");
    if (root < 0) {
      throw new IllegalArgumentException("root must be non-negative");
    }
    if (maxVertexId < 0) {
      throw new IllegalArgumentException("max vertex id must be non-negative");
    }
  }

  MwisOptions toMwisOptions() {
    MwisOptions defaults = MwisOptions.defaults();
    int crossCheckLimit = crossCheck ? Integer.MAX_VALUE : 0;
    int effectiveMaxVertexId = maxVertexId > 0 ? maxVertexId : defaults.maxVertexId();
    return new MwisOptions(root, !skipValidation, crossCheckLimit, effectiveMaxVertexId);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final List<String> positionals = new ArrayList<>();
    private boolean json;
    private boolean skipValidation;
    private boolean crossCheck;
    private int root = MwisOptions.defaults().root();
    private int maxVertexId = MwisOptions.defaults().maxVertexId();

    Builder positional(String value) {
      positionals.add(value);
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder skipValidation(boolean skipValidation) {
      this.skipValidation = skipValidation;
      return this;
    }

    Builder crossCheck(boolean crossCheck) {
      this.crossCheck = crossCheck;
      return this;
    }

    Builder root(int root) {
      this.root = root;
      return this;
    }

    Builder maxVertexId(int maxVertexId) {
      this.maxVertexId = maxVertexId;
      return this;
    }

    CliOptions build() {
      if (positionals.size() < 2) {
        throw new IllegalArgumentException("Expected a tree file and a weights file");
      }
      if (positionals.size() > 2) {
        throw new IllegalArgumentException(
            "Unexpected extra argument: " + positionals.get(2));
      }
      return new CliOptions(
          Path.of(positionals.get(0)),
          Path.of(positionals.get(1)),
          json,
          skipValidation,
          crossCheck,
          root,
          maxVertexId);
    }
  }
}
