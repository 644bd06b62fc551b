package spmwis.io;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads the two plain-text inputs: the composition-tree expression and the vertex weights. */
public final class InputFiles {
  private static final Logger LOG = LoggerFactory.getLogger(InputFiles.class);
  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private InputFiles() {}

  /** Reads the whole tree file; missing or unreadable files surface as {@link IOException}. */
  public static String readTree(Path treeFile) throws IOException {
    Objects.requireNonNull(treeFile, "treeFile");
    return Files.readString(treeFile, StandardCharsets.UTF_8);
  }

  public static long[] readWeights(Path weightsFile, int vertexCount) throws IOException {
    Objects.requireNonNull(weightsFile, "weightsFile");
    return parseWeights(Files.readString(weightsFile, StandardCharsets.UTF_8), vertexCount);
  }

  /**
   * Parses the first {@code vertexCount} whitespace-separated integers. Anything after them is
   * ignored with a warning.
   */
  public static long[] parseWeights(CharSequence text, int vertexCount) {
    Objects.requireNonNull(text, "text");
    if (vertexCount < 0) {
      throw new IllegalArgumentException("vertexCount must be non-negative: " + vertexCount);
    }
    long[] weights = new long[vertexCount];
    Iterator<String> tokens = WHITESPACE.split(text).iterator();
    for (int i = 0; i < vertexCount; i++) {
      if (!tokens.hasNext()) {
        throw new WeightsFormatException(
            "Expected " + vertexCount + " weights but found only " + i, i);
      }
      String token = tokens.next();
      try {
        weights[i] = Long.parseLong(token);
      } catch (NumberFormatException ex) {
        throw new WeightsFormatException(
            "Weight #" + i + " is not an integer: '" + token + "'", i);
      }
    }
    if (tokens.hasNext()) {
      int extra = 0;
      while (tokens.hasNext()) {
        tokens.next();
        extra++;
      }
      LOG.warn("Ignoring {} weight value(s) beyond the {} vertices of the tree", extra, vertexCount);
    }
    return weights;
  }
}
