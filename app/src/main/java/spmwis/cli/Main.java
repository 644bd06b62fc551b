package spmwis.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileSystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spmwis.io.WeightsFormatException;
import spmwis.parse.TreeParseException;
import spmwis.pipeline.TreePreconditionException;

/**
 * Command-line entrypoint.
 *
 * <p>Usage: {@code Main <tree-file> <weights-file> [options]}. Prints the selected vertices and
 * the MWIS weight on standard output; everything else goes to the log on standard error.
 *
 * <p>Exit codes:
 *
 * <ul>
 *   <li>0: success
 *   <li>1: an input file is missing or unreadable
 *   <li>2: bad command-line arguments
 *   <li>3: the tree or weights file is malformed, or the weights overflow a 64-bit sum
 *   <li>4: the materialized graph is not a tree
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_IO = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_PARSE = 3;
  static final int EXIT_PRECONDITION = 4;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    CliOptions options;
    try {
      options = SolveCommand.parseArgs(args);
    } catch (IllegalArgumentException ex) {
      err.println(ex.getMessage());
      err.println(SolveCommand.USAGE);
      return EXIT_USAGE;
    }

    try {
      return new SolveCommand(out).execute(options);
    } catch (TreeParseException ex) {
      LOG.error("Malformed composition tree in {}: {}", options.treeFile(), ex.getMessage());
      return EXIT_PARSE;
    } catch (WeightsFormatException ex) {
      LOG.error("Malformed weights file {}: {}", options.weightsFile(), ex.getMessage());
      return EXIT_PARSE;
    } catch (ArithmeticException ex) {
      LOG.error("Weights in {} are too large: {}", options.weightsFile(), ex.getMessage());
      return EXIT_PARSE;
    } catch (TreePreconditionException ex) {
      LOG.error("Graph is not a tree ({}): {}", ex.violation(), ex.getMessage());
      return EXIT_PRECONDITION;
    } catch (IOException ex) {
      LOG.error("Error opening file {}", describe(ex));
      return EXIT_IO;
    } catch (IllegalArgumentException ex) {
      LOG.error("Invalid input: {}", ex.getMessage());
      return EXIT_USAGE;
    }
  }

  private static String describe(IOException ex) {
    if (ex instanceof FileSystemException fse && fse.getFile() != null) {
      String reason = fse.getReason();
      return fse.getFile() + (reason != null ? " (" + reason + ")" : " (" + simpleName(ex) + ")");
    }
    return ex.getMessage();
  }

  private static String simpleName(Exception ex) {
    return ex.getClass().getSimpleName();
  }
}
