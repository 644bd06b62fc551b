package spmwis.parse;

/**
 * Thrown when composition-tree text does not follow the grammar. Carries the position of the
 * offending token (or of the end of input when the text stops early).
 */
public class TreeParseException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String detail;
  private final int offset;
  private final int line;
  private final int column;

  public TreeParseException(String detail, int offset, int line, int column) {
    super(detail + " at line " + line + ", column " + column + " (offset " + offset + ")");
    this.detail = detail;
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  TreeParseException(String detail, Token token) {
    this(detail, token.offset(), token.line(), token.column());
  }

  /** Message without the position suffix. */
  public String detail() {
    return detail;
  }

  /** Zero-based character offset into the input. */
  public int offset() {
    return offset;
  }

  /** One-based line number. */
  public int line() {
    return line;
  }

  /** One-based column number. */
  public int column() {
    return column;
  }
}
