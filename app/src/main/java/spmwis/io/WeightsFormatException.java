package spmwis.io;

/** The weights text is short, or holds a token that is not an integer. */
public class WeightsFormatException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int tokenIndex;

  public WeightsFormatException(String message, int tokenIndex) {
    super(message);
    this.tokenIndex = tokenIndex;
  }

  /** Zero-based index of the offending token, or the number of tokens read when input ran out. */
  public int tokenIndex() {
    return tokenIndex;
  }
}
