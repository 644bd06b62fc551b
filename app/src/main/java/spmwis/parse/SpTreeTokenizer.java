package spmwis.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits composition-tree text into tokens. Parentheses are always tokens of their own, so {@code
 * (L 0 1)} and {@code ( L 0 1 )} tokenize identically. The returned list always ends with an
 * {@link Token.Type#END} token.
 */
final class SpTreeTokenizer {
  private final String input;
  private int pos;
  private int line = 1;
  private int column = 1;

  SpTreeTokenizer(String input) {
    this.input = Objects.requireNonNull(input, "input");
  }

  List<Token> tokenize() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        tokens.add(new Token(Token.Type.END, "", pos, line, column));
        return tokens;
      }
      tokens.add(nextToken());
    }
  }

  private Token nextToken() {
    char c = input.charAt(pos);
    int startOffset = pos;
    int startLine = line;
    int startColumn = column;
    if (c == '(' || c == ')') {
      advance();
      Token.Type type = c == '(' ? Token.Type.OPEN : Token.Type.CLOSE;
      return new Token(type, String.valueOf(c), startOffset, startLine, startColumn);
    }
    if (Character.isLetter(c)) {
      while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
        advance();
      }
      return new Token(
          Token.Type.WORD, input.substring(startOffset, pos), startOffset, startLine, startColumn);
    }
    if (isDigit(c) || (c == '-' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
      advance();
      while (pos < input.length() && isDigit(input.charAt(pos))) {
        advance();
      }
      return new Token(
          Token.Type.INTEGER, input.substring(startOffset, pos), startOffset, startLine, startColumn);
    }
    throw new TreeParseException(
        "Unexpected character '" + c + "'", startOffset, startLine, startColumn);
  }

  private void skipWhitespace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      advance();
    }
  }

  private void advance() {
    if (input.charAt(pos) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    pos++;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
