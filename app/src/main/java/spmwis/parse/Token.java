package spmwis.parse;

import java.util.Objects;

/** Lexical token of the composition-tree grammar with its source position. */
record Token(Type type, String text, int offset, int line, int column) {

  Token {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(text, "text");
  }

  enum Type {
    OPEN,
    CLOSE,
    WORD,
    INTEGER,
    END
  }

  String describe() {
    return switch (type) {
      case END -> "end of input";
      case OPEN, CLOSE -> "'" + text + "'";
      case WORD -> "word '" + text + "'";
      case INTEGER -> "integer " + text;
    };
  }
}
