package spmwis.parse;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import spmwis.core.model.CompositionTree;
import spmwis.core.model.Leaf;
import spmwis.core.model.Parallel;
import spmwis.core.model.Series;

/**
 * Recursive-descent parser for series-parallel composition trees.
 *
 * <pre>
 * TREE := '(' NODE ')'
 * NODE := 'L' INT INT | 'P' INT INT TREE TREE | 'S' INT INT INT TREE TREE
 * </pre>
 *
 * <p>The descent is driven by an explicit frame stack rather than Java recursion. An internal node
 * is pushed once its tag and terminals are read, collects its two subtrees, and is built when its
 * closing parenthesis arrives. The running maximum vertex id is updated every time a node
 * completes, internal nodes included.
 */
public final class SpTreeParser {
  public static final int DEFAULT_MAX_VERTEX_ID = 10_000_000;

  private final int maxVertexId;

  public SpTreeParser() {
    this(DEFAULT_MAX_VERTEX_ID);
  }

  public SpTreeParser(int maxVertexId) {
    if (maxVertexId < 0 || maxVertexId == Integer.MAX_VALUE) {
      throw new IllegalArgumentException("maxVertexId out of range: " + maxVertexId);
    }
    this.maxVertexId = maxVertexId;
  }

  public ParsedTree parse(String text) {
    Objects.requireNonNull(text, "text");
    return new Run(new SpTreeTokenizer(text).tokenize()).parse();
  }

  /** Mutable state of a single parse. */
  private final class Run {
    private final List<Token> tokens;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private int index;
    private int maxSeen = -1;
    private int leaves;

    Run(List<Token> tokens) {
      this.tokens = tokens;
    }

    ParsedTree parse() {
      if (peek().type() == Token.Type.END) {
        throw new TreeParseException("Empty input", peek());
      }
      CompositionTree root = null;
      while (root == null) {
        CompositionTree completed = openNode();
        if (completed == null) {
          continue;
        }
        root = attach(completed);
      }
      Token trailing = peek();
      if (trailing.type() != Token.Type.END) {
        throw new TreeParseException(
            "Unexpected " + trailing.describe() + " after the end of the tree", trailing);
      }
      return new ParsedTree(root, maxSeen + 1, leaves);
    }

    /**
     * Reads {@code '(' TAG INT...}. A leaf is finished immediately and returned; an internal node
     * is pushed as a frame and {@code null} is returned so the caller opens its first subtree.
     */
    private CompositionTree openNode() {
      expect(Token.Type.OPEN, "'('");
      Token tag = next();
      if (tag.type() != Token.Type.WORD) {
        throw new TreeParseException(
            "Expected node tag L, P or S but found " + tag.describe(), tag);
      }
      switch (tag.text()) {
        case "L" -> {
          int x = vertexId();
          int y = vertexId();
          expect(Token.Type.CLOSE, "')'");
          leaves++;
          return complete(new Leaf(x, y));
        }
        case "P" -> {
          stack.push(new Frame(tag, new int[] {vertexId(), vertexId()}));
          return null;
        }
        case "S" -> {
          stack.push(new Frame(tag, new int[] {vertexId(), vertexId(), vertexId()}));
          return null;
        }
        default ->
            throw new TreeParseException(
                "Unknown node tag '" + tag.text() + "' (expected L, P or S)", tag);
      }
    }

    /**
     * Hands a finished subtree to the enclosing frame, closing every frame that becomes full.
     * Returns the root once the outermost node closes, otherwise {@code null}.
     */
    private CompositionTree attach(CompositionTree completed) {
      CompositionTree current = completed;
      while (!stack.isEmpty()) {
        Frame parent = stack.peek();
        if (parent.left == null) {
          parent.left = current;
          return null;
        }
        parent.right = current;
        expect(Token.Type.CLOSE, "')'");
        stack.pop();
        current = complete(parent.build());
      }
      return current;
    }

    private CompositionTree complete(CompositionTree node) {
      maxSeen = Math.max(maxSeen, node.maxTerminal());
      return node;
    }

    private int vertexId() {
      Token token = next();
      if (token.type() != Token.Type.INTEGER) {
        throw new TreeParseException("Expected vertex id but found " + token.describe(), token);
      }
      int value;
      try {
        value = Integer.parseInt(token.text());
      } catch (NumberFormatException ex) {
        throw new TreeParseException("Vertex id out of range: " + token.text(), token);
      }
      if (value < 0) {
        throw new TreeParseException("Vertex id must be non-negative: " + value, token);
      }
      if (value > maxVertexId) {
        throw new TreeParseException(
            "Vertex id " + value + " exceeds the configured maximum " + maxVertexId, token);
      }
      return value;
    }

    private void expect(Token.Type type, String description) {
      Token token = next();
      if (token.type() != type) {
        throw new TreeParseException(
            "Expected " + description + " but found " + token.describe(), token);
      }
    }

    private Token peek() {
      return tokens.get(index);
    }

    private Token next() {
      Token token = tokens.get(index);
      if (token.type() != Token.Type.END) {
        index++;
      }
      return token;
    }
  }

  /** An internal node whose terminals are known and whose subtrees are still being read. */
  private static final class Frame {
    private final Token tag;
    private final int[] terminals;
    private CompositionTree left;
    private CompositionTree right;

    Frame(Token tag, int[] terminals) {
      this.tag = tag;
      this.terminals = terminals;
    }

    CompositionTree build() {
      return switch (tag.text()) {
        case "P" -> new Parallel(terminals[0], terminals[1], left, right);
        case "S" -> new Series(terminals[0], terminals[1], terminals[2], left, right);
        default -> throw new IllegalStateException("Not an internal tag: " + tag.text());
      };
    }
  }
}
