package arrlit;

import java.util.Comparator;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

/** Produces a tokenization of the input. */
public class Tokenizer {
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    public Pos addColumns(int columns) {
      return new Pos(file, lineNumber, column + columns);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(Pos::file)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  public enum TokenType {
    IDENTIFIER,
    INTEGER,
    STRING,

    // Keywords
    LET("let"),
    EXTERN("extern"),
    FN("fn"),
    TRUE("true"),
    FALSE("false"),

    // Punctuation
    L_BRACKET("["),
    R_BRACKET("]"),
    L_PAREN("("),
    R_PAREN(")"),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    EQUALS("="),

    // Operators
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    DOT_DOT("..");

    private final String repr;

    TokenType() {
      this(null);
    }

    TokenType(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr != null ? repr : name().toLowerCase();
    }

    public boolean isKeyword() {
      return this == LET || this == EXTERN || this == FN || this == TRUE || this == FALSE;
    }

    private static final ImmutableMap<String, TokenType> KEYWORDS =
        ImmutableList.copyOf(values())
            .stream()
            .filter(TokenType::isKeyword)
            .collect(ImmutableMap.toImmutableMap(TokenType::repr, t -> t));

    private static final ImmutableMap<Character, TokenType> SINGLE_CHARS =
        ImmutableList.copyOf(values())
            .stream()
            .filter(t -> t.repr != null && t.repr.length() == 1)
            .collect(ImmutableMap.toImmutableMap(t -> t.repr.charAt(0), t -> t));
  }

  // 'text' is the decoded value for STRING tokens, and the source text otherwise.
  @AutoValue
  public abstract static class Token {
    public abstract TokenType type();

    public abstract String text();

    public abstract Pos pos();

    public boolean is(TokenType type) {
      return type() == type;
    }

    public static Token create(TokenType type, String text, Pos pos) {
      return new AutoValue_Tokenizer_Token(type, text, pos);
    }

    @Override
    public final String toString() {
      return type() == TokenType.STRING ? QUOTE + text() + QUOTE : text();
    }
  }

  private final String file;
  private final ImmutableList<String> lines;
  private int line = 0;
  private int col = -1; // In the initial state we have not read anything yet.
  private char ch = ' ';

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Tokenizer(String file, String content) {
    this.file = file;
    this.lines =
        ImmutableList.copyOf(Iterables.transform(Splitter.on('\n').split(content), s -> s + "\n"));
  }

  public static final char QUOTE = '\"';

  public ImmutableList<Token> tokenize() throws CompilerException {
    while (advance()) {
      if (skipCommentsOrWhitespace()) continue;

      Pos start = pos();
      if (Character.isLetter(ch) || ch == '_') {
        readWord(start);
      } else if (Character.isDigit(ch)) {
        readInteger(start);
      } else if (ch == QUOTE) {
        readString(start);
      } else if (ch == '.') {
        if (!canPeek() || peek() != '.') throw error("unexpected '.': did you mean '..'?");
        advance();
        tokensBuilder.add(Token.create(TokenType.DOT_DOT, "..", start));
      } else {
        TokenType type = TokenType.SINGLE_CHARS.get(ch);
        if (type == null) throw error(String.format("unexpected character '%c'", ch));
        tokensBuilder.add(Token.create(type, type.repr(), start));
      }
    }

    return tokensBuilder.build();
  }

  private CompilerException error(String msg) {
    return new CompilerException(pos(), ErrorKind.SYNTAX, msg);
  }

  private boolean canPeek() {
    if (line >= lines.size()) {
      return false;
    }

    int nCol = col + 1;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine).length();
      if (++nLine == lines.size()) return false;
    }
    return true;
  }

  private char peek() {
    int nCol = col + 1;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine++).length();
    }
    return lines.get(nLine).charAt(nCol);
  }

  private boolean advance() {
    if (line >= lines.size()) return false;

    col++;
    while (col >= lines.get(line).length()) {
      col -= lines.get(line).length();
      if (++line == lines.size()) return false;
    }

    ch = lines.get(line).charAt(col);
    return true;
  }

  private Pos pos() {
    return new Pos(file, line, col);
  }

  private boolean skipCommentsOrWhitespace() throws CompilerException {
    if (Character.isWhitespace(ch)) {
      return true;
    } else if (ch != '/' || !canPeek()) {
      return false;
    }

    char second = peek();
    if (second == '/') {
      // Advance to the next line.
      col = -1;
      ++line;
      return true;
    } else if (second == '*') {
      Pos start = pos();
      advance();
      while (advance()) {
        if (ch == '*' && canPeek() && peek() == '/') {
          advance();
          return true;
        }
      }
      throw new CompilerException(start, ErrorKind.SYNTAX, "unterminated block comment");
    } else {
      return false;
    }
  }

  private void readWord(Pos start) {
    StringBuilder word = new StringBuilder().append(ch);
    while (canPeek() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
      advance();
      word.append(ch);
    }

    String text = word.toString();
    TokenType type = TokenType.KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
    tokensBuilder.add(Token.create(type, text, start));
  }

  private void readInteger(Pos start) throws CompilerException {
    StringBuilder digits = new StringBuilder().append(ch);
    while (canPeek() && Character.isDigit(peek())) {
      advance();
      digits.append(ch);
    }

    String text = digits.toString();
    try {
      Integer.parseInt(text);
    } catch (NumberFormatException ex) {
      throw new CompilerException(start, ErrorKind.SYNTAX, "integer literal is out of range");
    }
    tokensBuilder.add(Token.create(TokenType.INTEGER, text, start));
  }

  private void readString(Pos start) throws CompilerException {
    StringBuilder value = new StringBuilder();
    while (true) {
      if (!advance() || ch == '\n') {
        throw new CompilerException(start, ErrorKind.SYNTAX, "unterminated string literal");
      }

      if (ch == QUOTE) break;
      if (ch != '\\') {
        value.append(ch);
        continue;
      }

      if (!canPeek() || (peek() != QUOTE && peek() != '\\' && peek() != 'n')) {
        throw error("illegal escape");
      }
      advance();
      value.append(ch == 'n' ? '\n' : ch);
    }

    tokensBuilder.add(Token.create(TokenType.STRING, value.toString(), start));
  }
}
