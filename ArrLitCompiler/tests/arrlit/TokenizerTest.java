package arrlit;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

import arrlit.Tokenizer.Token;
import arrlit.Tokenizer.TokenType;

public class TokenizerTest {

  private static final Correspondence<Token, TokenType> HAS_TYPE =
      Correspondence.transforming(Token::type, "has type");

  private static final Correspondence<Token, String> HAS_TEXT =
      Correspondence.transforming(Token::text, "has text");

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  public ImmutableList<Token> tokenize() throws CompilerException {
    return new Tokenizer("/test/file.al", file.toString()).tokenize();
  }

  private void assertError(String errorSubstr) {
    CompilerException ex = assertThrows(CompilerException.class, this::tokenize);
    assertThat(ex.kind()).isEqualTo(ErrorKind.SYNTAX);
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void emptyFile() throws CompilerException {
    assertThat(tokenize()).isEmpty();
  }

  @Test
  public void comments() throws CompilerException {
    println("// a line comment");
    println("let /* inline */ x");
    println("/* spans");
    println("   lines */ = 1;");

    assertThat(tokenize())
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("let", "x", "=", "1", ";")
        .inOrder();
  }

  @Test
  public void keywordsAndIdentifiers() throws CompilerException {
    println("let extern fn true false lets _x x1");

    assertThat(tokenize())
        .comparingElementsUsing(HAS_TYPE)
        .containsExactly(
            TokenType.LET,
            TokenType.EXTERN,
            TokenType.FN,
            TokenType.TRUE,
            TokenType.FALSE,
            TokenType.IDENTIFIER,
            TokenType.IDENTIFIER,
            TokenType.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void typeNamesAreIdentifiers() throws CompilerException {
    println("int bool string range");

    assertThat(tokenize()).comparingElementsUsing(HAS_TYPE).containsExactly(
        TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER);
  }

  @Test
  public void dotDot() throws CompilerException {
    println("[1..5, ..xs, .. ..3]");

    assertThat(tokenize())
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("[", "1", "..", "5", ",", "..", "xs", ",", "..", "..", "3", "]")
        .inOrder();
  }

  @Test
  public void loneDot() {
    println("[.5]");
    assertError("unexpected '.'");
  }

  @Test
  public void strings() throws CompilerException {
    println("\"plain\" \"with \\\"quotes\\\"\" \"new\\nline\" \"back\\\\slash\"");

    ImmutableList<Token> tokens = tokenize();
    assertThat(tokens).comparingElementsUsing(HAS_TYPE).containsExactly(
        TokenType.STRING, TokenType.STRING, TokenType.STRING, TokenType.STRING);
    assertThat(tokens)
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("plain", "with \"quotes\"", "new\nline", "back\\slash")
        .inOrder();
    assertThat(tokens.get(1).toString()).isEqualTo("\"with \"quotes\"\"");
  }

  @Test
  public void stringErrors() {
    println("\"never closed");
    assertError("unterminated string");

    file = new StringBuilder();
    println("\"bad \\q escape\"");
    assertError("illegal escape");
  }

  @Test
  public void integers() throws CompilerException {
    println("0 42 2147483647");
    assertThat(tokenize())
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("0", "42", "2147483647")
        .inOrder();

    file = new StringBuilder();
    println("2147483648");
    assertError("out of range");
  }

  @Test
  public void unknownCharacter() {
    println("let x = 1 % 2;");
    assertError("unexpected character '%'");
  }

  @Test
  public void unterminatedComment() {
    println("let x = 1; /* no end");
    assertError("unterminated block comment");
  }

  @Test
  public void positions() throws CompilerException {
    println("let x =");
    println("  [1];");

    ImmutableList<Token> tokens = tokenize();
    assertThat(tokens.get(0).pos().toString()).isEqualTo("/test/file.al@1:1");
    assertThat(tokens.get(1).pos().toString()).isEqualTo("/test/file.al@1:5");
    assertThat(tokens.get(3).pos().toString()).isEqualTo("/test/file.al@2:3");
    assertThat(tokens.get(4).pos().lineNumber()).isEqualTo(1);
    assertThat(tokens.get(4).pos().column()).isEqualTo(3);
  }
}
