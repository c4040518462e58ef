package arrlit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import arrlit.Tokenizer.Token;
import arrlit.Tokenizer.TokenType;

/** Parses the top-level {@code let} and {@code extern fn} declarations of a source file. */
public class DeclarationParser {
  private final String file;
  private final ImmutableList<Token> tokens;
  private int index = 0;

  public DeclarationParser(String file, ImmutableList<Token> tokens) {
    this.file = file;
    this.tokens = tokens;
  }

  public static AST parse(String file, String content) throws CompilerException {
    return new DeclarationParser(file, new Tokenizer(file, content).tokenize()).parse();
  }

  public AST parse() throws CompilerException {
    ImmutableList.Builder<AST.Declaration> declarations = ImmutableList.builder();
    while (index < tokens.size()) {
      Token token = tokens.get(index);
      if (token.is(TokenType.LET)) {
        declarations.add(parseDefinition());
      } else if (token.is(TokenType.EXTERN)) {
        declarations.add(parseExtern());
      } else {
        throw new CompilerException(
            token.pos(),
            ErrorKind.SYNTAX,
            String.format("expected 'let' or 'extern', found '%s'", token));
      }
    }
    return new AST(file, declarations.build());
  }

  private AST.Definition parseDefinition() throws CompilerException {
    expect(TokenType.LET);
    Token name = expect(TokenType.IDENTIFIER);

    Optional<ValueType> declaredType = Optional.empty();
    if (peekIs(TokenType.COLON)) {
      index++;
      declaredType = Optional.of(parseType());
    }
    Token equals = expect(TokenType.EQUALS);

    // The initializer extends to the next ';' outside of any brackets.
    List<Token> exprTokens = new ArrayList<>();
    int depth = 0;
    while (true) {
      if (index >= tokens.size()) throw endOfInput("';'");

      Token token = tokens.get(index++);
      if (token.is(TokenType.SEMICOLON) && depth == 0) break;
      if (token.is(TokenType.L_BRACKET) || token.is(TokenType.L_PAREN)) {
        depth++;
      } else if (token.is(TokenType.R_BRACKET) || token.is(TokenType.R_PAREN)) {
        depth--;
      }
      exprTokens.add(token);
    }

    Expression initializer = Expression.parseExpression(exprTokens, equals.pos().addColumns(1));
    return new AST.Definition(name.text(), name.pos(), declaredType, initializer);
  }

  private AST.ExternDeclaration parseExtern() throws CompilerException {
    expect(TokenType.EXTERN);
    expect(TokenType.FN);
    Token name = expect(TokenType.IDENTIFIER);
    expect(TokenType.L_PAREN);
    expect(TokenType.R_PAREN);
    expect(TokenType.COLON);
    ValueType returnType = parseType();
    expect(TokenType.SEMICOLON);
    return new AST.ExternDeclaration(name.text(), name.pos(), returnType);
  }

  // TYPE := int | bool | string | range | '[' TYPE ';' INTEGER ']'
  private ValueType parseType() throws CompilerException {
    if (peekIs(TokenType.L_BRACKET)) {
      index++;
      ValueType elementType = parseType();
      expect(TokenType.SEMICOLON);
      Token length = expect(TokenType.INTEGER);
      expect(TokenType.R_BRACKET);
      return ValueType.arrayOf(elementType, Integer.parseInt(length.text()));
    }

    Token token = expect(TokenType.IDENTIFIER);
    ValueType type = ValueType.forKeyword(token.text());
    if (type == null) {
      throw new CompilerException(
          token.pos(), ErrorKind.SYNTAX, String.format("unknown type '%s'", token.text()));
    }
    return type;
  }

  private boolean peekIs(TokenType type) {
    return index < tokens.size() && tokens.get(index).is(type);
  }

  private Token expect(TokenType type) throws CompilerException {
    if (index >= tokens.size()) throw endOfInput("'" + type.repr() + "'");

    Token token = tokens.get(index);
    if (!token.is(type)) {
      throw new CompilerException(
          token.pos(),
          ErrorKind.SYNTAX,
          String.format("expected '%s', found '%s'", type.repr(), token));
    }
    index++;
    return token;
  }

  private CompilerException endOfInput(String expected) {
    Tokenizer.Pos pos =
        tokens.isEmpty()
            ? new Tokenizer.Pos(file, 0, 0)
            : tokens.get(tokens.size() - 1).pos();
    return new CompilerException(
        pos, ErrorKind.SYNTAX, String.format("expected %s, found end of input", expected));
  }
}
