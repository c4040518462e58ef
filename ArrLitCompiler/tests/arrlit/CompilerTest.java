package arrlit;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class CompilerTest {

  private static Compiler compile(String... lines) throws CompilerException {
    ASTValidator validator =
        new ASTValidator(DeclarationParser.parse("/test/file.al", String.join("\n", lines)));
    ImmutableList<CompilerException> errors = validator.computeErrors();
    if (!errors.isEmpty()) throw errors.get(0);

    Compiler compiler = new Compiler(validator);
    compiler.compile();
    return compiler;
  }

  private static byte[] bytes(int... values) {
    byte[] out = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = (byte) values[i];
    }
    return out;
  }

  @Test
  public void varints() throws CompilerException {
    assertThat(Compiler.capture(out -> Compiler.writeVarint(0, out))).isEqualTo(bytes(0));
    assertThat(Compiler.capture(out -> Compiler.writeVarint(127, out))).isEqualTo(bytes(127));
    assertThat(Compiler.capture(out -> Compiler.writeVarint(300, out))).isEqualTo(bytes(172, 2));
    assertThat(Compiler.capture(out -> Compiler.writeUTF8("ab", out)))
        .isEqualTo(bytes(2, 'a', 'b'));
  }

  @Test
  public void fillConstruction() throws CompilerException {
    Compiler compiler = compile("let a: [int; 2] = [1, ..0];");

    assertThat(compiler.outFile())
        .isEqualTo(
            bytes(
                40, 2, // ARRAY_CONSTRUCTION, 2 steps
                1, 0, 11, 0, 0, 0, 1, // BIND %0 = 1
                3, 1, 11, 0, 0, 0, 0, // BIND_REPEAT %1 = 0
                6, 2, 5, 0, 5, 1)); // BUILD_ARRAY [%0, %1]
    assertThat(compiler.indexFile()).isEqualTo(bytes(2, 1, 1, 'a', 0, 22));
  }

  @Test
  public void zeroCountFillIsDiscarded() throws CompilerException {
    Compiler compiler = compile("let a: [bool; 0] = [..true];");

    assertThat(compiler.outFile()).isEqualTo(bytes(40, 1, 4, 10, 1, 6, 0));
  }

  @Test
  public void expansionDestructures() throws CompilerException {
    Compiler compiler = compile("let a = [..sub, 8];", "let sub: [int; 1] = [7];");

    assertThat(compiler.outFile())
        .isEqualTo(
            bytes(
                // sub
                40, 1, 1, 0, 11, 0, 0, 0, 7, 6, 1, 5, 0,
                // a
                40, 2,
                2, 0, 1, 1, 1, // BIND_DESTRUCTURE %0, 1 element, sub
                1, 1, 11, 0, 0, 0, 8, // BIND %1 = 8
                6, 2, 5, 0, 5, 1));
    assertThat(compiler.indexFile())
        .isEqualTo(bytes(2, 1, 3, 's', 'u', 'b', 0, 13, 2, 2, 1, 'a', 13, 20));
  }

  @Test
  public void singleExpansionCompilesOperand() throws CompilerException {
    Compiler compiler = compile("extern fn pair(): [int; 2];", "let a = [..pair()];");

    assertThat(compiler.outFile()).isEqualTo(bytes(2, 1));
    assertThat(compiler.indexFile())
        .isEqualTo(bytes(1, 1, 4, 'p', 'a', 'i', 'r', 2, 1, 1, 'a', 0, 2));
  }

  @Test
  public void ranges() throws CompilerException {
    Compiler compiler = compile("let r = [(1..), (..)];");

    assertThat(compiler.outFile())
        .isEqualTo(
            bytes(
                40, 2,
                1, 0, 13, 1, 11, 0, 0, 0, 1, // BIND %0 = 1..
                1, 1, 13, 0, // BIND %1 = ..
                6, 2, 5, 0, 5, 1));
  }

  @Test
  public void requiresValidation() {
    ASTValidator validator = new ASTValidator(new AST("/test/file.al", ImmutableList.of()));
    assertThrows(IllegalArgumentException.class, () -> new Compiler(validator));
  }
}
