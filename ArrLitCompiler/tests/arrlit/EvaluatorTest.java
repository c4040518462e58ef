package arrlit;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;

public class EvaluatorTest {

  private final Map<String, ExternFunction> externs = new HashMap<>();
  private final Multiset<String> calls = HashMultiset.create();

  private void extern(String name, Object value) {
    externs.put(
        name,
        () -> {
          calls.add(name);
          return value;
        });
  }

  private ImmutableMap<String, Object> evaluate(String... lines) throws CompilerException {
    ASTValidator validator =
        new ASTValidator(DeclarationParser.parse("/test/file.al", String.join("\n", lines)));
    ImmutableList<CompilerException> errors = validator.computeErrors();
    if (!errors.isEmpty()) throw errors.get(0);

    return new Evaluator(validator, externs).evaluate();
  }

  private void assertEvaluationError(String errorSubstr, String... lines) {
    CompilerException ex = assertThrows(CompilerException.class, () -> evaluate(lines));
    assertThat(ex.kind()).isEqualTo(ErrorKind.EVALUATION);
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void plainItems() throws CompilerException {
    ImmutableMap<String, Object> values =
        evaluate("let a = [1, 2 * 3, -4];", "let b = [\"x\", \"y\"];", "let c = [[1], [2 - 5]];");

    assertThat(values.get("a")).isEqualTo(ImmutableList.of(1, 6, -4));
    assertThat(values.get("b")).isEqualTo(ImmutableList.of("x", "y"));
    assertThat(values.get("c"))
        .isEqualTo(ImmutableList.of(ImmutableList.of(1), ImmutableList.of(-3)));
  }

  @Test
  public void fillEvaluatesOperandOnce() throws CompilerException {
    extern("next", 7);
    ImmutableMap<String, Object> values =
        evaluate("extern fn next(): int;", "let a: [int; 6] = [1, 2, 3, ..next()];");

    assertThat(values.get("a")).isEqualTo(ImmutableList.of(1, 2, 3, 7, 7, 7));
    assertThat(calls.count("next")).isEqualTo(1);
  }

  @Test
  public void zeroCountFillStillEvaluates() throws CompilerException {
    extern("tick", true);
    ImmutableMap<String, Object> values =
        evaluate(
            "extern fn tick(): bool;",
            "let a: [bool; 0] = [..tick()];",
            "let b: [bool; 1] = [false, ..tick()];");

    assertThat(values.get("a")).isEqualTo(ImmutableList.of());
    assertThat(values.get("b")).isEqualTo(ImmutableList.of(false));
    assertThat(calls.count("tick")).isEqualTo(2);
  }

  @Test
  public void fillWithContext() throws CompilerException {
    ImmutableMap<String, Object> values =
        evaluate(
            "let a: [bool; 3] = [..true];",
            "let s: [string; 1] = [..\"s\"];",
            "let d = 5;",
            "let e: [int; 4] = [1, ..d];");

    assertThat(values.get("a")).isEqualTo(ImmutableList.of(true, true, true));
    assertThat(values.get("s")).isEqualTo(ImmutableList.of("s"));
    assertThat(values.get("e")).isEqualTo(ImmutableList.of(1, 5, 5, 5));
  }

  @Test
  public void expansionEvaluatesOperandOnce() throws CompilerException {
    extern("pair", ImmutableList.of(2, 3));
    ImmutableMap<String, Object> values =
        evaluate("extern fn pair(): [int; 2];", "let a = [1, ..pair(), 4];");

    assertThat(values.get("a")).isEqualTo(ImmutableList.of(1, 2, 3, 4));
    assertThat(calls.count("pair")).isEqualTo(1);
  }

  @Test
  public void zeroLengthExpansionStillEvaluates() throws CompilerException {
    extern("none", ImmutableList.of());
    ImmutableMap<String, Object> values =
        evaluate("extern fn none(): [int; 0];", "let a = [1, ..none(), 2, ..none()];");

    assertThat(values.get("a")).isEqualTo(ImmutableList.of(1, 2));
    assertThat(calls.count("none")).isEqualTo(2);
  }

  @Test
  public void singleExpansionIsItsOperand() throws CompilerException {
    ImmutableList<String> names = ImmutableList.of("p", "q");
    extern("names", names);
    ImmutableMap<String, Object> values =
        evaluate("extern fn names(): [string; 2];", "let a = [..names()];");

    assertThat(values.get("a")).isSameInstanceAs(names);
    assertThat(calls.count("names")).isEqualTo(1);
  }

  @Test
  public void definitionsEvaluateDependenciesFirst() throws CompilerException {
    ImmutableMap<String, Object> values =
        evaluate("let a = [0, ..b];", "let b = [1, 2, 3];", "let c: [int; 5] = [..a, ..9];");

    assertThat(values.keySet()).containsExactly("b", "a", "c").inOrder();
    assertThat(values.get("a")).isEqualTo(ImmutableList.of(0, 1, 2, 3));
    assertThat(values.get("c")).isEqualTo(ImmutableList.of(0, 1, 2, 3, 9));
  }

  @Test
  public void nestedLiterals() throws CompilerException {
    ImmutableMap<String, Object> values =
        evaluate(
            "let a: [int; 4] = [1, ..[..0]];",
            "let b: [[int; 2]; 3] = [[1, 2], ..[..0]];",
            "let c: [[bool; 2]; 2] = [..[true, false]];");

    assertThat(values.get("a")).isEqualTo(ImmutableList.of(1, 0, 0, 0));
    assertThat(values.get("b"))
        .isEqualTo(
            ImmutableList.of(
                ImmutableList.of(1, 2), ImmutableList.of(0, 0), ImmutableList.of(0, 0)));
    assertThat(values.get("c"))
        .isEqualTo(ImmutableList.of(ImmutableList.of(true, false), ImmutableList.of(true, false)));
  }

  @Test
  public void ranges() throws CompilerException {
    ImmutableMap<String, Object> values = evaluate("let r = [1..3, (..2), (4..)];");

    assertThat(values.get("r"))
        .isEqualTo(
            ImmutableList.of(
                RangeValue.create(Optional.of(1), Optional.of(3)),
                RangeValue.create(Optional.empty(), Optional.of(2)),
                RangeValue.create(Optional.of(4), Optional.empty())));
  }

  @Test
  public void overflow() {
    assertEvaluationError(
        "integer overflow evaluating '2147483647 + 1'", "let a = [2147483647 + 1];");
    assertEvaluationError(
        "integer overflow evaluating '-2147483647 - 2'", "let a = [-2147483647 - 2];");
  }

  @Test
  public void externErrors() {
    assertEvaluationError(
        "no implementation was provided for extern fn 'next'",
        "extern fn next(): int;",
        "let a = [next()];");

    extern("next", "x");
    assertEvaluationError(
        "extern fn 'next' returned 'x', expected int",
        "extern fn next(): int;",
        "let a = [next()];");

    extern("pair", ImmutableList.of(1));
    assertEvaluationError(
        "extern fn 'pair' returned '[1]', expected [int; 2]",
        "extern fn pair(): [int; 2];",
        "let a = [0, ..pair()];");
  }
}
