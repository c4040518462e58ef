package arrlit;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

import arrlit.Expression.ArrayLiteral;

public class DesugarerTest {

  private static final Correspondence<BindingStep, BindingStep.Kind> HAS_KIND =
      Correspondence.transforming(BindingStep::kind, "has kind");

  private static ASTValidator validate(String... lines) throws CompilerException {
    ASTValidator validator =
        new ASTValidator(DeclarationParser.parse("/test/file.al", String.join("\n", lines)));
    ImmutableList<CompilerException> errors = validator.computeErrors();
    if (!errors.isEmpty()) throw errors.get(0);
    return validator;
  }

  private static ArrayLiteral literal(ASTValidator validator, String name) {
    return validator.registry().definition(name).get().initializer().cast();
  }

  private static BindingPlan plan(ASTValidator validator, ArrayLiteral literal) {
    return validator.desugarer().plan(literal).get();
  }

  private static BindingPlan plan(ASTValidator validator, String name) {
    return plan(validator, literal(validator, name));
  }

  @Test
  public void plainItemsBindOneNameEach() throws CompilerException {
    BindingPlan plan = plan(validate("let a = [1, 2 + 3, 4];"), "a");

    assertThat(plan.toString())
        .isEqualTo("let %t0 = 1; let %t1 = 2 + 3; let %t2 = 4; [%t0, %t1, %t2]");
    assertThat(plan.steps()).comparingElementsUsing(HAS_KIND).containsExactly(
        BindingStep.Kind.SINGLE, BindingStep.Kind.SINGLE, BindingStep.Kind.SINGLE);
    assertThat(plan.passthrough()).isFalse();
  }

  @Test
  public void fillBindsOnceAndRepeats() throws CompilerException {
    BindingPlan plan = plan(validate("let d = 5;", "let a: [int; 6] = [1, 2, 3, ..d];"), "a");

    assertThat(plan.toString())
        .isEqualTo(
            "let %t0 = 1; let %t1 = 2; let %t2 = 3; let %t3 = d x3;"
                + " [%t0, %t1, %t2, %t3, %t3, %t3]");

    BindingStep fill = plan.steps().get(3);
    assertThat(fill.kind()).isEqualTo(BindingStep.Kind.REPEAT);
    assertThat(fill.count()).isEqualTo(3);
    assertThat(fill.mode()).isEqualTo(BindingStep.Mode.COPY);
    assertThat(plan.arrayType()).isEqualTo(ValueType.arrayOf(ValueType.integerType(), 6));
  }

  @Test
  public void zeroCountFillKeepsItsStep() throws CompilerException {
    BindingPlan plan = plan(validate("let a: [bool; 0] = [..true];"), "a");

    assertThat(plan.toString()).isEqualTo("let %t0 = true x0; []");
    assertThat(plan.steps()).hasSize(1);
    assertThat(plan.steps().get(0).count()).isEqualTo(0);
    assertThat(plan.slots()).isEmpty();
  }

  @Test
  public void expansionDestructuresWholeOperand() throws CompilerException {
    ASTValidator validator =
        validate(
            "let x = 1;",
            "let y = 4;",
            "let sub: [int; 2] = [2, 3];",
            "let a = [x, ..sub, y];");
    BindingPlan plan = plan(validator, "a");

    assertThat(plan.toString())
        .isEqualTo("let %t0 = x; let [%t1, %t2] = sub; let %t3 = y; [%t0, %t1, %t2, %t3]");
    assertThat(plan.steps()).comparingElementsUsing(HAS_KIND).containsExactly(
        BindingStep.Kind.SINGLE, BindingStep.Kind.DESTRUCTURE, BindingStep.Kind.SINGLE)
        .inOrder();
    assertThat(plan.steps().get(1).count()).isEqualTo(2);
  }

  @Test
  public void zeroLengthExpansionKeepsItsStep() throws CompilerException {
    BindingPlan plan = plan(validate("let e: [int; 0] = [];", "let f = [..e, 7];"), "f");

    assertThat(plan.toString()).isEqualTo("let [] = e; let %t0 = 7; [%t0]");
    assertThat(plan.steps().get(0).slots()).isEmpty();
  }

  @Test
  public void moveOrCopyFollowsDuplicability() throws CompilerException {
    ASTValidator validator =
        validate(
            "let s: [string; 2] = [\"a\", \"b\"];",
            "let t = [\"z\", ..s];",
            "let u: [string; 2] = [\"y\", ..\"z\"];");

    assertThat(plan(validator, "t").steps().get(1).mode()).isEqualTo(BindingStep.Mode.MOVE);

    BindingStep fill = plan(validator, "u").steps().get(1);
    assertThat(fill.count()).isEqualTo(1);
    assertThat(fill.mode()).isEqualTo(BindingStep.Mode.MOVE);
  }

  @Test
  public void singleExpansionPassesThrough() throws CompilerException {
    BindingPlan plan = plan(validate("let sub = [1, 2];", "let a = [..sub];"), "a");

    assertThat(plan.passthrough()).isTrue();
    assertThat(plan.toString()).isEqualTo("let %t0 = sub; %t0");
    assertThat(plan.slots()).isEmpty();
    assertThat(plan.arrayType()).isEqualTo(ValueType.arrayOf(ValueType.integerType(), 2));

    // A single fill is not an expansion.
    assertThat(plan(validate("let b: [int; 1] = [..0];"), "b").passthrough()).isFalse();
  }

  @Test
  public void nestedLiteralsGetTheirOwnPlans() throws CompilerException {
    ASTValidator validator = validate("let a: [int; 4] = [1, ..[..0]];", "let b = [[2], [3]];");
    ArrayLiteral outer = literal(validator, "a");
    ArrayLiteral inner = outer.items().get(1).operand().cast();

    assertThat(plan(validator, outer).toString())
        .isEqualTo("let %t0 = 1; let [%t1, %t2, %t3] = [..0]; [%t0, %t1, %t2, %t3]");
    assertThat(plan(validator, inner).toString()).isEqualTo("let %t4 = 0 x3; [%t4, %t4, %t4]");

    // Names restart for each definition.
    assertThat(plan(validator, "b").toString())
        .isEqualTo("let %t0 = [2]; let %t1 = [3]; [%t0, %t1]");
  }
}
