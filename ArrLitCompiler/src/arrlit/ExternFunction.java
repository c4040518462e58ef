package arrlit;

/** A host implementation of an {@code extern fn}, supplied to the {@link Evaluator}. */
@FunctionalInterface
public interface ExternFunction {
  // Must return a value of the declared return type.
  Object call() throws CompilerException;
}
