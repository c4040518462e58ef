package arrlit.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a node of the syntax tree. The class must implement the generated
 * {@code Outer_Inner_ASTNode} interface, and gets a {@code visit} overload on every generated
 * visitor.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
