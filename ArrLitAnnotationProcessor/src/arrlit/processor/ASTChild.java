package arrlit.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an accessor of an {@link ASTNode} whose result is visited as a child, in declaration
 * order. The accessor must return a node, or an Iterable, Stream or Optional of nodes.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface ASTChild {}
