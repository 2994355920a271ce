package works.tagtree.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a field, accessor method, or record component as a participant in tag mapping.
 * Members without this annotation are neither written to nor read from tags.
 * <p>
 * An accessor method must take no parameters.
 * If its name follows the bean convention ({@code getFoo} or {@code isFoo}),
 * the member is named {@code foo}; otherwise it is named after the method.
 * A matching {@code setFoo} method makes the member replaceable;
 * without one, the member's current value is populated in place.
 */
@Retention(RUNTIME)
@Target({ FIELD, METHOD, RECORD_COMPONENT })
public @interface TagProperty {
	/**
	 * The name of the member's tag within its enclosing compound.
	 * Empty means the member's own name.
	 */
	String value() default "";

	/**
	 * If true, a scalar member whose value equals the default for its kind
	 * ({@code 0}, {@code '\0'}, or {@code false}) produces no tag.
	 */
	boolean hideDefault() default false;
}
