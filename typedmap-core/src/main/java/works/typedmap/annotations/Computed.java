package works.typedmap.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares a no-argument instance method as the producer of a computed member.
 * Registered by {@link works.typedmap.Schema.Builder#scan}.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Computed {
	/**
	 * The member's name. Defaults to the method name.
	 */
	String value() default "";

	boolean cache() default true;

	/**
	 * Names of the fields and computed members the producer reads.
	 * Writes to any of these invalidate the cached value.
	 */
	String[] deps() default {};
}
