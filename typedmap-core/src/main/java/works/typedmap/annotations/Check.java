package works.typedmap.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares a one-argument instance method as a check on writes to a key.
 * The method receives the candidate value and returns the value to store,
 * or throws to reject the write.
 * A {@code void} method leaves the value unchanged.
 * <p>
 * Registered by {@link works.typedmap.Schema.Builder#scan}.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Check {
	/**
	 * The key being checked.
	 */
	String value();
}
