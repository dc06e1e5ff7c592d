package works.typedmap.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * On a method of an interface passed to {@link works.typedmap.TypedMap#as},
 * overrides the key that the method reads or writes.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Attribute {
	String value();
}
