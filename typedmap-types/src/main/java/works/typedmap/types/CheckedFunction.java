package works.typedmap.types;

import java.util.Map;

/**
 * A function body bound to a {@link Contract}.
 * Every call checks its arguments before the body runs,
 * and checks the result before returning it.
 *
 * @see Contract#bind
 */
public interface CheckedFunction<R> {
	Contract contract();

	/**
	 * @param arguments one per parameter, in declaration order
	 * @throws IllegalArgumentException if the argument count is wrong
	 * @throws works.typedmap.types.exceptions.TypeMismatchException if an argument or the result doesn't conform
	 */
	R call(Object... arguments);

	/**
	 * @param arguments keyed by parameter name; every parameter must be present
	 * @throws IllegalArgumentException if a parameter is missing or an unknown name is given
	 * @throws works.typedmap.types.exceptions.TypeMismatchException if an argument or the result doesn't conform
	 */
	R callNamed(Map<String, ?> arguments);
}
