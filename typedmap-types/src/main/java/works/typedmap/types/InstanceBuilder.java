package works.typedmap.types;

import java.util.Map;

/**
 * Constructs an instance of a class from a mapping of its fields.
 * Used by the {@link Coercer} for {@link InstanceType} targets.
 */
@FunctionalInterface
public interface InstanceBuilder {
	/**
	 * @return an instance of {@code instanceClass}
	 * @throws IllegalArgumentException if {@code instanceClass} can't be built from a mapping,
	 * or if {@code fields} is not acceptable. Other runtime exceptions are also reported as coercion failures.
	 */
	Object build(Class<?> instanceClass, Map<?, ?> fields);

	static InstanceBuilder unsupported() {
		return (instanceClass, fields) -> {
			throw new IllegalArgumentException("No way to build " + instanceClass.getSimpleName() + " from a mapping");
		};
	}
}
