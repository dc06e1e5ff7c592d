package works.typedmap.types;

import static java.util.Objects.requireNonNull;

/**
 * Conforms if the value is an instance of {@link #instanceClass}.
 * This is how one declared container type is nested inside another's field type.
 * <p>
 * When coercing, a mapping can be turned into an instance of this class
 * by the {@link Coercer}'s {@link InstanceBuilder}.
 */
public record InstanceType(Class<?> instanceClass) implements ValueType {
	public InstanceType {
		requireNonNull(instanceClass);
		if (instanceClass.isPrimitive()) {
			throw new IllegalArgumentException("Use a PrimitiveType for " + instanceClass);
		}
	}

	@Override
	public boolean acceptsNone() {
		return false;
	}

	@Override
	public String toString() {
		String simpleName = instanceClass.getSimpleName();
		if (simpleName.isEmpty()) {
			// Anonymous classes
			simpleName = instanceClass.getName();
			simpleName = simpleName.substring(simpleName.lastIndexOf('.') + 1);
		}
		return simpleName;
	}
}
