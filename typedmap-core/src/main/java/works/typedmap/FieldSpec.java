package works.typedmap;

import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.typedmap.exceptions.InvalidDeclarationException;
import works.typedmap.types.ValueType;

import static java.util.Objects.requireNonNull;

/**
 * A declared field.
 * A field has at most one of a default value and a default factory;
 * if it has neither, it is {@link #isRequired() required}.
 *
 * @param factory called once per instance, so mutable defaults aren't shared
 */
public record FieldSpec(
	String name,
	ValueType type,
	boolean hasDefault,
	@Nullable Object defaultValue,
	@Nullable Supplier<?> factory
) {
	public FieldSpec {
		requireNonNull(name);
		requireNonNull(type);
		if (hasDefault && factory != null) {
			throw new InvalidDeclarationException("Field \"" + name + "\" cannot have both a default value and a default factory");
		}
		if (!hasDefault && defaultValue != null) {
			throw new IllegalArgumentException("Field \"" + name + "\" has a default value but hasDefault is false");
		}
	}

	public static FieldSpec required(String name, ValueType type) {
		return new FieldSpec(name, type, false, null, null);
	}

	public static FieldSpec withDefault(String name, ValueType type, @Nullable Object defaultValue) {
		return new FieldSpec(name, type, true, defaultValue, null);
	}

	public static FieldSpec withFactory(String name, ValueType type, Supplier<?> factory) {
		return new FieldSpec(name, type, false, null, requireNonNull(factory));
	}

	public boolean isRequired() {
		return !hasDefault && factory == null;
	}

	/**
	 * @return the value a new instance gets when none is supplied
	 * @throws IllegalStateException if the field is required
	 */
	public @Nullable Object initialValue() {
		if (factory != null) {
			return factory.get();
		} else if (hasDefault) {
			return defaultValue;
		} else {
			throw new IllegalStateException("Field \"" + name + "\" is required");
		}
	}
}
