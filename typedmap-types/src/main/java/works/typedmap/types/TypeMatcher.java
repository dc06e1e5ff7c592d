package works.typedmap.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.typedmap.types.exceptions.TypeMismatchException;

import static java.util.stream.Collectors.joining;
import static works.typedmap.types.exceptions.TypeMismatchException.Site.VALUE;

/**
 * Decides whether a runtime value conforms to a {@link ValueType}
 * by structural recursion over the expression.
 * <p>
 * Empty containers conform to any container expression of the right kind,
 * and {@code null} conforms only to expressions that {@link ValueType#acceptsNone accept none}.
 * <p>
 * Instances are immutable and can be shared freely.
 */
public final class TypeMatcher {
	private final Settings settings;

	public TypeMatcher(Settings settings) {
		this.settings = settings;
	}

	public static TypeMatcher standard() {
		return STANDARD;
	}

	/**
	 * @param booleansAsIntegers if true, {@link Boolean} values conform to {@link PrimitiveType.Kind#INTEGER}.
	 *                           Some ecosystems treat booleans as a numeric subtype;
	 *                           by default we don't.
	 * @param integersAsFloats if true, integral values conform to {@link PrimitiveType.Kind#FLOAT}.
	 */
	public record Settings(
		boolean booleansAsIntegers,
		boolean integersAsFloats
	) {
		public static final Settings DEFAULT = new Settings(false, true);

		public Settings withBooleansAsIntegers(boolean booleansAsIntegers) {
			return new Settings(booleansAsIntegers, integersAsFloats);
		}

		public Settings withIntegersAsFloats(boolean integersAsFloats) {
			return new Settings(booleansAsIntegers, integersAsFloats);
		}
	}

	public Settings settings() {
		return settings;
	}

	public boolean matches(@Nullable Object value, ValueType type) {
		return check(value, type).isEmpty();
	}

	/**
	 * @return empty if {@code value} conforms to {@code type};
	 * otherwise, a description of the first failure found.
	 */
	public Optional<Mismatch> check(@Nullable Object value, ValueType type) {
		return check(value, type, Mismatch.ROOT);
	}

	/**
	 * @return {@code value}, unchanged
	 * @throws TypeMismatchException if {@code value} doesn't conform to {@code type}
	 */
	public <T> T require(T value, ValueType type) {
		Optional<Mismatch> mismatch = check(value, type);
		if (mismatch.isPresent()) {
			throw new TypeMismatchException(VALUE, null, type, value, mismatch.get());
		}
		return value;
	}

	private Optional<Mismatch> check(@Nullable Object value, ValueType type, String path) {
		if (type instanceof AnyType) {
			return Optional.empty();
		} else if (type instanceof NoneType) {
			return value == null
				? Optional.empty()
				: mismatch(type, value, path, "only null conforms");
		} else if (type instanceof UnionType union) {
			return checkUnion(value, union, path);
		} else if (value == null) {
			return mismatch(type, null, path, "");
		} else if (type instanceof PrimitiveType primitive) {
			return hasKind(value, primitive.kind())
				? Optional.empty()
				: mismatch(type, value, path, "");
		} else if (type instanceof InstanceType instance) {
			return instance.instanceClass().isInstance(value)
				? Optional.empty()
				: mismatch(type, value, path, "");
		} else if (type instanceof ContainerType container) {
			return checkContainer(value, container, path);
		}
		throw new AssertionError("Unexpected type expression: " + type);
	}

	private Optional<Mismatch> checkUnion(@Nullable Object value, UnionType union, String path) {
		for (ValueType alternative : union.alternatives()) {
			if (check(value, alternative, path).isEmpty()) {
				return Optional.empty();
			}
		}
		return mismatch(union, value, path, "conforms to none of "
			+ union.alternatives().stream().map(ValueType::toString).collect(joining(", ")));
	}

	private Optional<Mismatch> checkContainer(Object value, ContainerType type, String path) {
		switch (type.kind()) {
			case SEQUENCE: {
				if (!(value instanceof List<?> list)) {
					return mismatch(type, value, path, "not a sequence");
				}
				int index = 0;
				for (Object element : list) {
					Optional<Mismatch> result = check(element, type.elementType(), path + "[" + index + "]");
					if (result.isPresent()) {
						return result;
					}
					index++;
				}
				return Optional.empty();
			}
			case SET: {
				if (!(value instanceof Set<?> set)) {
					return mismatch(type, value, path, "not a set");
				}
				for (Object element : set) {
					Optional<Mismatch> result = check(element, type.elementType(), path + "{" + element + "}");
					if (result.isPresent()) {
						return result;
					}
				}
				return Optional.empty();
			}
			case MAPPING: {
				if (!(value instanceof Map<?, ?> map)) {
					return mismatch(type, value, path, "not a mapping");
				}
				for (Map.Entry<?, ?> entry : map.entrySet()) {
					Optional<Mismatch> keyResult = check(entry.getKey(), type.keyType(), path + "{" + entry.getKey() + "}");
					if (keyResult.isPresent()) {
						return keyResult;
					}
					Optional<Mismatch> valueResult = check(entry.getValue(), type.elementType(), memberPath(path, entry.getKey()));
					if (valueResult.isPresent()) {
						return valueResult;
					}
				}
				return Optional.empty();
			}
			default:
				throw new AssertionError("Unexpected container kind: " + type.kind());
		}
	}

	boolean hasKind(Object value, PrimitiveType.Kind kind) {
		return switch (kind) {
			case BOOLEAN -> value instanceof Boolean;
			case INTEGER -> isIntegral(value) || (settings.booleansAsIntegers() && value instanceof Boolean);
			case FLOAT -> isFloating(value) || (settings.integersAsFloats() && isIntegral(value));
			case STRING -> value instanceof String || value instanceof Character;
		};
	}

	static boolean isIntegral(Object value) {
		return value instanceof Integer
			|| value instanceof Long
			|| value instanceof Short
			|| value instanceof Byte
			|| value instanceof BigInteger;
	}

	static boolean isFloating(Object value) {
		return value instanceof Double
			|| value instanceof Float
			|| value instanceof BigDecimal;
	}

	static String memberPath(String path, Object key) {
		if (key instanceof String s && !s.isEmpty() && s.chars().allMatch(Character::isJavaIdentifierPart)) {
			return path + "." + s;
		} else {
			return path + "[" + Mismatch.describe(key) + "]";
		}
	}

	private static Optional<Mismatch> mismatch(ValueType expected, @Nullable Object actual, String path, String reason) {
		return Optional.of(new Mismatch(expected, actual, path, reason));
	}

	private static final TypeMatcher STANDARD = new TypeMatcher(Settings.DEFAULT);
}
