package works.typedmap.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Arrays.asList;
import static works.typedmap.types.ContainerType.Kind.MAPPING;
import static works.typedmap.types.ContainerType.Kind.SEQUENCE;
import static works.typedmap.types.ContainerType.Kind.SET;

/**
 * An immutable description of the shapes a runtime value is allowed to take.
 * Equality is structural: two expressions built separately
 * that describe the same shape are {@link Object#equals equal}.
 */
public sealed interface ValueType permits AnyType, ContainerType, InstanceType, NoneType, PrimitiveType, UnionType {
	PrimitiveType BOOLEAN = new PrimitiveType(PrimitiveType.Kind.BOOLEAN);
	PrimitiveType INTEGER = new PrimitiveType(PrimitiveType.Kind.INTEGER);
	PrimitiveType FLOAT = new PrimitiveType(PrimitiveType.Kind.FLOAT);
	PrimitiveType STRING = new PrimitiveType(PrimitiveType.Kind.STRING);
	NoneType NONE = new NoneType();
	AnyType ANY = new AnyType();

	static ContainerType sequence(ValueType elementType) {
		return new ContainerType(SEQUENCE, elementType, ANY);
	}

	static ContainerType set(ValueType elementType) {
		return new ContainerType(SET, elementType, ANY);
	}

	static ContainerType mapping(ValueType keyType, ValueType valueType) {
		return new ContainerType(MAPPING, valueType, keyType);
	}

	static InstanceType instanceOf(Class<?> instanceClass) {
		return new InstanceType(instanceClass);
	}

	/**
	 * @return a {@link UnionType} of the given alternatives, or the lone alternative
	 * if only one remains after flattening and de-duplication.
	 */
	static ValueType union(ValueType... alternatives) {
		return union(asList(alternatives));
	}

	static ValueType union(List<? extends ValueType> alternatives) {
		UnionType result = new UnionType(List.copyOf(alternatives));
		if (result.alternatives().size() == 1) {
			return result.alternatives().get(0);
		} else {
			return result;
		}
	}

	/**
	 * Sugar for {@code union(inner, NONE)}.
	 */
	static ValueType optional(ValueType inner) {
		return union(inner, NONE);
	}

	/**
	 * Derives an expression from a Java type.
	 * Generic collection types become {@link ContainerType}s,
	 * {@link Optional} becomes an {@link #optional optional} type,
	 * type variables and wildcards become {@link #ANY} (or their upper bound when they have one),
	 * and other classes become {@link InstanceType}s.
	 */
	static ValueType of(Type type) {
		if (type instanceof Class<?> clazz) {
			return ofClass(clazz);
		} else if (type instanceof ParameterizedType pt) {
			Class<?> rawClass = (Class<?>) pt.getRawType();
			Type[] args = pt.getActualTypeArguments();
			if (Optional.class.equals(rawClass)) {
				return optional(of(args[0]));
			} else if (Map.class.isAssignableFrom(rawClass) && args.length == 2) {
				return mapping(of(args[0]), of(args[1]));
			} else if (Set.class.isAssignableFrom(rawClass) && args.length == 1) {
				return set(of(args[0]));
			} else if (Collection.class.isAssignableFrom(rawClass) && args.length == 1) {
				return sequence(of(args[0]));
			} else {
				return ofClass(rawClass);
			}
		} else if (type instanceof java.lang.reflect.WildcardType w) {
			if (w.getLowerBounds().length == 0 && w.getUpperBounds().length == 1) {
				return of(w.getUpperBounds()[0]);
			} else {
				return ANY;
			}
		} else if (type instanceof java.lang.reflect.TypeVariable<?>) {
			// Bounds can be self-referential, as in T extends Comparable<T>, so we don't follow them
			return ANY;
		} else if (type instanceof GenericArrayType) {
			return new InstanceType(Object[].class);
		}
		throw new IllegalArgumentException("Unsupported type: " + type);
	}

	static ValueType of(TypeReference<?> ref) {
		return of(ref.reflectionType());
	}

	private static ValueType ofClass(Class<?> clazz) {
		if (clazz == boolean.class || clazz == Boolean.class) {
			return BOOLEAN;
		} else if (clazz == byte.class || clazz == short.class || clazz == int.class || clazz == long.class
			|| clazz == Byte.class || clazz == Short.class || clazz == Integer.class || clazz == Long.class
			|| clazz == BigInteger.class) {
			return INTEGER;
		} else if (clazz == float.class || clazz == double.class
			|| clazz == Float.class || clazz == Double.class || clazz == BigDecimal.class) {
			return FLOAT;
		} else if (clazz == Number.class) {
			return union(INTEGER, FLOAT);
		} else if (clazz == char.class || clazz == Character.class || clazz == String.class) {
			return STRING;
		} else if (clazz == void.class || clazz == Void.class) {
			return NONE;
		} else if (clazz == Object.class) {
			return ANY;
		} else if (clazz == Optional.class) {
			return optional(ANY);
		} else if (Map.class.isAssignableFrom(clazz)) {
			return clazz == Map.class ? mapping(ANY, ANY) : new InstanceType(clazz);
		} else if (clazz == Set.class) {
			return set(ANY);
		} else if (clazz == List.class || clazz == Collection.class) {
			return sequence(ANY);
		} else {
			return new InstanceType(clazz);
		}
	}

	/**
	 * @return true if {@code null} conforms to this expression.
	 */
	boolean acceptsNone();
}
