package works.typedmap.types;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typedmap.types.exceptions.CoercionException;

import static works.typedmap.types.Mismatch.describe;

/**
 * Converts values into a form that conforms to a {@link ValueType},
 * along a fixed set of unambiguous conversion paths.
 * <p>
 * Values that already conform are returned unchanged,
 * and anything this class returns conforms,
 * so coercing an already-coerced value is a no-op.
 * <p>
 * Containers are rebuilt element by element into fresh
 * {@link ArrayList}, {@link LinkedHashSet} and {@link LinkedHashMap} objects.
 * If any element fails, the whole coercion fails.
 */
public final class Coercer {
	private final TypeMatcher matcher;
	private final InstanceBuilder instanceBuilder;

	public Coercer(TypeMatcher matcher, InstanceBuilder instanceBuilder) {
		this.matcher = matcher;
		this.instanceBuilder = instanceBuilder;
	}

	/**
	 * A coercer using the {@link TypeMatcher#standard() standard} matcher
	 * that can't build {@link InstanceType}s.
	 */
	public static Coercer standard() {
		return STANDARD;
	}

	public Coercer withInstanceBuilder(InstanceBuilder instanceBuilder) {
		return new Coercer(matcher, instanceBuilder);
	}

	public Coercer withMatcher(TypeMatcher matcher) {
		return new Coercer(matcher, instanceBuilder);
	}

	public TypeMatcher matcher() {
		return matcher;
	}

	/**
	 * @return a value conforming to {@code type}; {@code value} itself if it already conforms
	 * @throws CoercionException if there is no conversion path
	 */
	public Object coerce(@Nullable Object value, ValueType type) {
		if (matcher.matches(value, type)) {
			return value;
		}
		LOGGER.trace("Coercing {} to {}", describe(value), type);
		if (type instanceof UnionType union) {
			return coerceUnion(value, union);
		} else if (value == null) {
			throw new CoercionException(type, null, "null has no conversion");
		} else if (type instanceof PrimitiveType primitive) {
			return coercePrimitive(value, primitive);
		} else if (type instanceof ContainerType container) {
			return coerceContainer(value, container);
		} else if (type instanceof InstanceType instance) {
			return coerceInstance(value, instance);
		} else {
			// AnyType always matches; NoneType matches only null
			throw new CoercionException(type, value, "only null conforms");
		}
	}

	private Object coerceUnion(@Nullable Object value, UnionType union) {
		StringBuilder reasons = new StringBuilder();
		for (ValueType alternative : union.alternatives()) {
			try {
				return coerce(value, alternative);
			} catch (CoercionException e) {
				LOGGER.trace("Alternative {} rejected {}: {}", alternative, describe(value), e.reason());
				if (reasons.length() > 0) {
					reasons.append("; ");
				}
				reasons.append(alternative).append(": ").append(e.reason());
			}
		}
		throw new CoercionException(union, value, "no alternative applies (" + reasons + ")");
	}

	private Object coercePrimitive(Object value, PrimitiveType type) {
		return switch (type.kind()) {
			case BOOLEAN -> toBoolean(value, type);
			case INTEGER -> toInteger(value, type);
			case FLOAT -> toFloat(value, type);
			case STRING -> toText(value, type);
		};
	}

	private static Boolean toBoolean(Object value, ValueType type) {
		if (value instanceof String s) {
			String word = s.trim().toLowerCase(Locale.ROOT);
			if (TRUE_WORDS.contains(word)) {
				return true;
			} else if (FALSE_WORDS.contains(word)) {
				return false;
			}
			throw new CoercionException(type, value, "not a recognized boolean word");
		} else if (TypeMatcher.isIntegral(value)) {
			BigInteger n = new BigInteger(value.toString());
			if (BigInteger.ZERO.equals(n)) {
				return false;
			} else if (BigInteger.ONE.equals(n)) {
				return true;
			}
			throw new CoercionException(type, value, "only 0 and 1 convert to booleans");
		}
		throw new CoercionException(type, value, "no conversion to boolean");
	}

	private static Number toInteger(Object value, ValueType type) {
		if (value instanceof Boolean) {
			throw new CoercionException(type, value, "booleans are not integers");
		} else if (value instanceof String s) {
			String trimmed = s.trim();
			if (INTEGER_PATTERN.matcher(trimmed).matches()) {
				return narrow(new BigInteger(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed));
			}
			throw new CoercionException(type, value, "not an integer literal");
		} else if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (!Double.isFinite(d)) {
				throw new CoercionException(type, value, "not finite");
			}
			return integralPart(BigDecimal.valueOf(d), value, type);
		} else if (value instanceof BigDecimal bd) {
			return integralPart(bd, value, type);
		} else if (TypeMatcher.isIntegral(value)) {
			// Only reachable with booleansAsIntegers off and an unusual integral kind
			return narrow(new BigInteger(value.toString()));
		}
		throw new CoercionException(type, value, "no conversion to integer");
	}

	private static Number integralPart(BigDecimal decimal, Object value, ValueType type) {
		try {
			return narrow(decimal.toBigIntegerExact());
		} catch (ArithmeticException e) {
			throw new CoercionException(type, value, "has a fractional part", e);
		}
	}

	private static Number narrow(BigInteger n) {
		if (n.bitLength() < Integer.SIZE) {
			return n.intValue();
		} else if (n.bitLength() < Long.SIZE) {
			return n.longValue();
		} else {
			return n;
		}
	}

	private static Number toFloat(Object value, ValueType type) {
		if (value instanceof Boolean) {
			throw new CoercionException(type, value, "booleans are not numbers");
		} else if (value instanceof BigInteger bi) {
			return new BigDecimal(bi);
		} else if (value instanceof Number n) {
			return n.doubleValue();
		} else if (value instanceof String s) {
			String trimmed = s.trim();
			if (FLOAT_PATTERN.matcher(trimmed).matches()) {
				double result = Double.parseDouble(trimmed);
				if (Double.isFinite(result)) {
					return result;
				}
				throw new CoercionException(type, value, "out of range for a float");
			}
			throw new CoercionException(type, value, "not a finite numeric literal");
		}
		throw new CoercionException(type, value, "no conversion to float");
	}

	private static String toText(Object value, ValueType type) {
		if (value instanceof BigDecimal bd) {
			return bd.toPlainString();
		} else if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
			return value.toString();
		} else if (value instanceof Enum<?> e) {
			return e.name();
		}
		throw new CoercionException(type, value, "no conversion to string");
	}

	private Object coerceContainer(Object value, ContainerType type) {
		switch (type.kind()) {
			case SEQUENCE: {
				List<Object> result = new ArrayList<>();
				int index = 0;
				for (Object element : elementsOf(value, type)) {
					result.add(coerceElement(element, type.elementType(), value, type, "element [" + index + "]"));
					index++;
				}
				return result;
			}
			case SET: {
				Set<Object> result = new LinkedHashSet<>();
				int index = 0;
				for (Object element : elementsOf(value, type)) {
					result.add(coerceElement(element, type.elementType(), value, type, "element [" + index + "]"));
					index++;
				}
				return result;
			}
			case MAPPING: {
				Map<Object, Object> result = new LinkedHashMap<>();
				if (value instanceof Map<?, ?> map) {
					for (Map.Entry<?, ?> entry : map.entrySet()) {
						putEntry(result, entry.getKey(), entry.getValue(), value, type);
					}
				} else if (value instanceof Iterable<?> pairs) {
					int index = 0;
					for (Object pair : pairs) {
						if (pair instanceof Map.Entry<?, ?> entry) {
							putEntry(result, entry.getKey(), entry.getValue(), value, type);
						} else if (pair instanceof List<?> list && list.size() == 2) {
							putEntry(result, list.get(0), list.get(1), value, type);
						} else if (pair instanceof Object[] array && array.length == 2) {
							putEntry(result, array[0], array[1], value, type);
						} else {
							throw new CoercionException(type, value, "element [" + index + "] is not a key/value pair");
						}
						index++;
					}
				} else {
					throw new CoercionException(type, value, "not a mapping or a sequence of pairs");
				}
				return result;
			}
			default:
				throw new AssertionError("Unexpected container kind: " + type.kind());
		}
	}

	private static List<?> elementsOf(Object value, ContainerType type) {
		if (value instanceof Map) {
			throw new CoercionException(type, value, "mappings are not converted to " + type.kind().name().toLowerCase(Locale.ROOT) + "s");
		} else if (value instanceof Collection<?> collection) {
			return new ArrayList<>(collection);
		} else if (value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> result = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				result.add(Array.get(value, i));
			}
			return result;
		}
		throw new CoercionException(type, value, "not a collection or array");
	}

	private void putEntry(Map<Object, Object> result, Object key, Object value, Object container, ContainerType type) {
		Object newKey = coerceElement(key, type.keyType(), container, type, "key " + describe(key));
		Object newValue = coerceElement(value, type.elementType(), container, type, "value at " + describe(key));
		result.put(newKey, newValue);
	}

	private Object coerceElement(@Nullable Object element, ValueType elementType, Object container, ContainerType containerType, String where) {
		try {
			return coerce(element, elementType);
		} catch (CoercionException e) {
			throw new CoercionException(containerType, container, where + ": " + e.reason(), e);
		}
	}

	private Object coerceInstance(Object value, InstanceType type) {
		if (!(value instanceof Map<?, ?> fields)) {
			throw new CoercionException(type, value, "only a mapping can be built into " + type);
		}
		Object result;
		try {
			result = instanceBuilder.build(type.instanceClass(), fields);
		} catch (CoercionException e) {
			throw new CoercionException(type, value, e.reason(), e);
		} catch (RuntimeException e) {
			throw new CoercionException(type, value, String.valueOf(e.getMessage()), e);
		}
		if (!type.instanceClass().isInstance(result)) {
			throw new CoercionException(type, value, "builder returned " + describe(result));
		}
		return result;
	}

	private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
	private static final Pattern FLOAT_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
	private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on", "1");
	private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off", "0");
	private static final Coercer STANDARD = new Coercer(TypeMatcher.standard(), InstanceBuilder.unsupported());
	private static final Logger LOGGER = LoggerFactory.getLogger(Coercer.class);
}
