package works.typedmap.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.typedmap.exceptions.JsonShapeException;

/**
 * Decides whether a value lies within the subset of Java values that map directly onto JSON:
 * {@code null}, strings, booleans, finite numbers, lists of such values,
 * and maps from strings to such values.
 * A {@link Character} counts as a string, as it does for the STRING type.
 * <p>
 * Sets, arrays, non-finite floating-point numbers,
 * and objects of any other class are rejected.
 */
public final class JsonShape {
	private JsonShape() { }

	public static boolean isJsonCompatible(@Nullable Object value) {
		try {
			require(value, "$");
			return true;
		} catch (JsonShapeException e) {
			return false;
		}
	}

	/**
	 * @param path describes where {@code value} is, for the exception message
	 * @throws JsonShapeException at the first value that isn't JSON-compatible
	 */
	public static void require(@Nullable Object value, String path) {
		if (value == null || value instanceof String || value instanceof Character || value instanceof Boolean) {
			return;
		} else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
			|| value instanceof BigInteger || value instanceof BigDecimal) {
			return;
		} else if (value instanceof Double || value instanceof Float) {
			if (!Double.isFinite(((Number) value).doubleValue())) {
				throw new JsonShapeException(path, value, "not finite");
			}
		} else if (value instanceof List<?> list) {
			int index = 0;
			for (Object element : list) {
				require(element, path + "[" + index + "]");
				index++;
			}
		} else if (value instanceof Map<?, ?> map) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (!(entry.getKey() instanceof String key)) {
					throw new JsonShapeException(path, value, "key " + entry.getKey() + " is not a string");
				}
				require(entry.getValue(), path + "." + key);
			}
		} else {
			throw new JsonShapeException(path, value, "unsupported class " + value.getClass().getSimpleName());
		}
	}
}
