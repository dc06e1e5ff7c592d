package works.typedmap.types;

/**
 * Captures a generic Java type for {@link ValueType#of(TypeReference)}:
 * <pre>
 *     ValueType.of(new TypeReference&lt;Map&lt;String, List&lt;Integer&gt;&gt;&gt;() { })
 * </pre>
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	protected TypeReference() {
		if (!(getClass().getGenericSuperclass() instanceof java.lang.reflect.ParameterizedType)) {
			throw new IllegalStateException("TypeReference must be subclassed with an actual type argument");
		}
	}

	java.lang.reflect.Type reflectionType() {
		return ((java.lang.reflect.ParameterizedType) getClass()
			.getGenericSuperclass()).getActualTypeArguments()[0];
	}
}
